package com.crux.enclave.envelope;

/**
 * Serializes envelopes for storage and for pushing to peers. Implementations must round-trip exactly.
 */
public interface EncryptedPayloadCodec {

  /**
   * Encodes the envelope.
   *
   * @param payload The envelope to encode.
   * @return The encoded bytes.
   */
  byte[] encode(EncryptedPayload payload);

  /**
   * Decodes an envelope.
   *
   * @param encoded The encoded bytes.
   * @return The decoded envelope.
   * @throws com.crux.enclave.exceptions.EnclaveException if the bytes are not a well formed envelope.
   */
  EncryptedPayload decode(byte[] encoded);
}
