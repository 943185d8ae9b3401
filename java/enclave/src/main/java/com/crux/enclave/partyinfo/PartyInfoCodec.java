package com.crux.enclave.partyinfo;

/**
 * Serializes the directory snapshots that nodes gossip to each other.
 */
public interface PartyInfoCodec {

  byte[] encode(PartyInfo partyInfo);

  /**
   * Decodes a directory snapshot. Entries that cannot be read are dropped rather than failing the whole snapshot.
   *
   * @param encoded The encoded bytes.
   * @return The decoded snapshot.
   * @throws com.crux.enclave.exceptions.EnclaveException if the bytes are not a directory document at all.
   */
  PartyInfo decode(byte[] encoded);
}
