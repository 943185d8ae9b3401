package com.crux.enclave.envelope;

import java.util.List;

import org.json.JSONException;

import com.crux.enclave.exceptions.EnclaveException;
import com.crux.enclave.utils.Json;

/**
 * Encodes an {@link EncryptedPayload} as a UTF-8 json document with Base64 binary fields:
 * <pre>
 * {
 *   "Sender": "...",
 *   "CipherText": "...",
 *   "Nonce": "...",
 *   "RecipientNonce": "...",
 *   "RecipientBoxes": ["...", ...]
 * }
 * </pre>
 */
public class JsonEncryptedPayloadCodec implements EncryptedPayloadCodec {
  static final String SENDER = "Sender";
  static final String CIPHER_TEXT = "CipherText";
  static final String NONCE = "Nonce";
  static final String RECIPIENT_NONCE = "RecipientNonce";
  static final String RECIPIENT_BOXES = "RecipientBoxes";

  private static final int KEY_SIZE = 32;
  private static final int NONCE_SIZE = 24;

  @Override
  public byte[] encode(final EncryptedPayload payload) {
    Json json = new Json();
    json.put(SENDER, payload.getSender());
    json.put(CIPHER_TEXT, payload.getCipherText());
    json.put(NONCE, payload.getNonce());
    json.put(RECIPIENT_NONCE, payload.getRecipientNonce());
    json.putBytesList(RECIPIENT_BOXES, payload.getRecipientBoxes());
    return json.toUtf8();
  }

  @Override
  public EncryptedPayload decode(final byte[] encoded) {
    if (encoded == null) {
      throw new EnclaveException("encrypted payload is missing");
    }

    try {
      Json json = new Json(encoded);
      byte[] sender = json.getBytes(SENDER);
      byte[] cipherText = json.getBytes(CIPHER_TEXT);
      byte[] nonce = json.getBytes(NONCE);
      byte[] recipientNonce = json.getBytes(RECIPIENT_NONCE);
      List<byte[]> recipientBoxes = json.getBytesList(RECIPIENT_BOXES);

      checkLength(sender, KEY_SIZE, SENDER);
      checkLength(nonce, NONCE_SIZE, NONCE);
      checkLength(recipientNonce, NONCE_SIZE, RECIPIENT_NONCE);

      return new EncryptedPayload(sender, cipherText, nonce, recipientNonce, recipientBoxes);
    }
    catch (JSONException | IllegalArgumentException e) {
      throw new EnclaveException("unable to decode encrypted payload", e);
    }
  }

  private static void checkLength(final byte[] value, final int expected, final String field) {
    if (value.length != expected) {
      throw new IllegalArgumentException(field + " must be " + expected + " bytes, was " + value.length);
    }
  }
}
