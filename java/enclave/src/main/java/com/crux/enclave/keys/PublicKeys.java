package com.crux.enclave.keys;

import java.util.Base64;

import com.crux.crypto.engine.bouncycastle.BouncyCurve25519BoxCrypto;
import com.crux.enclave.exceptions.MalformedKeyException;

/**
 * Converts between the raw bytes of a public key and its external identifier, the standard Base64 encoding of those
 * bytes.
 */
public final class PublicKeys {
  private PublicKeys() { }

  /**
   * Decodes a public key identifier.
   *
   * @param identifier The Base64 identifier.
   * @return The 32 raw key bytes.
   * @throws MalformedKeyException if the identifier is not Base64 or not a 32 byte key.
   */
  public static byte[] decode(final String identifier) {
    if (identifier == null) {
      throw new MalformedKeyException("public key identifier is null");
    }

    byte[] key;
    try {
      key = Base64.getDecoder().decode(identifier.trim());
    }
    catch (IllegalArgumentException e) {
      throw new MalformedKeyException("public key is not valid Base64", e);
    }

    if (key.length != BouncyCurve25519BoxCrypto.PublicKeySize) {
      throw new MalformedKeyException("public key must be " + BouncyCurve25519BoxCrypto.PublicKeySize
          + " bytes, was " + key.length);
    }
    return key;
  }

  public static String encode(final byte[] publicKey) {
    return Base64.getEncoder().encodeToString(publicKey);
  }
}
