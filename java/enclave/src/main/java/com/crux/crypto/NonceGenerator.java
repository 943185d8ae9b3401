package com.crux.crypto;

import java.security.SecureRandom;

public class NonceGenerator {
  private final SecureRandom secureRandom = new SecureRandom();

  /**
   * Generates a nonce.
   * @param bits Number of bits to use for nonce generation.
   * @return An array of nonce bytes.
   */
  public byte[] createNonce(final int bits) {
    if (bits % Byte.SIZE != 0) {
      throw new IllegalArgumentException("Bits parameter must be multiple of 8");
    }

    byte[] nonceBytes = new byte[bits / Byte.SIZE];
    secureRandom.nextBytes(nonceBytes);
    return nonceBytes;
  }
}
