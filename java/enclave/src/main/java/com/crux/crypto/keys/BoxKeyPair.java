package com.crux.crypto.keys;

import java.util.Arrays;

import com.crux.enclave.utils.SafeAutoCloseable;

/**
 * A Curve25519 public key paired with its private half. The pairing is kept in one record so that a public key can
 * never be looked up against the wrong private key.
 */
public final class BoxKeyPair implements SafeAutoCloseable {
  private final byte[] publicKey;
  private final CryptoKey privateKey;

  /**
   * Creates a new {@code BoxKeyPair}.
   * @param publicKey The raw 32 byte public key.
   * @param privateKey The matching private key.
   */
  public BoxKeyPair(final byte[] publicKey, final CryptoKey privateKey) {
    if (publicKey == null || privateKey == null) {
      throw new IllegalArgumentException("public and private key are both required");
    }
    this.publicKey = publicKey.clone();
    this.privateKey = privateKey;
  }

  public byte[] getPublicKey() {
    return publicKey.clone();
  }

  public CryptoKey getPrivateKey() {
    return privateKey;
  }

  /**
   * Checks whether this pair's public half equals the given key, byte for byte.
   * @param otherPublicKey The public key to compare against.
   * @return {@code true} if the keys match.
   */
  public boolean hasPublicKey(final byte[] otherPublicKey) {
    return Arrays.equals(publicKey, otherPublicKey);
  }

  @Override
  public void close() {
    privateKey.close();
  }
}
