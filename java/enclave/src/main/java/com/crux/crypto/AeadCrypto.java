package com.crux.crypto;

import static com.crux.crypto.bufferutils.ManagedBufferUtils.wipeByteArray;

import com.crux.crypto.keys.CryptoKey;
import com.crux.crypto.keys.TransientCryptoKey;

import java.security.SecureRandom;

/**
 * Base class for authenticated symmetric ciphers that take an explicit, caller supplied nonce.
 */
public abstract class AeadCrypto {
  protected static final SecureRandom CRYPTO_RANDOM = new SecureRandom();

  private final NonceGenerator nonceGenerator;

  protected abstract int getNonceSizeBits();

  protected abstract int getKeySizeBits();

  protected abstract int getMacSizeBits();

  /**
   * Encrypts the provided payload.
   * @param input Payload bytes to be encrypted.
   * @param nonce The nonce to encrypt with. Must never be reused with the same key.
   * @param key The {@link CryptoKey} to encrypt the payload with.
   * @return An encrypted, integrity protected payload.
   */
  public abstract byte[] encrypt(byte[] input, byte[] nonce, CryptoKey key);

  /**
   * Decrypts an encrypted payload.
   * @param input The encrypted payload.
   * @param nonce The nonce the payload was encrypted with.
   * @param key The {@link CryptoKey} to decrypt the payload with.
   * @return A decrypted payload.
   * @throws com.crux.enclave.exceptions.UnsealException if the payload fails authentication.
   */
  public abstract byte[] decrypt(byte[] input, byte[] nonce, CryptoKey key);

  protected AeadCrypto() {
    nonceGenerator = new NonceGenerator();
  }

  /**
   * Generates a fresh random nonce of the size this cipher expects.
   * @return The nonce bytes.
   */
  public byte[] generateNonce() {
    return nonceGenerator.createNonce(getNonceSizeBits());
  }

  public int getNonceSize() {
    return getNonceSizeBits() / Byte.SIZE;
  }

  public int getKeySize() {
    return getKeySizeBits() / Byte.SIZE;
  }

  public int getMacSize() {
    return getMacSizeBits() / Byte.SIZE;
  }

  /**
   * Generates a new random {@link CryptoKey}.
   * @return A newly generated {@link CryptoKey}.
   */
  public CryptoKey generateKey() {
    int keyLengthBits = getKeySizeBits();

    if (keyLengthBits % Byte.SIZE != 0) {
      throw new IllegalArgumentException("Invalid key length " + keyLengthBits);
    }

    byte[] keyBytes = new byte[keyLengthBits / Byte.SIZE];
    CRYPTO_RANDOM.nextBytes(keyBytes);
    try {
      return generateKeyFromBytes(keyBytes);
    }
    finally {
      wipeByteArray(keyBytes);
    }
  }

  /**
   * Generates a {@link CryptoKey} using the provided source bytes. <b>NOTE</b>: you MUST wipe out the source
   * bytes after the completion of this call!
   * @param sourceBytes The bytes to use for generating {@link CryptoKey}.
   * @return A {@link CryptoKey} generated from the {@code sourceBytes}.
   */
  public CryptoKey generateKeyFromBytes(final byte[] sourceBytes) {
    if (sourceBytes.length != getKeySize()) {
      throw new IllegalArgumentException("Invalid key length " + sourceBytes.length * Byte.SIZE);
    }
    return new TransientCryptoKey(sourceBytes);
  }

  protected void checkNonce(final byte[] nonce) {
    if (nonce == null || nonce.length != getNonceSize()) {
      throw new IllegalArgumentException("nonce must be " + getNonceSize() + " bytes");
    }
  }
}
