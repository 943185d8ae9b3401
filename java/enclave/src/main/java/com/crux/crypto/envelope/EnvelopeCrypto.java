package com.crux.crypto.envelope;

import static com.crux.crypto.bufferutils.ManagedBufferUtils.wipeByteArray;

import com.crux.crypto.AeadCrypto;
import com.crux.crypto.engine.bouncycastle.BouncyCurve25519BoxCrypto;
import com.crux.crypto.engine.bouncycastle.BouncyXSalsa20Poly1305Crypto;
import com.crux.crypto.keys.CryptoKey;
import com.crux.enclave.exceptions.UnsealException;

/**
 * Two level envelope encryption. The payload body is sealed once with a random master key, and the master key is
 * sealed separately for every recipient with a public key box.
 */
public class EnvelopeCrypto {
  private final AeadCrypto secretBox;
  private final BouncyCurve25519BoxCrypto box;

  /**
   * Creates a new {@code EnvelopeCrypto} using XSalsa20-Poly1305 for payloads and Curve25519 boxes for master keys.
   */
  public EnvelopeCrypto() {
    this(new BouncyXSalsa20Poly1305Crypto(), new BouncyCurve25519BoxCrypto());
  }

  /**
   * Creates a new {@code EnvelopeCrypto} with the given engines.
   * @param secretBox The symmetric engine used for payload bodies.
   * @param box The public key engine used for master keys.
   */
  public EnvelopeCrypto(final AeadCrypto secretBox, final BouncyCurve25519BoxCrypto box) {
    this.secretBox = secretBox;
    this.box = box;
  }

  /**
   * Generates a fresh master key. The caller owns the key and must close it.
   * @return A random master key.
   */
  public CryptoKey generateMasterKey() {
    return secretBox.generateKey();
  }

  /**
   * Generates a fresh 24 byte nonce, usable both for payloads and for recipient boxes.
   * @return The nonce bytes.
   */
  public byte[] generateNonce() {
    return secretBox.generateNonce();
  }

  /**
   * Seals the payload body under the master key with a newly generated nonce.
   * @param plainText The payload.
   * @param masterKey The master key.
   * @return The cipher text and the nonce it was sealed with.
   */
  public SealedPayload sealPayload(final byte[] plainText, final CryptoKey masterKey) {
    byte[] nonce = generateNonce();
    return new SealedPayload(secretBox.encrypt(plainText, nonce, masterKey), nonce);
  }

  /**
   * Seals the raw master key bytes for one recipient. The same recipient nonce may be used for every recipient of a
   * payload, since each pairing of sender and recipient derives a different box key.
   * @param masterKey The master key to seal.
   * @param recipientNonce The payload's recipient nonce.
   * @param recipientPublicKey The recipient's public key.
   * @param senderPrivateKey The sender's private key.
   * @return The recipient box.
   */
  public byte[] sealMasterKey(final CryptoKey masterKey, final byte[] recipientNonce,
      final byte[] recipientPublicKey, final CryptoKey senderPrivateKey) {
    return masterKey.withKey(keyBytes -> {
      return box.seal(keyBytes, recipientNonce, recipientPublicKey, senderPrivateKey);
    });
  }

  /**
   * Opens a recipient box. The caller owns the returned key and must close it.
   * @param recipientBox The recipient box.
   * @param recipientNonce The payload's recipient nonce.
   * @param senderPublicKey The public key of the party that sealed the box.
   * @param ownPrivateKey This node's private key.
   * @return The master key.
   * @throws UnsealException if the box was not sealed for this key pair or was modified.
   */
  public CryptoKey openMasterKey(final byte[] recipientBox, final byte[] recipientNonce,
      final byte[] senderPublicKey, final CryptoKey ownPrivateKey) {
    byte[] keyBytes = box.open(recipientBox, recipientNonce, senderPublicKey, ownPrivateKey);
    try {
      if (keyBytes.length != secretBox.getKeySize()) {
        throw new UnsealException("recipient box does not hold a master key");
      }
      return secretBox.generateKeyFromBytes(keyBytes);
    }
    finally {
      wipeByteArray(keyBytes);
    }
  }

  /**
   * Opens a payload body.
   * @param cipherText The sealed body.
   * @param nonce The nonce the body was sealed with.
   * @param masterKey The master key.
   * @return The payload.
   * @throws UnsealException if the body was modified or the key does not match.
   */
  public byte[] openPayload(final byte[] cipherText, final byte[] nonce, final CryptoKey masterKey) {
    return secretBox.decrypt(cipherText, nonce, masterKey);
  }
}
