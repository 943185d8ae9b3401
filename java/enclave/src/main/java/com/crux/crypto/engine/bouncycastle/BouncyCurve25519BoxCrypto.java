package com.crux.crypto.engine.bouncycastle;

import java.security.SecureRandom;

import org.bouncycastle.crypto.agreement.X25519Agreement;
import org.bouncycastle.crypto.engines.Salsa20Engine;
import org.bouncycastle.crypto.params.X25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.X25519PublicKeyParameters;
import org.bouncycastle.util.Pack;

import com.crux.crypto.AeadCrypto;
import com.crux.crypto.bufferutils.ManagedBufferUtils;
import com.crux.crypto.keys.BoxKeyPair;
import com.crux.crypto.keys.CryptoKey;
import com.crux.crypto.keys.TransientCryptoKey;
import com.crux.enclave.exceptions.MalformedKeyException;
import com.crux.enclave.exceptions.UnsealException;

/**
 * NaCl {@code crypto_box}: an X25519 agreement between one party's private key and the other party's public key,
 * hashed with HSalsa20 into a symmetric key that then drives {@code crypto_secretbox}. Either side of a pairing
 * derives the same key, so a box sealed by A for B opens with B's private key and A's public key.
 */
public class BouncyCurve25519BoxCrypto {
  public static final int PublicKeySize = 32;
  public static final int PrivateKeySize = 32;

  // "expand 32-byte k"
  private static final int[] Sigma = {0x61707865, 0x3320646e, 0x79622d32, 0x6b206574};
  private static final int HSalsaRounds = 20;

  private final SecureRandom secureRandom = new SecureRandom();
  private final AeadCrypto secretBox;

  /**
   * Creates a new {@code BouncyCurve25519BoxCrypto} on top of XSalsa20-Poly1305.
   */
  public BouncyCurve25519BoxCrypto() {
    this(new BouncyXSalsa20Poly1305Crypto());
  }

  BouncyCurve25519BoxCrypto(final AeadCrypto secretBox) {
    this.secretBox = secretBox;
  }

  /**
   * Generates a new random key pair.
   * @return The new {@link BoxKeyPair}.
   */
  public BoxKeyPair generateKeyPair() {
    X25519PrivateKeyParameters privateKey = new X25519PrivateKeyParameters(secureRandom);
    byte[] privateKeyBytes = privateKey.getEncoded();
    try {
      return new BoxKeyPair(privateKey.generatePublicKey().getEncoded(), new TransientCryptoKey(privateKeyBytes));
    }
    finally {
      ManagedBufferUtils.wipeByteArray(privateKeyBytes);
    }
  }

  /**
   * Computes the public key that belongs to a private key.
   * @param privateKey The private key.
   * @return The raw public key bytes.
   */
  public byte[] derivePublicKey(final CryptoKey privateKey) {
    return privateKey.withKey(privateKeyBytes -> {
      checkLength(privateKeyBytes, PrivateKeySize, "private key");
      return new X25519PrivateKeyParameters(privateKeyBytes, 0).generatePublicKey().getEncoded();
    });
  }

  /**
   * Seals a message so that only the holder of {@code recipientPublicKey}'s private half can open it.
   * @param message The bytes to seal.
   * @param nonce A 24 byte nonce, unique per pairing.
   * @param recipientPublicKey The recipient's public key.
   * @param senderPrivateKey The sender's private key.
   * @return The authenticated box.
   */
  public byte[] seal(final byte[] message, final byte[] nonce, final byte[] recipientPublicKey,
      final CryptoKey senderPrivateKey) {
    try (CryptoKey sharedKey = precompute(recipientPublicKey, senderPrivateKey)) {
      return secretBox.encrypt(message, nonce, sharedKey);
    }
  }

  /**
   * Opens a box sealed by the holder of {@code senderPublicKey} for this key pair.
   * @param box The authenticated box.
   * @param nonce The nonce the box was sealed with.
   * @param senderPublicKey The sender's public key.
   * @param recipientPrivateKey The recipient's private key.
   * @return The opened message.
   * @throws UnsealException if authentication fails.
   */
  public byte[] open(final byte[] box, final byte[] nonce, final byte[] senderPublicKey,
      final CryptoKey recipientPrivateKey) {
    CryptoKey sharedKey;
    try {
      sharedKey = precompute(senderPublicKey, recipientPrivateKey);
    }
    catch (MalformedKeyException e) {
      throw new UnsealException("unable to derive box key", e);
    }

    try {
      return secretBox.decrypt(box, nonce, sharedKey);
    }
    finally {
      sharedKey.close();
    }
  }

  /**
   * Derives the symmetric key shared by a pairing ({@code crypto_box_beforenm}).
   * @param peerPublicKey The other party's public key.
   * @param privateKey This party's private key.
   * @return The shared key. The caller must close it.
   */
  CryptoKey precompute(final byte[] peerPublicKey, final CryptoKey privateKey) {
    checkLength(peerPublicKey, PublicKeySize, "public key");
    return privateKey.withKey(privateKeyBytes -> {
      checkLength(privateKeyBytes, PrivateKeySize, "private key");

      X25519Agreement agreement = new X25519Agreement();
      agreement.init(new X25519PrivateKeyParameters(privateKeyBytes, 0));
      byte[] sharedSecret = new byte[agreement.getAgreementSize()];
      byte[] boxKey = null;
      try {
        agreement.calculateAgreement(new X25519PublicKeyParameters(peerPublicKey, 0), sharedSecret, 0);
        boxKey = hsalsa20(sharedSecret, new byte[16]);
        return new TransientCryptoKey(boxKey);
      }
      catch (IllegalStateException e) {
        // low order point, the agreement is all zeros
        throw new MalformedKeyException("X25519 agreement failed", e);
      }
      finally {
        ManagedBufferUtils.wipeByteArray(sharedSecret);
        ManagedBufferUtils.wipeByteArray(boxKey);
      }
    });
  }

  static byte[] hsalsa20(final byte[] key, final byte[] input) {
    int[] state = new int[16];
    int[] mixed = new int[16];
    int[] output = new int[8];
    try {
      state[0] = Sigma[0];
      Pack.littleEndianToInt(key, 0, state, 1, 4);
      state[5] = Sigma[1];
      Pack.littleEndianToInt(input, 0, state, 6, 4);
      state[10] = Sigma[2];
      Pack.littleEndianToInt(key, 16, state, 11, 4);
      state[15] = Sigma[3];

      Salsa20Engine.salsaCore(HSalsaRounds, state, mixed);

      // salsaCore adds the input back in, HSalsa20 must not
      output[0] = mixed[0] - state[0];
      output[1] = mixed[5] - state[5];
      output[2] = mixed[10] - state[10];
      output[3] = mixed[15] - state[15];
      output[4] = mixed[6] - state[6];
      output[5] = mixed[7] - state[7];
      output[6] = mixed[8] - state[8];
      output[7] = mixed[9] - state[9];
      return Pack.intToLittleEndian(output);
    }
    finally {
      ManagedBufferUtils.wipeIntArray(state);
      ManagedBufferUtils.wipeIntArray(mixed);
      ManagedBufferUtils.wipeIntArray(output);
    }
  }

  private static void checkLength(final byte[] key, final int expected, final String name) {
    if (key == null || key.length != expected) {
      throw new MalformedKeyException(name + " must be " + expected + " bytes");
    }
  }
}
