package com.crux.crypto.engine.bouncycastle;

import java.util.Arrays;

import org.bouncycastle.crypto.engines.XSalsa20Engine;
import org.bouncycastle.crypto.macs.Poly1305;
import org.bouncycastle.crypto.params.KeyParameter;
import org.bouncycastle.crypto.params.ParametersWithIV;

import com.crux.crypto.AeadCrypto;
import com.crux.crypto.bufferutils.ManagedBufferUtils;
import com.crux.crypto.keys.CryptoKey;
import com.crux.enclave.exceptions.UnsealException;

/**
 * NaCl {@code crypto_secretbox}: XSalsa20 stream encryption with a Poly1305 authenticator. The first 32 bytes of
 * keystream become the one-time Poly1305 key and the remaining keystream encrypts the message. Output is the 16 byte
 * tag followed by the ciphertext, which is byte compatible with other NaCl implementations.
 */
public class BouncyXSalsa20Poly1305Crypto extends AeadCrypto {
  private static final int NonceSizeBits = 192;
  private static final int MacSizeBits = 128;
  private static final int KeySizeBits = 256;
  private static final int MacKeySize = 32;

  @Override
  public byte[] encrypt(final byte[] input, final byte[] nonce, final CryptoKey key) {
    checkNonce(nonce);
    return key.withKey(keyBytes -> {
      return seal(input, nonce, keyBytes);
    });
  }

  @Override
  public byte[] decrypt(final byte[] input, final byte[] nonce, final CryptoKey key) {
    checkNonce(nonce);
    if (input.length < getMacSize()) {
      throw new UnsealException("cipher text shorter than authenticator");
    }
    return key.withKey(keyBytes -> {
      return open(input, nonce, keyBytes);
    });
  }

  private byte[] seal(final byte[] input, final byte[] nonce, final byte[] keyBytes) {
    int macSize = getMacSize();
    XSalsa20Engine cipher = newCipher(nonce, keyBytes);
    byte[] macKey = new byte[MacKeySize];
    try {
      cipher.processBytes(macKey, 0, MacKeySize, macKey, 0);

      byte[] output = new byte[macSize + input.length];
      cipher.processBytes(input, 0, input.length, output, macSize);

      Poly1305 mac = newMac(macKey);
      mac.update(output, macSize, input.length);
      mac.doFinal(output, 0);
      return output;
    }
    finally {
      ManagedBufferUtils.wipeByteArray(macKey);
    }
  }

  private byte[] open(final byte[] input, final byte[] nonce, final byte[] keyBytes) {
    int macSize = getMacSize();
    int cipherTextLength = input.length - macSize;
    XSalsa20Engine cipher = newCipher(nonce, keyBytes);
    byte[] macKey = new byte[MacKeySize];
    try {
      cipher.processBytes(macKey, 0, MacKeySize, macKey, 0);

      Poly1305 mac = newMac(macKey);
      byte[] expectedTag = new byte[macSize];
      mac.update(input, macSize, cipherTextLength);
      mac.doFinal(expectedTag, 0);

      byte[] actualTag = Arrays.copyOfRange(input, 0, macSize);
      if (!org.bouncycastle.util.Arrays.constantTimeAreEqual(expectedTag, actualTag)) {
        throw new UnsealException("message authentication failed");
      }

      byte[] output = new byte[cipherTextLength];
      cipher.processBytes(input, macSize, cipherTextLength, output, 0);
      return output;
    }
    finally {
      ManagedBufferUtils.wipeByteArray(macKey);
    }
  }

  private static XSalsa20Engine newCipher(final byte[] nonce, final byte[] keyBytes) {
    KeyParameter keyParameter = new KeyParameter(keyBytes);
    XSalsa20Engine cipher = new XSalsa20Engine();
    try {
      cipher.init(true, new ParametersWithIV(keyParameter, nonce));
      return cipher;
    }
    finally {
      ManagedBufferUtils.wipeByteArray(keyParameter.getKey());
    }
  }

  private static Poly1305 newMac(final byte[] macKey) {
    KeyParameter keyParameter = new KeyParameter(macKey);
    Poly1305 mac = new Poly1305();
    try {
      mac.init(keyParameter);
      return mac;
    }
    finally {
      ManagedBufferUtils.wipeByteArray(keyParameter.getKey());
    }
  }

  @Override
  protected int getNonceSizeBits() {
    return NonceSizeBits;
  }

  @Override
  protected int getKeySizeBits() {
    return KeySizeBits;
  }

  @Override
  protected int getMacSizeBits() {
    return MacSizeBits;
  }
}
