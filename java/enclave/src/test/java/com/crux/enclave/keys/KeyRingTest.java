package com.crux.enclave.keys;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.crux.crypto.engine.bouncycastle.BouncyCurve25519BoxCrypto;
import com.crux.crypto.keys.BoxKeyPair;
import com.crux.crypto.keys.TransientCryptoKey;
import com.crux.enclave.exceptions.KeyNotFoundException;

class KeyRingTest {
  private final BouncyCurve25519BoxCrypto boxCrypto = new BouncyCurve25519BoxCrypto();

  private BoxKeyPair first;
  private BoxKeyPair second;
  private KeyRing keyRing;

  @BeforeEach
  void setUp() {
    first = boxCrypto.generateKeyPair();
    second = boxCrypto.generateKeyPair();
    keyRing = new KeyRing(Arrays.asList(first, second));
  }

  @Test
  void testDefaultIdentityIsFirst() {
    assertSame(first, keyRing.getDefaultIdentity());
  }

  @Test
  void testResolvePrivate() {
    assertSame(second.getPrivateKey(), keyRing.resolvePrivate(second.getPublicKey()));
    assertSame(first, keyRing.resolveKeyPair(first.getPublicKey()));
  }

  @Test
  void testResolveUnknownShouldFail() {
    byte[] unknown = boxCrypto.generateKeyPair().getPublicKey();
    assertThrows(KeyNotFoundException.class, () -> keyRing.resolvePrivate(unknown));
  }

  @Test
  void testGetPublicKeysKeepsOrder() {
    List<byte[]> publicKeys = keyRing.getPublicKeys();
    assertEquals(2, publicKeys.size());
    assertArrayEquals(first.getPublicKey(), publicKeys.get(0));
    assertArrayEquals(second.getPublicKey(), publicKeys.get(1));
  }

  @Test
  void testEmptyShouldFail() {
    assertThrows(IllegalArgumentException.class, () -> new KeyRing(Collections.emptyList()));
  }

  @Test
  void testDuplicatePublicKeyShouldFail() {
    BoxKeyPair copy = new BoxKeyPair(first.getPublicKey(), new TransientCryptoKey(new byte[32]));
    assertThrows(IllegalArgumentException.class, () -> new KeyRing(Arrays.asList(first, copy)));
  }

  @Test
  void testCloseClosesAllPrivateKeys() {
    keyRing.close();
    assertTrue(first.getPrivateKey().isClosed());
    assertTrue(second.getPrivateKey().isClosed());
  }
}
