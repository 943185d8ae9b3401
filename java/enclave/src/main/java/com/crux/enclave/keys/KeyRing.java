package com.crux.enclave.keys;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.crux.crypto.keys.BoxKeyPair;
import com.crux.crypto.keys.CryptoKey;
import com.crux.enclave.exceptions.KeyNotFoundException;
import com.crux.enclave.utils.SafeAutoCloseable;
import com.google.common.collect.ImmutableList;

/**
 * The node's own identities. The first key pair is the default identity, used whenever a caller does not name a
 * sender. The list is fixed at construction and is safe to read from any thread.
 */
public class KeyRing implements SafeAutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(KeyRing.class);

  private final ImmutableList<BoxKeyPair> keyPairs;

  /**
   * Creates a new {@code KeyRing}.
   *
   * @param keyPairs The node's key pairs, default identity first. Must be non-empty and free of duplicates.
   */
  public KeyRing(final List<BoxKeyPair> keyPairs) {
    if (keyPairs == null || keyPairs.isEmpty()) {
      throw new IllegalArgumentException("at least one key pair is required");
    }

    Set<String> seen = new HashSet<>();
    for (BoxKeyPair keyPair : keyPairs) {
      String publicKey = PublicKeys.encode(keyPair.getPublicKey());
      if (!seen.add(publicKey)) {
        throw new IllegalArgumentException("duplicate key pair for public key " + publicKey);
      }
    }

    this.keyPairs = ImmutableList.copyOf(keyPairs);
    logger.debug("key ring initialized with {} key pair(s)", this.keyPairs.size());
  }

  /**
   * Finds the private key matching a public key.
   *
   * @param publicKey The raw public key.
   * @return The matching private key.
   * @throws KeyNotFoundException if no configured key pair has this public key.
   */
  public CryptoKey resolvePrivate(final byte[] publicKey) {
    return resolveKeyPair(publicKey).getPrivateKey();
  }

  /**
   * Finds the configured key pair whose public half is the given key.
   *
   * @param publicKey The raw public key.
   * @return The matching key pair.
   * @throws KeyNotFoundException if no configured key pair has this public key.
   */
  public BoxKeyPair resolveKeyPair(final byte[] publicKey) {
    return findKeyPair(publicKey).orElseThrow(() ->
        new KeyNotFoundException("unable to find private key for public key " + PublicKeys.encode(publicKey)));
  }

  /**
   * Looks up the configured key pair whose public half is the given key.
   *
   * @param publicKey The raw public key.
   * @return The matching key pair, or empty if the key is not one of this node's.
   */
  public Optional<BoxKeyPair> findKeyPair(final byte[] publicKey) {
    for (BoxKeyPair keyPair : keyPairs) {
      if (keyPair.hasPublicKey(publicKey)) {
        return Optional.of(keyPair);
      }
    }
    return Optional.empty();
  }

  public BoxKeyPair getDefaultIdentity() {
    return keyPairs.get(0);
  }

  /**
   * Lists the public halves of all configured key pairs, in configuration order.
   *
   * @return The raw public keys.
   */
  public List<byte[]> getPublicKeys() {
    ImmutableList.Builder<byte[]> publicKeys = ImmutableList.builder();
    for (BoxKeyPair keyPair : keyPairs) {
      publicKeys.add(keyPair.getPublicKey());
    }
    return publicKeys.build();
  }

  @Override
  public void close() {
    for (BoxKeyPair keyPair : keyPairs) {
      keyPair.close();
    }
  }
}
