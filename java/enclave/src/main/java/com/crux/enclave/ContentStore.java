package com.crux.enclave;

import java.util.Base64;

import org.bouncycastle.crypto.digests.SHA3Digest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.crux.enclave.exceptions.PayloadNotFoundException;
import com.crux.enclave.persistence.ByteStore;
import com.crux.enclave.utils.SafeAutoCloseable;

/**
 * Content addressed storage of encoded envelopes. The address of an envelope is the SHA3-512 digest of its cipher
 * text alone, so every node holding a copy of the same message files it under the same digest even though each copy
 * carries different recipient boxes.
 */
public class ContentStore implements SafeAutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(ContentStore.class);

  public static final int DIGEST_SIZE_BITS = 512;

  private final ByteStore byteStore;

  /**
   * Creates a new {@code ContentStore} over the given byte store.
   *
   * @param byteStore The underlying key-value store.
   */
  public ContentStore(final ByteStore byteStore) {
    this.byteStore = byteStore;
  }

  /**
   * Computes the 64 byte content digest of a cipher text.
   *
   * @param cipherText The sealed payload body.
   * @return The digest.
   */
  public static byte[] digestOf(final byte[] cipherText) {
    SHA3Digest sha3 = new SHA3Digest(DIGEST_SIZE_BITS);
    sha3.update(cipherText, 0, cipherText.length);
    byte[] digest = new byte[sha3.getDigestSize()];
    sha3.doFinal(digest, 0);
    return digest;
  }

  /**
   * Stores an encoded envelope under its digest. Rewriting the same digest with the same bytes is a no-op in effect.
   *
   * @param digest The digest of the envelope's cipher text.
   * @param encodedEnvelope The encoded envelope.
   */
  public void put(final byte[] digest, final byte[] encodedEnvelope) {
    byteStore.put(digest, encodedEnvelope);
    if (logger.isDebugEnabled()) {
      logger.debug("stored payload {} ({} bytes)", encode(digest), encodedEnvelope.length);
    }
  }

  /**
   * Loads the encoded envelope stored under a digest.
   *
   * @param digest The digest.
   * @return The encoded envelope.
   * @throws PayloadNotFoundException if nothing is stored under the digest.
   */
  public byte[] get(final byte[] digest) {
    return byteStore.get(digest)
        .orElseThrow(() -> new PayloadNotFoundException("no payload found for digest " + encode(digest)));
  }

  /**
   * Removes the envelope stored under a digest.
   *
   * @param digest The digest.
   * @throws PayloadNotFoundException if nothing is stored under the digest.
   */
  public void delete(final byte[] digest) {
    if (!byteStore.delete(digest)) {
      throw new PayloadNotFoundException("no payload found for digest " + encode(digest));
    }
    logger.debug("deleted payload {}", encode(digest));
  }

  /**
   * Closes the underlying byte store.
   */
  @Override
  public void close() {
    byteStore.close();
  }

  static String encode(final byte[] digest) {
    return Base64.getEncoder().encodeToString(digest);
  }
}
