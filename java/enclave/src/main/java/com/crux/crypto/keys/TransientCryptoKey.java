package com.crux.crypto.keys;

import java.util.function.Consumer;
import java.util.function.Function;

import com.crux.crypto.bufferutils.ManagedBufferUtils;

/**
 * A {@link CryptoKey} held on the heap for the lifetime of a single operation (or of the process for configured
 * identities). The key bytes are wiped when the key is closed.
 */
public class TransientCryptoKey extends CryptoKey {
  private final byte[] keyBytes;
  private volatile boolean closed;

  /**
   * Creates a new {@code TransientCryptoKey}. The source bytes are copied, so the caller remains responsible for
   * wiping its own buffer.
   * @param sourceBytes The raw key bytes.
   */
  public TransientCryptoKey(final byte[] sourceBytes) {
    this.keyBytes = sourceBytes.clone();
  }

  @Override
  public <T> T withKey(final Function<byte[], T> action) {
    checkOpen();
    return action.apply(keyBytes);
  }

  @Override
  public void withKey(final Consumer<byte[]> action) {
    checkOpen();
    action.accept(keyBytes);
  }

  @Override
  public boolean isClosed() {
    return closed;
  }

  @Override
  public void close() {
    closed = true;
    ManagedBufferUtils.wipeByteArray(keyBytes);
  }

  private void checkOpen() {
    if (closed) {
      throw new IllegalStateException("key has been closed");
    }
  }
}
