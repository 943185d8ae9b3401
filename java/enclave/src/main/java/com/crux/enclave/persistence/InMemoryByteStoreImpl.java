package com.crux.enclave.persistence;

import java.nio.ByteBuffer;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Provides a {@link HashMap} based implementation of {@link ByteStore}.
 * NOTE: This is a volatile implementation and should NEVER be used in a production environment.
 */
public class InMemoryByteStoreImpl implements ByteStore {
  // ByteBuffer gives the keys value equality
  private final Map<ByteBuffer, byte[]> table = new HashMap<>();

  @Override
  public Optional<byte[]> get(final byte[] key) {
    synchronized (table) {
      return Optional.ofNullable(table.get(wrap(key))).map(byte[]::clone);
    }
  }

  @Override
  public void put(final byte[] key, final byte[] value) {
    synchronized (table) {
      table.put(wrap(key), value.clone());
    }
  }

  @Override
  public boolean delete(final byte[] key) {
    synchronized (table) {
      return table.remove(wrap(key)) != null;
    }
  }

  /**
   * Returns the number of stored values.
   *
   * @return The number of entries.
   */
  public int size() {
    synchronized (table) {
      return table.size();
    }
  }

  private static ByteBuffer wrap(final byte[] key) {
    return ByteBuffer.wrap(key.clone());
  }
}
