package com.crux.enclave.persistence;

import java.util.Optional;

import com.crux.enclave.utils.SafeAutoCloseable;

/**
 * The {@code ByteStore} interface is the key-value store that encoded envelopes are persisted in. Durability,
 * indexing and concurrency guarantees belong to the implementation, with the one requirement that a {@link #get}
 * issued after a {@link #put} of the same key observes the written value.
 */
public interface ByteStore extends SafeAutoCloseable {

  /**
   * Lookup the key and return its associated value, if any.
   *
   * @param key The key to lookup.
   * @return The value associated with the key, if any.
   */
  Optional<byte[]> get(byte[] key);

  /**
   * Stores the value under the key, replacing any existing value.
   *
   * @param key The key to associate with.
   * @param value The value to store.
   */
  void put(byte[] key, byte[] value);

  /**
   * Removes the value stored under the key.
   *
   * @param key The key to remove.
   * @return {@code true} if a value was removed, {@code false} if the key was absent.
   */
  boolean delete(byte[] key);

  /**
   * Releases resources held by the store, such as a connection pool. Stores without such resources do nothing.
   */
  @Override
  default void close() {
  }
}
