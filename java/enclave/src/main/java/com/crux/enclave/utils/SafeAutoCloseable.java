package com.crux.enclave.utils;

public interface SafeAutoCloseable extends AutoCloseable {
  /**
   * {@inheritDoc}
   */
  void close();
}
