package com.crux.crypto.keys;

import java.util.function.Consumer;
import java.util.function.Function;

import com.crux.enclave.utils.SafeAutoCloseable;

public abstract class CryptoKey implements SafeAutoCloseable {
  /**
   * Checks if the key material has already been wiped.
   * @return {@code true} if the key was closed.
   */
  public abstract boolean isClosed();

  /**
   * Performs an action with the {@link CryptoKey}.
   * @param action The action to be performed.
   */
  public abstract void withKey(Consumer<byte[]> action);

  /**
   * Applies a function to the key.
   * @param action The function to execute
   * @param <T> the type used to store the result of the function.
   * @return the result of the function.
   */
  public abstract <T> T withKey(Function<byte[], T> action);
}
