package com.crux.enclave.exceptions;

public class MalformedKeyException extends EnclaveException {

  /**
   * Creates a new {@code MalformedKeyException}. This signals that a key identifier could not be decoded to a usable
   * public key.
   *
   * @param message The detailed exception message.
   */
  public MalformedKeyException(final String message) {
    super(message);
  }

  /**
   * Creates a new {@code MalformedKeyException}.
   *
   * @param message The detailed exception message.
   * @param cause The actual {@link java.lang.Exception} raised.
   */
  public MalformedKeyException(final String message, final Exception cause) {
    super(message, cause);
  }
}
