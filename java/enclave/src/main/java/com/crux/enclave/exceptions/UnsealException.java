package com.crux.enclave.exceptions;

public class UnsealException extends EnclaveException {

  /**
   * Creates a new {@code UnsealException}. This signals that an authenticated box could not be opened, either
   * because it was tampered with or because it was not sealed for the key used to open it.
   *
   * @param message The detailed exception message.
   */
  public UnsealException(final String message) {
    super(message);
  }

  /**
   * Creates a new {@code UnsealException}.
   *
   * @param message The detailed exception message.
   * @param cause The actual {@link java.lang.Exception} raised.
   */
  public UnsealException(final String message, final Exception cause) {
    super(message, cause);
  }
}
