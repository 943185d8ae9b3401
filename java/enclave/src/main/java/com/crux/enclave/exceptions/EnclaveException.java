package com.crux.enclave.exceptions;

public class EnclaveException extends RuntimeException {

  /**
   * Creates a new {@code EnclaveException}. This signals that a {@link com.crux.enclave.Enclave} operation has failed.
   *
   * @param message The detailed exception message.
   */
  public EnclaveException(final String message) {
    super(message);
  }

  /**
   * Creates a new {@code EnclaveException}. This signals that a {@link com.crux.enclave.Enclave} operation has failed.
   *
   * @param message The detailed exception message.
   * @param cause The actual {@link java.lang.Exception} raised.
   */
  public EnclaveException(final String message, final Exception cause) {
    super(message, cause);
  }
}
