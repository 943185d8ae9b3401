package com.crux.enclave.exceptions;

public class UnknownSenderException extends EnclaveException {

  /**
   * Creates a new {@code UnknownSenderException}. This signals that the sender of a store request could not be
   * resolved to a local private key, so no payload was built or stored.
   *
   * @param message The detailed exception message.
   * @param cause The actual {@link java.lang.Exception} raised.
   */
  public UnknownSenderException(final String message, final Exception cause) {
    super(message, cause);
  }
}
