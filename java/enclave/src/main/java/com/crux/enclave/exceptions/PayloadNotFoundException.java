package com.crux.enclave.exceptions;

public class PayloadNotFoundException extends EnclaveException {

  /**
   * Creates a new {@code PayloadNotFoundException}. This signals that no payload is stored under the requested digest.
   *
   * @param message The detailed exception message.
   */
  public PayloadNotFoundException(final String message) {
    super(message);
  }
}
