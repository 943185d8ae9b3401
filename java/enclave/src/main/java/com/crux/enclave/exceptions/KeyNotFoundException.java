package com.crux.enclave.exceptions;

public class KeyNotFoundException extends EnclaveException {

  /**
   * Creates a new {@code KeyNotFoundException}. This signals that no configured key pair of the
   * {@link com.crux.enclave.keys.KeyRing} has the requested public key.
   *
   * @param message The detailed exception message.
   */
  public KeyNotFoundException(final String message) {
    super(message);
  }
}
