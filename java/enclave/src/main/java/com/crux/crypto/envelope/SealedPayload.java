package com.crux.crypto.envelope;

public class SealedPayload {
  private final byte[] cipherText;
  private final byte[] nonce;

  /**
   * Creates a new {@code SealedPayload}.
   * @param cipherText the authenticated cipher text of the payload body.
   * @param nonce the nonce the body was sealed with.
   */
  public SealedPayload(final byte[] cipherText, final byte[] nonce) {
    this.cipherText = cipherText;
    this.nonce = nonce;
  }

  public byte[] getCipherText() {
    return cipherText;
  }

  public byte[] getNonce() {
    return nonce;
  }
}
