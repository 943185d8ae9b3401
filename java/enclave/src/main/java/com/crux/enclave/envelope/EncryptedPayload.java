package com.crux.enclave.envelope;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * The envelope format is:
 * <pre>
 * {
 *   Sender: public key of the sealing identity,
 *   CipherText: payload body sealed under the master key,
 *   Nonce: 24 byte nonce of the body,
 *   RecipientNonce: 24 byte nonce shared by all recipient boxes of the payload,
 *   RecipientBoxes: master key sealed for each recipient
 * }
 * </pre>
 * Instances are immutable. Copies for different recipients share the sender, body and nonces and differ only in their
 * recipient boxes. Byte arrays are shared rather than copied and must not be modified by callers.
 */
public final class EncryptedPayload {
  private final byte[] sender;
  private final byte[] cipherText;
  private final byte[] nonce;
  private final byte[] recipientNonce;
  private final ImmutableList<byte[]> recipientBoxes;

  /**
   * Creates an {@code EncryptedPayload} instance.
   *
   * @param sender The sender's public key.
   * @param cipherText The sealed payload body.
   * @param nonce The nonce the body was sealed with.
   * @param recipientNonce The nonce the recipient boxes were sealed with.
   * @param recipientBoxes The recipient boxes, in order.
   */
  public EncryptedPayload(final byte[] sender, final byte[] cipherText, final byte[] nonce,
      final byte[] recipientNonce, final List<byte[]> recipientBoxes) {
    this.sender = sender;
    this.cipherText = cipherText;
    this.nonce = nonce;
    this.recipientNonce = recipientNonce;
    this.recipientBoxes = ImmutableList.copyOf(recipientBoxes);
  }

  /**
   * Builds the copy of this envelope addressed to exactly one recipient.
   *
   * @param recipientBox The master key box of that recipient.
   * @return A new envelope carrying only {@code recipientBox}.
   */
  public EncryptedPayload withRecipientBox(final byte[] recipientBox) {
    return new EncryptedPayload(sender, cipherText, nonce, recipientNonce, ImmutableList.of(recipientBox));
  }

  public byte[] getSender() {
    return sender;
  }

  public byte[] getCipherText() {
    return cipherText;
  }

  public byte[] getNonce() {
    return nonce;
  }

  public byte[] getRecipientNonce() {
    return recipientNonce;
  }

  public List<byte[]> getRecipientBoxes() {
    return recipientBoxes;
  }
}
