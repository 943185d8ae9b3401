package com.crux.enclave.transport;

import com.crux.enclave.envelope.EncryptedPayload;
import com.crux.enclave.utils.SafeAutoCloseable;

/**
 * Delivers an envelope copy to another node. Delivery is best effort: implementations must not block the caller on
 * the remote node and must not report delivery failures by throwing. Closing the client gives pushes still in flight
 * a bounded time to complete.
 */
public interface PeerPushClient extends SafeAutoCloseable {

  /**
   * Sends the envelope to the node at the given url.
   *
   * @param payload The envelope, carrying only the receiving recipient's box.
   * @param url The base url of the receiving node.
   */
  void push(EncryptedPayload payload, String url);
}
