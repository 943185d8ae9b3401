package com.crux.enclave;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Timer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.crux.crypto.envelope.EnvelopeCrypto;
import com.crux.crypto.envelope.SealedPayload;
import com.crux.crypto.keys.BoxKeyPair;
import com.crux.crypto.keys.CryptoKey;
import com.crux.enclave.envelope.EncryptedPayload;
import com.crux.enclave.envelope.EncryptedPayloadCodec;
import com.crux.enclave.envelope.JsonEncryptedPayloadCodec;
import com.crux.enclave.exceptions.EnclaveException;
import com.crux.enclave.exceptions.KeyNotFoundException;
import com.crux.enclave.exceptions.MalformedKeyException;
import com.crux.enclave.exceptions.UnknownSenderException;
import com.crux.enclave.keys.KeyRing;
import com.crux.enclave.keys.PublicKeys;
import com.crux.enclave.partyinfo.JsonPartyInfoCodec;
import com.crux.enclave.partyinfo.PartyDirectory;
import com.crux.enclave.partyinfo.PartyInfoCodec;
import com.crux.enclave.persistence.ByteStore;
import com.crux.enclave.transport.HttpPeerPushClient;
import com.crux.enclave.transport.PeerPushClient;
import com.crux.enclave.utils.MetricsUtil;
import com.crux.enclave.utils.SafeAutoCloseable;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;

/**
 * The node-local enclave. Encrypts payloads for a set of recipients, pushes each remote recipient its own copy, keeps
 * a copy the sender can open in the local content store, and opens stored copies for the node's default identity.
 * <p>
 * A store is best effort towards recipients and guaranteed towards the sender: a recipient key that cannot be decoded
 * or resolved to a node is logged and skipped, while failing to resolve the sender aborts before anything is built.
 */
public class Enclave implements SafeAutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(Enclave.class);

  private final Timer storeTimer = Metrics.timer(MetricsUtil.ENCLAVE_METRICS_PREFIX + ".store");
  private final Timer storeRawTimer = Metrics.timer(MetricsUtil.ENCLAVE_METRICS_PREFIX + ".storeraw");
  private final Timer retrieveTimer = Metrics.timer(MetricsUtil.ENCLAVE_METRICS_PREFIX + ".retrieve");

  private final KeyRing keyRing;
  private final EnvelopeCrypto crypto;
  private final ContentStore contentStore;
  private final PartyDirectory partyDirectory;
  private final PeerPushClient peerPushClient;
  private final EncryptedPayloadCodec payloadCodec;
  private final PartyInfoCodec partyInfoCodec;

  /**
   * Initialize an {@code Enclave} builder.
   *
   * @return A new {@link Builder}.
   */
  public static Builder newBuilder() {
    return new Builder();
  }

  Enclave(final KeyRing keyRing, final EnvelopeCrypto crypto, final ContentStore contentStore,
      final PartyDirectory partyDirectory, final PeerPushClient peerPushClient,
      final EncryptedPayloadCodec payloadCodec, final PartyInfoCodec partyInfoCodec) {
    this.keyRing = keyRing;
    this.crypto = crypto;
    this.contentStore = contentStore;
    this.partyDirectory = partyDirectory;
    this.peerPushClient = peerPushClient;
    this.payloadCodec = payloadCodec;
    this.partyInfoCodec = partyInfoCodec;
  }

  /**
   * Encrypts a message, pushes a copy to every resolvable recipient and stores the sender's own copy.
   *
   * @param message The plaintext.
   * @param sender The sender's public key identifier, or empty for the default identity.
   * @param recipients The recipients' public key identifiers.
   * @return The digest the sender's copy was stored under.
   * @throws UnknownSenderException if {@code sender} is not one of this node's keys.
   */
  public byte[] store(final byte[] message, final String sender, final List<String> recipients) {
    return storeTimer.record(() -> {
      BoxKeyPair senderIdentity = resolveSender(sender);
      byte[] senderPublicKey = senderIdentity.getPublicKey();
      CryptoKey senderPrivateKey = senderIdentity.getPrivateKey();

      try (CryptoKey masterKey = crypto.generateMasterKey()) {
        SealedPayload sealedPayload = crypto.sealPayload(message, masterKey);
        byte[] recipientNonce = crypto.generateNonce();
        EncryptedPayload envelope = new EncryptedPayload(senderPublicKey, sealedPayload.getCipherText(),
            sealedPayload.getNonce(), recipientNonce, ImmutableList.of());

        distribute(envelope, masterKey, senderIdentity,
            recipients == null ? Collections.<String>emptyList() : recipients);

        byte[] selfBox = crypto.sealMasterKey(masterKey, recipientNonce, senderPublicKey, senderPrivateKey);
        EncryptedPayload selfCopy = envelope.withRecipientBox(selfBox);
        return persist(selfCopy, payloadCodec.encode(selfCopy));
      }
    });
  }

  /**
   * Stores an envelope built elsewhere, typically one pushed by a peer, exactly as received.
   *
   * @param encodedEnvelope The encoded envelope.
   * @return The digest it was stored under.
   * @throws EnclaveException if the bytes are not a well formed envelope with a recipient box.
   */
  public byte[] storeRaw(final byte[] encodedEnvelope) {
    return storeRawTimer.record(() -> {
      EncryptedPayload envelope = payloadCodec.decode(encodedEnvelope);
      if (envelope.getRecipientBoxes().isEmpty()) {
        throw new EnclaveException("encrypted payload carries no recipient box");
      }
      return persist(envelope, encodedEnvelope);
    });
  }

  /**
   * Opens the payload stored under a digest. A copy this node sealed opens with the identity that sealed it, any
   * other copy with this node's default identity.
   *
   * @param digest The digest returned by {@link #store} or {@link #storeRaw}.
   * @return The plaintext.
   * @throws com.crux.enclave.exceptions.PayloadNotFoundException if nothing is stored under the digest.
   * @throws com.crux.enclave.exceptions.UnsealException if the stored copy is not addressed to this node or has been
   *         tampered with.
   */
  public byte[] retrieve(final byte[] digest) {
    return retrieveTimer.record(() -> {
      EncryptedPayload envelope = payloadCodec.decode(contentStore.get(digest));
      if (envelope.getRecipientBoxes().isEmpty()) {
        throw new EnclaveException("stored payload carries no recipient box");
      }

      BoxKeyPair identity = resolveOpener(envelope.getSender());
      try (CryptoKey masterKey = crypto.openMasterKey(envelope.getRecipientBoxes().get(0),
          envelope.getRecipientNonce(), envelope.getSender(), identity.getPrivateKey())) {
        return crypto.openPayload(envelope.getCipherText(), envelope.getNonce(), masterKey);
      }
    });
  }

  /**
   * Deletes the payload stored under a digest. Keys and the party directory are not affected.
   *
   * @param digest The digest.
   * @throws com.crux.enclave.exceptions.PayloadNotFoundException if nothing is stored under the digest.
   */
  public void delete(final byte[] digest) {
    contentStore.delete(digest);
  }

  /**
   * Merges a directory snapshot received from a peer. Never fails: undecodable snapshots are logged and ignored.
   *
   * @param encodedPartyInfo The encoded snapshot.
   */
  public void mergeDirectory(final byte[] encodedPartyInfo) {
    try {
      partyDirectory.merge(partyInfoCodec.decode(encodedPartyInfo));
    }
    catch (EnclaveException e) {
      logger.warn("ignoring party info that could not be decoded", e);
    }
  }

  /**
   * Encodes the directory snapshot this node advertises to its peers.
   *
   * @return The encoded snapshot.
   */
  public byte[] encodePartyInfo() {
    return partyInfoCodec.encode(partyDirectory.getPartyInfo());
  }

  /**
   * Looks up the node a recipient lives on.
   *
   * @param publicKey The recipient's public key identifier.
   * @return The node url, if known.
   */
  public Optional<String> resolve(final String publicKey) {
    return partyDirectory.resolve(publicKey);
  }

  @VisibleForTesting
  PartyDirectory getPartyDirectory() {
    return partyDirectory;
  }

  BoxKeyPair resolveSender(final String sender) {
    if (sender == null || sender.isEmpty()) {
      return keyRing.getDefaultIdentity();
    }

    try {
      return keyRing.resolveKeyPair(PublicKeys.decode(sender));
    }
    catch (MalformedKeyException | KeyNotFoundException e) {
      logger.error("Unable to locate private key for sender public key {}", sender);
      throw new UnknownSenderException("unknown sender " + sender, e);
    }
  }

  /**
   * Picks the identity that opens a stored copy. The sender's own copy is boxed to the sender's key pair, so it opens
   * with that pair. Copies pushed by other nodes open with the default identity.
   */
  private BoxKeyPair resolveOpener(final byte[] sender) {
    return keyRing.findKeyPair(sender).orElse(keyRing.getDefaultIdentity());
  }

  private void distribute(final EncryptedPayload envelope, final CryptoKey masterKey,
      final BoxKeyPair senderIdentity, final List<String> recipients) {
    byte[] senderPublicKey = senderIdentity.getPublicKey();
    Set<String> seen = new HashSet<>();

    for (String recipient : recipients) {
      byte[] recipientKey;
      try {
        recipientKey = PublicKeys.decode(recipient);
      }
      catch (MalformedKeyException e) {
        logger.error("Unable to load recipient {}: {}", recipient, e.getMessage());
        continue;
      }

      if (Arrays.equals(recipientKey, senderPublicKey)) {
        logger.warn("Sender cannot be recipient, skipping {}", recipient);
        continue;
      }

      String recipientId = PublicKeys.encode(recipientKey);
      if (!seen.add(recipientId)) {
        logger.debug("recipient {} listed more than once", recipientId);
        continue;
      }

      Optional<String> url = partyDirectory.resolve(recipientId);
      if (!url.isPresent()) {
        logger.warn("Unable to resolve host for recipient {}", recipientId);
        continue;
      }

      byte[] recipientBox;
      try {
        recipientBox = crypto.sealMasterKey(masterKey, envelope.getRecipientNonce(), recipientKey,
            senderIdentity.getPrivateKey());
      }
      catch (MalformedKeyException e) {
        logger.error("Unable to seal master key for recipient {}: {}", recipientId, e.getMessage());
        continue;
      }

      push(envelope.withRecipientBox(recipientBox), url.get());
    }
  }

  private void push(final EncryptedPayload recipientCopy, final String url) {
    try {
      peerPushClient.push(recipientCopy, url);
    }
    catch (RuntimeException e) {
      logger.warn("push to {} failed", url, e);
    }
  }

  private byte[] persist(final EncryptedPayload envelope, final byte[] encodedEnvelope) {
    byte[] digest = ContentStore.digestOf(envelope.getCipherText());
    contentStore.put(digest, encodedEnvelope);
    return digest;
  }

  /**
   * Waits for pushes still in flight, then closes the content store and wipes the key ring.
   */
  @Override
  public void close() {
    closeQuietly(peerPushClient, "peer push client");
    closeQuietly(contentStore, "content store");
    closeQuietly(keyRing, "key ring");
  }

  private static void closeQuietly(final SafeAutoCloseable closeable, final String name) {
    try {
      closeable.close();
    }
    catch (Exception e) {
      logger.error("unexpected exception closing {}", name, e);
    }
  }

  public static final class Builder {
    private KeyRing keyRing;
    private ByteStore byteStore;
    private PartyDirectory partyDirectory;
    private PeerPushClient peerPushClient;
    private EnvelopeCrypto envelopeCrypto = new EnvelopeCrypto();
    private EncryptedPayloadCodec payloadCodec = new JsonEncryptedPayloadCodec();
    private PartyInfoCodec partyInfoCodec = new JsonPartyInfoCodec();

    private Builder() {
    }

    public Builder withKeyRing(final KeyRing ring) {
      this.keyRing = ring;
      return this;
    }

    public Builder withByteStore(final ByteStore store) {
      this.byteStore = store;
      return this;
    }

    public Builder withPartyDirectory(final PartyDirectory directory) {
      this.partyDirectory = directory;
      return this;
    }

    /**
     * Specifies how envelope copies reach other nodes. Defaults to {@link HttpPeerPushClient}.
     *
     * @param client The push client.
     * @return The current {@code Builder} step.
     */
    public Builder withPeerPushClient(final PeerPushClient client) {
      this.peerPushClient = client;
      return this;
    }

    public Builder withEnvelopeCrypto(final EnvelopeCrypto crypto) {
      this.envelopeCrypto = crypto;
      return this;
    }

    public Builder withPayloadCodec(final EncryptedPayloadCodec codec) {
      this.payloadCodec = codec;
      return this;
    }

    public Builder withPartyInfoCodec(final PartyInfoCodec codec) {
      this.partyInfoCodec = codec;
      return this;
    }

    /**
     * Builds the {@code Enclave} object.
     *
     * @return The fully instantiated {@code Enclave} object.
     * @throws IllegalStateException if the key ring, byte store or party directory is missing.
     */
    public Enclave build() {
      if (keyRing == null || byteStore == null || partyDirectory == null) {
        throw new IllegalStateException("key ring, byte store and party directory are required");
      }

      PeerPushClient client = peerPushClient != null ? peerPushClient : new HttpPeerPushClient(payloadCodec);
      return new Enclave(keyRing, envelopeCrypto, new ContentStore(byteStore), partyDirectory, client,
          payloadCodec, partyInfoCodec);
    }
  }
}
