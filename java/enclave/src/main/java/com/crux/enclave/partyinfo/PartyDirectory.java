package com.crux.enclave.partyinfo;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.crux.enclave.exceptions.MalformedKeyException;
import com.crux.enclave.keys.PublicKeys;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * Process wide directory of peer nodes and of the node each recipient public key lives on. The node's own url is
 * fixed at construction. Reads and merges are guarded by a single read/write lock.
 * <p>
 * Snapshots are merged without any signature check, last writer wins. Entries that point at this node's own url are
 * dropped, which stops a peer from redirecting traffic for this node's keys, but nothing stops a peer from publishing
 * false addresses for other nodes' keys.
 */
public class PartyDirectory {
  private static final Logger logger = LoggerFactory.getLogger(PartyDirectory.class);

  private final String selfUrl;
  private final ImmutableList<String> ownPublicKeys;
  private final Map<String, String> recipients = new HashMap<>();
  private final Set<String> parties = new HashSet<>();
  private final ReadWriteLock lock = new ReentrantReadWriteLock();

  /**
   * Creates an empty {@code PartyDirectory}.
   *
   * @param selfUrl This node's url.
   */
  public PartyDirectory(final String selfUrl) {
    this(selfUrl, Collections.emptyList(), Collections.emptyList());
  }

  /**
   * Creates a new {@code PartyDirectory}.
   *
   * @param selfUrl This node's url.
   * @param ownPublicKeys Identifiers of this node's public keys, advertised in {@link #getPartyInfo()} only.
   * @param otherNodes Urls of peers known at startup.
   */
  public PartyDirectory(final String selfUrl, final Collection<String> ownPublicKeys,
      final Collection<String> otherNodes) {
    if (selfUrl == null || selfUrl.trim().isEmpty()) {
      throw new IllegalArgumentException("selfUrl is required");
    }
    this.selfUrl = selfUrl;
    this.ownPublicKeys = ImmutableList.copyOf(ownPublicKeys);
    for (String node : otherNodes) {
      if (isRemote(node)) {
        parties.add(node);
      }
    }
  }

  /**
   * Merges a snapshot received from another node. Recipient entries overwrite any address already known for the same
   * key. Entries pointing at this node, and entries whose key is not a valid public key, are dropped.
   *
   * @param incoming The received snapshot.
   */
  public void merge(final PartyInfo incoming) {
    int merged = 0;
    lock.writeLock().lock();
    try {
      for (Map.Entry<String, String> entry : incoming.getRecipients().entrySet()) {
        String url = entry.getValue();
        if (!isRemote(url)) {
          continue;
        }

        String publicKey;
        try {
          publicKey = PublicKeys.encode(PublicKeys.decode(entry.getKey()));
        }
        catch (MalformedKeyException e) {
          logger.debug("dropping directory entry with malformed key {}", entry.getKey());
          continue;
        }

        String previous = recipients.put(publicKey, url);
        if (previous != null && !previous.equals(url)) {
          logger.info("recipient {} moved from {} to {}", publicKey, previous, url);
        }
        merged++;
      }

      for (String url : incoming.getParties()) {
        if (isRemote(url)) {
          parties.add(url);
        }
      }
    }
    finally {
      lock.writeLock().unlock();
    }
    logger.debug("merged {} recipient(s) from {}", merged, incoming.getUrl());
  }

  /**
   * Looks up the node a recipient lives on.
   *
   * @param publicKey The recipient's public key identifier.
   * @return The node url, or empty if no address is known.
   */
  public Optional<String> resolve(final String publicKey) {
    lock.readLock().lock();
    try {
      return Optional.ofNullable(recipients.get(publicKey));
    }
    finally {
      lock.readLock().unlock();
    }
  }

  public Optional<String> resolve(final byte[] publicKey) {
    return resolve(PublicKeys.encode(publicKey));
  }

  /**
   * Returns the known peer urls, not including this node.
   *
   * @return A copy of the peer set.
   */
  public Set<String> getParties() {
    lock.readLock().lock();
    try {
      return ImmutableSet.copyOf(parties);
    }
    finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Builds the snapshot this node gossips to peers: every known recipient plus this node's own keys at its own url,
   * and every known peer plus this node.
   *
   * @return The snapshot.
   */
  public PartyInfo getPartyInfo() {
    lock.readLock().lock();
    try {
      Map<String, String> advertised = new LinkedHashMap<>(recipients);
      for (String publicKey : ownPublicKeys) {
        advertised.put(publicKey, selfUrl);
      }
      Set<String> advertisedParties = new LinkedHashSet<>(parties);
      advertisedParties.add(selfUrl);
      return new PartyInfo(selfUrl, advertised, advertisedParties);
    }
    finally {
      lock.readLock().unlock();
    }
  }

  private boolean isRemote(final String url) {
    return url != null && !url.trim().isEmpty() && !url.equals(selfUrl);
  }
}
