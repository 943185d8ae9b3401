package com.crux.enclave.partyinfo;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/**
 * A node's view of the network: its own url, the url to reach each known recipient public key at, and the urls of
 * all known nodes. Instances are immutable snapshots.
 */
public final class PartyInfo {
  private final String url;
  private final ImmutableMap<String, String> recipients;
  private final ImmutableSet<String> parties;

  /**
   * Creates a new {@code PartyInfo}.
   *
   * @param url The url of the node this information describes.
   * @param recipients Public key identifier to node url.
   * @param parties Known node urls.
   */
  public PartyInfo(final String url, final Map<String, String> recipients, final Set<String> parties) {
    this.url = url;
    this.recipients = ImmutableMap.copyOf(recipients);
    this.parties = ImmutableSet.copyOf(parties);
  }

  public String getUrl() {
    return url;
  }

  public Map<String, String> getRecipients() {
    return recipients;
  }

  public Set<String> getParties() {
    return parties;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }

    PartyInfo other = (PartyInfo) o;
    return Objects.equals(url, other.url)
        && recipients.equals(other.recipients)
        && parties.equals(other.parties);
  }

  @Override
  public int hashCode() {
    return Objects.hash(url, recipients, parties);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("url", url)
        .add("recipients", recipients)
        .add("parties", parties)
        .toString();
  }
}
