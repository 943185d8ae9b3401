package com.crux.enclave.partyinfo;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.crux.enclave.exceptions.EnclaveException;
import com.crux.enclave.utils.Json;

/**
 * Encodes a {@link PartyInfo} as a UTF-8 json document:
 * <pre>
 * {
 *   "Url": "http://node-a:9000",
 *   "Recipients": { public key: url, ... },
 *   "Parties": [ url, ... ]
 * }
 * </pre>
 */
public class JsonPartyInfoCodec implements PartyInfoCodec {
  private static final Logger logger = LoggerFactory.getLogger(JsonPartyInfoCodec.class);

  static final String URL = "Url";
  static final String RECIPIENTS = "Recipients";
  static final String PARTIES = "Parties";

  @Override
  public byte[] encode(final PartyInfo partyInfo) {
    Json json = new Json();
    json.put(URL, partyInfo.getUrl());

    Json recipients = new Json();
    partyInfo.getRecipients().forEach(recipients::put);
    json.put(RECIPIENTS, recipients);
    json.put(PARTIES, partyInfo.getParties());
    return json.toUtf8();
  }

  @Override
  public PartyInfo decode(final byte[] encoded) {
    if (encoded == null) {
      throw new EnclaveException("party info is missing");
    }

    Json json;
    try {
      json = new Json(encoded);
    }
    catch (JSONException e) {
      throw new EnclaveException("unable to decode party info", e);
    }

    String url = json.getOptionalString(URL).orElse("");

    Map<String, String> recipients = new LinkedHashMap<>();
    json.getOptionalJson(RECIPIENTS).ifPresent(recipientsJson -> {
      JSONObject document = recipientsJson.toJsonObject();
      for (String publicKey : document.keySet()) {
        Object recipientUrl = document.opt(publicKey);
        if (recipientUrl instanceof String) {
          recipients.put(publicKey, (String) recipientUrl);
        }
        else {
          logger.debug("dropping recipient {} with non-string url", publicKey);
        }
      }
    });

    Set<String> parties = new LinkedHashSet<>();
    JSONArray partiesArray = json.toJsonObject().optJSONArray(PARTIES);
    if (partiesArray != null) {
      for (int i = 0; i < partiesArray.length(); i++) {
        Object party = partiesArray.opt(i);
        if (party instanceof String) {
          parties.add((String) party);
        }
        else {
          logger.debug("dropping non-string party at index {}", i);
        }
      }
    }

    return new PartyInfo(url, recipients, parties);
  }
}
