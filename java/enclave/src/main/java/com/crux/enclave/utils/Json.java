package com.crux.enclave.utils;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.json.JSONArray;
import org.json.JSONObject;

/**
 * This is a wrapper over {@link org.json.JSONObject} that adds helper methods for the binary fields of envelopes and
 * key files. Binary values are stored as standard Base64 strings.
 */
public class Json {
  private final JSONObject document;

  /**
   * Creates a new, empty {@code Json} instance.
   */
  public Json() {
    document = new JSONObject();
  }

  /**
   * Creates a new {@code Json} instance from the provided {@code JSONObject}.
   *
   * @param jsonObject The {@link org.json.JSONObject} object to wrap.
   */
  public Json(final JSONObject jsonObject) {
    if (jsonObject == null) {
      throw new IllegalArgumentException("jsonObject is null!");
    }
    document = jsonObject;
  }

  /**
   * Creates a new {@code Json} instance from UTF-8 encoded json.
   *
   * @param utf8Json The encoded document.
   * @throws org.json.JSONException if the bytes are not a json object.
   */
  public Json(final byte[] utf8Json) {
    document = new JSONObject(new String(utf8Json, StandardCharsets.UTF_8));
  }

  public Set<String> keySet() {
    return document.keySet();
  }

  public boolean has(final String key) {
    return document.has(key);
  }

  public Json getJson(final String key) {
    return new Json(document.getJSONObject(key));
  }

  /**
   * Gets the nested document associated with a given key.
   *
   * @param key The key whose value needs to be retrieved.
   * @return An {@link Optional} Json value which is empty, if the key does not exist or is not an object.
   */
  public Optional<Json> getOptionalJson(final String key) {
    return Optional.ofNullable(document.optJSONObject(key)).map(Json::new);
  }

  public String getString(final String key) {
    return document.getString(key);
  }

  /**
   * Gets the string associated with a given key.
   *
   * @param key The key whose value needs to be retrieved.
   * @return An {@link Optional} string which is empty, if the key does not exist or is not a string.
   */
  public Optional<String> getOptionalString(final String key) {
    Object value = document.opt(key);
    if (value instanceof String) {
      return Optional.of((String) value);
    }
    return Optional.empty();
  }

  /**
   * Decodes the Base64 string stored under the key into a newly-allocated byte array.
   *
   * @param key The key whose value needs to be retrieved.
   * @return The value associated with the key, as a byte array.
   */
  public byte[] getBytes(final String key) {
    return Base64.getDecoder().decode(document.getString(key));
  }

  /**
   * Decodes an array of Base64 strings stored under the key.
   *
   * @param key The key whose value needs to be retrieved.
   * @return The decoded values, in document order.
   */
  public List<byte[]> getBytesList(final String key) {
    JSONArray array = document.getJSONArray(key);
    List<byte[]> values = new ArrayList<>(array.length());
    for (int i = 0; i < array.length(); i++) {
      values.add(Base64.getDecoder().decode(array.getString(i)));
    }
    return values;
  }

  public JSONArray getJSONArray(final String key) {
    return document.getJSONArray(key);
  }

  public void put(final String key, final String string) {
    document.put(key, string);
  }

  /**
   * Adds a new entry to the {@code Json} object where the value is a {@code byte[]}, stored as Base64.
   *
   * @param key The key to add to the {@code Json} object.
   * @param bytes The value associated with the key.
   */
  public void put(final String key, final byte[] bytes) {
    document.put(key, Base64.getEncoder().encodeToString(bytes));
  }

  /**
   * Adds a new entry to the {@code Json} object where the value is an array of Base64 encoded {@code byte[]}.
   *
   * @param key The key to add to the {@code Json} object.
   * @param byteArrays The values associated with the key.
   */
  public void putBytesList(final String key, final List<byte[]> byteArrays) {
    JSONArray array = new JSONArray();
    for (byte[] bytes : byteArrays) {
      array.put(Base64.getEncoder().encodeToString(bytes));
    }
    document.put(key, array);
  }

  public void put(final String key, final Collection<String> strings) {
    document.put(key, new JSONArray(strings));
  }

  public void put(final String key, final Json json) {
    document.put(key, json.toJsonObject());
  }

  /**
   * Converts the {@code Json} object to UTF-8 bytes.
   *
   * @return The json document as a byte array.
   */
  public byte[] toUtf8() {
    return document.toString().getBytes(StandardCharsets.UTF_8);
  }

  public JSONObject toJsonObject() {
    return document;
  }
}
