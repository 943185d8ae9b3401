package com.crux.enclave.partyinfo;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

import com.crux.enclave.exceptions.EnclaveException;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

class JsonPartyInfoCodecTest {
  private final JsonPartyInfoCodec codec = new JsonPartyInfoCodec();

  @Test
  void testEncodeDecode() {
    PartyInfo partyInfo = new PartyInfo("http://node-a",
        ImmutableMap.of("key1", "http://node-b", "key2", "http://node-c"),
        ImmutableSet.of("http://node-b", "http://node-c"));

    assertEquals(partyInfo, codec.decode(codec.encode(partyInfo)));
  }

  @Test
  void testDecodeIsLenient() {
    String encoded = "{\"Recipients\":{\"key1\":\"http://node-b\",\"key2\":7},\"Parties\":[\"http://node-b\",false]}";

    PartyInfo decoded = codec.decode(encoded.getBytes(StandardCharsets.UTF_8));

    assertEquals("", decoded.getUrl());
    assertEquals(ImmutableMap.of("key1", "http://node-b"), decoded.getRecipients());
    assertEquals(ImmutableSet.of("http://node-b"), decoded.getParties());
  }

  @Test
  void testDecodeEmptyObject() {
    PartyInfo decoded = codec.decode("{}".getBytes(StandardCharsets.UTF_8));

    assertTrue(decoded.getRecipients().isEmpty());
    assertTrue(decoded.getParties().isEmpty());
  }

  @Test
  void testDecodeInvalidJsonShouldFail() {
    assertThrows(EnclaveException.class, () -> codec.decode("[1, 2".getBytes(StandardCharsets.UTF_8)));
  }

  @Test
  void testDecodeNullShouldFail() {
    assertThrows(EnclaveException.class, () -> codec.decode(null));
  }
}
