package com.crux.enclave;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import java.util.Arrays;
import java.util.Optional;

import org.bouncycastle.util.encoders.Hex;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.crux.enclave.exceptions.PayloadNotFoundException;
import com.crux.enclave.persistence.ByteStore;

@ExtendWith(MockitoExtension.class)
class ContentStoreTest {
  private static final byte[] DIGEST = {1, 2, 3};
  private static final byte[] ENVELOPE = {4, 5, 6};

  @Mock
  ByteStore byteStoreMock;

  private ContentStore contentStore;

  @BeforeEach
  void setUp() {
    contentStore = new ContentStore(byteStoreMock);
  }

  @Test
  void testDigestOfEmptyInput() {
    assertArrayEquals(Hex.decode("a69f73cca23a9ac5c8b567dc185a756e97c982164fe25859e0d1dcc1475c80a6"
        + "15b2123af1f5f94c11e3e9402c3ac558f500199d95b6d3e301758586281dcd26"), ContentStore.digestOf(new byte[0]));
  }

  @Test
  void testDigestIsDeterministic() {
    byte[] digest = ContentStore.digestOf(new byte[]{1, 2, 3});

    assertEquals(64, digest.length);
    assertArrayEquals(digest, ContentStore.digestOf(new byte[]{1, 2, 3}));
    assertFalse(Arrays.equals(digest, ContentStore.digestOf(new byte[]{1, 2, 4})));
  }

  @Test
  void testPut() {
    contentStore.put(DIGEST, ENVELOPE);
    verify(byteStoreMock).put(DIGEST, ENVELOPE);
  }

  @Test
  void testGet() {
    when(byteStoreMock.get(DIGEST)).thenReturn(Optional.of(ENVELOPE));
    assertArrayEquals(ENVELOPE, contentStore.get(DIGEST));
  }

  @Test
  void testGetUnknownShouldFail() {
    when(byteStoreMock.get(DIGEST)).thenReturn(Optional.empty());
    assertThrows(PayloadNotFoundException.class, () -> contentStore.get(DIGEST));
  }

  @Test
  void testDelete() {
    when(byteStoreMock.delete(DIGEST)).thenReturn(true);
    contentStore.delete(DIGEST);
    verify(byteStoreMock).delete(DIGEST);
  }

  @Test
  void testDeleteUnknownShouldFail() {
    when(byteStoreMock.delete(DIGEST)).thenReturn(false);
    assertThrows(PayloadNotFoundException.class, () -> contentStore.delete(DIGEST));
  }
}
