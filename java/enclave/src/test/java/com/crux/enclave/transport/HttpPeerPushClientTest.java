package com.crux.enclave.transport;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Collections;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.crux.enclave.envelope.EncryptedPayload;
import com.crux.enclave.envelope.EncryptedPayloadCodec;

@ExtendWith(MockitoExtension.class)
class HttpPeerPushClientTest {
  @Mock
  HttpClient httpClientMock;

  @Mock
  EncryptedPayloadCodec codecMock;

  private final EncryptedPayload payload =
      new EncryptedPayload(new byte[32], new byte[]{7}, new byte[24], new byte[24], Collections.emptyList());

  private HttpPeerPushClient pushClient;

  @BeforeEach
  void setUp() {
    pushClient = new HttpPeerPushClient(httpClientMock, codecMock, Duration.ofSeconds(1));
  }

  @Test
  void testPushUri() {
    assertEquals(URI.create("http://node-b:9000/push"), HttpPeerPushClient.pushUri("http://node-b:9000"));
    assertEquals(URI.create("http://node-b:9000/push"), HttpPeerPushClient.pushUri("http://node-b:9000/"));
  }

  @Test
  void testPushPostsEncodedEnvelope() {
    when(codecMock.encode(payload)).thenReturn(new byte[]{1, 2, 3});
    doReturn(new CompletableFuture<>()).when(httpClientMock).sendAsync(any(), any());

    pushClient.push(payload, "http://node-b");

    ArgumentCaptor<HttpRequest> requestCaptor = ArgumentCaptor.forClass(HttpRequest.class);
    verify(httpClientMock).sendAsync(requestCaptor.capture(), any());
    HttpRequest request = requestCaptor.getValue();
    assertEquals("POST", request.method());
    assertEquals(URI.create("http://node-b/push"), request.uri());
    assertEquals(3L, request.bodyPublisher().get().contentLength());
  }

  @Test
  void testFailedPushDoesNotThrow() {
    when(codecMock.encode(payload)).thenReturn(new byte[]{1});
    CompletableFuture<Object> failed = new CompletableFuture<>();
    failed.completeExceptionally(new IOException("connection refused"));
    doReturn(failed).when(httpClientMock).sendAsync(any(), any());

    assertDoesNotThrow(() -> pushClient.push(payload, "http://node-b"));
  }

  @Test
  void testInvalidUrlDoesNotThrow() {
    assertDoesNotThrow(() -> pushClient.push(payload, "not a url"));
    verify(httpClientMock, never()).sendAsync(any(), any());
  }

  @Test
  void testCloseWaitsForPushInFlight() {
    when(codecMock.encode(payload)).thenReturn(new byte[]{1});
    @SuppressWarnings("unchecked")
    HttpResponse<Void> response = mock(HttpResponse.class);
    when(response.statusCode()).thenReturn(200);
    CompletableFuture<HttpResponse<Void>> sent = new CompletableFuture<>();
    doReturn(sent).when(httpClientMock).sendAsync(any(), any());

    pushClient.push(payload, "http://node-b");
    assertEquals(1, pushClient.pendingCount());
    CompletableFuture.delayedExecutor(200, TimeUnit.MILLISECONDS).execute(() -> sent.complete(response));

    pushClient.close();

    assertTrue(sent.isDone());
    verify(response).statusCode();
  }

  @Test
  void testCloseAbandonsPushAfterTimeout() {
    HttpPeerPushClient shortTimeoutClient =
        new HttpPeerPushClient(httpClientMock, codecMock, Duration.ofMillis(100));
    when(codecMock.encode(payload)).thenReturn(new byte[]{1});
    doReturn(new CompletableFuture<>()).when(httpClientMock).sendAsync(any(), any());

    shortTimeoutClient.push(payload, "http://node-b");

    assertTimeout(Duration.ofSeconds(5), shortTimeoutClient::close);
    assertEquals(1, shortTimeoutClient.pendingCount());
  }

  @Test
  void testCloseWithNothingInFlight() {
    assertTimeout(Duration.ofSeconds(1), pushClient::close);
    verifyNoInteractions(httpClientMock);
  }
}
