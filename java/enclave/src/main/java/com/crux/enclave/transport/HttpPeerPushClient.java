package com.crux.enclave.transport;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.crux.enclave.envelope.EncryptedPayload;
import com.crux.enclave.envelope.EncryptedPayloadCodec;
import com.crux.enclave.utils.MetricsUtil;

/**
 * Pushes envelopes to {@code <url>/push} as an {@code application/octet-stream} POST. Requests are sent
 * asynchronously; failures are logged and counted, never retried. {@link #close()} waits for pushes in flight.
 */
public class HttpPeerPushClient implements PeerPushClient {
  private static final Logger logger = LoggerFactory.getLogger(HttpPeerPushClient.class);

  static final String PUSH_PATH = "/push";
  static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

  private final Counter failedCounter = Metrics.counter(MetricsUtil.ENCLAVE_METRICS_PREFIX + ".push.failed");

  private final HttpClient httpClient;
  private final EncryptedPayloadCodec codec;
  private final Duration timeout;
  private final Set<CompletableFuture<Void>> pending = ConcurrentHashMap.newKeySet();

  /**
   * Creates a new {@code HttpPeerPushClient} with a default {@link HttpClient}.
   *
   * @param codec The codec used to encode pushed envelopes.
   */
  public HttpPeerPushClient(final EncryptedPayloadCodec codec) {
    this(HttpClient.newBuilder().connectTimeout(DEFAULT_TIMEOUT).build(), codec, DEFAULT_TIMEOUT);
  }

  /**
   * Creates a new {@code HttpPeerPushClient}.
   *
   * @param httpClient The client used to send requests.
   * @param codec The codec used to encode pushed envelopes.
   * @param timeout The request timeout.
   */
  public HttpPeerPushClient(final HttpClient httpClient, final EncryptedPayloadCodec codec, final Duration timeout) {
    this.httpClient = httpClient;
    this.codec = codec;
    this.timeout = timeout;
  }

  @Override
  public void push(final EncryptedPayload payload, final String url) {
    HttpRequest request;
    try {
      request = HttpRequest.newBuilder(pushUri(url))
          .timeout(timeout)
          .header("Content-Type", "application/octet-stream")
          .POST(HttpRequest.BodyPublishers.ofByteArray(codec.encode(payload)))
          .build();
    }
    catch (IllegalArgumentException e) {
      failedCounter.increment();
      logger.warn("unable to push payload to invalid url {}", url, e);
      return;
    }

    CompletableFuture<Void> inFlight = httpClient.sendAsync(request, HttpResponse.BodyHandlers.discarding())
        .handle((response, throwable) -> {
          if (throwable != null) {
            failedCounter.increment();
            logger.warn("push to {} failed", url, throwable);
          }
          else if (response.statusCode() / 100 != 2) {
            failedCounter.increment();
            logger.warn("push to {} rejected with status {}", url, response.statusCode());
          }
          else {
            logger.debug("pushed payload to {}", url);
          }
          return null;
        });
    pending.add(inFlight);
    inFlight.whenComplete((ignored, throwable) -> pending.remove(inFlight));
  }

  int pendingCount() {
    return pending.size();
  }

  /**
   * Waits up to the request timeout for pushes still in flight. Pushes that have not completed by then are
   * abandoned and logged.
   */
  @Override
  public void close() {
    CompletableFuture<?>[] inFlight = pending.toArray(new CompletableFuture<?>[0]);
    if (inFlight.length == 0) {
      return;
    }

    logger.debug("waiting for {} push(es) in flight", inFlight.length);
    try {
      CompletableFuture.allOf(inFlight).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
    catch (TimeoutException e) {
      logger.warn("abandoning {} push(es) still in flight after {}", pending.size(), timeout);
    }
    catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.warn("interrupted while waiting for {} push(es) in flight", pending.size());
    }
    catch (ExecutionException e) {
      // tracked futures handle their own failures
      logger.error("unexpected push failure", e);
    }
  }

  static URI pushUri(final String url) {
    String base = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    return URI.create(base + PUSH_PATH);
  }
}
