/*
 * Copyright 2026 Yellowbrick Data, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ai.floedb.datamesh.client.transport;

import ai.floedb.datamesh.client.metrics.DatameshMetrics;
import ai.floedb.datamesh.error.DatameshConnectException;
import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import org.jboss.logging.Logger;

/**
 * Sends requests with bounded retries on connection-level failures.
 *
 * <p>IOExceptions (refused connections, connect and read timeouts) are retried with a backoff of
 * {@code 0.1 * 2^attempt} seconds. A {@code 502} response is held for the bad-gateway cooldown and
 * then counted as a failed attempt, so a persistent 502 ends in a {@link DatameshConnectException}
 * rather than a response. Every other status is returned as is.
 */
public final class RetryTransport {

  private static final Logger LOG = Logger.getLogger(RetryTransport.class);

  static final int BAD_GATEWAY = 502;
  static final long BACKOFF_BASE_MILLIS = 100;

  /** Blocking pause between attempts. */
  @FunctionalInterface
  public interface Sleeper {
    Sleeper THREAD = d -> Thread.sleep(d.toMillis());

    void sleep(Duration duration) throws InterruptedException;
  }

  private final HttpSender sender;
  private final int defaultRetries;
  private final Duration badGatewayCooldown;
  private final Sleeper sleeper;
  private final DatameshMetrics metrics;

  public RetryTransport(
      HttpSender sender,
      int defaultRetries,
      Duration badGatewayCooldown,
      Sleeper sleeper,
      DatameshMetrics metrics) {
    if (defaultRetries < 1) {
      throw new IllegalArgumentException("retries must be at least 1");
    }
    this.sender = Objects.requireNonNull(sender, "sender");
    this.defaultRetries = defaultRetries;
    this.badGatewayCooldown = Objects.requireNonNull(badGatewayCooldown, "badGatewayCooldown");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  public int defaultRetries() {
    return defaultRetries;
  }

  public HttpResult execute(HttpRequestSpec request) {
    return execute(request, defaultRetries);
  }

  /**
   * @param retries total number of attempts before giving up
   * @throws DatameshConnectException when every attempt failed, carrying the last failure
   */
  public HttpResult execute(HttpRequestSpec request, int retries) {
    if (retries < 1) {
      throw new IllegalArgumentException("retries must be at least 1");
    }
    Exception last = null;
    for (int attempt = 0; attempt < retries; attempt++) {
      try {
        HttpResult result = sender.send(request);
        if (result.status() != BAD_GATEWAY) {
          return result;
        }
        last = new IOException("Bad gateway from " + request.url() + ": " + result.text());
        metrics.recordRetry(request.method(), "bad_gateway");
        LOG.debugf("%s returned 502, cooling down for %s", request, badGatewayCooldown);
        sleeper.sleep(badGatewayCooldown);
      } catch (IOException e) {
        last = e;
        metrics.recordRetry(request.method(), e.getClass().getSimpleName());
        LOG.debugf("%s failed on attempt %d of %d: %s", request, attempt + 1, retries, e);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new DatameshConnectException("Interrupted while requesting " + request.url(), e);
      }
      if (attempt + 1 < retries) {
        try {
          sleeper.sleep(Duration.ofMillis(BACKOFF_BASE_MILLIS << Math.min(attempt, 20)));
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new DatameshConnectException("Interrupted while requesting " + request.url(), e);
        }
      }
    }
    metrics.recordExhausted(request.method());
    LOG.warnf("Giving up on %s after %d attempts", request, retries);
    throw new DatameshConnectException(
        "Failed to connect to " + request.url() + " after " + retries + " retries with error: "
            + last,
        last);
  }
}
