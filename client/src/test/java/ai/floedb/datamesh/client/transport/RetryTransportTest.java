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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import ai.floedb.datamesh.client.metrics.DatameshMetrics;
import ai.floedb.datamesh.error.DatameshConnectException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class RetryTransportTest {

  private final List<Duration> sleeps = new ArrayList<>();
  private final DatameshMetrics metrics = DatameshMetrics.inMemory();
  private final HttpRequestSpec request = HttpRequestSpec.get("http://datamesh.test/info");

  @AfterEach
  void clearInterrupt() {
    Thread.interrupted();
  }

  private RetryTransport transport(HttpSender sender, int retries) {
    return new RetryTransport(sender, retries, Duration.ofSeconds(30), sleeps::add, metrics);
  }

  @Test
  void succeedsOnLastAllowedAttempt() {
    AtomicInteger calls = new AtomicInteger();
    HttpSender flaky =
        r -> {
          if (calls.incrementAndGet() < 3) {
            throw new ConnectException("refused");
          }
          return HttpResult.of(200, "ok");
        };

    HttpResult result = transport(flaky, 3).execute(request);

    assertThat(result.text()).isEqualTo("ok");
    assertThat(calls).hasValue(3);
    assertThat(sleeps).containsExactly(Duration.ofMillis(100), Duration.ofMillis(200));
    assertThat(metrics.total(DatameshMetrics.RETRIES)).isEqualTo(2.0);
  }

  @Test
  void readTimeoutsAreRetriedWithTheSameRequest() throws Exception {
    HttpSender sender = mock(HttpSender.class);
    when(sender.send(any()))
        .thenThrow(new HttpTimeoutException("request timed out"))
        .thenReturn(HttpResult.of(204, ""));

    HttpResult result = transport(sender, 2).execute(request);

    assertThat(result.status()).isEqualTo(204);
    verify(sender, times(2)).send(request);
    assertThat(sleeps).containsExactly(Duration.ofMillis(100));
  }

  @Test
  void exhaustionCarriesLastError() {
    AtomicInteger calls = new AtomicInteger();
    HttpSender down =
        r -> {
          calls.incrementAndGet();
          throw new IOException("connection reset " + calls.get());
        };

    assertThatThrownBy(() -> transport(down, 3).execute(request))
        .isInstanceOf(DatameshConnectException.class)
        .hasMessageContaining("after 3 retries")
        .hasMessageContaining("connection reset 3")
        .hasCauseInstanceOf(IOException.class);
    assertThat(calls).hasValue(3);
    assertThat(sleeps).hasSize(2);
    assertThat(metrics.total(DatameshMetrics.EXHAUSTED)).isEqualTo(1.0);
  }

  @Test
  void badGatewayCoolsDownAndCountsAsFailure() {
    AtomicInteger calls = new AtomicInteger();
    HttpSender gateway =
        r -> {
          calls.incrementAndGet();
          return HttpResult.of(502, "bad gateway");
        };

    assertThatThrownBy(() -> transport(gateway, 2).execute(request))
        .isInstanceOf(DatameshConnectException.class)
        .hasMessageContaining("Bad gateway");
    assertThat(calls).hasValue(2);
    assertThat(sleeps)
        .containsExactly(Duration.ofSeconds(30), Duration.ofMillis(100), Duration.ofSeconds(30));
  }

  @Test
  void otherStatusesAreReturnedUntouched() {
    AtomicInteger calls = new AtomicInteger();
    HttpSender notFound =
        r -> {
          calls.incrementAndGet();
          return HttpResult.of(404, "{\"detail\": \"missing\"}");
        };

    HttpResult result = transport(notFound, 5).execute(request);

    assertThat(result.status()).isEqualTo(404);
    assertThat(result.detail()).contains("missing");
    assertThat(calls).hasValue(1);
    assertThat(sleeps).isEmpty();
  }

  @Test
  void perCallRetriesOverrideDefault() {
    AtomicInteger calls = new AtomicInteger();
    HttpSender down =
        r -> {
          calls.incrementAndGet();
          throw new IOException("down");
        };

    assertThatThrownBy(() -> transport(down, 8).execute(request, 1))
        .isInstanceOf(DatameshConnectException.class);
    assertThat(calls).hasValue(1);
    assertThat(sleeps).isEmpty();
  }

  @Test
  void interruptStopsRetryingAndKeepsFlag() {
    HttpSender down =
        r -> {
          throw new IOException("down");
        };
    RetryTransport transport =
        new RetryTransport(
            down,
            5,
            Duration.ZERO,
            d -> {
              throw new InterruptedException();
            },
            metrics);

    assertThatThrownBy(() -> transport.execute(request))
        .isInstanceOf(DatameshConnectException.class)
        .hasMessageContaining("Interrupted");
    assertThat(Thread.currentThread().isInterrupted()).isTrue();
  }

  @Test
  void rejectsNonPositiveRetries() {
    assertThatThrownBy(() -> transport(r -> HttpResult.of(200, ""), 0))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
