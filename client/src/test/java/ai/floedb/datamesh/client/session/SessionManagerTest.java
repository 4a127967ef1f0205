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

package ai.floedb.datamesh.client.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.floedb.datamesh.client.metrics.DatameshMetrics;
import ai.floedb.datamesh.client.transport.HttpRequestSpec;
import ai.floedb.datamesh.client.transport.ScriptedSender;
import ai.floedb.datamesh.error.DatameshSessionException;
import ai.floedb.datamesh.model.Session;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SessionManagerTest {

  private static final String GATEWAY = "https://gateway.datamesh.test";
  private static final Map<String, String> AUTH = Map.of("Authorization", "Token abc");
  private static final String SESSION =
      "{\"id\": \"s-123\", \"user\": \"ops\", \"creation_time\": \"2026-01-01T00:00:00Z\","
          + " \"end_time\": \"2026-01-01T02:00:00Z\", \"write\": false,"
          + " \"allow_multiwrite\": true, \"verified\": true}";

  private final ScriptedSender sender = new ScriptedSender();
  private final DatameshMetrics metrics = DatameshMetrics.inMemory();

  private SessionManager manager(boolean legacy, Duration duration) {
    return new SessionManager(
        sender.transport(1), GATEWAY, AUTH, legacy, duration, Duration.ofSeconds(5), metrics);
  }

  @Test
  void legacySessionsAreLocal() {
    SessionManager sessions = manager(true, null);

    try (SessionLease lease = sessions.acquire()) {
      assertThat(lease.session().isLocal()).isTrue();
      assertThat(lease.headers(AUTH)).containsEntry(Session.HEADER, Session.LOCAL_ID);
    }
    assertThat(sender.requests()).isEmpty();
  }

  @Test
  void acquireRequestsFreshSession() {
    sender.on("GET", "/session/", 200, SESSION);

    SessionLease lease = manager(false, Duration.ofHours(2)).acquire(true);

    assertThat(lease.id()).isEqualTo("s-123");
    assertThat(lease.session().allowMultiwrite()).isTrue();
    HttpRequestSpec r = sender.requests("GET", "/session/").get(0);
    assertThat(r.headers())
        .containsEntry("Authorization", "Token abc")
        .containsEntry("Cache-Control", "no-store");
    assertThat(r.params())
        .containsEntry("duration", "2.0")
        .containsEntry("allow_multiwrite", "true");
    assertThat(metrics.total(DatameshMetrics.SESSIONS)).isEqualTo(1.0);
  }

  @Test
  void refusedSessionRaises() {
    sender.on("GET", "/session/", 403, "{\"detail\": \"no\"}");

    assertThatThrownBy(() -> manager(false, null).acquire())
        .isInstanceOf(DatameshSessionException.class)
        .hasMessageContaining("Failed to create session");
  }

  @Test
  void finalisingReleaseSendsSessionHeaderOnly() {
    sender.on("GET", "/session/", 200, SESSION).on("DELETE", "/session/s-123", 204, "");

    SessionLease lease = manager(false, null).acquire();
    lease.release(true);
    lease.close();

    HttpRequestSpec r = sender.requests("DELETE", "/session/s-123").get(0);
    assertThat(sender.requests("DELETE", "/session/s-123")).hasSize(1);
    assertThat(r.params()).containsEntry("finalise_write", "true");
    assertThat(r.headers()).containsOnlyKeys(Session.HEADER);
    assertThat(lease.isReleased()).isTrue();
  }

  @Test
  void failedCloseWithoutFinaliseOnlyWarns() {
    sender.on("GET", "/session/", 200, SESSION).on("DELETE", "/session/s-123", 500, "boom");

    SessionLease lease = manager(false, null).acquire();
    lease.close();

    assertThat(lease.isReleased()).isTrue();
    assertThat(
            metrics
                .registry()
                .find(DatameshMetrics.SESSIONS)
                .tag("event", "close_failed")
                .counter()
                .count())
        .isEqualTo(1.0);
  }

  @Test
  void failedFinaliseRaises() {
    sender.on("GET", "/session/", 200, SESSION).on("DELETE", "/session/s-123", 409, "conflict");

    SessionLease lease = manager(false, null).acquire();

    assertThatThrownBy(() -> lease.release(true))
        .isInstanceOf(DatameshSessionException.class)
        .hasMessageContaining("conflict");
  }

  @Test
  void withSessionFinalisesOnlyOnSuccess() {
    sender.on("GET", "/session/", 200, SESSION).on("DELETE", "/session/s-123", 204, "");
    SessionManager sessions = manager(false, null);

    String id = sessions.withSession(SessionLease::id);
    assertThatThrownBy(
            () ->
                sessions.withSession(
                    lease -> {
                      throw new IllegalStateException("write failed");
                    }))
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("write failed");

    assertThat(id).isEqualTo("s-123");
    assertThat(sender.requests("DELETE", "/session/s-123"))
        .extracting(r -> r.params().get("finalise_write"))
        .containsExactly("true", "false");
  }

  @Test
  void resumeFetchesExistingSession() {
    sender.on("GET", "/session/s-123", 200, SESSION);

    assertThat(manager(false, null).resume("s-123").id()).isEqualTo("s-123");
    assertThatThrownBy(() -> manager(true, null).resume("s-123"))
        .isInstanceOf(DatameshSessionException.class)
        .hasMessageContaining("legacy");
  }
}
