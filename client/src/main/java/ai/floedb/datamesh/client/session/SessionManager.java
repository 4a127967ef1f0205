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

import ai.floedb.datamesh.client.metrics.DatameshMetrics;
import ai.floedb.datamesh.client.transport.HttpRequestSpec;
import ai.floedb.datamesh.client.transport.HttpResult;
import ai.floedb.datamesh.client.transport.RetryTransport;
import ai.floedb.datamesh.error.DatameshException;
import ai.floedb.datamesh.error.DatameshSessionException;
import ai.floedb.datamesh.model.DatameshJson;
import ai.floedb.datamesh.model.Session;
import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import org.jboss.logging.Logger;

/**
 * Acquires and releases datamesh sessions.
 *
 * <p>Legacy services have no session endpoint; a local session is synthesized and releasing it
 * does nothing. Prefer {@link #withSession(Function)}, which releases on every exit path and
 * finalises writes only when the work completed normally.
 */
public final class SessionManager {

  private static final Logger LOG = Logger.getLogger(SessionManager.class);

  public static final Duration DEFAULT_LOCAL_DURATION = Duration.ofHours(1);

  private final RetryTransport transport;
  private final String gateway;
  private final Map<String, String> authHeaders;
  private final boolean legacy;
  private final Duration duration;
  private final Duration readTimeout;
  private final DatameshMetrics metrics;

  /**
   * @param duration requested session length, or {@code null} for the service default
   */
  public SessionManager(
      RetryTransport transport,
      String gateway,
      Map<String, String> authHeaders,
      boolean legacy,
      Duration duration,
      Duration readTimeout,
      DatameshMetrics metrics) {
    this.transport = Objects.requireNonNull(transport, "transport");
    this.gateway = Objects.requireNonNull(gateway, "gateway");
    this.authHeaders = Map.copyOf(authHeaders);
    this.legacy = legacy;
    this.duration = duration;
    this.readTimeout = readTimeout;
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  public boolean isLegacy() {
    return legacy;
  }

  public SessionLease acquire() {
    return acquire(false);
  }

  /**
   * @param allowMultiwrite let other sessions write to a datasource this session writes to
   * @throws DatameshSessionException when the service does not grant a session
   */
  public SessionLease acquire(boolean allowMultiwrite) {
    if (legacy) {
      return new SessionLease(
          Session.local(Objects.requireNonNullElse(duration, DEFAULT_LOCAL_DURATION)), this);
    }
    Map<String, String> headers = new LinkedHashMap<>(authHeaders);
    headers.put("Cache-Control", "no-store");
    Map<String, String> params = new LinkedHashMap<>();
    if (duration != null) {
      params.put("duration", Double.toString(duration.toMillis() / 3_600_000d));
    }
    params.put("allow_multiwrite", Boolean.toString(allowMultiwrite));
    HttpRequestSpec request =
        HttpRequestSpec.get(gateway + "/session/")
            .withHeaders(headers)
            .withParams(params)
            .withTimeout(readTimeout);
    Session session = fetch(request, "Failed to create session");
    metrics.recordSession("acquired");
    LOG.debugf("Acquired session %s until %s", session.id(), session.endTime());
    return new SessionLease(session, this);
  }

  /**
   * Attaches to an existing session by id. The returned lease releases that session too.
   *
   * @throws DatameshSessionException for legacy services, which have no sessions to resume
   */
  public SessionLease resume(String sessionId) {
    Objects.requireNonNull(sessionId, "sessionId");
    if (legacy) {
      throw new DatameshSessionException(
          "Cannot acquire session from id when using the legacy datamesh API");
    }
    HttpRequestSpec request =
        HttpRequestSpec.get(gateway + "/session/" + sessionId)
            .withHeaders(authHeaders)
            .withTimeout(readTimeout);
    Session session = fetch(request, "Failed to retrieve session " + sessionId);
    metrics.recordSession("resumed");
    return new SessionLease(session, this);
  }

  /**
   * Runs {@code work} under a fresh session. The session is released with its writes finalised
   * when {@code work} returns, and released without finalising when it throws.
   */
  public <T> T withSession(Function<SessionLease, T> work) {
    SessionLease lease = acquire();
    T result;
    try {
      result = work.apply(lease);
    } catch (RuntimeException | Error e) {
      try {
        lease.release(false);
      } catch (RuntimeException suppressed) {
        e.addSuppressed(suppressed);
      }
      throw e;
    }
    lease.release(true);
    return result;
  }

  void release(Session session, boolean finaliseWrite) {
    if (legacy || session.isLocal()) {
      return;
    }
    HttpRequestSpec request =
        HttpRequestSpec.of("DELETE", gateway + "/session/" + session.id())
            .withHeaders(session.header())
            .withParams(Map.of("finalise_write", Boolean.toString(finaliseWrite)))
            .withTimeout(readTimeout);
    HttpResult result;
    try {
      result = transport.execute(request);
    } catch (DatameshException e) {
      if (finaliseWrite) {
        throw new DatameshSessionException("Failed to finalise write: " + e.getMessage(), e);
      }
      LOG.warnf(e, "Failed to close session %s", session.id());
      metrics.recordSession("close_failed");
      return;
    }
    if (result.status() != 204) {
      if (finaliseWrite) {
        throw new DatameshSessionException("Failed to finalise write with error: " + result.text());
      }
      LOG.warnf("Failed to close session %s with error: %s", session.id(), result.text());
      metrics.recordSession("close_failed");
      return;
    }
    metrics.recordSession(finaliseWrite ? "finalised" : "released");
    LOG.debugf("Released session %s (finalise_write=%s)", session.id(), finaliseWrite);
  }

  private Session fetch(HttpRequestSpec request, String failure) {
    HttpResult result;
    try {
      result = transport.execute(request);
    } catch (DatameshException e) {
      throw new DatameshSessionException("Error when acquiring datamesh session: " + e, e);
    }
    if (result.status() != 200) {
      throw new DatameshSessionException(failure + " with error: " + result.text());
    }
    try {
      return DatameshJson.mapper().readValue(result.body(), Session.class);
    } catch (IOException e) {
      throw new DatameshSessionException("Invalid session returned by " + request.url(), e);
    }
  }
}
