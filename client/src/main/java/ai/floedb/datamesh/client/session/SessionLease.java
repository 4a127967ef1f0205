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

import ai.floedb.datamesh.model.Session;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A session held by one logical operation. Released at most once; {@link #close()} releases
 * without finalising pending writes.
 */
public final class SessionLease implements AutoCloseable {

  private final Session session;
  private final SessionManager manager;
  private final AtomicBoolean released = new AtomicBoolean();

  SessionLease(Session session, SessionManager manager) {
    this.session = Objects.requireNonNull(session, "session");
    this.manager = Objects.requireNonNull(manager, "manager");
  }

  public Session session() {
    return session;
  }

  public String id() {
    return session.id();
  }

  /** Copy of {@code headers} with this session's header overlaid. */
  public Map<String, String> headers(Map<String, String> headers) {
    return session.withHeader(headers);
  }

  public boolean isReleased() {
    return released.get();
  }

  /**
   * Ends the session on the service. Only the first call has an effect.
   *
   * @param finaliseWrite commit writes made under this session; a failure to do so is raised
   */
  public void release(boolean finaliseWrite) {
    if (released.compareAndSet(false, true)) {
      manager.release(session, finaliseWrite);
    }
  }

  @Override
  public void close() {
    release(false);
  }

  @Override
  public String toString() {
    return "SessionLease{" + session.id() + (released.get() ? ", released" : "") + "}";
  }
}
