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

package ai.floedb.datamesh.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Short-lived capability token scoping one logical sequence of requests.
 *
 * <p>This is only the value returned by the service; acquisition and release live in the client's
 * session manager.
 */
public record Session(
    String id,
    String user,
    @JsonProperty("creation_time") @JsonDeserialize(using = Times.LenientInstantDeserializer.class)
        Instant creationTime,
    @JsonProperty("end_time") @JsonDeserialize(using = Times.LenientInstantDeserializer.class)
        Instant endTime,
    boolean write,
    @JsonProperty("allow_multiwrite") boolean allowMultiwrite,
    boolean verified) {

  public static final String HEADER = "X-DATAMESH-SESSIONID";
  public static final String LOCAL_ID = "dummy_session";

  public Session {
    Objects.requireNonNull(id, "id");
  }

  /** Session synthesized for services that predate session negotiation. Never sent anywhere. */
  public static Session local(Duration duration) {
    Instant now = Instant.now();
    return new Session(LOCAL_ID, "dummy_user", now, now.plus(duration), false, false, false);
  }

  public boolean isLocal() {
    return LOCAL_ID.equals(id);
  }

  public Map<String, String> header() {
    return Map.of(HEADER, id);
  }

  /** Copy of {@code headers} with the session header added or replaced. */
  public Map<String, String> withHeader(Map<String, String> headers) {
    Map<String, String> out = new LinkedHashMap<>(headers);
    out.put(HEADER, id);
    return out;
  }
}
