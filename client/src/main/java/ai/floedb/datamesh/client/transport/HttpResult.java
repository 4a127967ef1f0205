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

import ai.floedb.datamesh.model.DatameshJson;
import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/** Status, headers and fully-read body of a response. */
public record HttpResult(int status, Map<String, List<String>> headers, byte[] body) {

  public HttpResult {
    headers = headers == null ? Map.of() : headers;
    body = body == null ? new byte[0] : body;
  }

  public static HttpResult of(int status, String body) {
    return new HttpResult(status, Map.of(), body.getBytes(StandardCharsets.UTF_8));
  }

  public boolean isSuccess() {
    return status >= 200 && status < 300;
  }

  public String text() {
    return new String(body, StandardCharsets.UTF_8);
  }

  public Optional<String> header(String name) {
    for (Map.Entry<String, List<String>> e : headers.entrySet()) {
      if (e.getKey() != null
          && e.getKey().toLowerCase(Locale.ROOT).equals(name.toLowerCase(Locale.ROOT))
          && !e.getValue().isEmpty()) {
        return Optional.of(e.getValue().get(0));
      }
    }
    return Optional.empty();
  }

  public JsonNode json() {
    try {
      return DatameshJson.mapper().readTree(body);
    } catch (IOException e) {
      throw new UncheckedIOException("Response body is not JSON (status " + status + ")", e);
    }
  }

  /** The {@code detail} message of a JSON error body, if the body has one. */
  public Optional<String> detail() {
    try {
      JsonNode node = DatameshJson.mapper().readTree(body);
      if (node != null && node.hasNonNull("detail")) {
        JsonNode d = node.get("detail");
        return Optional.of(d.isTextual() ? d.asText() : d.toString());
      }
    } catch (IOException e) {
      return Optional.empty();
    }
    return Optional.empty();
  }
}
