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

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * One HTTP exchange to perform: method, absolute URL, headers, query parameters, optional body
 * and read timeout ({@code null} waits indefinitely).
 */
public record HttpRequestSpec(
    String method,
    String url,
    Map<String, String> headers,
    Map<String, String> params,
    byte[] body,
    Duration timeout) {

  public HttpRequestSpec {
    Objects.requireNonNull(method, "method");
    Objects.requireNonNull(url, "url");
    headers = copy(headers);
    params = copy(params);
  }

  private static Map<String, String> copy(Map<String, String> values) {
    return values == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  public static HttpRequestSpec get(String url) {
    return new HttpRequestSpec("GET", url, null, null, null, null);
  }

  public static HttpRequestSpec of(String method, String url) {
    return new HttpRequestSpec(method, url, null, null, null, null);
  }

  public HttpRequestSpec withHeaders(Map<String, String> replacement) {
    return new HttpRequestSpec(method, url, replacement, params, body, timeout);
  }

  public HttpRequestSpec withHeader(String name, String value) {
    Map<String, String> h = new LinkedHashMap<>(headers);
    h.put(name, value);
    return withHeaders(h);
  }

  public HttpRequestSpec withParams(Map<String, String> replacement) {
    return new HttpRequestSpec(method, url, headers, replacement, body, timeout);
  }

  public HttpRequestSpec withBody(byte[] replacement) {
    return new HttpRequestSpec(method, url, headers, params, replacement, timeout);
  }

  public HttpRequestSpec withTimeout(Duration replacement) {
    return new HttpRequestSpec(method, url, headers, params, body, replacement);
  }

  /** URL with the form-encoded query parameters appended. */
  public URI uri() {
    if (params.isEmpty()) {
      return URI.create(url);
    }
    StringJoiner query = new StringJoiner("&");
    params.forEach(
        (k, v) ->
            query.add(
                URLEncoder.encode(k, StandardCharsets.UTF_8)
                    + "="
                    + URLEncoder.encode(v, StandardCharsets.UTF_8)));
    return URI.create(url + (url.contains("?") ? "&" : "?") + query);
  }

  @Override
  public String toString() {
    return method + " " + url;
  }
}
