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

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandlers;
import java.time.Duration;

/** {@link HttpSender} on the JDK HTTP client. */
public final class JdkHttpSender implements HttpSender {

  private final HttpClient client;

  public JdkHttpSender(Duration connectTimeout) {
    HttpClient.Builder b =
        HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .followRedirects(HttpClient.Redirect.NORMAL);
    if (connectTimeout != null) {
      b.connectTimeout(connectTimeout);
    }
    this.client = b.build();
  }

  @Override
  public HttpResult send(HttpRequestSpec request) throws IOException, InterruptedException {
    HttpRequest.BodyPublisher body =
        request.body() == null
            ? HttpRequest.BodyPublishers.noBody()
            : HttpRequest.BodyPublishers.ofByteArray(request.body());
    var req = HttpRequest.newBuilder().uri(request.uri()).method(request.method(), body);
    if (request.timeout() != null) {
      req.timeout(request.timeout());
    }
    request.headers().forEach(req::header);

    HttpResponse<byte[]> resp = client.send(req.build(), BodyHandlers.ofByteArray());
    return new HttpResult(resp.statusCode(), resp.headers().map(), resp.body());
  }
}
