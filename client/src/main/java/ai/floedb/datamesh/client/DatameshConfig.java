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

package ai.floedb.datamesh.client;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Connection settings for a {@link DatameshConnector}.
 *
 * <p>A {@code null} timeout means "wait indefinitely". {@code gateway} may be left {@code null},
 * in which case it is derived from the service URL while probing the service version. {@code
 * sessionDuration} is only sent when set; legacy connections fall back to one hour for their
 * local session.
 */
public record DatameshConfig(
    String token,
    URI service,
    URI gateway,
    String user,
    Duration sessionDuration,
    Duration connectTimeout,
    Duration readTimeout,
    Duration stageReadTimeout,
    Duration downloadTimeout,
    Duration writeTimeout,
    Duration chunkReadTimeout,
    Duration chunkWriteTimeout,
    Path cacheDir,
    Duration cacheLockTimeout,
    int retries,
    Duration badGatewayCooldown) {

  public static final URI DEFAULT_SERVICE = URI.create("https://datamesh.oceanum.io");
  public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofMillis(3050);
  public static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(10);
  public static final Duration DEFAULT_STAGE_READ_TIMEOUT = Duration.ofSeconds(900);
  public static final Duration DEFAULT_DOWNLOAD_TIMEOUT = Duration.ofSeconds(900);
  public static final Duration DEFAULT_CHUNK_READ_TIMEOUT = Duration.ofSeconds(60);
  public static final Duration DEFAULT_CHUNK_WRITE_TIMEOUT = Duration.ofSeconds(600);
  public static final Duration DEFAULT_CACHE_LOCK_TIMEOUT = Duration.ofSeconds(60);
  public static final Duration DEFAULT_BAD_GATEWAY_COOLDOWN = Duration.ofSeconds(30);
  public static final int DEFAULT_RETRIES = 8;

  /** Literal used in the environment to switch a timeout off. */
  static final String NO_TIMEOUT = "None";

  public DatameshConfig {
    Objects.requireNonNull(token, "token");
    if (token.isBlank()) {
      throw new IllegalArgumentException(
          "A datamesh token must be supplied or defined in the environment as DATAMESH_TOKEN");
    }
    service = Objects.requireNonNullElse(service, DEFAULT_SERVICE);
    if (service.getScheme() == null || service.getHost() == null) {
      throw new IllegalArgumentException("Service URL needs a scheme and a host: " + service);
    }
    if (sessionDuration != null && (sessionDuration.isNegative() || sessionDuration.isZero())) {
      throw new IllegalArgumentException("Session duration must be positive: " + sessionDuration);
    }
    cacheDir =
        cacheDir == null
            ? Path.of(System.getProperty("java.io.tmpdir"), "datamesh-cache")
            : cacheDir;
    cacheLockTimeout = Objects.requireNonNullElse(cacheLockTimeout, DEFAULT_CACHE_LOCK_TIMEOUT);
    retries = retries <= 0 ? DEFAULT_RETRIES : retries;
    badGatewayCooldown =
        Objects.requireNonNullElse(badGatewayCooldown, DEFAULT_BAD_GATEWAY_COOLDOWN);
  }

  public static Builder builder(String token) {
    return new Builder(token);
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  public static DatameshConfig fromEnvironment() {
    return fromEnvironment(System.getenv());
  }

  /**
   * Reads {@code DATAMESH_*} variables. Unset variables keep their defaults; timeouts set to
   * {@code None} are disabled.
   */
  public static DatameshConfig fromEnvironment(Map<String, String> env) {
    Builder b = new Builder(env.getOrDefault("DATAMESH_TOKEN", ""));
    String service = env.get("DATAMESH_SERVICE");
    if (service != null && !service.isBlank()) {
      b.service(URI.create(service.trim()));
    }
    String gateway = env.get("DATAMESH_GATEWAY");
    if (gateway != null && !gateway.isBlank()) {
      b.gateway(URI.create(gateway.trim()));
    }
    b.user(env.get("DATAMESH_USER"));
    b.connectTimeout(timeout(env, "DATAMESH_CONNECT_TIMEOUT", DEFAULT_CONNECT_TIMEOUT));
    b.readTimeout(timeout(env, "DATAMESH_READ_TIMEOUT", DEFAULT_READ_TIMEOUT));
    b.stageReadTimeout(timeout(env, "DATAMESH_STAGE_READ_TIMEOUT", DEFAULT_STAGE_READ_TIMEOUT));
    b.downloadTimeout(timeout(env, "DATAMESH_DOWNLOAD_TIMEOUT", DEFAULT_DOWNLOAD_TIMEOUT));
    b.writeTimeout(timeout(env, "DATAMESH_WRITE_TIMEOUT", null));
    b.chunkReadTimeout(timeout(env, "DATAMESH_CHUNK_READ_TIMEOUT", DEFAULT_CHUNK_READ_TIMEOUT));
    b.chunkWriteTimeout(
        timeout(env, "DATAMESH_CHUNK_WRITE_TIMEOUT", DEFAULT_CHUNK_WRITE_TIMEOUT));
    String cacheDir = env.get("DATAMESH_CACHE_DIR");
    if (cacheDir != null && !cacheDir.isBlank()) {
      b.cacheDir(Path.of(cacheDir.trim()));
    }
    return b.build();
  }

  static Duration timeout(Map<String, String> env, String key, Duration fallback) {
    String raw = env.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    String v = raw.trim();
    if (NO_TIMEOUT.equalsIgnoreCase(v)) {
      return null;
    }
    try {
      double seconds = Double.parseDouble(v);
      if (seconds < 0) {
        throw new IllegalArgumentException(key + " must not be negative: " + raw);
      }
      return Duration.ofNanos(Math.round(seconds * 1_000_000_000L));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          String.format(Locale.ROOT, "%s must be a number of seconds or None: %s", key, raw), e);
    }
  }

  public static final class Builder {
    private final String token;
    private URI service;
    private URI gateway;
    private String user;
    private Duration sessionDuration;
    private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
    private Duration readTimeout = DEFAULT_READ_TIMEOUT;
    private Duration stageReadTimeout = DEFAULT_STAGE_READ_TIMEOUT;
    private Duration downloadTimeout = DEFAULT_DOWNLOAD_TIMEOUT;
    private Duration writeTimeout;
    private Duration chunkReadTimeout = DEFAULT_CHUNK_READ_TIMEOUT;
    private Duration chunkWriteTimeout = DEFAULT_CHUNK_WRITE_TIMEOUT;
    private Path cacheDir;
    private Duration cacheLockTimeout;
    private int retries = DEFAULT_RETRIES;
    private Duration badGatewayCooldown;

    private Builder(String token) {
      this.token = token;
    }

    private Builder(DatameshConfig c) {
      this.token = c.token;
      this.service = c.service;
      this.gateway = c.gateway;
      this.user = c.user;
      this.sessionDuration = c.sessionDuration;
      this.connectTimeout = c.connectTimeout;
      this.readTimeout = c.readTimeout;
      this.stageReadTimeout = c.stageReadTimeout;
      this.downloadTimeout = c.downloadTimeout;
      this.writeTimeout = c.writeTimeout;
      this.chunkReadTimeout = c.chunkReadTimeout;
      this.chunkWriteTimeout = c.chunkWriteTimeout;
      this.cacheDir = c.cacheDir;
      this.cacheLockTimeout = c.cacheLockTimeout;
      this.retries = c.retries;
      this.badGatewayCooldown = c.badGatewayCooldown;
    }

    public Builder service(URI service) {
      this.service = service;
      return this;
    }

    public Builder service(String service) {
      return service(URI.create(service));
    }

    public Builder gateway(URI gateway) {
      this.gateway = gateway;
      return this;
    }

    public Builder gateway(String gateway) {
      return gateway(URI.create(gateway));
    }

    public Builder user(String user) {
      this.user = user;
      return this;
    }

    public Builder sessionDuration(Duration sessionDuration) {
      this.sessionDuration = sessionDuration;
      return this;
    }

    public Builder connectTimeout(Duration connectTimeout) {
      this.connectTimeout = connectTimeout;
      return this;
    }

    public Builder readTimeout(Duration readTimeout) {
      this.readTimeout = readTimeout;
      return this;
    }

    public Builder stageReadTimeout(Duration stageReadTimeout) {
      this.stageReadTimeout = stageReadTimeout;
      return this;
    }

    public Builder downloadTimeout(Duration downloadTimeout) {
      this.downloadTimeout = downloadTimeout;
      return this;
    }

    public Builder writeTimeout(Duration writeTimeout) {
      this.writeTimeout = writeTimeout;
      return this;
    }

    public Builder chunkReadTimeout(Duration chunkReadTimeout) {
      this.chunkReadTimeout = chunkReadTimeout;
      return this;
    }

    public Builder chunkWriteTimeout(Duration chunkWriteTimeout) {
      this.chunkWriteTimeout = chunkWriteTimeout;
      return this;
    }

    public Builder cacheDir(Path cacheDir) {
      this.cacheDir = cacheDir;
      return this;
    }

    public Builder cacheLockTimeout(Duration cacheLockTimeout) {
      this.cacheLockTimeout = cacheLockTimeout;
      return this;
    }

    public Builder retries(int retries) {
      this.retries = retries;
      return this;
    }

    public Builder badGatewayCooldown(Duration badGatewayCooldown) {
      this.badGatewayCooldown = badGatewayCooldown;
      return this;
    }

    public DatameshConfig build() {
      return new DatameshConfig(
          token,
          service,
          gateway,
          user,
          sessionDuration,
          connectTimeout,
          readTimeout,
          stageReadTimeout,
          downloadTimeout,
          writeTimeout,
          chunkReadTimeout,
          chunkWriteTimeout,
          cacheDir,
          cacheLockTimeout,
          retries,
          badGatewayCooldown);
    }
  }
}
