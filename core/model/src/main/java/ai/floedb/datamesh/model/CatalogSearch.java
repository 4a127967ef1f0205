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

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Catalog search criteria. All fields are optional; an empty search lists every datasource
 * visible to the caller.
 */
public record CatalogSearch(
    String search, TimeFilter timefilter, GeoFilter geofilter, Integer limit) {

  private static final Instant OPEN_START =
      LocalDateTime.of(1, 1, 1, 0, 0).toInstant(ZoneOffset.UTC);
  private static final Instant OPEN_END =
      LocalDateTime.of(2500, 1, 1, 0, 0).toInstant(ZoneOffset.UTC);
  private static final DateTimeFormatter RANGE_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

  public static final CatalogSearch ALL = new CatalogSearch(null, null, null, null);

  public CatalogSearch {
    if (limit != null && limit <= 0) {
      throw new IllegalArgumentException("limit must be positive");
    }
  }

  public static CatalogSearch text(String search) {
    return new CatalogSearch(search, null, null, null);
  }

  /** Query parameters understood by the metadata service's datasource listing. */
  public Map<String, String> toParams(Instant now) {
    Map<String, String> q = new LinkedHashMap<>();
    if (limit != null) {
      q.put("limit", Integer.toString(limit));
    }
    if (search != null && !search.isBlank()) {
      q.put("search", search);
    }
    if (timefilter != null) {
      Instant start = timefilter.start() == null ? OPEN_START : timefilter.start().resolve(now);
      Instant end = timefilter.end() == null ? OPEN_END : timefilter.end().resolve(now);
      q.put("in_trange", RANGE_FORMAT.format(start) + "Z," + RANGE_FORMAT.format(end) + "Z");
    }
    if (geofilter != null) {
      q.put("geom_intersects", GeoJsonWkt.toWkt(geofilter));
    }
    return q;
  }
}
