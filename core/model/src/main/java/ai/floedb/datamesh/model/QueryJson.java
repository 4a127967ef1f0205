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

import com.fasterxml.jackson.core.JsonProcessingException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/** Canonical query serialization and the content hash derived from it. */
public final class QueryJson {

  private QueryJson() {}

  /**
   * Serializes a query with alphabetically ordered properties and map keys. Equal queries,
   * including nested filter objects built in different insertion orders, produce equal strings.
   */
  public static String canonical(Query query) {
    try {
      return DatameshJson.canonical().writeValueAsString(query);
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException("Failed to serialize query for " + query.datasource(), e);
    }
  }

  /** Lowercase hex SHA-224 of {@link #canonical(Query)}. */
  public static String hash(Query query) {
    return sha224(canonical(query));
  }

  static String sha224(String text) {
    try {
      MessageDigest md = MessageDigest.getInstance("SHA-224");
      return HexFormat.of().formatHex(md.digest(text.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException(e);
    }
  }
}
