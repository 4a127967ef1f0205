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

package ai.floedb.datamesh.client.store;

import ai.floedb.datamesh.error.DatameshConnectException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the gateway's directory listing of a chunk-store prefix.
 *
 * <p>Listing format, version 1: an HTML document with one anchor per entry, whose {@code href}
 * is the entry name (directories end in {@code /}), optionally prefixed with the listed path.
 * Parent and self links are ignored. A page with markup but no anchors is an empty directory.
 */
public final class ChunkListingParser {

  public static final int FORMAT_VERSION = 1;

  static final Pattern ANCHOR =
      Pattern.compile("<(a|A)\\s+(?:[^>]*?\\s+)?(href|HREF)=[\"'](?<url>[^\"']+)");

  private ChunkListingParser() {}

  /**
   * @param listedPath path of the listed prefix, for example {@code /zarr/my-data/}
   * @throws DatameshConnectException when the body is not an HTML listing at all
   */
  public static List<String> parse(String body, String listedPath) {
    if (body == null || body.isBlank()) {
      return List.of();
    }
    Matcher m = ANCHOR.matcher(body);
    Set<String> entries = new LinkedHashSet<>();
    boolean any = false;
    while (m.find()) {
      any = true;
      String entry = relativize(m.group("url"), listedPath);
      if (!entry.isEmpty()) {
        entries.add(entry);
      }
    }
    if (!any && body.indexOf('<') < 0) {
      throw new DatameshConnectException(
          "Unexpected chunk listing format (expected version "
              + FORMAT_VERSION
              + " HTML anchors): "
              + abbreviate(body));
    }
    return new ArrayList<>(entries);
  }

  static String relativize(String href, String listedPath) {
    String h = href;
    int cut = indexOfAny(h, '?', '#');
    if (cut >= 0) {
      h = h.substring(0, cut);
    }
    int scheme = h.indexOf("://");
    if (scheme >= 0) {
      int slash = h.indexOf('/', scheme + 3);
      h = slash < 0 ? "" : h.substring(slash);
    }
    if (listedPath != null && !listedPath.isEmpty() && h.startsWith(listedPath)) {
      h = h.substring(listedPath.length());
    } else if (h.startsWith("/")) {
      return "";
    }
    if (h.equals(".") || h.equals("./") || h.startsWith("..")) {
      return "";
    }
    return h.startsWith("./") ? h.substring(2) : h;
  }

  private static int indexOfAny(String s, char a, char b) {
    int i = s.indexOf(a);
    int j = s.indexOf(b);
    if (i < 0) {
      return j;
    }
    return j < 0 ? i : Math.min(i, j);
  }

  private static String abbreviate(String body) {
    String b = body.strip();
    return b.length() > 200 ? b.substring(0, 200) + "..." : b;
  }
}
