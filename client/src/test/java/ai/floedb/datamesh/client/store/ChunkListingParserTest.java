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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.floedb.datamesh.error.DatameshConnectException;
import org.junit.jupiter.api.Test;

class ChunkListingParserTest {

  private static final String LISTED = "/zarr/wave-hindcast/";

  @Test
  void relativeAnchorsAreEntries() {
    String page =
        "<html><body><a href=\"../\">../</a>\n"
            + "<a href=\".zgroup\">.zgroup</a>\n"
            + "<A HREF='hs/'>hs/</A>\n"
            + "<a class=\"dir\" href=\"./time/\">time/</a></body></html>";

    assertThat(ChunkListingParser.parse(page, LISTED)).containsExactly(".zgroup", "hs/", "time/");
  }

  @Test
  void absoluteAnchorsAreRelativizedToListedPath() {
    String page =
        "<a href=\"/zarr/wave-hindcast/hs/\">hs</a>"
            + "<a href=\"https://gateway.datamesh.test/zarr/wave-hindcast/time/?x=1\">time</a>"
            + "<a href=\"/zarr/other/\">other</a>"
            + "<a href=\"/zarr/wave-hindcast/\">self</a>";

    assertThat(ChunkListingParser.parse(page, LISTED)).containsExactly("hs/", "time/");
  }

  @Test
  void emptyListings() {
    assertThat(ChunkListingParser.parse("", LISTED)).isEmpty();
    assertThat(ChunkListingParser.parse("<html><body></body></html>", LISTED)).isEmpty();
  }

  @Test
  void nonHtmlBodyIsRejected() {
    assertThatThrownBy(() -> ChunkListingParser.parse("hs/\ntime/", LISTED))
        .isInstanceOf(DatameshConnectException.class)
        .hasMessageContaining("version " + ChunkListingParser.FORMAT_VERSION);
  }
}
