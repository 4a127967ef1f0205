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

package ai.floedb.datamesh.zarr;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.CRC32;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import java.util.zip.ZipOutputStream;

/**
 * Packs a chunk store into a single zip archive with stored (uncompressed) entries, the layout of
 * a zarr {@code ZipStore}. Chunks carry their own compression.
 */
public final class ZipChunkArchives {

  private ZipChunkArchives() {}

  public static byte[] pack(InMemoryChunkStore store) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try {
      writeTo(store, out);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return out.toByteArray();
  }

  public static void write(InMemoryChunkStore store, Path target) throws IOException {
    try (OutputStream out = Files.newOutputStream(target)) {
      writeTo(store, out);
    }
  }

  public static InMemoryChunkStore unpack(byte[] archive) {
    try {
      return readFrom(new ByteArrayInputStream(archive));
    } catch (IOException e) {
      throw new UncheckedIOException("Corrupt zarr zip archive", e);
    }
  }

  public static InMemoryChunkStore read(Path source) throws IOException {
    try (InputStream in = Files.newInputStream(source)) {
      return readFrom(in);
    }
  }

  private static void writeTo(InMemoryChunkStore store, OutputStream target) throws IOException {
    try (ZipOutputStream zip = new ZipOutputStream(target)) {
      for (String key : store.allKeys()) {
        byte[] data = store.get(key);
        CRC32 crc = new CRC32();
        crc.update(data);
        ZipEntry entry = new ZipEntry(key);
        entry.setMethod(ZipEntry.STORED);
        entry.setSize(data.length);
        entry.setCompressedSize(data.length);
        entry.setCrc(crc.getValue());
        zip.putNextEntry(entry);
        zip.write(data);
        zip.closeEntry();
      }
    }
  }

  private static InMemoryChunkStore readFrom(InputStream in) throws IOException {
    InMemoryChunkStore store = new InMemoryChunkStore();
    try (ZipInputStream zip = new ZipInputStream(in)) {
      ZipEntry entry;
      while ((entry = zip.getNextEntry()) != null) {
        if (!entry.isDirectory()) {
          store.set(entry.getName(), zip.readAllBytes());
        }
      }
    }
    return store;
  }
}
