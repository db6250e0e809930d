/**
 * (c) Copyright 2013 WibiData, Inc.
 *
 * See the NOTICE file distributed with this work for additional
 * information regarding copyright ownership.
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

package org.pilosa.pdk.ingest;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Properties;

import com.google.common.base.Charsets;
import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import org.pilosa.pdk.ingest.decode.DelimitedTextDecoder;
import org.pilosa.pdk.ingest.mapping.FieldDescriptor;
import org.pilosa.pdk.ingest.mapping.FieldType;
import org.pilosa.pdk.ingest.mapping.SchemaDescriptor;
import org.pilosa.pdk.ingest.sink.InMemoryIndexSink;
import org.pilosa.pdk.ingest.source.Frame;
import org.pilosa.pdk.ingest.source.ListSource;

public class TestIngestTool {
  @Rule
  public TemporaryFolder mTempDir = new TemporaryFolder();

  private File properties(String text) throws IOException {
    final File file = mTempDir.newFile("ingest.properties");
    Files.asCharSink(file, Charsets.UTF_8).write(text);
    return file;
  }

  @Test
  public void testUsage() throws Exception {
    final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    IngestTool.printUsage(new PrintStream(bytes, true, "UTF-8"));
    final String usage = bytes.toString("UTF-8");
    assertTrue(usage, usage.contains("primary-key-fields"));
    assertTrue(usage, usage.contains("max-msgs"));
  }

  @Test
  public void testMissingArgument() {
    assertEquals(ExitStatus.CONFIG_ERROR.getCode(), new IngestTool().run(new String[0]));
  }

  @Test
  public void testMissingFile() {
    final String path = new File(mTempDir.getRoot(), "missing.properties").getPath();
    assertEquals(ExitStatus.CONFIG_ERROR.getCode(), new IngestTool().run(new String[] {path}));
  }

  @Test
  public void testConflictingOptions() throws IOException {
    final File file = properties("topics=t\nurl-file=urls.txt\nid-field=id\n");
    assertEquals(ExitStatus.CONFIG_ERROR.getCode(),
        new IngestTool().run(new String[] {file.getPath()}));
  }

  @Test
  public void testMissingDescriptor() throws IOException {
    final File file = properties("url-file=urls.txt\nid-field=id\n");
    assertEquals(ExitStatus.CONFIG_ERROR.getCode(),
        new IngestTool().run(new String[] {file.getPath()}));
  }

  @Test
  public void testUnreadableLocatorList() throws IOException {
    final File descriptor = mTempDir.newFile("colors.json");
    Files.asCharSink(descriptor, Charsets.UTF_8).write("{ \"fields\" : ["
        + "{ \"name\" : \"id\", \"type\" : \"int\" },"
        + "{ \"name\" : \"color\", \"type\" : \"string\" } ] }");
    final File file = properties("url-file="
        + slashes(new File(mTempDir.getRoot(), "no-urls.txt"))
        + "\ndescriptor-file=" + slashes(descriptor)
        + "\nid-field=id\n");
    assertEquals(ExitStatus.FETCH_FAILURE.getCode(),
        new IngestTool().run(new String[] {file.getPath()}));
  }

  @Test
  public void testShutdownHookCancelsTheRun() throws Exception {
    final Properties props = new Properties();
    props.setProperty("index", "colors");
    props.setProperty("url-file", "colors.txt");
    props.setProperty("id-field", "id");
    final IngestPipeline pipeline = IngestPipeline.builder()
        .withConfig(IngestConfig.fromProperties(props))
        .withSource(new ListSource(ImmutableList.<Frame>of()))
        .withDecoder(DelimitedTextDecoder.withHeaderRow(
            SchemaDescriptor.create(ImmutableList.of(FieldDescriptor.of("id", FieldType.INT))),
            ','))
        .withSink(InMemoryIndexSink.create())
        .build();

    final IngestTool tool = new IngestTool();
    assertFalse(tool.isShutdownRequested());
    tool.shutdownHook(pipeline, 10L).run();
    assertTrue(tool.isShutdownRequested());
    assertTrue(pipeline.run().isCancelled());
  }

  /** @return the path of a file with forward slashes, as properties files expect. */
  private static String slashes(File file) {
    return file.getPath().replace('\\', '/');
  }
}
