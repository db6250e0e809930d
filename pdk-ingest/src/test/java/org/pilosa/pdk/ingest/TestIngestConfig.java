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
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.File;
import java.io.IOException;
import java.util.Properties;

import com.google.common.base.Charsets;
import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class TestIngestConfig {
  @Rule
  public TemporaryFolder mTempDir = new TemporaryFolder();

  private static IngestConfig config(String... pairs) {
    final Properties properties = new Properties();
    for (int i = 0; i < pairs.length; i += 2) {
      properties.setProperty(pairs[i], pairs[i + 1]);
    }
    return IngestConfig.fromProperties(properties);
  }

  private static void assertInvalid(IngestConfig config, String expectedFragment) {
    try {
      config.validate();
      fail("Should have rejected " + config);
    } catch (ConfigException ce) {
      assertTrue(ce.getMessage(), ce.getMessage().contains(expectedFragment));
    }
  }

  @Test
  public void testDefaults() throws ConfigException {
    final IngestConfig config = IngestConfig.defaults();
    assertEquals(8, config.getConcurrency());
    assertEquals(1000000, config.getBufferSize());
    assertEquals(1000, config.getBatchSize());
    assertEquals("localhost:10101", config.getPilosaHost());
    assertEquals("pdk", config.getIndex());
    assertEquals(0L, config.getMaxMsgs());
    assertEquals(ImmutableList.of("localhost:9092"), config.getKafkaHosts());
    assertEquals(',', config.getFieldDelimiterChar());
    assertFalse(config.isUseReadAll());
    assertNull(config.getUrlFile());
    assertNull(config.getPackBools());
    assertTrue(config.getTopics().isEmpty());
  }

  @Test
  public void testParsesOptions() throws ConfigException {
    final IngestConfig config = config(
        "topics", "a, b",
        "primary-key-fields", "abc,db,user_id",
        "pack-bools", "bools",
        "batch-size", "10",
        "field-delimiter", "tab",
        "use-read-all", "true").validate();
    assertEquals(ImmutableList.of("a", "b"), config.getTopics());
    assertEquals(ImmutableList.of("abc", "db", "user_id"), config.getPrimaryKeyFields());
    assertEquals("bools", config.getPackBools());
    assertEquals(10, config.getBatchSize());
    assertEquals('\t', config.getFieldDelimiterChar());
    assertTrue(config.isUseReadAll());
  }

  @Test
  public void testColumnIdentityIsExclusive() {
    assertInvalid(config("topics", "t"), "Exactly one of primary-key-fields and id-field");
    assertInvalid(config("topics", "t", "id-field", "id", "primary-key-fields", "a"),
        "Exactly one of primary-key-fields and id-field");
  }

  @Test
  public void testInputIsExclusive() {
    assertInvalid(config("id-field", "id"), "Exactly one of url-file and topics");
    assertInvalid(config("id-field", "id", "topics", "t", "url-file", "urls.txt"),
        "Exactly one of url-file and topics");
  }

  @Test
  public void testRejectsBadNumbers() {
    assertInvalid(config("id-field", "id", "topics", "t", "batch-size", "0"), "batch-size");
    assertInvalid(config("id-field", "id", "topics", "t", "concurrency", "many"), "concurrency");
    assertInvalid(config("id-field", "id", "topics", "t", "max-msgs", "-1"), "max-msgs");
    assertInvalid(config("id-field", "id", "topics", "t",
        "retry-backoff-ms", "50", "max-backoff-ms", "10"), "Invalid backoff");
  }

  @Test
  public void testRejectsLongDelimiter() {
    assertInvalid(config("id-field", "id", "topics", "t", "field-delimiter", "||"),
        "field-delimiter");
  }

  @Test
  public void testLoad() throws IOException {
    final File file = new File(mTempDir.getRoot(), "ingest.properties");
    Files.asCharSink(file, Charsets.UTF_8).write("index=taxi\nurl-file=urls.txt\nid-field=id\n");
    final IngestConfig config = IngestConfig.load(file).validate();
    assertEquals("taxi", config.getIndex());
    assertEquals("urls.txt", config.getUrlFile());
    assertEquals("id", config.getIdField());
  }

  @Test(expected=ConfigException.class)
  public void testLoadMissingFile() throws ConfigException {
    IngestConfig.load(new File(mTempDir.getRoot(), "missing.properties"));
  }
}
