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

package org.pilosa.pdk.ingest.source;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;

import com.google.common.base.Charsets;
import com.google.common.io.Files;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class TestLocatorList {
  @Rule
  public TemporaryFolder mTempDir = new TemporaryFolder();

  @Test
  public void testParseSkipsBlankAndCommentLines() {
    assertEquals(
        Arrays.asList("http://example.com/a.csv", "/data/b.csv", "https://example.com/c.csv"),
        LocatorList.parse("http://example.com/a.csv\n\n# comment\r\n  /data/b.csv  \n"
            + "https://example.com/c.csv"));
  }

  @Test
  public void testRead() throws IOException {
    final File list = mTempDir.newFile("urls.txt");
    Files.asCharSink(list, Charsets.UTF_8).write("a.csv\nb.csv\n");
    assertEquals(Arrays.asList("a.csv", "b.csv"), LocatorList.read(list));
  }

  @Test
  public void testMissingListIsFatal() {
    try {
      LocatorList.read(new File(mTempDir.getRoot(), "missing.txt"));
      fail("Expected a FetchException.");
    } catch (FetchException fe) {
      assertFalse(fe.isTransient());
    }
  }

  @Test
  public void testIsHttp() {
    assertTrue(LocatorList.isHttp("http://x"));
    assertTrue(LocatorList.isHttp("HTTPS://x"));
    assertFalse(LocatorList.isHttp("/tmp/http"));
  }
}
