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

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeUnit;

import com.google.common.base.Charsets;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Ordering;
import com.google.common.io.Files;
import org.apache.http.HttpVersion;
import org.apache.http.client.HttpClient;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.conn.ClientConnectionManager;
import org.apache.http.entity.StringEntity;
import org.apache.http.message.BasicHttpResponse;
import org.apache.http.message.BasicStatusLine;
import org.easymock.EasyMock;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import org.pilosa.pdk.ingest.IngestCounter;
import org.pilosa.pdk.ingest.IngestMetrics;
import org.pilosa.pdk.ingest.RetryPolicy;

public class TestUrlSource {
  @Rule
  public TemporaryFolder mTempDir = new TemporaryFolder();

  /**
   * Reads every frame of a source.
   *
   * @param source The source.
   * @return the bodies, sorted.
   */
  private static List<String> drain(Source source) throws IOException, InterruptedException {
    final List<String> bodies = Lists.newArrayList();
    final long deadline = System.currentTimeMillis() + 10000L;
    while (!source.isExhausted() && System.currentTimeMillis() < deadline) {
      final Frame frame = source.next(50, TimeUnit.MILLISECONDS);
      if (null != frame) {
        bodies.add(new String(frame.getBytes(), Charsets.UTF_8));
        frame.release();
      }
    }
    assertTrue("Source did not finish", source.isExhausted());
    return Ordering.natural().sortedCopy(bodies);
  }

  /** @return a mock client that expects to be closed. */
  private static HttpClient closableClient() {
    final ClientConnectionManager manager = EasyMock.createMock(ClientConnectionManager.class);
    manager.shutdown();
    EasyMock.expectLastCall();
    final HttpClient client = EasyMock.createMock(HttpClient.class);
    EasyMock.expect(client.getConnectionManager()).andReturn(manager);
    EasyMock.replay(manager);
    return client;
  }

  private List<String> writeFiles() throws IOException {
    final File a = mTempDir.newFile("a.csv");
    final File b = mTempDir.newFile("b.csv");
    Files.asCharSink(a, Charsets.UTF_8).write("x,1\n");
    Files.asCharSink(b, Charsets.UTF_8).write("y,2\n");
    return ImmutableList.of(
        a.getPath(), new File(mTempDir.getRoot(), "missing.csv").getPath(), b.getPath());
  }

  @Test
  public void testReadAllFiles() throws Exception {
    final HttpClient client = closableClient();
    EasyMock.replay(client);
    final IngestMetrics metrics = IngestMetrics.create();
    final UrlSource source =
        UrlSource.create(writeFiles(), client, 2, true, RetryPolicy.noRetries(), metrics);
    assertFalse(source.isExhausted());

    assertEquals(ImmutableList.of("x,1\n", "y,2\n"), drain(source));
    assertEquals("Missing file is dead-lettered", 1L, metrics.get(IngestCounter.FRAMES_FAILED));
    source.close();
    EasyMock.verify(client);
  }

  @Test
  public void testStreamingFiles() throws Exception {
    final HttpClient client = closableClient();
    EasyMock.replay(client);
    final IngestMetrics metrics = IngestMetrics.create();
    final UrlSource source =
        UrlSource.create(writeFiles(), client, 1, false, RetryPolicy.noRetries(), metrics);

    assertEquals(ImmutableList.of("x,1\n", "y,2\n"), drain(source));
    assertEquals(1L, metrics.get(IngestCounter.FRAMES_FAILED));
    source.close();
  }

  @Test
  public void testHttpRetriesServerErrors() throws Exception {
    final BasicHttpResponse unavailable =
        new BasicHttpResponse(new BasicStatusLine(HttpVersion.HTTP_1_1, 503, "Unavailable"));
    unavailable.setEntity(new StringEntity("busy"));
    final BasicHttpResponse ok =
        new BasicHttpResponse(new BasicStatusLine(HttpVersion.HTTP_1_1, 200, "OK"));
    ok.setEntity(new StringEntity("z,3\n"));

    final HttpClient client = closableClient();
    EasyMock.expect(client.execute(EasyMock.isA(HttpGet.class)))
        .andReturn(unavailable)
        .andReturn(ok);
    EasyMock.replay(client);

    final IngestMetrics metrics = IngestMetrics.create();
    final UrlSource source = UrlSource.create(ImmutableList.of("http://example.com/z.csv"),
        client, 1, true, RetryPolicy.create(2, 1L, 1L), metrics);
    assertEquals(ImmutableList.of("z,3\n"), drain(source));
    assertEquals(0L, metrics.get(IngestCounter.FRAMES_FAILED));
    source.close();
    EasyMock.verify(client);
  }

  @Test
  public void testHttpClientErrorIsNotRetried() throws Exception {
    final BasicHttpResponse notFound =
        new BasicHttpResponse(new BasicStatusLine(HttpVersion.HTTP_1_1, 404, "Not Found"));
    notFound.setEntity(new StringEntity("nope"));

    final HttpClient client = closableClient();
    EasyMock.expect(client.execute(EasyMock.isA(HttpGet.class))).andReturn(notFound);
    EasyMock.replay(client);

    final IngestMetrics metrics = IngestMetrics.create();
    final UrlSource source = UrlSource.create(ImmutableList.of("http://example.com/gone.csv"),
        client, 1, true, RetryPolicy.create(5, 1L, 1L), metrics);
    assertEquals(ImmutableList.<String>of(), drain(source));
    assertEquals(1L, metrics.get(IngestCounter.FRAMES_FAILED));
    source.close();
    EasyMock.verify(client);
  }
}
