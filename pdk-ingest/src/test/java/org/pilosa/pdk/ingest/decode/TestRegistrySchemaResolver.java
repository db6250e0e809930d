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

package org.pilosa.pdk.ingest.decode;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import java.io.IOException;
import java.io.UnsupportedEncodingException;
import java.net.URI;

import org.apache.avro.Schema;
import org.apache.http.HttpResponse;
import org.apache.http.HttpVersion;
import org.apache.http.client.HttpClient;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.entity.StringEntity;
import org.apache.http.message.BasicHttpResponse;
import org.apache.http.message.BasicStatusLine;
import org.apache.http.util.EntityUtils;
import org.easymock.Capture;
import org.easymock.EasyMock;
import org.junit.Before;
import org.junit.Test;

public class TestRegistrySchemaResolver {
  private static final String SCHEMA =
      "{\"type\":\"record\",\"name\":\"user\",\"fields\":[{\"name\":\"id\",\"type\":\"long\"}]}";

  private HttpClient mClient;
  private Capture<HttpUriRequest> mRequest;
  private RegistrySchemaResolver mResolver;

  @Before
  public void setup() {
    mClient = EasyMock.createMock(HttpClient.class);
    mRequest = EasyMock.newCapture();
    mResolver = RegistrySchemaResolver.create(mClient, URI.create("http://registry:8081/"));
  }

  private static HttpResponse response(int status, String body)
      throws UnsupportedEncodingException {
    final BasicHttpResponse response =
        new BasicHttpResponse(new BasicStatusLine(HttpVersion.HTTP_1_1, status, "status"));
    response.setEntity(new StringEntity(body));
    return response;
  }

  /**
   * Quotes a string as a JSON string value.
   *
   * @param text The string.
   * @return the JSON string.
   */
  private static String quote(String text) {
    return "\"" + text.replace("\"", "\\\"") + "\"";
  }

  @Test
  public void testResolve() throws Exception {
    EasyMock.expect(mClient.execute(EasyMock.capture(mRequest)))
        .andReturn(response(200, "{\"schema\":" + quote(SCHEMA) + "}"));
    EasyMock.replay(mClient);

    final Schema schema = mResolver.resolve(42);
    assertEquals("user", schema.getName());
    assertEquals("http://registry:8081/schemas/ids/42", mRequest.getValue().getURI().toString());
    EasyMock.verify(mClient);
  }

  @Test
  public void testUnknownIdentifier() throws Exception {
    EasyMock.expect(mClient.execute(EasyMock.capture(mRequest)))
        .andReturn(response(404, "{\"error_code\":40403}"));
    EasyMock.replay(mClient);
    try {
      mResolver.resolve(7);
      fail("Expected a SchemaResolutionException.");
    } catch (SchemaResolutionException sre) {
      assertEquals(7, sre.getSchemaId());
    }
  }

  @Test(expected=SchemaResolutionException.class)
  public void testUnreachableRegistry() throws Exception {
    EasyMock.expect(mClient.execute(EasyMock.capture(mRequest)))
        .andThrow(new IOException("Connection refused"));
    EasyMock.replay(mClient);
    mResolver.resolve(1);
  }

  @Test(expected=SchemaResolutionException.class)
  public void testInvalidSchema() throws Exception {
    EasyMock.expect(mClient.execute(EasyMock.capture(mRequest)))
        .andReturn(response(200, "{\"schema\":\"{\\\"type\\\":\\\"nope\\\"}\"}"));
    EasyMock.replay(mClient);
    mResolver.resolve(1);
  }

  @Test
  public void testRegister() throws Exception {
    EasyMock.expect(mClient.execute(EasyMock.capture(mRequest)))
        .andReturn(response(200, "{\"id\":12}"));
    EasyMock.replay(mClient);

    assertEquals(12, mResolver.register("users-value", new Schema.Parser().parse(SCHEMA)));
    final HttpPost post = (HttpPost) mRequest.getValue();
    assertEquals("http://registry:8081/subjects/users-value/versions", post.getURI().toString());
    assertEquals("application/vnd.schemaregistry.v1+json",
        post.getEntity().getContentType().getValue().split(";")[0]);
    assertEquals("{\"schema\":" + quote(SCHEMA) + "}", EntityUtils.toString(post.getEntity()));
  }
}
