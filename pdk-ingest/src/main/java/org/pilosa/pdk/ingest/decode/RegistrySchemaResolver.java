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

import java.io.Closeable;
import java.io.IOException;
import java.net.URI;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.avro.Schema;
import org.apache.avro.SchemaParseException;
import org.apache.http.HttpEntity;
import org.apache.http.HttpResponse;
import org.apache.http.client.HttpClient;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client of a schema registry: resolves identifiers with <code>GET /schemas/ids/{id}</code>,
 * which answers <code>{"schema": "&lt;avro schema json&gt;"}</code>, and registers schemas under
 * a subject with <code>POST /subjects/{subject}/versions</code>.
 *
 * <p>The client does not cache; wrap it in a {@link CachingSchemaResolver}. Call
 * {@link #close()} to release the underlying http client.</p>
 */
public final class RegistrySchemaResolver implements SchemaResolver, Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(RegistrySchemaResolver.class);

  /** Content type of registry requests. */
  private static final ContentType REGISTRY_JSON =
      ContentType.create("application/vnd.schemaregistry.v1+json");

  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** The http client to use when making requests. */
  private final HttpClient mHttpClient;

  /** Base URI of the registry. */
  private final URI mRegistryURI;

  /**
   * Creates a new instance that will make requests to a registry using an http client.
   *
   * @param httpClient will be used to make http requests.
   * @param registryURI base URI of the registry.
   */
  RegistrySchemaResolver(HttpClient httpClient, URI registryURI) {
    mHttpClient = httpClient;
    mRegistryURI = registryURI;
  }

  /**
   * Creates a new instance that will make requests to a registry using an http client.
   *
   * @param httpClient will be used to make http requests.
   * @param registryURI base URI of the registry.
   * @return a new registry client.
   */
  public static RegistrySchemaResolver create(HttpClient httpClient, URI registryURI) {
    return new RegistrySchemaResolver(httpClient, registryURI);
  }

  /**
   * Creates a new instance with its own http client.
   *
   * @param registryURI base URI of the registry.
   * @return a new registry client.
   */
  public static RegistrySchemaResolver create(URI registryURI) {
    return new RegistrySchemaResolver(HttpClients.createDefault(), registryURI);
  }

  /** {@inheritDoc} */
  @Override
  public Schema resolve(int id) throws SchemaResolutionException {
    final HttpGet getRequest = new HttpGet(resolve("schemas/ids/" + id));
    final String responseBody;
    try {
      final HttpResponse response = mHttpClient.execute(getRequest);
      try {
        final int status = response.getStatusLine().getStatusCode();
        final HttpEntity responseEntity = response.getEntity();
        responseBody = null == responseEntity ? "" : EntityUtils.toString(responseEntity);
        if (status != 200) {
          throw new SchemaResolutionException(id, String.format(
              "Registry %s answered %d for schema %d: %s", mRegistryURI, status, id, responseBody));
        }
      } finally {
        getRequest.releaseConnection();
      }
    } catch (SchemaResolutionException sre) {
      throw sre;
    } catch (IOException ioe) {
      throw new SchemaResolutionException(id,
          String.format("Could not reach registry %s for schema %d.", mRegistryURI, id), ioe);
    }

    try {
      final JsonNode schemaNode = MAPPER.readTree(responseBody).path("schema");
      if (!schemaNode.isTextual()) {
        throw new SchemaResolutionException(id, "Registry response lacks a schema: "
            + responseBody);
      }
      final Schema schema = new Schema.Parser().parse(schemaNode.asText());
      LOG.debug("Resolved schema {} to {}.", id, schema.getFullName());
      return schema;
    } catch (SchemaParseException spe) {
      throw new SchemaResolutionException(id, "Registry returned an invalid schema.", spe);
    } catch (IOException ioe) {
      throw new SchemaResolutionException(id, "Registry returned malformed JSON.", ioe);
    }
  }

  /**
   * Registers a schema under a subject.
   *
   * @param subject Subject to register under.
   * @param schema The schema.
   * @return the identifier assigned by the registry.
   * @throws IOException if the request fails or the registry refuses the schema.
   */
  public int register(String subject, Schema schema) throws IOException {
    final ObjectNode body = MAPPER.createObjectNode();
    body.put("schema", schema.toString());

    final HttpPost postRequest = new HttpPost(resolve("subjects/" + subject + "/versions"));
    postRequest.setEntity(new StringEntity(body.toString(), REGISTRY_JSON));
    final HttpResponse response = mHttpClient.execute(postRequest);
    try {
      final int status = response.getStatusLine().getStatusCode();
      final String responseBody = EntityUtils.toString(response.getEntity());
      if (status != 200) {
        throw new IOException(String.format(
            "Registry %s refused schema for subject %s (%d): %s",
            mRegistryURI, subject, status, responseBody));
      }
      final JsonNode id = MAPPER.readTree(responseBody).path("id");
      if (!id.canConvertToInt()) {
        throw new IOException("Registry response lacks an id: " + responseBody);
      }
      return id.asInt();
    } finally {
      postRequest.releaseConnection();
    }
  }

  /**
   * Resolves a path against the registry base URI.
   *
   * @param path Relative path.
   * @return the absolute URI.
   */
  private URI resolve(String path) {
    final String base = mRegistryURI.toString();
    return URI.create(base.endsWith("/") ? base + path : base + "/" + path);
  }

  /** @return the base URI of the registry. */
  public URI getRegistryURI() {
    return mRegistryURI;
  }

  /**
   * Closes resources (specifically the http client) used by this instance.
   */
  @Override
  public void close() {
    mHttpClient.getConnectionManager().shutdown();
  }
}
