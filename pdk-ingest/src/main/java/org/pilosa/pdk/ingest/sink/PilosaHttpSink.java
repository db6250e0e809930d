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

package org.pilosa.pdk.ingest.sink;

import java.io.IOException;
import java.net.URI;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.text.SimpleDateFormat;
import java.util.Date;
import java.util.TimeZone;
import java.util.concurrent.ConcurrentMap;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.CharMatcher;
import com.google.common.base.Charsets;
import com.google.common.base.Preconditions;
import com.google.common.collect.Maps;
import com.google.common.io.BaseEncoding;
import org.apache.http.HttpEntity;
import org.apache.http.HttpResponse;
import org.apache.http.client.HttpClient;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.entity.ByteArrayEntity;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.pilosa.pdk.ingest.FieldSpec;
import org.pilosa.pdk.ingest.IndexRef;
import org.pilosa.pdk.ingest.IngestConfig;
import org.pilosa.pdk.ingest.Mutation;
import org.pilosa.pdk.ingest.batch.Batch;

/**
 * Applies batches to a Pilosa server over http.
 *
 * <p>The index and each field are created on first use; an answer of 409 means they exist
 * already. A batch becomes one PQL request with one <code>Set()</code> call per mutation.</p>
 *
 * <p>Keys that are printable UTF-8 text are sent as text. Other keys, such as composite primary
 * keys holding binary integers, are sent as <code>0x</code> followed by their lowercase hex
 * digits, and so are text keys starting with <code>0x</code>; two distinct keys never become
 * the same Pilosa key.</p>
 *
 * <p>Server errors (5xx) and connection failures are retryable; client errors (4xx) are
 * not.</p>
 */
public final class PilosaHttpSink implements BatchSink {
  private static final Logger LOG = LoggerFactory.getLogger(PilosaHttpSink.class);

  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** Prefix of keys sent as hex digits. */
  private static final String HEX_PREFIX = "0x";

  /** Time quantum of time fields. */
  static final String TIME_QUANTUM = "YMDH";

  /** Format of timestamps in PQL. */
  static final String PQL_TIME_FORMAT = "yyyy-MM-dd'T'HH:mm";

  /** Control characters that force a key into hex. */
  private static final CharMatcher CONTROL = CharMatcher.javaIsoControl();

  /** The http client to use when making requests. */
  private final HttpClient mHttpClient;

  /** Base URI of the server. */
  private final URI mServerURI;

  private final String mIndex;
  private final boolean mColumnKeys;

  private volatile boolean mIndexCreated = false;
  private final ConcurrentMap<String, FieldSpec> mCreatedFields = Maps.newConcurrentMap();

  /**
   * Creates a new instance that will make requests to a server using an http client.
   *
   * @param httpClient will be used to make http requests.
   * @param serverURI base URI of the server.
   * @param index Name of the index.
   * @param columnKeys Whether the index addresses columns by key.
   */
  PilosaHttpSink(HttpClient httpClient, URI serverURI, String index, boolean columnKeys) {
    mHttpClient = Preconditions.checkNotNull(httpClient);
    mServerURI = Preconditions.checkNotNull(serverURI);
    mIndex = Preconditions.checkNotNull(index);
    mColumnKeys = columnKeys;
  }

  /**
   * Creates a sink.
   *
   * @param httpClient will be used to make http requests.
   * @param serverURI base URI of the server.
   * @param index Name of the index.
   * @param columnKeys Whether the index addresses columns by key.
   * @return the sink.
   */
  public static PilosaHttpSink create(
      HttpClient httpClient,
      URI serverURI,
      String index,
      boolean columnKeys) {
    return new PilosaHttpSink(httpClient, serverURI, index, columnKeys);
  }

  /**
   * Creates the sink of a run.
   *
   * @param config The run configuration.
   * @param columnKeys Whether the index addresses columns by key.
   * @return the sink.
   */
  public static PilosaHttpSink fromConfig(IngestConfig config, boolean columnKeys) {
    return new PilosaHttpSink(
        HttpClients.createDefault(), serverURI(config.getPilosaHost()),
        config.getIndex(), columnKeys);
  }

  /**
   * Turns a host, with or without scheme, into a base URI.
   *
   * @param host For instance <code>localhost:10101</code>.
   * @return the base URI.
   */
  static URI serverURI(String host) {
    final String trimmed = host.trim();
    return URI.create(trimmed.contains("://") ? trimmed : "http://" + trimmed);
  }

  /** {@inheritDoc} */
  @Override
  public void apply(Batch batch) throws SinkException {
    ensureIndex();
    ensureField(batch.getField());
    final String pql = toPql(batch);
    final String path = "index/" + mIndex + "/query";
    final HttpPost postRequest = new HttpPost(resolve(path));
    postRequest.setEntity(new ByteArrayEntity(pql.getBytes(Charsets.UTF_8)));
    final int status = execute(postRequest, path);
    if (status != 200) {
      throw new SinkException(String.format("Query on index %s answered %d.", mIndex, status),
          status >= 500);
    }
    LOG.debug("Applied {} to index {}.", batch, mIndex);
  }

  /**
   * Builds the query applying a batch.
   *
   * @param batch The batch.
   * @return the PQL text.
   */
  static String toPql(Batch batch) {
    // SimpleDateFormat is not thread safe.
    final SimpleDateFormat format = new SimpleDateFormat(PQL_TIME_FORMAT);
    format.setTimeZone(TimeZone.getTimeZone("UTC"));
    final StringBuilder pql = new StringBuilder();
    for (Mutation mutation : batch.getMutations()) {
      pql.append("Set(")
          .append(pqlRef(mutation.getColumn()))
          .append(", ")
          .append(mutation.getFieldName())
          .append('=');
      if (mutation.isValue()) {
        pql.append(mutation.getValue());
      } else {
        pql.append(pqlRef(mutation.getRow()));
        if (null != mutation.getTimestamp() && batch.getField().getType() == FieldSpec.Type.TIME) {
          pql.append(", ").append(format.format(new Date(mutation.getTimestamp())));
        }
      }
      pql.append(")\n");
    }
    return pql.toString();
  }

  /**
   * Renders a row or column reference in PQL.
   *
   * @param ref The reference.
   * @return the unsigned id, or the quoted key, in hex when it is not plain text.
   */
  static String pqlRef(IndexRef ref) {
    if (!ref.isKey()) {
      return Long.toUnsignedString(ref.getId());
    }
    final byte[] key = ref.getKeyBytes();
    String text;
    try {
      text = Charsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(key))
          .toString();
      if (CONTROL.matchesAnyOf(text) || text.startsWith(HEX_PREFIX)) {
        text = null;
      }
    } catch (CharacterCodingException cce) {
      text = null;
    }
    if (null == text) {
      text = HEX_PREFIX + BaseEncoding.base16().lowerCase().encode(key);
    }
    return "'" + text.replace("\\", "\\\\").replace("'", "\\'") + "'";
  }

  /**
   * Creates the index unless done already.
   *
   * @throws SinkException if the index cannot be created.
   */
  private void ensureIndex() throws SinkException {
    if (mIndexCreated) {
      return;
    }
    synchronized (this) {
      if (mIndexCreated) {
        return;
      }
      final ObjectNode body = MAPPER.createObjectNode();
      body.putObject("options").put("keys", mColumnKeys);
      create("index/" + mIndex, body);
      mIndexCreated = true;
      LOG.info("Index {} is ready (column keys: {}).", mIndex, mColumnKeys);
    }
  }

  /**
   * Creates a field unless done already.
   *
   * @param field The field.
   * @throws SinkException if the field cannot be created.
   */
  private void ensureField(FieldSpec field) throws SinkException {
    final FieldSpec known = mCreatedFields.get(field.getName());
    if (null != known) {
      if (!known.equals(field)) {
        LOG.warn("Field {} was created as {}, now written as {}.", field.getName(), known, field);
      }
      return;
    }
    create("index/" + mIndex + "/field/" + field.getName(), fieldOptions(field));
    mCreatedFields.putIfAbsent(field.getName(), field);
  }

  /**
   * Builds the creation options of a field.
   *
   * @param field The field.
   * @return the request body.
   */
  static ObjectNode fieldOptions(FieldSpec field) {
    final ObjectNode body = MAPPER.createObjectNode();
    final ObjectNode options = body.putObject("options");
    switch (field.getType()) {
      case SET:
        options.put("type", "set");
        options.put("keys", field.hasRowKeys());
        break;
      case TIME:
        options.put("type", "time");
        options.put("timeQuantum", TIME_QUANTUM);
        options.put("keys", field.hasRowKeys());
        break;
      case INT:
        options.put("type", "int");
        options.put("min", field.getMin());
        options.put("max", field.getMax());
        break;
      default:
        throw new IllegalArgumentException("Unknown field type: " + field.getType());
    }
    return body;
  }

  /**
   * Creates a schema object; conflicts mean it exists.
   *
   * @param path Path of the object.
   * @param body Creation options.
   * @throws SinkException if the object cannot be created.
   */
  private void create(String path, ObjectNode body) throws SinkException {
    final HttpPost postRequest = new HttpPost(resolve(path));
    postRequest.setEntity(new StringEntity(body.toString(), ContentType.APPLICATION_JSON));
    final int status = execute(postRequest, path);
    if (status != 200 && status != 409) {
      throw new SinkException(String.format("Creating %s answered %d.", path, status),
          status >= 500);
    }
  }

  /**
   * Makes a request and reads its answer.
   *
   * @param request The request.
   * @param path Path, for messages.
   * @return the status code.
   * @throws SinkException if the request cannot be made.
   */
  private int execute(HttpPost request, String path) throws SinkException {
    try {
      final HttpResponse response = mHttpClient.execute(request);
      final int status = response.getStatusLine().getStatusCode();
      final HttpEntity entity = response.getEntity();
      final String responseBody = null == entity ? "" : EntityUtils.toString(entity);
      if (status != 200 && status != 409) {
        LOG.warn("POST {} answered {}: {}", path, status, responseBody);
      }
      return status;
    } catch (IOException ioe) {
      throw new SinkException("POST " + path + " failed: " + ioe.getMessage(), true, ioe);
    } finally {
      request.releaseConnection();
    }
  }

  /**
   * Resolves a path against the server base URI.
   *
   * @param path Relative path.
   * @return the absolute URI.
   */
  private URI resolve(String path) {
    final String base = mServerURI.toString();
    return URI.create(base.endsWith("/") ? base + path : base + "/" + path);
  }

  /** @return the name of the index. */
  public String getIndex() {
    return mIndex;
  }

  /**
   * Closes resources (specifically the http client) used by this instance.
   */
  @Override
  public void close() {
    mHttpClient.getConnectionManager().shutdown();
  }
}
