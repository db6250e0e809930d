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

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Properties;

import com.google.common.base.Joiner;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import org.apache.commons.io.IOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.pilosa.pdk.configurator.PdkConf;
import org.pilosa.pdk.configurator.PdkConfigurationException;
import org.pilosa.pdk.configurator.PdkConfigurator;

/**
 * Options of an ingestion run, read from a properties file.
 *
 * <p>Every option has a property key of the same name, for example:</p>
 * <pre>
 *   index=users
 *   topics=users-v1
 *   primary-key-fields=abc,db,user_id
 *   pack-bools=bools
 *   batch-size=1000
 * </pre>
 *
 * <p>Call {@link #validate()} before starting a run.</p>
 */
public final class IngestConfig {
  private static final Logger LOG = LoggerFactory.getLogger(IngestConfig.class);

  @PdkConf(key="concurrency", usage="Number of decode and map workers.", defaultValue="8")
  private int mConcurrency;

  @PdkConf(key="fetch-concurrency", usage="Number of parallel locator fetches.",
      defaultValue="8")
  private int mFetchConcurrency;

  @PdkConf(key="buffer-size", usage="Capacity of the queue into the decoders, in frames.",
      defaultValue="1000000")
  private int mBufferSize;

  @PdkConf(key="use-read-all", usage="Read whole bodies before decoding them.",
      defaultValue="false")
  private boolean mUseReadAll;

  @PdkConf(key="pilosa-host", usage="Host and port of the index.", defaultValue="localhost:10101")
  private String mPilosaHost;

  @PdkConf(key="index", usage="Name of the target index.", defaultValue="pdk")
  private String mIndex;

  @PdkConf(key="url-file", usage="File listing one URL or path per line.")
  private String mUrlFile;

  @PdkConf(key="topics", usage="Comma separated topics to consume.")
  private List<String> mTopics = ImmutableList.of();

  @PdkConf(key="primary-key-fields", usage="Fields whose values form the column key.")
  private List<String> mPrimaryKeyFields = ImmutableList.of();

  @PdkConf(key="id-field", usage="Integer field holding the column id.")
  private String mIdField;

  @PdkConf(key="pack-bools", usage="Field to pack boolean fields into; empty to disable.")
  private String mPackBools;

  @PdkConf(key="batch-size", usage="Mutations per batch.", defaultValue="1000")
  private int mBatchSize;

  @PdkConf(key="max-msgs", usage="Records to admit before draining; 0 for no limit.",
      defaultValue="0")
  private long mMaxMsgs;

  @PdkConf(key="kafka-hosts", usage="Comma separated Kafka bootstrap servers.",
      defaultValue="localhost:9092")
  private List<String> mKafkaHosts;

  @PdkConf(key="registry-url", usage="Base URL of the schema registry.",
      defaultValue="http://localhost:8081")
  private String mRegistryUrl;

  @PdkConf(key="group", usage="Kafka consumer group.", defaultValue="pdk")
  private String mGroup;

  @PdkConf(key="descriptor-file", usage="JSON schema descriptor of delimited text input.")
  private String mDescriptorFile;

  @PdkConf(key="header", usage="Comma separated field names; empty to read a header row.")
  private List<String> mHeader = ImmutableList.of();

  @PdkConf(key="field-delimiter", usage="Field delimiter of delimited text; 'tab' for tabs.",
      defaultValue=",")
  private String mFieldDelimiter;

  @PdkConf(key="flush-interval-ms", usage="Longest time a partial batch waits.",
      defaultValue="1000")
  private long mFlushIntervalMillis;

  @PdkConf(key="max-retries", usage="Retries of a failed fetch or batch.", defaultValue="5")
  private int mMaxRetries;

  @PdkConf(key="retry-backoff-ms", usage="Wait before the first retry.", defaultValue="100")
  private long mRetryBackoffMillis;

  @PdkConf(key="max-backoff-ms", usage="Longest wait between retries.", defaultValue="10000")
  private long mMaxBackoffMillis;

  @PdkConf(key="sink-concurrency", usage="Batches applied in parallel.", defaultValue="4")
  private int mSinkConcurrency;

  @PdkConf(key="shutdown-deadline-ms", usage="Time allowed to drain after cancellation.",
      defaultValue="30000")
  private long mShutdownDeadlineMillis;

  @PdkConf(key="log-rate", usage="Rejected records between two log statements.",
      defaultValue="1000")
  private long mLogRate;

  /** Use the static factories. */
  private IngestConfig() {}

  /**
   * Reads the options from a set of properties. Absent options take their defaults.
   *
   * @param properties The properties.
   * @return the options, not yet validated.
   */
  public static IngestConfig fromProperties(Properties properties) {
    final IngestConfig config = new IngestConfig();
    PdkConfigurator.configure(config, properties);
    return config;
  }

  /** @return the default options. */
  public static IngestConfig defaults() {
    return fromProperties(new Properties());
  }

  /**
   * Reads the options from a properties file.
   *
   * @param file The properties file.
   * @return the options, not yet validated.
   * @throws ConfigException if the file cannot be read.
   */
  public static IngestConfig load(File file) throws ConfigException {
    final Properties properties = new Properties();
    InputStream input = null;
    try {
      input = new FileInputStream(file);
      properties.load(input);
    } catch (IOException ioe) {
      throw new ConfigException("Could not read configuration file: " + file, ioe);
    } finally {
      IOUtils.closeQuietly(input);
    }
    LOG.info("Loaded {} options from {}.", properties.size(), file);
    try {
      return fromProperties(properties);
    } catch (PdkConfigurationException pce) {
      throw new ConfigException("Invalid configuration file: " + file, pce);
    }
  }

  /**
   * Checks the options for consistency.
   *
   * @return this configuration.
   * @throws ConfigException naming the first invalid or conflicting option.
   */
  public IngestConfig validate() throws ConfigException {
    requirePositive("concurrency", mConcurrency);
    requirePositive("fetch-concurrency", mFetchConcurrency);
    requirePositive("buffer-size", mBufferSize);
    requirePositive("batch-size", mBatchSize);
    requirePositive("sink-concurrency", mSinkConcurrency);
    requirePositive("log-rate", mLogRate);
    if (mMaxMsgs < 0) {
      throw new ConfigException("max-msgs must not be negative, got " + mMaxMsgs);
    }
    if (mMaxRetries < 0) {
      throw new ConfigException("max-retries must not be negative, got " + mMaxRetries);
    }
    if (mRetryBackoffMillis < 0 || mMaxBackoffMillis < mRetryBackoffMillis) {
      throw new ConfigException(String.format(
          "Invalid backoff: retry-backoff-ms=%d max-backoff-ms=%d",
          mRetryBackoffMillis, mMaxBackoffMillis));
    }
    if (mFlushIntervalMillis <= 0 || mShutdownDeadlineMillis <= 0) {
      throw new ConfigException("flush-interval-ms and shutdown-deadline-ms must be positive.");
    }
    if (isNullOrEmpty(mIndex)) {
      throw new ConfigException("index must not be empty.");
    }
    if (isNullOrEmpty(mPilosaHost)) {
      throw new ConfigException("pilosa-host must not be empty.");
    }
    final boolean hasPrimaryKey = !mPrimaryKeyFields.isEmpty();
    final boolean hasIdField = !isNullOrEmpty(mIdField);
    if (hasPrimaryKey == hasIdField) {
      throw new ConfigException(
          "Exactly one of primary-key-fields and id-field must be set, got primary-key-fields="
          + Joiner.on(',').join(mPrimaryKeyFields) + " id-field=" + mIdField);
    }
    final boolean hasUrlFile = !isNullOrEmpty(mUrlFile);
    final boolean hasTopics = !mTopics.isEmpty();
    if (hasUrlFile == hasTopics) {
      throw new ConfigException("Exactly one of url-file and topics must be set.");
    }
    if (hasTopics && mKafkaHosts.isEmpty()) {
      throw new ConfigException("kafka-hosts must not be empty when consuming topics.");
    }
    getFieldDelimiterChar();
    return this;
  }

  /**
   * Rejects a non-positive option.
   *
   * @param key Option key.
   * @param value Option value.
   * @throws ConfigException if the value is not positive.
   */
  private static void requirePositive(String key, long value) throws ConfigException {
    if (value <= 0) {
      throw new ConfigException(key + " must be positive, got " + value);
    }
  }

  /**
   * Whether an optional string option is unset.
   *
   * @param value The option value.
   * @return true if null or empty.
   */
  private static boolean isNullOrEmpty(String value) {
    return null == value || value.trim().isEmpty();
  }

  /** @return the number of decode and map workers. */
  public int getConcurrency() {
    return mConcurrency;
  }

  /** @return the number of parallel fetches. */
  public int getFetchConcurrency() {
    return mFetchConcurrency;
  }

  /** @return the capacity of the decoder input queue. */
  public int getBufferSize() {
    return mBufferSize;
  }

  /** @return whether bodies are read whole before decoding. */
  public boolean isUseReadAll() {
    return mUseReadAll;
  }

  /** @return host and port of the index. */
  public String getPilosaHost() {
    return mPilosaHost;
  }

  /** @return the target index. */
  public String getIndex() {
    return mIndex;
  }

  /** @return the locator list path, or null in bus mode. */
  public String getUrlFile() {
    return isNullOrEmpty(mUrlFile) ? null : mUrlFile;
  }

  /** @return the topics to consume, empty in file mode. */
  public List<String> getTopics() {
    return mTopics;
  }

  /** @return the primary key fields, empty when the column id comes from a field. */
  public List<String> getPrimaryKeyFields() {
    return mPrimaryKeyFields;
  }

  /** @return the column id field, or null. */
  public String getIdField() {
    return isNullOrEmpty(mIdField) ? null : mIdField;
  }

  /** @return the packed boolean field, or null when booleans are not packed. */
  public String getPackBools() {
    return isNullOrEmpty(mPackBools) ? null : mPackBools;
  }

  /** @return mutations per batch. */
  public int getBatchSize() {
    return mBatchSize;
  }

  /** @return records admitted before draining, 0 for no limit. */
  public long getMaxMsgs() {
    return mMaxMsgs;
  }

  /** @return the Kafka bootstrap servers. */
  public List<String> getKafkaHosts() {
    return mKafkaHosts;
  }

  /** @return the schema registry base URL. */
  public String getRegistryUrl() {
    return mRegistryUrl;
  }

  /** @return the Kafka consumer group. */
  public String getGroup() {
    return mGroup;
  }

  /** @return the schema descriptor file for delimited text, or null. */
  public String getDescriptorFile() {
    return isNullOrEmpty(mDescriptorFile) ? null : mDescriptorFile;
  }

  /** @return explicit field names of delimited text, empty to read a header row. */
  public List<String> getHeader() {
    return mHeader;
  }

  /**
   * Gets the delimited text field delimiter.
   *
   * @return the delimiter character.
   * @throws ConfigException if the option is not a single character or <code>tab</code>.
   */
  public char getFieldDelimiterChar() throws ConfigException {
    if ("tab".equalsIgnoreCase(mFieldDelimiter) || "\t".equals(mFieldDelimiter)) {
      return '\t';
    }
    if (null == mFieldDelimiter || mFieldDelimiter.length() != 1) {
      throw new ConfigException("field-delimiter must be a single character, got '"
          + mFieldDelimiter + "'");
    }
    return mFieldDelimiter.charAt(0);
  }

  /** @return the longest time a partial batch waits, in milliseconds. */
  public long getFlushIntervalMillis() {
    return mFlushIntervalMillis;
  }

  /** @return retries of a failed fetch or batch. */
  public int getMaxRetries() {
    return mMaxRetries;
  }

  /** @return wait before the first retry, in milliseconds. */
  public long getRetryBackoffMillis() {
    return mRetryBackoffMillis;
  }

  /** @return longest wait between retries, in milliseconds. */
  public long getMaxBackoffMillis() {
    return mMaxBackoffMillis;
  }

  /** @return batches applied in parallel. */
  public int getSinkConcurrency() {
    return mSinkConcurrency;
  }

  /** @return time allowed to drain after cancellation, in milliseconds. */
  public long getShutdownDeadlineMillis() {
    return mShutdownDeadlineMillis;
  }

  /** @return rejected records between two log statements. */
  public long getLogRate() {
    return mLogRate;
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("index", mIndex)
        .add("pilosa-host", mPilosaHost)
        .add("url-file", mUrlFile)
        .add("topics", mTopics)
        .add("primary-key-fields", mPrimaryKeyFields)
        .add("id-field", mIdField)
        .add("pack-bools", mPackBools)
        .add("concurrency", mConcurrency)
        .add("fetch-concurrency", mFetchConcurrency)
        .add("buffer-size", mBufferSize)
        .add("batch-size", mBatchSize)
        .add("max-msgs", mMaxMsgs)
        .toString();
  }
}
