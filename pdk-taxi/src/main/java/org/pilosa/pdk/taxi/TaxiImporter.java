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

package org.pilosa.pdk.taxi;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import java.util.concurrent.TimeUnit;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import org.apache.commons.io.IOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.pilosa.pdk.ingest.ConfigException;
import org.pilosa.pdk.ingest.ExitStatus;
import org.pilosa.pdk.ingest.IngestConfig;
import org.pilosa.pdk.ingest.IngestCounter;
import org.pilosa.pdk.ingest.IngestMetrics;
import org.pilosa.pdk.ingest.IngestPipeline;
import org.pilosa.pdk.ingest.IngestResult;
import org.pilosa.pdk.ingest.decode.DelimitedTextDecoder;
import org.pilosa.pdk.ingest.sink.BatchSink;
import org.pilosa.pdk.ingest.sink.PilosaHttpSink;
import org.pilosa.pdk.ingest.source.Source;
import org.pilosa.pdk.ingest.source.UrlSource;

/**
 * Imports yellow cab trip files into a Pilosa index.
 *
 * <p>Trips are numbered as they are read; the number is the column of the trip. Options are
 * those of the generic ingestion, with these defaults:</p>
 * <pre>
 *   url-file=usecase/taxi/urls-short.txt
 *   index=taxi
 *   id-field=id
 * </pre>
 *
 * <pre>
 * java org.pilosa.pdk.taxi.TaxiImporter [taxi.properties]
 * </pre>
 */
public final class TaxiImporter {
  private static final Logger LOG = LoggerFactory.getLogger(TaxiImporter.class);

  /** Default list of trip files. */
  public static final String DEFAULT_URL_FILE = "usecase/taxi/urls-short.txt";

  /** Default index. */
  public static final String DEFAULT_INDEX = "taxi";

  private final IngestConfig mConfig;

  /**
   * @param config Validated options of the import.
   */
  private TaxiImporter(IngestConfig config) {
    mConfig = config;
  }

  /**
   * Creates an importer.
   *
   * @param overrides Options replacing the taxi defaults.
   * @return the importer.
   * @throws ConfigException if the resulting options are invalid.
   */
  public static TaxiImporter create(Properties overrides) throws ConfigException {
    final Properties properties = defaultProperties();
    properties.putAll(overrides);
    return new TaxiImporter(IngestConfig.fromProperties(properties).validate());
  }

  /** @return the taxi defaults. */
  static Properties defaultProperties() {
    final Properties properties = new Properties();
    properties.setProperty("url-file", DEFAULT_URL_FILE);
    properties.setProperty("index", DEFAULT_INDEX);
    properties.setProperty("id-field", SequentialIdDecoder.ID_FIELD);
    return properties;
  }

  /** @return the options of the import. */
  public IngestConfig getConfig() {
    return mConfig;
  }

  /**
   * Assembles the pipeline of an import.
   *
   * @param source Trip files.
   * @param sink Target index.
   * @param metrics Counters of the run.
   * @return the pipeline, not started.
   * @throws ConfigException if the options are invalid.
   */
  IngestPipeline buildPipeline(Source source, BatchSink sink, IngestMetrics metrics)
      throws ConfigException {
    final DelimitedTextDecoder trips = DelimitedTextDecoder.withHeaderRow(
        TaxiSchema.descriptor(), mConfig.getFieldDelimiterChar());
    final String idField = mConfig.getIdField();
    return IngestPipeline.builder()
        .withConfig(mConfig)
        .withSource(source)
        .withDecoder(null == idField ? trips : SequentialIdDecoder.create(trips, idField, 0L))
        .withSink(sink)
        .withMetrics(metrics)
        .build();
  }

  /**
   * Imports every trip file of the url file into the configured index.
   *
   * @return the outcome.
   * @throws IOException if the url file cannot be read.
   */
  public IngestResult run() throws IOException {
    final Stopwatch stopwatch = Stopwatch.createStarted();
    final IngestMetrics metrics = IngestMetrics.create();
    final IngestResult result = buildPipeline(
        UrlSource.fromConfig(mConfig, metrics),
        PilosaHttpSink.fromConfig(mConfig, false),
        metrics).run();
    LOG.info("Done: {} trips in {} s.", result.getCount(IngestCounter.RECORDS_ADMITTED),
        stopwatch.elapsed(TimeUnit.SECONDS));
    return result;
  }

  /**
   * Reads optional overrides from a properties file.
   *
   * @param args The command-line arguments: at most one properties file.
   * @return the overrides.
   * @throws ConfigException if the file cannot be read.
   */
  static Properties readOverrides(String[] args) throws ConfigException {
    Preconditions.checkArgument(args.length <= 1, "Usage: TaxiImporter [properties file]");
    final Properties overrides = new Properties();
    if (args.length == 0) {
      return overrides;
    }
    InputStream input = null;
    try {
      input = new FileInputStream(new File(args[0]));
      overrides.load(input);
    } catch (IOException ioe) {
      throw new ConfigException("Could not read configuration file: " + args[0], ioe);
    } finally {
      IOUtils.closeQuietly(input);
    }
    return overrides;
  }

  /**
   * Program entry point. Terminates the application without returning.
   *
   * @param args The arguments from the command line: at most one properties file.
   */
  public static void main(String[] args) {
    int status;
    try {
      status = create(readOverrides(args)).run().getStatus().getCode();
    } catch (ConfigException ce) {
      LOG.error("Invalid configuration: {}", ce.getMessage());
      status = ExitStatus.CONFIG_ERROR.getCode();
    } catch (IllegalArgumentException iae) {
      LOG.error(iae.getMessage());
      status = ExitStatus.CONFIG_ERROR.getCode();
    } catch (IOException ioe) {
      LOG.error("Cannot read the trip files: {}", ioe.getMessage());
      status = ExitStatus.FETCH_FAILURE.getCode();
    }
    System.exit(status);
  }
}
