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
import java.io.IOException;
import java.io.PrintStream;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.pilosa.pdk.configurator.PdkConfigurator;
import org.pilosa.pdk.ingest.mapping.InvalidSchemaDescriptorException;

/**
 * Runs one ingestion described by a properties file and exits with the status of the run.
 *
 * <pre>
 * java org.pilosa.pdk.ingest.IngestTool ingest.properties
 * </pre>
 *
 * <p>The run is cancelled gracefully when the JVM is asked to shut down. The process then ends
 * with the exit code of the shutdown signal, not with the status of the run, which is logged
 * instead.</p>
 */
public final class IngestTool {
  private static final Logger LOG = LoggerFactory.getLogger(IngestTool.class);

  /** Extra time the shutdown hook gives a cancelled run past its own deadline. */
  private static final long HOOK_GRACE_MILLIS = 1000L;

  /** Set once the shutdown hook runs, that is once the JVM is exiting already. */
  private volatile boolean mShutdownRequested = false;

  /**
   * Prints the usage of the tool and every recognized option.
   *
   * @param out Where to print.
   */
  static void printUsage(PrintStream out) {
    out.println("Usage: IngestTool <properties file>");
    out.println();
    out.println("Options:");
    for (Map.Entry<String, String> entry
        : PdkConfigurator.describe(IngestConfig.class).entrySet()) {
      out.printf("  %-22s %s%n", entry.getKey(), entry.getValue());
    }
  }

  /**
   * Runs the tool.
   *
   * @param args The command-line arguments: one properties file.
   * @return the exit code.
   */
  public int run(String[] args) {
    if (args.length != 1) {
      printUsage(System.err);
      return ExitStatus.CONFIG_ERROR.getCode();
    }

    final IngestPipeline pipeline;
    final long hookWaitMillis;
    try {
      final IngestConfig config = IngestConfig.load(new File(args[0])).validate();
      LOG.info("Configuration: {}", config);
      pipeline = IngestPipeline.fromConfig(config);
      hookWaitMillis = config.getShutdownDeadlineMillis() + HOOK_GRACE_MILLIS;
    } catch (ConfigException ce) {
      LOG.error("Invalid configuration: {}", ce.getMessage());
      return ExitStatus.CONFIG_ERROR.getCode();
    } catch (InvalidSchemaDescriptorException isde) {
      LOG.error("Invalid schema descriptor: {}", isde.getMessage());
      return ExitStatus.CONFIG_ERROR.getCode();
    } catch (IOException ioe) {
      LOG.error("Cannot start the ingestion: {}", ioe.getMessage());
      return ExitStatus.FETCH_FAILURE.getCode();
    }

    final Thread hook = shutdownHook(pipeline, hookWaitMillis);
    Runtime.getRuntime().addShutdownHook(hook);
    final IngestResult result = pipeline.run();
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException ise) {
      LOG.debug("Already shutting down.");
    }
    return result.getStatus().getCode();
  }

  /**
   * Builds the hook cancelling a run when the JVM shuts down.
   *
   * @param pipeline The running pipeline.
   * @param waitMillis How long the hook waits for the run to stop.
   * @return the hook thread, not registered.
   */
  Thread shutdownHook(final IngestPipeline pipeline, final long waitMillis) {
    return new Thread("pdk-shutdown") {
      /** {@inheritDoc} */
      @Override
      public void run() {
        mShutdownRequested = true;
        pipeline.cancel();
        try {
          pipeline.awaitCompletion(waitMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
        }
      }
    };
  }

  /** @return whether the run was stopped by the JVM shutting down. */
  boolean isShutdownRequested() {
    return mShutdownRequested;
  }

  /**
   * Java program entry point.
   *
   * @param args The command-line arguments: one properties file.
   */
  public static void main(String[] args) {
    final IngestTool tool = new IngestTool();
    final int code = tool.run(args);
    if (tool.isShutdownRequested()) {
      // System.exit() blocks while the JVM shuts down.
      LOG.warn("Run stopped by shutdown with exit code {}.", code);
      return;
    }
    System.exit(code);
  }
}
