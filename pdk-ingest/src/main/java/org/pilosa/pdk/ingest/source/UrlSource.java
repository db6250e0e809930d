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

import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.apache.commons.io.IOUtils;
import org.apache.http.HttpEntity;
import org.apache.http.HttpResponse;
import org.apache.http.client.HttpClient;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.pilosa.pdk.ingest.Cancellation;
import org.pilosa.pdk.ingest.IngestConfig;
import org.pilosa.pdk.ingest.IngestCounter;
import org.pilosa.pdk.ingest.IngestMetrics;
import org.pilosa.pdk.ingest.RetryPolicy;

/**
 * Fetches the bodies behind a list of locators with a pool of fetch threads. Locators starting
 * with <code>http://</code> or <code>https://</code> are fetched with an http client, all others
 * are read as files.
 *
 * <p>When reading fully, each body is read into memory inside the retry loop, so a failure
 * part-way is retried from the start. Otherwise the open body is handed out as a stream, only
 * the connection is retried, and the fetch thread waits for the frame to be released before it
 * moves on to the next locator.</p>
 *
 * <p>Locators that still fail after the retry budget are dead-lettered and counted as
 * {@link IngestCounter#FRAMES_FAILED}; the run goes on with the other locators.</p>
 */
public final class UrlSource implements Source {
  private static final Logger LOG = LoggerFactory.getLogger(UrlSource.class);
  private static final Logger DEADLETTER_LOG =
      LoggerFactory.getLogger("deadletter." + UrlSource.class.getName());

  /** Period at which a streaming fetcher checks whether the source is closing. */
  private static final long RELEASE_POLL_MILLIS = 100L;

  private final ImmutableList<String> mLocators;
  private final HttpClient mHttpClient;
  private final int mFetchConcurrency;
  private final boolean mReadAll;
  private final RetryPolicy mRetryPolicy;
  private final IngestMetrics mMetrics;

  /** Index of the next locator to fetch. */
  private final AtomicInteger mNextLocator = new AtomicInteger(0);

  /** Number of fetch threads still running. */
  private final AtomicInteger mActiveFetchers;

  /** Fetched frames, waiting to be picked up. */
  private final BlockingQueue<Frame> mFrames;

  /** Cancelled when the source closes; interrupts backoff waits. */
  private final Cancellation mClosing = new Cancellation();

  private final AtomicBoolean mStarted = new AtomicBoolean(false);
  private final ExecutorService mExecutor;

  /**
   * Builds a source.
   *
   * @param locators Locators to fetch, in order.
   * @param httpClient Client for http locators.
   * @param fetchConcurrency Number of fetch threads.
   * @param readAll Whether to read bodies fully before handing them out.
   * @param retryPolicy Retry policy of transient failures.
   * @param metrics Run counters.
   */
  private UrlSource(
      List<String> locators,
      HttpClient httpClient,
      int fetchConcurrency,
      boolean readAll,
      RetryPolicy retryPolicy,
      IngestMetrics metrics) {
    Preconditions.checkArgument(fetchConcurrency > 0,
        "Fetch concurrency must be positive, got %s.", fetchConcurrency);
    mLocators = ImmutableList.copyOf(locators);
    mHttpClient = Preconditions.checkNotNull(httpClient);
    mFetchConcurrency = fetchConcurrency;
    mReadAll = readAll;
    mRetryPolicy = Preconditions.checkNotNull(retryPolicy);
    mMetrics = Preconditions.checkNotNull(metrics);
    mActiveFetchers = new AtomicInteger(fetchConcurrency);
    mFrames = new ArrayBlockingQueue<>(fetchConcurrency);
    mExecutor = Executors.newFixedThreadPool(fetchConcurrency,
        new ThreadFactoryBuilder()
            .setNameFormat("pdk-fetch-%d")
            .setDaemon(true)
            .build());
  }

  /**
   * Creates a source.
   *
   * @param locators Locators to fetch, in order.
   * @param httpClient Client for http locators.
   * @param fetchConcurrency Number of fetch threads.
   * @param readAll Whether to read bodies fully before handing them out.
   * @param retryPolicy Retry policy of transient failures.
   * @param metrics Run counters.
   * @return the source; fetching starts on the first call to {@link #next}.
   */
  public static UrlSource create(
      List<String> locators,
      HttpClient httpClient,
      int fetchConcurrency,
      boolean readAll,
      RetryPolicy retryPolicy,
      IngestMetrics metrics) {
    return new UrlSource(locators, httpClient, fetchConcurrency, readAll, retryPolicy, metrics);
  }

  /**
   * Creates the source of a run configured with a locator list.
   *
   * @param config The run configuration, with <code>url-file</code> set.
   * @param metrics Run counters.
   * @return the source.
   * @throws FetchException if the locator list cannot be read.
   */
  public static UrlSource fromConfig(IngestConfig config, IngestMetrics metrics)
      throws FetchException {
    Preconditions.checkArgument(null != config.getUrlFile(), "No url-file configured.");
    final List<String> locators = LocatorList.read(new File(config.getUrlFile()));
    LOG.info("Read {} locators from {}.", locators.size(), config.getUrlFile());
    return new UrlSource(
        locators,
        HttpClients.createDefault(),
        config.getFetchConcurrency(),
        config.isUseReadAll(),
        RetryPolicy.fromConfig(config),
        metrics);
  }

  /** Starts the fetch threads once. */
  private void start() {
    if (mStarted.compareAndSet(false, true)) {
      for (int i = 0; i < mFetchConcurrency; i++) {
        mExecutor.execute(new Fetcher());
      }
    }
  }

  /** {@inheritDoc} */
  @Override
  public Frame next(long timeout, TimeUnit unit) throws InterruptedException {
    start();
    return mFrames.poll(timeout, unit);
  }

  /** {@inheritDoc} */
  @Override
  public boolean isExhausted() {
    // Fetchers enqueue before they stop, so checking them first is race free.
    return mStarted.get() && mActiveFetchers.get() == 0 && mFrames.isEmpty();
  }

  /** {@inheritDoc} */
  @Override
  public void acknowledge(Frame frame) {
    LOG.debug("Frame {} fully applied.", frame);
  }

  /** {@inheritDoc} */
  @Override
  public void close() throws IOException {
    mClosing.cancel();
    mExecutor.shutdownNow();
    final List<Frame> pending = Lists.newArrayList();
    mFrames.drainTo(pending);
    for (Frame frame : pending) {
      frame.release();
    }
    try {
      if (!mExecutor.awaitTermination(RELEASE_POLL_MILLIS * 10, TimeUnit.MILLISECONDS)) {
        LOG.warn("Fetch threads did not stop in time.");
      }
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
    mHttpClient.getConnectionManager().shutdown();
  }

  /**
   * Opens the body behind a locator.
   *
   * @param locator The locator.
   * @param request Set to the http request made, so that the caller can release it.
   * @return the open body.
   * @throws FetchException if the body cannot be opened.
   */
  private InputStream open(String locator, HttpGet[] request) throws FetchException {
    if (!LocatorList.isHttp(locator)) {
      try {
        return new FileInputStream(locator);
      } catch (FileNotFoundException fnfe) {
        throw new FetchException("No such file: " + locator, false, fnfe);
      }
    }

    final HttpGet getRequest = new HttpGet(locator);
    request[0] = getRequest;
    try {
      final HttpResponse response = mHttpClient.execute(getRequest);
      final int status = response.getStatusLine().getStatusCode();
      final HttpEntity entity = response.getEntity();
      if (status != 200) {
        final String body = null == entity ? "" : EntityUtils.toString(entity);
        getRequest.releaseConnection();
        throw new FetchException(
            String.format("GET %s answered %d: %s", locator, status, body),
            status >= 500 || status == 429);
      }
      if (null == entity) {
        getRequest.releaseConnection();
        throw new FetchException("GET " + locator + " returned no body.", false);
      }
      return entity.getContent();
    } catch (FetchException fe) {
      throw fe;
    } catch (IOException ioe) {
      getRequest.releaseConnection();
      throw new FetchException("GET " + locator + " failed: " + ioe.getMessage(), true, ioe);
    }
  }

  /**
   * Fetches one locator with retries.
   *
   * @param locator The locator.
   * @param request Set to the http request made, so that the caller can release it.
   * @return the frame, or null if the source closed.
   * @throws FetchException once the retry budget is spent.
   * @throws InterruptedException if the fetch thread is interrupted.
   */
  private Frame fetch(String locator, HttpGet[] request)
      throws FetchException, InterruptedException {
    int retries = 0;
    while (true) {
      try {
        final InputStream body = open(locator, request);
        if (!mReadAll) {
          return Frame.ofStream(locator, body);
        }
        try {
          return Frame.ofBytes(locator, IOUtils.toByteArray(body));
        } catch (IOException ioe) {
          throw new FetchException(
              "Reading " + locator + " failed: " + ioe.getMessage(), true, ioe);
        } finally {
          IOUtils.closeQuietly(body);
          if (null != request[0]) {
            request[0].releaseConnection();
          }
        }
      } catch (FetchException fe) {
        if (!fe.isTransient() || !mRetryPolicy.canRetry(retries)) {
          throw fe;
        }
        LOG.warn("Fetching {} failed ({}), retrying.", locator, fe.getMessage());
        if (mRetryPolicy.backoff(retries, mClosing)) {
          return null;
        }
        retries++;
      }
    }
  }

  /** Pulls locators off the shared list until it runs out or the source closes. */
  private final class Fetcher implements Runnable {
    /** {@inheritDoc} */
    @Override
    public void run() {
      try {
        while (!mClosing.isCancelled()) {
          final int index = mNextLocator.getAndIncrement();
          if (index >= mLocators.size()) {
            break;
          }
          final String locator = mLocators.get(index);
          final HttpGet[] request = new HttpGet[1];
          final Frame frame;
          try {
            frame = fetch(locator, request);
          } catch (FetchException fe) {
            mMetrics.increment(IngestCounter.FRAMES_FAILED);
            DEADLETTER_LOG.error("Giving up on {}: {}", locator, fe.getMessage());
            continue;
          }
          if (null == frame) {
            break;
          }
          try {
            mFrames.put(frame);
            if (!frame.isMaterialized()) {
              while (!frame.awaitRelease(RELEASE_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                if (mClosing.isCancelled()) {
                  frame.release();
                }
              }
            }
          } finally {
            if (mClosing.isCancelled()) {
              frame.release();
            }
            if (!frame.isMaterialized() && null != request[0]) {
              request[0].releaseConnection();
            }
          }
        }
      } catch (InterruptedException ie) {
        Thread.interrupted();
        LOG.debug("Fetch thread interrupted.");
      } finally {
        mActiveFetchers.decrementAndGet();
      }
    }
  }
}
