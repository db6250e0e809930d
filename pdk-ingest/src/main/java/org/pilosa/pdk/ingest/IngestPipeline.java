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

import java.io.Closeable;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.apache.commons.io.IOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.pilosa.pdk.ingest.batch.BatchApplier;
import org.pilosa.pdk.ingest.batch.BatchRouter;
import org.pilosa.pdk.ingest.batch.FrameTracker;
import org.pilosa.pdk.ingest.decode.CachingSchemaResolver;
import org.pilosa.pdk.ingest.decode.Decoder;
import org.pilosa.pdk.ingest.decode.DelimitedTextDecoder;
import org.pilosa.pdk.ingest.decode.RecordReader;
import org.pilosa.pdk.ingest.decode.RegistrySchemaResolver;
import org.pilosa.pdk.ingest.decode.SchemaEncodedDecoder;
import org.pilosa.pdk.ingest.decode.SchemaResolutionException;
import org.pilosa.pdk.ingest.mapping.IdAssignment;
import org.pilosa.pdk.ingest.mapping.RecordMapper;
import org.pilosa.pdk.ingest.mapping.SchemaDescriptor;
import org.pilosa.pdk.ingest.sink.BatchSink;
import org.pilosa.pdk.ingest.sink.PilosaHttpSink;
import org.pilosa.pdk.ingest.source.Frame;
import org.pilosa.pdk.ingest.source.KafkaSource;
import org.pilosa.pdk.ingest.source.Source;
import org.pilosa.pdk.ingest.source.UrlSource;

/**
 * Runs an ingestion: frames flow from a {@link Source} to a pool of decode workers, each of
 * which decodes a frame, maps its records to mutations and routes them to per-field batchers,
 * which apply them to a {@link BatchSink}.
 *
 * <p>Stages are connected by bounded queues, so a slow sink slows the source down. Frames of the
 * same partition always go to the same decode worker. A frame is acknowledged to its source once
 * every mutation derived from it is applied.</p>
 *
 * <p>The run ends when the source is exhausted, when the message cap is reached, or when the run
 * is cancelled. After cancellation, stages still running when the shutdown deadline expires are
 * interrupted.</p>
 *
 * <pre>
 * final IngestPipeline pipeline = IngestPipeline.builder()
 *     .withConfig(config)
 *     .withSource(source)
 *     .withDecoder(decoder)
 *     .withSink(sink)
 *     .build();
 * final IngestResult result = pipeline.run();
 * </pre>
 */
public final class IngestPipeline {
  private static final Logger LOG = LoggerFactory.getLogger(IngestPipeline.class);
  private static final Logger DEADLETTER_LOG =
      LoggerFactory.getLogger("deadletter." + IngestPipeline.class.getName());

  /** Period at which blocked stages look for cancellation. */
  private static final long POLL_MILLIS = 100L;

  /** Tells a decode worker to stop. */
  private static final Frame END = Frame.ofBytes("<end>", new byte[0]);

  private final IngestConfig mConfig;
  private final Source mSource;
  private final Decoder mDecoder;
  private final RecordMapper mMapper;
  private final BatchSink mSink;
  private final IngestMetrics mMetrics;
  private final List<Closeable> mResources;
  private final Cancellation mCancellation = new Cancellation();

  private final AtomicBoolean mStarted = new AtomicBoolean(false);
  private final CountDownLatch mFinished = new CountDownLatch(1);

  /** Records admitted so far, for the message cap. */
  private final AtomicLong mAdmitted = new AtomicLong(0);
  private final AtomicBoolean mAdmissionClosed = new AtomicBoolean(false);

  private final AtomicInteger mSchemaErrors = new AtomicInteger(0);

  /** When a cancelled run is forced to stop, on the {@link System#nanoTime()} clock. */
  private volatile long mForceDeadlineNanos = Long.MAX_VALUE;

  /** Rate-limits the logging of malformed records. */
  private final AtomicLong mMalformedLogged = new AtomicLong(0);

  /**
   * Builds a pipeline.
   *
   * @param builder The builder holding the stages.
   */
  private IngestPipeline(Builder builder) {
    mConfig = builder.mConfig;
    mSource = builder.mSource;
    mDecoder = builder.mDecoder;
    mSink = builder.mSink;
    mMetrics = builder.mMetrics;
    mResources = builder.mResources;
    mMapper = RecordMapper.create(
        builder.mIdAssignment, mConfig.getPackBools(), mMetrics, mConfig.getLogRate());
  }

  /** @return a new builder. */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builds the pipeline described by a configuration: a bus consumer decoding registry framed
   * messages when <code>topics</code> is set, otherwise a locator list of delimited text.
   *
   * @param config The run configuration.
   * @return the pipeline.
   * @throws ConfigException if the configuration is invalid.
   * @throws IOException if the schema descriptor or the locator list cannot be read.
   */
  public static IngestPipeline fromConfig(IngestConfig config) throws IOException {
    config.validate();
    final IdAssignment idAssignment = IdAssignment.fromConfig(config);
    final IngestMetrics metrics = IngestMetrics.create();
    final Builder builder = builder()
        .withConfig(config)
        .withIdAssignment(idAssignment)
        .withMetrics(metrics);

    if (!config.getTopics().isEmpty()) {
      final RegistrySchemaResolver registry =
          RegistrySchemaResolver.create(URI.create(config.getRegistryUrl()));
      builder.withDecoder(SchemaEncodedDecoder.create(CachingSchemaResolver.create(registry)))
          .withResource(registry)
          .withSource(KafkaSource.fromConfig(config, metrics));
    } else {
      if (null == config.getDescriptorFile()) {
        throw new ConfigException("descriptor-file is required with url-file.");
      }
      final SchemaDescriptor descriptor = readDescriptor(new File(config.getDescriptorFile()));
      final char delimiter = config.getFieldDelimiterChar();
      builder.withDecoder(config.getHeader().isEmpty()
              ? DelimitedTextDecoder.withHeaderRow(descriptor, delimiter)
              : DelimitedTextDecoder.withHeader(descriptor, delimiter, config.getHeader()))
          .withSource(UrlSource.fromConfig(config, metrics));
    }
    return builder
        .withSink(PilosaHttpSink.fromConfig(config, idAssignment.hasColumnKeys()))
        .build();
  }

  /**
   * Reads a JSON schema descriptor file.
   *
   * @param file The file.
   * @return the descriptor.
   * @throws IOException if the file cannot be read or is invalid.
   */
  private static SchemaDescriptor readDescriptor(File file) throws IOException {
    final InputStream input = new FileInputStream(file);
    try {
      return SchemaDescriptor.fromJson(input);
    } finally {
      IOUtils.closeQuietly(input);
    }
  }

  /** @return the counters of this run. */
  public IngestMetrics getMetrics() {
    return mMetrics;
  }

  /**
   * Stops the run: the source stops, queued frames are dropped, pending batches get one last
   * attempt, and stages still running after the shutdown deadline are interrupted. Returns at
   * once; {@link #run()} returns when the run has stopped.
   */
  public void cancel() {
    if (mCancellation.isCancelled()) {
      return;
    }
    mForceDeadlineNanos = System.nanoTime()
        + TimeUnit.MILLISECONDS.toNanos(mConfig.getShutdownDeadlineMillis());
    LOG.info("Cancelling the run.");
    mCancellation.cancel();
  }

  /**
   * Waits for {@link #run()} to return.
   *
   * @param timeout How long to wait at most.
   * @param unit Unit of the timeout.
   * @return true if the run has finished.
   * @throws InterruptedException if the calling thread is interrupted.
   */
  public boolean awaitCompletion(long timeout, TimeUnit unit) throws InterruptedException {
    return mFinished.await(timeout, unit);
  }

  /** @return whether a cancelled run ran past its shutdown deadline. */
  private boolean isForced() {
    return mCancellation.isCancelled() && System.nanoTime() - mForceDeadlineNanos > 0;
  }

  /**
   * Runs the ingestion to completion in the calling thread, which pumps the source.
   *
   * @return the outcome.
   */
  public IngestResult run() {
    Preconditions.checkState(mStarted.compareAndSet(false, true), "A pipeline runs only once.");
    final int concurrency = mConfig.getConcurrency();
    final int queueCapacity = Math.max(1, mConfig.getBufferSize() / concurrency);
    final List<BlockingQueue<Frame>> queues = Lists.newArrayListWithCapacity(concurrency);
    for (int i = 0; i < concurrency; i++) {
      queues.add(new ArrayBlockingQueue<Frame>(queueCapacity));
    }

    final BatchApplier applier = BatchApplier.create(
        mSink, RetryPolicy.fromConfig(mConfig), mConfig.getSinkConcurrency(), mMetrics,
        mCancellation);
    final BatchRouter router = BatchRouter.create(
        mConfig.getBatchSize(), mConfig.getFlushIntervalMillis(), applier);
    final ExecutorService workers = Executors.newFixedThreadPool(concurrency,
        new ThreadFactoryBuilder()
            .setNameFormat("pdk-decode-%d")
            .setDaemon(true)
            .build());
    for (BlockingQueue<Frame> queue : queues) {
      workers.execute(new DecodeWorker(queue, router));
    }
    LOG.info("Starting ingestion into index {} with {} decode workers.",
        mConfig.getIndex(), concurrency);

    boolean sourceFailed = false;
    boolean interrupted = false;
    try {
      try {
        pump(queues);
      } catch (IOException ioe) {
        LOG.error("Source failed, draining the pipeline.", ioe);
        sourceFailed = true;
      } catch (RuntimeException re) {
        LOG.error("Source failed unexpectedly, draining the pipeline.", re);
        sourceFailed = true;
      }
      for (BlockingQueue<Frame> queue : queues) {
        offer(queue, END, true);
      }
      workers.shutdown();
      if (!awaitStage(workers, "decode")) {
        workers.shutdownNow();
      }
      while (!router.finish(POLL_MILLIS, TimeUnit.MILLISECONDS)) {
        if (isForced()) {
          break;
        }
      }
      if (!awaitStage(router)) {
        router.forceStop();
      }
    } catch (InterruptedException ie) {
      LOG.warn("Run interrupted, stopping every stage.");
      interrupted = true;
      cancel();
      workers.shutdownNow();
      router.forceStop();
    } finally {
      applier.close();
      closeQuietly(mSource, "source");
      closeQuietly(mSink, "sink");
      for (Closeable resource : mResources) {
        closeQuietly(resource, resource.toString());
      }
      mFinished.countDown();
    }
    if (interrupted) {
      Thread.currentThread().interrupt();
    }

    final ExitStatus status;
    if (sourceFailed) {
      status = ExitStatus.FETCH_FAILURE;
    } else if (mMetrics.get(IngestCounter.BATCHES_DEAD_LETTERED) > 0) {
      status = ExitStatus.SINK_FAILURE;
    } else if (mSchemaErrors.get() > 0) {
      status = ExitStatus.SCHEMA_ERROR;
    } else {
      status = ExitStatus.OK;
    }
    final IngestResult result =
        IngestResult.create(status, mMetrics.snapshot(), mCancellation.isCancelled());
    LOG.info("Ingestion finished: {}", result);
    return result;
  }

  /**
   * Moves frames from the source to the decode queues until the source is exhausted, the
   * message cap is reached or the run is cancelled.
   *
   * @param queues Queue of each decode worker.
   * @throws IOException if the source fails.
   * @throws InterruptedException if the calling thread is interrupted.
   */
  private void pump(List<BlockingQueue<Frame>> queues) throws IOException, InterruptedException {
    final int workers = queues.size();
    int next = 0;
    while (!mCancellation.isCancelled() && !mAdmissionClosed.get() && !mSource.isExhausted()) {
      final Frame frame = mSource.next(POLL_MILLIS, TimeUnit.MILLISECONDS);
      if (null == frame) {
        continue;
      }
      mMetrics.increment(IngestCounter.FRAMES_FETCHED);
      final Integer partitionHash = frame.getPartitionHash();
      final int worker;
      if (null == partitionHash) {
        worker = next;
        next = (next + 1) % workers;
      } else {
        worker = Math.floorMod(partitionHash, workers);
      }
      if (!offer(queues.get(worker), frame, false)) {
        frame.release();
      }
    }
    LOG.debug("Source pump stopped (cancelled: {}, capped: {}).",
        mCancellation.isCancelled(), mAdmissionClosed.get());
  }

  /**
   * Queues a frame, blocking while the queue is full.
   *
   * @param queue The queue.
   * @param frame The frame.
   * @param untilForced Whether to keep trying after cancellation, until the deadline.
   * @return whether the frame was queued.
   * @throws InterruptedException if the calling thread is interrupted.
   */
  private boolean offer(BlockingQueue<Frame> queue, Frame frame, boolean untilForced)
      throws InterruptedException {
    while (!queue.offer(frame, POLL_MILLIS, TimeUnit.MILLISECONDS)) {
      if (untilForced ? isForced() : mCancellation.isCancelled()) {
        return false;
      }
    }
    return true;
  }

  /**
   * Waits for a stage to stop, up to the deadline of a cancelled run.
   *
   * @param executor The threads of the stage.
   * @param name Name of the stage, for logs.
   * @return true if the stage stopped.
   * @throws InterruptedException if the calling thread is interrupted.
   */
  private boolean awaitStage(ExecutorService executor, String name) throws InterruptedException {
    while (!executor.awaitTermination(POLL_MILLIS, TimeUnit.MILLISECONDS)) {
      if (isForced()) {
        LOG.warn("Stage {} still running at the shutdown deadline, interrupting it.", name);
        return false;
      }
    }
    return true;
  }

  /**
   * Waits for the batchers to stop, up to the deadline of a cancelled run.
   *
   * @param router The router of the batchers.
   * @return true if the batchers stopped.
   * @throws InterruptedException if the calling thread is interrupted.
   */
  private boolean awaitStage(BatchRouter router) throws InterruptedException {
    while (!router.awaitTermination(POLL_MILLIS, TimeUnit.MILLISECONDS)) {
      if (isForced()) {
        LOG.warn("Batchers still running at the shutdown deadline, interrupting them.");
        return false;
      }
    }
    return true;
  }

  /**
   * Closes a resource, logging failures.
   *
   * @param closeable The resource.
   * @param name Name of the resource, for logs.
   */
  private static void closeQuietly(Closeable closeable, String name) {
    try {
      closeable.close();
    } catch (IOException ioe) {
      LOG.warn("Closing {} failed.", name, ioe);
    }
  }

  /**
   * Admits one record under the message cap.
   *
   * @return false once the cap is reached.
   */
  private boolean tryAdmit() {
    final long cap = mConfig.getMaxMsgs();
    while (true) {
      final long admitted = mAdmitted.get();
      if (cap > 0 && admitted >= cap) {
        mAdmissionClosed.set(true);
        return false;
      }
      if (mAdmitted.compareAndSet(admitted, admitted + 1)) {
        if (cap > 0 && admitted + 1 >= cap) {
          mAdmissionClosed.set(true);
        }
        mMetrics.increment(IngestCounter.RECORDS_ADMITTED);
        return true;
      }
    }
  }

  /**
   * Counts and logs a malformed record.
   *
   * @param mre The failure.
   */
  private void malformed(MalformedRecordException mre) {
    mMetrics.increment(IngestCounter.RECORDS_MALFORMED);
    final long logged = mMalformedLogged.getAndIncrement();
    if (logged % mConfig.getLogRate() == 0) {
      LOG.warn("Dropping malformed record ({} so far): {}", logged + 1, mre.getMessage());
    }
  }

  /** Decodes frames, maps their records and routes the mutations. */
  private final class DecodeWorker implements Runnable {
    private final BlockingQueue<Frame> mQueue;
    private final BatchRouter mRouter;

    /**
     * @param queue Frames to decode.
     * @param router Where mutations go.
     */
    DecodeWorker(BlockingQueue<Frame> queue, BatchRouter router) {
      mQueue = queue;
      mRouter = router;
    }

    /** {@inheritDoc} */
    @Override
    public void run() {
      try {
        while (true) {
          final Frame frame = mQueue.take();
          if (END == frame) {
            break;
          }
          if (mCancellation.isCancelled()) {
            LOG.debug("Dropping frame {} of a cancelled run.", frame);
            frame.release();
            continue;
          }
          process(frame);
        }
      } catch (InterruptedException ie) {
        Thread.interrupted();
        LOG.debug("Decode worker interrupted.");
      }
    }

    /**
     * Decodes one frame.
     *
     * @param frame The frame.
     * @throws InterruptedException if interrupted while routing.
     */
    private void process(Frame frame) throws InterruptedException {
      final FrameTracker tracker = FrameTracker.create(frame, mSource);
      try {
        final RecordReader reader = mDecoder.decode(frame);
        try {
          final SchemaDescriptor descriptor = reader.getDescriptor();
          while (true) {
            if (mCancellation.isCancelled()) {
              tracker.fail();
              break;
            }
            final Record record;
            try {
              record = reader.next();
            } catch (MalformedRecordException mre) {
              malformed(mre);
              continue;
            }
            if (null == record) {
              break;
            }
            if (!tryAdmit()) {
              LOG.debug("Message cap reached, leaving the rest of {} unread.", frame);
              tracker.fail();
              break;
            }
            final List<Mutation> mutations;
            try {
              mutations = mMapper.map(descriptor, record);
            } catch (MalformedRecordException mre) {
              malformed(mre);
              continue;
            }
            for (Mutation mutation : mutations) {
              mRouter.route(mutation, tracker);
            }
          }
        } finally {
          IOUtils.closeQuietly(reader);
        }
      } catch (SchemaResolutionException sre) {
        mSchemaErrors.incrementAndGet();
        mMetrics.increment(IngestCounter.FRAMES_FAILED);
        tracker.fail();
        LOG.error("Cannot resolve the schema of {}: {}", frame, sre.getMessage());
      } catch (MalformedRecordException mre) {
        malformed(mre);
      } catch (IOException ioe) {
        mMetrics.increment(IngestCounter.FRAMES_FAILED);
        tracker.fail();
        DEADLETTER_LOG.error("Giving up on the rest of {}: {}", frame, ioe.getMessage());
      } catch (InterruptedException ie) {
        tracker.fail();
        throw ie;
      } finally {
        tracker.finishDecoding();
        frame.release();
      }
    }
  }

  /** Assembles a pipeline. */
  public static final class Builder {
    private IngestConfig mConfig;
    private Source mSource;
    private Decoder mDecoder;
    private BatchSink mSink;
    private IdAssignment mIdAssignment;
    private IngestMetrics mMetrics;
    private final List<Closeable> mResources = Lists.newArrayList();

    /** Use {@link IngestPipeline#builder()}. */
    private Builder() {}

    /**
     * @param config The run configuration.
     * @return this builder.
     */
    public Builder withConfig(IngestConfig config) {
      mConfig = config;
      return this;
    }

    /**
     * @param source Where frames come from.
     * @return this builder.
     */
    public Builder withSource(Source source) {
      mSource = source;
      return this;
    }

    /**
     * @param decoder How frames are decoded.
     * @return this builder.
     */
    public Builder withDecoder(Decoder decoder) {
      mDecoder = decoder;
      return this;
    }

    /**
     * @param sink Where batches go.
     * @return this builder.
     */
    public Builder withSink(BatchSink sink) {
      mSink = sink;
      return this;
    }

    /**
     * Sets the column policy. Defaults to the one the configuration describes.
     *
     * @param idAssignment The column policy.
     * @return this builder.
     */
    public Builder withIdAssignment(IdAssignment idAssignment) {
      mIdAssignment = idAssignment;
      return this;
    }

    /**
     * Sets the counters, which should be the ones the source updates. Defaults to new
     * counters.
     *
     * @param metrics The counters.
     * @return this builder.
     */
    public Builder withMetrics(IngestMetrics metrics) {
      mMetrics = metrics;
      return this;
    }

    /**
     * Adds a resource to close when the run ends.
     *
     * @param resource The resource.
     * @return this builder.
     */
    public Builder withResource(Closeable resource) {
      mResources.add(resource);
      return this;
    }

    /**
     * Builds the pipeline.
     *
     * @return the pipeline.
     * @throws ConfigException if the configuration is invalid.
     */
    public IngestPipeline build() throws ConfigException {
      Preconditions.checkState(null != mConfig, "No configuration.");
      Preconditions.checkState(null != mSource, "No source.");
      Preconditions.checkState(null != mDecoder, "No decoder.");
      Preconditions.checkState(null != mSink, "No sink.");
      mConfig.validate();
      if (null == mIdAssignment) {
        mIdAssignment = IdAssignment.fromConfig(mConfig);
      }
      if (null == mMetrics) {
        mMetrics = IngestMetrics.create();
      }
      return new IngestPipeline(this);
    }
  }
}
