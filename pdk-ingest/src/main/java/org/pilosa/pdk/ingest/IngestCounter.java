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

/** Counters maintained by a pipeline run. */
public enum IngestCounter {
  /** Frames handed to the decoders. */
  FRAMES_FETCHED,
  /** Frames that could not be fetched, read to the end or resolved, and were dead-lettered. */
  FRAMES_FAILED,
  /** Records admitted by the decoders. */
  RECORDS_ADMITTED,
  /** Frames or records dropped as malformed. */
  RECORDS_MALFORMED,
  /** Record fields dropped by the mapper. */
  FIELDS_DROPPED,
  /** Mutations produced by the mapper. */
  MUTATIONS_EMITTED,
  /** Batches applied by the sink. */
  BATCHES_APPLIED,
  /** Batch attempts that failed and were retried. */
  BATCHES_RETRIED,
  /** Batches given up on. */
  BATCHES_DEAD_LETTERED,
  /** Offset commits made to the message bus. */
  OFFSETS_COMMITTED
}
