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

package org.pilosa.pdk.ingest.batch;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import org.pilosa.pdk.ingest.FieldSpec;
import org.pilosa.pdk.ingest.Mutation;

/**
 * A group of mutations to one field, applied as a unit. All mutations of a batch share the same
 * field definition, the same kind (bit or value) and the same kind of column reference.
 */
public final class Batch {
  private static final AtomicLong SEQUENCE = new AtomicLong(0);

  private final long mSequence;
  private final FieldSpec mField;
  private final ImmutableList<Mutation> mMutations;

  /**
   * Builds a batch.
   *
   * @param mutations The mutations, at least one.
   */
  private Batch(List<Mutation> mutations) {
    Preconditions.checkArgument(!mutations.isEmpty(), "A batch holds at least one mutation.");
    mMutations = ImmutableList.copyOf(mutations);
    final Mutation first = mMutations.get(0);
    for (Mutation mutation : mMutations) {
      Preconditions.checkArgument(compatible(first, mutation),
          "Mutation %s does not belong in a batch with %s.", mutation, first);
    }
    mField = first.getField();
    mSequence = SEQUENCE.incrementAndGet();
  }

  /**
   * Creates a batch.
   *
   * @param mutations The mutations, at least one, all compatible with each other.
   * @return the batch.
   */
  public static Batch create(List<Mutation> mutations) {
    return new Batch(mutations);
  }

  /**
   * Whether two mutations may be applied in the same batch.
   *
   * @param a A mutation.
   * @param b Another mutation.
   * @return true if they target the same field definition the same way.
   */
  public static boolean compatible(Mutation a, Mutation b) {
    return a.getField().equals(b.getField())
        && a.isValue() == b.isValue()
        && a.getColumn().isKey() == b.getColumn().isKey();
  }

  /** @return a number identifying this batch in logs. */
  public long getSequence() {
    return mSequence;
  }

  /** @return the target field. */
  public FieldSpec getField() {
    return mField;
  }

  /** @return the mutations, in arrival order. */
  public List<Mutation> getMutations() {
    return mMutations;
  }

  /** @return the number of mutations. */
  public int size() {
    return mMutations.size();
  }

  /** @return whether this batch sets integer values rather than bits. */
  public boolean isValues() {
    return mMutations.get(0).isValue();
  }

  /** @return whether columns are referenced by key. */
  public boolean hasColumnKeys() {
    return mMutations.get(0).getColumn().isKey();
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("sequence", mSequence)
        .add("field", mField.getName())
        .add("size", mMutations.size())
        .toString();
  }
}
