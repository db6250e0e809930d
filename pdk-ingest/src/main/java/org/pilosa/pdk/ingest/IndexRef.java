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

import java.util.Arrays;

import com.google.common.base.CharMatcher;
import com.google.common.base.Charsets;
import com.google.common.base.Preconditions;
import com.google.common.io.BaseEncoding;

/**
 * A reference to a row or a column of the index: either a numeric id or an opaque byte key.
 *
 * <p>The index keeps ids and keys in separate spaces, so an id never equals a key even when the
 * key spells out the same number.</p>
 */
public final class IndexRef {
  /** Matches keys that can be printed as they are. */
  private static final CharMatcher PRINTABLE = CharMatcher.inRange(' ', '~');

  private final long mId;
  private final byte[] mKey;

  /**
   * Builds a reference.
   *
   * @param id The numeric id, ignored for keys.
   * @param key The key bytes, or null for an id.
   */
  private IndexRef(long id, byte[] key) {
    mId = id;
    mKey = key;
  }

  /**
   * Creates an id reference.
   *
   * @param id The id, an unsigned 64-bit value.
   * @return a new reference.
   */
  public static IndexRef id(long id) {
    return new IndexRef(id, null);
  }

  /**
   * Creates a key reference from raw bytes.
   *
   * @param key The key bytes; copied.
   * @return a new reference.
   */
  public static IndexRef key(byte[] key) {
    Preconditions.checkNotNull(key);
    return new IndexRef(0L, Arrays.copyOf(key, key.length));
  }

  /**
   * Creates a key reference from text.
   *
   * @param key The key, stored as its UTF-8 bytes.
   * @return a new reference.
   */
  public static IndexRef key(String key) {
    Preconditions.checkNotNull(key);
    return new IndexRef(0L, key.getBytes(Charsets.UTF_8));
  }

  /** @return whether this reference is a key. */
  public boolean isKey() {
    return null != mKey;
  }

  /** @return the numeric id. */
  public long getId() {
    Preconditions.checkState(!isKey(), "Reference %s is a key, not an id.", this);
    return mId;
  }

  /** @return a copy of the key bytes. */
  public byte[] getKeyBytes() {
    Preconditions.checkState(isKey(), "Reference %s is an id, not a key.", this);
    return Arrays.copyOf(mKey, mKey.length);
  }

  /** @return the key decoded as UTF-8. */
  public String getKeyString() {
    Preconditions.checkState(isKey(), "Reference %s is an id, not a key.", this);
    return new String(mKey, Charsets.UTF_8);
  }

  /** {@inheritDoc} */
  @Override
  public boolean equals(Object other) {
    if (!(other instanceof IndexRef)) {
      return false;
    }
    final IndexRef that = (IndexRef) other;
    if (isKey() != that.isKey()) {
      return false;
    }
    return isKey() ? Arrays.equals(mKey, that.mKey) : mId == that.mId;
  }

  /** {@inheritDoc} */
  @Override
  public int hashCode() {
    return isKey() ? Arrays.hashCode(mKey) : Long.valueOf(mId).hashCode();
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    if (!isKey()) {
      return Long.toUnsignedString(mId);
    }
    final String text = new String(mKey, Charsets.ISO_8859_1);
    if (PRINTABLE.matchesAllOf(text)) {
      return "'" + text + "'";
    }
    return "0x" + BaseEncoding.base16().lowerCase().encode(mKey);
  }
}
