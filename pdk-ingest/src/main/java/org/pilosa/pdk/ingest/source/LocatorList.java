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
import java.io.IOException;
import java.io.InputStream;
import java.util.List;

import com.google.common.base.Charsets;
import com.google.common.collect.ImmutableList;
import org.apache.commons.io.IOUtils;
import org.apache.commons.lang.StringUtils;

/**
 * Reads a locator list: one <code>http(s)://</code> URL or filesystem path per line. Blank
 * lines and lines starting with <code>#</code> are skipped.
 */
public final class LocatorList {
  /** Utility class. */
  private LocatorList() {}

  /**
   * Reads a locator list file.
   *
   * @param file The list.
   * @return the locators, in file order.
   * @throws FetchException if the list cannot be read.
   */
  public static List<String> read(File file) throws FetchException {
    InputStream input = null;
    try {
      input = new FileInputStream(file);
      return parse(IOUtils.toString(input, Charsets.UTF_8));
    } catch (IOException ioe) {
      throw new FetchException("Cannot read locator list " + file, false, ioe);
    } finally {
      IOUtils.closeQuietly(input);
    }
  }

  /**
   * Parses the text of a locator list.
   *
   * @param text Content of the list.
   * @return the locators, in order.
   */
  public static List<String> parse(String text) {
    final ImmutableList.Builder<String> locators = ImmutableList.builder();
    for (String line : StringUtils.split(text, "\r\n")) {
      final String locator = StringUtils.trimToEmpty(line);
      if (locator.isEmpty() || locator.startsWith("#")) {
        continue;
      }
      locators.add(locator);
    }
    return locators.build();
  }

  /**
   * Whether a locator is fetched over http.
   *
   * @param locator The locator.
   * @return true for <code>http://</code> and <code>https://</code> locators.
   */
  public static boolean isHttp(String locator) {
    return StringUtils.startsWithIgnoreCase(locator, "http://")
        || StringUtils.startsWithIgnoreCase(locator, "https://");
  }
}
