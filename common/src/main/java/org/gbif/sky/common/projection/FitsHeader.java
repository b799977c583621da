/*
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
package org.gbif.sky.common.projection;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;

import lombok.extern.slf4j.Slf4j;

/**
 * The keyword values of a FITS primary header.
 * <p>
 * Headers are read either from a FITS file, a sequence of 80 character cards in 2880 byte blocks terminated by an
 * {@code END} card, or from a text dump of such a header with one card per line.
 * Comment cards are ignored and only the first occurrence of a keyword is kept.
 */
@Slf4j
public class FitsHeader {
  static final int CARD_LENGTH = 80;
  static final int BLOCK_LENGTH = 2880;

  private static final ImmutableList<String> WCS_KEYWORDS = ImmutableList.of("CTYPE1", "CTYPE2");
  private static final ImmutableList<String> EQUINOX_KEYWORDS = ImmutableList.of("EQUINOX", "EPOCH");
  private static final ImmutableList<String> CD_KEYWORDS =
    ImmutableList.of("CD1_1", "CD1_2", "CD2_1", "CD2_2", "CRPIX1", "CRPIX2", "CRVAL1", "CRVAL2");
  private static final ImmutableList<String> CDELT_KEYWORDS =
    ImmutableList.of("CDELT1", "CDELT2", "CRPIX1", "CRPIX2", "CRVAL1", "CRVAL2");
  // present in 3 axis headers, which do not describe a plain sky image
  private static final ImmutableList<String> UNSUPPORTED_KEYWORDS =
    ImmutableList.of("CDELT3", "CTYPE3", "CRPIX3", "CRVAL3");

  private final Map<String, String> cards;

  private FitsHeader(Map<String, String> cards) {
    this.cards = Collections.unmodifiableMap(cards);
  }

  /**
   * Reads the primary header of the given FITS file, or a text file holding one header card per line.
   *
   * @throws IOException if the file cannot be read
   * @throws IllegalArgumentException if it holds no header cards
   */
  public static FitsHeader read(File file) throws IOException {
    byte[] bytes = Files.toByteArray(file);
    log.info("Reading FITS header from {} ({} bytes)", file, bytes.length);
    return parse(new String(bytes, StandardCharsets.US_ASCII));
  }

  /**
   * Parses header text in either the fixed 80 column layout or with one card per line.
   */
  public static FitsHeader parse(String text) {
    Preconditions.checkNotNull(text, "Header text cannot be null");
    Map<String, String> cards = new LinkedHashMap<>();
    int newline = text.indexOf('\n');
    Iterable<String> lines = newline >= 0 && newline <= CARD_LENGTH
      ? Splitter.onPattern("\r?\n").split(text)
      : Splitter.fixedLength(CARD_LENGTH).split(text);

    boolean ended = false;
    for (String line : lines) {
      String keyword = keywordOf(line);
      if ("END".equals(keyword)) {
        ended = true;
        break;
      }
      int equals = line.indexOf('=');
      if (keyword.isEmpty() || equals < 0 || isCommentary(keyword)) {
        continue;
      }
      keyword = line.substring(0, equals).trim().toUpperCase(Locale.ROOT);
      cards.putIfAbsent(keyword, parseValue(line.substring(equals + 1)));
    }
    Preconditions.checkArgument(ended || !cards.isEmpty(), "No header cards found");
    return new FitsHeader(cards);
  }

  private static String keywordOf(String card) {
    return card.substring(0, Math.min(8, card.length())).trim().toUpperCase(Locale.ROOT);
  }

  private static boolean isCommentary(String keyword) {
    return "COMMENT".equals(keyword) || "HISTORY".equals(keyword);
  }

  /**
   * Extracts the value from everything after the value indicator, dropping any trailing comment.
   */
  @VisibleForTesting
  static String parseValue(String field) {
    String trimmed = field.trim();
    if (trimmed.startsWith("'")) {
      StringBuilder value = new StringBuilder();
      int i = 1;
      while (i < trimmed.length()) {
        char c = trimmed.charAt(i);
        if (c == '\'') {
          // a doubled quote is an escaped quote
          if (i + 1 < trimmed.length() && trimmed.charAt(i + 1) == '\'') {
            value.append('\'');
            i += 2;
            continue;
          }
          break;
        }
        value.append(c);
        i++;
      }
      return value.toString().trim();
    }
    int slash = trimmed.indexOf('/');
    return slash >= 0 ? trimmed.substring(0, slash).trim() : trimmed;
  }

  public boolean contains(String keyword) {
    return cards.containsKey(keyword);
  }

  public Set<String> keywords() {
    return cards.keySet();
  }

  public String getString(String keyword) {
    String value = cards.get(keyword);
    Preconditions.checkArgument(value != null, "Missing keyword %s", keyword);
    return value;
  }

  public double getDouble(String keyword) {
    String value = getString(keyword);
    try {
      // FORTRAN style exponents are legal in FITS
      return Double.parseDouble(value.replace('D', 'E').replace('d', 'e'));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Keyword " + keyword + " is not a number: " + value, e);
    }
  }

  public double getDouble(String keyword, double defaultValue) {
    return contains(keyword) ? getDouble(keyword) : defaultValue;
  }

  public int getInt(String keyword) {
    String value = getString(keyword);
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Keyword " + keyword + " is not an integer: " + value, e);
    }
  }

  /**
   * @return true if a complete CD matrix, with its reference pixel and value, is present
   */
  public boolean hasCdMatrix() {
    return CD_KEYWORDS.stream().allMatch(this::contains);
  }

  /**
   * Fails unless the header carries a usable world coordinate system. Headers produced by the wider community
   * often carry incomplete or unusual WCS descriptions that would otherwise project silently to the wrong place.
   *
   * @throws IllegalArgumentException describing the first problem found
   */
  public void checkWcs() {
    for (String keyword : WCS_KEYWORDS) {
      Preconditions.checkArgument(contains(keyword), "Missing keyword %s", keyword);
    }
    Preconditions.checkArgument(EQUINOX_KEYWORDS.stream().anyMatch(this::contains),
                                "Missing equinox or epoch keyword");
    Preconditions.checkArgument(hasCdMatrix() || CDELT_KEYWORDS.stream().allMatch(this::contains),
                                "Couldn't find a complete set of CD matrix or CDELT keywords");
    for (String keyword : UNSUPPORTED_KEYWORDS) {
      Preconditions.checkArgument(!contains(keyword), "Unsupported 3 axis WCS keyword %s found", keyword);
    }
  }

  @Override
  public String toString() {
    return "FitsHeader" + cards;
  }
}
