/*
 * Copyright 2026 Yellowbrick Data, Inc.
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

package ai.floedb.nameguard.validation.conflict;

import java.math.BigInteger;
import java.util.Random;
import java.util.function.UnaryOperator;

/** Name mutations used by the conflict strategies. */
public final class NameMutators {
  private static final String SUFFIX_ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";

  private NameMutators() {}

  /**
   * Increments the trailing instance number, keeping its zero padding ({@code app-009} becomes
   * {@code app-010}, {@code app-999} becomes {@code app-1000}). A name without a trailing number
   * gets {@code 1} appended.
   */
  public static UnaryOperator<String> incrementInstance() {
    return NameMutators::increment;
  }

  /** Appends {@code length} random lowercase letters and digits. */
  public static UnaryOperator<String> randomSuffix(int length, Random random) {
    if (length <= 0) {
      throw new IllegalArgumentException("suffix length must be positive");
    }
    return name -> {
      StringBuilder out = new StringBuilder(name.length() + length).append(name);
      for (int i = 0; i < length; i++) {
        out.append(SUFFIX_ALPHABET.charAt(random.nextInt(SUFFIX_ALPHABET.length())));
      }
      return out.toString();
    };
  }

  static String increment(String name) {
    int end = name.length();
    int start = end;
    while (start > 0 && Character.isDigit(name.charAt(start - 1))) {
      start--;
    }
    if (start == end) {
      return name + "1";
    }
    String digits = name.substring(start, end);
    String next = new BigInteger(digits).add(BigInteger.ONE).toString();
    StringBuilder padded = new StringBuilder(name.substring(0, start));
    for (int i = next.length(); i < digits.length(); i++) {
      padded.append('0');
    }
    return padded.append(next).toString();
  }
}
