/*
 * Copyright 2025 OneLink
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.onelink.linkservice.links;

import com.google.common.annotations.VisibleForTesting;
import java.security.SecureRandom;
import java.util.Random;

/**
 * Generates random, URL-safe short codes. Generated codes are <em>not</em> guaranteed to be unique; callers must
 * check them against the link store.
 */
public class ShortCodeGenerator {

  /**
   * Alphanumerics without the visually ambiguous {@code 0}, {@code 1}, {@code I}, {@code O} and {@code l}.
   */
  public static final String ALPHABET = "23456789ABCDEFGHJKLMNPQRSTUVWXYZabcdefghijkmnopqrstuvwxyz";

  public static final int DEFAULT_LENGTH = 6;

  private final Random random;
  private final int defaultLength;

  public ShortCodeGenerator() {
    this(DEFAULT_LENGTH);
  }

  public ShortCodeGenerator(final int defaultLength) {
    this(new SecureRandom(), defaultLength);
  }

  @VisibleForTesting
  ShortCodeGenerator(final Random random, final int defaultLength) {
    if (defaultLength <= 0) {
      throw new IllegalArgumentException("Short code length must be positive");
    }

    this.random = random;
    this.defaultLength = defaultLength;
  }

  public String generate() {
    return generate(defaultLength);
  }

  public String generate(final int length) {
    if (length <= 0) {
      throw new IllegalArgumentException("Short code length must be positive");
    }

    final char[] code = new char[length];

    for (int i = 0; i < length; i++) {
      code[i] = ALPHABET.charAt(random.nextInt(ALPHABET.length()));
    }

    return new String(code);
  }
}
