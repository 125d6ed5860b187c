/*
 * Copyright 2025 OneLink
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.onelink.linkservice.links;

import org.apache.commons.lang3.StringUtils;

/**
 * Qualifies short codes into absolute short links under a configured base URL.
 */
public class ShortUrlBuilder {

  private final String baseUrl;

  public ShortUrlBuilder(final String baseUrl) {
    this.baseUrl = normalize(baseUrl);
  }

  public String build(final String shortCode) {
    return baseUrl + "/" + shortCode;
  }

  public static String build(final String baseUrl, final String shortCode) {
    return normalize(baseUrl) + "/" + shortCode;
  }

  private static String normalize(final String baseUrl) {
    return StringUtils.stripEnd(baseUrl, "/");
  }
}
