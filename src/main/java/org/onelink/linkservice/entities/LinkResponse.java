/*
 * Copyright 2025 OneLink
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.onelink.linkservice.entities;

import java.time.Instant;
import javax.annotation.Nullable;
import org.onelink.linkservice.storage.Link;

public record LinkResponse(String shortCode,
                           String shortUrl,
                           String appName,
                           String iosUrl,
                           String androidUrl,
                           @Nullable String fallbackUrl,
                           long totalClicks,
                           Instant createdAt,
                           Instant updatedAt) {

  public static LinkResponse of(final Link link, final String shortUrl, final long totalClicks) {
    return new LinkResponse(link.shortCode(),
        shortUrl,
        link.appName(),
        link.iosUrl(),
        link.androidUrl(),
        link.fallbackUrl(),
        totalClicks,
        link.createdAt(),
        link.updatedAt());
  }
}
