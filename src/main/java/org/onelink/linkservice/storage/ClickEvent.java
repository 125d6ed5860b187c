/*
 * Copyright 2025 OneLink
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.onelink.linkservice.storage;

import java.time.Instant;
import org.onelink.linkservice.util.ua.ClientPlatform;
import org.onelink.linkservice.util.ua.DeviceInfo;

/**
 * A single redirect through a short link. Click events are append-only and never carry a raw client address.
 */
public record ClickEvent(String shortCode,
                         ClientPlatform platform,
                         String device,
                         String os,
                         String osVersion,
                         String browser,
                         String browserVersion,
                         String ipHash,
                         String country,
                         Instant timestamp) {

  /**
   * Geolocation is not performed, so every click is attributed to this country.
   */
  public static final String UNKNOWN_COUNTRY = "Unknown";

  public static ClickEvent of(final String shortCode, final DeviceInfo deviceInfo, final String ipHash,
      final Instant timestamp) {

    return new ClickEvent(shortCode,
        deviceInfo.platform(),
        deviceInfo.device(),
        deviceInfo.os(),
        deviceInfo.osVersion(),
        deviceInfo.browser(),
        deviceInfo.browserVersion(),
        ipHash,
        UNKNOWN_COUNTRY,
        timestamp);
  }
}
