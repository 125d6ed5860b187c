/*
 * Copyright 2025 OneLink
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.onelink.linkservice.util.ua;

/**
 * A coarse description of the device behind a User-Agent string, as used for redirect routing and click analytics.
 */
public record DeviceInfo(ClientPlatform platform,
                         String device,
                         String os,
                         String osVersion,
                         String browser,
                         String browserVersion,
                         boolean mobile,
                         boolean tablet,
                         boolean bot) {

  public static final String UNKNOWN = "Unknown";

  public static final DeviceInfo UNKNOWN_DEVICE =
      new DeviceInfo(ClientPlatform.OTHER, UNKNOWN, UNKNOWN, UNKNOWN, UNKNOWN, UNKNOWN, false, false, false);
}
