/*
 * Copyright 2013-2020 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.onelink.linkservice.metrics;

import io.micrometer.core.instrument.Tag;
import org.onelink.linkservice.util.ua.ClientPlatform;
import org.onelink.linkservice.util.ua.UserAgentUtil;

/**
 * Utility class for extracting platform metrics tags from User-Agent strings.
 */
public class UserAgentTagUtil {

  public static final String PLATFORM_TAG = "platform";

  private UserAgentTagUtil() {
  }

  public static Tag getPlatformTag(final String userAgentString) {
    return getPlatformTag(UserAgentUtil.getPlatformFromUserAgentString(userAgentString));
  }

  public static Tag getPlatformTag(final ClientPlatform platform) {
    return Tag.of(PLATFORM_TAG, platform.getName());
  }
}
