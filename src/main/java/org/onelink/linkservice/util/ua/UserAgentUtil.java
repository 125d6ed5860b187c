/*
 * Copyright 2013-2020 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.onelink.linkservice.util.ua;

import com.google.common.collect.ImmutableSet;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ua_parser.Client;
import ua_parser.Parser;

/**
 * Classifies browser User-Agent strings into a {@link ClientPlatform} and a {@link DeviceInfo}. Parsing is backed by
 * the ua-parser regex database; the mobile/tablet/bot heuristics on top of it are local.
 * <p>
 * Note that an iOS client is only classified as {@link ClientPlatform#IOS} if it is also a mobile device, while any
 * Android client (phone or tablet) is classified as {@link ClientPlatform#ANDROID}. iPads therefore fall through to
 * {@link ClientPlatform#OTHER}.
 */
public class UserAgentUtil {

  private static final Logger logger = LoggerFactory.getLogger(UserAgentUtil.class);

  private static final String IOS_FAMILY = "iOS";
  private static final String ANDROID_FAMILY = "Android";
  private static final String SPIDER_FAMILY = "Spider";
  private static final String WINDOWS_FAMILY = "Windows";

  private static final Set<String> MOBILE_DEVICE_FAMILIES = ImmutableSet.of(
      "iPhone", "iPod", "Generic Smartphone", "Generic Feature Phone", "PlayStation Vita", "iOS-Device");

  private static final Set<String> MOBILE_OS_FAMILIES = ImmutableSet.of(
      "Windows Phone", "Windows Phone OS", "Symbian OS", "Bada", "Windows CE", "Windows Mobile", "Maemo");

  private static final Set<String> MOBILE_BROWSER_FAMILIES = ImmutableSet.of(
      "IE Mobile", "Opera Mobile", "Opera Mini", "Chrome Mobile", "Chrome Mobile WebView", "Chrome Mobile iOS");

  private static final Set<String> TABLET_DEVICE_FAMILIES = ImmutableSet.of(
      "iPad", "BlackBerry Playbook", "Blackberry Playbook", "Kindle", "Kindle Fire", "Kindle Fire HD", "Galaxy Tab",
      "Xoom", "Dell Streak");

  // The parser compiles its whole regex database up front; instances are immutable and safe to share
  private static final Parser PARSER = createParser();

  private UserAgentUtil() {
  }

  public static ClientPlatform getPlatformFromUserAgentString(final String userAgentString) {
    return getDeviceInfoFromUserAgentString(userAgentString).platform();
  }

  public static DeviceInfo getDeviceInfoFromUserAgentString(final String userAgentString) {
    if (StringUtils.isBlank(userAgentString)) {
      return DeviceInfo.UNKNOWN_DEVICE;
    }

    final Client client;

    try {
      client = PARSER.parse(userAgentString);
    } catch (final RuntimeException e) {
      logger.debug("Failed to parse user agent: {}", userAgentString, e);
      return DeviceInfo.UNKNOWN_DEVICE;
    }

    final String deviceFamily = client.device != null ? client.device.family : null;
    final String osFamily = client.os != null ? client.os.family : null;
    final String browserFamily = client.userAgent != null ? client.userAgent.family : null;

    final String osMajor = client.os != null ? client.os.major : null;

    final boolean tablet = isTablet(userAgentString, deviceFamily, osFamily, osMajor, browserFamily);
    final boolean mobile = isMobile(userAgentString, deviceFamily, osFamily, browserFamily, tablet);

    return new DeviceInfo(
        classify(osFamily, mobile),
        StringUtils.defaultIfBlank(deviceFamily, DeviceInfo.UNKNOWN),
        StringUtils.defaultIfBlank(osFamily, DeviceInfo.UNKNOWN),
        client.os != null
            ? versionString(client.os.major, client.os.minor, client.os.patch, client.os.patchMinor)
            : DeviceInfo.UNKNOWN,
        StringUtils.defaultIfBlank(browserFamily, DeviceInfo.UNKNOWN),
        client.userAgent != null
            ? versionString(client.userAgent.major, client.userAgent.minor, client.userAgent.patch)
            : DeviceInfo.UNKNOWN,
        mobile,
        tablet,
        SPIDER_FAMILY.equals(deviceFamily));
  }

  private static ClientPlatform classify(final String osFamily, final boolean mobile) {
    if (mobile && IOS_FAMILY.equals(osFamily)) {
      return ClientPlatform.IOS;
    }

    if (ANDROID_FAMILY.equals(osFamily)) {
      return ClientPlatform.ANDROID;
    }

    return ClientPlatform.OTHER;
  }

  private static boolean isTablet(final String userAgentString, final String deviceFamily, final String osFamily,
      final String osMajor, final String browserFamily) {

    if (TABLET_DEVICE_FAMILIES.contains(deviceFamily)) {
      return true;
    }

    // Newer Android tablets don't announce "Mobile Safari"; Firefox never does
    if (ANDROID_FAMILY.equals(osFamily)
        && !userAgentString.contains("Mobile Safari")
        && !"Firefox Mobile".equals(browserFamily)) {
      return true;
    }

    // Windows RT parses as family "Windows" with major version "RT"
    if (WINDOWS_FAMILY.equals(osFamily) && StringUtils.startsWith(osMajor, "RT")) {
      return true;
    }

    return "Firefox OS".equals(osFamily) && !StringUtils.contains(browserFamily, "Mobile");
  }

  private static boolean isMobile(final String userAgentString, final String deviceFamily, final String osFamily,
      final String browserFamily, final boolean tablet) {

    if (MOBILE_DEVICE_FAMILIES.contains(deviceFamily) || MOBILE_BROWSER_FAMILIES.contains(browserFamily)) {
      return true;
    }

    if ((ANDROID_FAMILY.equals(osFamily) || "Firefox OS".equals(osFamily)) && !tablet) {
      return true;
    }

    if ("BlackBerry OS".equals(osFamily) && !"Blackberry Playbook".equals(deviceFamily)) {
      return true;
    }

    if (MOBILE_OS_FAMILIES.contains(osFamily)) {
      return true;
    }

    if (userAgentString.contains("J2ME") || userAgentString.contains("MIDP")) {
      return true;
    }

    // Google's mobile crawlers
    if (userAgentString.contains("iPhone;") || userAgentString.contains("Googlebot-Mobile")) {
      return true;
    }

    if (SPIDER_FAMILY.equals(deviceFamily) && StringUtils.contains(browserFamily, "Mobile")) {
      return true;
    }

    return userAgentString.contains("NokiaBrowser") && userAgentString.contains("Mobile");
  }

  private static String versionString(final String... parts) {
    final String version = Stream.of(parts)
        .filter(StringUtils::isNotBlank)
        .collect(Collectors.joining("."));

    return version.isEmpty() ? DeviceInfo.UNKNOWN : version;
  }

  private static Parser createParser() {
    try {
      return new Parser();
    } catch (final Exception e) {
      throw new IllegalStateException("Failed to load user agent regex database", e);
    }
  }
}
