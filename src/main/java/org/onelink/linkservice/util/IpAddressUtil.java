/*
 * Copyright 2025 OneLink
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.onelink.linkservice.util;

import java.nio.charset.StandardCharsets;
import javax.annotation.Nullable;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.lang3.StringUtils;

public class IpAddressUtil {

  public static final String UNKNOWN_ADDRESS = "unknown";

  private IpAddressUtil() {
  }

  /**
   * Returns the lower-case, hex-encoded SHA-256 digest of the given address. The input is hashed as text and is not
   * validated as an address.
   */
  public static String hash(final String ipAddress) {
    return DigestUtils.sha256Hex(ipAddress.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Picks the originating client address, preferring the first entry of an {@code X-Forwarded-For} header.
   */
  public static String getClientIp(@Nullable final String forwardedFor, @Nullable final String remoteAddress) {
    if (StringUtils.isNotBlank(forwardedFor)) {
      final String first = StringUtils.substringBefore(forwardedFor, ",").trim();

      if (!first.isEmpty()) {
        return first;
      }
    }

    return StringUtils.defaultIfBlank(remoteAddress, UNKNOWN_ADDRESS);
  }
}
