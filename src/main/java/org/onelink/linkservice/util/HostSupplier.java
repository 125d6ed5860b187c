/*
 * Copyright 2025 OneLink
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.onelink.linkservice.util;

import com.google.cloud.MetadataConfig;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Optional;
import java.util.UUID;
import org.apache.commons.lang3.StringUtils;

/**
 * Supplies a host string for metrics attribution: the local hostname if it is meaningful, then the GCP instance ID,
 * then a random ID generated once per process.
 */
public class HostSupplier {

  private static final String FALLBACK_INSTANCE_ID = UUID.randomUUID().toString();

  private HostSupplier() {
  }

  public static String getHost() {
    return getHostName()
        .orElseGet(() -> StringUtils.defaultIfBlank(MetadataConfig.getInstanceId(), FALLBACK_INSTANCE_ID));
  }

  private static Optional<String> getHostName() {
    try {
      final String hostname = InetAddress.getLocalHost().getHostName();

      return "localhost".equals(hostname) ? Optional.empty() : Optional.ofNullable(hostname);
    } catch (final UnknownHostException e) {
      return Optional.empty();
    }
  }
}
