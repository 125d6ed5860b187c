/*
 * Copyright 2025 OneLink
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.onelink.linkservice.storage;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import javax.annotation.Nullable;
import org.onelink.linkservice.util.ua.ClientPlatform;

/**
 * A stored short link and its per-platform destinations.
 */
public record Link(String shortCode,
                   String appName,
                   String iosUrl,
                   String androidUrl,
                   @Nullable String fallbackUrl,
                   @Nullable UUID owner,
                   Instant createdAt,
                   Instant updatedAt) {

  public Optional<String> getFallbackUrl() {
    return Optional.ofNullable(fallbackUrl);
  }

  public Optional<UUID> getOwner() {
    return Optional.ofNullable(owner);
  }

  public boolean isOwnedBy(final UUID uuid) {
    return uuid.equals(owner);
  }

  /**
   * Selects the redirect destination for the given platform. Clients that are neither iOS nor Android go to the
   * fallback URL, or to the Android URL if no fallback was configured.
   */
  public String getDestination(final ClientPlatform platform) {
    return switch (platform) {
      case IOS -> iosUrl;
      case ANDROID -> androidUrl;
      case OTHER -> getFallbackUrl().orElse(androidUrl);
    };
  }
}
