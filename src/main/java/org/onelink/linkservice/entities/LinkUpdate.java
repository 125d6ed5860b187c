/*
 * Copyright 2025 OneLink
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.onelink.linkservice.entities;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.Optional;
import org.onelink.linkservice.util.AbsoluteHttpUrl;

/**
 * A sparse update to a link. Absent fields leave the stored value unchanged. An explicit {@code null} can't be told
 * apart from an absent field, so removing the fallback destination takes {@code clearFallbackUrl}.
 */
public record LinkUpdate(
    Optional<@NotBlank @Size(max = LinkDefinition.MAX_APP_NAME_LENGTH) String> appName,
    Optional<@AbsoluteHttpUrl String> iosUrl,
    Optional<@AbsoluteHttpUrl String> androidUrl,
    Optional<@AbsoluteHttpUrl String> fallbackUrl,
    boolean clearFallbackUrl) {

  public LinkUpdate {
    // Jackson leaves fields missing from the request body null
    appName = appName != null ? appName : Optional.empty();
    iosUrl = iosUrl != null ? iosUrl : Optional.empty();
    androidUrl = androidUrl != null ? androidUrl : Optional.empty();
    fallbackUrl = fallbackUrl != null ? fallbackUrl : Optional.empty();
  }

  public static LinkUpdate empty() {
    return new LinkUpdate(Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty(), false);
  }

  @JsonIgnore
  @AssertTrue(message = "cannot both set and clear the fallback URL")
  public boolean isFallbackUrlUnambiguous() {
    return !(clearFallbackUrl && fallbackUrl.isPresent());
  }
}
