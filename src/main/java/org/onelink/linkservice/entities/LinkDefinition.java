/*
 * Copyright 2025 OneLink
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.onelink.linkservice.entities;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import javax.annotation.Nullable;
import org.onelink.linkservice.util.AbsoluteHttpUrl;

/**
 * The destinations a caller supplies when creating a link.
 */
public record LinkDefinition(
    @NotBlank @Size(max = MAX_APP_NAME_LENGTH) String appName,
    @NotNull @AbsoluteHttpUrl String iosUrl,
    @NotNull @AbsoluteHttpUrl String androidUrl,
    @Nullable @AbsoluteHttpUrl String fallbackUrl) {

  public static final int MAX_APP_NAME_LENGTH = 100;
}
