/*
 * Copyright 2025 OneLink
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.onelink.linkservice.configuration;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.onelink.linkservice.links.ShortCodeGenerator;
import org.onelink.linkservice.storage.LinksManager;
import org.onelink.linkservice.util.AbsoluteHttpUrl;

/**
 * @param baseUrl the public base URL under which short codes are served, e.g. {@code https://onelink.app}
 * @param codeLength the length of newly generated short codes
 * @param maxGenerationAttempts the number of short codes to try before giving up on creating a link
 * @param recordClicks whether redirects record click events
 */
public record LinkConfiguration(
    @NotBlank @AbsoluteHttpUrl String baseUrl,
    @Positive Integer codeLength,
    @Positive Integer maxGenerationAttempts,
    Boolean recordClicks) {

  public LinkConfiguration {
    if (codeLength == null) {
      codeLength = ShortCodeGenerator.DEFAULT_LENGTH;
    }
    if (maxGenerationAttempts == null) {
      maxGenerationAttempts = LinksManager.DEFAULT_MAX_GENERATION_ATTEMPTS;
    }
    if (recordClicks == null) {
      recordClicks = true;
    }
  }
}
