/*
 * Copyright 2025 OneLink
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.onelink.linkservice.util;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Set;

public class AbsoluteHttpUrlValidator implements ConstraintValidator<AbsoluteHttpUrl, String> {

  private static final Set<String> ALLOWED_SCHEMES = Set.of("http", "https");

  @Override
  public boolean isValid(final String value, final ConstraintValidatorContext context) {
    if (value == null) {
      return true;
    }

    return isAbsoluteHttpUrl(value);
  }

  public static boolean isAbsoluteHttpUrl(final String value) {
    try {
      final URI uri = new URI(value);

      return uri.getScheme() != null
          && ALLOWED_SCHEMES.contains(uri.getScheme().toLowerCase(Locale.ROOT))
          && uri.getHost() != null;
    } catch (final URISyntaxException e) {
      return false;
    }
  }
}
