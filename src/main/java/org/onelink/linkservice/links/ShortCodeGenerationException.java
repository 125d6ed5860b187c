/*
 * Copyright 2025 OneLink
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.onelink.linkservice.links;

/**
 * Indicates that no unused short code could be found within the configured number of attempts. This is a server-side
 * failure, not something a client can correct.
 */
public class ShortCodeGenerationException extends RuntimeException {

  public ShortCodeGenerationException(final int attempts) {
    super("Failed to generate a unique short code after " + attempts + " attempts");
  }
}
