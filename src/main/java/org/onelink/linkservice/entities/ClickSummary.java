/*
 * Copyright 2025 OneLink
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.onelink.linkservice.entities;

/**
 * Click counts for a single link, broken down by the platform each click was classified as.
 */
public record ClickSummary(String shortCode,
                           String appName,
                           long totalClicks,
                           long iosClicks,
                           long androidClicks,
                           long otherClicks) {
}
