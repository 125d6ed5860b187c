/*
 * Copyright 2025 OneLink
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.onelink.linkservice.entities;

import javax.annotation.Nullable;

/**
 * Click counts across every link a user owns.
 *
 * @param mostClicked the summary of the owner's most-clicked link, or {@code null} if none of the owner's links has
 *                    been clicked
 */
public record DashboardSummary(int totalLinks,
                               long totalClicks,
                               long iosClicks,
                               long androidClicks,
                               long otherClicks,
                               @Nullable ClickSummary mostClicked) {
}
