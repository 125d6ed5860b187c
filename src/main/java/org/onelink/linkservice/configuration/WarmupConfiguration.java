/*
 * Copyright 2020 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.onelink.linkservice.configuration;

import jakarta.validation.constraints.Positive;

public record WarmupConfiguration(
    // the number of times warmup logic should run
    @Positive Integer count
) { }
