/*
 * Copyright 2013-2020 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.onelink.linkservice.util.ua;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum ClientPlatform {
    IOS,
    ANDROID,
    OTHER;

    @JsonValue
    public String getName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ClientPlatform fromName(final String name) {
        return valueOf(name.toUpperCase(Locale.ROOT));
    }
}
