/*
 * Copyright 2020 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.onelink.linkservice.configuration;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Hex;

public class AuthenticationConfiguration {

  /**
   * Hex-encoded HMAC key shared with the account service that issues access tokens.
   */
  @JsonProperty
  @NotEmpty
  private String key;

  @JsonProperty
  @NotNull
  private Duration tokenLifetime = Duration.ofHours(24);

  public byte[] getKey() throws DecoderException {
    return Hex.decodeHex(key);
  }

  public Duration getTokenLifetime() {
    return tokenLifetime;
  }
}
