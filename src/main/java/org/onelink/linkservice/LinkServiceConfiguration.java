/*
 * Copyright 2020 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.onelink.linkservice;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.onelink.linkservice.configuration.AuthenticationConfiguration;
import org.onelink.linkservice.configuration.BigTableConfiguration;
import org.onelink.linkservice.configuration.DatadogConfiguration;
import org.onelink.linkservice.configuration.LinkConfiguration;
import org.onelink.linkservice.configuration.WarmupConfiguration;

public class LinkServiceConfiguration extends Configuration {

  @JsonProperty
  @Valid
  @NotNull
  private BigTableConfiguration bigtable;

  @JsonProperty
  @Valid
  @NotNull
  private AuthenticationConfiguration authentication;

  @JsonProperty
  @Valid
  @NotNull
  private LinkConfiguration links;

  @JsonProperty
  @Valid
  @NotNull
  private DatadogConfiguration datadog;

  @JsonProperty
  @Valid
  @NotNull
  private WarmupConfiguration warmup = new WarmupConfiguration(5);

  public BigTableConfiguration getBigTableConfiguration() {
    return bigtable;
  }

  public AuthenticationConfiguration getAuthenticationConfiguration() {
    return authentication;
  }

  public LinkConfiguration getLinkConfiguration() {
    return links;
  }

  public DatadogConfiguration getDatadogConfiguration() {
    return datadog;
  }

  public WarmupConfiguration getWarmUpConfiguration() {
    return warmup;
  }
}
