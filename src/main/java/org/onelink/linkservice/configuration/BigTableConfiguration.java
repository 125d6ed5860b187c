/*
 * Copyright 2020 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.onelink.linkservice.configuration;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotEmpty;

public class BigTableConfiguration {

  @JsonProperty
  @NotEmpty
  private String projectId;

  @JsonProperty
  @NotEmpty
  private String instanceId;

  @JsonProperty
  @NotEmpty
  private String linksTableId;

  @JsonProperty
  @NotEmpty
  private String clicksTableId;

  public String getProjectId() {
    return projectId;
  }

  public String getInstanceId() {
    return instanceId;
  }

  public String getLinksTableId() {
    return linksTableId;
  }

  public String getClicksTableId() {
    return clicksTableId;
  }
}
