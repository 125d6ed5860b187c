/*
 * Copyright 2020 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.onelink.linkservice.metrics;

public class StorageMetrics {

  public static final String NAME = "link_service";

  private StorageMetrics() {
  }
}
