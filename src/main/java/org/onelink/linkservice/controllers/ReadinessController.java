/*
 * Copyright 2025 OneLink
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.onelink.linkservice.controllers;

import com.google.cloud.bigtable.data.v2.BigtableDataClient;
import com.google.cloud.bigtable.data.v2.models.Query;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports readiness to the load balancer. The first few probes also read a row from each table so that the Bigtable
 * client has open channels before the instance takes redirect traffic.
 */
@Path("/_ready")
public class ReadinessController {

  private static final Logger logger = LoggerFactory.getLogger(ReadinessController.class);

  private final BigtableDataClient client;
  private final List<String> tableIds;
  private final AtomicInteger remainingWarmups;

  public ReadinessController(final BigtableDataClient client, final List<String> tableIds, final int warmups) {
    this.client = client;
    this.tableIds = List.copyOf(tableIds);
    this.remainingWarmups = new AtomicInteger(warmups);
  }

  @GET
  public String isReady() {
    final int remaining = remainingWarmups.getAndDecrement();

    if (remaining > 0) {
      // a failed warm-up read fails the probe; otherwise the instance reports ready even while warm-ups remain
      for (final String tableId : tableIds) {
        client.readRows(Query.create(tableId).limit(1)).stream().findAny();
      }

      logger.debug("Warmed up {} tables, {} warm-ups remaining", tableIds.size(), remaining - 1);
    }

    return "ready";
  }
}
