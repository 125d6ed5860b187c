/*
 * Copyright 2025 OneLink
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.onelink.linkservice.controllers;

import com.codahale.metrics.annotation.Timed;
import io.dropwizard.auth.Auth;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import java.util.concurrent.CompletableFuture;
import org.onelink.linkservice.auth.User;
import org.onelink.linkservice.entities.DashboardSummary;
import org.onelink.linkservice.storage.ClicksManager;
import org.onelink.linkservice.storage.LinksManager;

@Path("/v1/dashboard")
public class DashboardController {

  private final LinksManager linksManager;
  private final ClicksManager clicksManager;

  public DashboardController(final LinksManager linksManager, final ClicksManager clicksManager) {
    this.linksManager = linksManager;
    this.clicksManager = clicksManager;
  }

  @Timed
  @GET
  @Produces(MediaType.APPLICATION_JSON)
  public CompletableFuture<DashboardSummary> getDashboard(@Auth final User user) {
    return linksManager.listAll(user.getUuid()).thenCompose(clicksManager::summarizeAll);
  }
}
