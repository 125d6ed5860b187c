/*
 * Copyright 2020 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.onelink.linkservice.controllers;

import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import java.util.Map;

@Path("/health")
public class HealthCheckController {

  @GET
  @Produces(MediaType.APPLICATION_JSON)
  public Map<String, String> isAlive() {
    return Map.of("status", "healthy");
  }

}
