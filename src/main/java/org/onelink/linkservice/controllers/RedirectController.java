/*
 * Copyright 2025 OneLink
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.onelink.linkservice.controllers;

import com.codahale.metrics.annotation.Timed;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Tags;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.Response;
import java.net.URI;
import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import javax.annotation.Nullable;
import org.onelink.linkservice.metrics.MetricsUtil;
import org.onelink.linkservice.metrics.UserAgentTagUtil;
import org.onelink.linkservice.storage.ClickEvent;
import org.onelink.linkservice.storage.ClicksManager;
import org.onelink.linkservice.storage.Link;
import org.onelink.linkservice.storage.LinksManager;
import org.onelink.linkservice.util.IpAddressUtil;
import org.onelink.linkservice.util.ua.DeviceInfo;
import org.onelink.linkservice.util.ua.UserAgentUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves short codes and redirects visitors to the destination for their platform.
 */
@Path("/{shortCode: [A-Za-z0-9]+}")
public class RedirectController {

  private static final Logger logger = LoggerFactory.getLogger(RedirectController.class);

  private static final String REDIRECT_COUNTER_NAME = MetricsUtil.name(RedirectController.class, "redirect");
  private static final String CLICK_RECORDING_FAILED_COUNTER_NAME =
      MetricsUtil.name(RedirectController.class, "clickRecordingFailed");

  static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";

  private final LinksManager linksManager;
  private final ClicksManager clicksManager;
  private final boolean recordClicks;
  private final Clock clock;

  public RedirectController(final LinksManager linksManager, final ClicksManager clicksManager,
      final boolean recordClicks, final Clock clock) {

    this.linksManager = linksManager;
    this.clicksManager = clicksManager;
    this.recordClicks = recordClicks;
    this.clock = clock;
  }

  @Timed
  @GET
  public CompletableFuture<Response> redirect(@PathParam("shortCode") final String shortCode,
      @HeaderParam(HttpHeaders.USER_AGENT) @Nullable final String userAgent,
      @HeaderParam(FORWARDED_FOR_HEADER) @Nullable final String forwardedFor,
      @Context final HttpServletRequest request) {

    return linksManager.get(shortCode).thenApply(maybeLink -> {
      final Link link = maybeLink.orElseThrow(() -> new WebApplicationException(Response.Status.NOT_FOUND));
      final DeviceInfo deviceInfo = UserAgentUtil.getDeviceInfoFromUserAgentString(userAgent);

      Metrics.counter(REDIRECT_COUNTER_NAME, Tags.of(UserAgentTagUtil.getPlatformTag(deviceInfo.platform())))
          .increment();

      if (recordClicks) {
        final String clientIp = IpAddressUtil.getClientIp(forwardedFor, request != null ? request.getRemoteAddr() : null);
        recordClick(ClickEvent.of(shortCode, deviceInfo, IpAddressUtil.hash(clientIp), clock.instant()));
      }

      return Response.temporaryRedirect(URI.create(link.getDestination(deviceInfo.platform()))).build();
    });
  }

  private void recordClick(final ClickEvent click) {
    try {
      clicksManager.record(click).whenComplete((ignored, throwable) -> {
        if (throwable != null) {
          logClickRecordingFailure(click, throwable);
        }
      });
    } catch (final RuntimeException e) {
      logClickRecordingFailure(click, e);
    }
  }

  private static void logClickRecordingFailure(final ClickEvent click, final Throwable throwable) {
    Metrics.counter(CLICK_RECORDING_FAILED_COUNTER_NAME).increment();
    logger.warn("Failed to record click for {}", click.shortCode(), throwable);
  }
}
