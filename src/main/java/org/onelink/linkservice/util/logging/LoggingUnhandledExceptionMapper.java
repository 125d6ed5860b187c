/*
 * Copyright 2013-2022 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.onelink.linkservice.util.logging;

import io.dropwizard.jersey.errors.LoggingExceptionMapper;
import jakarta.inject.Provider;
import jakarta.ws.rs.core.Context;
import org.glassfish.jersey.server.ContainerRequest;
import org.onelink.linkservice.util.UriInfoUtil;

/**
 * Logs unhandled exceptions along with the method, path template and user agent of the request that raised them.
 */
public class LoggingUnhandledExceptionMapper extends LoggingExceptionMapper<Throwable> {

  @Context
  private Provider<ContainerRequest> request;

  @Override
  protected String formatLogMessage(final long id, final Throwable exception) {
    String requestMethod = "unknown method";
    String userAgent = "missing";
    String requestPath = "/{unknown path}";

    try {
      final ContainerRequest containerRequest = request.get();

      requestMethod = containerRequest.getMethod();
      requestPath = UriInfoUtil.getPathTemplate(containerRequest.getUriInfo());
      userAgent = containerRequest.getHeaderString("user-agent");
    } catch (final Exception e) {
      logger.warn("Unexpected exception getting request details", e);
    }

    return String.format("%s at %s %s (%s)",
        super.formatLogMessage(id, exception),
        requestMethod,
        requestPath,
        userAgent);
  }
}
