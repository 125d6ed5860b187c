/*
 * Copyright 2025 OneLink
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.onelink.linkservice.providers;

import io.dropwizard.jersey.errors.ErrorMessage;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.onelink.linkservice.links.ShortCodeGenerationException;

@Provider
public class ShortCodeGenerationExceptionMapper implements ExceptionMapper<ShortCodeGenerationException> {

  @Override
  public Response toResponse(final ShortCodeGenerationException exception) {
    return Response.serverError()
        .type(MediaType.APPLICATION_JSON_TYPE)
        .entity(new ErrorMessage(Response.Status.INTERNAL_SERVER_ERROR.getStatusCode(), exception.getMessage()))
        .build();
  }
}
