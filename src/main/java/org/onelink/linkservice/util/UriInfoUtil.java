/*
 * Copyright 2025 OneLink
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.onelink.linkservice.util;

import jakarta.ws.rs.core.UriInfo;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.glassfish.jersey.server.ExtendedUriInfo;
import org.glassfish.jersey.uri.UriTemplate;

public class UriInfoUtil {

  private UriInfoUtil() {
  }

  /**
   * Returns the matched path template for a request, e.g. {@code /v1/links/{shortCode}}, so metrics and logs are not
   * keyed by individual short codes.
   */
  public static String getPathTemplate(final UriInfo uriInfo) {
    if (uriInfo instanceof ExtendedUriInfo extendedUriInfo) {
      return getPathTemplate(extendedUriInfo);
    }

    return "/{unknown path}";
  }

  public static String getPathTemplate(final ExtendedUriInfo uriInfo) {
    final List<UriTemplate> matchedTemplates = new ArrayList<>(uriInfo.getMatchedTemplates());
    Collections.reverse(matchedTemplates);

    final StringBuilder pathBuilder = new StringBuilder();

    for (final UriTemplate uriTemplate : matchedTemplates) {
      final String template = uriTemplate.getTemplate();

      if (!template.startsWith("/")) {
        pathBuilder.append('/');
      }

      pathBuilder.append(template);
    }

    return pathBuilder.length() == 0 ? "/" : pathBuilder.toString();
  }
}
