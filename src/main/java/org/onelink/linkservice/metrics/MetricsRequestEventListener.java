/*
 * Copyright 2025 OneLink
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.onelink.linkservice.metrics;

import com.codahale.metrics.MetricRegistry;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Tags;
import java.util.List;
import org.glassfish.jersey.server.monitoring.RequestEvent;
import org.glassfish.jersey.server.monitoring.RequestEventListener;
import org.onelink.linkservice.util.UriInfoUtil;

/**
 * Gathers and reports request-level metrics.
 */
public class MetricsRequestEventListener implements RequestEventListener {

  static final String REQUEST_COUNTER_NAME = MetricRegistry.name(MetricsRequestEventListener.class, "request");

  static final String PATH_TAG = "path";
  static final String METHOD_TAG = "method";
  static final String STATUS_CODE_TAG = "status";

  private final MeterRegistry meterRegistry;

  public MetricsRequestEventListener() {
    this(Metrics.globalRegistry);
  }

  @VisibleForTesting
  MetricsRequestEventListener(final MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  @Override
  public void onEvent(final RequestEvent event) {
    if (event.getType() == RequestEvent.Type.FINISHED && !event.getUriInfo().getMatchedTemplates().isEmpty()) {
      Tags tags = Tags.of(
          PATH_TAG, UriInfoUtil.getPathTemplate(event.getUriInfo()),
          METHOD_TAG, event.getContainerRequest().getMethod(),
          STATUS_CODE_TAG, String.valueOf(event.getContainerResponse().getStatus()));

      final List<String> userAgentValues = event.getContainerRequest().getRequestHeader("User-Agent");

      if (userAgentValues != null && !userAgentValues.isEmpty()) {
        tags = tags.and(UserAgentTagUtil.getPlatformTag(userAgentValues.get(0)));
      }

      meterRegistry.counter(REQUEST_COUNTER_NAME, tags).increment();
    }
  }
}
