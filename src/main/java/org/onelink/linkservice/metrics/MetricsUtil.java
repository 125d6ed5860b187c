/*
 * Copyright 2025 OneLink
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.onelink.linkservice.metrics;

import com.codahale.metrics.SharedMetricRegistries;
import io.dropwizard.core.setup.Environment;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.FileDescriptorMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.datadog.DatadogMeterRegistry;
import org.onelink.linkservice.LinkServiceConfiguration;
import org.onelink.linkservice.LinkServiceVersion;
import org.onelink.linkservice.util.HostSupplier;

public class MetricsUtil {

  public static final String PREFIX = "links";

  private static volatile boolean registeredMetrics = false;

  private MetricsUtil() {
  }

  /**
   * Returns a dot-separated ('.') name for the given class and name parts
   */
  public static String name(Class<?> clazz, String... parts) {
    final StringBuilder sb = new StringBuilder(PREFIX);
    sb.append(".").append(clazz.getSimpleName());
    for (String part : parts) {
      sb.append(".").append(part);
    }
    return sb.toString();
  }

  public static void configureRegistries(final LinkServiceConfiguration config, final Environment environment) {

    if (registeredMetrics) {
      throw new IllegalStateException("Metric registries configured more than once");
    }

    registeredMetrics = true;

    SharedMetricRegistries.add(StorageMetrics.NAME, environment.metrics());

    if (config.getDatadogConfiguration().enabled()) {
      final DatadogMeterRegistry datadogMeterRegistry = new DatadogMeterRegistry(
          config.getDatadogConfiguration(), io.micrometer.core.instrument.Clock.SYSTEM);

      datadogMeterRegistry.config().commonTags(
          Tags.of(
              "service", "links",
              "host", HostSupplier.getHost(),
              "version", LinkServiceVersion.getServiceVersion(),
              "env", config.getDatadogConfiguration().getEnvironment()));

      Metrics.addRegistry(datadogMeterRegistry);
    }
  }

  public static void registerSystemResourceMetrics() {
    new ProcessorMetrics().bindTo(Metrics.globalRegistry);
    new FileDescriptorMetrics().bindTo(Metrics.globalRegistry);

    new JvmMemoryMetrics().bindTo(Metrics.globalRegistry);
    new JvmThreadMetrics().bindTo(Metrics.globalRegistry);
  }
}
