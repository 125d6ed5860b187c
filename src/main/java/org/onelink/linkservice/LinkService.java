/*
 * Copyright 2020-2021 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.onelink.linkservice;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.google.cloud.bigtable.data.v2.BigtableDataClient;
import com.google.cloud.bigtable.data.v2.BigtableDataSettings;
import io.dropwizard.auth.AuthDynamicFeature;
import io.dropwizard.auth.AuthFilter;
import io.dropwizard.auth.AuthValueFactoryProvider;
import io.dropwizard.auth.basic.BasicCredentialAuthFilter;
import io.dropwizard.auth.basic.BasicCredentials;
import io.dropwizard.core.Application;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import io.dropwizard.lifecycle.Managed;
import java.time.Clock;
import java.util.List;
import org.onelink.linkservice.auth.ExternalServiceCredentialValidator;
import org.onelink.linkservice.auth.User;
import org.onelink.linkservice.auth.UserAuthenticator;
import org.onelink.linkservice.configuration.BigTableConfiguration;
import org.onelink.linkservice.configuration.LinkConfiguration;
import org.onelink.linkservice.controllers.DashboardController;
import org.onelink.linkservice.controllers.HealthCheckController;
import org.onelink.linkservice.controllers.LinksController;
import org.onelink.linkservice.controllers.ReadinessController;
import org.onelink.linkservice.controllers.RedirectController;
import org.onelink.linkservice.links.ShortCodeGenerator;
import org.onelink.linkservice.links.ShortUrlBuilder;
import org.onelink.linkservice.metrics.MetricsApplicationEventListener;
import org.onelink.linkservice.metrics.MetricsUtil;
import org.onelink.linkservice.providers.CompletionExceptionMapper;
import org.onelink.linkservice.providers.ShortCodeGenerationExceptionMapper;
import org.onelink.linkservice.storage.ClicksManager;
import org.onelink.linkservice.storage.LinksManager;
import org.onelink.linkservice.util.UncaughtExceptionHandler;
import org.onelink.linkservice.util.logging.LoggingUnhandledExceptionMapper;

public class LinkService extends Application<LinkServiceConfiguration> {

  @Override
  public String getName() {
    return "link-service";
  }

  @Override
  public void initialize(Bootstrap<LinkServiceConfiguration> bootstrap) { }

  @Override
  public void run(LinkServiceConfiguration config, Environment environment) throws Exception {
    MetricsUtil.configureRegistries(config, environment);

    UncaughtExceptionHandler.register();

    BigTableConfiguration bigTableConfiguration = config.getBigTableConfiguration();
    LinkConfiguration     linkConfiguration     = config.getLinkConfiguration();

    BigtableDataSettings bigtableDataSettings = BigtableDataSettings.newBuilder()
                                                                    .setProjectId(bigTableConfiguration.getProjectId())
                                                                    .setInstanceId(bigTableConfiguration.getInstanceId())
                                                                    .build();
    BigtableDataClient bigtableDataClient = BigtableDataClient.create(bigtableDataSettings);

    ShortCodeGenerator shortCodeGenerator = new ShortCodeGenerator(linkConfiguration.codeLength());
    ShortUrlBuilder    shortUrlBuilder    = new ShortUrlBuilder(linkConfiguration.baseUrl());
    LinksManager       linksManager       = new LinksManager(bigtableDataClient, bigTableConfiguration.getLinksTableId(), bigTableConfiguration.getClicksTableId(), shortCodeGenerator, linkConfiguration.maxGenerationAttempts(), Clock.systemUTC());
    ClicksManager      clicksManager      = new ClicksManager(bigtableDataClient, bigTableConfiguration.getClicksTableId());

    environment.lifecycle().manage(new Managed() {
      @Override
      public void start() { }

      @Override
      public void stop() {
        bigtableDataClient.close();
      }
    });

    environment.getObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    environment.jersey().register(CompletionExceptionMapper.class);
    environment.jersey().register(ShortCodeGenerationExceptionMapper.class);
    environment.jersey().register(new LoggingUnhandledExceptionMapper());

    ExternalServiceCredentialValidator credentialValidator = new ExternalServiceCredentialValidator(
        config.getAuthenticationConfiguration().getKey(),
        config.getAuthenticationConfiguration().getTokenLifetime(),
        Clock.systemUTC());

    AuthFilter<BasicCredentials, User> userAuthFilter = new BasicCredentialAuthFilter.Builder<User>().setAuthenticator(new UserAuthenticator(credentialValidator)).buildAuthFilter();

    environment.jersey().register(new AuthDynamicFeature(userAuthFilter));
    environment.jersey().register(new AuthValueFactoryProvider.Binder<>(User.class));

    environment.jersey().register(new MetricsApplicationEventListener());

    environment.jersey().register(new HealthCheckController());
    environment.jersey().register(new ReadinessController(bigtableDataClient,
        List.of(bigTableConfiguration.getLinksTableId(), bigTableConfiguration.getClicksTableId()),
        config.getWarmUpConfiguration().count()));
    environment.jersey().register(new LinksController(linksManager, clicksManager, shortUrlBuilder));
    environment.jersey().register(new DashboardController(linksManager, clicksManager));
    environment.jersey().register(new RedirectController(linksManager, clicksManager, linkConfiguration.recordClicks(), Clock.systemUTC()));

    MetricsUtil.registerSystemResourceMetrics();
  }

  public static void main(String[] argv) throws Exception {
    new LinkService().run(argv);
  }
}
