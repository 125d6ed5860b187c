/*
 * Copyright 2025 OneLink
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.onelink.linkservice.controllers;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.reset;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.dropwizard.auth.AuthValueFactoryProvider;
import io.dropwizard.jersey.errors.ErrorMessage;
import io.dropwizard.testing.junit5.DropwizardExtensionsSupport;
import io.dropwizard.testing.junit5.ResourceExtension;
import jakarta.ws.rs.client.Entity;
import jakarta.ws.rs.core.GenericType;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.onelink.linkservice.auth.User;
import org.onelink.linkservice.entities.ClickSummary;
import org.onelink.linkservice.entities.LinkDefinition;
import org.onelink.linkservice.entities.LinkResponse;
import org.onelink.linkservice.entities.LinkUpdate;
import org.onelink.linkservice.links.ShortCodeGenerationException;
import org.onelink.linkservice.links.ShortUrlBuilder;
import org.onelink.linkservice.providers.CompletionExceptionMapper;
import org.onelink.linkservice.providers.ShortCodeGenerationExceptionMapper;
import org.onelink.linkservice.storage.ClickEvent;
import org.onelink.linkservice.storage.ClicksManager;
import org.onelink.linkservice.storage.Link;
import org.onelink.linkservice.storage.LinksManager;
import org.onelink.linkservice.util.AuthHelper;
import org.onelink.linkservice.util.ua.ClientPlatform;

@ExtendWith(DropwizardExtensionsSupport.class)
class LinksControllerTest {

  private static final Instant NOW = Instant.parse("2025-02-01T08:00:00Z");
  private static final String BASE_URL = "https://onelink.example/";

  private static final String IOS_URL = "https://apps.apple.com/app/id1";
  private static final String ANDROID_URL = "https://play.google.com/store/apps/details?id=com.example";

  private static final LinksManager linksManager = mock(LinksManager.class);
  private static final ClicksManager clicksManager = mock(ClicksManager.class);

  private static final ResourceExtension resources = ResourceExtension.builder()
      .addProvider(AuthHelper.getAuthFilter())
      .addProvider(new AuthValueFactoryProvider.Binder<>(User.class))
      .addProvider(CompletionExceptionMapper.class)
      .addProvider(ShortCodeGenerationExceptionMapper.class)
      .addResource(new LinksController(linksManager, clicksManager, new ShortUrlBuilder(BASE_URL)))
      .build();

  @BeforeEach
  void setUp() {
    reset(linksManager, clicksManager);

    when(clicksManager.count(anyString())).thenReturn(CompletableFuture.completedFuture(0L));
  }

  @Test
  void create() {
    final LinkDefinition definition = new LinkDefinition("Example", IOS_URL, ANDROID_URL, null);

    when(linksManager.create(AuthHelper.VALID_USER, definition))
        .thenReturn(CompletableFuture.completedFuture(link("abc234", AuthHelper.VALID_USER)));

    final Response response = resources.getJerseyTest()
        .target("/v1/links")
        .request()
        .header("Authorization", AuthHelper.getAuthHeader(AuthHelper.VALID_USER, AuthHelper.VALID_PASSWORD))
        .post(Entity.json(definition));

    assertThat(response.getStatus()).isEqualTo(201);

    final LinkResponse linkResponse = response.readEntity(LinkResponse.class);
    assertThat(linkResponse.shortCode()).isEqualTo("abc234");
    assertThat(linkResponse.shortUrl()).isEqualTo("https://onelink.example/abc234");
    assertThat(linkResponse.iosUrl()).isEqualTo(IOS_URL);
    assertThat(linkResponse.androidUrl()).isEqualTo(ANDROID_URL);
    assertThat(linkResponse.fallbackUrl()).isNull();
    assertThat(linkResponse.totalClicks()).isZero();
  }

  @Test
  void createUnauthenticated() {
    final Response response = resources.getJerseyTest()
        .target("/v1/links")
        .request()
        .header("Authorization", AuthHelper.getAuthHeader(AuthHelper.INVALID_USER, AuthHelper.INVALID_PASSWORD))
        .post(Entity.json(new LinkDefinition("Example", IOS_URL, ANDROID_URL, null)));

    assertThat(response.getStatus()).isEqualTo(401);
    verifyNoInteractions(linksManager);
  }

  @ParameterizedTest
  @ValueSource(strings = {
      "{\"appName\":\"\",\"iosUrl\":\"https://a.example\",\"androidUrl\":\"https://b.example\"}",
      "{\"appName\":\"Example\",\"androidUrl\":\"https://b.example\"}",
      "{\"appName\":\"Example\",\"iosUrl\":\"not a url\",\"androidUrl\":\"https://b.example\"}",
      "{\"appName\":\"Example\",\"iosUrl\":\"ftp://a.example\",\"androidUrl\":\"https://b.example\"}",
      "{\"appName\":\"Example\",\"iosUrl\":\"https://a.example\",\"androidUrl\":\"https://b.example\",\"fallbackUrl\":\"/relative\"}"
  })
  void createInvalid(final String body) {
    final Response response = resources.getJerseyTest()
        .target("/v1/links")
        .request()
        .header("Authorization", AuthHelper.getAuthHeader(AuthHelper.VALID_USER, AuthHelper.VALID_PASSWORD))
        .post(Entity.entity(body, MediaType.APPLICATION_JSON_TYPE));

    assertThat(response.getStatus()).isEqualTo(422);
    verifyNoInteractions(linksManager);
  }

  @Test
  void createCodeSpaceExhausted() {
    when(linksManager.create(any(), any()))
        .thenReturn(CompletableFuture.failedFuture(new ShortCodeGenerationException(10)));

    final Response response = resources.getJerseyTest()
        .target("/v1/links")
        .request()
        .header("Authorization", AuthHelper.getAuthHeader(AuthHelper.VALID_USER, AuthHelper.VALID_PASSWORD))
        .post(Entity.json(new LinkDefinition("Example", IOS_URL, ANDROID_URL, null)));

    assertThat(response.getStatus()).isEqualTo(500);
    assertThat(response.readEntity(ErrorMessage.class).getMessage())
        .isEqualTo("Failed to generate a unique short code after 10 attempts");
  }

  @Test
  void list() {
    when(linksManager.list(AuthHelper.VALID_USER, 0, 100)).thenReturn(CompletableFuture.completedFuture(List.of(
        link("aaa222", AuthHelper.VALID_USER),
        link("bbb333", AuthHelper.VALID_USER))));
    when(clicksManager.count("bbb333")).thenReturn(CompletableFuture.completedFuture(7L));

    final List<LinkResponse> links = resources.getJerseyTest()
        .target("/v1/links")
        .request()
        .header("Authorization", AuthHelper.getAuthHeader(AuthHelper.VALID_USER, AuthHelper.VALID_PASSWORD))
        .get(new GenericType<List<LinkResponse>>() {});

    assertThat(links).extracting(LinkResponse::shortCode).containsExactly("aaa222", "bbb333");
    assertThat(links).extracting(LinkResponse::totalClicks).containsExactly(0L, 7L);
  }

  @ParameterizedTest
  @ValueSource(strings = {"limit=0", "limit=101", "offset=-1"})
  void listInvalidPage(final String query) {
    final String[] parts = query.split("=");

    final Response response = resources.getJerseyTest()
        .target("/v1/links")
        .queryParam(parts[0], parts[1])
        .request()
        .header("Authorization", AuthHelper.getAuthHeader(AuthHelper.VALID_USER, AuthHelper.VALID_PASSWORD))
        .get();

    assertThat(response.getStatus()).isEqualTo(400);
    verify(linksManager, never()).list(any(), anyInt(), anyInt());
  }

  @Test
  void get() {
    when(linksManager.get("abc234", AuthHelper.VALID_USER))
        .thenReturn(CompletableFuture.completedFuture(Optional.of(link("abc234", AuthHelper.VALID_USER))));
    when(clicksManager.count("abc234")).thenReturn(CompletableFuture.completedFuture(3L));

    final LinkResponse linkResponse = resources.getJerseyTest()
        .target("/v1/links/abc234")
        .request()
        .header("Authorization", AuthHelper.getAuthHeader(AuthHelper.VALID_USER, AuthHelper.VALID_PASSWORD))
        .get(LinkResponse.class);

    assertThat(linkResponse.shortCode()).isEqualTo("abc234");
    assertThat(linkResponse.totalClicks()).isEqualTo(3L);
    assertThat(linkResponse.createdAt()).isEqualTo(NOW);
  }

  @Test
  void getNotOwned() {
    when(linksManager.get("abc234", AuthHelper.VALID_USER_TWO))
        .thenReturn(CompletableFuture.completedFuture(Optional.empty()));

    final Response response = resources.getJerseyTest()
        .target("/v1/links/abc234")
        .request()
        .header("Authorization", AuthHelper.getAuthHeader(AuthHelper.VALID_USER_TWO, AuthHelper.VALID_PASSWORD))
        .get();

    assertThat(response.getStatus()).isEqualTo(404);
  }

  @Test
  void update() {
    final Link updated = new Link("abc234", "Renamed", IOS_URL, ANDROID_URL, null, AuthHelper.VALID_USER, NOW,
        NOW.plusSeconds(5));

    final ArgumentCaptor<LinkUpdate> updateCaptor = ArgumentCaptor.forClass(LinkUpdate.class);
    when(linksManager.update(eq("abc234"), eq(AuthHelper.VALID_USER), updateCaptor.capture()))
        .thenReturn(CompletableFuture.completedFuture(Optional.of(updated)));

    final LinkResponse linkResponse = resources.getJerseyTest()
        .target("/v1/links/abc234")
        .request()
        .header("Authorization", AuthHelper.getAuthHeader(AuthHelper.VALID_USER, AuthHelper.VALID_PASSWORD))
        .put(Entity.entity("{\"appName\":\"Renamed\"}", MediaType.APPLICATION_JSON_TYPE), LinkResponse.class);

    assertThat(linkResponse.appName()).isEqualTo("Renamed");
    assertThat(linkResponse.updatedAt()).isEqualTo(NOW.plusSeconds(5));

    assertThat(updateCaptor.getValue())
        .isEqualTo(new LinkUpdate(Optional.of("Renamed"), Optional.empty(), Optional.empty(), Optional.empty(), false));
  }

  @Test
  void updateClearFallbackUrl() {
    final Link updated = new Link("abc234", "Example", IOS_URL, ANDROID_URL, null, AuthHelper.VALID_USER, NOW,
        NOW.plusSeconds(5));

    final ArgumentCaptor<LinkUpdate> updateCaptor = ArgumentCaptor.forClass(LinkUpdate.class);
    when(linksManager.update(eq("abc234"), eq(AuthHelper.VALID_USER), updateCaptor.capture()))
        .thenReturn(CompletableFuture.completedFuture(Optional.of(updated)));

    final LinkResponse linkResponse = resources.getJerseyTest()
        .target("/v1/links/abc234")
        .request()
        .header("Authorization", AuthHelper.getAuthHeader(AuthHelper.VALID_USER, AuthHelper.VALID_PASSWORD))
        .put(Entity.entity("{\"clearFallbackUrl\":true}", MediaType.APPLICATION_JSON_TYPE), LinkResponse.class);

    assertThat(linkResponse.fallbackUrl()).isNull();
    assertThat(updateCaptor.getValue().clearFallbackUrl()).isTrue();
    assertThat(updateCaptor.getValue().fallbackUrl()).isEmpty();
  }

  @Test
  void updateSetAndClearFallbackUrl() {
    final Response response = resources.getJerseyTest()
        .target("/v1/links/abc234")
        .request()
        .header("Authorization", AuthHelper.getAuthHeader(AuthHelper.VALID_USER, AuthHelper.VALID_PASSWORD))
        .put(Entity.entity("{\"fallbackUrl\":\"https://example.com/web\",\"clearFallbackUrl\":true}",
            MediaType.APPLICATION_JSON_TYPE));

    assertThat(response.getStatus()).isEqualTo(422);
    verifyNoInteractions(linksManager);
  }

  @Test
  void updateInvalid() {
    final Response response = resources.getJerseyTest()
        .target("/v1/links/abc234")
        .request()
        .header("Authorization", AuthHelper.getAuthHeader(AuthHelper.VALID_USER, AuthHelper.VALID_PASSWORD))
        .put(Entity.entity("{\"androidUrl\":\"market://details\"}", MediaType.APPLICATION_JSON_TYPE));

    assertThat(response.getStatus()).isEqualTo(422);
    verifyNoInteractions(linksManager);
  }

  @Test
  void updateNotOwned() {
    when(linksManager.update(eq("abc234"), eq(AuthHelper.VALID_USER), any()))
        .thenReturn(CompletableFuture.completedFuture(Optional.empty()));

    final Response response = resources.getJerseyTest()
        .target("/v1/links/abc234")
        .request()
        .header("Authorization", AuthHelper.getAuthHeader(AuthHelper.VALID_USER, AuthHelper.VALID_PASSWORD))
        .put(Entity.entity("{\"appName\":\"Renamed\"}", MediaType.APPLICATION_JSON_TYPE));

    assertThat(response.getStatus()).isEqualTo(404);
  }

  @Test
  void delete() {
    when(linksManager.delete("abc234", AuthHelper.VALID_USER)).thenReturn(CompletableFuture.completedFuture(true));

    final Response response = resources.getJerseyTest()
        .target("/v1/links/abc234")
        .request()
        .header("Authorization", AuthHelper.getAuthHeader(AuthHelper.VALID_USER, AuthHelper.VALID_PASSWORD))
        .delete();

    assertThat(response.getStatus()).isEqualTo(204);
  }

  @Test
  void deleteNotOwned() {
    when(linksManager.delete("abc234", AuthHelper.VALID_USER)).thenReturn(CompletableFuture.completedFuture(false));

    final Response response = resources.getJerseyTest()
        .target("/v1/links/abc234")
        .request()
        .header("Authorization", AuthHelper.getAuthHeader(AuthHelper.VALID_USER, AuthHelper.VALID_PASSWORD))
        .delete();

    assertThat(response.getStatus()).isEqualTo(404);
  }

  @Test
  void listClicks() {
    final ClickEvent click = new ClickEvent("abc234", ClientPlatform.ANDROID, "Pixel 8", "Android", "14",
        "Chrome Mobile", "120.0.0", "0".repeat(64), ClickEvent.UNKNOWN_COUNTRY, NOW);

    when(linksManager.get("abc234", AuthHelper.VALID_USER))
        .thenReturn(CompletableFuture.completedFuture(Optional.of(link("abc234", AuthHelper.VALID_USER))));
    when(clicksManager.list("abc234", 0, 10)).thenReturn(CompletableFuture.completedFuture(List.of(click)));

    final Response response = resources.getJerseyTest()
        .target("/v1/links/abc234/clicks")
        .queryParam("limit", 10)
        .request()
        .header("Authorization", AuthHelper.getAuthHeader(AuthHelper.VALID_USER, AuthHelper.VALID_PASSWORD))
        .get();

    assertThat(response.getStatus()).isEqualTo(200);

    final List<Map<String, Object>> clicks = response.readEntity(new GenericType<List<Map<String, Object>>>() {});
    assertThat(clicks).hasSize(1);
    assertThat(clicks.get(0)).containsEntry("platform", "android")
        .containsEntry("device", "Pixel 8")
        .containsEntry("country", "Unknown");
  }

  @Test
  void listClicksNotOwned() {
    when(linksManager.get("abc234", AuthHelper.VALID_USER))
        .thenReturn(CompletableFuture.completedFuture(Optional.empty()));

    final Response response = resources.getJerseyTest()
        .target("/v1/links/abc234/clicks")
        .request()
        .header("Authorization", AuthHelper.getAuthHeader(AuthHelper.VALID_USER, AuthHelper.VALID_PASSWORD))
        .get();

    assertThat(response.getStatus()).isEqualTo(404);
    verify(clicksManager, never()).list(any(), anyInt(), anyInt());
  }

  @Test
  void summary() {
    final Link link = link("abc234", AuthHelper.VALID_USER);
    final ClickSummary summary = new ClickSummary("abc234", "Example", 6, 3, 2, 1);

    when(linksManager.get("abc234", AuthHelper.VALID_USER))
        .thenReturn(CompletableFuture.completedFuture(Optional.of(link)));
    when(clicksManager.summarize(link)).thenReturn(CompletableFuture.completedFuture(summary));

    final ClickSummary response = resources.getJerseyTest()
        .target("/v1/links/abc234/summary")
        .request()
        .header("Authorization", AuthHelper.getAuthHeader(AuthHelper.VALID_USER, AuthHelper.VALID_PASSWORD))
        .get(ClickSummary.class);

    assertThat(response).isEqualTo(summary);
  }

  private static Link link(final String shortCode, final UUID owner) {
    return new Link(shortCode, "Example", IOS_URL, ANDROID_URL, null, owner, NOW, NOW);
  }
}
