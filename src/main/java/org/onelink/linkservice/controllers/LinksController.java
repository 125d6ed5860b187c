/*
 * Copyright 2025 OneLink
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.onelink.linkservice.controllers;

import com.codahale.metrics.annotation.Timed;
import io.dropwizard.auth.Auth;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;
import org.onelink.linkservice.auth.User;
import org.onelink.linkservice.entities.ClickSummary;
import org.onelink.linkservice.entities.LinkDefinition;
import org.onelink.linkservice.entities.LinkResponse;
import org.onelink.linkservice.entities.LinkUpdate;
import org.onelink.linkservice.links.ShortUrlBuilder;
import org.onelink.linkservice.storage.ClickEvent;
import org.onelink.linkservice.storage.ClicksManager;
import org.onelink.linkservice.storage.Link;
import org.onelink.linkservice.storage.LinksManager;

@Path("/v1/links")
@Produces(MediaType.APPLICATION_JSON)
public class LinksController {

  static final int MAX_PAGE_SIZE = 100;

  private final LinksManager linksManager;
  private final ClicksManager clicksManager;
  private final ShortUrlBuilder shortUrlBuilder;

  public LinksController(final LinksManager linksManager, final ClicksManager clicksManager,
      final ShortUrlBuilder shortUrlBuilder) {

    this.linksManager = linksManager;
    this.clicksManager = clicksManager;
    this.shortUrlBuilder = shortUrlBuilder;
  }

  @Timed
  @POST
  @Consumes(MediaType.APPLICATION_JSON)
  public CompletableFuture<Response> create(@Auth final User user, @NotNull @Valid final LinkDefinition definition) {
    return linksManager.create(user.getUuid(), definition)
        .thenApply(link -> Response.status(Response.Status.CREATED)
            .entity(LinkResponse.of(link, shortUrlBuilder.build(link.shortCode()), 0))
            .build());
  }

  @Timed
  @GET
  public CompletableFuture<List<LinkResponse>> list(@Auth final User user,
      @QueryParam("offset") @DefaultValue("0") @Min(0) final int offset,
      @QueryParam("limit") @DefaultValue("100") @Min(1) @Max(MAX_PAGE_SIZE) final int limit) {

    return linksManager.list(user.getUuid(), offset, limit).thenCompose(links -> {
      final List<CompletableFuture<LinkResponse>> responseFutures = links.stream()
          .map(this::toResponse)
          .collect(Collectors.toList());

      return CompletableFuture.allOf(responseFutures.toArray(new CompletableFuture[0]))
          .thenApply(ignored -> responseFutures.stream()
              .map(CompletableFuture::join)
              .collect(Collectors.toList()));
    });
  }

  @Timed
  @GET
  @Path("/{shortCode}")
  public CompletableFuture<LinkResponse> get(@Auth final User user, @PathParam("shortCode") final String shortCode) {
    return getOwnedLink(user, shortCode).thenCompose(this::toResponse);
  }

  @Timed
  @PUT
  @Path("/{shortCode}")
  @Consumes(MediaType.APPLICATION_JSON)
  public CompletableFuture<LinkResponse> update(@Auth final User user,
      @PathParam("shortCode") final String shortCode,
      @NotNull @Valid final LinkUpdate update) {

    return linksManager.update(shortCode, user.getUuid(), update)
        .thenCompose(maybeLink -> toResponse(
            maybeLink.orElseThrow(() -> new WebApplicationException(Response.Status.NOT_FOUND))));
  }

  @Timed
  @DELETE
  @Path("/{shortCode}")
  public CompletableFuture<Response> delete(@Auth final User user, @PathParam("shortCode") final String shortCode) {
    return linksManager.delete(shortCode, user.getUuid()).thenApply(deleted -> {
      if (!deleted) {
        throw new WebApplicationException(Response.Status.NOT_FOUND);
      }

      return Response.noContent().build();
    });
  }

  @Timed
  @GET
  @Path("/{shortCode}/clicks")
  public CompletableFuture<List<ClickEvent>> listClicks(@Auth final User user,
      @PathParam("shortCode") final String shortCode,
      @QueryParam("offset") @DefaultValue("0") @Min(0) final int offset,
      @QueryParam("limit") @DefaultValue("100") @Min(1) @Max(MAX_PAGE_SIZE) final int limit) {

    return getOwnedLink(user, shortCode)
        .thenCompose(link -> clicksManager.list(link.shortCode(), offset, limit));
  }

  @Timed
  @GET
  @Path("/{shortCode}/summary")
  public CompletableFuture<ClickSummary> getSummary(@Auth final User user,
      @PathParam("shortCode") final String shortCode) {

    return getOwnedLink(user, shortCode).thenCompose(clicksManager::summarize);
  }

  private CompletableFuture<Link> getOwnedLink(final User user, final String shortCode) {
    return linksManager.get(shortCode, user.getUuid())
        .thenApply(maybeLink -> maybeLink.orElseThrow(() -> new WebApplicationException(Response.Status.NOT_FOUND)));
  }

  private CompletableFuture<LinkResponse> toResponse(final Link link) {
    return clicksManager.count(link.shortCode())
        .thenApply(totalClicks -> LinkResponse.of(link, shortUrlBuilder.build(link.shortCode()), totalClicks));
  }
}
