/*
 * Copyright 2025 OneLink
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.onelink.linkservice.storage;

import com.google.cloud.bigtable.data.v2.BigtableDataClient;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import org.onelink.linkservice.entities.LinkDefinition;
import org.onelink.linkservice.entities.LinkUpdate;
import org.onelink.linkservice.links.ShortCodeGenerationException;
import org.onelink.linkservice.links.ShortCodeGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LinksManager {

  private static final Logger logger = LoggerFactory.getLogger(LinksManager.class);

  public static final int DEFAULT_MAX_GENERATION_ATTEMPTS = 10;

  private final LinksTable linksTable;
  private final ClicksTable clicksTable;
  private final ShortCodeGenerator shortCodeGenerator;
  private final int maxGenerationAttempts;
  private final Clock clock;

  public LinksManager(BigtableDataClient client, String linksTableId, String clicksTableId,
      ShortCodeGenerator shortCodeGenerator, int maxGenerationAttempts, Clock clock) {

    this(new LinksTable(client, linksTableId), new ClicksTable(client, clicksTableId), shortCodeGenerator,
        maxGenerationAttempts, clock);
  }

  @VisibleForTesting
  LinksManager(LinksTable linksTable, ClicksTable clicksTable, ShortCodeGenerator shortCodeGenerator,
      int maxGenerationAttempts, Clock clock) {

    this.linksTable = linksTable;
    this.clicksTable = clicksTable;
    this.shortCodeGenerator = shortCodeGenerator;
    this.maxGenerationAttempts = maxGenerationAttempts;
    this.clock = clock;
  }

  /**
   * Creates a new link under a freshly generated short code. Codes that are already in use, whether detected by the
   * pre-check or by the conditional insert, are discarded and regenerated.
   *
   * @param owner the owner of the new link
   * @param definition the new link's destinations
   *
   * @return a future that yields the stored link, or fails with a {@link ShortCodeGenerationException} if no unused
   * code was found within the configured number of attempts
   */
  public CompletableFuture<Link> create(UUID owner, LinkDefinition definition) {
    return create(owner, definition, 1);
  }

  private CompletableFuture<Link> create(UUID owner, LinkDefinition definition, int attempt) {
    if (attempt > maxGenerationAttempts) {
      logger.error("No unused short code after {} attempts", maxGenerationAttempts);
      return CompletableFuture.failedFuture(new ShortCodeGenerationException(maxGenerationAttempts));
    }

    final String shortCode = shortCodeGenerator.generate();

    return linksTable.get(shortCode).thenCompose(existing -> {
      if (existing.isPresent()) {
        logger.debug("Short code {} already in use (attempt {})", shortCode, attempt);
        return create(owner, definition, attempt + 1);
      }

      final Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
      final Link link = new Link(shortCode,
          definition.appName(),
          definition.iosUrl(),
          definition.androidUrl(),
          definition.fallbackUrl(),
          owner,
          now,
          now);

      return linksTable.create(link).thenCompose(created -> {
        if (created) {
          return CompletableFuture.completedFuture(link);
        }

        logger.info("Short code {} claimed concurrently (attempt {})", shortCode, attempt);
        return create(owner, definition, attempt + 1);
      });
    });
  }

  public CompletableFuture<Optional<Link>> get(String shortCode) {
    return linksTable.get(shortCode);
  }

  /**
   * Returns the identified link if and only if it exists and belongs to the given owner.
   */
  public CompletableFuture<Optional<Link>> get(String shortCode, UUID owner) {
    return linksTable.get(shortCode).thenApply(maybeLink -> maybeLink.filter(link -> link.isOwnedBy(owner)));
  }

  public CompletableFuture<List<Link>> list(UUID owner, int offset, int limit) {
    return linksTable.listByOwner(owner, offset, limit);
  }

  public CompletableFuture<List<Link>> listAll(UUID owner) {
    return linksTable.listByOwner(owner);
  }

  /**
   * Applies a sparse update to a link owned by the given owner.
   *
   * @return a future that yields the updated link, or empty if no such link exists for the given owner
   */
  public CompletableFuture<Optional<Link>> update(String shortCode, UUID owner, LinkUpdate update) {
    return linksTable.update(shortCode, owner, update, clock.instant().truncatedTo(ChronoUnit.MILLIS))
        .thenCompose(updated -> updated
            ? linksTable.get(shortCode)
            : CompletableFuture.completedFuture(Optional.empty()));
  }

  /**
   * Deletes a link owned by the given owner along with all of its clicks.
   *
   * @return a future that yields {@code true} if the link was deleted or {@code false} if no such link exists for the
   * given owner
   */
  public CompletableFuture<Boolean> delete(String shortCode, UUID owner) {
    return linksTable.delete(shortCode, owner)
        .thenCompose(deleted -> deleted
            ? clicksTable.clear(shortCode).thenApply(ignored -> true)
            : CompletableFuture.completedFuture(false));
  }
}
