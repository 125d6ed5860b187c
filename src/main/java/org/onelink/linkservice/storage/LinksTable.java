/*
 * Copyright 2025 OneLink
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.onelink.linkservice.storage;

import static com.codahale.metrics.MetricRegistry.name;
import static com.google.cloud.bigtable.data.v2.models.Filters.FILTERS;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.SharedMetricRegistries;
import com.codahale.metrics.Timer;
import com.google.cloud.bigtable.data.v2.BigtableDataClient;
import com.google.cloud.bigtable.data.v2.models.Mutation;
import com.google.cloud.bigtable.data.v2.models.Query;
import com.google.cloud.bigtable.data.v2.models.Row;
import com.google.protobuf.ByteString;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;
import org.onelink.linkservice.entities.LinkUpdate;
import org.onelink.linkservice.metrics.StorageMetrics;

/**
 * Stores one row per link, keyed by its short code.
 */
public class LinksTable extends Table {

  public static final String FAMILY = "l";

  public static final String COLUMN_APP_NAME     = "app";
  public static final String COLUMN_IOS_URL      = "ios";
  public static final String COLUMN_ANDROID_URL  = "android";
  public static final String COLUMN_FALLBACK_URL = "fallback";
  public static final String COLUMN_OWNER        = "owner";
  public static final String COLUMN_CREATED      = "created";
  public static final String COLUMN_UPDATED      = "updated";

  private final MetricRegistry metricRegistry = SharedMetricRegistries.getOrCreate(StorageMetrics.NAME);
  private final Timer          getTimer       = metricRegistry.timer(name(LinksTable.class, "get"   ));
  private final Timer          createTimer    = metricRegistry.timer(name(LinksTable.class, "create"));
  private final Timer          updateTimer    = metricRegistry.timer(name(LinksTable.class, "update"));
  private final Timer          deleteTimer    = metricRegistry.timer(name(LinksTable.class, "delete"));
  private final Timer          listTimer      = metricRegistry.timer(name(LinksTable.class, "list"  ));

  public LinksTable(BigtableDataClient client, String tableId) {
    super(client, tableId);
  }

  public CompletableFuture<Optional<Link>> get(String shortCode) {
    return toFuture(client.readRowAsync(tableId, ByteString.copyFromUtf8(shortCode)), getTimer)
        .thenApply(row -> Optional.ofNullable(row).map(LinksTable::getLinkFromRow));
  }

  /**
   * Stores a new link if and only if no link with the same short code exists.
   *
   * @return a future that yields {@code true} if the link was stored or {@code false} if its short code is taken
   */
  public CompletableFuture<Boolean> create(Link link) {
    final Mutation mutation = Mutation.create()
        .setCell(FAMILY, COLUMN_APP_NAME, 0, link.appName())
        .setCell(FAMILY, COLUMN_IOS_URL, 0, link.iosUrl())
        .setCell(FAMILY, COLUMN_ANDROID_URL, 0, link.androidUrl())
        .setCell(FAMILY, COLUMN_CREATED, 0, String.valueOf(link.createdAt().toEpochMilli()))
        .setCell(FAMILY, COLUMN_UPDATED, 0, String.valueOf(link.updatedAt().toEpochMilli()));

    link.getFallbackUrl().ifPresent(fallbackUrl -> mutation.setCell(FAMILY, COLUMN_FALLBACK_URL, 0, fallbackUrl));
    link.getOwner().ifPresent(owner -> mutation.setCell(FAMILY, COLUMN_OWNER, 0, owner.toString()));

    return setIfEmpty(createTimer, ByteString.copyFromUtf8(link.shortCode()), FAMILY, COLUMN_IOS_URL, mutation);
  }

  /**
   * Applies the fields present in the given update to a link, if and only if the link exists and is owned by the given
   * owner.
   *
   * @return a future that yields {@code true} if the link was modified or {@code false} otherwise
   */
  public CompletableFuture<Boolean> update(String shortCode, UUID owner, LinkUpdate update, Instant updatedAt) {
    final Mutation mutation = Mutation.create()
        .setCell(FAMILY, COLUMN_UPDATED, 0, String.valueOf(updatedAt.toEpochMilli()));

    update.appName().ifPresent(appName -> mutation.setCell(FAMILY, COLUMN_APP_NAME, 0, appName));
    update.iosUrl().ifPresent(iosUrl -> mutation.setCell(FAMILY, COLUMN_IOS_URL, 0, iosUrl));
    update.androidUrl().ifPresent(androidUrl -> mutation.setCell(FAMILY, COLUMN_ANDROID_URL, 0, androidUrl));
    update.fallbackUrl().ifPresent(fallbackUrl -> mutation.setCell(FAMILY, COLUMN_FALLBACK_URL, 0, fallbackUrl));

    if (update.clearFallbackUrl()) {
      mutation.deleteCells(FAMILY, COLUMN_FALLBACK_URL);
    }

    return setIfValue(updateTimer, ByteString.copyFromUtf8(shortCode), FAMILY, COLUMN_OWNER, owner.toString(), mutation);
  }

  /**
   * Deletes a link if and only if it is owned by the given owner.
   *
   * @return a future that yields {@code true} if the link was deleted or {@code false} otherwise
   */
  public CompletableFuture<Boolean> delete(String shortCode, UUID owner) {
    return setIfValue(deleteTimer, ByteString.copyFromUtf8(shortCode), FAMILY, COLUMN_OWNER, owner.toString(),
        Mutation.create().deleteRow());
  }

  /**
   * Lists one page of the links owned by the given owner in short code order. Reads stop once the page is filled.
   */
  public CompletableFuture<List<Link>> listByOwner(UUID owner, int offset, int limit) {
    return readRows(listTimer, ownedBy(owner).limit((long) offset + limit)).thenApply(rows -> rows.stream()
        .skip(offset)
        .map(LinksTable::getLinkFromRow)
        .collect(Collectors.toList()));
  }

  /**
   * Lists every link owned by the given owner in short code order.
   */
  public CompletableFuture<List<Link>> listByOwner(UUID owner) {
    return readRows(listTimer, ownedBy(owner)).thenApply(rows -> rows.stream()
        .map(LinksTable::getLinkFromRow)
        .collect(Collectors.toList()));
  }

  private Query ownedBy(UUID owner) {
    return Query.create(tableId)
        .filter(FILTERS.condition(FILTERS.chain()
                .filter(FILTERS.family().exactMatch(FAMILY))
                .filter(FILTERS.qualifier().exactMatch(COLUMN_OWNER))
                .filter(FILTERS.value().exactMatch(owner.toString())))
            .then(FILTERS.pass())
            .otherwise(FILTERS.block()));
  }

  private static Link getLinkFromRow(Row row) {
    return new Link(row.getKey().toStringUtf8(),
        getCellValue(row, FAMILY, COLUMN_APP_NAME).orElseThrow(),
        getCellValue(row, FAMILY, COLUMN_IOS_URL).orElseThrow(),
        getCellValue(row, FAMILY, COLUMN_ANDROID_URL).orElseThrow(),
        getCellValue(row, FAMILY, COLUMN_FALLBACK_URL).orElse(null),
        getCellValue(row, FAMILY, COLUMN_OWNER).map(UUID::fromString).orElse(null),
        getCellValue(row, FAMILY, COLUMN_CREATED).map(millis -> Instant.ofEpochMilli(Long.parseLong(millis))).orElseThrow(),
        getCellValue(row, FAMILY, COLUMN_UPDATED).map(millis -> Instant.ofEpochMilli(Long.parseLong(millis))).orElseThrow());
  }
}
