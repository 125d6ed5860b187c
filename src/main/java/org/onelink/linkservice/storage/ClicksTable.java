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
import com.google.cloud.bigtable.data.v2.models.BulkMutation;
import com.google.cloud.bigtable.data.v2.models.Mutation;
import com.google.cloud.bigtable.data.v2.models.Query;
import com.google.cloud.bigtable.data.v2.models.Row;
import com.google.cloud.bigtable.data.v2.models.RowMutation;
import com.google.protobuf.ByteString;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;
import org.onelink.linkservice.metrics.StorageMetrics;
import org.onelink.linkservice.util.ua.ClientPlatform;

/**
 * Stores click events, one row per click. Row keys are {@code shortCode#reverseTimestamp#uuid}, so a prefix scan for
 * a short code yields that link's clicks newest first.
 */
public class ClicksTable extends Table {

  public static final String FAMILY = "c";

  public static final String COLUMN_PLATFORM        = "platform";
  public static final String COLUMN_DEVICE          = "device";
  public static final String COLUMN_OS              = "os";
  public static final String COLUMN_OS_VERSION      = "osVersion";
  public static final String COLUMN_BROWSER         = "browser";
  public static final String COLUMN_BROWSER_VERSION = "browserVersion";
  public static final String COLUMN_IP_HASH         = "ipHash";
  public static final String COLUMN_COUNTRY         = "country";
  public static final String COLUMN_TIMESTAMP       = "timestamp";

  public static final int MAX_MUTATIONS = 100_000;

  private final MetricRegistry metricRegistry       = SharedMetricRegistries.getOrCreate(StorageMetrics.NAME);
  private final Timer          appendTimer          = metricRegistry.timer(name(ClicksTable.class, "append"         ));
  private final Timer          listTimer            = metricRegistry.timer(name(ClicksTable.class, "list"           ));
  private final Timer          countTimer           = metricRegistry.timer(name(ClicksTable.class, "count"          ));
  private final Timer          getKeysToDeleteTimer = metricRegistry.timer(name(ClicksTable.class, "getKeysToDelete"));
  private final Timer          deleteKeysTimer      = metricRegistry.timer(name(ClicksTable.class, "deleteKeys"     ));

  public ClicksTable(BigtableDataClient client, String tableId) {
    super(client, tableId);
  }

  public CompletableFuture<Void> append(ClickEvent click) {
    final RowMutation mutation = RowMutation.create(tableId, getRowKeyFor(click), Mutation.create()
        .setCell(FAMILY, COLUMN_PLATFORM, 0, click.platform().getName())
        .setCell(FAMILY, COLUMN_DEVICE, 0, click.device())
        .setCell(FAMILY, COLUMN_OS, 0, click.os())
        .setCell(FAMILY, COLUMN_OS_VERSION, 0, click.osVersion())
        .setCell(FAMILY, COLUMN_BROWSER, 0, click.browser())
        .setCell(FAMILY, COLUMN_BROWSER_VERSION, 0, click.browserVersion())
        .setCell(FAMILY, COLUMN_IP_HASH, 0, click.ipHash())
        .setCell(FAMILY, COLUMN_COUNTRY, 0, click.country())
        .setCell(FAMILY, COLUMN_TIMESTAMP, 0, String.valueOf(click.timestamp().toEpochMilli())));

    return toFuture(client.mutateRowAsync(mutation), appendTimer);
  }

  /**
   * Lists the clicks of a link, newest first.
   */
  public CompletableFuture<List<ClickEvent>> list(String shortCode, int offset, int limit) {
    final Query query = Query.create(tableId)
        .prefix(getRowKeyPrefixFor(shortCode))
        .limit((long) offset + limit);

    return readRows(listTimer, query).thenApply(rows -> rows.stream()
        .skip(offset)
        .map(row -> getClickFromRow(shortCode, row))
        .collect(Collectors.toList()));
  }

  public CompletableFuture<Long> count(String shortCode) {
    final Query query = Query.create(tableId)
        .prefix(getRowKeyPrefixFor(shortCode))
        .filter(FILTERS.chain()
            .filter(FILTERS.limit().cellsPerRow(1))
            .filter(FILTERS.value().strip()));

    return readRows(countTimer, query).thenApply(rows -> (long) rows.size());
  }

  /**
   * Counts the clicks of a link by platform. Every platform is present in the returned map.
   */
  public CompletableFuture<Map<ClientPlatform, Long>> countByPlatform(String shortCode) {
    final Query query = Query.create(tableId)
        .prefix(getRowKeyPrefixFor(shortCode))
        .filter(FILTERS.chain()
            .filter(FILTERS.family().exactMatch(FAMILY))
            .filter(FILTERS.qualifier().exactMatch(COLUMN_PLATFORM)));

    return readRows(countTimer, query).thenApply(rows -> {
      final Map<ClientPlatform, Long> counts = new EnumMap<>(ClientPlatform.class);

      for (final ClientPlatform platform : ClientPlatform.values()) {
        counts.put(platform, 0L);
      }

      for (final Row row : rows) {
        getCellValue(row, FAMILY, COLUMN_PLATFORM)
            .map(ClientPlatform::fromName)
            .ifPresent(platform -> counts.merge(platform, 1L, Long::sum));
      }

      return counts;
    });
  }

  /**
   * Deletes every click of the given link.
   */
  public CompletableFuture<Void> clear(String shortCode) {
    final Query query = Query.create(tableId)
        .prefix(getRowKeyPrefixFor(shortCode))
        .filter(FILTERS.chain()
            .filter(FILTERS.limit().cellsPerRow(1))
            .filter(FILTERS.value().strip()))
        .limit(MAX_MUTATIONS);

    return readRows(getKeysToDeleteTimer, query).thenCompose(rows -> {
      if (rows.isEmpty()) {
        return CompletableFuture.completedFuture(null);
      }

      final BulkMutation bulkMutation = BulkMutation.create(tableId);
      rows.forEach(row -> bulkMutation.add(row.getKey(), Mutation.create().deleteRow()));

      return toFuture(client.bulkMutateRowsAsync(bulkMutation), deleteKeysTimer).thenCompose(ignored -> clear(shortCode));
    });
  }

  private static ClickEvent getClickFromRow(String shortCode, Row row) {
    return new ClickEvent(shortCode,
        getCellValue(row, FAMILY, COLUMN_PLATFORM).map(ClientPlatform::fromName).orElse(ClientPlatform.OTHER),
        getCellValue(row, FAMILY, COLUMN_DEVICE).orElseThrow(),
        getCellValue(row, FAMILY, COLUMN_OS).orElseThrow(),
        getCellValue(row, FAMILY, COLUMN_OS_VERSION).orElseThrow(),
        getCellValue(row, FAMILY, COLUMN_BROWSER).orElseThrow(),
        getCellValue(row, FAMILY, COLUMN_BROWSER_VERSION).orElseThrow(),
        getCellValue(row, FAMILY, COLUMN_IP_HASH).orElseThrow(),
        getCellValue(row, FAMILY, COLUMN_COUNTRY).orElse(ClickEvent.UNKNOWN_COUNTRY),
        getCellValue(row, FAMILY, COLUMN_TIMESTAMP).map(millis -> Instant.ofEpochMilli(Long.parseLong(millis))).orElseThrow());
  }

  private static ByteString getRowKeyFor(ClickEvent click) {
    return ByteString.copyFromUtf8(getRowKeyPrefixFor(click.shortCode())
        + String.format("%019d", Long.MAX_VALUE - click.timestamp().toEpochMilli())
        + "#" + UUID.randomUUID());
  }

  private static String getRowKeyPrefixFor(String shortCode) {
    return shortCode + "#";
  }
}
