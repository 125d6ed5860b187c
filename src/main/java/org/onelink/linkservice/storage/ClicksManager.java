/*
 * Copyright 2025 OneLink
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.onelink.linkservice.storage;

import com.google.cloud.bigtable.data.v2.BigtableDataClient;
import com.google.common.annotations.VisibleForTesting;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;
import org.onelink.linkservice.entities.ClickSummary;
import org.onelink.linkservice.entities.DashboardSummary;
import org.onelink.linkservice.util.ua.ClientPlatform;

public class ClicksManager {

  private final ClicksTable clicksTable;

  public ClicksManager(BigtableDataClient client, String clicksTableId) {
    this(new ClicksTable(client, clicksTableId));
  }

  @VisibleForTesting
  ClicksManager(ClicksTable clicksTable) {
    this.clicksTable = clicksTable;
  }

  public CompletableFuture<Void> record(ClickEvent click) {
    return clicksTable.append(click);
  }

  public CompletableFuture<List<ClickEvent>> list(String shortCode, int offset, int limit) {
    return clicksTable.list(shortCode, offset, limit);
  }

  public CompletableFuture<Long> count(String shortCode) {
    return clicksTable.count(shortCode);
  }

  public CompletableFuture<ClickSummary> summarize(Link link) {
    return clicksTable.countByPlatform(link.shortCode()).thenApply(counts -> {
      final long ios = counts.get(ClientPlatform.IOS);
      final long android = counts.get(ClientPlatform.ANDROID);
      final long other = counts.get(ClientPlatform.OTHER);

      return new ClickSummary(link.shortCode(), link.appName(), ios + android + other, ios, android, other);
    });
  }

  /**
   * Sums the click counts of the given links. Ties for the most-clicked link go to the link listed first.
   */
  public CompletableFuture<DashboardSummary> summarizeAll(List<Link> links) {
    final List<CompletableFuture<ClickSummary>> summaryFutures = links.stream()
        .map(this::summarize)
        .collect(Collectors.toList());

    return CompletableFuture.allOf(summaryFutures.toArray(new CompletableFuture[0])).thenApply(ignored -> {
      long ios = 0;
      long android = 0;
      long other = 0;
      ClickSummary mostClicked = null;

      for (final CompletableFuture<ClickSummary> summaryFuture : summaryFutures) {
        final ClickSummary summary = summaryFuture.join();

        ios += summary.iosClicks();
        android += summary.androidClicks();
        other += summary.otherClicks();

        if (summary.totalClicks() > 0 && (mostClicked == null || summary.totalClicks() > mostClicked.totalClicks())) {
          mostClicked = summary;
        }
      }

      return new DashboardSummary(links.size(), ios + android + other, ios, android, other, mostClicked);
    });
  }
}
