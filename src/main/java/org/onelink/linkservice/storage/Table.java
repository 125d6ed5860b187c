/*
 * Copyright 2020 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.onelink.linkservice.storage;

import static com.google.cloud.bigtable.data.v2.models.Filters.FILTERS;

import com.codahale.metrics.Timer;
import com.google.api.core.ApiFuture;
import com.google.api.core.ApiFutureCallback;
import com.google.api.core.ApiFutures;
import com.google.api.gax.rpc.ResponseObserver;
import com.google.api.gax.rpc.StreamController;
import com.google.cloud.bigtable.data.v2.BigtableDataClient;
import com.google.cloud.bigtable.data.v2.models.ConditionalRowMutation;
import com.google.cloud.bigtable.data.v2.models.Mutation;
import com.google.cloud.bigtable.data.v2.models.Query;
import com.google.cloud.bigtable.data.v2.models.Row;
import com.google.cloud.bigtable.data.v2.models.RowCell;
import com.google.cloud.bigtable.data.v2.models.TableId;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.protobuf.ByteString;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

abstract class Table {

  final BigtableDataClient client;
  final TableId tableId;

  public Table(final BigtableDataClient client, final String tableId) {
    this.client = client;
    this.tableId = TableId.of(tableId);
  }

  /**
   * Applies a mutation to the given row if and only if the cell with the given column family/name has exactly the given
   * value.
   *
   * @param timer a timer to measure the duration of the operation
   * @param rowId the ID of the row to potentially mutate
   * @param columnFamily the column family of the cell to check for a specific value
   * @param columnName the column name of the cell to check for a specific value
   * @param columnEquals the value for which to check in the identified cell
   * @param mutation the mutation to apply if {@code columnEquals} exactly matches the existing value in the identified
   *                 cell
   *
   * @return a future that yields {@code true} if the identified row was modified or {@code false} otherwise
   */
  CompletableFuture<Boolean> setIfValue(Timer timer, ByteString rowId, String columnFamily, String columnName, String columnEquals, Mutation mutation) {
    return toFuture(client.checkAndMutateRowAsync(ConditionalRowMutation.create(tableId, rowId)
        .condition(FILTERS.chain()
            .filter(FILTERS.family().exactMatch(columnFamily))
            .filter(FILTERS.qualifier().exactMatch(columnName))
            .filter(FILTERS.value().exactMatch(columnEquals)))
        .then(mutation)), timer);
  }

  /**
   * Applies a mutation to the given row if and only if the cell with the given column family/name is empty.
   *
   * @param timer a timer to measure the duration of the operation
   * @param rowId the ID of the row to potentially mutate
   * @param columnFamily the column family of the cell to check for a specific value
   * @param columnName the column name of the cell to check for a specific value
   * @param mutation the mutation to apply if the identified cell is empty
   *
   * @return a future that yields {@code true} if the identified row was modified or {@code false} otherwise
   */
  CompletableFuture<Boolean> setIfEmpty(Timer timer, ByteString rowId, String columnFamily, String columnName, Mutation mutation) {
    return toFuture(client.checkAndMutateRowAsync(ConditionalRowMutation.create(tableId, rowId)
        .condition(FILTERS.chain()
            .filter(FILTERS.family().exactMatch(columnFamily))
            .filter(FILTERS.qualifier().exactMatch(columnName))
            // See https://github.com/google/re2/wiki/Syntax; `\C` is "any byte", and so this matches any
            // non-empty value. Note that the mutation is applied in an `otherwise` clause.
            .filter(FILTERS.value().regex("\\C+")))
        .otherwise(mutation)), timer)
        // The mutation is applied only if the predicate does NOT match
        .thenApply(predicateMatched -> !predicateMatched);
  }

  /**
   * Streams all rows matching the given query into a list.
   */
  CompletableFuture<List<Row>> readRows(Timer timer, Query query) {
    final Timer.Context timerContext = timer.time();
    final CompletableFuture<List<Row>> future = new CompletableFuture<>();

    client.readRowsAsync(query, new ResponseObserver<>() {
      private final List<Row> rows = new ArrayList<>();

      @Override
      public void onStart(final StreamController controller) {
      }

      @Override
      public void onResponse(final Row row) {
        rows.add(row);
      }

      @Override
      public void onError(final Throwable throwable) {
        timerContext.close();
        future.completeExceptionally(throwable);
      }

      @Override
      public void onComplete() {
        timerContext.close();
        future.complete(rows);
      }
    });

    return future;
  }

  static Optional<String> getCellValue(final Row row, final String family, final String column) {
    final List<RowCell> cells = row.getCells(family, column);

    if (cells.isEmpty()) {
      return Optional.empty();
    }

    return Optional.of(cells.get(0).getValue().toStringUtf8());
  }

  static <T> CompletableFuture<T> toFuture(ApiFuture<T> future, Timer timer) {
    Timer.Context        timerContext = timer.time();
    CompletableFuture<T> result       = new CompletableFuture<>();

    ApiFutures.addCallback(future, new ApiFutureCallback<T>() {
      @Override
      public void onFailure(Throwable t) {
        timerContext.close();
        result.completeExceptionally(t);
      }

      @Override
      public void onSuccess(T t) {
        timerContext.close();
        result.complete(t);
      }
    }, MoreExecutors.directExecutor());

    return result;
  }

}
