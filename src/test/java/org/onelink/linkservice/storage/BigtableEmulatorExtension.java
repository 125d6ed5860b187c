/*
 * Copyright 2025 OneLink
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.onelink.linkservice.storage;

import com.google.cloud.bigtable.admin.v2.BigtableTableAdminClient;
import com.google.cloud.bigtable.admin.v2.BigtableTableAdminSettings;
import com.google.cloud.bigtable.admin.v2.models.CreateTableRequest;
import com.google.cloud.bigtable.data.v2.BigtableDataClient;
import com.google.cloud.bigtable.data.v2.BigtableDataSettings;
import com.google.cloud.bigtable.emulator.v2.Emulator;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;

/**
 * A JUnit 5 extension that starts a bundled Bigtable {@link Emulator} with empty links and clicks tables for each test.
 */
public class BigtableEmulatorExtension implements BeforeEachCallback, AfterEachCallback {

  static final String LINKS_TABLE_ID = "links";
  static final String CLICKS_TABLE_ID = "clicks";

  private static final String PROJECT_ID = "test-project";
  private static final String INSTANCE_ID = "test-instance";

  private Emulator emulator;
  private BigtableDataClient client;

  static BigtableEmulatorExtension create() {
    return new BigtableEmulatorExtension();
  }

  private BigtableEmulatorExtension() {
  }

  @Override
  public void beforeEach(final ExtensionContext context) throws Exception {
    emulator = Emulator.createBundled();
    emulator.start();

    final BigtableTableAdminSettings tableAdminSettings =
        BigtableTableAdminSettings.newBuilderForEmulator(emulator.getPort())
            .setProjectId(PROJECT_ID)
            .setInstanceId(INSTANCE_ID)
            .build();

    try (BigtableTableAdminClient tableAdminClient = BigtableTableAdminClient.create(tableAdminSettings)) {
      tableAdminClient.createTable(CreateTableRequest.of(LINKS_TABLE_ID).addFamily(LinksTable.FAMILY));
      tableAdminClient.createTable(CreateTableRequest.of(CLICKS_TABLE_ID).addFamily(ClicksTable.FAMILY));
    }

    client = BigtableDataClient.create(BigtableDataSettings.newBuilderForEmulator(emulator.getPort())
        .setProjectId(PROJECT_ID)
        .setInstanceId(INSTANCE_ID)
        .build());
  }

  @Override
  public void afterEach(final ExtensionContext context) throws Exception {
    client.close();
    client = null;

    emulator.stop();
    emulator = null;
  }

  public BigtableDataClient getClient() {
    return client;
  }
}
