package io.intellixity.pgrecord.client;

import io.intellixity.pgrecord.config.PgRecordSettings;

/** Opens a {@link SqlClient}; failures are raised as {@link io.intellixity.pgrecord.errors.ConnectionException}. */
@FunctionalInterface
public interface SqlConnector {
  SqlClient connect(PgRecordSettings settings);
}
