package io.intellixity.pgrecord.exec;

import io.intellixity.pgrecord.client.ClientGuard;
import io.intellixity.pgrecord.client.PreparedSql;
import io.intellixity.pgrecord.client.SqlClient;
import io.intellixity.pgrecord.client.SqlConnector;
import io.intellixity.pgrecord.client.SqlRow;
import io.intellixity.pgrecord.config.PgRecordSettings;
import io.intellixity.pgrecord.descriptor.DescriptorRegistry;
import io.intellixity.pgrecord.descriptor.TypeDescriptor;
import io.intellixity.pgrecord.errors.ConnectionException;
import io.intellixity.pgrecord.mapping.RowDecoder;
import io.intellixity.pgrecord.sql.SqlStatement;
import io.intellixity.pgrecord.sql.StatementBuilder;
import io.intellixity.pgrecord.util.PgRecordFactoriesLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Asynchronous record operations over one shared {@link SqlClient}.
 *
 * <p>Each statement is prepared and executed while holding the client's {@link ClientGuard}, so concurrent
 * callers are serialized per statement. Descriptor synthesis and statement building happen in the calling
 * thread; mapping errors are therefore thrown directly rather than through the returned future. Row
 * decoding runs after the guard is released.</p>
 *
 * <p>Batch operations given an empty list complete with an empty list without contacting the server.</p>
 *
 * <p>Without an explicit executor, statements run on a daemon thread owned by the connection and stopped
 * by {@link #close()}. A caller-supplied executor is never shut down here.</p>
 */
public final class PgConnection implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(PgConnection.class);

  private static final AtomicInteger THREAD_IDS = new AtomicInteger();

  private final ClientGuard<SqlClient> guard;
  private final Executor executor;
  private final ExecutorService ownedExecutor;
  private final DescriptorRegistry registry;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  private PgConnection(SqlClient client, Executor executor, ExecutorService ownedExecutor,
                       DescriptorRegistry registry) {
    this.guard = new ClientGuard<>(Objects.requireNonNull(client, "client"));
    this.executor = Objects.requireNonNull(executor, "executor");
    this.ownedExecutor = ownedExecutor;
    this.registry = Objects.requireNonNull(registry, "registry");
  }

  /** Runs statements on a dedicated daemon thread that is shut down by {@link #close()}. */
  public static PgConnection open(SqlClient client) {
    ExecutorService own = newConnectionExecutor();
    return open(client, own, own, DescriptorRegistry.global());
  }

  /** Runs statements on {@code executor}, which stays owned by the caller. */
  public static PgConnection open(SqlClient client, Executor executor) {
    return open(client, executor, DescriptorRegistry.global());
  }

  public static PgConnection open(SqlClient client, Executor executor, DescriptorRegistry registry) {
    return open(client, executor, null, registry);
  }

  private static PgConnection open(SqlClient client, Executor executor, ExecutorService owned,
                                   DescriptorRegistry registry) {
    PgConnection c = new PgConnection(client, executor, owned, registry);
    log.info("pgrecord.conn opened client={} ownExecutor={}", client.getClass().getSimpleName(), owned != null);
    return c;
  }

  /** One daemon thread per connection; the guard admits one statement at a time anyway. */
  static ExecutorService newConnectionExecutor() {
    return Executors.newSingleThreadExecutor(r -> {
      Thread t = new Thread(r, "pgrecord-conn-" + THREAD_IDS.incrementAndGet());
      t.setDaemon(true);
      return t;
    });
  }

  /** Connects on {@code executor}; the future fails with {@link ConnectionException} when the server is unreachable. */
  public static CompletableFuture<PgConnection> connect(SqlConnector connector, PgRecordSettings settings,
                                                        Executor executor) {
    Objects.requireNonNull(connector, "connector");
    Objects.requireNonNull(settings, "settings");
    Objects.requireNonNull(executor, "executor");
    return CompletableFuture.supplyAsync(() -> open(connector.connect(settings), executor), executor);
  }

  /** Connects and runs statements on a dedicated thread owned by the returned connection. */
  public static CompletableFuture<PgConnection> connect(SqlConnector connector, PgRecordSettings settings) {
    Objects.requireNonNull(connector, "connector");
    Objects.requireNonNull(settings, "settings");
    ExecutorService own = newConnectionExecutor();
    CompletableFuture<PgConnection> f = CompletableFuture.supplyAsync(
        () -> open(connector.connect(settings), own, own, DescriptorRegistry.global()), own);
    f.whenComplete((c, e) -> {
      if (e != null) own.shutdown();
    });
    return f;
  }

  /** Uses the first {@link SqlConnector} registered in {@value PgRecordFactoriesLoader#RESOURCE}. */
  public static CompletableFuture<PgConnection> connect(PgRecordSettings settings) {
    List<SqlConnector> found = PgRecordFactoriesLoader.load(SqlConnector.class);
    if (found.isEmpty()) {
      return CompletableFuture.failedFuture(
          new ConnectionException("No SqlConnector registered in " + PgRecordFactoriesLoader.RESOURCE));
    }
    return connect(found.get(0), settings);
  }

  /** Runs {@code sql} with positional arguments ({@code $1} is {@code args[0]}) and returns the affected row count. */
  public CompletableFuture<Long> execute(String sql, Object... args) {
    SqlStatement ss = new SqlStatement(sql, StatementBuilder.binds(args), SqlStatement.ExecKind.UPDATE);
    return submit("execute", ss, c -> {
      try (PreparedSql ps = c.prepare(ss.sql())) {
        return c.execute(ps, ss.binds());
      }
    });
  }

  /** Runs a parameterless, semicolon-separated script; the first failing statement fails the future. */
  public CompletableFuture<Void> batchExecute(String script) {
    Objects.requireNonNull(script, "script");
    SqlStatement ss = new SqlStatement(script, List.of(), SqlStatement.ExecKind.UPDATE);
    return submit("batchExecute", ss, c -> {
      c.batchExecute(script);
      return null;
    });
  }

  /** Exactly one row is expected; zero rows fails with {@link io.intellixity.pgrecord.errors.NotFoundException}. */
  public <T> CompletableFuture<T> query(Class<T> type, String sql, Object... args) {
    RowDecoder<T> decoder = registry.decoder(type);
    return one("query", StatementBuilder.query(sql, args), decoder);
  }

  public <T> CompletableFuture<List<T>> queryMultiple(Class<T> type, String sql, Object... args) {
    RowDecoder<T> decoder = registry.decoder(type);
    return many("queryMultiple", StatementBuilder.query(sql, args), decoder);
  }

  public <T> CompletableFuture<T> create(T record) {
    StatementBuilder<T> b = builderFor(record);
    return one("create", b.insert(record), b.descriptor().decoder());
  }

  public <T> CompletableFuture<List<T>> createMultiple(List<T> records) {
    if (records.isEmpty()) return CompletableFuture.completedFuture(List.of());
    StatementBuilder<T> b = batchBuilderFor(records);
    return many("createMultiple", b.insertMultiple(records), b.descriptor().decoder());
  }

  public <T> CompletableFuture<T> update(T record) {
    StatementBuilder<T> b = builderFor(record);
    return one("update", b.update(record), b.descriptor().decoder());
  }

  public <T> CompletableFuture<List<T>> updateMultiple(List<T> records) {
    if (records.isEmpty()) return CompletableFuture.completedFuture(List.of());
    StatementBuilder<T> b = batchBuilderFor(records);
    return many("updateMultiple", b.updateMultiple(records), b.descriptor().decoder());
  }

  public <T> CompletableFuture<T> delete(T record) {
    StatementBuilder<T> b = builderFor(record);
    return one("delete", b.delete(record), b.descriptor().decoder());
  }

  public <T> CompletableFuture<List<T>> deleteMultiple(List<T> records) {
    if (records.isEmpty()) return CompletableFuture.completedFuture(List.of());
    StatementBuilder<T> b = batchBuilderFor(records);
    return many("deleteMultiple", b.deleteMultiple(records), b.descriptor().decoder());
  }

  public boolean isClosed() {
    return closed.get();
  }

  /** Waits for the statement in flight, then closes the client. Further calls fail with {@link ConnectionException}. */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) return;
    try {
      guard.withClient(c -> {
        c.close();
        return null;
      });
    } finally {
      if (ownedExecutor != null) ownedExecutor.shutdown();
    }
    log.info("pgrecord.conn closed");
  }

  private <T> CompletableFuture<T> one(String op, SqlStatement ss, RowDecoder<T> decoder) {
    return submit(op, ss, c -> {
      try (PreparedSql ps = c.prepare(ss.sql())) {
        return c.queryOne(ps, ss.binds());
      }
    }).thenApply(decoder::decode);
  }

  private <T> CompletableFuture<List<T>> many(String op, SqlStatement ss, RowDecoder<T> decoder) {
    return submit(op, ss, c -> {
      try (PreparedSql ps = c.prepare(ss.sql())) {
        return c.query(ps, ss.binds());
      }
    }).thenApply(rows -> decoder.decodeAll(rows));
  }

  private <R> CompletableFuture<R> submit(String op, SqlStatement ss, Function<SqlClient, R> work) {
    if (closed.get()) return CompletableFuture.failedFuture(closedError(op));
    CompletableFuture<R> f;
    try {
      f = CompletableFuture.supplyAsync(() -> guard.withClient(c -> {
        if (closed.get() || c.isClosed()) throw closedError(op);
        return work.apply(c);
      }), executor);
    } catch (RejectedExecutionException e) {
      return CompletableFuture.failedFuture(closed.get() ? closedError(op) : e);
    }
    if (log.isDebugEnabled()) {
      f.whenComplete((r, e) -> {
        if (e != null) {
          log.debug("pgrecord.conn op={} bindCount={} failed: {}", op, ss.binds().size(), e.toString());
        }
      });
    }
    return f;
  }

  @SuppressWarnings("unchecked")
  private <T> StatementBuilder<T> builderFor(T record) {
    Objects.requireNonNull(record, "record");
    TypeDescriptor<T> d = registry.descriptor((Class<T>) record.getClass());
    return new StatementBuilder<>(d);
  }

  private <T> StatementBuilder<T> batchBuilderFor(List<T> records) {
    T first = records.get(0);
    StatementBuilder<T> b = builderFor(first);
    for (T r : records) {
      if (r != null && r.getClass() != first.getClass()) {
        throw new IllegalArgumentException("Mixed record types in batch: " + first.getClass().getName()
            + " and " + r.getClass().getName());
      }
    }
    return b;
  }

  private static ConnectionException closedError(String op) {
    return new ConnectionException("Connection is closed (op=" + op + ")");
  }
}
