package io.intellixity.pgrecord.exec;

import io.intellixity.pgrecord.annotation.Column;
import io.intellixity.pgrecord.annotation.PrimaryKey;
import io.intellixity.pgrecord.config.PgRecordSettings;
import io.intellixity.pgrecord.descriptor.DescriptorRegistry;
import io.intellixity.pgrecord.errors.ConnectionException;
import io.intellixity.pgrecord.errors.NotFoundException;
import io.intellixity.pgrecord.errors.StatementException;
import io.intellixity.pgrecord.errors.SynthesisException;
import io.intellixity.pgrecord.sql.Bind;
import io.intellixity.pgrecord.testing.FakeSqlClient;
import io.intellixity.pgrecord.testing.MapRow;
import io.intellixity.pgrecord.testing.StubConnector;
import io.intellixity.pgrecord.types.WireType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

final class PgConnectionTest {

  record Product(@PrimaryKey @Column(name = "prod_id") int prodId, String title) {}

  record Summary(String title, long total) {}

  record Priced(@PrimaryKey int id, BigDecimal price) {}

  private final ExecutorService pool = Executors.newFixedThreadPool(8);

  @AfterEach
  void shutdown() throws InterruptedException {
    pool.shutdownNow();
    assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
  }

  private PgConnection open(FakeSqlClient client) {
    return PgConnection.open(client, pool, new DescriptorRegistry());
  }

  private static Throwable causeOf(CompletableFuture<?> f) {
    CompletionException e = assertThrows(CompletionException.class, f::join);
    return e.getCause();
  }

  @Test
  void create_sendsInsertAndDecodesReturnedRow() {
    FakeSqlClient client = new FakeSqlClient().respond(MapRow.of("prod_id", 11, "title", "x"));
    PgConnection conn = open(client);

    Product created = conn.create(new Product(0, "x")).join();

    assertEquals(new Product(11, "x"), created);
    assertEquals(1, client.calls().size());
    assertEquals("INSERT INTO \"Product\" (\"title\") VALUES ($1) RETURNING *", client.calls().get(0).sql());
    assertEquals(List.of(new Bind("x", WireType.VARCHAR)), client.calls().get(0).binds());
  }

  @Test
  void createMultiple_returnsRowsInServerOrder() {
    FakeSqlClient client = new FakeSqlClient().respond(
        MapRow.of("prod_id", 2, "title", "b"),
        MapRow.of("prod_id", 1, "title", "a"));
    PgConnection conn = open(client);

    List<Product> out = conn.createMultiple(List.of(new Product(0, "a"), new Product(0, "b"))).join();

    assertEquals(List.of(new Product(2, "b"), new Product(1, "a")), out);
    assertEquals("INSERT INTO \"Product\" (\"title\") VALUES ($1),($2) RETURNING *", client.calls().get(0).sql());
  }

  @Test
  void emptyBatches_completeWithoutRoundTrip() {
    FakeSqlClient client = new FakeSqlClient();
    PgConnection conn = open(client);

    assertEquals(List.of(), conn.createMultiple(new ArrayList<Product>()).join());
    assertEquals(List.of(), conn.updateMultiple(new ArrayList<Product>()).join());
    assertEquals(List.of(), conn.deleteMultiple(new ArrayList<Product>()).join());
    assertEquals(0, client.preparedCount());
  }

  @Test
  void update_bindsCurrentPrimaryKeyFirst() {
    FakeSqlClient client = new FakeSqlClient().respond(MapRow.of("prod_id", 5, "title", "new"));
    PgConnection conn = open(client);

    assertEquals(new Product(5, "new"), conn.update(new Product(5, "new")).join());
    FakeSqlClient.Call call = client.calls().get(0);
    assertEquals("UPDATE \"Product\" SET \"title\" = $2 WHERE \"prod_id\" = $1 RETURNING *", call.sql());
    assertEquals(5, call.binds().get(0).value());
  }

  @Test
  void updateMultiple_andDeleteMultiple_roundTripOnce() {
    FakeSqlClient client = new FakeSqlClient()
        .respond(MapRow.of("prod_id", 1, "title", "a"), MapRow.of("prod_id", 2, "title", "b"))
        .respond(MapRow.of("prod_id", 1, "title", "a"), MapRow.of("prod_id", 2, "title", "b"));
    PgConnection conn = open(client);
    List<Product> items = List.of(new Product(1, "a"), new Product(2, "b"));

    assertEquals(items, conn.updateMultiple(items).join());
    assertEquals(items, conn.deleteMultiple(items).join());
    assertEquals(2, client.calls().size());
    assertTrue(client.calls().get(0).sql().startsWith("UPDATE \"Product\" AS P SET"));
    assertEquals("DELETE FROM \"Product\" WHERE \"prod_id\" IN ($1,$2) RETURNING *", client.calls().get(1).sql());
  }

  @Test
  void delete_withNoRow_failsWithNotFound() {
    PgConnection conn = open(new FakeSqlClient());
    assertInstanceOf(NotFoundException.class, causeOf(conn.delete(new Product(99, "gone"))));
  }

  @Test
  void query_decodesKeylessRecords() {
    FakeSqlClient client = new FakeSqlClient().respond(MapRow.of("title", "x", "total", 3L));
    PgConnection conn = open(client);

    Summary s = conn.query(Summary.class, "SELECT title, count(*) AS total FROM t WHERE title = $1 GROUP BY title", "x").join();

    assertEquals(new Summary("x", 3L), s);
    assertEquals(List.of(new Bind("x", WireType.VARCHAR)), client.calls().get(0).binds());
  }

  @Test
  void query_withSeveralRows_isAStatementError() {
    FakeSqlClient client = new FakeSqlClient().respond(
        MapRow.of("title", "a", "total", 1L), MapRow.of("title", "b", "total", 2L));
    PgConnection conn = open(client);
    assertInstanceOf(StatementException.class, causeOf(conn.query(Summary.class, "SELECT title, total FROM s")));
  }

  @Test
  void queryMultiple_returnsEmptyListForNoRows() {
    PgConnection conn = open(new FakeSqlClient());
    assertEquals(List.of(), conn.queryMultiple(Summary.class, "SELECT title, total FROM s").join());
  }

  @Test
  void execute_returnsRowCount_andBatchExecutePassesScript() {
    FakeSqlClient client = new FakeSqlClient().updateCount(3);
    PgConnection conn = open(client);

    assertEquals(3L, conn.execute("DELETE FROM t WHERE a = $1", 1).join());
    conn.batchExecute("CREATE TABLE a(x int); CREATE TABLE b(y int)").join();

    assertEquals("CREATE TABLE a(x int); CREATE TABLE b(y int)", client.calls().get(1).sql());
  }

  @Test
  void clientFailures_propagateUnchanged() {
    StatementException boom = new StatementException("relation \"t\" does not exist", "42P01");
    PgConnection conn = open(new FakeSqlClient().failWith(boom));
    assertSame(boom, causeOf(conn.execute("SELECT * FROM t")));
  }

  @Test
  void synthesisErrors_areThrownBeforeAnyRoundTrip() {
    FakeSqlClient client = new FakeSqlClient();
    PgConnection conn = open(client);
    assertThrows(SynthesisException.class, () -> conn.create(new Priced(1, BigDecimal.ONE)));
    assertEquals(0, client.preparedCount());
  }

  @Test
  void afterClose_everyCallFailsWithConnectionError() {
    FakeSqlClient client = new FakeSqlClient();
    PgConnection conn = open(client);
    conn.close();
    conn.close();

    assertTrue(conn.isClosed());
    assertTrue(client.isClosed());
    assertInstanceOf(ConnectionException.class, causeOf(conn.create(new Product(0, "x"))));
    assertInstanceOf(ConnectionException.class, causeOf(conn.execute("SELECT 1")));
  }

  @Test
  void concurrentCallers_areSerializedOnTheClient() {
    FakeSqlClient client = new FakeSqlClient().workMillis(5);
    PgConnection conn = open(client);

    List<CompletableFuture<Long>> fs = new ArrayList<>();
    for (int i = 0; i < 24; i++) fs.add(conn.execute("UPDATE t SET n = n + 1 WHERE id = $1", i));
    CompletableFuture.allOf(fs.toArray(new CompletableFuture[0])).join();

    assertEquals(24, client.calls().size());
    assertEquals(1, client.maxInFlight());
  }

  @Test
  void defaultExecutor_isOwnedByTheConnection_andStoppedOnClose() throws InterruptedException {
    FakeSqlClient client = new FakeSqlClient();
    PgConnection conn = PgConnection.open(client);

    conn.execute("SELECT 1").join();
    conn.execute("SELECT 2").join();
    Thread worker = client.threads().get(0);
    assertTrue(worker.getName().startsWith("pgrecord-conn-"), worker.getName());
    assertTrue(worker.isDaemon());
    assertSame(worker, client.threads().get(1));

    conn.close();
    worker.join(5_000);
    assertFalse(worker.isAlive());
    assertInstanceOf(ConnectionException.class, causeOf(conn.execute("SELECT 3")));
  }

  @Test
  void suppliedExecutor_isLeftRunningOnClose() {
    open(new FakeSqlClient()).close();
    assertFalse(pool.isShutdown());
  }

  @Test
  void connect_usesGivenConnector() {
    PgConnection conn = PgConnection.connect(new StubConnector(), PgRecordSettings.of("postgresql://db/x", "u", "p"), pool).join();
    assertFalse(conn.isClosed());
    conn.close();
  }

  @Test
  void connect_discoversConnector_andReportsUnreachableServer() {
    PgConnection conn = PgConnection.connect(PgRecordSettings.of("postgresql://db/x", "u", "p")).join();
    assertFalse(conn.isClosed());
    conn.close();

    CompletableFuture<PgConnection> f = PgConnection.connect(PgRecordSettings.of("postgresql://unreachable/x", "u", "p"));
    assertInstanceOf(ConnectionException.class, causeOf(f));
  }
}
