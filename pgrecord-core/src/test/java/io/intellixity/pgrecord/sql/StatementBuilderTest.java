package io.intellixity.pgrecord.sql;

import io.intellixity.pgrecord.annotation.Column;
import io.intellixity.pgrecord.annotation.PrimaryKey;
import io.intellixity.pgrecord.annotation.Table;
import io.intellixity.pgrecord.descriptor.DescriptorRegistry;
import io.intellixity.pgrecord.sql.SqlStatement.ExecKind;
import io.intellixity.pgrecord.types.WireType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class StatementBuilderTest {

  record Product(@PrimaryKey @Column(name = "prod_id") int prodId, String title) {}

  @Table("inventory")
  record Stock(@PrimaryKey long id, String sku, int quantity) {}

  record Tag(@PrimaryKey int id) {}

  record Entry(@PrimaryKey @Column(name = "order") long id, String desc, int qty) {}

  private static final DescriptorRegistry REG = new DescriptorRegistry();

  private static <T> StatementBuilder<T> builder(Class<T> type) {
    return new StatementBuilder<>(REG.descriptor(type));
  }

  @Test
  void insert_singleColumn() {
    SqlStatement s = builder(Product.class).insert(new Product(0, "x"));
    assertEquals("INSERT INTO \"Product\" (\"title\") VALUES ($1) RETURNING *", s.sql());
    assertEquals(List.of(new Bind("x", WireType.VARCHAR)), s.binds());
    assertEquals(ExecKind.QUERY_ONE, s.execKind());
  }

  @Test
  void insert_withoutValueColumns_usesDefaultValues() {
    SqlStatement s = builder(Tag.class).insert(new Tag(1));
    assertEquals("INSERT INTO \"Tag\" DEFAULT VALUES RETURNING *", s.sql());
    assertTrue(s.binds().isEmpty());
  }

  @Test
  void insertMultiple_groupsRowsInInputOrder() {
    SqlStatement s = builder(Product.class).insertMultiple(List.of(
        new Product(0, "a"), new Product(0, "b"), new Product(0, "c")));
    assertEquals("INSERT INTO \"Product\" (\"title\") VALUES ($1),($2),($3) RETURNING *", s.sql());
    assertEquals(List.of("a", "b", "c"), s.binds().stream().map(Bind::value).toList());
    assertEquals(ExecKind.QUERY, s.execKind());
  }

  @Test
  void insertMultiple_multiColumn() {
    SqlStatement s = builder(Stock.class).insertMultiple(List.of(new Stock(0, "s1", 4), new Stock(0, "s2", 9)));
    assertEquals("INSERT INTO \"inventory\" (\"sku\",\"quantity\") VALUES ($1,$2),($3,$4) RETURNING *", s.sql());
    assertEquals(List.of("s1", 4, "s2", 9), s.binds().stream().map(Bind::value).toList());
  }

  @Test
  void update_scalarFormForOneColumn() {
    SqlStatement s = builder(Product.class).update(new Product(7, "y"));
    assertEquals("UPDATE \"Product\" SET \"title\" = $2 WHERE \"prod_id\" = $1 RETURNING *", s.sql());
    assertEquals(List.of(new Bind(7, WireType.INT), new Bind("y", WireType.VARCHAR)), s.binds());
  }

  @Test
  void update_tupleFormForSeveralColumns() {
    SqlStatement s = builder(Stock.class).update(new Stock(3L, "s", 1));
    assertEquals("UPDATE \"inventory\" SET (\"sku\",\"quantity\") = ($2,$3) WHERE \"id\" = $1 RETURNING *", s.sql());
    assertEquals(List.of(3L, "s", 1), s.binds().stream().map(Bind::value).toList());
  }

  @Test
  void update_withoutValueColumns_isRejected() {
    assertThrows(IllegalArgumentException.class, () -> builder(Tag.class).update(new Tag(1)));
  }

  @Test
  void updateMultiple_joinsTypedValuesOnPrimaryKey() {
    SqlStatement s = builder(Stock.class).updateMultiple(List.of(new Stock(1L, "a", 10), new Stock(2L, "b", 20)));
    assertEquals("UPDATE \"inventory\" AS P SET (\"sku\",\"quantity\") = (temp_table.\"sku\",temp_table.\"quantity\")"
        + " FROM (VALUES ($1::BIGINT,$2::VARCHAR,$3::INT),($4::BIGINT,$5::VARCHAR,$6::INT))"
        + " AS temp_table(\"id\",\"sku\",\"quantity\")"
        + " WHERE P.\"id\" = temp_table.\"id\" RETURNING *", s.sql());
    assertEquals(List.of(1L, "a", 10, 2L, "b", 20), s.binds().stream().map(Bind::value).toList());
  }

  @Test
  void updateMultiple_scalarFormForOneColumn() {
    SqlStatement s = builder(Product.class).updateMultiple(List.of(new Product(60, "Rust")));
    assertEquals("UPDATE \"Product\" AS P SET \"title\" = temp_table.\"title\""
        + " FROM (VALUES ($1::INT,$2::VARCHAR)) AS temp_table(\"prod_id\",\"title\")"
        + " WHERE P.\"prod_id\" = temp_table.\"prod_id\" RETURNING *", s.sql());
  }

  @Test
  void delete_bindsPrimaryKeyOnly() {
    SqlStatement s = builder(Product.class).delete(new Product(5, "z"));
    assertEquals("DELETE FROM \"Product\" WHERE \"prod_id\" IN ($1) RETURNING *", s.sql());
    assertEquals(List.of(new Bind(5, WireType.INT)), s.binds());
  }

  @Test
  void deleteMultiple_bindsKeysInInputOrder() {
    SqlStatement s = builder(Product.class).deleteMultiple(List.of(
        new Product(3, "a"), new Product(1, "b"), new Product(2, "c")));
    assertEquals("DELETE FROM \"Product\" WHERE \"prod_id\" IN ($1,$2,$3) RETURNING *", s.sql());
    assertEquals(List.of(3, 1, 2), s.binds().stream().map(Bind::value).toList());
  }

  @Test
  void batches_rejectEmptyInput() {
    StatementBuilder<Product> b = builder(Product.class);
    assertThrows(IllegalArgumentException.class, () -> b.insertMultiple(List.of()));
    assertThrows(IllegalArgumentException.class, () -> b.updateMultiple(List.of()));
    assertThrows(IllegalArgumentException.class, () -> b.deleteMultiple(List.of()));
  }

  @Test
  void query_infersWireTypesAndKeepsExplicitBinds() {
    Bind explicit = new Bind(9L, WireType.OID);
    SqlStatement s = StatementBuilder.query("SELECT * FROM t WHERE a = $1 AND b = $2 AND c = $3 AND d = $4",
        "x", explicit, Optional.of(3), null);
    assertEquals(List.of(new Bind("x", WireType.VARCHAR), explicit, new Bind(3, WireType.INT), new Bind(null, null)),
        s.binds());
    assertEquals(ExecKind.QUERY, s.execKind());
  }

  @Test
  void query_withoutArgs_hasNoBinds() {
    assertTrue(StatementBuilder.query("SELECT 1").binds().isEmpty());
  }

  @Test
  void reservedWordColumns_areQuotedInEveryTemplate() {
    StatementBuilder<Entry> b = builder(Entry.class);
    Entry e1 = new Entry(1, "first", 2);
    Entry e2 = new Entry(2, "second", 3);

    assertEquals("INSERT INTO \"Entry\" (\"desc\",\"qty\") VALUES ($1,$2) RETURNING *", b.insert(e1).sql());
    assertEquals("INSERT INTO \"Entry\" (\"desc\",\"qty\") VALUES ($1,$2),($3,$4) RETURNING *",
        b.insertMultiple(List.of(e1, e2)).sql());
    assertEquals("UPDATE \"Entry\" SET (\"desc\",\"qty\") = ($2,$3) WHERE \"order\" = $1 RETURNING *",
        b.update(e1).sql());
    assertEquals("UPDATE \"Entry\" AS P SET (\"desc\",\"qty\") = (temp_table.\"desc\",temp_table.\"qty\")"
        + " FROM (VALUES ($1::BIGINT,$2::VARCHAR,$3::INT),($4::BIGINT,$5::VARCHAR,$6::INT))"
        + " AS temp_table(\"order\",\"desc\",\"qty\")"
        + " WHERE P.\"order\" = temp_table.\"order\" RETURNING *", b.updateMultiple(List.of(e1, e2)).sql());
    assertEquals("DELETE FROM \"Entry\" WHERE \"order\" IN ($1) RETURNING *", b.delete(e1).sql());
    assertEquals("DELETE FROM \"Entry\" WHERE \"order\" IN ($1,$2) RETURNING *",
        b.deleteMultiple(List.of(e1, e2)).sql());

    for (SqlStatement s : List.of(b.insert(e1), b.update(e1), b.updateMultiple(List.of(e1)), b.delete(e1))) {
      String bare = s.sql().replace("\"desc\"", "").replace("\"order\"", "");
      assertFalse(bare.contains("desc") || bare.contains("order"), s.sql());
    }
  }
}
