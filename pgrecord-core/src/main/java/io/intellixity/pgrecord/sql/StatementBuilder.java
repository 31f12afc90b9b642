package io.intellixity.pgrecord.sql;

import io.intellixity.pgrecord.descriptor.ColumnRef;
import io.intellixity.pgrecord.descriptor.TypeDescriptor;
import io.intellixity.pgrecord.sql.SqlStatement.ExecKind;
import io.intellixity.pgrecord.types.ScalarCodecs;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * SQL text plus ordered binds for the record operations of one type.
 *
 * <p>Identifiers come pre-quoted from the descriptor; values are always sent as parameters. Every
 * statement ends with {@code RETURNING *} so the server's view of the affected rows is decoded back.</p>
 */
public final class StatementBuilder<T> {
  private final TypeDescriptor<T> descriptor;

  public StatementBuilder(TypeDescriptor<T> descriptor) {
    this.descriptor = Objects.requireNonNull(descriptor, "descriptor");
  }

  public TypeDescriptor<T> descriptor() { return descriptor; }

  public SqlStatement insert(T record) {
    Objects.requireNonNull(record, "record");
    int n = descriptor.argumentCount();
    if (n == 0) {
      return new SqlStatement("INSERT INTO " + descriptor.tableName() + " DEFAULT VALUES RETURNING *",
          List.of(), ExecKind.QUERY_ONE);
    }
    String sql = "INSERT INTO " + descriptor.tableName() + " (" + descriptor.fieldList() + ") VALUES ("
        + Placeholders.singleArgList(n) + ") RETURNING *";
    return new SqlStatement(sql, descriptor.queryParams(record), ExecKind.QUERY_ONE);
  }

  public SqlStatement insertMultiple(List<? extends T> records) {
    requireRows(records);
    int n = descriptor.argumentCount();
    if (n == 0) throw new IllegalArgumentException(noColumns("multi-row insert"));
    List<Bind> binds = new ArrayList<>(n * records.size());
    for (T r : records) binds.addAll(descriptor.queryParams(r));
    String sql = "INSERT INTO " + descriptor.tableName() + " (" + descriptor.fieldList() + ") VALUES "
        + Placeholders.rowGroupedArgList(n, records.size()) + " RETURNING *";
    return new SqlStatement(sql, binds, ExecKind.QUERY);
  }

  /** {@code $1} is the current primary key; the value columns follow as {@code $2..$n+1}. */
  public SqlStatement update(T record) {
    Objects.requireNonNull(record, "record");
    int n = descriptor.argumentCount();
    if (n == 0) throw new IllegalArgumentException(noColumns("update"));
    String set = (n == 1)
        ? descriptor.fieldList() + " = $2"
        : "(" + descriptor.fieldList() + ") = (" + Placeholders.singleArgListFrom(2, n + 1) + ")";
    String sql = "UPDATE " + descriptor.tableName() + " SET " + set
        + " WHERE " + descriptor.primaryKey().quotedName() + " = $1 RETURNING *";
    return new SqlStatement(sql, descriptor.allValues(record), ExecKind.QUERY_ONE);
  }

  /** Joins the target table against a typed {@code VALUES} row set on the primary key. */
  public SqlStatement updateMultiple(List<? extends T> records) {
    requireRows(records);
    int n = descriptor.argumentCount();
    if (n == 0) throw new IllegalArgumentException(noColumns("multi-row update"));
    List<Bind> binds = new ArrayList<>((n + 1) * records.size());
    for (T r : records) binds.addAll(descriptor.allValues(r));

    String inner = descriptor.columns().stream()
        .map(c -> "temp_table." + c.quotedName())
        .collect(Collectors.joining(","));
    String set = (n == 1)
        ? descriptor.fieldList() + " = " + inner
        : "(" + descriptor.fieldList() + ") = (" + inner + ")";
    String pk = descriptor.primaryKey().quotedName();
    String sql = "UPDATE " + descriptor.tableName() + " AS P SET " + set
        + " FROM (VALUES " + Placeholders.typedRowGroupedArgList(descriptor, n + 1, records.size())
        + ") AS temp_table(" + descriptor.allFieldList() + ")"
        + " WHERE P." + pk + " = temp_table." + pk + " RETURNING *";
    return new SqlStatement(sql, binds, ExecKind.QUERY);
  }

  public SqlStatement delete(T record) {
    Objects.requireNonNull(record, "record");
    String sql = "DELETE FROM " + descriptor.tableName() + " WHERE " + descriptor.primaryKey().quotedName()
        + " IN ($1) RETURNING *";
    return new SqlStatement(sql, List.of(descriptor.primaryKeyValue(record)), ExecKind.QUERY_ONE);
  }

  public SqlStatement deleteMultiple(List<? extends T> records) {
    requireRows(records);
    List<Bind> binds = new ArrayList<>(records.size());
    for (T r : records) binds.add(descriptor.primaryKeyValue(r));
    String sql = "DELETE FROM " + descriptor.tableName() + " WHERE " + descriptor.primaryKey().quotedName()
        + " IN (" + Placeholders.singleArgList(records.size()) + ") RETURNING *";
    return new SqlStatement(sql, binds, ExecKind.QUERY);
  }

  /**
   * Caller-written SQL. Each argument becomes {@code $i}; an argument that already is a {@link Bind}
   * is used as is, otherwise the wire type is inferred from the runtime value.
   */
  public static SqlStatement query(String sql, Object... args) {
    Objects.requireNonNull(sql, "sql");
    return new SqlStatement(sql, binds(args), ExecKind.QUERY);
  }

  public static List<Bind> binds(Object... args) {
    if (args == null || args.length == 0) return List.of();
    List<Bind> out = new ArrayList<>(args.length);
    for (Object a : args) out.add(toBind(a));
    return out;
  }

  private static Bind toBind(Object arg) {
    if (arg instanceof Bind b) return b;
    Object v = (arg instanceof Optional<?> o) ? o.orElse(null) : arg;
    return new Bind(v, ScalarCodecs.infer(v));
  }

  private void requireRows(List<? extends T> records) {
    Objects.requireNonNull(records, "records");
    if (records.isEmpty()) throw new IllegalArgumentException("records must not be empty");
    for (T r : records) Objects.requireNonNull(r, "records must not contain null");
  }

  private String noColumns(String op) {
    List<ColumnRef> all = descriptor.allColumns();
    return "Cannot build " + op + " for " + descriptor.recordType().getName()
        + ": no columns besides primary key " + all.get(0).sqlName();
  }
}
