package io.intellixity.pgrecord.descriptor;

import io.intellixity.pgrecord.mapping.RowDecoder;
import io.intellixity.pgrecord.sql.Bind;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Immutable per-record-type metadata: table, primary key and the ordered persisted columns.
 *
 * <p>Instances come from {@link DescriptorSynthesizer} and are shared through {@link DescriptorRegistry}.</p>
 */
public final class TypeDescriptor<T> {
  private final Class<T> recordType;
  private final String tableName;
  private final ColumnRef primaryKey;
  private final List<ColumnRef> columns;
  private final List<ColumnRef> allColumns;
  private final RowDecoder<T> decoder;

  TypeDescriptor(Class<T> recordType, String tableName, ColumnRef primaryKey, List<ColumnRef> columns,
                 RowDecoder<T> decoder) {
    this.recordType = Objects.requireNonNull(recordType, "recordType");
    this.tableName = Objects.requireNonNull(tableName, "tableName");
    this.primaryKey = Objects.requireNonNull(primaryKey, "primaryKey");
    this.columns = List.copyOf(columns);
    List<ColumnRef> all = new ArrayList<>(columns.size() + 1);
    all.add(primaryKey);
    all.addAll(columns);
    this.allColumns = List.copyOf(all);
    this.decoder = Objects.requireNonNull(decoder, "decoder");
  }

  public Class<T> recordType() { return recordType; }

  /** Quoted table name, ready to splice into SQL. */
  public String tableName() { return tableName; }

  public ColumnRef primaryKey() { return primaryKey; }

  /** Persisted columns excluding the primary key, in declaration order. */
  public List<ColumnRef> columns() { return columns; }

  /** Primary key followed by {@link #columns()}. */
  public List<ColumnRef> allColumns() { return allColumns; }

  public int argumentCount() { return columns.size(); }

  public RowDecoder<T> decoder() { return decoder; }

  /** {@code "a","b"} over {@link #columns()}. */
  public String fieldList() {
    return join(columns);
  }

  /** {@code "id","a","b"} over {@link #allColumns()}. */
  public String allFieldList() {
    return join(allColumns);
  }

  public List<Bind> queryParams(T record) {
    return read(columns, record);
  }

  public List<Bind> allValues(T record) {
    return read(allColumns, record);
  }

  public Bind primaryKeyValue(T record) {
    Objects.requireNonNull(record, "record");
    return primaryKey.read(record);
  }

  private static List<Bind> read(List<ColumnRef> cols, Object record) {
    Objects.requireNonNull(record, "record");
    List<Bind> out = new ArrayList<>(cols.size());
    for (ColumnRef c : cols) out.add(c.read(record));
    return out;
  }

  private static String join(List<ColumnRef> cols) {
    return cols.stream().map(ColumnRef::quotedName).collect(Collectors.joining(","));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof TypeDescriptor<?> that)) return false;
    return recordType.equals(that.recordType)
        && tableName.equals(that.tableName)
        && primaryKey.equals(that.primaryKey)
        && columns.equals(that.columns);
  }

  @Override
  public int hashCode() {
    return Objects.hash(recordType, tableName, primaryKey, columns);
  }

  @Override
  public String toString() {
    return "TypeDescriptor{" + recordType.getSimpleName() + " -> " + tableName
        + ", pk=" + primaryKey.sqlName() + ", columns=" + fieldList() + "}";
  }
}
