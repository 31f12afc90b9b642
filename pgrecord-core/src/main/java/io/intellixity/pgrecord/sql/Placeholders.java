package io.intellixity.pgrecord.sql;

import io.intellixity.pgrecord.descriptor.ColumnRef;
import io.intellixity.pgrecord.descriptor.TypeDescriptor;

import java.util.List;

/**
 * Positional parameter lists ({@code $1,$2}, {@code ($1,$2),($3,$4)}, {@code $1::INT}).
 *
 * <p>Numbering is 1-based, contiguous and global across rows: row r, column c of a grouped list is
 * {@code $((r - 1) * itemLength + c)}.</p>
 */
public final class Placeholders {
  private Placeholders() {}

  /** {@code $1,...,$length}; empty for 0. */
  public static String singleArgList(int length) {
    if (length < 0) throw new IllegalArgumentException("length must be >= 0");
    return singleArgListFrom(1, length);
  }

  /** {@code $start,...,$end}; empty when {@code end < start}. */
  public static String singleArgListFrom(int start, int end) {
    if (start < 1) throw new IllegalArgumentException("start must be >= 1");
    StringBuilder sb = new StringBuilder(Math.max(0, end - start + 1) * 4);
    for (int i = start; i <= end; i++) {
      if (i > start) sb.append(',');
      sb.append('$').append(i);
    }
    return sb.toString();
  }

  public static String rowGroupedArgList(int itemLength, int rowCount) {
    requirePositive(itemLength, rowCount);
    StringBuilder sb = new StringBuilder(itemLength * rowCount * 4 + rowCount * 3);
    int n = 1;
    for (int r = 0; r < rowCount; r++) {
      if (r > 0) sb.append(',');
      sb.append('(');
      for (int c = 0; c < itemLength; c++) {
        if (c > 0) sb.append(',');
        sb.append('$').append(n++);
      }
      sb.append(')');
    }
    return sb.toString();
  }

  /**
   * Row-grouped list with every parameter cast to its column type, following
   * {@link TypeDescriptor#allColumns()}: {@code ($1::INT,$2::VARCHAR),($3::INT,$4::VARCHAR)}.
   */
  public static String typedRowGroupedArgList(TypeDescriptor<?> descriptor, int itemLength, int rowCount) {
    requirePositive(itemLength, rowCount);
    List<ColumnRef> cols = descriptor.allColumns();
    if (itemLength != cols.size()) {
      throw new IllegalArgumentException("itemLength " + itemLength + " does not match " + cols.size()
          + " columns of " + descriptor.recordType().getName());
    }
    StringBuilder sb = new StringBuilder(itemLength * rowCount * 12);
    int n = 1;
    for (int r = 0; r < rowCount; r++) {
      if (r > 0) sb.append(',');
      sb.append('(');
      for (int c = 0; c < itemLength; c++) {
        if (c > 0) sb.append(',');
        sb.append('$').append(n++).append("::").append(cols.get(c).wireType().sqlName());
      }
      sb.append(')');
    }
    return sb.toString();
  }

  private static void requirePositive(int itemLength, int rowCount) {
    if (itemLength < 1) throw new IllegalArgumentException("itemLength must be >= 1");
    if (rowCount < 1) throw new IllegalArgumentException("rowCount must be >= 1");
  }
}
