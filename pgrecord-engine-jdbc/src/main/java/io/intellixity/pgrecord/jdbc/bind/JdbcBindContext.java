package io.intellixity.pgrecord.jdbc.bind;

/** Where a value is bound: the 1-based JDBC parameter index. */
public record JdbcBindContext(int position1Based) {
  public JdbcBindContext {
    if (position1Based <= 0) throw new IllegalArgumentException("position1Based must be >= 1");
  }
}
