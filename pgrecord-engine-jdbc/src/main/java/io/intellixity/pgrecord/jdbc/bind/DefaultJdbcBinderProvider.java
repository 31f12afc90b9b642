package io.intellixity.pgrecord.jdbc.bind;

/**
 * Global JDBC provider discovered via META-INF/pgrecord.factories.
 *
 * Supplies base JDBC binders from {@link JdbcBinderProvider} for all dialects.
 */
public final class DefaultJdbcBinderProvider extends JdbcBinderProvider {
  @Override
  public String dialectId() {
    return DiscoveredBinderRegistry.GLOBAL_DIALECT;
  }
}
