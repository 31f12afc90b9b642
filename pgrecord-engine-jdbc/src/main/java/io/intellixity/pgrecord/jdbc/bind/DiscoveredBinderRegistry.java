package io.intellixity.pgrecord.jdbc.bind;

import io.intellixity.pgrecord.sql.Bind;
import io.intellixity.pgrecord.util.PgRecordFactoriesLoader;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.*;

/**
 * Binder registry built via discovery (META-INF/pgrecord.factories).
 *
 * Resolution semantics:
 * - Dialect-specific providers first, then global providers (dialectId="*").
 * - Within a provider, binder order is preserved.
 * - First binder whose valueType accepts the value and that supports(ctx,bind,value) wins.
 */
public final class DiscoveredBinderRegistry {
  public static final String GLOBAL_DIALECT = "*";

  private final String dialectId;
  private final List<Binder<?>> dialectOrdered;
  private final List<Binder<?>> globalOrdered;

  public DiscoveredBinderRegistry(String dialectId) {
    this(dialectId, PgRecordFactoriesLoader.load(BinderProvider.class));
  }

  public DiscoveredBinderRegistry(String dialectId, List<BinderProvider> providers) {
    this.dialectId = (dialectId == null || dialectId.isBlank()) ? "" : dialectId;
    List<Binder<?>> dialect = new ArrayList<>();
    List<Binder<?>> global = new ArrayList<>();

    for (BinderProvider p : providers) {
      if (p == null) continue;
      String did = normalizeDialect(p.dialectId());
      Collection<Binder<?>> bs = p.binders();
      if (bs == null) continue;
      if (GLOBAL_DIALECT.equals(did)) global.addAll(bs);
      else if (Objects.equals(this.dialectId, did)) dialect.addAll(bs);
    }

    this.dialectOrdered = List.copyOf(dialect);
    this.globalOrdered = List.copyOf(global);
  }

  public String dialectId() { return dialectId; }

  public void bind(PreparedStatement ps, JdbcBindContext ctx, Bind bind) throws SQLException {
    if (ps == null) throw new IllegalArgumentException("ps is required");
    if (ctx == null) throw new IllegalArgumentException("ctx is required");
    if (bind == null) throw new IllegalArgumentException("bind is required");
    if (tryBind(dialectOrdered, ps, ctx, bind)) return;
    if (tryBind(globalOrdered, ps, ctx, bind)) return;
    throw new IllegalArgumentException("No binder found for dialectId=" + dialectId +
        ", value=" + (bind.value() == null ? "null" : bind.value().getClass().getName()) +
        ", wireType=" + bind.wireType());
  }

  private static boolean tryBind(List<Binder<?>> ordered, PreparedStatement ps, JdbcBindContext ctx, Bind bind)
      throws SQLException {
    Object value = bind.value();
    for (Binder<?> b : ordered) {
      if (b == null) continue;
      if (value != null && !b.valueType().isInstance(value)) continue;
      @SuppressWarnings("unchecked")
      Binder<Object> bb = (Binder<Object>) b;
      if (bb.supports(ctx, bind, value)) {
        bb.bind(ps, ctx, bind, value);
        return true;
      }
    }
    return false;
  }

  private static String normalizeDialect(String did) {
    if (did == null) return GLOBAL_DIALECT;
    String s = did.trim();
    return s.isEmpty() ? GLOBAL_DIALECT : s;
  }
}
