package io.intellixity.pgrecord.jdbc;

import io.intellixity.pgrecord.errors.StatementException;
import io.intellixity.pgrecord.sql.Bind;

import java.util.ArrayList;
import java.util.List;

/**
 * Compiles SQL with PostgreSQL positional parameters ({@code $1}, {@code $2}) into JDBC SQL with '?' binds.
 *
 * Rules:
 * - A parameter is '$' followed by digits, not preceded by an identifier character.
 * - Text inside '...' (and E'...'), "...", $tag$...$tag$ bodies and comments is copied unchanged.
 * - '::' casts are kept.
 * - A literal '?' outside quoted text is written as '??' so the driver does not take it for a bind.
 *
 * Purely lexical scanning.
 */
public final class PlaceholderSqlCompiler {
  private PlaceholderSqlCompiler() {}

  /**
   * Result of compilation.
   *
   * @param parameterOrder placeholder numbers in order of appearance; JDBC parameter i is {@code $parameterOrder[i-1]}
   */
  public record CompiledSql(String sql, String jdbcSql, List<Integer> parameterOrder) {
    public CompiledSql {
      parameterOrder = List.copyOf(parameterOrder);
    }

    /** Highest placeholder number referenced, 0 when there is none. */
    public int parameterCount() {
      int max = 0;
      for (int n : parameterOrder) max = Math.max(max, n);
      return max;
    }

    /** Binds in JDBC parameter order; {@code binds.get(n - 1)} is used for every occurrence of {@code $n}. */
    public List<Bind> orderBinds(List<Bind> binds) {
      List<Bind> in = binds == null ? List.of() : binds;
      if (in.size() != parameterCount()) {
        throw new StatementException("Statement expects " + parameterCount() + " parameters but "
            + in.size() + " were supplied: " + sql, null);
      }
      List<Bind> out = new ArrayList<>(parameterOrder.size());
      for (int n : parameterOrder) out.add(in.get(n - 1));
      return out;
    }
  }

  public static CompiledSql compile(String sql) {
    if (sql == null) throw new IllegalArgumentException("sql is required");
    StringBuilder out = new StringBuilder(sql.length() + 16);
    List<Integer> order = new ArrayList<>();
    int len = sql.length();

    for (int i = 0; i < len; i++) {
      char ch = sql.charAt(i);

      if (ch == '\'') {
        boolean escapes = i > 0 && (sql.charAt(i - 1) == 'E' || sql.charAt(i - 1) == 'e')
            && (i < 2 || !isIdentPart(sql.charAt(i - 2)));
        int end = endOfQuoted(sql, i, '\'', escapes);
        out.append(sql, i, end);
        i = end - 1;
        continue;
      }

      if (ch == '"') {
        int end = endOfQuoted(sql, i, '"', false);
        out.append(sql, i, end);
        i = end - 1;
        continue;
      }

      if (ch == '-' && i + 1 < len && sql.charAt(i + 1) == '-') {
        int end = sql.indexOf('\n', i);
        end = (end < 0) ? len : end;
        out.append(sql, i, end);
        i = end - 1;
        continue;
      }

      if (ch == '/' && i + 1 < len && sql.charAt(i + 1) == '*') {
        int end = endOfBlockComment(sql, i);
        out.append(sql, i, end);
        i = end - 1;
        continue;
      }

      if (ch == '$') {
        boolean afterIdent = i > 0 && isIdentPart(sql.charAt(i - 1));
        if (!afterIdent && i + 1 < len && isDigit(sql.charAt(i + 1))) {
          int end = i + 1;
          while (end < len && isDigit(sql.charAt(end))) end++;
          int n;
          try {
            n = Integer.parseInt(sql.substring(i + 1, end));
          } catch (NumberFormatException e) {
            throw new StatementException("Placeholder out of range: " + sql.substring(i, end), null, e);
          }
          if (n < 1) throw new StatementException("Invalid placeholder $" + n + " in: " + sql, null);
          order.add(n);
          out.append('?');
          i = end - 1;
          continue;
        }
        if (!afterIdent) {
          int tagEnd = dollarTagEnd(sql, i);
          if (tagEnd > 0) {
            String tag = sql.substring(i, tagEnd);
            int close = sql.indexOf(tag, tagEnd);
            int end = (close < 0) ? len : close + tag.length();
            out.append(sql, i, end);
            i = end - 1;
            continue;
          }
        }
      }

      if (ch == '?') {
        out.append("??");
        continue;
      }

      out.append(ch);
    }

    return new CompiledSql(sql, out.toString(), order);
  }

  private static int endOfQuoted(String sql, int start, char quote, boolean backslashEscapes) {
    int i = start + 1;
    while (i < sql.length()) {
      char c = sql.charAt(i);
      if (backslashEscapes && c == '\\') {
        i += 2;
        continue;
      }
      if (c == quote) {
        // doubled quote is an escaped quote
        if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
          i += 2;
          continue;
        }
        return i + 1;
      }
      i++;
    }
    return sql.length();
  }

  private static int endOfBlockComment(String sql, int start) {
    int depth = 0;
    int i = start;
    while (i < sql.length()) {
      if (sql.startsWith("/*", i)) {
        depth++;
        i += 2;
      } else if (sql.startsWith("*/", i)) {
        depth--;
        i += 2;
        if (depth == 0) return i;
      } else {
        i++;
      }
    }
    return sql.length();
  }

  /** End index (exclusive) of a {@code $tag$} opener starting at {@code start}, or -1. */
  private static int dollarTagEnd(String sql, int start) {
    int i = start + 1;
    if (i < sql.length() && sql.charAt(i) == '$') return i + 1;
    if (i >= sql.length() || !isIdentStart(sql.charAt(i))) return -1;
    while (i < sql.length() && (isIdentStart(sql.charAt(i)) || isDigit(sql.charAt(i)))) i++;
    return (i < sql.length() && sql.charAt(i) == '$') ? i + 1 : -1;
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isIdentStart(char c) {
    return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
  }

  private static boolean isIdentPart(char c) {
    return isIdentStart(c) || isDigit(c) || c == '$';
  }
}
