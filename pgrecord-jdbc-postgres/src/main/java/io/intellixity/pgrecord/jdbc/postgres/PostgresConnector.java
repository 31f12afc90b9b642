package io.intellixity.pgrecord.jdbc.postgres;

import io.intellixity.pgrecord.client.SqlClient;
import io.intellixity.pgrecord.client.SqlConnector;
import io.intellixity.pgrecord.config.PgRecordSettings;
import io.intellixity.pgrecord.errors.ConnectionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;

/**
 * Opens a {@link PostgresSqlClient} through the PostgreSQL JDBC driver.
 *
 * <p>Accepts {@code jdbc:postgresql://...} URLs as well as libpq-style {@code postgresql://} and
 * {@code postgres://} URLs. Userinfo in a libpq URL becomes the {@code user}/{@code password} connection
 * properties unless the settings carry their own. URLs are redacted before they reach logs or errors.</p>
 */
public final class PostgresConnector implements SqlConnector {
  private static final Logger log = LoggerFactory.getLogger(PostgresConnector.class);

  /** A driver URL plus the credentials lifted out of it. */
  record Target(String jdbcUrl, String user, String password) {}

  @Override
  public SqlClient connect(PgRecordSettings settings) {
    Target target = target(settings.url());
    Properties props = connectionProperties(settings, target);
    String shown = PgRecordSettings.redact(target.jdbcUrl());
    try {
      Connection c = DriverManager.getConnection(target.jdbcUrl(), props);
      log.info("pgrecord.pg connected url={} user={} applicationName={}",
          shown, props.getProperty("user"), settings.applicationName());
      return new PostgresSqlClient(c);
    } catch (SQLException e) {
      throw new ConnectionException("Cannot connect to " + shown + ": " + e.getMessage(), e);
    }
  }

  static Target target(String url) {
    if (url.startsWith("jdbc:")) return new Target(url, null, null);
    String rest;
    if (url.startsWith("postgresql://")) rest = url.substring("postgresql://".length());
    else if (url.startsWith("postgres://")) rest = url.substring("postgres://".length());
    else throw new ConnectionException("Unsupported connection URL: " + PgRecordSettings.redact(url));

    int end = rest.length();
    for (char ch : new char[] {'/', '?', '#'}) {
      int i = rest.indexOf(ch);
      if (i >= 0 && i < end) end = i;
    }
    String authority = rest.substring(0, end);
    String tail = rest.substring(end);

    String user = null;
    String password = null;
    int at = authority.lastIndexOf('@');
    if (at >= 0) {
      String info = authority.substring(0, at);
      authority = authority.substring(at + 1);
      int colon = info.indexOf(':');
      user = decode(colon < 0 ? info : info.substring(0, colon));
      password = colon < 0 ? null : decode(info.substring(colon + 1));
      if (user.isEmpty()) user = null;
    }
    if (authority.isEmpty()) authority = "localhost";
    // pgjdbc needs a path segment even when the database name is left to the server default
    if (!tail.startsWith("/")) tail = "/" + tail;
    return new Target("jdbc:postgresql://" + authority + tail, user, password);
  }

  static Properties connectionProperties(PgRecordSettings settings, Target target) {
    Properties props = new Properties();
    String user = settings.user() != null ? settings.user() : target.user();
    String password = settings.password() != null ? settings.password() : target.password();
    if (user != null) props.setProperty("user", user);
    if (password != null) props.setProperty("password", password);
    props.setProperty("ApplicationName", settings.applicationName());
    props.setProperty("connectTimeout", String.valueOf(settings.connectTimeoutSeconds()));
    return props;
  }

  private static String decode(String s) {
    return URLDecoder.decode(s.replace("+", "%2B"), StandardCharsets.UTF_8);
  }
}
