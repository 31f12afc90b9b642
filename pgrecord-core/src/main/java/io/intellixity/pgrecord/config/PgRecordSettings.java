package io.intellixity.pgrecord.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.Properties;
import java.util.regex.Pattern;

/**
 * Connection settings.
 *
 * <p>{@link #load()} reads the classpath resource {@value #RESOURCE}, then applies JVM system properties
 * with the same keys on top.</p>
 */
public record PgRecordSettings(String url,
                               String user,
                               String password,
                               String applicationName,
                               int connectTimeoutSeconds) {
  public static final String RESOURCE = "pgrecord.properties";

  public static final String URL = "pgrecord.url";
  public static final String USER = "pgrecord.user";
  public static final String PASSWORD = "pgrecord.password";
  public static final String APPLICATION_NAME = "pgrecord.application-name";
  public static final String CONNECT_TIMEOUT_SECONDS = "pgrecord.connect-timeout-seconds";

  public static final String DEFAULT_APPLICATION_NAME = "pgrecord";
  public static final int DEFAULT_CONNECT_TIMEOUT_SECONDS = 10;

  private static final Pattern USERINFO_PASSWORD = Pattern.compile("(//[^/?#@:]*:)[^/?#@]*@");
  private static final Pattern PASSWORD_PARAM = Pattern.compile("(?i)([?&]password=)[^&#]*");

  public PgRecordSettings {
    if (url == null || url.isBlank()) throw new IllegalArgumentException(URL + " is required");
    if (connectTimeoutSeconds < 0) throw new IllegalArgumentException(CONNECT_TIMEOUT_SECONDS + " must be >= 0");
    applicationName = (applicationName == null || applicationName.isBlank()) ? DEFAULT_APPLICATION_NAME : applicationName;
  }

  public static PgRecordSettings of(String url, String user, String password) {
    return new PgRecordSettings(url, user, password, DEFAULT_APPLICATION_NAME, DEFAULT_CONNECT_TIMEOUT_SECONDS);
  }

  public static PgRecordSettings load() {
    return load(Thread.currentThread().getContextClassLoader(), System.getProperties());
  }

  public static PgRecordSettings load(ClassLoader cl, Properties overrides) {
    if (cl == null) cl = PgRecordSettings.class.getClassLoader();
    Properties p = new Properties();
    try (InputStream in = cl.getResourceAsStream(RESOURCE)) {
      if (in != null) p.load(in);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to load " + RESOURCE, e);
    }
    if (overrides != null) {
      for (String key : new String[] {URL, USER, PASSWORD, APPLICATION_NAME, CONNECT_TIMEOUT_SECONDS}) {
        String v = overrides.getProperty(key);
        if (v != null) p.setProperty(key, v);
      }
    }
    return fromProperties(p);
  }

  public static PgRecordSettings fromProperties(Properties p) {
    Objects.requireNonNull(p, "properties");
    String timeout = trimToNull(p.getProperty(CONNECT_TIMEOUT_SECONDS));
    int seconds;
    try {
      seconds = timeout == null ? DEFAULT_CONNECT_TIMEOUT_SECONDS : Integer.parseInt(timeout);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(CONNECT_TIMEOUT_SECONDS + " is not a number: " + timeout, e);
    }
    return new PgRecordSettings(
        trimToNull(p.getProperty(URL)),
        trimToNull(p.getProperty(USER)),
        p.getProperty(PASSWORD),
        trimToNull(p.getProperty(APPLICATION_NAME)),
        seconds);
  }

  private static String trimToNull(String s) {
    if (s == null) return null;
    String t = s.trim();
    return t.isEmpty() ? null : t;
  }

  /** {@link #url()} with any password (userinfo or {@code password=} parameter) masked, for logs and errors. */
  public String redactedUrl() {
    return redact(url);
  }

  public static String redact(String url) {
    if (url == null) return null;
    String masked = USERINFO_PASSWORD.matcher(url).replaceFirst("$1****@");
    return PASSWORD_PARAM.matcher(masked).replaceAll("$1****");
  }

  @Override
  public String toString() {
    return "PgRecordSettings{url=" + redactedUrl() + ", user=" + user + ", password=" + (password == null ? "null" : "****")
        + ", applicationName=" + applicationName + ", connectTimeoutSeconds=" + connectTimeoutSeconds + "}";
  }
}
