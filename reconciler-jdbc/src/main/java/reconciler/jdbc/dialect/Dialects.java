package reconciler.jdbc.dialect;

import reconciler.jdbc.spi.Dialect;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of claim dialects, loaded via {@link ServiceLoader} from
 * {@code META-INF/services/reconciler.jdbc.spi.Dialect}.
 *
 * <pre>{@code
 * Dialect dialect = Dialects.detect(dataSource);
 * Dialect dialect = Dialects.detect("jdbc:postgresql://localhost/reminders");
 * Dialect dialect = Dialects.get("h2");
 * }</pre>
 */
public final class Dialects {

  private static final List<Dialect> DIALECTS;
  private static final Map<String, Dialect> BY_NAME = new ConcurrentHashMap<>();

  static {
    DIALECTS = ServiceLoader.load(Dialect.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();

    for (Dialect dialect : DIALECTS) {
      BY_NAME.put(dialect.name().toLowerCase(Locale.ROOT), dialect);
    }
  }

  private Dialects() {
  }

  public static List<Dialect> all() {
    return DIALECTS;
  }

  /**
   * Gets a dialect by name (case-insensitive).
   *
   * @throws IllegalArgumentException if no dialect has that name
   */
  public static Dialect get(String name) {
    Dialect dialect = BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (dialect == null) {
      throw new IllegalArgumentException("Unknown dialect: " + name +
          ". Available: " + BY_NAME.keySet());
    }
    return dialect;
  }

  /**
   * Detects the dialect of a DataSource from its connection URL, falling back to the
   * database product name for wrapping drivers whose URL prefix is not recognized.
   *
   * @throws IllegalStateException if the DataSource cannot be inspected or nothing matches
   */
  public static Dialect detect(DataSource dataSource) {
    try (Connection conn = dataSource.getConnection()) {
      DatabaseMetaData metaData = conn.getMetaData();
      String url = metaData.getURL();
      Dialect byUrl = byUrl(url);
      if (byUrl != null) {
        return byUrl;
      }
      String product = metaData.getDatabaseProductName();
      Dialect byProduct = product == null ? null : BY_NAME.get(product.toLowerCase(Locale.ROOT));
      if (byProduct != null) {
        return byProduct;
      }
      throw new IllegalStateException("No dialect for " + product + " at " + url +
          ". Supported prefixes: " + allPrefixes());
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect dialect from DataSource", e);
    }
  }

  /**
   * Detects the dialect from a JDBC URL.
   *
   * @throws IllegalArgumentException if the URL is empty or no dialect matches
   */
  public static Dialect detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    Dialect dialect = byUrl(jdbcUrl);
    if (dialect == null) {
      throw new IllegalArgumentException("No dialect found for JDBC URL: " + jdbcUrl +
          ". Supported prefixes: " + allPrefixes());
    }
    return dialect;
  }

  private static Dialect byUrl(String jdbcUrl) {
    if (jdbcUrl == null) {
      return null;
    }
    for (Dialect dialect : DIALECTS) {
      for (String prefix : dialect.jdbcUrlPrefixes()) {
        if (jdbcUrl.startsWith(prefix)) {
          return dialect;
        }
      }
    }
    return null;
  }

  private static List<String> allPrefixes() {
    return DIALECTS.stream()
        .flatMap(d -> d.jdbcUrlPrefixes().stream())
        .toList();
  }
}
