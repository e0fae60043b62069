package se.alipsa.tablefilter;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.tablefilter.engine.FilterExpressionParser;
import se.alipsa.tablefilter.helper.TableFilterUtil;

/**
 * Configuration: where file-based tables live and how deeply expressions may
 * nest.
 *
 * <p>
 * Defaults come from the classpath resource {@value #RESOURCE}; they are
 * overlaid by the query string of a location such as
 * {@code /data/tables?maxDepth=32}, and finally by caller supplied properties.
 * </p>
 */
public final class FilterSettings {

  private static final Logger log = LoggerFactory.getLogger(FilterSettings.class);

  /** Classpath resource holding the defaults. */
  public static final String RESOURCE = "tablefilter.properties";
  /** Base directory of file-based tables. */
  public static final String TABLES_PATH = "tablesPath";
  /** Maximum nesting depth of a filter expression. */
  public static final String MAX_DEPTH = "maxDepth";

  private static final String DEFAULT_TABLES_PATH = "./tables";

  private final Path tablesPath;
  private final int maxDepth;

  /**
   * Create settings.
   *
   * @param tablesPath
   *          the base directory of file-based tables
   * @param maxDepth
   *          the maximum expression nesting depth, at least 1
   */
  public FilterSettings(Path tablesPath, int maxDepth) {
    this.tablesPath = Objects.requireNonNull(tablesPath, "tablesPath");
    if (maxDepth < 1) {
      throw new IllegalArgumentException(MAX_DEPTH + " must be at least 1, was " + maxDepth);
    }
    this.maxDepth = maxDepth;
  }

  /**
   * The settings from {@value #RESOURCE} alone.
   *
   * @return the default settings
   */
  public static FilterSettings defaults() {
    return load(null);
  }

  /**
   * The defaults overlaid with caller properties.
   *
   * @param overrides
   *          properties that take precedence over the defaults, may be
   *          {@code null}
   * @return the settings
   * @throws IllegalArgumentException
   *           if {@value #MAX_DEPTH} is not a positive integer
   */
  public static FilterSettings load(Properties overrides) {
    Properties props = readDefaults();
    if (overrides != null) {
      props.putAll(overrides);
    }
    return fromProperties(props);
  }

  /**
   * Settings for a table location. The part before {@code ?} is the tables
   * path (a leading {@code file://} is stripped), the query string may set
   * any other key.
   *
   * @param location
   *          e.g. {@code /data/tables?maxDepth=32}
   * @param overrides
   *          properties that take precedence over the location, may be
   *          {@code null}
   * @return the settings
   */
  public static FilterSettings fromLocation(String location, Properties overrides) {
    Objects.requireNonNull(location, "location");
    String path = location;
    Properties props = readDefaults();
    int q = path.indexOf('?');
    if (q >= 0) {
      props.putAll(TableFilterUtil.parseUrlQuery(path.substring(q + 1)));
      path = path.substring(0, q);
    }
    if (path.startsWith("file://")) {
      path = path.substring("file://".length());
    }
    if (!path.isEmpty()) {
      props.setProperty(TABLES_PATH, path);
    }
    if (overrides != null) {
      props.putAll(overrides);
    }
    return fromProperties(props);
  }

  private static FilterSettings fromProperties(Properties props) {
    String path = props.getProperty(TABLES_PATH, DEFAULT_TABLES_PATH).trim();
    String depth = props.getProperty(MAX_DEPTH, String.valueOf(FilterExpressionParser.DEFAULT_MAX_DEPTH)).trim();
    int maxDepth;
    try {
      maxDepth = Integer.parseInt(depth);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(MAX_DEPTH + " must be an integer, was '" + depth + "'", e);
    }
    return new FilterSettings(Paths.get(path.isEmpty() ? DEFAULT_TABLES_PATH : path), maxDepth);
  }

  private static Properties readDefaults() {
    Properties props = new Properties();
    try (InputStream in = FilterSettings.class.getClassLoader().getResourceAsStream(RESOURCE)) {
      if (in == null) {
        log.debug("No {} on the classpath, using built-in defaults", RESOURCE);
        return props;
      }
      props.load(in);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read " + RESOURCE, e);
    }
    return props;
  }

  /**
   * The base directory of file-based tables.
   *
   * @return the tables path
   */
  public Path tablesPath() {
    return tablesPath;
  }

  /**
   * The maximum expression nesting depth.
   *
   * @return the max depth
   */
  public int maxDepth() {
    return maxDepth;
  }

  /**
   * A parser honouring {@link #maxDepth()}.
   *
   * @return the parser
   */
  public FilterExpressionParser parser() {
    return maxDepth == FilterExpressionParser.DEFAULT_MAX_DEPTH ? FilterExpressionParser.defaultParser()
        : new FilterExpressionParser(maxDepth);
  }

  @Override
  public String toString() {
    return "FilterSettings{" + TABLES_PATH + "=" + tablesPath + ", " + MAX_DEPTH + "=" + maxDepth + "}";
  }
}
