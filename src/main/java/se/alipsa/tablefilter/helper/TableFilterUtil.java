package se.alipsa.tablefilter.helper;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

/** Utility methods. */
public final class TableFilterUtil {

  private TableFilterUtil() {
  }

  /**
   * Parses a URL query string into a Properties object.
   *
   * @param qs
   *          the query string, with or without the leading {@code ?}
   * @return a Properties object containing the key-value pairs
   */
  public static Properties parseUrlQuery(String qs) {
    Properties p = new Properties();
    if (qs == null || qs.isEmpty()) {
      return p;
    }
    String s = qs.charAt(0) == '?' ? qs.substring(1) : qs;
    for (String kv : s.split("&")) {
      if (kv.isEmpty()) {
        continue;
      }
      String[] arr = kv.split("=", 2);
      String k = URLDecoder.decode(arr[0], StandardCharsets.UTF_8);
      String v = arr.length == 2 ? URLDecoder.decode(arr[1], StandardCharsets.UTF_8) : "";
      if (!k.isEmpty()) {
        p.setProperty(k, v);
      }
    }
    return p;
  }

  /**
   * Whether a table name is a single, plain path segment.
   *
   * @param name
   *          the table name
   * @return false for blank names, names containing a path separator and the
   *         {@code .}/{@code ..} segments
   */
  public static boolean isPlainName(String name) {
    if (name == null || name.isBlank()) {
      return false;
    }
    if (".".equals(name) || "..".equals(name)) {
      return false;
    }
    return name.indexOf('/') < 0 && name.indexOf('\\') < 0;
  }
}
