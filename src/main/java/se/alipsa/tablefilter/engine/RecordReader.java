package se.alipsa.tablefilter.engine;

import java.io.Closeable;
import java.io.IOException;
import java.util.Map;

/**
 * Minimal abstraction for sequential access to records, each a field name to
 * value map.
 */
public interface RecordReader extends Closeable {

  /**
   * Read the next available record.
   *
   * @return the next record, or {@code null} when exhausted
   * @throws IOException
   *           if reading fails
   */
  Map<String, Object> read() throws IOException;

  @Override
  void close() throws IOException;
}
