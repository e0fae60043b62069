package se.alipsa.tablefilter.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link RecordReader} backed by an in-memory list of records, e.g. the
 * contents of a {@code data.json} file.
 */
public final class InMemoryRecordReader implements RecordReader {

  private final List<Map<String, Object>> records;
  private int index;

  /**
   * Create a new reader that iterates over the provided records.
   *
   * @param records
   *          the records to expose through the reader; null elements are not
   *          allowed
   */
  public InMemoryRecordReader(List<? extends Map<String, Object>> records) {
    this.records = new ArrayList<>(Objects.requireNonNull(records, "records"));
    this.index = 0;
  }

  @Override
  public Map<String, Object> read() {
    if (index >= records.size()) {
      return null;
    }
    Map<String, Object> record = records.get(index);
    index++;
    return record;
  }

  @Override
  public void close() {
    // No resources to release for in-memory data.
  }
}
