package se.alipsa.tablefilter.engine;

import java.util.Map;

/** A compiled filter that decides whether a single record matches. */
@FunctionalInterface
public interface RecordMatcher {

  /** Matches every record. */
  RecordMatcher ALL = record -> true;

  /** Matches no record. */
  RecordMatcher NONE = record -> false;

  /**
   * Test a record.
   *
   * @param record
   *          field name to value mapping
   * @return true if the record matches
   */
  boolean matches(Map<String, ?> record);
}
