package se.alipsa.tablefilter;

import java.util.Objects;

/**
 * Raised when a filter expression cannot be parsed, validated against a table
 * schema or translated into a predicate.
 *
 * <p>
 * Every failure is terminal for the call that raised it: nested failures
 * propagate unchanged to the caller, there are no partial results.
 * </p>
 */
public class FilterException extends Exception {

  private static final long serialVersionUID = 1L;

  /** The kinds of failure a filter expression can produce. */
  public enum Kind {
    /** The expression, or a nested sub expression, is not a sequence. */
    INVALID_EXPRESSION_SHAPE,
    /** A negation has the wrong arity or a non-sequence operand. */
    MALFORMED_NOT,
    /** A chain has a dangling operator or mismatched condition/operator counts. */
    MALFORMED_GROUP,
    /** A chain separator is not {@code and}/{@code or}. */
    INVALID_LOGICAL_OPERATOR,
    /** The operator slot of a leaf condition is not a string. */
    INVALID_OPERATOR,
    /** A leaf condition references a field that is not in the schema. */
    UNKNOWN_FIELD,
    /** The operator is not defined for the declared type of the field. */
    UNSUPPORTED_OPERATOR,
    /** The operand cannot be coerced to the comparison domain of the field. */
    INVALID_OPERAND_TYPE,
    /** The expression nests deeper than the configured maximum. */
    EXPRESSION_TOO_DEEP
  }

  private final Kind kind;

  /**
   * Create a new exception.
   *
   * @param kind
   *          the failure kind
   * @param message
   *          a human readable description, suitable to show to an end user
   */
  public FilterException(Kind kind, String message) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  /**
   * Create a new exception caused by another failure.
   *
   * @param kind
   *          the failure kind
   * @param message
   *          a human readable description
   * @param cause
   *          the underlying failure
   */
  public FilterException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  /**
   * The failure kind.
   *
   * @return the kind of this failure
   */
  public Kind getKind() {
    return kind;
  }
}
