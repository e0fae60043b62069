package se.alipsa.tablefilter.value;

/** Raised when a value cannot be converted to the comparison domain of a field type. */
public class CoercionException extends Exception {

  private static final long serialVersionUID = 1L;

  /**
   * Create a new exception.
   *
   * @param message
   *          description of the failed conversion
   */
  public CoercionException(String message) {
    super(message);
  }

  /**
   * Create a new exception with the failure that caused it.
   *
   * @param message
   *          description of the failed conversion
   * @param cause
   *          the underlying parse failure
   */
  public CoercionException(String message, Throwable cause) {
    super(message, cause);
  }
}
