package se.alipsa.tablefilter.engine;

import java.util.Locale;
import java.util.Optional;

/** The comparison operators a leaf condition can use. */
public enum Operator {
  EQ("="),
  NOT_EQ("<>"),
  GT(">"),
  GT_EQ(">="),
  LT("<"),
  LT_EQ("<="),
  CONTAINS("contains"),
  NOT_CONTAINS("notcontains"),
  STARTS_WITH("startswith"),
  ENDS_WITH("endswith"),
  /** Inclusive range; the operand is a two element sequence {@code [lower, upper]}. */
  BETWEEN("between");

  private final String token;

  Operator(String token) {
    this.token = token;
  }

  /**
   * The token used for this operator in filter expressions.
   *
   * @return the token
   */
  public String token() {
    return token;
  }

  /**
   * Look up an operator by its token, ignoring case.
   *
   * @param token
   *          the token (may be {@code null})
   * @return the operator, or empty if the token is unknown
   */
  public static Optional<Operator> fromToken(String token) {
    if (token == null) {
      return Optional.empty();
    }
    String lower = token.trim().toLowerCase(Locale.ROOT);
    for (Operator op : values()) {
      if (op.token.equals(lower)) {
        return Optional.of(op);
      }
    }
    return Optional.empty();
  }

  @Override
  public String toString() {
    return token;
  }
}
