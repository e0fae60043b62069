package se.alipsa.tablefilter.adapter;

import java.io.Serializable;
import java.util.Objects;
import org.apache.parquet.filter2.predicate.Statistics;
import org.apache.parquet.filter2.predicate.UserDefinedPredicate;
import org.apache.parquet.io.api.Binary;
import se.alipsa.tablefilter.engine.Comparisons;
import se.alipsa.tablefilter.engine.Operator;

/**
 * Case-insensitive text operator evaluated per value by Parquet. Row groups
 * are never dropped on statistics since min/max are not case folded.
 */
final class FoldedTextPredicate extends UserDefinedPredicate<Binary> implements Serializable {

  private static final long serialVersionUID = 1L;

  private final Operator operator;
  private final String foldedOperand;

  FoldedTextPredicate(Operator operator, String operand) {
    this.operator = Objects.requireNonNull(operator, "operator");
    this.foldedOperand = Comparisons.fold(operand);
  }

  @Override
  public boolean keep(Binary value) {
    if (value == null) {
      return false;
    }
    return Comparisons.textMatches(operator, Comparisons.fold(value.toStringUsingUTF8()), foldedOperand);
  }

  @Override
  public boolean canDrop(Statistics<Binary> statistics) {
    return false;
  }

  @Override
  public boolean inverseCanDrop(Statistics<Binary> statistics) {
    return false;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FoldedTextPredicate other)) {
      return false;
    }
    return operator == other.operator && foldedOperand.equals(other.foldedOperand);
  }

  @Override
  public int hashCode() {
    return Objects.hash(operator, foldedOperand);
  }

  @Override
  public String toString() {
    return "folded " + operator.token() + " '" + foldedOperand + "'";
  }
}
