package mathedit;

/**
 * Numeric or symbolic engine that turns the serialized expression into a result string.
 */
public interface Evaluator {
  Evaluator NONE = expression -> "";

  String recompute(String serializedExpression);
}
