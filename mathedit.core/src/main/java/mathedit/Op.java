package mathedit;

public enum Op {
  INSERT_CHARACTER,
  INSERT_CONSTANT,
  INSERT_UNIT_VECTOR,
  WRAP_FRACTION,
  WRAP_EXPONENT,
  WRAP_SQUARE_ROOT,
  WRAP_NTH_ROOT,
  WRAP_LOG10,
  WRAP_LOG_N,
  WRAP_NATURAL_LOG,
  WRAP_TRIG,
  WRAP_PERMUTATION,
  WRAP_COMBINATION,
  WRAP_PARENTHESIS,
  INSERT_SQUARE,
  INSERT_SUMMATION,
  INSERT_PRODUCT,
  INSERT_DERIVATIVE,
  INSERT_INTEGRAL,
  INSERT_ANS,
  INSERT_NEWLINE,
  DELETE_CHAR,
  DELETE_SELECTION,
  CUT,
  PASTE,
  CLEAR,
  SET_EXPRESSION,
  UNDO,
  REDO
}
