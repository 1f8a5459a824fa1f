package mathedit.impl;

/**
 * Character classes of literal text. Literals store display glyphs, so both the ASCII operator and its
 * display form are recognized everywhere.
 */
public class Chars {
  public static final char PLUS = '+';
  public static final char MINUS = '−';
  public static final char TIMES = '×';
  public static final char DOT = '·';
  public static final char SCIENTIFIC_E = 'ᴇ';

  public interface Boundary {
    boolean test(String text, int index);
  }

  public static final Boundary NON_MULTIPLY = (text, index) -> isNonMultiplyWordBoundary(text.charAt(index));

  // a minus right after a scientific E belongs to the number
  public static final Boundary FRACTION = (text, index) -> {
    char c = text.charAt(index);
    if (c == '+' || c == '/' || c == '=' || c == ' ') {
      return true;
    }
    if (c == '-' || c == MINUS) {
      if (index > 0) {
        char prev = text.charAt(index - 1);
        return prev != SCIENTIFIC_E && prev != 'E' && prev != 'e';
      }
      return true;
    }
    return false;
  };

  public static boolean isWordBoundary(char c) {
    return isNonMultiplyWordBoundary(c) || isMultiply(c);
  }

  public static boolean isNonMultiplyWordBoundary(char c) {
    return c == '+' || c == '-' || c == '/' || c == '=' || c == ' ' || c == MINUS;
  }

  public static boolean isMultiply(char c) {
    return c == '*' || c == TIMES || c == DOT;
  }

  public static boolean isMultiply(String s) {
    return s.length() == 1 && isMultiply(s.charAt(0));
  }

  public static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  public static boolean isLetter(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
  }

  public static boolean isDigitOrLetter(char c) {
    return isDigit(c) || isLetter(c);
  }

  public static boolean isSerializedDigit(char c) {
    return isDigit(c) || c == '.';
  }

  public static boolean isOperatorInput(String s) {
    if (s.length() != 1) return false;
    char c = s.charAt(0);
    return c == '+' || c == '-' || c == '*' || c == '=' || c == MINUS || c == TIMES || c == DOT;
  }

  public static String toDisplay(String s, String multiplySign) {
    switch (s) {
      case "-":
        return String.valueOf(MINUS);
      case "*":
        return multiplySign;
      default:
        return s;
    }
  }

  /**
   * Start of the operand that ends at {@code end}: scans back until the boundary test hits.
   */
  public static int operandStart(String text, int end, Boundary boundary) {
    int start = end;
    while (start > 0 && !boundary.test(text, start - 1)) {
      start--;
    }
    return start;
  }

  public static boolean endsWithMultiply(String text) {
    return !text.isEmpty() && isMultiply(text.charAt(text.length() - 1));
  }

  public static boolean endsWithDigitOrLetter(String text) {
    return !text.isEmpty() && isDigitOrLetter(text.charAt(text.length() - 1));
  }
}
