package mathedit.serializer;

import mathedit.nodes.Node;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static mathedit.nodes.Slots.*;

/**
 * Renders the tree as the flat infix text the evaluator reads, with implicit multiplication made explicit.
 */
public class ExpressionSerializer {
  private static final Pattern NAME = Pattern.compile("[a-zA-Z]+");

  private static final List<String> FUNCTIONS = Arrays.asList(
    "sin", "cos", "tan", "asin", "acos", "atan", "sinh", "cosh", "tanh", "asinh", "acosh", "atanh",
    "log", "ln", "sqrt", "abs", "diff", "int", "perm", "comb", "sum", "prod");

  private static final Set<String> NOT_VARIABLES = new HashSet<>(Arrays.asList(
    "sin", "cos", "tan", "log", "ln", "sqrt", "abs", "sum", "prod", "P", "C", "i"));

  public static String serialize(List<Node> nodes) {
    String raw = serializeList(nodes);
    String result = insertImplicitMultiplication(raw);
    if (result.startsWith("+")) {
      result = result.substring(1);
    }
    return result;
  }

  static String serializeList(List<Node> nodes) {
    StringBuilder sb = new StringBuilder();
    for (Node node : nodes) {
      sb.append(serializeNode(node));
    }
    return sb.toString();
  }

  private static String serializeNode(Node node) {
    switch (node.kind) {
      case LITERAL:
        return node.getText()
          .replace('·', '*')
          .replace('×', '*')
          .replace('−', '-')
          .replace('ᴇ', 'E');
      case NEWLINE:
        return "\n";
      case FRACTION:
        return "((" + slot(node, NUMERATOR) + ")/(" + slot(node, DENOMINATOR) + "))";
      case EXPONENT: {
        String base = slot(node, BASE);
        if (base.contains("+") || base.contains("-") || base.contains("*") || base.contains("/")) {
          base = "(" + base + ")";
        }
        return base + "^(" + slot(node, POWER) + ")";
      }
      case PARENTHESIS:
        return "(" + slot(node, CONTENT) + ")";
      case TRIG:
        return node.symbol + "(" + slot(node, ARGUMENT) + ")";
      case LOG:
        if (node.naturalLog) {
          return "ln(" + slot(node, ARGUMENT) + ")";
        }
        return "(ln(" + slot(node, ARGUMENT) + ")/ln(" + slot(node, BASE) + "))";
      case ROOT:
        if (node.squareRoot) {
          return "sqrt(" + slot(node, RADICAND) + ")";
        }
        return "((" + slot(node, RADICAND) + ")^(1/(" + slot(node, INDEX) + ")))";
      case PERMUTATION:
        return "perm(" + slot(node, N) + "," + slot(node, R) + ")";
      case COMBINATION:
        return "comb(" + slot(node, N) + "," + slot(node, R) + ")";
      case SUMMATION:
        return "sum(" + slot(node, VARIABLE) + "," + slot(node, LOWER) + "," + slot(node, UPPER) + "," + slot(node, BODY) + ")";
      case PRODUCT:
        return "prod(" + slot(node, VARIABLE) + "," + slot(node, LOWER) + "," + slot(node, UPPER) + "," + slot(node, BODY) + ")";
      case INTEGRAL:
        return "int(" + slot(node, VARIABLE) + "," + slot(node, LOWER) + "," + slot(node, UPPER) + "," + slot(node, BODY) + ")";
      case DERIVATIVE:
        return "diff(" + slot(node, VARIABLE) + "," + slot(node, AT) + "," + slot(node, BODY) + ")";
      case ANS:
        return "ans" + slot(node, INDEX);
      case CONSTANT:
        return node.symbol;
      case UNIT_VECTOR:
        return "e_" + node.symbol;
      case COMPLEX:
        return "(" + slot(node, CONTENT) + ")*i";
      default:
        throw new AssertionError(node.kind);
    }
  }

  private static String slot(Node node, String name) {
    return serializeList(node.slot(name));
  }

  static String insertImplicitMultiplication(String s) {
    StringBuilder sb = new StringBuilder(s.length() + 8);
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      sb.append(c);
      if (i + 1 >= s.length()) break;
      char next = s.charAt(i + 1);
      if (isDigit(c) && isLetter(next)) {
        if (!isScientificNotation(s, i) && !isCombinatoricOperator(s, i)) {
          sb.append('*');
        }
      }
      else if (isDigit(c) && next == '(') {
        sb.append('*');
      }
      else if (c == ')' && (isDigit(next) || isLetter(next) || next == '(')) {
        sb.append('*');
      }
      else if (isLetter(c) && next == '(' && !endsWithFunctionName(s, i)) {
        sb.append('*');
      }
    }
    return sb.toString();
  }

  // 1E5, 2e-3
  private static boolean isScientificNotation(String s, int digit) {
    char e = s.charAt(digit + 1);
    if (e != 'E' && e != 'e') return false;
    if (digit + 2 >= s.length()) return false;
    char after = s.charAt(digit + 2);
    return isDigit(after) || after == '+' || after == '-';
  }

  // 5P2, 5C(3)
  private static boolean isCombinatoricOperator(String s, int digit) {
    char op = s.charAt(digit + 1);
    if (op != 'P' && op != 'C') return false;
    if (digit + 2 >= s.length()) return false;
    char after = s.charAt(digit + 2);
    return isDigit(after) || after == '(';
  }

  private static boolean endsWithFunctionName(String s, int end) {
    String head = s.substring(0, end + 1);
    for (String function : FUNCTIONS) {
      if (head.endsWith(function)) {
        return true;
      }
    }
    return false;
  }

  private static boolean isDigit(char c) {
    return (c >= '0' && c <= '9') || c == '.';
  }

  private static boolean isLetter(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
  }

  /**
   * Free variable names in document order. Function names, the combinatoric operators and the imaginary
   * unit are not variables; summation, product, integral and derivative bind their own variable.
   */
  public static Set<String> extractVariables(List<Node> nodes) {
    Set<String> variables = new LinkedHashSet<>();
    collectVariables(nodes, variables);
    return variables;
  }

  private static void collectVariables(List<Node> nodes, Set<String> variables) {
    for (Node node : nodes) {
      switch (node.kind) {
        case LITERAL: {
          Matcher matcher = NAME.matcher(node.getText());
          while (matcher.find()) {
            String name = matcher.group();
            if (!NOT_VARIABLES.contains(name)) {
              variables.add(name);
            }
          }
          break;
        }
        case ANS:
        case CONSTANT:
        case UNIT_VECTOR:
        case NEWLINE:
          break;
        case SUMMATION:
        case PRODUCT:
        case INTEGRAL:
        case DERIVATIVE: {
          Set<String> inner = new LinkedHashSet<>();
          for (String slot : node.slotNames()) {
            if (!VARIABLE.equals(slot)) {
              collectVariables(node.slot(slot), inner);
            }
          }
          String bound = serializeList(node.slot(VARIABLE)).trim();
          inner.remove(bound);
          variables.addAll(inner);
          break;
        }
        default:
          for (String slot : node.slotNames()) {
            collectVariables(node.slot(slot), variables);
          }
      }
    }
  }

  public static boolean isEquation(List<Node> nodes) {
    return serialize(nodes).contains("=");
  }

  /**
   * The two sides of {@code lhs = rhs}, trimmed; null unless there is exactly one equals sign.
   */
  @Nullable
  public static String[] splitEquation(List<Node> nodes) {
    String serialized = serialize(nodes);
    String[] parts = serialized.split("=", -1);
    if (parts.length != 2) {
      return null;
    }
    return new String[]{parts[0].trim(), parts[1].trim()};
  }
}
