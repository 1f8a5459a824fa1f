package mathedit.nodes;

import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static mathedit.nodes.Slots.*;

/**
 * Tag of a {@link Node}. Every per-kind rule of the editor (slot layout, traversal order, which slot holds
 * the wrapped operand, which slot backspace enters) is answered here so callers dispatch on the tag once.
 */
public enum NodeKind {
  LITERAL(null),
  FRACTION(NUMERATOR, NUMERATOR, DENOMINATOR),
  EXPONENT(BASE, BASE, POWER),
  ROOT(RADICAND, INDEX, RADICAND),
  LOG(ARGUMENT, BASE, ARGUMENT),
  TRIG(ARGUMENT, ARGUMENT),
  PARENTHESIS(CONTENT, CONTENT),
  PERMUTATION(N, N, R),
  COMBINATION(N, N, R),
  SUMMATION(BODY, VARIABLE, LOWER, UPPER, BODY),
  PRODUCT(BODY, VARIABLE, LOWER, UPPER, BODY),
  DERIVATIVE(BODY, VARIABLE, AT, BODY),
  INTEGRAL(BODY, VARIABLE, LOWER, UPPER, BODY),
  ANS(INDEX, INDEX),
  CONSTANT(null),
  UNIT_VECTOR(null),
  COMPLEX(CONTENT, CONTENT),
  NEWLINE(null);

  private final String primarySlot;
  private final List<String> slots;

  NodeKind(@Nullable String primarySlot, String... slots) {
    this.primarySlot = primarySlot;
    this.slots = Collections.unmodifiableList(Arrays.asList(slots));
  }

  public List<String> slots() {
    return slots;
  }

  public boolean isContainer() {
    return !slots.isEmpty();
  }

  /**
   * Slot that receives existing content when something is wrapped into a node of this kind.
   */
  @Nullable
  public String primarySlot() {
    return primarySlot;
  }

  public boolean isBigOperator() {
    return this == SUMMATION || this == PRODUCT || this == DERIVATIVE || this == INTEGRAL;
  }

  /**
   * Slot the cursor lands in when moving right into the node from outside.
   */
  @Nullable
  public String entrySlotFromLeft(Node node) {
    switch (this) {
      case FRACTION:
        return NUMERATOR;
      case EXPONENT:
        return BASE;
      case ROOT:
        return node.squareRoot ? RADICAND : INDEX;
      case LOG:
        return node.naturalLog ? ARGUMENT : BASE;
      case PERMUTATION:
      case COMBINATION:
        return N;
      case SUMMATION:
      case PRODUCT:
      case DERIVATIVE:
      case INTEGRAL:
        return BODY;
      case TRIG:
      case PARENTHESIS:
      case ANS:
      case COMPLEX:
        return primarySlot;
      default:
        return null;
    }
  }

  /**
   * Slot the cursor lands in when moving left into the node, or when backspace steps into it.
   */
  @Nullable
  public String entrySlotFromRight(Node node) {
    switch (this) {
      case FRACTION:
        return DENOMINATOR;
      case EXPONENT:
        return POWER;
      case ROOT:
        return RADICAND;
      case LOG:
        return ARGUMENT;
      case PERMUTATION:
      case COMBINATION:
        return R;
      case SUMMATION:
      case PRODUCT:
      case DERIVATIVE:
      case INTEGRAL:
        return BODY;
      case TRIG:
      case PARENTHESIS:
      case ANS:
      case COMPLEX:
        return primarySlot;
      default:
        return null;
    }
  }

  /**
   * Slot reached by moving right off the end of {@code slot}, or null when that leaves the node.
   */
  @Nullable
  public String nextSlot(Node node, String slot) {
    switch (this) {
      case FRACTION:
        return NUMERATOR.equals(slot) ? DENOMINATOR : null;
      case EXPONENT:
        return BASE.equals(slot) ? POWER : null;
      case ROOT:
        return INDEX.equals(slot) ? RADICAND : null;
      case LOG:
        return BASE.equals(slot) ? ARGUMENT : null;
      case PERMUTATION:
      case COMBINATION:
        return N.equals(slot) ? R : null;
      case SUMMATION:
      case PRODUCT:
      case INTEGRAL:
      case DERIVATIVE:
        return BODY.equals(slot) ? null : BODY;
      default:
        return null;
    }
  }

  /**
   * Slot reached by moving left off the start of {@code slot}, or null when that leaves the node.
   */
  @Nullable
  public String previousSlot(Node node, String slot) {
    switch (this) {
      case FRACTION:
        return DENOMINATOR.equals(slot) ? NUMERATOR : null;
      case EXPONENT:
        return POWER.equals(slot) ? BASE : null;
      case ROOT:
        return RADICAND.equals(slot) && !node.squareRoot ? INDEX : null;
      case LOG:
        return ARGUMENT.equals(slot) && !node.naturalLog ? BASE : null;
      case PERMUTATION:
      case COMBINATION:
        return R.equals(slot) ? N : null;
      case SUMMATION:
      case PRODUCT:
      case INTEGRAL:
        return BODY.equals(slot) ? LOWER : null;
      case DERIVATIVE:
        return BODY.equals(slot) ? AT : null;
      default:
        return null;
    }
  }

  /**
   * Typing an operator inside this slot is legal, so exiting stops here. Big operators take them in the
   * body only.
   */
  public boolean acceptsOperators(String slot) {
    if (isBigOperator()) {
      return BODY.equals(slot);
    }
    return this == FRACTION || this == PARENTHESIS;
  }

  /**
   * Fields hold numbers only; typing an operator walks out of the node.
   */
  public boolean isNumericOnly(String slot) {
    switch (this) {
      case ANS:
      case PERMUTATION:
      case COMBINATION:
        return true;
      case ROOT:
        return INDEX.equals(slot);
      default:
        return false;
    }
  }
}
