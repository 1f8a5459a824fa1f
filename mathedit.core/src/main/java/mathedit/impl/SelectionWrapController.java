package mathedit.impl;

import mathedit.Document;
import mathedit.cursor.Address;
import mathedit.cursor.EditorCursor;
import mathedit.nodes.Node;
import mathedit.nodes.NodeKind;
import mathedit.nodes.Nodes;
import mathedit.nodes.Slots;
import mathedit.selection.SelectionRange;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Wraps the active selection, as a whole, into a new container.
 */
public class SelectionWrapController {
  private static final Logger logger = LogManager.getLogger(SelectionWrapController.class);

  private static final Pattern SIMPLE_BASE = Pattern.compile("[a-zA-Z0-9.]+");

  public enum Target {
    FRACTION,
    EXPONENT,
    SQUARE,
    SQUARE_ROOT,
    NTH_ROOT,
    TRIG,
    LOG10,
    LOG_N,
    NATURAL_LOG,
    PERMUTATION,
    COMBINATION,
    PARENTHESIS
  }

  public static boolean wrap(Document doc, Target target) {
    return wrapSelection(doc, target, null);
  }

  public static boolean wrapTrig(Document doc, String function) {
    return wrapSelection(doc, Target.TRIG, function);
  }

  private static boolean wrapSelection(Document doc, Target target, @Nullable String function) {
    SelectionRange range = doc.selection;
    if (range == null || range.isEmpty()) return false;
    List<Node> siblings = Address.resolveSiblingList(doc.expression, range.parentId(), range.slot());
    if (siblings == null) {
      logger.debug("Selection context vanished: {}", range);
      doc.selection = null;
      return false;
    }
    SelectedSpan span = SelectedSpan.of(siblings, range);
    if (target == Target.PARENTHESIS && isSingleParenthesis(span)) {
      doc.selection = null;
      return false;
    }

    List<Node> content = span.content();
    for (int i = span.to; i >= span.from; i--) {
      siblings.remove(i);
    }
    Node container = build(target, content, function);
    siblings.add(span.from, Nodes.literal(span.before));
    siblings.add(span.from + 1, container);
    siblings.add(span.from + 2, Nodes.literal(span.after));
    doc.selection = null;

    String slot = cursorSlot(target);
    doc.cursor = slot != null
                 ? new EditorCursor(container.id, slot, 0, 0)
                 : new EditorCursor(range.parentId(), range.slot(), span.from + 2, 0);
    return true;
  }

  private static Node build(Target target, List<Node> content, @Nullable String function) {
    switch (target) {
      case FRACTION:
        return Nodes.fraction(content, Nodes.single(""));
      case EXPONENT:
        return Nodes.exponent(baseOf(content), Nodes.single(""));
      case SQUARE:
        return Nodes.exponent(baseOf(content), Nodes.single("2"));
      case SQUARE_ROOT:
        return Nodes.squareRoot(content);
      case NTH_ROOT:
        return Nodes.nthRoot(Nodes.single(""), content);
      case TRIG:
        assert function != null;
        return Nodes.trig(function, content);
      case LOG10:
        return Nodes.log(Nodes.single("10"), content);
      case LOG_N:
        return Nodes.log(Nodes.single(""), content);
      case NATURAL_LOG:
        return Nodes.naturalLog(content);
      case PERMUTATION:
        return Nodes.permutation(content, Nodes.single(""));
      case COMBINATION:
        return Nodes.combination(content, Nodes.single(""));
      case PARENTHESIS:
        if (!content.get(0).isLiteral()) {
          content.add(0, Nodes.literal());
        }
        if (!content.get(content.size() - 1).isLiteral()) {
          content.add(Nodes.literal());
        }
        return Nodes.parenthesis(content);
      default:
        throw new AssertionError(target);
    }
  }

  @Nullable
  private static String cursorSlot(Target target) {
    switch (target) {
      case FRACTION:
        return Slots.DENOMINATOR;
      case EXPONENT:
        return Slots.POWER;
      case NTH_ROOT:
        return Slots.INDEX;
      case LOG_N:
        return Slots.BASE;
      case PERMUTATION:
      case COMBINATION:
        return Slots.R;
      default:
        return null;
    }
  }

  /**
   * Anything but a plain number, a plain name or an existing parenthesis is raised in parentheses.
   */
  private static List<Node> baseOf(List<Node> content) {
    if (content.size() == 1) {
      Node node = content.get(0);
      if (node.isLiteral() && SIMPLE_BASE.matcher(node.getText()).matches()) {
        return content;
      }
      if (node.kind == NodeKind.PARENTHESIS) {
        return content;
      }
    }
    return Nodes.list(Nodes.parenthesis(content));
  }

  private static boolean isSingleParenthesis(SelectedSpan span) {
    return span.leading.isEmpty() &&
           span.trailing.isEmpty() &&
           span.nodes.size() == 1 &&
           span.nodes.get(0).kind == NodeKind.PARENTHESIS;
  }
}
