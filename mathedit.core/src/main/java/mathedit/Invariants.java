package mathedit;

import mathedit.cursor.Address;
import mathedit.cursor.EditorCursor;
import mathedit.nodes.Node;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural well-formedness of a document: non-empty sibling lists, merged literals, unique identities and
 * a resolvable cursor.
 */
public class Invariants {

  public static List<String> check(List<Node> expression, EditorCursor cursor) {
    List<String> violations = new ArrayList<>();
    check(expression, null, null, new HashSet<>(), violations);
    if (!Address.isValid(expression, cursor)) {
      violations.add("cursor does not resolve: " + cursor);
    }
    return violations;
  }

  private static void check(List<Node> nodes, @Nullable String parentId, @Nullable String slot, Set<String> ids, List<String> violations) {
    if (nodes.isEmpty()) {
      violations.add("empty list at " + parentId + "." + slot);
    }
    for (int i = 0; i < nodes.size(); i++) {
      Node node = nodes.get(i);
      if (!ids.add(node.id)) {
        violations.add("duplicate id " + node.id);
      }
      if (i > 0 && node.isLiteral() && nodes.get(i - 1).isLiteral()) {
        violations.add("adjacent literals at " + parentId + "." + slot + "[" + (i - 1) + "]");
      }
      for (String child : node.slotNames()) {
        List<Node> content = node.slot(child);
        if (content == null) {
          violations.add("missing slot " + child + " in " + node.id);
          continue;
        }
        check(content, node.id, child, ids, violations);
      }
    }
  }
}
