package mathedit.impl;

import mathedit.Document;
import mathedit.cursor.Address;
import mathedit.cursor.EditorCursor;
import mathedit.nodes.Node;
import mathedit.nodes.Nodes;
import mathedit.selection.ClipboardContent;
import mathedit.selection.SelectionAnchor;
import mathedit.selection.SelectionRange;
import org.jetbrains.annotations.Nullable;

import java.util.List;

public class SelectionController {

  @Nullable
  public static ClipboardContent copy(Document doc) {
    if (!doc.hasSelection()) return null;
    SelectionRange range = doc.selection;
    List<Node> siblings = Address.resolveSiblingList(doc.expression, range.parentId(), range.slot());
    if (siblings == null) return null;
    SelectedSpan span = SelectedSpan.of(siblings, range);
    if (span.isEmpty()) return null;
    return new ClipboardContent(Nodes.deepCopy(span.nodes),
                                span.leading.isEmpty() ? null : span.leading,
                                span.trailing.isEmpty() ? null : span.trailing);
  }

  /**
   * Removes the selected content; the text around it is joined and the cursor sits at the join.
   */
  public static boolean deleteSelection(Document doc) {
    SelectionRange range = doc.selection;
    if (range == null) return false;
    doc.selection = null;
    if (range.isEmpty()) return false;
    List<Node> siblings = Address.resolveSiblingList(doc.expression, range.parentId(), range.slot());
    if (siblings == null) return false;
    SelectedSpan span = SelectedSpan.of(siblings, range);
    if (span.isEmpty()) return false;
    span.cut(siblings);
    doc.cursor = new EditorCursor(range.parentId(), range.slot(), span.from, span.before.length());
    return true;
  }

  public static boolean paste(Document doc, @Nullable ClipboardContent content) {
    if (content == null || content.isEmpty()) return false;
    if (doc.hasSelection()) {
      deleteSelection(doc);
    }
    doc.selection = null;
    if (!Navigation.settle(doc)) return false;
    List<Node> siblings = doc.siblings();
    int index = doc.cursor.index;
    Node current = siblings.get(index);
    String before = Literals.before(current, doc.cursor.charOffset);
    String after = Literals.after(current, doc.cursor.charOffset);

    if (content.nodes.isEmpty()) {
      String text = content.leading() + content.trailing();
      current.setText(before + text + after);
      doc.cursor = doc.cursor.withCharOffset(before.length() + text.length());
      return true;
    }
    current.setText(before + content.leading());
    List<Node> nodes = Nodes.deepCopy(content.nodes);
    siblings.addAll(index + 1, nodes);
    int tail = index + 1 + nodes.size();
    siblings.add(tail, Nodes.literal(content.trailing() + after));
    doc.cursor = doc.cursor.withIndex(tail, content.trailing().length());
    return true;
  }

  public static SelectionRange selectAll(Document doc) {
    List<Node> root = doc.expression;
    int last = root.size() - 1;
    Node node = root.get(last);
    int end = node.isLiteral() ? node.getText().length() : 1;
    return new SelectionRange(new SelectionAnchor(null, null, 0, 0), new SelectionAnchor(null, null, last, end));
  }
}
