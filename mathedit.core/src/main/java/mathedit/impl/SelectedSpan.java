package mathedit.impl;

import mathedit.nodes.Node;
import mathedit.nodes.Nodes;
import mathedit.selection.SelectionAnchor;
import mathedit.selection.SelectionRange;

import java.util.ArrayList;
import java.util.List;

/**
 * What a selection covers in its sibling list. Literals at either end are cut at the anchor offsets; a
 * composite at an end counts only when the anchor's block offset puts it inside the range.
 */
class SelectedSpan {
  // inclusive index range replaced when the selection is removed or wrapped
  final int from;
  final int to;
  final String before;
  final String after;
  final String leading;
  final String trailing;
  final List<Node> nodes;

  private SelectedSpan(int from, int to, String before, String after, String leading, String trailing, List<Node> nodes) {
    this.from = from;
    this.to = to;
    this.before = before;
    this.after = after;
    this.leading = leading;
    this.trailing = trailing;
    this.nodes = nodes;
  }

  static SelectedSpan of(List<Node> siblings, SelectionRange range) {
    SelectionRange normalized = range.normalized();
    SelectionAnchor start = normalized.start;
    SelectionAnchor end = normalized.end;
    int first = clamp(start.nodeIndex, siblings);
    int last = clamp(end.nodeIndex, siblings);
    List<Node> nodes = new ArrayList<>();

    if (first == last) {
      Node node = siblings.get(first);
      if (node.isLiteral()) {
        String text = node.getText();
        int s = clamp(start.charIndex, text);
        int e = clamp(end.charIndex, text);
        return new SelectedSpan(first, first, text.substring(0, s), text.substring(e), text.substring(s, e), "", nodes);
      }
      if (start.charIndex == end.charIndex) {
        return new SelectedSpan(first, first - 1, "", "", "", "", nodes);
      }
      nodes.add(node);
      return new SelectedSpan(first, first, "", "", "", "", nodes);
    }

    int from = first;
    int to = last;
    String before = "";
    String after = "";
    String leading = "";
    String trailing = "";

    Node head = siblings.get(first);
    if (head.isLiteral()) {
      int s = clamp(start.charIndex, head.getText());
      before = head.getText().substring(0, s);
      leading = head.getText().substring(s);
    }
    else if (start.charIndex == 0) {
      nodes.add(head);
    }
    else {
      from = first + 1;
    }

    for (int i = first + 1; i < last; i++) {
      nodes.add(siblings.get(i));
    }

    Node tail = siblings.get(last);
    if (tail.isLiteral()) {
      int e = clamp(end.charIndex, tail.getText());
      trailing = tail.getText().substring(0, e);
      after = tail.getText().substring(e);
    }
    else if (end.charIndex > 0) {
      nodes.add(tail);
    }
    else {
      to = last - 1;
    }
    return new SelectedSpan(from, to, before, after, leading, trailing, nodes);
  }

  boolean isEmpty() {
    return leading.isEmpty() && trailing.isEmpty() && nodes.isEmpty();
  }

  /**
   * Selected content as one sibling sequence; existing composites are reused.
   */
  List<Node> content() {
    List<Node> content = new ArrayList<>();
    if (!leading.isEmpty()) {
      content.add(Nodes.literal(leading));
    }
    content.addAll(nodes);
    if (!trailing.isEmpty()) {
      content.add(Nodes.literal(trailing));
    }
    if (content.isEmpty()) {
      content.add(Nodes.literal());
    }
    return content;
  }

  /**
   * Removes the span, leaving {@code before + after} as one literal at {@link #from}.
   */
  void cut(List<Node> siblings) {
    for (int i = to; i >= from; i--) {
      siblings.remove(i);
    }
    siblings.add(from, Nodes.literal(before + after));
  }

  private static int clamp(int index, List<Node> siblings) {
    return Math.max(0, Math.min(index, siblings.size() - 1));
  }

  private static int clamp(int offset, String text) {
    return Math.max(0, Math.min(offset, text.length()));
  }
}
