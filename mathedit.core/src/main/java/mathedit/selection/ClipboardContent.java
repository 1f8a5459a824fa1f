package mathedit.selection;

import mathedit.nodes.Node;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.List;

/**
 * Copied selection: partial literal text at the two ends is kept apart from the whole nodes in between.
 */
public class ClipboardContent {
  public final List<Node> nodes;
  @Nullable public final String leadingText;
  @Nullable public final String trailingText;

  public ClipboardContent(List<Node> nodes, @Nullable String leadingText, @Nullable String trailingText) {
    this.nodes = Collections.unmodifiableList(nodes);
    this.leadingText = leadingText;
    this.trailingText = trailingText;
  }

  public boolean isEmpty() {
    return nodes.isEmpty() &&
           (leadingText == null || leadingText.isEmpty()) &&
           (trailingText == null || trailingText.isEmpty());
  }

  public String leading() {
    return leadingText == null ? "" : leadingText;
  }

  public String trailing() {
    return trailingText == null ? "" : trailingText;
  }

  @Override
  public String toString() {
    return "ClipboardContent{" +
           "nodes=" + nodes +
           ", leadingText=" + leadingText +
           ", trailingText=" + trailingText +
           '}';
  }
}
