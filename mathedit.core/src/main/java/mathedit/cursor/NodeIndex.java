package mathedit.cursor;

import io.lacuna.bifurcan.List;
import io.lacuna.bifurcan.Map;
import mathedit.nodes.Node;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Objects;

/**
 * Snapshot map from node identity to its location, rebuilt after every structural change. Literals are
 * also kept in document order for hit testing.
 */
public class NodeIndex {
  public static final NodeIndex EMPTY = new NodeIndex(new Map<>(), new List<>());

  public final Map<String, Entry> entries;
  public final List<Entry> literals;

  private NodeIndex(Map<String, Entry> entries, List<Entry> literals) {
    this.entries = entries;
    this.literals = literals;
  }

  public static NodeIndex build(java.util.List<Node> root) {
    Map<String, Entry> entries = new Map<String, Entry>().linear();
    List<Entry> literals = new List<Entry>().linear();
    collect(root, null, null, entries, literals);
    return new NodeIndex(entries.forked(), literals.forked());
  }

  private static void collect(java.util.List<Node> nodes,
                              @Nullable String parentId,
                              @Nullable String slot,
                              Map<String, Entry> entries,
                              List<Entry> literals) {
    for (int i = 0; i < nodes.size(); i++) {
      Node node = nodes.get(i);
      Entry entry = new Entry(node, parentId, slot, i);
      entries.put(node.id, entry);
      if (node.isLiteral()) {
        literals.addLast(entry);
      }
      for (String childSlot : node.slotNames()) {
        collect(node.slot(childSlot), node.id, childSlot, entries, literals);
      }
    }
  }

  @Nullable
  public Entry get(String id) {
    return entries.get(id, null);
  }

  public boolean contains(String id) {
    return entries.contains(id);
  }

  public long size() {
    return entries.size();
  }

  /**
   * Both indexes hold the same identities.
   */
  public boolean sameNodes(NodeIndex other) {
    if (size() != other.size()) return false;
    for (String id : entries.keys()) {
      if (!other.contains(id)) return false;
    }
    return true;
  }

  public java.util.List<Entry> literals() {
    java.util.List<Entry> result = new ArrayList<>();
    for (int i = 0; i < literals.size(); i++) {
      result.add(literals.nth(i));
    }
    return result;
  }

  public java.util.List<Entry> literalsIn(@Nullable String parentId, @Nullable String slot) {
    java.util.List<Entry> result = new ArrayList<>();
    for (int i = 0; i < literals.size(); i++) {
      Entry entry = literals.nth(i);
      if (Objects.equals(entry.parentId, parentId) && Objects.equals(entry.slot, slot)) {
        result.add(entry);
      }
    }
    return result;
  }

  public static class Entry {
    public final Node node;
    @Nullable public final String parentId;
    @Nullable public final String slot;
    public final int index;

    public Entry(Node node, @Nullable String parentId, @Nullable String slot, int index) {
      this.node = node;
      this.parentId = parentId;
      this.slot = slot;
      this.index = index;
    }

    @Override
    public String toString() {
      return "Entry{" +
             "node=" + node.id +
             ", parentId=" + parentId +
             ", slot=" + slot +
             ", index=" + index +
             '}';
    }
  }
}
