package mathedit;

import io.lacuna.bifurcan.List;
import io.lacuna.bifurcan.Lists;

import java.util.Objects;

/**
 * Bounded undo/redo stacks of whole-document snapshots plus a bounded log of applied operations.
 */
public class History {
  public final int limit;
  public final List<EditorState> undoStack;
  public final List<EditorState> redoStack;
  public final List<Entry> entries;

  public History(int limit) {
    this(limit, new List<>(), new List<>(), new List<>());
  }

  public History(int limit, List<EditorState> undoStack, List<EditorState> redoStack, List<Entry> entries) {
    assert limit > 0;
    this.limit = limit;
    this.undoStack = undoStack;
    this.redoStack = redoStack;
    this.entries = entries;
  }

  public boolean canUndo() {
    return undoStack.size() > 0;
  }

  public boolean canRedo() {
    return redoStack.size() > 0;
  }

  public int undoDepth() {
    return (int)undoStack.size();
  }

  public int redoDepth() {
    return (int)redoStack.size();
  }

  /**
   * Pushes the pre-operation state and forgets everything that could have been redone.
   */
  public History record(EditorState before) {
    return new History(limit, bounded(undoStack.addLast(before)), new List<>(), entries);
  }

  public EditorState lastUndo() {
    return undoStack.last();
  }

  public EditorState lastRedo() {
    return redoStack.last();
  }

  public History undo(EditorState current) {
    assert canUndo();
    return new History(limit, undoStack.removeLast(), bounded(redoStack.addLast(current)), entries);
  }

  public History redo(EditorState current) {
    assert canRedo();
    return new History(limit, bounded(undoStack.addLast(current)), redoStack.removeLast(), entries);
  }

  public History log(Op op, long version) {
    return new History(limit, undoStack, redoStack, bounded(entries.addLast(new Entry(op, version))));
  }

  public java.util.List<Entry> entries() {
    return Lists.toList(entries);
  }

  private <T> List<T> bounded(List<T> list) {
    while (list.size() > limit) {
      list = list.removeFirst();
    }
    return list;
  }

  public static class Entry {
    public final Op op;
    public final long version;

    public Entry(Op op, long version) {
      this.op = op;
      this.version = version;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) return true;
      if (o == null || getClass() != o.getClass()) return false;
      Entry entry = (Entry)o;
      return version == entry.version &&
             op == entry.op;
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, version);
    }

    @Override
    public String toString() {
      return "Entry{" +
             "op=" + op +
             ", version=" + version +
             '}';
    }
  }
}
