package mathedit;

import mathedit.cursor.EditorCursor;
import mathedit.nodes.Node;
import mathedit.nodes.Nodes;
import mathedit.nodes.Slots;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class HistoryTest {

  private static EditorState state(String text) {
    return EditorState.capture(Nodes.single(text), EditorCursor.root(0, text.length()));
  }

  private static String text(EditorState state) {
    return state.expression.get(0).getText();
  }

  @Test
  public void undoThenRedoIsSymmetric() {
    History history = new History(10).record(state("1")).record(state("12"));
    assertThat(history.undoDepth()).isEqualTo(2);

    EditorState current = state("123");
    assertThat(text(history.lastUndo())).isEqualTo("12");
    history = history.undo(current);
    assertThat(history.undoDepth()).isEqualTo(1);
    assertThat(history.redoDepth()).isEqualTo(1);
    assertThat(text(history.lastRedo())).isEqualTo("123");

    history = history.redo(state("12"));
    assertThat(history.undoDepth()).isEqualTo(2);
    assertThat(history.canRedo()).isFalse();
  }

  @Test
  public void recordingForgetsRedo() {
    History history = new History(10).record(state("1")).undo(state("12"));
    assertThat(history.canRedo()).isTrue();
    history = history.record(state("1"));
    assertThat(history.canRedo()).isFalse();
  }

  @Test
  public void dropsOldestBeyondLimit() {
    History history = new History(2);
    for (String text : new String[]{"a", "b", "c"}) {
      history = history.record(state(text));
    }
    assertThat(history.undoDepth()).isEqualTo(2);
    assertThat(text(history.undoStack.first())).isEqualTo("b");
  }

  @Test
  public void historyIsPersistent() {
    History empty = new History(5);
    History one = empty.record(state("x"));
    assertThat(empty.canUndo()).isFalse();
    assertThat(one.canUndo()).isTrue();
  }

  @Test
  public void logIsBoundedToo() {
    History history = new History(2).log(Op.CLEAR, 1).log(Op.PASTE, 2).log(Op.CUT, 3);
    assertThat(history.entries()).containsExactly(new History.Entry(Op.PASTE, 2), new History.Entry(Op.CUT, 3));
  }

  @Test
  public void captureRemapsCursorIntoCopy() {
    Node fraction = Nodes.fraction(Nodes.single("1"), Nodes.single("2"));
    List<Node> tree = Nodes.list(Nodes.literal(""), fraction, Nodes.literal(""));
    EditorState state = EditorState.capture(tree, new EditorCursor(fraction.id, Slots.DENOMINATOR, 0, 1));

    Node copy = state.expression.get(1);
    assertThat(copy.id).isNotEqualTo(fraction.id);
    assertThat(state.cursor).isEqualTo(new EditorCursor(copy.id, Slots.DENOMINATOR, 0, 1));
    assertThat(Nodes.sameShape(tree, state.expression)).isTrue();
  }
}
