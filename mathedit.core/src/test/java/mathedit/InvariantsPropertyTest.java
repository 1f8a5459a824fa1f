package mathedit;

import mathedit.cursor.Address;
import mathedit.cursor.EditorCursor;
import mathedit.nodes.Node;
import mathedit.nodes.Nodes;
import mathedit.selection.SelectionAnchor;
import mathedit.selection.SelectionRange;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Random edit sequences must always leave a well-formed document behind.
 */
public class InvariantsPropertyTest {
  private static final String[] KEYS = {"1", "2", "x", "+", "-", "*", "=", "/", "^", "(", ")", "ans"};

  private static List<Consumer<MathEditor>> operations(Random random) {
    List<Consumer<MathEditor>> ops = new ArrayList<>();
    for (String key : KEYS) {
      ops.add(e -> e.insertCharacter(key));
      ops.add(e -> e.insertCharacter(key));
    }
    ops.add(MathEditor::wrapIntoFraction);
    ops.add(MathEditor::wrapIntoExponent);
    ops.add(MathEditor::wrapIntoSquareRoot);
    ops.add(MathEditor::wrapIntoNthRoot);
    ops.add(MathEditor::wrapIntoLog10);
    ops.add(MathEditor::wrapIntoLogN);
    ops.add(MathEditor::wrapIntoNaturalLog);
    ops.add(e -> e.wrapIntoTrig("cos"));
    ops.add(MathEditor::wrapIntoPermutation);
    ops.add(MathEditor::wrapIntoCombination);
    ops.add(MathEditor::wrapIntoParenthesis);
    ops.add(MathEditor::insertSquare);
    ops.add(MathEditor::insertSummation);
    ops.add(MathEditor::insertIntegral);
    ops.add(MathEditor::insertDerivative);
    ops.add(MathEditor::insertNewline);
    ops.add(e -> e.insertConstant("π"));
    ops.add(e -> e.insertUnitVector("y"));
    for (int i = 0; i < 6; i++) {
      ops.add(MathEditor::deleteChar);
      ops.add(MathEditor::moveLeft);
      ops.add(MathEditor::moveRight);
    }
    ops.add(MathEditor::moveCursorToStart);
    ops.add(MathEditor::moveCursorToEnd);
    ops.add(MathEditor::selectAll);
    ops.add(MathEditor::copy);
    ops.add(MathEditor::cut);
    ops.add(MathEditor::paste);
    ops.add(MathEditor::deleteSelection);
    ops.add(e -> e.setSelection(randomRange(e, random)));
    ops.add(e -> e.setSelection(randomRange(e, random)));
    // undo and redo stay last
    ops.add(MathEditor::undo);
    ops.add(MathEditor::redo);
    return ops;
  }

  private static SelectionRange randomRange(MathEditor editor, Random random) {
    EditorCursor cursor = editor.cursor();
    List<Node> siblings = Address.resolveSiblingList(editor.expression(), cursor);
    return new SelectionRange(randomAnchor(cursor, siblings, random), randomAnchor(cursor, siblings, random));
  }

  private static SelectionAnchor randomAnchor(EditorCursor cursor, List<Node> siblings, Random random) {
    int index = random.nextInt(siblings.size());
    Node node = siblings.get(index);
    int charIndex = random.nextInt(node.isLiteral() ? node.getText().length() + 1 : 2);
    return new SelectionAnchor(cursor.parentId, cursor.slot, index, charIndex);
  }

  @Test
  public void randomEditsKeepDocumentWellFormed() {
    for (long seed = 1; seed <= 20; seed++) {
      Random random = new Random(seed);
      List<Consumer<MathEditor>> ops = operations(random);
      MathEditor editor = new MathEditor();
      for (int step = 0; step < 300; step++) {
        ops.get(random.nextInt(ops.size())).accept(editor);
        List<String> violations = Invariants.check(editor.expression(), editor.cursor());
        assertThat(violations).as("seed %d step %d: %s", seed, step, Nodes.shape(editor.expression())).isEmpty();
      }
    }
  }

  @Test
  public void undoingEverythingRestoresEmptyDocument() {
    Random random = new Random(99);
    List<Consumer<MathEditor>> ops = operations(random);
    MathEditor editor = new MathEditor(new EditorSettings(1000));
    for (int step = 0; step < 200; step++) {
      ops.get(random.nextInt(ops.size() - 2)).accept(editor);
    }
    while (editor.canUndo()) {
      editor.undo();
    }
    assertThat(Nodes.shape(editor.expression())).isEqualTo(Shapes.shape("['']"));
  }
}
