package mathedit.impl;

import mathedit.Document;
import mathedit.cursor.EditorCursor;
import mathedit.nodes.Node;
import mathedit.nodes.Nodes;
import mathedit.selection.ClipboardContent;
import mathedit.selection.SelectionAnchor;
import mathedit.selection.SelectionRange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static mathedit.Shapes.shape;
import static org.assertj.core.api.Assertions.assertThat;

public class SelectionControllerTest {
  private Node fraction;
  private Document doc;

  @BeforeEach
  public void setUp() {
    fraction = Nodes.fraction(Nodes.single("1"), Nodes.single("2"));
    doc = Document.of(Nodes.literal("a"), fraction, Nodes.literal("bc"));
  }

  private static SelectionRange range(int fromNode, int fromChar, int toNode, int toChar) {
    return new SelectionRange(new SelectionAnchor(null, null, fromNode, fromChar), new SelectionAnchor(null, null, toNode, toChar));
  }

  @Test
  public void copySplitsEdgeText() {
    doc.selection = range(0, 0, 2, 1);
    ClipboardContent content = SelectionController.copy(doc);
    assertThat(content).isNotNull();
    assertThat(content.leadingText).isEqualTo("a");
    assertThat(content.trailingText).isEqualTo("b");
    assertThat(Nodes.shape(content.nodes)).isEqualTo(shape("[FRACTION(num=['1'], den=['2'])]"));
    assertThat(content.nodes.get(0).id).isNotEqualTo(fraction.id);
  }

  @Test
  public void copyInsideOneLiteral() {
    Document doc = Document.of(Nodes.literal("1+23"));
    doc.selection = range(0, 4, 0, 2);
    ClipboardContent content = SelectionController.copy(doc);
    assertThat(content.nodes).isEmpty();
    assertThat(content.leading()).isEqualTo("23");
    assertThat(content.trailingText).isNull();
  }

  @Test
  public void anchorBeforeCompositeExcludesIt() {
    doc.selection = range(0, 1, 1, 0);
    assertThat(SelectionController.copy(doc)).isNull();
  }

  @Test
  public void pasteJoinsEdgeText() {
    doc.selection = range(0, 0, 2, 1);
    ClipboardContent content = SelectionController.copy(doc);

    Document target = Document.of(Nodes.literal("xy"));
    target.cursor = EditorCursor.root(0, 1);
    assertThat(SelectionController.paste(target, content)).isTrue();
    assertThat(Nodes.shape(target.expression)).isEqualTo(shape("['xa', FRACTION(num=['1'], den=['2']), 'by']"));
    assertThat(target.cursor).isEqualTo(EditorCursor.root(2, 1));

    SelectionController.paste(target, content);
    assertThat(target.expression.get(1).id).isNotEqualTo(target.expression.get(3).id);
  }

  @Test
  public void pasteNothing() {
    assertThat(SelectionController.paste(doc, null)).isFalse();
  }

  @Test
  public void deleteSelectionJoinsRemainders() {
    doc.selection = range(2, 1, 0, 0);
    assertThat(SelectionController.deleteSelection(doc)).isTrue();
    assertThat(Nodes.shape(doc.expression)).isEqualTo(shape("['c']"));
    assertThat(doc.cursor).isEqualTo(EditorCursor.ROOT);
    assertThat(doc.selection).isNull();
  }

  @Test
  public void selectAllCoversRoot() {
    assertThat(SelectionController.selectAll(doc)).isEqualTo(range(0, 0, 2, 2));
  }

  @Test
  public void deletingGapBetweenCompositesChangesNothing() {
    Node root = Nodes.squareRoot(Nodes.single("2"));
    Document doc = Document.of(Nodes.literal(""), fraction, root, Nodes.literal(""));
    doc.selection = range(1, 1, 2, 0);
    assertThat(SelectionController.deleteSelection(doc)).isFalse();
    assertThat(Nodes.shape(doc.expression)).isEqualTo(shape("['', FRACTION(num=['1'], den=['2']), ROOT:sqrt(index=['2'], radicand=['2']), '']"));
    assertThat(doc.selection).isNull();
  }
}
