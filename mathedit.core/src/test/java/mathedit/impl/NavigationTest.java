package mathedit.impl;

import mathedit.Document;
import mathedit.cursor.EditorCursor;
import mathedit.nodes.Node;
import mathedit.nodes.Nodes;
import mathedit.nodes.Slots;
import org.junit.jupiter.api.Test;

import static mathedit.Shapes.shape;
import static org.assertj.core.api.Assertions.assertThat;

public class NavigationTest {
  private final Node fraction = Nodes.fraction(Nodes.single("2"), Nodes.single("3"));
  private final Document doc = Document.of(Nodes.literal("1"), fraction, Nodes.literal("4"));

  private EditorCursor in(String slot, int offset) {
    return new EditorCursor(fraction.id, slot, 0, offset);
  }

  @Test
  public void leftWalksThroughFractionSlots() {
    doc.cursor = EditorCursor.root(2, 1);
    Navigation.moveLeft(doc);
    assertThat(doc.cursor).isEqualTo(EditorCursor.root(2, 0));
    Navigation.moveLeft(doc);
    assertThat(doc.cursor).isEqualTo(in(Slots.DENOMINATOR, 1));
    Navigation.moveLeft(doc);
    assertThat(doc.cursor).isEqualTo(in(Slots.DENOMINATOR, 0));
    Navigation.moveLeft(doc);
    assertThat(doc.cursor).isEqualTo(in(Slots.NUMERATOR, 1));
    Navigation.moveLeft(doc);
    assertThat(doc.cursor).isEqualTo(in(Slots.NUMERATOR, 0));
    Navigation.moveLeft(doc);
    assertThat(doc.cursor).isEqualTo(EditorCursor.root(0, 1));
  }

  @Test
  public void rightWalksThroughFractionSlots() {
    doc.cursor = EditorCursor.root(0, 1);
    Navigation.moveRight(doc);
    assertThat(doc.cursor).isEqualTo(in(Slots.NUMERATOR, 0));
    Navigation.moveRight(doc);
    assertThat(doc.cursor).isEqualTo(in(Slots.NUMERATOR, 1));
    Navigation.moveRight(doc);
    assertThat(doc.cursor).isEqualTo(in(Slots.DENOMINATOR, 0));
    Navigation.moveRight(doc);
    assertThat(doc.cursor).isEqualTo(in(Slots.DENOMINATOR, 1));
    Navigation.moveRight(doc);
    assertThat(doc.cursor).isEqualTo(EditorCursor.root(2, 0));
  }

  @Test
  public void stopsAtDocumentEdges() {
    doc.cursor = EditorCursor.root(2, 1);
    assertThat(Navigation.moveRight(doc)).isFalse();
    doc.cursor = EditorCursor.ROOT;
    assertThat(Navigation.moveLeft(doc)).isFalse();
  }

  @Test
  public void squareRootSkipsIndex() {
    Node sqrt = Nodes.squareRoot(Nodes.single("9"));
    Document doc = Document.of(Nodes.literal(""), sqrt, Nodes.literal(""));
    Navigation.moveRight(doc);
    assertThat(doc.cursor).isEqualTo(new EditorCursor(sqrt.id, Slots.RADICAND, 0, 0));
    Navigation.moveLeft(doc);
    assertThat(doc.cursor).isEqualTo(EditorCursor.ROOT);
  }

  @Test
  public void movingPastSymbolAddsSpacer() {
    Document doc = Document.of(Nodes.constant("π"), Nodes.literal(""));
    doc.cursor = EditorCursor.root(1, 0);
    Navigation.moveLeft(doc);
    assertThat(Nodes.shape(doc.expression)).isEqualTo(shape("['', CONSTANT:π, '']"));
    assertThat(doc.cursor).isEqualTo(EditorCursor.ROOT);
  }

  @Test
  public void startAndEnd() {
    doc.cursor = in(Slots.NUMERATOR, 1);
    assertThat(Navigation.moveToStart(doc)).isTrue();
    assertThat(doc.cursor).isEqualTo(EditorCursor.ROOT);
    assertThat(Navigation.moveToStart(doc)).isFalse();
    Navigation.moveToEnd(doc);
    assertThat(doc.cursor).isEqualTo(EditorCursor.root(2, 1));
  }

  @Test
  public void endOfRootAppendsLiteralAfterComposite() {
    Document doc = Document.of(Nodes.literal("1"), Nodes.parenthesis(Nodes.single("2")));
    EditorCursor end = Navigation.endOfRoot(doc.expression);
    assertThat(end).isEqualTo(EditorCursor.root(2, 0));
    assertThat(doc.expression).hasSize(3);
  }

  @Test
  public void settleMovesOffComposites() {
    doc.cursor = EditorCursor.root(1, 0);
    assertThat(Navigation.settle(doc)).isTrue();
    assertThat(doc.cursor).isEqualTo(EditorCursor.root(0, 1));

    Document leading = Document.of(fraction, Nodes.literal(""));
    assertThat(Navigation.settle(leading)).isTrue();
    assertThat(leading.expression).hasSize(3);
    assertThat(leading.cursor).isEqualTo(EditorCursor.ROOT);

    doc.cursor = new EditorCursor("missing", Slots.BASE, 0, 0);
    assertThat(Navigation.settle(doc)).isFalse();
  }

  @Test
  public void settleClampsOffset() {
    doc.cursor = EditorCursor.root(2, 9);
    Navigation.settle(doc);
    assertThat(doc.cursor).isEqualTo(EditorCursor.root(2, 1));
  }
}
