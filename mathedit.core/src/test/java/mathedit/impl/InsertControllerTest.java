package mathedit.impl;

import mathedit.Document;
import mathedit.EditorSettings;
import mathedit.cursor.EditorCursor;
import mathedit.nodes.Node;
import mathedit.nodes.Nodes;
import mathedit.nodes.Slots;
import mathedit.selection.SelectionAnchor;
import mathedit.selection.SelectionRange;
import org.junit.jupiter.api.Test;

import static mathedit.Shapes.shape;
import static org.assertj.core.api.Assertions.assertThat;

public class InsertControllerTest {
  private final EditorSettings settings = new EditorSettings();

  private Document type(Document doc, String... keys) {
    for (String key : keys) {
      InsertController.insertCharacter(doc, settings, key);
      Literals.normalize(doc);
    }
    return doc;
  }

  @Test
  public void operatorsUseDisplayGlyphs() {
    Document doc = type(new Document(), "1", "-", "2", "*", "3");
    assertThat(Nodes.shape(doc.expression)).isEqualTo(shape("['1−2×3']"));
    assertThat(doc.cursor).isEqualTo(EditorCursor.root(0, 5));
  }

  @Test
  public void dotMultiplySign() {
    Document doc = new Document();
    InsertController.insertCharacter(doc, settings.withMultiplySign(EditorSettings.MULTIPLY_DOT), "2");
    InsertController.insertCharacter(doc, settings.withMultiplySign(EditorSettings.MULTIPLY_DOT), "*");
    assertThat(Nodes.shape(doc.expression)).isEqualTo(shape("['2·']"));
  }

  @Test
  public void doubleMultiplyBecomesExponent() {
    Document doc = type(new Document(), "2", "*", "*");
    assertThat(Nodes.shape(doc.expression)).isEqualTo(shape("['', EXPONENT(base=['2'], pow=['']), '']"));
    assertThat(doc.cursor.slot).isEqualTo(Slots.POWER);
  }

  @Test
  public void slashAndCaretWrap() {
    Document doc = type(new Document(), "3", "/");
    assertThat(Nodes.shape(doc.expression)).isEqualTo(shape("[FRACTION(num=['3'], den=['']), '']"));
    type(doc, "x", "^");
    assertThat(Nodes.shape(doc.expression)).isEqualTo(shape("[FRACTION(num=['3'], den=['', EXPONENT(base=['x'], pow=['']), '']), '']"));
  }

  @Test
  public void closingParenthesisLeavesIt() {
    Document doc = type(new Document(), "(", "1", "+", "2", ")", "3");
    assertThat(Nodes.shape(doc.expression)).isEqualTo(shape("['', PARENTHESIS(content=['1+2']), '3']"));
    assertThat(doc.cursor).isEqualTo(EditorCursor.root(2, 1));
  }

  @Test
  public void closingParenthesisOutsideIsIgnored() {
    Document doc = type(new Document(), "1");
    assertThat(InsertController.insertCharacter(doc, settings, ")")).isFalse();
    assertThat(Nodes.shape(doc.expression)).isEqualTo(shape("['1']"));
  }

  @Test
  public void operatorLeavesNumericField() {
    Document doc = type(new Document(), "5");
    WrapController.wrapIntoPermutation(doc);
    type(doc, "2", "+", "1");
    assertThat(Nodes.shape(doc.expression)).isEqualTo(shape("['', PERMUTATION(n=['5'], r=['2']), '+1']"));
    assertThat(doc.cursor).isEqualTo(EditorCursor.root(2, 2));
  }

  @Test
  public void operatorStaysInFraction() {
    Document doc = type(new Document(), "1", "/", "2", "+");
    assertThat(Nodes.shape(doc.expression)).isEqualTo(shape("[FRACTION(num=['1'], den=['2+']), '']"));
  }

  @Test
  public void symbolsKeepLiteralsBetween() {
    Document doc = new Document();
    InsertController.insertConstant(doc, "π");
    assertThat(Nodes.shape(doc.expression)).isEqualTo(shape("[CONSTANT:π, '']"));
    assertThat(doc.cursor).isEqualTo(EditorCursor.root(1, 0));

    InsertController.insertUnitVector(doc, "x");
    assertThat(Nodes.shape(doc.expression)).isEqualTo(shape("[CONSTANT:π, '', UNIT_VECTOR:x, '']"));
    assertThat(doc.cursor).isEqualTo(EditorCursor.root(3, 0));
  }

  @Test
  public void constantSplitsLiteral() {
    Document doc = Document.of(Nodes.literal("23"));
    doc.cursor = EditorCursor.root(0, 1);
    InsertController.insertConstant(doc, "e");
    assertThat(Nodes.shape(doc.expression)).isEqualTo(shape("['2', CONSTANT:e, '3']"));
    assertThat(doc.cursor).isEqualTo(EditorCursor.root(2, 0));
  }

  @Test
  public void newlineSplitsLiteral() {
    Document doc = Document.of(Nodes.literal("12"));
    doc.cursor = EditorCursor.root(0, 1);
    InsertController.insertNewline(doc);
    assertThat(Nodes.shape(doc.expression)).isEqualTo(shape("['1', NEWLINE, '2']"));
    assertThat(doc.cursor).isEqualTo(EditorCursor.root(2, 0));
  }

  @Test
  public void bigOperatorsSeedBoundVariable() {
    Document doc = new Document();
    InsertController.insertSummation(doc, settings);
    Node sum = doc.expression.get(1);
    assertThat(Nodes.shape(doc.expression)).isEqualTo(shape("['', SUMMATION(var=['x'], lower=[''], upper=[''], body=['']), '']"));
    assertThat(doc.cursor).isEqualTo(new EditorCursor(sum.id, Slots.BODY, 0, 0));

    Document derivative = new Document();
    InsertController.insertDerivative(derivative, new EditorSettings(0, null, -1, -1, -1, -1, "t"));
    assertThat(Nodes.shape(derivative.expression)).isEqualTo(shape("['', DERIVATIVE(var=['t'], at=[''], body=['']), '']"));
  }

  @Test
  public void emptyContainersWithoutSelection() {
    Document trig = new Document();
    assertThat(InsertController.insertTrig(trig, "sin")).isTrue();
    Node sin = trig.expression.get(1);
    assertThat(Nodes.shape(trig.expression)).isEqualTo(shape("['', TRIG:sin(arg=['']), '']"));
    assertThat(trig.cursor).isEqualTo(new EditorCursor(sin.id, Slots.ARGUMENT, 0, 0));

    Document sqrt = new Document();
    InsertController.insertSquareRoot(sqrt);
    assertThat(Nodes.shape(sqrt.expression)).isEqualTo(shape("['', ROOT:sqrt(index=['2'], radicand=['']), '']"));
    assertThat(sqrt.cursor.slot).isEqualTo(Slots.RADICAND);

    Document nth = new Document();
    InsertController.insertNthRoot(nth);
    assertThat(nth.cursor.slot).isEqualTo(Slots.INDEX);
  }

  @Test
  public void logVariants() {
    Document log10 = new Document();
    InsertController.insertLog10(log10);
    assertThat(Nodes.shape(log10.expression)).isEqualTo(shape("['', LOG(base=['10'], arg=['']), '']"));
    assertThat(log10.cursor.slot).isEqualTo(Slots.ARGUMENT);

    Document logN = new Document();
    InsertController.insertLogN(logN);
    assertThat(logN.cursor.slot).isEqualTo(Slots.BASE);

    Document ln = new Document();
    InsertController.insertNaturalLog(ln);
    assertThat(Nodes.shape(ln.expression)).isEqualTo(shape("['', LOG:ln(base=['10'], arg=['']), '']"));
  }

  @Test
  public void typingReplacesSelection() {
    Document doc = type(new Document(), "1", "2", "3");
    doc.selection = new SelectionRange(new SelectionAnchor(null, null, 0, 1), new SelectionAnchor(null, null, 0, 3));
    type(doc, "9");
    assertThat(Nodes.shape(doc.expression)).isEqualTo(shape("['19']"));
    assertThat(doc.selection).isNull();
  }
}
