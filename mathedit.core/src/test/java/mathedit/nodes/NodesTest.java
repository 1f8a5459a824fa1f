package mathedit.nodes;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static mathedit.Shapes.shape;
import static org.assertj.core.api.Assertions.assertThat;

public class NodesTest {

  @Test
  public void emptySlotsHoldOneEmptyLiteral() {
    Node fraction = Nodes.fraction(Nodes.list(), Nodes.single("1"));
    assertThat(Nodes.shape(Nodes.list(fraction))).isEqualTo(shape("[FRACTION(num=[''], den=['1'])]"));

    Node empty = Nodes.empty(NodeKind.SUMMATION);
    for (String slot : empty.slotNames()) {
      assertThat(Nodes.isEffectivelyEmpty(empty.slot(slot))).isTrue();
    }
  }

  @Test
  public void squareRootAndNaturalLogAreFlagged() {
    Node sqrt = Nodes.squareRoot(Nodes.single("x"));
    Node ln = Nodes.naturalLog(Nodes.single("x"));
    assertThat(sqrt.squareRoot).isTrue();
    assertThat(ln.naturalLog).isTrue();
    assertThat(Nodes.shape(Nodes.list(sqrt))).isEqualTo(shape("[ROOT:sqrt(index=['2'], radicand=['x'])]"));
  }

  @Test
  public void deepCopyKeepsShapeButNotIdentity() {
    List<Node> tree = Nodes.list(Nodes.literal("1+"),
                                 Nodes.exponent(Nodes.single("x"), Nodes.single("2")),
                                 Nodes.literal(""));
    Map<String, String> idMap = new HashMap<>();
    List<Node> copy = Nodes.deepCopy(tree, idMap);

    assertThat(Nodes.sameShape(tree, copy)).isTrue();
    assertThat(idMap).hasSize(5);
    for (int i = 0; i < tree.size(); i++) {
      assertThat(copy.get(i).id).isNotEqualTo(tree.get(i).id);
      assertThat(idMap.get(tree.get(i).id)).isEqualTo(copy.get(i).id);
    }
  }

  @Test
  public void sameShapeComparesTextAndFlags() {
    assertThat(Nodes.sameShape(Nodes.single("12"), Nodes.single("12"))).isTrue();
    assertThat(Nodes.sameShape(Nodes.single("12"), Nodes.single("13"))).isFalse();
    assertThat(Nodes.sameShape(Nodes.list(Nodes.trig("sin", Nodes.single("x"))),
                               Nodes.list(Nodes.trig("cos", Nodes.single("x"))))).isFalse();
    assertThat(Nodes.sameShape(Nodes.list(Nodes.squareRoot(Nodes.single("x"))),
                               Nodes.list(Nodes.nthRoot(Nodes.single("2"), Nodes.single("x"))))).isFalse();
  }

  @Test
  public void effectivelyEmpty() {
    assertThat(Nodes.isEffectivelyEmpty(Nodes.list(Nodes.literal(), Nodes.literal()))).isTrue();
    assertThat(Nodes.isEffectivelyEmpty(Nodes.single("0"))).isFalse();
    assertThat(Nodes.isEffectivelyEmpty(Nodes.list(Nodes.constant("π")))).isFalse();
  }

  @Test
  public void identitiesAreUnique() {
    assertThat(Nodes.literal().id).isNotEqualTo(Nodes.literal().id);
    Node a = Nodes.literal("x");
    assertThat(a).isEqualTo(a);
    assertThat(a).isNotEqualTo(Nodes.literal("x"));
  }

  @Test
  public void traversalOrder() {
    Node nthRoot = Nodes.nthRoot(Nodes.single("3"), Nodes.single("8"));
    Node sqrt = Nodes.squareRoot(Nodes.single("8"));
    assertThat(nthRoot.kind.entrySlotFromLeft(nthRoot)).isEqualTo(Slots.INDEX);
    assertThat(sqrt.kind.entrySlotFromLeft(sqrt)).isEqualTo(Slots.RADICAND);
    assertThat(sqrt.kind.previousSlot(sqrt, Slots.RADICAND)).isNull();
    assertThat(nthRoot.kind.nextSlot(nthRoot, Slots.INDEX)).isEqualTo(Slots.RADICAND);

    Node sum = Nodes.empty(NodeKind.SUMMATION);
    assertThat(sum.kind.nextSlot(sum, Slots.LOWER)).isEqualTo(Slots.BODY);
    assertThat(sum.kind.nextSlot(sum, Slots.BODY)).isNull();
  }

  @Test
  public void operatorsBelongToBodiesAndGroupings() {
    assertThat(NodeKind.SUMMATION.acceptsOperators(Slots.BODY)).isTrue();
    assertThat(NodeKind.SUMMATION.acceptsOperators(Slots.LOWER)).isFalse();
    assertThat(NodeKind.INTEGRAL.acceptsOperators(Slots.UPPER)).isFalse();
    assertThat(NodeKind.DERIVATIVE.acceptsOperators(Slots.AT)).isFalse();
    assertThat(NodeKind.FRACTION.acceptsOperators(Slots.DENOMINATOR)).isTrue();
    assertThat(NodeKind.PARENTHESIS.acceptsOperators(Slots.CONTENT)).isTrue();
    assertThat(NodeKind.PERMUTATION.acceptsOperators(Slots.R)).isFalse();
  }
}
