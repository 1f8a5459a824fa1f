package mathedit.impl;

import mathedit.nodes.Node;
import mathedit.nodes.Nodes;
import org.junit.jupiter.api.Test;

import java.util.List;

import static mathedit.Shapes.shape;
import static org.assertj.core.api.Assertions.assertThat;

public class MultiplicationChainTest {

  @Test
  public void keepsTextBeforeTheOperand() {
    Node fraction = Nodes.fraction(Nodes.single("1"), Nodes.single("2"));
    List<Node> siblings = Nodes.list(Nodes.literal("2+3"), fraction);

    MultiplicationChain chain = MultiplicationChain.collect(siblings, 1);
    assertThat(Nodes.shape(chain.nodes)).isEqualTo(shape("['3', FRACTION(num=['1'], den=['2'])]"));
    assertThat(chain.prefixToKeep).isEqualTo("2+");
    assertThat(chain.prefixNodeIndex).isEqualTo(0);
    assertThat(chain.removeStart()).isEqualTo(1);
    assertThat(chain.nodes.get(1)).isSameAs(fraction);

    int at = chain.detach(siblings, 1);
    assertThat(at).isEqualTo(1);
    assertThat(Nodes.shape(siblings)).isEqualTo(shape("['2+']"));
  }

  @Test
  public void continuesAcrossExplicitMultiply() {
    List<Node> siblings = Nodes.list(Nodes.literal("12"),
                                     Nodes.literal("×"),
                                     Nodes.fraction(Nodes.single("1"), Nodes.single("2")));
    MultiplicationChain chain = MultiplicationChain.collect(siblings, 2);
    assertThat(Nodes.shape(chain.nodes)).isEqualTo(shape("['12', '×', FRACTION(num=['1'], den=['2'])]"));
    assertThat(chain.prefixToKeep).isNull();
    assertThat(chain.removeStart()).isEqualTo(0);
  }

  @Test
  public void stopsAtLineBreak() {
    Node fraction = Nodes.fraction(Nodes.single("1"), Nodes.single("2"));
    List<Node> siblings = Nodes.list(Nodes.literal("5"), Nodes.newline(), fraction);
    MultiplicationChain chain = MultiplicationChain.collect(siblings, 2);
    assertThat(chain.nodes).containsExactly(fraction);
    assertThat(chain.removeFromIndex).isEqualTo(2);
  }

  @Test
  public void skipsEmptyLiterals() {
    Node root = Nodes.squareRoot(Nodes.single("2"));
    List<Node> siblings = Nodes.list(Nodes.literal("x"), root, Nodes.literal(""));
    MultiplicationChain chain = MultiplicationChain.collect(siblings, 2);
    assertThat(Nodes.shape(chain.nodes)).isEqualTo(shape("['x', ROOT:sqrt(index=['2'], radicand=['2'])]"));
  }

  @Test
  public void emptyAfterOperator() {
    assertThat(MultiplicationChain.collect(Nodes.single("1+"), 0).isEmpty()).isTrue();
    assertThat(MultiplicationChain.collect(Nodes.single(""), 0).isEmpty()).isTrue();
  }

  @Test
  public void fractionBoundaryKeepsScientificExponent() {
    List<Node> siblings = Nodes.single("2ᴇ−3");
    assertThat(Nodes.shape(MultiplicationChain.collect(siblings, 0, Chars.FRACTION).nodes)).isEqualTo(shape("['2ᴇ−3']"));
    assertThat(Nodes.shape(MultiplicationChain.collect(siblings, 0).nodes)).isEqualTo(shape("['3']"));
  }
}
