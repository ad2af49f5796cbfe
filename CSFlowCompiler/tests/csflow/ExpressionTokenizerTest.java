package csflow;

import static com.google.common.truth.Truth.assertThat;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.truth.Correspondence;

public class ExpressionTokenizerTest {
  private static final Correspondence<Token, Token.Type> HAS_TYPE =
      Correspondence.transforming(Token::type, "has type");
  private static final Correspondence<Token, String> HAS_TEXT =
      Correspondence.transforming(Token::text, "has text");

  private final Diagnostics diagnostics = new Diagnostics();

  private ImmutableList<Token> tokenize(String text) {
    return new ExpressionTokenizer("test", diagnostics).tokenize(text, 0, 0, 0);
  }

  @Test
  public void comparisonAndLogic() {
    ImmutableList<Token> tokens = tokenize("gold >= 10 and not flag");

    assertThat(tokens)
        .comparingElementsUsing(HAS_TYPE)
        .containsExactly(
            Token.Type.IDENTIFIER,
            Token.Type.OPERATOR,
            Token.Type.NUMBER,
            Token.Type.OPERATOR,
            Token.Type.OPERATOR,
            Token.Type.IDENTIFIER)
        .inOrder();
    assertThat(tokens.get(1).isOperator(Operator.GREATER_EQUALS)).isTrue();
    assertThat(tokens.get(3).isOperator(Operator.AND)).isTrue();
    assertThat(tokens.get(4).isOperator(Operator.NOT)).isTrue();
  }

  @Test
  public void numbers() {
    ImmutableList<Token> tokens = tokenize("3.5 42");

    assertThat(tokens).comparingElementsUsing(HAS_TEXT).containsExactly("3.5", "42").inOrder();
    assertThat(tokens.get(0).numberValue()).isEqualTo(3.5);
  }

  @Test
  public void booleans() {
    ImmutableList<Token> tokens = tokenize("true false");

    assertThat(tokens).comparingElementsUsing(HAS_TYPE).containsExactly(Token.Type.BOOLEAN, Token.Type.BOOLEAN);
    assertThat(tokens.get(0).booleanValue()).isTrue();
    assertThat(tokens.get(1).booleanValue()).isFalse();
  }

  @Test
  public void stringsUnescape() {
    ImmutableList<Token> tokens = tokenize("\"say \\\"hi\\\"\" & 'it''s'");

    assertThat(tokens)
        .comparingElementsUsing(HAS_TYPE)
        .containsExactly(
            Token.Type.STRING, Token.Type.OPERATOR, Token.Type.STRING, Token.Type.STRING)
        .inOrder();
    assertThat(tokens.get(0).text()).isEqualTo("say \"hi\"");
    assertThat(tokens.get(1).isOperator(Operator.CONCATENATE)).isTrue();
    assertThat(diagnostics.isEmpty()).isTrue();
  }

  @Test
  public void fairmathAndModulo() {
    ImmutableList<Token> tokens = tokenize("%+ 10 %- 5 % 2 modulo 3");

    assertThat(tokens.get(0).isOperator(Operator.FAIRMATH_ADD)).isTrue();
    assertThat(tokens.get(2).isOperator(Operator.FAIRMATH_SUBTRACT)).isTrue();
    assertThat(tokens.get(4).isOperator(Operator.MODULO)).isTrue();
    assertThat(tokens.get(6).isOperator(Operator.MODULO)).isTrue();
  }

  @Test
  public void printMarkers() {
    assertThat(tokenize("${name} $!{name} $!!{name}"))
        .comparingElementsUsing(HAS_TYPE)
        .containsExactly(
            Token.Type.OPEN_PRINT,
            Token.Type.IDENTIFIER,
            Token.Type.CLOSE_BRACE,
            Token.Type.OPEN_PRINT_CAPITALIZED,
            Token.Type.IDENTIFIER,
            Token.Type.CLOSE_BRACE,
            Token.Type.OPEN_PRINT_UPPERCASE,
            Token.Type.IDENTIFIER,
            Token.Type.CLOSE_BRACE)
        .inOrder();
  }

  @Test
  public void multiReplace() {
    assertThat(tokenize("@{flag yes|no}"))
        .comparingElementsUsing(HAS_TYPE)
        .containsExactly(
            Token.Type.OPEN_MULTI_REPLACE,
            Token.Type.IDENTIFIER,
            Token.Type.IDENTIFIER,
            Token.Type.MULTI_REPLACE_SEPARATOR,
            Token.Type.IDENTIFIER,
            Token.Type.CLOSE_BRACE)
        .inOrder();
  }

  @Test
  public void unknownCharacterIsSkipped() {
    ImmutableList<Token> tokens = tokenize("a ^ b");

    assertThat(tokens).comparingElementsUsing(HAS_TEXT).containsExactly("a", "b").inOrder();
    assertThat(diagnostics.ofKind(Diagnostic.Kind.LEXICAL)).hasSize(1);
    assertThat(diagnostics.diagnostics().get(0).pos()).isEqualTo(new Scanner.Pos("test", 0, 2));
  }

  @Test
  public void positionsAreOffset() {
    ImmutableList<Token> tokens =
        new ExpressionTokenizer("test", diagnostics).tokenize(" x", 3, 10, 1.5);

    assertThat(tokens).hasSize(1);
    assertThat(tokens.get(0).pos()).isEqualTo(new Scanner.Pos("test", 3, 11));
    assertThat(tokens.get(0).indent()).isEqualTo(1.5);
  }
}
