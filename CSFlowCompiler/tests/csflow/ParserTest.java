package csflow;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.truth.Correspondence;

public class ParserTest {
  private static final Correspondence<Statement, Statement.Type> HAS_TYPE =
      Correspondence.transforming(Statement::type, "has type");

  private final StringBuilder file = new StringBuilder();
  private final Diagnostics diagnostics = new Diagnostics();

  private void println(String line) {
    file.append(line);
    file.append('\n');
  }

  private ImmutableList<Statement> parse() throws CompilerException {
    return parse(true);
  }

  private ImmutableList<Statement> parse(boolean strict) throws CompilerException {
    ImmutableList<Token> tokens = new Scanner("test", file.toString(), diagnostics).scan();
    return new Parser(tokens, diagnostics, strict).parse();
  }

  @Test
  public void emptyScene() throws CompilerException {
    assertThat(parse()).isEmpty();
  }

  @Test
  public void choiceWithOptions() throws CompilerException {
    println("What now?");
    println("*choice");
    println("  #Go north");
    println("    You walk north.");
    println("    *goto_scene chapter2 Start");
    println("  #Stay");
    println("    *finish");

    ImmutableList<Statement> statements = parse();

    assertThat(statements)
        .comparingElementsUsing(HAS_TYPE)
        .containsExactly(Statement.Type.PROSE, Statement.Type.CHOICE)
        .inOrder();

    Statement.Choice choice = statements.get(1).cast();
    assertThat(choice.isFake()).isFalse();
    assertThat(choice.body()).hasSize(2);

    Statement.ChoiceOption north = choice.body().get(0).cast();
    assertThat(north.text()).isEqualTo("Go north");
    assertThat(north.body())
        .comparingElementsUsing(HAS_TYPE)
        .containsExactly(Statement.Type.PROSE, Statement.Type.GOTO_SCENE)
        .inOrder();

    Statement.GotoScene gotoScene = north.body().get(1).cast();
    assertThat(gotoScene.scene()).isEqualTo("chapter2");
    assertThat(gotoScene.label()).hasValue("start");
  }

  @Test
  public void optionPrefixes() throws CompilerException {
    println("*fake_choice");
    println("  *disable_reuse *if (gold > 5) #Buy");
    println("  *selectable_if (gold > 1) #Pay ${gold}");
    println("  *if (tired)");
    println("    #Sleep");

    Statement.Choice choice = parse().get(0).cast();
    assertThat(choice.isFake()).isTrue();
    assertThat(choice.body())
        .comparingElementsUsing(HAS_TYPE)
        .containsExactly(
            Statement.Type.CHOICE_OPTION, Statement.Type.CHOICE_OPTION, Statement.Type.IF)
        .inOrder();

    Statement.ChoiceOption buy = choice.body().get(0).cast();
    assertThat(buy.reusePolicy()).hasValue(Statement.ChoiceOption.ReusePolicy.DISABLE_REUSE);
    assertThat(buy.condition().get().unwrap().toSource()).isEqualTo("gold > 5");
    assertThat(buy.selectableIf()).isEmpty();

    Statement.ChoiceOption pay = choice.body().get(1).cast();
    assertThat(pay.text()).isEqualTo("Pay ${gold}");
    assertThat(pay.condition()).isEmpty();
    assertThat(pay.selectableIf().get().toSource()).isEqualTo("(gold > 1)");
    assertThat(pay.markup()).hasSize(3);

    Statement.If guard = choice.body().get(2).cast();
    assertThat(guard.body()).comparingElementsUsing(HAS_TYPE).containsExactly(Statement.Type.CHOICE_OPTION);
  }

  @Test
  public void ifCascade() throws CompilerException {
    println("*if gold > 10");
    println("  Rich.");
    println("*elseif gold > 5");
    println("  Comfortable.");
    println("*elsif gold > 0");
    println("  Poor.");
    println("*else");
    println("  Broke.");
    println("*endif");
    println("Done.");

    ImmutableList<Statement> statements = parse();

    assertThat(statements)
        .comparingElementsUsing(HAS_TYPE)
        .containsExactly(Statement.Type.IF, Statement.Type.PROSE)
        .inOrder();

    Statement.If cascade = statements.get(0).cast();
    assertThat(cascade.condition().toSource()).isEqualTo("gold > 10");
    assertThat(cascade.elseIfs()).hasSize(2);
    assertThat(cascade.elseIfs().get(1).condition().toSource()).isEqualTo("gold > 0");
    assertThat(cascade.otherwise()).isPresent();
    assertThat(cascade.explicitEnd()).isTrue();
  }

  @Test
  public void elseAtDifferentIndentIsNotPartOfCascade() throws CompilerException {
    println("*choice");
    println("  #A");
    println("    *if x");
    println("      Yes.");
    println("  *else");
    println("    No.");

    assertThrows(CompilerException.class, this::parse);
  }

  @Test
  public void orphanElseIf() {
    println("*elseif x");
    println("  Text");

    StructureException ex = assertThrows(StructureException.class, this::parse);
    assertThat(ex.pos()).isEqualTo(new Scanner.Pos("test", 0, 0));
  }

  @Test
  public void orphanEndIfIsFatalEvenWhenLenient() {
    println("*endif");

    assertThrows(StructureException.class, () -> parse(false));
  }

  @Test
  public void expressionPrecedence() throws CompilerException {
    println("*if a + 2 * 3 > 4 and not b");
    println("  Text");

    Statement.If cascade = parse().get(0).cast();
    Expression.Binary and = cascade.condition().cast();
    assertThat(and.operator()).isEqualTo(Operator.AND);

    Expression.Binary greater = and.left().cast();
    assertThat(greater.operator()).isEqualTo(Operator.GREATER);

    Expression.Binary sum = greater.left().cast();
    assertThat(sum.operator()).isEqualTo(Operator.ADD);
    assertThat(sum.right().toSource()).isEqualTo("2 * 3");

    assertThat(and.right().type()).isEqualTo(Expression.Type.UNARY);
    assertThat(cascade.condition().toSource()).isEqualTo("a + 2 * 3 > 4 and not b");
  }

  @Test
  public void groupingRoundTrips() throws CompilerException {
    println("*if not(a or b) = (c != \"x\")");
    println("  Text");

    Statement.If cascade = parse().get(0).cast();
    assertThat(cascade.condition().toSource()).isEqualTo("not(a or b) = (c != \"x\")");
  }

  @Test
  public void declarations() throws CompilerException {
    println("*create strength 50");
    println("*temp name \"Bob\"");
    println("*temp counter");
    println("*create 5");

    ImmutableList<Statement> statements = parse();

    Statement.DeclareVariable strength = statements.get(0).cast();
    assertThat(strength.scope()).isEqualTo(Statement.DeclareVariable.Scope.GLOBAL);
    assertThat(strength.name()).hasValue("strength");
    assertThat(strength.initializer().get().toSource()).isEqualTo("50");

    Statement.DeclareVariable name = statements.get(1).cast();
    assertThat(name.scope()).isEqualTo(Statement.DeclareVariable.Scope.TEMPORARY);
    assertThat(name.initializer().get().toSource()).isEqualTo("\"Bob\"");

    Statement.DeclareVariable counter = statements.get(2).cast();
    assertThat(counter.initializer()).isEmpty();

    Statement.DeclareVariable invalid = statements.get(3).cast();
    assertThat(invalid.name()).isEmpty();
    assertThat(invalid.rawArguments()).isEqualTo("5");
  }

  @Test
  public void setOperations() throws CompilerException {
    println("*set strength %+ 10");
    println("*set gold -5");
    println("*set gold +5");
    println("*set gold *2");
    println("*set flag true");

    ImmutableList<Statement> statements = parse();

    Statement.SetVariable fairmath = statements.get(0).cast();
    assertThat(fairmath.operation()).isEqualTo(SetOperation.FAIRMATH_ADD);
    assertThat(fairmath.value().get().toSource()).isEqualTo("10");

    Statement.SetVariable subtract = statements.get(1).cast();
    assertThat(subtract.operation()).isEqualTo(SetOperation.SUBTRACT);
    assertThat(subtract.value().get().toSource()).isEqualTo("5");

    Statement.SetVariable add = statements.get(2).cast();
    assertThat(add.operation()).isEqualTo(SetOperation.ADD);

    Statement.SetVariable multiply = statements.get(3).cast();
    assertThat(multiply.operation()).isEqualTo(SetOperation.SET);
    assertThat(multiply.value().get().toSource()).isEqualTo("gold * 2");

    Statement.SetVariable flag = statements.get(4).cast();
    assertThat(flag.operation()).isEqualTo(SetOperation.SET);
    assertThat(flag.value().get().toSource()).isEqualTo("true");
  }

  @Test
  public void subroutines() throws CompilerException {
    println("*gosub Heal 10 \"potion\"");
    println("*gosub_scene shop buy");
    println("*return");

    ImmutableList<Statement> statements = parse();

    Statement.GoSub heal = statements.get(0).cast();
    assertThat(heal.label()).isEqualTo("heal");
    assertThat(heal.arguments()).hasSize(2);

    Statement.GoSubScene shop = statements.get(1).cast();
    assertThat(shop.scene()).isEqualTo("shop");
    assertThat(shop.label()).hasValue("buy");
    assertThat(shop.arguments()).isEmpty();

    assertThat(statements.get(2).type()).isEqualTo(Statement.Type.RETURN);
  }

  @Test
  public void metadataBlocks() throws CompilerException {
    println("*title The Lighthouse");
    println("*scene_list");
    println("  startup");
    println("  ending");
    println("*achievement hero visible 10 Hero of the Day");
    println("  Save the day.");
    println("  You saved the day.");
    println("*stat_chart");
    println("  percent courage Courage");

    ImmutableList<Statement> statements = parse();

    assertThat(statements)
        .comparingElementsUsing(HAS_TYPE)
        .containsExactly(
            Statement.Type.METADATA,
            Statement.Type.SCENE_LIST,
            Statement.Type.ACHIEVEMENT,
            Statement.Type.STAT_CHART)
        .inOrder();

    Statement.Metadata title = statements.get(0).cast();
    assertThat(title.field()).isEqualTo("title");
    assertThat(title.value()).isEqualTo("The Lighthouse");

    Statement.SceneList sceneList = statements.get(1).cast();
    assertThat(sceneList.scenes()).containsExactly("startup", "ending").inOrder();

    Statement.Achievement hero = statements.get(2).cast();
    assertThat(hero.id()).isEqualTo("hero");
    assertThat(hero.visible()).isTrue();
    assertThat(hero.points()).isEqualTo(10);
    assertThat(hero.title()).isEqualTo("Hero of the Day");
    assertThat(hero.preEarnedDescription()).isEqualTo("Save the day.");
    assertThat(hero.postEarnedDescription()).hasValue("You saved the day.");

    Statement.StatChart chart = statements.get(3).cast();
    assertThat(chart.entries()).containsExactly("percent courage Courage");
  }

  @Test
  public void achievementWithoutDescriptionWarns() throws CompilerException {
    println("*achievement hero visible 10 Hero");
    println("*finish");

    ImmutableList<Statement> statements = parse();

    assertThat(statements)
        .comparingElementsUsing(HAS_TYPE)
        .containsExactly(Statement.Type.ACHIEVEMENT, Statement.Type.FINISH)
        .inOrder();
    Statement.Achievement hero = statements.get(0).cast();
    assertThat(hero.points()).isEqualTo(10);
    assertThat(hero.title()).isEqualTo("Hero");
    assertThat(hero.preEarnedDescription()).isEmpty();
    assertThat(diagnostics.ofKind(Diagnostic.Kind.INVALID_DECLARATION)).hasSize(1);
  }

  @Test
  public void achievementWithOversizedPointsWarns() throws CompilerException {
    println("*achievement hero hidden 99999999999 Hero");
    println("  Save the day.");

    Statement.Achievement hero = parse().get(0).cast();

    assertThat(hero.id()).isEqualTo("hero");
    assertThat(hero.visible()).isFalse();
    assertThat(hero.points()).isEqualTo(0);
    assertThat(hero.title()).isEqualTo("Hero");
    assertThat(hero.preEarnedDescription()).isEqualTo("Save the day.");
    assertThat(diagnostics.ofKind(Diagnostic.Kind.INVALID_DECLARATION)).hasSize(1);
  }

  @Test
  public void achievementWithMalformedHeaderKeepsId() throws CompilerException {
    println("*achievement hero");
    println("  Save the day.");

    Statement.Achievement hero = parse().get(0).cast();

    assertThat(hero.id()).isEqualTo("hero");
    assertThat(hero.title()).isEqualTo("hero");
    assertThat(diagnostics.diagnostics()).hasSize(1);
    assertThat(diagnostics.diagnostics().get(0).message())
        .isEqualTo("expected *achievement <id> visible|hidden <points> <title>");
  }

  @Test
  public void unknownCommandIsFatal() {
    println("Text");
    println("  *bogus stuff");

    SyntaxException ex = assertThrows(SyntaxException.class, this::parse);
    assertThat(ex.getMessage()).isEqualTo("test:2:2:1 unknown command *bogus");
  }

  @Test
  public void passthroughCommand() throws CompilerException {
    println("*image dawn.png");

    Statement.Command command = parse().get(0).cast();
    assertThat(command.name()).isEqualTo("image");
    assertThat(command.arguments()).isEqualTo("dawn.png");
  }

  @Test
  public void gotoNeedsLabel() {
    println("*goto");

    assertThrows(SyntaxException.class, this::parse);
  }

  @Test
  public void lenientModeResynchronizes() throws CompilerException {
    println("*bogus");
    println("Skipped.");
    println("*goto end");
    println("*label end");

    ImmutableList<Statement> statements = parse(false);

    assertThat(statements)
        .comparingElementsUsing(HAS_TYPE)
        .containsExactly(Statement.Type.GOTO_LABEL, Statement.Type.LABEL)
        .inOrder();
    assertThat(diagnostics.ofKind(Diagnostic.Kind.SYNTAX)).hasSize(1);
    assertThat(diagnostics.ofKind(Diagnostic.Kind.SYNTAX).get(0).message())
        .isEqualTo("unknown command *bogus");
  }

  @Test
  public void emptyChoiceWarns() throws CompilerException {
    println("*choice");
    println("Text");

    parse();

    assertThat(diagnostics.ofKind(Diagnostic.Kind.INDENTATION)).hasSize(1);
  }
}
