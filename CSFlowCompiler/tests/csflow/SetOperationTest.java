package csflow;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public class SetOperationTest {
  @Test
  public void leadingOperators() {
    assertThat(SetOperation.forOperator(Operator.ADD)).hasValue(SetOperation.ADD);
    assertThat(SetOperation.forOperator(Operator.SUBTRACT)).hasValue(SetOperation.SUBTRACT);
    assertThat(SetOperation.forOperator(Operator.FAIRMATH_ADD)).hasValue(SetOperation.FAIRMATH_ADD);
    assertThat(SetOperation.forOperator(Operator.FAIRMATH_SUBTRACT))
        .hasValue(SetOperation.FAIRMATH_SUBTRACT);
    assertThat(SetOperation.forOperator(Operator.MULTIPLY)).isEmpty();
    assertThat(SetOperation.forOperator(Operator.EQUALS)).isEmpty();
  }

  @Test
  public void plainArithmetic() {
    assertThat(SetOperation.SET.apply(40, 7)).isEqualTo(7.0);
    assertThat(SetOperation.ADD.apply(40, 7)).isEqualTo(47.0);
    assertThat(SetOperation.SUBTRACT.apply(40, 7)).isEqualTo(33.0);
  }

  @Test
  public void fairmathApproachesBounds() {
    assertThat(SetOperation.FAIRMATH_ADD.apply(50, 20)).isEqualTo(60.0);
    assertThat(SetOperation.FAIRMATH_ADD.apply(90, 50)).isEqualTo(95.0);
    assertThat(SetOperation.FAIRMATH_SUBTRACT.apply(50, 20)).isEqualTo(40.0);
    assertThat(SetOperation.FAIRMATH_SUBTRACT.apply(0, 50)).isEqualTo(0.0);
    assertThat(SetOperation.FAIRMATH_ADD.isFairmath()).isTrue();
    assertThat(SetOperation.ADD.isFairmath()).isFalse();
  }

  @Test
  public void fairmathNeedsPercentage() {
    assertThrows(IllegalArgumentException.class, () -> SetOperation.FAIRMATH_ADD.apply(120, 10));
  }

  @Test
  public void labels() {
    assertThat(SetOperation.FAIRMATH_SUBTRACT.label()).isEqualTo("fairmath_subtract");
  }
}
