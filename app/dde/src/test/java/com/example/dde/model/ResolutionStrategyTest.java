package com.example.dde.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class ResolutionStrategyTest {

  @Test
  void fromValueIgnoresCaseAndSurroundingSpace() {
    assertThat(ResolutionStrategy.fromValue(" Second_Correct "))
        .isEqualTo(ResolutionStrategy.SECOND_CORRECT);
    assertThat(ResolutionStrategy.fromValue("adjudicated")).isEqualTo(ResolutionStrategy.ADJUDICATED);
  }

  @Test
  void fromValueRejectsBlankAndUnknown() {
    assertThatThrownBy(() -> ResolutionStrategy.fromValue(""))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageStartingWith("resolution is required");
    assertThatThrownBy(() -> ResolutionStrategy.fromValue("both_wrong"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("unsupported resolution: both_wrong");
  }

  @Test
  void onlyNewValueAndAdjudicatedRequireCallerValue() {
    assertThat(ResolutionStrategy.NEW_VALUE.requiresNewValue()).isTrue();
    assertThat(ResolutionStrategy.ADJUDICATED.requiresNewValue()).isTrue();
    assertThat(ResolutionStrategy.FIRST_CORRECT.requiresNewValue()).isFalse();
    assertThat(ResolutionStrategy.SECOND_CORRECT.requiresNewValue()).isFalse();
  }
}
