package io.bunting.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class IdentifierKeysTest {

  @Test
  void acceptsCompiledKeys() {
    assertThat(IdentifierKeys.validate("dark_mode")).isEmpty();
    assertThat(IdentifierKeys.validate("ab")).isEmpty();
    assertThat(IdentifierKeys.isValid("a".repeat(64))).isTrue();
  }

  @ParameterizedTest
  @CsvSource({
    "'', EMPTY",
    "Dark_Mode, INVALID_CHARACTERS",
    "dark-mode, INVALID_CHARACTERS",
    "mode2, INVALID_CHARACTERS",
    "_dark, LEADING_UNDERSCORE",
    "dark_, TRAILING_UNDERSCORE",
    "a, TOO_SHORT"
  })
  void rejectsWithDistinctErrors(String key, KeyError expected) {
    assertThat(IdentifierKeys.validate(key)).contains(expected);
  }

  @Test
  void rejectsNullAndOverlongKeys() {
    assertThat(IdentifierKeys.validate(null)).contains(KeyError.EMPTY);
    assertThat(IdentifierKeys.validate("a".repeat(65))).contains(KeyError.TOO_LONG);
  }

  @Test
  void namespacedKeysValidatePerSegment() {
    assertThat(IdentifierKeys.validateNamespaced("store/new_paywall")).isEmpty();
    assertThat(IdentifierKeys.validateNamespaced("store/_paywall"))
        .contains(KeyError.LEADING_UNDERSCORE);
    assertThat(IdentifierKeys.validateNamespaced("store//paywall")).contains(KeyError.EMPTY);
    assertThat(IdentifierKeys.validate("store/new_paywall"))
        .contains(KeyError.INVALID_CHARACTERS);
  }

  @Test
  void requireValidCarriesTheError() {
    assertThat(IdentifierKeys.requireValid("dark_mode")).isEqualTo("dark_mode");
    assertThatThrownBy(() -> IdentifierKeys.requireValid("_x"))
        .isInstanceOf(Exceptions.InvalidKeyException.class)
        .satisfies(
            e -> {
              final Exceptions.InvalidKeyException invalid = (Exceptions.InvalidKeyException) e;
              assertThat(invalid.getError()).isEqualTo(KeyError.LEADING_UNDERSCORE);
              assertThat(invalid.getKey()).isEqualTo("_x");
            })
        .hasMessageContaining("Key cannot start with underscore");
  }

  @Test
  void normalizesFreeFormInput() {
    assertThat(IdentifierKeys.normalize("Store: Use New Paywall Design"))
        .isEqualTo("store_use_new_paywall_design");
    assertThat(IdentifierKeys.normalize("  --Dark   Mode 2!! "))
        .isEqualTo("dark_mode");
    assertThat(IdentifierKeys.normalize("store/new-paywall")).isEqualTo("store_new_paywall");
    assertThat(IdentifierKeys.normalize("")).isEmpty();
  }

  @Test
  void normalizeTruncatesWithoutLeavingATrailingUnderscore() {
    final String input = "a".repeat(63) + " b" + "c".repeat(10);

    final String key = IdentifierKeys.normalize(input);

    assertThat(key).isEqualTo("a".repeat(63));
    assertThat(IdentifierKeys.isValid(key)).isTrue();
  }

  @Test
  void normalizedKeysAreValidWhenLongEnough() {
    for (String input : new String[] {"Hello World", "ÄÖ über flag", "x__y", "Checkout V2 Flow"}) {
      assertThat(IdentifierKeys.isValid(IdentifierKeys.normalize(input)))
          .as("normalize(%s)", input)
          .isTrue();
    }
  }

  @Test
  void displayNameTitleCasesWords() {
    assertThat(IdentifierKeys.displayName("store_new_paywall")).isEqualTo("Store New Paywall");
  }

  @Test
  void conditionIdsAllowDigitsAndHyphens() {
    assertThat(IdentifierKeys.validateConditionId("cond-1_a")).isEmpty();
    assertThat(IdentifierKeys.validateConditionId("Cond 1")).isPresent();
    assertThat(IdentifierKeys.validateConditionId("")).isPresent();
    assertThat(IdentifierKeys.validateConditionId("c".repeat(65))).isPresent();
  }

  @Test
  void appIdentifiersAreReverseDomainLike() {
    assertThat(IdentifierKeys.validateAppIdentifier("com.example.app")).isEmpty();
    assertThat(IdentifierKeys.validateAppIdentifier("com.Example.App")).isPresent();
    assertThat(IdentifierKeys.validateAppIdentifier("a".repeat(129))).isPresent();
  }
}
