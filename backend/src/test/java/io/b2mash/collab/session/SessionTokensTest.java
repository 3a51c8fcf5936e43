package io.b2mash.collab.session;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class SessionTokensTest {

  @Test
  void generatedTokensAreWellFormedAndDistinct() {
    var first = SessionTokens.generate();
    var second = SessionTokens.generate();

    assertThat(first).hasSize(43);
    assertThat(SessionTokens.isWellFormed(first)).isTrue();
    assertThat(first).isNotEqualTo(second);
  }

  @Test
  void rejectsMalformedTokens() {
    assertThat(SessionTokens.isWellFormed(null)).isFalse();
    assertThat(SessionTokens.isWellFormed("")).isFalse();
    assertThat(SessionTokens.isWellFormed("s:abc.signature")).isFalse();
    assertThat(SessionTokens.isWellFormed("a".repeat(42))).isFalse();
    assertThat(SessionTokens.isWellFormed("a".repeat(42) + "=")).isFalse();
  }
}
