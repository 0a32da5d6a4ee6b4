package com.codeheadsystems.curvecrypt.common;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.security.SecureRandom;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class RandomProviderTest {

  @Test
  void usesSuppliedSecureRandom() {
    SecureRandom custom = new SecureRandom();
    assertThat(new RandomProvider(custom).random()).isSameAs(custom);
    assertThat(new RandomProvider().random()).isNotNull();
  }

  @Test
  void rejectsNullRandom() {
    assertThatThrownBy(() -> new RandomProvider(null)).isInstanceOf(NullPointerException.class);
  }

  @ParameterizedTest
  @ValueSource(ints = {0, 1, 16, 32, 64})
  void randomBytes_length(int length) {
    assertThat(new RandomProvider().randomBytes(length)).hasSize(length);
  }

  @Test
  void randomBytes_negativeLength() {
    assertThatThrownBy(() -> new RandomProvider().randomBytes(-1))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("-1");
  }

  @Test
  void randomBytes_freshEachCall() {
    RandomProvider provider = new RandomProvider();
    assertThat(provider.randomBytes(16)).isNotEqualTo(provider.randomBytes(16));
  }
}
