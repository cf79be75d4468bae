package com.statusio.common;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class SecretRedactorTest {

  @Test
  void redactKeepsHeadAndTail() {
    assertThat(SecretRedactor.redact("ABCD1234567890WXYZ")).isEqualTo("ABCD…WXYZ");
  }

  @Test
  void redactTrimsBeforeMasking() {
    assertThat(SecretRedactor.redact("  ABCD1234567890WXYZ \n")).isEqualTo("ABCD…WXYZ");
  }

  @Test
  void redactReturnsNoneForMissingSecret() {
    assertThat(SecretRedactor.redact(null)).isEqualTo(SecretRedactor.NONE);
    assertThat(SecretRedactor.redact("   ")).isEqualTo(SecretRedactor.NONE);
  }

  @Test
  void redactHidesShortSecretsEntirely() {
    assertThat(SecretRedactor.redact("abc12345")).isEqualTo("…(8)").doesNotContain("abc");
  }

  @Test
  void secretsDifferingOnlyInTheMiddleShareRedactedForm() {
    assertThat(SecretRedactor.redact("ABCD-first-secret-WXYZ"))
        .isEqualTo(SecretRedactor.redact("ABCD-other-secret-WXYZ"));
  }
}
