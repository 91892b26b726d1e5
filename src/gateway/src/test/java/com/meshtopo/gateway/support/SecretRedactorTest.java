package com.meshtopo.gateway.support;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class SecretRedactorTest {

  @Test
  void masksEverySecretLongestFirst() {
    SecretRedactor redactor = new SecretRedactor(Arrays.asList("KEY", "KEY_LONG", null, " "));

    assertThat(redactor.redact("url /report/KEY_LONG?id=1 and /report/KEY"))
        .isEqualTo("url /report/<REDACTED>?id=1 and /report/<REDACTED>");
  }

  @Test
  void escapesLineBreaks() {
    SecretRedactor redactor = new SecretRedactor(List.of("S3CRET"));

    assertThat(redactor.redact("line\nforged S3CRET\r")).isEqualTo("line\\nforged <REDACTED>\\r");
    assertThat(LogSanitizer.sanitize(null)).isEqualTo("null");
  }
}
