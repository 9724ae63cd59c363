package com.gentoro.errorkit.metadata;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class RedactionsTest {

  @Test
  void sha256HexMatchesKnownDigest() {
    assertThat(Redactions.sha256Hex("abc"))
        .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
  }

  @ParameterizedTest
  @CsvSource({
    "4111111111111111, ************1111",
    "12345, *2345",
    "1234, ***4",
    "ab, *b",
    "x, x"
  })
  void last4MasksLeadingCharacters(String input, String expected) {
    assertThat(Redactions.last4(input)).isEqualTo(expected);
  }

  @Test
  void last4OfEmptyIsEmpty() {
    assertThat(Redactions.last4("")).isEmpty();
  }

  @ParameterizedTest
  @CsvSource({
    "password, REDACT",
    "db.Passphrase, REDACT",
    "client_secret, REDACT",
    "Authorization, REDACT",
    "session_id, REDACT",
    "user.otp, REDACT",
    "token, HASH",
    "api_key, HASH",
    "apikey, HASH",
    "x-api-key, HASH",
    "refresh_token, HASH",
    "accessToken, HASH",
    "card_number, LAST4",
    "iban.no, LAST4",
    "account-id, LAST4",
    "user_id, NONE",
    "card_holder, NONE",
    "request.path, NONE"
  })
  void infersDefaultFromName(String name, FieldRedaction expected) {
    assertThat(Redactions.inferDefault(name)).isEqualTo(expected);
  }

  @Test
  void sanitizedTextFollowsPolicy() {
    Field hashed = Fields.str("token", "abc");
    Field masked = Fields.str("card_number", "4111111111111111");
    Field redacted = Fields.str("password", "hunter2");
    Field plain = Fields.uuid("request", UUID.fromString("00000000-0000-0000-0000-000000000001"));

    assertThat(hashed.sanitizedText()).isEqualTo(Redactions.sha256Hex("abc"));
    assertThat(masked.sanitizedText()).isEqualTo("************1111");
    assertThat(redacted.sanitizedText()).isEqualTo(Redactions.PLACEHOLDER);
    assertThat(plain.sanitizedText()).isEqualTo("00000000-0000-0000-0000-000000000001");
  }

  @Test
  void booleansAreHashedButNeverMasked() {
    Field flag = Fields.bool("flag", true);

    assertThat(flag.withRedaction(FieldRedaction.HASH).sanitizedText())
        .isEqualTo(Redactions.sha256Hex("true"));
    assertThat(flag.withRedaction(FieldRedaction.LAST4).sanitizedText())
        .isEqualTo(Redactions.PLACEHOLDER);
  }

  @Test
  void unsignedValuesRenderAboveLongMax() {
    Field big = Fields.u64("count", -1L);

    assertThat(big.value().display()).isEqualTo("18446744073709551615");
  }
}
