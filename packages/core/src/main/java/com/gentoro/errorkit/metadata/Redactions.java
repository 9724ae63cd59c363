package com.gentoro.errorkit.metadata;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/** Redaction primitives shared by the renderers and the problem-details builder. */
public final class Redactions {
  public static final String PLACEHOLDER = "[REDACTED]";

  private static final String[] REDACT_MARKERS = {
    "password", "passphrase", "secret", "authorization", "cookie", "session", "jwt", "bearer",
    "otp", "pin"
  };
  private static final String[] CARD_SEGMENTS = {"card", "iban", "pan", "account", "acct"};
  private static final String[] NUMBER_SEGMENTS = {"number", "no", "id"};

  private Redactions() {}

  /** Lowercase hex SHA-256 of the UTF-8 bytes of {@code text}. */
  public static String sha256Hex(String text) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      // Every JRE ships SHA-256.
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  /**
   * Masks everything except the trailing characters: four are kept, or one when the input has
   * four characters or fewer.
   */
  public static String last4(String text) {
    int length = text.codePointCount(0, text.length());
    if (length == 0) return "";
    int keep = length <= 4 ? 1 : 4;
    int cut = text.offsetByCodePoints(0, length - keep);
    return "*".repeat(length - keep) + text.substring(cut);
  }

  /**
   * Default policy for a field, derived from its name. Credentials are redacted, token and API
   * key names are hashed, card or account numbers keep their last four characters.
   */
  public static FieldRedaction inferDefault(String name) {
    if (name == null || name.isEmpty()) return FieldRedaction.NONE;
    String lower = name.toLowerCase(Locale.ROOT);
    for (String marker : REDACT_MARKERS) {
      if (lower.contains(marker)) return FieldRedaction.REDACT;
    }

    String[] segments = lower.split("[._\\-:/]");
    boolean containsKey = lower.contains("key");
    boolean containsToken = lower.contains("token");
    boolean cardLike = false;
    boolean numberLike = false;
    for (String segment : segments) {
      if (segment.isEmpty()) continue;
      if (segment.equals("token") || segment.equals("apikey") || segment.equals("key")) {
        return FieldRedaction.HASH;
      }
      if (segment.endsWith("token")) return FieldRedaction.HASH;
      if (segment.equals("api") && containsKey) return FieldRedaction.HASH;
      if ((segment.equals("access") || segment.equals("refresh")) && containsToken) {
        return FieldRedaction.HASH;
      }
      cardLike |= matchesAny(segment, CARD_SEGMENTS);
      numberLike |= matchesAny(segment, NUMBER_SEGMENTS);
    }
    return cardLike && numberLike ? FieldRedaction.LAST4 : FieldRedaction.NONE;
  }

  private static boolean matchesAny(String segment, String[] candidates) {
    for (String candidate : candidates) {
      if (candidate.equals(segment)) return true;
    }
    return false;
  }
}
