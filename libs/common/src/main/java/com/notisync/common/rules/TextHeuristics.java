package com.notisync.common.rules;

import java.util.List;
import java.util.Locale;

/** Keyword and numeric-code heuristics shared by the built-in rule types and the classifier. */
public final class TextHeuristics {

  public static final List<String> OTP_KEYWORDS =
      List.of(
          "otp",
          "one time password",
          "auth code",
          "security code",
          "login code",
          "2fa",
          "two factor",
          "confirmation code",
          "access code");

  public static final List<String> VERIFICATION_KEYWORDS = List.of("verification code", "verify");

  public static final List<String> PROMOTIONAL_KEYWORDS =
      List.of(
          "sale",
          "discount",
          "offer",
          "deal",
          "promotion",
          "coupon",
          "limited time",
          "buy now",
          "shop",
          "free shipping",
          "% off",
          "unsubscribe",
          "marketing",
          "newsletter");

  private static final int OTP_MIN_DIGITS = 4;
  private static final int OTP_MAX_DIGITS = 8;

  private TextHeuristics() {}

  /**
   * True for explicit OTP keywords, for "verification code"/"verify" next to a 4-8 digit
   * token, and for any standalone 4-8 digit token.
   */
  public static boolean looksLikeOtp(String text) {
    if (text == null || text.isBlank()) {
      return false;
    }
    final String lower = text.toLowerCase(Locale.ROOT);
    if (containsAny(lower, OTP_KEYWORDS)) {
      return true;
    }
    if (containsAny(lower, VERIFICATION_KEYWORDS)
        && containsNumericToken(lower, OTP_MIN_DIGITS, OTP_MAX_DIGITS, "-:")) {
      return true;
    }
    return containsNumericToken(lower, OTP_MIN_DIGITS, OTP_MAX_DIGITS, "-");
  }

  public static boolean looksPromotional(String text, List<String> keywords) {
    if (text == null || text.isBlank()) {
      return false;
    }
    return containsAny(text.toLowerCase(Locale.ROOT), lowerAll(keywords));
  }

  /**
   * Looks for a whitespace-separated word made only of digits once {@code separators} and
   * surrounding punctuation are stripped.
   */
  public static boolean containsNumericToken(
      String text, int minDigits, int maxDigits, String separators) {
    if (text == null) {
      return false;
    }
    for (String word : text.trim().split("\\s+")) {
      String cleaned = stripEdgePunctuation(word);
      for (int i = 0; i < separators.length(); i++) {
        cleaned = cleaned.replace(String.valueOf(separators.charAt(i)), "");
      }
      if (cleaned.length() >= minDigits
          && cleaned.length() <= maxDigits
          && cleaned.chars().allMatch(ch -> ch >= '0' && ch <= '9')) {
        return true;
      }
    }
    return false;
  }

  public static boolean containsAny(String lowerText, List<String> lowerKeywords) {
    for (String keyword : lowerKeywords) {
      if (lowerText.contains(keyword)) {
        return true;
      }
    }
    return false;
  }

  private static List<String> lowerAll(List<String> keywords) {
    return keywords.stream().map(keyword -> keyword.toLowerCase(Locale.ROOT)).toList();
  }

  private static String stripEdgePunctuation(String word) {
    int start = 0;
    int end = word.length();
    while (start < end && isEdgePunctuation(word.charAt(start))) {
      start++;
    }
    while (end > start && isEdgePunctuation(word.charAt(end - 1))) {
      end--;
    }
    return word.substring(start, end);
  }

  private static boolean isEdgePunctuation(char ch) {
    return ".,;!?()[]\"'".indexOf(ch) >= 0;
  }
}
