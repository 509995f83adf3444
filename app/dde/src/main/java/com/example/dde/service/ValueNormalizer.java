package com.example.dde.service;

import java.util.Locale;

/** 比較用の正規化。null は空文字、前後の空白を除去し、Locale.ROOT で小文字化する。 */
public final class ValueNormalizer {

  private ValueNormalizer() {}

  public static String normalize(String raw) {
    if (raw == null) {
      return "";
    }
    int start = 0;
    int end = raw.length();
    while (start < end && isTrimmable(raw.charAt(start))) {
      start++;
    }
    while (end > start && isTrimmable(raw.charAt(end - 1))) {
      end--;
    }
    return raw.substring(start, end).toLowerCase(Locale.ROOT);
  }

  // NBSP などの Unicode 空白と BOM も前後の空白として扱う
  private static boolean isTrimmable(char c) {
    return Character.isWhitespace(c) || Character.isSpaceChar(c) || c == '\uFEFF';
  }

  public static boolean sameValue(String first, String second) {
    return normalize(first).equals(normalize(second));
  }
}
