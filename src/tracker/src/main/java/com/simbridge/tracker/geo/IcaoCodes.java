package com.simbridge.tracker.geo;

import java.util.Locale;

public final class IcaoCodes {
  private IcaoCodes() {}

  /** True for 3 or 4 ASCII letters, nothing else. */
  public static boolean isValid(String code) {
    if (code == null) {
      return false;
    }
    String trimmed = code.trim();
    if (trimmed.length() < 3 || trimmed.length() > 4) {
      return false;
    }
    for (int i = 0; i < trimmed.length(); i++) {
      char c = trimmed.charAt(i);
      if (!((c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z'))) {
        return false;
      }
    }
    return true;
  }

  /** Returns the trimmed upper-case code when valid, otherwise null. */
  public static String normalize(String code) {
    return isValid(code) ? code.trim().toUpperCase(Locale.ROOT) : null;
  }
}
