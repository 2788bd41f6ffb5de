package com.simbridge.bridge.relay;

import java.security.SecureRandom;
import java.util.Random;

/**
 * Human-readable session codes in the form {@code XXXX-XXXX}.
 *
 * <p>The alphabet leaves out {@code 0}, {@code O}, {@code 1} and {@code I}.
 */
public final class SessionCodeGenerator {
  static final String ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789";

  private final Random random;

  public SessionCodeGenerator() {
    this(new SecureRandom());
  }

  SessionCodeGenerator(Random random) {
    this.random = random;
  }

  public String next() {
    StringBuilder code = new StringBuilder(9);
    for (int i = 0; i < 8; i++) {
      if (i == 4) {
        code.append('-');
      }
      code.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
    }
    return code.toString();
  }

  public static boolean isValid(String code) {
    if (code == null || code.length() != 9 || code.charAt(4) != '-') {
      return false;
    }
    for (int i = 0; i < code.length(); i++) {
      if (i != 4 && ALPHABET.indexOf(code.charAt(i)) < 0) {
        return false;
      }
    }
    return true;
  }
}
