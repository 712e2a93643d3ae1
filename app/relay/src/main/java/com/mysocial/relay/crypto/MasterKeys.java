/*
 * Where: Relay crypto
 * What: Decodes the configured master key into 32 bytes
 * Why: Operators provide either 64 hex characters or a passphrase-style secret
 */
package com.mysocial.relay.crypto;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.regex.Pattern;

public final class MasterKeys {

  public static final int KEY_LENGTH_BYTES = 32;

  private static final Pattern HEX_KEY = Pattern.compile("^[0-9a-fA-F]{64}$");

  private MasterKeys() {}

  /**
   * Hex input of exactly 64 characters is decoded; any other value is taken as UTF-8 bytes,
   * zero-padded or truncated to 32 bytes.
   */
  public static byte[] decode(String configured) {
    if (configured == null || configured.isBlank()) {
      throw new IllegalStateException("relay.encryption.master-key must be set");
    }
    final String trimmed = configured.trim();
    if (HEX_KEY.matcher(trimmed).matches()) {
      return HexFormat.of().parseHex(trimmed);
    }
    return Arrays.copyOf(trimmed.getBytes(StandardCharsets.UTF_8), KEY_LENGTH_BYTES);
  }

  public static boolean isHex(String configured) {
    return configured != null && HEX_KEY.matcher(configured.trim()).matches();
  }
}
