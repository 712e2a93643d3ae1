package com.mysocial.relay.model;

import java.util.Arrays;

/** Ciphertext with its authentication tag appended, plus the nonce used to produce it. */
public record EncryptedContent(byte[] ciphertext, byte[] nonce) {

  public EncryptedContent {
    if (ciphertext == null || nonce == null) {
      throw new IllegalArgumentException("ciphertext and nonce are required");
    }
    ciphertext = ciphertext.clone();
    nonce = nonce.clone();
  }

  @Override
  public byte[] ciphertext() {
    return ciphertext.clone();
  }

  @Override
  public byte[] nonce() {
    return nonce.clone();
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof EncryptedContent that)) {
      return false;
    }
    return Arrays.equals(ciphertext, that.ciphertext) && Arrays.equals(nonce, that.nonce);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(ciphertext) + Arrays.hashCode(nonce);
  }

  @Override
  public String toString() {
    return "EncryptedContent[ciphertextLength=" + ciphertext.length + ", nonceLength="
        + nonce.length + "]";
  }
}
