/*
 * Where: Relay crypto
 * What: Per-conversation key derivation (HKDF-SHA256) and AES-256-GCM message encryption
 * Why: A leaked conversation key exposes one conversation, and tampered rows fail loudly
 */
package com.mysocial.relay.crypto;

import com.google.common.annotations.VisibleForTesting;
import com.mysocial.relay.config.EncryptionProperties;
import com.mysocial.relay.model.EncryptedContent;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.InvalidAlgorithmParameterException;
import java.security.SecureRandom;
import java.util.Arrays;
import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.Mac;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

@Component
public class MessageEncryptionEngine {

  static final int NONCE_LENGTH_BYTES = 12;
  static final int TAG_LENGTH_BITS = 128;

  private static final Logger logger = LoggerFactory.getLogger(MessageEncryptionEngine.class);
  private static final String HMAC_ALGORITHM = "HmacSHA256";
  private static final String CIPHER_TRANSFORMATION = "AES/GCM/NoPadding";
  private static final String KEY_ALGORITHM = "AES";
  private static final int HASH_LENGTH_BYTES = 32;

  private final byte[] pseudoRandomKey;
  private final SecureRandom secureRandom;

  @Autowired
  public MessageEncryptionEngine(EncryptionProperties properties) {
    this(MasterKeys.decode(properties.masterKey()), new SecureRandom());
    if (!MasterKeys.isHex(properties.masterKey())) {
      logger.warn("relay.encryption.master-key is not 64 hex characters; using padded raw bytes");
    }
  }

  @VisibleForTesting
  MessageEncryptionEngine(byte[] masterKey, SecureRandom secureRandom) {
    // HKDF-Extract with an all-zero salt; the conversation id enters at the expand step
    this.pseudoRandomKey = hmac(new byte[HASH_LENGTH_BYTES], masterKey);
    this.secureRandom = secureRandom;
  }

  /** HKDF-Expand of the master key with the conversation id as info, one 32-byte block. */
  public ConversationKey deriveKey(String conversationId) {
    if (conversationId == null || conversationId.isBlank()) {
      throw new IllegalArgumentException("conversationId is required");
    }
    final byte[] info = conversationId.getBytes(StandardCharsets.UTF_8);
    final byte[] block =
        ByteBuffer.allocate(info.length + 1).put(info).put((byte) 0x01).array();
    final byte[] okm = hmac(pseudoRandomKey, block);
    try {
      return new ConversationKey(
          conversationId,
          new SecretKeySpec(Arrays.copyOf(okm, MasterKeys.KEY_LENGTH_BYTES), KEY_ALGORITHM));
    } finally {
      Arrays.fill(okm, (byte) 0);
    }
  }

  public EncryptedContent encrypt(ConversationKey key, String plaintext) {
    if (plaintext == null) {
      throw new IllegalArgumentException("plaintext is required");
    }
    // a fresh random 96-bit nonce per call; GCM nonces must never repeat under one key
    final byte[] nonce = new byte[NONCE_LENGTH_BYTES];
    secureRandom.nextBytes(nonce);
    try {
      final Cipher cipher = Cipher.getInstance(CIPHER_TRANSFORMATION);
      cipher.init(
          Cipher.ENCRYPT_MODE, key.secretKey(), new GCMParameterSpec(TAG_LENGTH_BITS, nonce));
      cipher.updateAAD(associatedData(key));
      final byte[] ciphertext = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
      return new EncryptedContent(ciphertext, nonce);
    } catch (GeneralSecurityException ex) {
      throw new IllegalStateException("message encryption failed", ex);
    }
  }

  /**
   * Decrypts content stored for the key's conversation.
   *
   * @throws MessageAuthenticationException when the tag does not verify under this key
   */
  public String decrypt(ConversationKey key, EncryptedContent content) {
    try {
      final Cipher cipher = Cipher.getInstance(CIPHER_TRANSFORMATION);
      cipher.init(
          Cipher.DECRYPT_MODE,
          key.secretKey(),
          new GCMParameterSpec(TAG_LENGTH_BITS, content.nonce()));
      cipher.updateAAD(associatedData(key));
      return new String(cipher.doFinal(content.ciphertext()), StandardCharsets.UTF_8);
    } catch (AEADBadTagException | InvalidAlgorithmParameterException ex) {
      throw new MessageAuthenticationException(
          "message authentication failed conversationId=" + key.conversationId(), ex);
    } catch (GeneralSecurityException ex) {
      throw new IllegalStateException("message decryption failed", ex);
    }
  }

  private static byte[] associatedData(ConversationKey key) {
    return key.conversationId().getBytes(StandardCharsets.UTF_8);
  }

  private static byte[] hmac(byte[] key, byte[] data) {
    try {
      final Mac mac = Mac.getInstance(HMAC_ALGORITHM);
      mac.init(new SecretKeySpec(key, HMAC_ALGORITHM));
      return mac.doFinal(data);
    } catch (GeneralSecurityException ex) {
      throw new IllegalStateException("HmacSHA256 is unavailable", ex);
    }
  }
}
