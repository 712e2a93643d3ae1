/*
 * Where: Relay crypto tests
 * What: HKDF derivation, AES-GCM round trip and authentication failures
 */
package com.mysocial.relay.crypto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.mysocial.relay.config.EncryptionProperties;
import com.mysocial.relay.model.EncryptedContent;
import java.security.SecureRandom;
import java.util.HexFormat;
import org.junit.jupiter.api.Test;

class MessageEncryptionEngineTest {

  private static final String MASTER_KEY_HEX =
      "000102030405060708090a0b0c0d0e0f101112131415161718191a1b1c1d1e1f";
  private static final String CONVERSATION = "0xalice:0xbob";

  private final MessageEncryptionEngine engine =
      new MessageEncryptionEngine(new EncryptionProperties(MASTER_KEY_HEX));

  @Test
  void deriveKeyMatchesHkdfSha256KnownAnswer() {
    final ConversationKey key = engine.deriveKey(CONVERSATION);

    // HKDF-SHA256, zero salt, info = conversation id, L = 32
    assertThat(HexFormat.of().formatHex(key.secretKey().getEncoded()))
        .isEqualTo("08900f10304897a9b244768e90f6945fd1530bf6cc38f20d9cacb72ca89b9d9a");
    assertThat(key.conversationId()).isEqualTo(CONVERSATION);
  }

  @Test
  void deriveKeyIsDeterministicAndPerConversation() {
    final ConversationKey first = engine.deriveKey(CONVERSATION);
    final ConversationKey again = engine.deriveKey(CONVERSATION);
    final ConversationKey other = engine.deriveKey("0xalice:0xcarol");

    assertThat(again.secretKey().getEncoded()).isEqualTo(first.secretKey().getEncoded());
    assertThat(other.secretKey().getEncoded()).isNotEqualTo(first.secretKey().getEncoded());
  }

  @Test
  void encryptThenDecryptReturnsPlaintext() {
    final ConversationKey key = engine.deriveKey(CONVERSATION);

    final EncryptedContent content = engine.encrypt(key, "gm frens");

    assertThat(content.nonce()).hasSize(MessageEncryptionEngine.NONCE_LENGTH_BYTES);
    // ciphertext carries the 16-byte GCM tag
    assertThat(content.ciphertext()).hasSize("gm frens".length() + 16);
    assertThat(engine.decrypt(key, content)).isEqualTo("gm frens");
  }

  @Test
  void encryptUsesFreshNonceEachCall() {
    final ConversationKey key = engine.deriveKey(CONVERSATION);

    final EncryptedContent first = engine.encrypt(key, "same text");
    final EncryptedContent second = engine.encrypt(key, "same text");

    assertThat(first.nonce()).isNotEqualTo(second.nonce());
    assertThat(first.ciphertext()).isNotEqualTo(second.ciphertext());
  }

  @Test
  void decryptWithOtherConversationKeyFailsAuthentication() {
    final EncryptedContent content = engine.encrypt(engine.deriveKey(CONVERSATION), "secret");

    assertThatThrownBy(() -> engine.decrypt(engine.deriveKey("0xalice:0xmallory"), content))
        .isInstanceOf(MessageAuthenticationException.class);
  }

  @Test
  void tamperedCiphertextFailsAuthentication() {
    final ConversationKey key = engine.deriveKey(CONVERSATION);
    final EncryptedContent content = engine.encrypt(key, "secret");
    final byte[] tampered = content.ciphertext();
    tampered[0] ^= 0x01;

    assertThatThrownBy(() -> engine.decrypt(key, new EncryptedContent(tampered, content.nonce())))
        .isInstanceOf(MessageAuthenticationException.class);
  }

  @Test
  void differentMasterKeyCannotDecrypt() {
    final MessageEncryptionEngine otherEngine =
        new MessageEncryptionEngine(MasterKeys.decode("another passphrase"), new SecureRandom());
    final EncryptedContent content = engine.encrypt(engine.deriveKey(CONVERSATION), "secret");

    assertThatThrownBy(() -> otherEngine.decrypt(otherEngine.deriveKey(CONVERSATION), content))
        .isInstanceOf(MessageAuthenticationException.class);
  }

  @Test
  void blankConversationIdIsRejected() {
    assertThatThrownBy(() -> engine.deriveKey(" "))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void keyToStringHidesMaterial() {
    assertThat(engine.deriveKey(CONVERSATION).toString())
        .isEqualTo("ConversationKey[conversationId=0xalice:0xbob]");
  }
}
