// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.classchat.crypto;

import javax.crypto.Cipher;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;

import static com.github.classchat.ChatProtocol.IV_BYTES;
import static com.github.classchat.ChatProtocol.SESSION_KEY_BYTES;

/// AES-256-CBC payload encryption. Each call draws a fresh IV which is sent in front of the ciphertext, and the pair
/// is base64 encoded for transport. The JCE name `PKCS5Padding` is PKCS7 padding for a 16 byte block.
public final class SessionCipher {

  private static final ThreadLocal<SecureRandom> RANDOM = ThreadLocal.withInitial(SecureRandom::new);
  private static final ThreadLocal<Cipher> CIPHER = ThreadLocal.withInitial(() -> {
    try {
      return Cipher.getInstance("AES/CBC/PKCS5Padding");
    } catch (GeneralSecurityException e) {
      throw new RuntimeException("Required crypto algorithm unavailable", e);
    }
  });

  private SessionCipher() {
  }

  public static byte[] generateKey() {
    byte[] key = new byte[SESSION_KEY_BYTES];
    RANDOM.get().nextBytes(key);
    return key;
  }

  /// @return base64 of `IV || ciphertext`
  public static String encrypt(byte[] plaintext, byte[] sessionKey) {
    try {
      byte[] iv = new byte[IV_BYTES];
      RANDOM.get().nextBytes(iv);

      Cipher cipher = CIPHER.get();
      cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(sessionKey, "AES"), new IvParameterSpec(iv));
      byte[] encrypted = cipher.doFinal(plaintext);

      ByteBuffer out = ByteBuffer.allocate(IV_BYTES + encrypted.length);
      out.put(iv).put(encrypted);
      return Base64.getEncoder().encodeToString(out.array());
    } catch (GeneralSecurityException e) {
      throw new SecurityException("Encryption failed", e);
    }
  }

  /// @throws DecryptionFailureException on bad base64, a short input, or a padding or key mismatch
  public static byte[] decrypt(String transport, byte[] sessionKey) {
    final byte[] raw;
    try {
      raw = Base64.getDecoder().decode(transport);
    } catch (IllegalArgumentException e) {
      throw new DecryptionFailureException("Payload is not base64", e);
    }
    // at least the IV and one block
    if (raw.length < 2 * IV_BYTES || raw.length % IV_BYTES != 0) {
      throw new DecryptionFailureException("Payload has invalid length " + raw.length, null);
    }
    try {
      Cipher cipher = CIPHER.get();
      cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(sessionKey, "AES"),
          new IvParameterSpec(raw, 0, IV_BYTES));
      return cipher.doFinal(raw, IV_BYTES, raw.length - IV_BYTES);
    } catch (GeneralSecurityException e) {
      throw new DecryptionFailureException("Decryption failed", e);
    }
  }
}
