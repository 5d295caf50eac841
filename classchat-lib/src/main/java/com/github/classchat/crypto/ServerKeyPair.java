// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.classchat.crypto;

import javax.crypto.Cipher;
import javax.crypto.spec.OAEPParameterSpec;
import javax.crypto.spec.PSource;
import java.security.*;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.MGF1ParameterSpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;
import java.util.logging.Logger;

import static com.github.classchat.ChatProtocol.RSA_KEY_BITS;
import static com.github.classchat.ChatProtocol.SESSION_KEY_BYTES;

/// The server's long-lived RSA keypair. One instance is shared by every connection and is only ever used to unwrap
/// the AES session key each client sends during the handshake.
public final class ServerKeyPair {
  private static final Logger LOGGER = Logger.getLogger(ServerKeyPair.class.getName());

  static final String TRANSFORMATION = "RSA/ECB/OAEPPadding";

  /// SHA-256 for the digest and for MGF1. The JCE shorthand `OAEPWithSHA-256AndMGF1Padding` would use SHA-1 for
  /// MGF1 so the parameters are spelled out.
  static final OAEPParameterSpec OAEP_SHA256 = new OAEPParameterSpec(
      "SHA-256", "MGF1", MGF1ParameterSpec.SHA256, PSource.PSpecified.DEFAULT);

  private final KeyPair keyPair;
  private final String encodedPublicKey;

  private ServerKeyPair(KeyPair keyPair) {
    this.keyPair = keyPair;
    this.encodedPublicKey = Base64.getEncoder().encodeToString(keyPair.getPublic().getEncoded());
  }

  public static ServerKeyPair generate() {
    try {
      KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
      generator.initialize(RSA_KEY_BITS, new SecureRandom());
      final var pair = new ServerKeyPair(generator.generateKeyPair());
      LOGGER.fine(() -> "Generated " + RSA_KEY_BITS + " bit RSA server keypair");
      return pair;
    } catch (NoSuchAlgorithmException e) {
      throw new RuntimeException("Required crypto algorithm unavailable", e);
    }
  }

  /// Base64 of the X.509 SubjectPublicKeyInfo encoding.
  public String encodedPublicKey() {
    return encodedPublicKey;
  }

  /// @throws HandshakeFailureException if the material is not base64, does not decrypt or is not a 256 bit key
  public byte[] unwrapSessionKey(String wrappedKey) {
    try {
      Cipher cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(Cipher.DECRYPT_MODE, keyPair.getPrivate(), OAEP_SHA256);
      byte[] key = cipher.doFinal(Base64.getDecoder().decode(wrappedKey));
      if (key.length != SESSION_KEY_BYTES) {
        throw new HandshakeFailureException("Session key must be " + SESSION_KEY_BYTES + " bytes not " + key.length);
      }
      return key;
    } catch (GeneralSecurityException | IllegalArgumentException e) {
      throw new HandshakeFailureException("Could not unwrap session key", e);
    }
  }

  /// The client half: wrap a fresh session key under the server's public key.
  ///
  /// @param encodedPublicKey what [#encodedPublicKey()] returned on the server
  /// @return base64 of the OAEP ciphertext
  /// @throws HandshakeFailureException if the public key cannot be read
  public static String wrapSessionKey(String encodedPublicKey, byte[] sessionKey) {
    try {
      PublicKey publicKey = KeyFactory.getInstance("RSA")
          .generatePublic(new X509EncodedKeySpec(Base64.getDecoder().decode(encodedPublicKey)));
      Cipher cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(Cipher.ENCRYPT_MODE, publicKey, OAEP_SHA256);
      return Base64.getEncoder().encodeToString(cipher.doFinal(sessionKey));
    } catch (InvalidKeySpecException | IllegalArgumentException e) {
      throw new HandshakeFailureException("Server public key is unreadable", e);
    } catch (GeneralSecurityException e) {
      throw new HandshakeFailureException("Could not wrap session key", e);
    }
  }
}
