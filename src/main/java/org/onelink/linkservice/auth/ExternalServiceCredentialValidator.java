/*
 * Copyright 2020 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.onelink.linkservice.auth;

import com.google.common.annotations.VisibleForTesting;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates access tokens minted by the account service. A token has the form
 * {@code username:epochSeconds:signature}, where the signature is the hex encoding of the first
 * {@value #SIGNATURE_LENGTH} bytes of {@code HMAC-SHA256(key, "username:epochSeconds")}.
 */
public class ExternalServiceCredentialValidator {

  private static final Logger logger = LoggerFactory.getLogger(ExternalServiceCredentialValidator.class);

  static final int SIGNATURE_LENGTH = 10;

  private static final String HMAC_ALGORITHM = "HmacSHA256";

  private final byte[] key;
  private final Duration tokenLifetime;
  private final Clock clock;

  public ExternalServiceCredentialValidator(byte[] key, Duration tokenLifetime, Clock clock) {
    this.key = key;
    this.tokenLifetime = tokenLifetime;
    this.clock = clock;
  }

  public boolean isValid(String token, String username) {
    final String[] parts = token.split(":");

    if (parts.length != 3) {
      return false;
    }

    if (!username.equals(parts[0])) {
      return false;
    }

    if (!isValidTime(parts[1])) {
      return false;
    }

    return isValidSignature(parts[0] + ":" + parts[1], parts[2]);
  }

  /**
   * Mints a token for the given user at the current time. The account service does the same with the shared key.
   */
  @VisibleForTesting
  String generateFor(String username) {
    final String prefix = username + ":" + clock.instant().getEpochSecond();
    return prefix + ":" + Hex.encodeHexString(getSignature(prefix));
  }

  private boolean isValidTime(String timeString) {
    try {
      final Instant issued = Instant.ofEpochSecond(Long.parseLong(timeString));

      return Duration.between(issued, clock.instant()).abs().compareTo(tokenLifetime) < 0;
    } catch (NumberFormatException e) {
      logger.debug("Malformed token timestamp", e);
      return false;
    }
  }

  private boolean isValidSignature(String prefix, String signature) {
    try {
      return MessageDigest.isEqual(getSignature(prefix), Hex.decodeHex(signature));
    } catch (DecoderException e) {
      logger.debug("Malformed token signature", e);
      return false;
    }
  }

  private byte[] getSignature(String prefix) {
    try {
      final Mac mac = Mac.getInstance(HMAC_ALGORITHM);
      mac.init(new SecretKeySpec(key, HMAC_ALGORITHM));

      return Arrays.copyOf(mac.doFinal(prefix.getBytes(StandardCharsets.UTF_8)), SIGNATURE_LENGTH);
    } catch (NoSuchAlgorithmException | InvalidKeyException e) {
      throw new AssertionError(e);
    }
  }
}
