/*
 * Copyright 2020 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.onelink.linkservice.auth;

import io.dropwizard.auth.Authenticator;
import io.dropwizard.auth.basic.BasicCredentials;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Authenticates link owners by basic credentials of the form {@code uuid:token}, where the token was issued for that
 * UUID by the account service.
 */
public class UserAuthenticator implements Authenticator<BasicCredentials, User> {

  private static final Logger logger = LoggerFactory.getLogger(UserAuthenticator.class);

  private final ExternalServiceCredentialValidator validator;

  public UserAuthenticator(ExternalServiceCredentialValidator validator) {
    this.validator = validator;
  }

  @Override
  public Optional<User> authenticate(BasicCredentials basicCredentials) {
    if (!validator.isValid(basicCredentials.getPassword(), basicCredentials.getUsername())) {
      return Optional.empty();
    }

    try {
      return Optional.of(new User(UUID.fromString(basicCredentials.getUsername())));
    } catch (IllegalArgumentException e) {
      logger.warn("Valid token issued for non-UUID user {}", basicCredentials.getUsername(), e);
      return Optional.empty();
    }
  }
}
