/*
 * Copyright 2020 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.onelink.linkservice.util;

import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.dropwizard.auth.AuthDynamicFeature;
import io.dropwizard.auth.basic.BasicCredentialAuthFilter;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.UUID;
import org.onelink.linkservice.auth.ExternalServiceCredentialValidator;
import org.onelink.linkservice.auth.User;
import org.onelink.linkservice.auth.UserAuthenticator;

public class AuthHelper {

  public static final UUID VALID_USER = UUID.randomUUID();
  public static final UUID VALID_USER_TWO = UUID.randomUUID();
  public static final String VALID_PASSWORD = "foo";

  public static final UUID INVALID_USER = UUID.randomUUID();
  public static final String INVALID_PASSWORD = "bar";

  public static final ExternalServiceCredentialValidator CREDENTIAL_VALIDATOR =
      mock(ExternalServiceCredentialValidator.class);

  public static AuthDynamicFeature getAuthFilter() {
    when(CREDENTIAL_VALIDATOR.isValid(eq(VALID_PASSWORD), eq(VALID_USER.toString()))).thenReturn(true);
    when(CREDENTIAL_VALIDATOR.isValid(eq(VALID_PASSWORD), eq(VALID_USER_TWO.toString()))).thenReturn(true);

    return new AuthDynamicFeature(new BasicCredentialAuthFilter.Builder<User>()
        .setAuthenticator(new UserAuthenticator(CREDENTIAL_VALIDATOR))
        .buildAuthFilter());
  }

  public static String getAuthHeader(UUID user, String password) {
    return "Basic " + Base64.getEncoder().encodeToString((user + ":" + password).getBytes(StandardCharsets.UTF_8));
  }
}
