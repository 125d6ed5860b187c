/*
 * Copyright 2020 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.onelink.linkservice.auth;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.security.Principal;
import java.util.Objects;
import java.util.UUID;
import javax.security.auth.Subject;

/**
 * An authenticated link owner.
 */
public class User implements Principal {

  private final UUID uuid;

  public User(UUID uuid) {
    this.uuid = uuid;
  }

  public UUID getUuid() {
    return uuid;
  }

  // Principal implementation

  @JsonIgnore
  @Override
  public String getName() {
    return uuid.toString();
  }

  @JsonIgnore
  @Override
  public boolean implies(Subject subject) {
    return false;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) return true;
    if (!(other instanceof User)) return false;

    return Objects.equals(uuid, ((User) other).uuid);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(uuid);
  }
}
