package com.codeheadsystems.pwdata.server.model;

import com.codeheadsystems.pwdata.codec.PasswordHashCodec;
import com.codeheadsystems.pwdata.model.PasswordHash;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for exporting and importing a user's password hash.
 * <p>
 * The hash travels in its ASP.NET Core Identity base64 text form, the same value a legacy
 * {@code AspNetUsers.PasswordHash} column holds.
 *
 * @param userName         the user name
 * @param passwordHashText base64 text of the V3 password hash record
 */
public record UserRecord(
    @JsonProperty("userName") String userName,
    @JsonProperty("passwordHash") String passwordHashText) {

  /**
   * Instantiates a new User record.
   *
   * @param userName the user name
   * @param hash     the hash
   */
  public UserRecord(String userName, PasswordHash hash) {
    this(userName, PasswordHashCodec.encodeText(hash));
  }

  /**
   * Decodes the password hash.
   *
   * @return the password hash
   * @throws IllegalArgumentException if the field is missing
   * @throws com.codeheadsystems.pwdata.model.PasswordHashException if the value is malformed
   */
  public PasswordHash passwordHash() {
    if (passwordHashText == null || passwordHashText.isBlank()) {
      throw new IllegalArgumentException("Missing required field: passwordHash");
    }
    return PasswordHashCodec.decodeText(passwordHashText);
  }

  /**
   * Validated user name.
   *
   * @return the user name
   * @throws IllegalArgumentException if the field is missing
   */
  public String requireUserName() {
    if (userName == null || userName.isBlank()) {
      throw new IllegalArgumentException("Missing required field: userName");
    }
    return userName;
  }
}
