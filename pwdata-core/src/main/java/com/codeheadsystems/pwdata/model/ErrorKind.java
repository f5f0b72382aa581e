package com.codeheadsystems.pwdata.model;

/**
 * The closed set of failures reported by password hash operations.
 */
public enum ErrorKind {

  /**
   * Byte length inconsistent with the declared fields, or the text layer could not be decoded.
   */
  CORRUPT("malformed hashed value"),

  /**
   * Version byte is not the supported format.
   */
  VERSION("unknown hashed format version"),

  /**
   * PRF identifier is not the supported function.
   */
  FUNCTION("unknown hash function"),

  /**
   * Iteration count or salt length outside the accepted range.
   */
  PARAMETER("invalid hash function parameter"),

  /**
   * The secure random source could not supply salt bytes.
   */
  RANDOM_SOURCE_FAILURE("cannot make salt value"),

  /**
   * A well-formed stored hash that does not match the supplied password.
   */
  MISMATCH("hashed password does not match");

  private final String description;

  ErrorKind(String description) {
    this.description = description;
  }

  public String description() {
    return description;
  }
}
