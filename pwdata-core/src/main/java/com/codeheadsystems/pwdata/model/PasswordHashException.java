package com.codeheadsystems.pwdata.model;

import java.util.Objects;

/**
 * Failure of a password hash operation. Callers branch on {@link #kind()}, never on the message.
 */
public class PasswordHashException extends RuntimeException {

  private final ErrorKind kind;

  /**
   * Instantiates a new Password hash exception.
   *
   * @param kind the kind
   */
  public PasswordHashException(final ErrorKind kind) {
    super(Objects.requireNonNull(kind, "kind").description());
    this.kind = kind;
  }

  /**
   * Instantiates a new Password hash exception.
   *
   * @param kind   the kind
   * @param detail what exactly was wrong, appended to the kind's description
   */
  public PasswordHashException(final ErrorKind kind, final String detail) {
    this(kind, detail, null);
  }

  /**
   * Instantiates a new Password hash exception.
   *
   * @param kind   the kind
   * @param detail what exactly was wrong, appended to the kind's description
   * @param cause  the cause
   */
  public PasswordHashException(final ErrorKind kind, final String detail, final Throwable cause) {
    super(Objects.requireNonNull(kind, "kind").description() + ": " + detail, cause);
    this.kind = kind;
  }

  public ErrorKind kind() {
    return kind;
  }
}
