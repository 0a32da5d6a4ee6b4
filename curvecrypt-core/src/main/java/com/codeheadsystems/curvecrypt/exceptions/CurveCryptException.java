package com.codeheadsystems.curvecrypt.exceptions;

/**
 * Base type for the unchecked failures raised by the curve crypto core.
 */
public abstract class CurveCryptException extends RuntimeException {

  /**
   * Instantiates a new curve crypt exception.
   *
   * @param message the message
   */
  protected CurveCryptException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new curve crypt exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  protected CurveCryptException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
