package com.codeheadsystems.curvecrypt.exceptions;

/**
 * Raised when a private scalar or public point cannot be parsed for the configured curve.
 */
public class InvalidKeyMaterialException extends CurveCryptException {

  public InvalidKeyMaterialException(final String message) {
    super(message);
  }

  public InvalidKeyMaterialException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
