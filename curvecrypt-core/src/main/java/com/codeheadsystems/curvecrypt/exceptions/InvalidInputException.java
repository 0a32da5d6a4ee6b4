package com.codeheadsystems.curvecrypt.exceptions;

/**
 * Raised by signature verification when the public key or the DER signature is malformed,
 * as opposed to well-formed but not matching.
 */
public class InvalidInputException extends CurveCryptException {

  public InvalidInputException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
