package com.codeheadsystems.curvecrypt.exceptions;

/**
 * A derived value did not fit its fixed-width field. This is an internal invariant
 * violation, never a caller error.
 */
public class EncodingException extends CurveCryptException {

  public EncodingException(final String message) {
    super(message);
  }
}
