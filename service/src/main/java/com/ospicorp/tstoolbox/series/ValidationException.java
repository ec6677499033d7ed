package com.ospicorp.tstoolbox.series;

/**
 * Fatal input error raised by the series kernels and services. Aborts the whole operation; the
 * API maps it to a 400 response carrying {@link #errorCode()}.
 */
public class ValidationException extends RuntimeException {
  private final int errorCode;

  public ValidationException(String message, int errorCode) {
    super(message);
    this.errorCode = errorCode;
  }

  public int errorCode() {
    return errorCode;
  }
}
