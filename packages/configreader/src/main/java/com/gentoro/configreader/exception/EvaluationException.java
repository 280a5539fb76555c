package com.gentoro.configreader.exception;

import java.util.Map;

/** A value could not be evaluated: bad operand type, division by zero, overflow, domain error. */
public class EvaluationException extends ConfigReaderException {
  public EvaluationException(String message) {
    super(ConfigReaderErrorCode.EVALUATION_ERROR, message);
  }

  public EvaluationException(String message, Map<String, ?> context) {
    super(ConfigReaderErrorCode.EVALUATION_ERROR, message, context);
  }

  public EvaluationException(String message, Map<String, ?> context, Throwable cause) {
    super(ConfigReaderErrorCode.EVALUATION_ERROR, message, context, cause);
  }
}
