package com.callcenter.backend.dialog.exception;

public class DialogValidationException extends RuntimeException {

  public DialogValidationException(String message) {
    super(message);
  }
}
