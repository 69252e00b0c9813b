package com.callcenter.backend.dialog.exception;

public class DialogStorageException extends RuntimeException {

  public DialogStorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
