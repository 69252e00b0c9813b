package com.callcenter.backend.dialog.exception;

/** Another turn for the same dialog held the lock longer than the configured wait. */
public class DialogBusyException extends RuntimeException {

  private final String dialogId;

  public DialogBusyException(String dialogId, String message) {
    super(message);
    this.dialogId = dialogId;
  }

  public DialogBusyException(String dialogId, String message, Throwable cause) {
    super(message, cause);
    this.dialogId = dialogId;
  }

  public String getDialogId() {
    return dialogId;
  }
}
