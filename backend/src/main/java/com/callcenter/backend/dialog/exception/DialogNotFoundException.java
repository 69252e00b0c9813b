package com.callcenter.backend.dialog.exception;

public class DialogNotFoundException extends RuntimeException {

  private final String dialogId;

  public DialogNotFoundException(String dialogId) {
    super("Dialog " + dialogId + " not found");
    this.dialogId = dialogId;
  }

  public String getDialogId() {
    return dialogId;
  }
}
