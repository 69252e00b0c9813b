package com.callcenter.backend.dialog.exception;

import com.callcenter.backend.dialog.domain.DialogStatus;

/** The requested operation is not allowed in the dialog's current status. */
public class DialogStateException extends RuntimeException {

  private final String dialogId;
  private final DialogStatus status;

  public DialogStateException(String dialogId, DialogStatus status, String message) {
    super(message);
    this.dialogId = dialogId;
    this.status = status;
  }

  public String getDialogId() {
    return dialogId;
  }

  public DialogStatus getStatus() {
    return status;
  }
}
