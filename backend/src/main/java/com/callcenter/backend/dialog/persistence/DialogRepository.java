package com.callcenter.backend.dialog.persistence;

import com.callcenter.backend.dialog.domain.DialogRecord;
import com.callcenter.backend.dialog.exception.DialogNotFoundException;
import java.util.List;
import java.util.Optional;

/**
 * Storage of dialog records. Failures surface as
 * {@link com.callcenter.backend.dialog.exception.DialogStorageException}.
 */
public interface DialogRepository {

  Optional<DialogRecord> findById(String dialogId);

  default DialogRecord load(String dialogId) {
    return findById(dialogId).orElseThrow(() -> new DialogNotFoundException(dialogId));
  }

  /** Replaces the stored record as a whole; readers never observe a partial write. */
  DialogRecord save(DialogRecord dialog);

  boolean deleteById(String dialogId);

  List<DialogRecord> findAll();

  boolean isAvailable();
}
