package com.callcenter.backend.dialog.service;

import com.callcenter.backend.dialog.exception.DialogBusyException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-dialog mutual exclusion. Turns of the same dialog run one at a time; different dialogs never
 * contend. Lock entries are reference counted and dropped once no caller holds or waits for them.
 */
public class DialogLockRegistry {

  private final ConcurrentMap<String, LockEntry> locks = new ConcurrentHashMap<>();
  private final Duration acquireTimeout;

  public DialogLockRegistry(Duration acquireTimeout) {
    this.acquireTimeout = Objects.requireNonNull(acquireTimeout, "acquireTimeout must not be null");
  }

  public <T> T withLock(String dialogId, Supplier<T> action) {
    LockEntry entry = retain(dialogId);
    boolean locked = false;
    try {
      locked = entry.lock.tryLock(acquireTimeout.toMillis(), TimeUnit.MILLISECONDS);
      if (!locked) {
        throw new DialogBusyException(
            dialogId,
            "Dialog " + dialogId + " is busy with another request, retry later");
      }
      return action.get();
    } catch (InterruptedException exception) {
      Thread.currentThread().interrupt();
      throw new DialogBusyException(
          dialogId, "Interrupted while waiting for dialog " + dialogId, exception);
    } finally {
      if (locked) {
        entry.lock.unlock();
      }
      release(dialogId);
    }
  }

  int activeEntries() {
    return locks.size();
  }

  private LockEntry retain(String dialogId) {
    return locks.compute(
        dialogId,
        (id, current) -> {
          LockEntry entry = current != null ? current : new LockEntry();
          entry.users++;
          return entry;
        });
  }

  private void release(String dialogId) {
    locks.computeIfPresent(
        dialogId,
        (id, current) -> {
          current.users--;
          return current.users > 0 ? current : null;
        });
  }

  private static final class LockEntry {
    private final ReentrantLock lock = new ReentrantLock(true);
    private int users;
  }
}
