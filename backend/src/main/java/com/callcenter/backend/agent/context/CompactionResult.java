package com.callcenter.backend.agent.context;

public record CompactionResult(DialogContext context, boolean compacted, int droppedCount) {

  public static CompactionResult unchanged(DialogContext context) {
    return new CompactionResult(context, false, 0);
  }
}
