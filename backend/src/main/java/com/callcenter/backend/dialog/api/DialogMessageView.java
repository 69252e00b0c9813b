package com.callcenter.backend.dialog.api;

import com.callcenter.backend.agent.context.SenderRole;
import java.time.Instant;
import java.util.Map;

public record DialogMessageView(
    String id,
    SenderRole sender,
    String text,
    String handlerName,
    Instant timestamp,
    Map<String, Object> metadata) {}
