package com.callcenter.backend.dialog.service;

import com.callcenter.backend.agent.orchestrator.TurnResult;
import java.time.Instant;

/** A persisted turn: the orchestration result plus the id of the stored agent reply. */
public record DialogTurn(String dialogId, String messageId, TurnResult result, Instant timestamp) {}
