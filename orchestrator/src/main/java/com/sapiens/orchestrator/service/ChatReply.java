package com.sapiens.orchestrator.service;

import com.sapiens.orchestrator.model.Phase;

/**
 * What a chat request returns once everything it decided has been stored.
 *
 * RETRY means the request's agent call failed and nothing changed; the user
 * should send the same message again.
 */
public record ChatReply(String userId, String text, Phase phase, Outcome outcome) {

    public enum Outcome { ANSWERED, RETRY }
}
