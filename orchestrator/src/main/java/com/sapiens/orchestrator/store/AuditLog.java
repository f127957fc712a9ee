package com.sapiens.orchestrator.store;

import com.sapiens.orchestrator.model.ConversationEntry;
import com.sapiens.orchestrator.model.StateTransition;

import java.util.List;

/**
 * Append-only log of conversation entries and transition records.
 *
 * An append is durable once it returns (or once the surrounding transaction
 * commits), and is immediately visible to reads for the same user. Lists
 * are ordered by append sequence.
 */
public interface AuditLog {

    ConversationEntry append(ConversationEntry entry);

    StateTransition append(StateTransition transition);

    List<ConversationEntry> entries(String userId);

    /** The last {@code limit} entries, oldest first. */
    List<ConversationEntry> recentEntries(String userId, int limit);

    List<StateTransition> transitions(String userId);
}
