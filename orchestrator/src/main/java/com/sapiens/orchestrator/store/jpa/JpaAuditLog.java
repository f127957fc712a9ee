package com.sapiens.orchestrator.store.jpa;

import com.sapiens.orchestrator.model.ConversationEntry;
import com.sapiens.orchestrator.model.StateTransition;
import com.sapiens.orchestrator.repository.ConversationEntryRepository;
import com.sapiens.orchestrator.repository.StateTransitionRepository;
import com.sapiens.orchestrator.store.AuditLog;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Component
public class JpaAuditLog implements AuditLog {

    private final ConversationEntryRepository entryRepo;
    private final StateTransitionRepository   transitionRepo;

    public JpaAuditLog(ConversationEntryRepository entryRepo, StateTransitionRepository transitionRepo) {
        this.entryRepo      = entryRepo;
        this.transitionRepo = transitionRepo;
    }

    @Override
    public ConversationEntry append(ConversationEntry entry) {
        return entryRepo.save(entry);
    }

    @Override
    public StateTransition append(StateTransition transition) {
        return transitionRepo.save(transition);
    }

    @Override
    public List<ConversationEntry> entries(String userId) {
        return entryRepo.findByUserIdOrderBySequenceAsc(userId);
    }

    @Override
    public List<ConversationEntry> recentEntries(String userId, int limit) {
        List<ConversationEntry> newestFirst = new ArrayList<>(
                entryRepo.findByUserIdOrderBySequenceDesc(userId, PageRequest.of(0, limit)));
        Collections.reverse(newestFirst);
        return newestFirst;
    }

    @Override
    public List<StateTransition> transitions(String userId) {
        return transitionRepo.findByUserIdOrderByIdAsc(userId);
    }
}
