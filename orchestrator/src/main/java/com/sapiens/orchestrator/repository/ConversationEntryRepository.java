package com.sapiens.orchestrator.repository;

import com.sapiens.orchestrator.model.ConversationEntry;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ConversationEntryRepository extends JpaRepository<ConversationEntry, Long> {

    List<ConversationEntry> findByUserIdOrderBySequenceAsc(String userId);

    /** Newest first; callers reverse for display. */
    List<ConversationEntry> findByUserIdOrderBySequenceDesc(String userId, Pageable page);
}
