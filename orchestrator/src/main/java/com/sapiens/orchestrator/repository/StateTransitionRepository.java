package com.sapiens.orchestrator.repository;

import com.sapiens.orchestrator.model.StateTransition;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface StateTransitionRepository extends JpaRepository<StateTransition, Long> {

    List<StateTransition> findByUserIdOrderByIdAsc(String userId);
}
