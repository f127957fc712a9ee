package com.sapiens.orchestrator.repository;

import com.sapiens.orchestrator.model.UserState;
import org.springframework.data.jpa.repository.JpaRepository;

public interface UserStateRepository extends JpaRepository<UserState, String> {
}
