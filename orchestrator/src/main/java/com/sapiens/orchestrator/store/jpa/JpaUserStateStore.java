package com.sapiens.orchestrator.store.jpa;

import com.sapiens.orchestrator.model.UserState;
import com.sapiens.orchestrator.repository.UserStateRepository;
import com.sapiens.orchestrator.store.UserStateStore;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class JpaUserStateStore implements UserStateStore {

    private final UserStateRepository repo;

    public JpaUserStateStore(UserStateRepository repo) {
        this.repo = repo;
    }

    @Override
    public Optional<UserState> find(String userId) {
        return repo.findById(userId);
    }

    @Override
    public boolean exists(String userId) {
        return repo.existsById(userId);
    }

    @Override
    public UserState save(UserState state) {
        // saveAndFlush so a version conflict surfaces inside the caller's transaction.
        return repo.saveAndFlush(state);
    }
}
