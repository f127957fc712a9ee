package com.sapiens.orchestrator.store;

import com.sapiens.orchestrator.model.UserState;

import java.util.Optional;

/** Durable keyed storage, one {@link UserState} per user. */
public interface UserStateStore {

    Optional<UserState> find(String userId);

    boolean exists(String userId);

    /**
     * Insert or update. Updates are version-checked: saving a copy whose
     * version is stale fails.
     *
     * @return the stored record, with its new version
     */
    UserState save(UserState state);
}
