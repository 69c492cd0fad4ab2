package org.gamboni.sideshelf.store;

import org.gamboni.sideshelf.data.ActiveSession;

import java.util.Optional;

public interface SessionRepository {
    Optional<ActiveSession> findActiveSession(String userId, String libraryItemId);
}
