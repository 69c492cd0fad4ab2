package org.gamboni.sideshelf.store;

import java.util.Optional;

public interface UserDirectory {
    /** Id of the authenticated user, if any. */
    Optional<String> currentUserId();
}
