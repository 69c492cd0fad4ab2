package org.gamboni.sideshelf.store;

import org.gamboni.sideshelf.data.MediaProgress;

import java.util.Optional;

public interface ProgressRepository {
    Optional<MediaProgress> findProgress(String libraryItemId, String userId);
}
