package org.gamboni.sideshelf.store;

import java.util.Optional;

/** The playback position persisted locally on the device, under a single fixed key. */
public interface PositionStore {
    Optional<Double> load();

    void save(double position);

    void clear();
}
