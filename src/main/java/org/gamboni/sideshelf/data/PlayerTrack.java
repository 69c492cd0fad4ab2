package org.gamboni.sideshelf.data;

import java.util.List;
import java.util.Optional;

/**
 * Track information for the player.
 *
 * @param libraryItemId library item the track belongs to
 * @param mediaId media metadata id
 * @param coverUri cover image, if known
 * @param duration total duration in seconds
 * @param downloaded whether files are available locally
 */
public record PlayerTrack(
        String libraryItemId,
        String mediaId,
        String title,
        String author,
        Optional<String> coverUri,
        double duration,
        boolean downloaded,
        List<Chapter> chapters) {

    public PlayerTrack {
        coverUri = (coverUri == null) ? Optional.empty() : coverUri;
        chapters = (chapters == null) ? List.of() : List.copyOf(chapters);
    }
}
