package org.gamboni.sideshelf;

import org.gamboni.sideshelf.tech.media.PlayerService;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/** Player service recording the commands it receives. Commands named in {@link #failOn} complete exceptionally. */
class RecordingPlayerService implements PlayerService {
    private final List<String> calls = new ArrayList<>();
    private final Set<String> failOn = new HashSet<>();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();
    /** Runs inside each command, e.g. to check what the coordinator looks like while a side effect executes. */
    private volatile Runnable duringCall = () -> {};

    synchronized List<String> calls() {
        return List.copyOf(calls);
    }

    synchronized long count(String command) {
        return calls.stream().filter(c -> c.equals(command) || c.startsWith(command + "(")).count();
    }

    synchronized void failOn(String command) {
        failOn.add(command);
    }

    void duringCall(Runnable action) {
        this.duringCall = action;
    }

    /** True while one of the commands is executing. */
    boolean isExecuting() {
        return inFlight.get() > 0;
    }

    int maxInFlight() {
        return maxInFlight.get();
    }

    private CompletableFuture<Void> invoke(String command, String call) {
        int running = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(running, Math::max);
        try {
            boolean fail;
            synchronized (this) {
                calls.add(call);
                fail = failOn.contains(command);
            }
            duringCall.run();
            return fail
                    ? CompletableFuture.failedFuture(new IllegalStateException(command + " failed"))
                    : CompletableFuture.completedFuture(null);
        } finally {
            inFlight.decrementAndGet();
        }
    }

    @Override
    public CompletableFuture<Void> executeLoadTrack(String libraryItemId, Optional<String> episodeId) {
        return invoke("loadTrack", "loadTrack(" + libraryItemId + episodeId.map(e -> "," + e).orElse("") + ")");
    }

    @Override
    public CompletableFuture<Void> executePlay() {
        return invoke("play", "play");
    }

    @Override
    public CompletableFuture<Void> executePause() {
        return invoke("pause", "pause");
    }

    @Override
    public CompletableFuture<Void> executeStop() {
        return invoke("stop", "stop");
    }

    @Override
    public CompletableFuture<Void> executeSeek(double position) {
        return invoke("seek", "seek(" + position + ")");
    }

    @Override
    public CompletableFuture<Void> executeSetRate(double rate) {
        return invoke("setRate", "setRate(" + rate + ")");
    }

    @Override
    public CompletableFuture<Void> executeSetVolume(double volume) {
        return invoke("setVolume", "setVolume(" + volume + ")");
    }
}
