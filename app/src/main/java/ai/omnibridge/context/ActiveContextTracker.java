package ai.omnibridge.context;

import ai.omnibridge.util.Emission;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

/**
 * Turns the churn of raw "this document might be active" events into one committed active context.
 *
 * <p>Every candidate hops onto the event scheduler, is debounced, and is checked against destroyed
 * documents both before and after the debounce window. The committed value feeds one replaying
 * sink; the editor and config facets are mapped from that same sink, so they can never disagree
 * with it or with each other about timing.
 */
public final class ActiveContextTracker implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(ActiveContextTracker.class);

    // single consumer; no initial value, so a source that never emits produces no commit
    private final Sinks.Many<Optional<TrackedDocument>> candidates =
            Sinks.many().unicast().onBackpressureBuffer();
    private final AtomicReference<Optional<TrackedDocument>> latestCandidate = new AtomicReference<>(Optional.empty());

    private final Sinks.Many<Optional<TrackedDocument>> activeContext =
            Sinks.many().replay().latestOrDefault(Optional.empty());
    private final AtomicReference<Optional<TrackedDocument>> committed = new AtomicReference<>(Optional.empty());

    private final Disposable commits;
    private volatile boolean closed;

    public ActiveContextTracker(Scheduler scheduler, long debounceMillis) {
        var window = Duration.ofMillis(debounceMillis);
        commits = wrap(candidates.asFlux(), scheduler)
                .sampleTimeout(candidate -> Mono.delay(window, scheduler))
                .map(ActiveContextTracker::dropDestroyed)
                .subscribe(this::commit, error -> logger.error("Active context pipeline failed", error));
    }

    /**
     * Moves delivery onto the scheduler so nothing wired synchronously during startup sees a value
     * before its own subscriptions exist, then drops documents that were destroyed while queued.
     */
    static Flux<Optional<TrackedDocument>> wrap(Flux<Optional<TrackedDocument>> source, Scheduler scheduler) {
        return source.publishOn(scheduler).map(ActiveContextTracker::dropDestroyed);
    }

    static Optional<TrackedDocument> dropDestroyed(Optional<TrackedDocument> candidate) {
        return candidate.filter(document -> !document.isDestroyed());
    }

    private static Optional<TrackedDocument> plainOnly(Optional<TrackedDocument> context) {
        return context.filter(document -> !document.isConfig());
    }

    private static Optional<TrackedDocument> configOnly(Optional<TrackedDocument> context) {
        return context.filter(TrackedDocument::isConfig);
    }

    private void commit(Optional<TrackedDocument> context) {
        if (closed) {
            return;
        }
        logger.debug("Active context committed: {}", context.orElse(null));
        committed.set(context);
        Emission.emit(activeContext, context);
    }

    /** Offers a raw candidate. Only the last candidate of a burst is ever committed. */
    public void submit(Optional<TrackedDocument> candidate) {
        if (closed) {
            return;
        }
        latestCandidate.set(candidate);
        Emission.emit(candidates, candidate);
    }

    /** Clears the pending candidate if it is the document that just went away. */
    public void documentDestroyed(TrackedDocument document) {
        var latest = latestCandidate.get();
        if (latest.isPresent() && latest.get() == document) {
            logger.debug("Active candidate {} destroyed; clearing", document);
            submit(Optional.empty());
        }
    }

    /** Committed context, plain or config document. */
    public Flux<Optional<TrackedDocument>> activeContext() {
        return activeContext.asFlux();
    }

    /** Committed context when it is a plain (non-config) document, empty otherwise. */
    public Flux<Optional<TrackedDocument>> activeEditor() {
        return activeContext.asFlux().map(ActiveContextTracker::plainOnly);
    }

    /** Committed context when it is a config document, empty otherwise. */
    public Flux<Optional<TrackedDocument>> activeConfigEditor() {
        return activeContext.asFlux().map(ActiveContextTracker::configOnly);
    }

    /**
     * Same filter as {@link #activeEditor()}, but only emits when its own value changes, so moving
     * between config documents does not produce repeated empties.
     */
    public Flux<Optional<TrackedDocument>> activeEditorOnly() {
        return activeEditor()
                .distinctUntilChanged(
                        Function.<Optional<TrackedDocument>>identity(), (a, b) -> a.orElse(null) == b.orElse(null));
    }

    /** The latest committed context. */
    public Optional<TrackedDocument> current() {
        return committed.get();
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        commits.dispose();
        latestCandidate.set(Optional.empty());
        committed.set(Optional.empty());
        Emission.emit(activeContext, Optional.empty());
        closed = true;
        candidates.tryEmitComplete();
    }
}
