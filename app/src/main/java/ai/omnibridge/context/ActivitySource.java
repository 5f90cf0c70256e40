package ai.omnibridge.context;

import ai.omnibridge.session.IHostDocument;
import ai.omnibridge.session.IHostWorkspace;
import java.util.Optional;
import java.util.function.Consumer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * Adapts the host's active-pane notifications into raw active-context candidates.
 *
 * <p>A pane item that is not a supported document becomes an empty candidate. A supported document
 * that is not tracked yet is resolved to its session first; the candidate is only emitted once that
 * binding exists. A newer pane change abandons a resolution still in flight.
 */
public final class ActivitySource implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(ActivitySource.class);

    private final IHostWorkspace workspace;
    private final DocumentRegistry documents;
    private final DocumentFilter filter;
    private final Scheduler scheduler;

    @Nullable
    private Disposable subscription;

    public ActivitySource(
            IHostWorkspace workspace, DocumentRegistry documents, DocumentFilter filter, Scheduler scheduler) {
        this.workspace = workspace;
        this.documents = documents;
        this.filter = filter;
        this.scheduler = scheduler;
    }

    static Flux<Optional<IHostDocument>> paneItems(IHostWorkspace workspace) {
        return Flux.create(sink -> sink.onDispose(workspace.observeActivePaneItem(sink::next)));
    }

    public Flux<Optional<TrackedDocument>> candidates() {
        return paneItems(workspace).map(item -> item.filter(filter::isCandidate)).switchMap(this::toCandidate);
    }

    private Mono<Optional<TrackedDocument>> toCandidate(Optional<IHostDocument> item) {
        if (item.isEmpty()) {
            return Mono.just(Optional.empty());
        }
        var host = item.get();
        var tracked = documents.find(host);
        if (tracked.isPresent()) {
            return Mono.just(tracked);
        }
        return documents
                .resolve(host)
                .publishOn(scheduler)
                .filter(document -> !document.isDestroyed())
                .map(Optional::of);
    }

    public synchronized void start(Consumer<Optional<TrackedDocument>> sink) {
        if (subscription != null) {
            throw new IllegalStateException("ActivitySource already started");
        }
        subscription = candidates().subscribe(sink, error -> logger.error("Active pane tracking failed", error));
    }

    @Override
    public synchronized void close() {
        if (subscription != null) {
            subscription.dispose();
            subscription = null;
        }
    }
}
