package ai.omnibridge.context;

import ai.omnibridge.session.IHostDocument;
import ai.omnibridge.session.ISession;
import ai.omnibridge.session.ISessionRegistry;
import ai.omnibridge.util.Emission;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * The set of live tracked documents.
 *
 * <p>Mutated only when a document is first tracked and when it is destroyed (or its session goes
 * away). Snapshot order is insertion order, but callers should not depend on it.
 */
public final class DocumentRegistry implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(DocumentRegistry.class);

    private final ISessionRegistry sessions;
    private final DocumentFilter filter;

    // guarded by 'this'
    private final Map<IHostDocument, Entry> live = new LinkedHashMap<>();

    private final Sinks.Many<TrackedDocument> created = Sinks.many().multicast().directBestEffort();
    private final Sinks.Many<TrackedDocument> destroyed = Sinks.many().multicast().directBestEffort();
    private final Disposable.Composite pendingResolutions = Disposables.composite();

    private record Entry(TrackedDocument document, Disposable hooks) {}

    public DocumentRegistry(ISessionRegistry sessions, DocumentFilter filter) {
        this.sessions = sessions;
        this.filter = filter;
    }

    public synchronized Optional<TrackedDocument> find(IHostDocument host) {
        var entry = live.get(host);
        return entry == null ? Optional.empty() : Optional.of(entry.document());
    }

    public synchronized List<TrackedDocument> snapshot() {
        var result = new ArrayList<TrackedDocument>(live.size());
        for (var entry : live.values()) {
            result.add(entry.document());
        }
        return result;
    }

    public synchronized int size() {
        return live.size();
    }

    /**
     * Tracks the document under the given session. Returns the existing wrapper if the document is
     * already tracked; the config flag is only computed the first time.
     */
    public TrackedDocument track(IHostDocument host, ISession session) {
        TrackedDocument document;
        synchronized (this) {
            var existing = live.get(host);
            if (existing != null) {
                return existing.document();
            }
            document = new TrackedDocument(host, session, filter.isConfigPath(host.getPath()));
            // hooks are swapped in once wired
            live.put(host, new Entry(document, Disposables.disposed()));
        }

        Disposable untrackAction = () -> untrack(document);
        var untrack = Disposables.composite(untrackAction);
        var destroyHook = host.onDidDestroy(untrack::dispose);
        session.disposables().add(untrack);
        Disposable unhookAction = () -> {
            destroyHook.dispose();
            session.disposables().remove(untrack);
        };
        var hooks = Disposables.composite(unhookAction);
        synchronized (this) {
            var entry = live.get(host);
            if (entry != null && entry.document() == document) {
                live.put(host, new Entry(document, hooks));
            } else {
                // destroyed while we were wiring
                hooks.dispose();
                return document;
            }
        }

        logger.debug("Tracking {}", document);
        Emission.emit(created, document);
        return document;
    }

    private void untrack(TrackedDocument document) {
        Entry entry;
        synchronized (this) {
            entry = live.get(document.getHost());
            if (entry == null || entry.document() != document) {
                return;
            }
            live.remove(document.getHost());
        }
        entry.hooks().dispose();
        logger.debug("Untracked {}", document);
        Emission.emit(destroyed, document);
    }

    /** Documents as they are first tracked. Does not replay. */
    public Flux<TrackedDocument> created() {
        return created.asFlux();
    }

    /** Documents as they leave the registry. Does not replay. */
    public Flux<TrackedDocument> destroyed() {
        return destroyed.asFlux();
    }

    /** Every currently tracked document, then every document tracked afterwards. */
    public Flux<TrackedDocument> documents() {
        return Flux.merge(Flux.defer(() -> Flux.fromIterable(snapshot())), created.asFlux());
    }

    /**
     * Resolves the host document to its tracked wrapper, asking the session registry for the owning
     * session when needed. Completes empty if no session claims the document.
     */
    public Mono<TrackedDocument> resolve(IHostDocument host) {
        return Mono.defer(() -> {
            var existing = find(host);
            if (existing.isPresent()) {
                return Mono.just(existing.get());
            }
            return sessions.sessionForDocument(host)
                    .filter(session -> !host.isDestroyed())
                    .map(session -> track(host, session));
        });
    }

    /** Resolves and tracks the document in the background. */
    public void register(IHostDocument host) {
        if (pendingResolutions.isDisposed() || host.isDestroyed() || find(host).isPresent()) {
            return;
        }
        var resolution = Disposables.swap();
        if (!pendingResolutions.add(resolution)) {
            return;
        }
        resolution.update(resolve(host)
                .doFinally(signal -> pendingResolutions.remove(resolution))
                .subscribe(
                        document -> {},
                        error -> logger.warn("Failed to resolve session for {}", host.getPath(), error)));
    }

    /** Resolutions started by {@link #register} that have not finished yet. */
    int pendingResolutionCount() {
        return pendingResolutions.size();
    }

    /** Registers every open, supported, not yet tracked document. */
    public void restoreUntracked(List<IHostDocument> openDocuments) {
        for (var host : openDocuments) {
            if (filter.isSupportedPath(host.getPath()) && find(host).isEmpty()) {
                logger.debug("Restoring session binding for {}", host.getPath());
                register(host);
            }
        }
    }

    @Override
    public void close() {
        pendingResolutions.dispose();
    }
}
