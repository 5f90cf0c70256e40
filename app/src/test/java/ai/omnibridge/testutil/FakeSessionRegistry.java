package ai.omnibridge.testutil;

import ai.omnibridge.session.ConnectionState;
import ai.omnibridge.session.IHostDocument;
import ai.omnibridge.session.ISession;
import ai.omnibridge.session.ISessionRegistry;
import ai.omnibridge.session.SessionValue;
import java.time.Duration;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Function;
import org.jetbrains.annotations.Nullable;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

/**
 * In-memory registry. A document belongs to the first session whose path is a prefix of the
 * document's path. The active session follows the document handed to {@link #activate}.
 */
public class FakeSessionRegistry implements ISessionRegistry {
    private final List<FakeSession> sessions = new CopyOnWriteArrayList<>();
    private final Sinks.Many<FakeSession> added = Sinks.many().multicast().directBestEffort();
    private final Sinks.Many<Optional<ISession>> activeSession =
            Sinks.many().replay().latestOrDefault(Optional.empty());
    private final List<Consumer<ISession>> configurations = new CopyOnWriteArrayList<>();

    private final AtomicInteger listenToSubscriptions = new AtomicInteger();
    private final AtomicInteger liveListenToSubscriptions = new AtomicInteger();
    private final AtomicInteger sessionLookups = new AtomicInteger();
    private final List<Optional<IHostDocument>> activatedDocuments = new CopyOnWriteArrayList<>();

    private volatile boolean connected;
    private volatile boolean deactivated;

    @Nullable
    private Disposable activation;

    @Nullable
    private Duration lookupDelay;

    @Nullable
    private Scheduler lookupScheduler;

    public FakeSession addSession(String name, String path) {
        var session = new FakeSession(name, path);
        sessions.add(session);
        for (var callback : configurations) {
            callback.accept(session);
        }
        added.emitNext(session, Sinks.EmitFailureHandler.FAIL_FAST);
        return session;
    }

    public void setActiveSession(@Nullable ISession session) {
        activeSession.emitNext(Optional.ofNullable(session), Sinks.EmitFailureHandler.FAIL_FAST);
    }

    /** Makes every later {@link #sessionForDocument} lookup answer after the delay. */
    public void delayLookups(Duration delay, Scheduler scheduler) {
        this.lookupDelay = delay;
        this.lookupScheduler = scheduler;
    }

    public Optional<FakeSession> ownerOf(IHostDocument document) {
        var path = document.getPath();
        if (path == null) {
            return Optional.empty();
        }
        return sessions.stream().filter(s -> path.startsWith(s.getPath())).findFirst();
    }

    @Override
    public Flux<Optional<ISession>> activeSession() {
        return activeSession.asFlux();
    }

    @Override
    public List<ISession> getActiveSessions() {
        return new ArrayList<>(sessions);
    }

    @Override
    public Flux<List<SessionValue<ConnectionState>>> aggregateState() {
        return listenTo(ISession::state);
    }

    @Override
    public Mono<ISession> sessionForDocument(IHostDocument document) {
        return Mono.defer(() -> {
            sessionLookups.incrementAndGet();
            var found = ownerOf(document).map(s -> Mono.<ISession>just(s)).orElseGet(Mono::empty);
            var delay = lookupDelay;
            var scheduler = lookupScheduler;
            if (delay != null && scheduler != null) {
                return found.delayElement(delay, scheduler);
            }
            return found;
        });
    }

    @Override
    public <T> Flux<List<SessionValue<T>>> listenTo(Function<ISession, Flux<T>> selector) {
        return Flux.create(sink -> {
            listenToSubscriptions.incrementAndGet();
            liveListenToSubscriptions.incrementAndGet();
            Map<ISession, T> latest = new IdentityHashMap<>();
            var inner = Disposables.composite();
            Runnable emit = () -> {
                var values = new ArrayList<SessionValue<T>>();
                synchronized (latest) {
                    for (var session : sessions) {
                        if (latest.containsKey(session)) {
                            values.add(new SessionValue<>(session, latest.get(session)));
                        }
                    }
                }
                sink.next(values);
            };
            Consumer<FakeSession> follow = session -> inner.add(selector.apply(session)
                    .subscribe(
                            value -> {
                                synchronized (latest) {
                                    latest.put(session, value);
                                }
                                emit.run();
                            },
                            sink::error));
            sessions.forEach(follow);
            inner.add(added.asFlux().subscribe(follow));
            sink.onDispose(() -> {
                liveListenToSubscriptions.decrementAndGet();
                inner.dispose();
            });
        });
    }

    /** Every subscription ever made through {@link #listenTo}. */
    public int listenToSubscriptionCount() {
        return listenToSubscriptions.get();
    }

    public int liveListenToSubscriptionCount() {
        return liveListenToSubscriptions.get();
    }

    public int sessionLookupCount() {
        return sessionLookups.get();
    }

    @Override
    public void connect() {
        connected = true;
        sessions.forEach(s -> s.setState(ConnectionState.CONNECTED));
    }

    @Override
    public void disconnect() {
        connected = false;
        sessions.forEach(s -> s.setState(ConnectionState.DISCONNECTED));
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public void registerConfiguration(Consumer<ISession> callback) {
        configurations.add(callback);
        sessions.forEach(callback);
    }

    @Override
    public synchronized void activate(Flux<Optional<IHostDocument>> activeDocument) {
        activation = activeDocument.subscribe(document -> {
            activatedDocuments.add(document);
            document.flatMap(this::ownerOf).ifPresent(this::setActiveSession);
        });
    }

    @Override
    public synchronized void deactivate() {
        deactivated = true;
        if (activation != null) {
            activation.dispose();
            activation = null;
        }
    }

    public List<Optional<IHostDocument>> activatedDocuments() {
        return activatedDocuments;
    }

    public boolean isDeactivated() {
        return deactivated;
    }
}
