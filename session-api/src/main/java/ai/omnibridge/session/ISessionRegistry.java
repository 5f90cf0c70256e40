package ai.omnibridge.session;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Owner of every live analysis session. The orchestration core consumes this boundary and never
 * creates or destroys sessions itself.
 */
public interface ISessionRegistry {
    /** The session of the active document, replaying the current one. */
    Flux<Optional<ISession>> activeSession();

    /** Point-in-time snapshot in registry iteration order. */
    List<ISession> getActiveSessions();

    /** Latest connection state of every session, in registry iteration order. */
    Flux<List<SessionValue<ConnectionState>>> aggregateState();

    /**
     * Returns the session that owns the document, creating and starting one if needed. Completes
     * empty for documents no session can own.
     */
    Mono<ISession> sessionForDocument(IHostDocument document);

    /**
     * Fan-out primitive: subscribes {@code selector} on every session (present and future) and
     * emits the latest value of each, in registry iteration order, whenever any of them changes.
     * Sessions that have not produced a value yet are left out.
     */
    <T> Flux<List<SessionValue<T>>> listenTo(Function<ISession, Flux<T>> selector);

    void connect();

    void disconnect();

    boolean isConnected();

    /** Runs the callback for every session now and for every session created later. */
    void registerConfiguration(Consumer<ISession> callback);

    /** Hands the registry the committed active document so it can pick the active session. */
    void activate(Flux<Optional<IHostDocument>> activeDocument);

    void deactivate();
}
