package ai.omnibridge.session;

import java.util.List;
import java.util.Map;
import reactor.core.publisher.Flux;

/**
 * One analysis backend instance. Owned by the {@link ISessionRegistry}; everyone else holds
 * non-owning references.
 *
 * <p>The state and diagnostics streams replay their latest value to new subscribers.
 */
public interface ISession {
    String getName();

    /** Root path the session was started for. */
    String getPath();

    Flux<ConnectionState> state();

    ConnectionState getCurrentState();

    default boolean isConnected() {
        return getCurrentState() == ConnectionState.CONNECTED;
    }

    /** Emits this session once it is connected (immediately if it already is). */
    Flux<ISession> whenConnected();

    Flux<List<DiagnosticLocation>> diagnostics();

    /** Finding counts keyed by {@link DiagnosticLocation#logLevel()}. */
    Flux<Map<String, Integer>> diagnosticCounts();

    /** Full file to findings map, re-emitted whenever any file's findings change. */
    Flux<Map<String, List<DiagnosticLocation>>> diagnosticsByFile();

    List<IProject> getProjects();

    /** Resolves the project that owns the document. May never emit when no project claims it. */
    Flux<IProject> projectForDocument(IHostDocument document);

    /** Disposal container torn down together with the session. */
    DisposalRegistry disposables();
}
