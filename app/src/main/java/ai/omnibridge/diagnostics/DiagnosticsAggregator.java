package ai.omnibridge.diagnostics;

import ai.omnibridge.session.DiagnosticLocation;
import ai.omnibridge.session.ISession;
import ai.omnibridge.session.ISessionRegistry;
import ai.omnibridge.session.SessionValue;
import ai.omnibridge.util.Emission;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

/**
 * Diagnostics of the active session, or of all sessions merged, depending on a live toggle.
 *
 * <p>Three facets are kept: the flat list, counts per category and the file map. All three switch
 * source together, on the same samples of (active session, toggle). The cross-session source is
 * debounced; the single-session source is passed through as the session emits it.
 */
public final class DiagnosticsAggregator implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(DiagnosticsAggregator.class);

    /** One observation of the inputs that decide where diagnostics come from. */
    record ModeSample(Optional<ISession> session, boolean aggregate) {
        boolean sameAs(ModeSample other) {
            return aggregate == other.aggregate && session.orElse(null) == other.session.orElse(null);
        }

        @Override
        public String toString() {
            return "ModeSample{session=" + session.map(ISession::getName).orElse("none") + ", aggregate=" + aggregate
                    + '}';
        }
    }

    private final ISessionRegistry registry;
    private final Scheduler scheduler;
    private final Duration window;

    private final Sinks.Many<List<DiagnosticLocation>> diagnostics = Sinks.many().replay().latestOrDefault(List.of());
    private final Sinks.Many<Map<String, Integer>> counts = Sinks.many().replay().latestOrDefault(Map.of());
    private final Sinks.Many<Map<String, List<DiagnosticLocation>>> byFile =
            Sinks.many().replay().latestOrDefault(Map.of());

    private final Disposable wiring;

    public DiagnosticsAggregator(
            ISessionRegistry registry, Flux<Boolean> aggregateMode, Scheduler scheduler, long debounceMillis) {
        this.registry = registry;
        this.scheduler = scheduler;
        this.window = Duration.ofMillis(debounceMillis);

        var samples = switchingSamples(registry.activeSession(), aggregateMode)
                .doOnNext(sample -> logger.debug("Diagnostics source switching: {}", sample))
                .publish();
        var listSub = follow(
                samples.switchMap(sample -> facet(
                                sample, List.<DiagnosticLocation>of(), ISession::diagnostics, DiagnosticsMerge::concat)
                        .startWith(List.<DiagnosticLocation>of())),
                diagnostics);
        var countsSub = follow(
                samples.switchMap(sample -> facet(
                                sample, Map.<String, Integer>of(), ISession::diagnosticCounts, DiagnosticsMerge::sumCounts)
                        .startWith(Map.<String, Integer>of())),
                counts);
        var byFileSub = follow(
                samples.switchMap(sample -> facet(
                                sample,
                                Map.<String, List<DiagnosticLocation>>of(),
                                ISession::diagnosticsByFile,
                                DiagnosticsMerge::mergeByFile)
                        .startWith(Map.<String, List<DiagnosticLocation>>of())),
                byFile);
        // facets are subscribed before the first sample is taken
        wiring = Disposables.composite(samples.connect(), listSub, countsSub, byFileSub);
    }

    private static <T> Disposable follow(Flux<T> facet, Sinks.Many<T> sink) {
        return facet.subscribe(
                value -> Emission.emit(sink, value), error -> logger.error("Diagnostics facet failed", error));
    }

    /**
     * Samples of (active session, toggle) that require a new source. The first sample always
     * switches. While the toggle stays on the active session does not matter, so such samples are
     * dropped, as are exact repeats.
     */
    static Flux<ModeSample> switchingSamples(Flux<Optional<ISession>> activeSession, Flux<Boolean> aggregateMode) {
        return Flux.defer(() -> {
            var previous = new AtomicReference<ModeSample>();
            return Flux.combineLatest(
                            activeSession.startWith(Optional.<ISession>empty()), aggregateMode, ModeSample::new)
                    .filter(sample -> {
                        var last = previous.getAndSet(sample);
                        if (last == null) {
                            return true;
                        }
                        if (last.aggregate() && sample.aggregate()) {
                            return false;
                        }
                        return !last.sameAs(sample);
                    });
        });
    }

    private <T> Flux<T> facet(
            ModeSample sample, T identity, Function<ISession, Flux<T>> selector, Function<List<SessionValue<T>>, T> merge) {
        if (sample.aggregate()) {
            return registry.listenTo(session -> isolated(session, selector, identity))
                    .sampleTimeout(values -> Mono.delay(window, scheduler))
                    .map(merge);
        }
        if (sample.session().isPresent()) {
            return isolated(sample.session().get(), selector, identity);
        }
        return Flux.empty();
    }

    /** The session's stream with failures replaced by the identity value. */
    private static <T> Flux<T> isolated(ISession session, Function<ISession, Flux<T>> selector, T identity) {
        Flux<T> source;
        try {
            source = selector.apply(session);
        } catch (RuntimeException e) {
            logger.warn("Session {} could not provide diagnostics", session.getName(), e);
            return Flux.just(identity);
        }
        return source.doOnError(error ->
                        logger.warn("Diagnostics of session {} failed; treating as empty", session.getName(), error))
                .onErrorReturn(identity);
    }

    public Flux<List<DiagnosticLocation>> diagnostics() {
        return diagnostics.asFlux();
    }

    public Flux<Map<String, Integer>> diagnosticCounts() {
        return counts.asFlux();
    }

    public Flux<Map<String, List<DiagnosticLocation>>> diagnosticsByFile() {
        return byFile.asFlux();
    }

    @Override
    public void close() {
        wiring.dispose();
    }
}
