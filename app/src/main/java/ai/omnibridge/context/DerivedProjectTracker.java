package ai.omnibridge.context;

import ai.omnibridge.session.IProject;
import ai.omnibridge.util.Emission;
import java.util.Optional;
import java.util.function.Function;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * Projects the committed active context onto its owning project and that project's active
 * framework.
 *
 * <p>Holds no state besides the last published values. An empty context releases the inner project
 * lookup, so nothing here keeps a destroyed document reachable; the last project stays published.
 */
public final class DerivedProjectTracker implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(DerivedProjectTracker.class);

    private final Sinks.Many<IProject> activeProject = Sinks.many().replay().latest();
    private final Sinks.Many<ProjectFramework> activeFramework = Sinks.many().replay().latest();
    private final Disposable wiring;

    public DerivedProjectTracker(Flux<Optional<TrackedDocument>> activeContext) {
        var resolved = activeContext.switchMap(DerivedProjectTracker::projectFor).publish();
        var projectSub = resolved.distinctUntilChanged(Function.<IProject>identity(), (a, b) -> a == b)
                .subscribe(
                        project -> Emission.emit(activeProject, project),
                        error -> logger.error("Active project tracking failed", error));
        var frameworkSub = resolved.switchMap(project -> project.activeFramework()
                        .map(framework -> new ProjectFramework(project, framework)))
                .distinctUntilChanged()
                .subscribe(
                        framework -> Emission.emit(activeFramework, framework),
                        error -> logger.error("Active framework tracking failed", error));
        // both projections are subscribed before the first context is replayed
        wiring = Disposables.composite(resolved.connect(), frameworkSub, projectSub);
    }

    private static Flux<IProject> projectFor(Optional<TrackedDocument> context) {
        if (context.isEmpty() || context.get().isDestroyed()) {
            return Flux.empty();
        }
        var document = context.get();
        return document.getSession().projectForDocument(document.getHost());
    }

    /** Owning project of the active document; identity-distinct. */
    public Flux<IProject> activeProject() {
        return activeProject.asFlux();
    }

    /** Active project together with its active framework; value-distinct. */
    public Flux<ProjectFramework> activeFramework() {
        return activeFramework.asFlux();
    }

    @Override
    public void close() {
        wiring.dispose();
    }
}
