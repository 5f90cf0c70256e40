package ai.omnibridge;

import ai.omnibridge.context.ActiveContextTracker;
import ai.omnibridge.context.ActivitySource;
import ai.omnibridge.context.DerivedProjectTracker;
import ai.omnibridge.context.DocumentFilter;
import ai.omnibridge.context.DocumentRegistry;
import ai.omnibridge.context.ProjectFramework;
import ai.omnibridge.context.TrackedDocument;
import ai.omnibridge.context.UnsavedDocumentSafeguard;
import ai.omnibridge.diagnostics.DiagnosticsAggregator;
import ai.omnibridge.scope.ScopeArena;
import ai.omnibridge.scope.ScopeHandle;
import ai.omnibridge.scope.ScopeKind;
import ai.omnibridge.scope.ScopedSwitch;
import ai.omnibridge.session.DiagnosticLocation;
import ai.omnibridge.session.DisposalRegistry;
import ai.omnibridge.session.IHostDocument;
import ai.omnibridge.session.IHostWorkspace;
import ai.omnibridge.session.IProject;
import ai.omnibridge.session.ISession;
import ai.omnibridge.session.ISessionRegistry;
import ai.omnibridge.util.CoreSettings;
import com.google.common.base.Joiner;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Function;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.reactivestreams.Publisher;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Entry point of the orchestration core. Wires host notifications, the session registry and the
 * trackers together and exposes the resulting streams and scoped-switch operations.
 *
 * <p>Every stream returned here replays its latest value to new subscribers. Nothing touches the
 * host until {@link #activate()}; {@link #close()} releases everything that was wired.
 */
public class ActivityManager implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(ActivityManager.class);

    private static final Joiner FRAMEWORK_JOINER = Joiner.on(',');

    private final ISessionRegistry sessions;
    private final IHostWorkspace workspace;
    private final CoreSettings settings;
    private final INotifier notifier;

    private final DocumentFilter filter;
    private final DocumentRegistry documents;
    private final ActiveContextTracker tracker;
    private final ActivitySource source;
    private final UnsavedDocumentSafeguard safeguard;
    private final DerivedProjectTracker projects;
    private final DiagnosticsAggregator diagnostics;

    private final ScopeArena arena = new ScopeArena();
    private final ScopeHandle root;
    private final Disposable.Composite requests = Disposables.composite();
    private final SettingsChangeListener settingsListener;
    private final Disposable ownedScheduler;

    private volatile boolean off = true;
    private boolean active;
    private boolean closed;

    /** Runs on a dedicated event thread that is released on {@link #close()}. */
    public ActivityManager(
            ISessionRegistry sessions, IHostWorkspace workspace, CoreSettings settings, INotifier notifier) {
        this(sessions, workspace, settings, Schedulers.newSingle("omnibridge-events", true), notifier, true);
    }

    /** Runs on the given scheduler; the caller keeps ownership of it. */
    public ActivityManager(
            ISessionRegistry sessions,
            IHostWorkspace workspace,
            CoreSettings settings,
            Scheduler scheduler,
            INotifier notifier) {
        this(sessions, workspace, settings, scheduler, notifier, false);
    }

    private ActivityManager(
            ISessionRegistry sessions,
            IHostWorkspace workspace,
            CoreSettings settings,
            Scheduler scheduler,
            INotifier notifier,
            boolean ownsScheduler) {
        this.sessions = sessions;
        this.workspace = workspace;
        this.settings = settings;
        this.notifier = notifier;

        this.filter = new DocumentFilter(settings);
        this.documents = new DocumentRegistry(sessions, filter);
        this.tracker = new ActiveContextTracker(scheduler, settings.getContextDebounceMillis());
        this.source = new ActivitySource(workspace, documents, filter, scheduler);
        this.safeguard = new UnsavedDocumentSafeguard(
                workspace, filter, notifier, scheduler, settings.getUnsavedDocumentDebounceMillis());
        this.projects = new DerivedProjectTracker(tracker.activeContext());
        this.diagnostics = new DiagnosticsAggregator(
                sessions, settings.observeAggregateAllSessions(), scheduler, settings.getDiagnosticsDebounceMillis());
        this.root = arena.openRoot("activity manager");
        root.add(requests);
        this.ownedScheduler = ownsScheduler ? scheduler : Disposables.disposed();

        this.settingsListener = new SettingsChangeListener() {
            @Override
            public void documentPatternsChanged() {
                if (isActive()) {
                    documents.restoreUntracked(workspace.getDocuments());
                }
            }

            @Override
            public void timingsChanged() {
                logger.info("Debounce timings changed; they apply once the activity manager is recreated");
            }
        };
    }

    /** Starts following the host and the session registry. Calling it twice has no effect. */
    public void activate() {
        synchronized (this) {
            if (active || closed) {
                return;
            }
            active = true;
        }
        logger.info("Activating");
        var wiring = root.openChild("host wiring");

        wiring.add(documents.destroyed().subscribe(tracker::documentDestroyed));
        wiring.add(workspace.observeDocuments(this::registerIfSupported));
        wiring.add(safeguard.savedDocuments().subscribe(this::registerIfSupported));

        // restore session bindings after a reconnect
        wiring.add(sessions.activeSession()
                .subscribe(session -> documents.restoreUntracked(workspace.getDocuments())));

        wiring.add(sessions.aggregateState().subscribe(states -> {
            off = states.stream().allMatch(state -> state.value().isOff());
        }));

        sessions.activate(tracker.activeContext().map(context -> context.map(TrackedDocument::getHost)));

        source.start(tracker::submit);
        wiring.add(source::close);

        settings.addSettingsChangeListener(settingsListener);
        wiring.add(() -> settings.removeSettingsChangeListener(settingsListener));
    }

    private synchronized boolean isActive() {
        return active && !closed;
    }

    private void registerIfSupported(IHostDocument host) {
        if (filter.isSupportedPath(host.getPath())) {
            documents.register(host);
        }
    }

    // ---------------------------------------------------------------------------------------------
    // Active context
    // ---------------------------------------------------------------------------------------------

    public Flux<Optional<TrackedDocument>> activeContext() {
        return tracker.activeContext();
    }

    public Flux<Optional<TrackedDocument>> activeEditor() {
        return tracker.activeEditor();
    }

    public Flux<Optional<TrackedDocument>> activeConfigEditor() {
        return tracker.activeConfigEditor();
    }

    public Flux<Optional<TrackedDocument>> activeEditorOnly() {
        return tracker.activeEditorOnly();
    }

    public Flux<Optional<ISession>> activeSession() {
        return sessions.activeSession();
    }

    public Flux<IProject> activeProject() {
        return projects.activeProject();
    }

    public Flux<ProjectFramework> activeFramework() {
        return projects.activeFramework();
    }

    /** Every tracked plain document, live ones first, then each one as it is tracked. */
    public Flux<TrackedDocument> editors() {
        return documents.documents().filter(document -> !document.isConfig());
    }

    public Flux<TrackedDocument> configEditors() {
        return documents.documents().filter(TrackedDocument::isConfig);
    }

    // ---------------------------------------------------------------------------------------------
    // Diagnostics
    // ---------------------------------------------------------------------------------------------

    public Flux<List<DiagnosticLocation>> diagnostics() {
        return diagnostics.diagnostics();
    }

    public Flux<Map<String, Integer>> diagnosticCounts() {
        return diagnostics.diagnosticCounts();
    }

    public Flux<Map<String, List<DiagnosticLocation>>> diagnosticsByFile() {
        return diagnostics.diagnosticsByFile();
    }

    // ---------------------------------------------------------------------------------------------
    // Scoped switches
    // ---------------------------------------------------------------------------------------------

    public ScopeHandle switchActiveEditor(BiConsumer<? super TrackedDocument, ScopeHandle> callback) {
        return documentSwitch(ScopeKind.ACTIVE_EDITOR).switchActive(tracker.activeEditor(), callback);
    }

    public ScopeHandle switchActiveConfigEditor(BiConsumer<? super TrackedDocument, ScopeHandle> callback) {
        return documentSwitch(ScopeKind.ACTIVE_CONFIG_EDITOR).switchActive(tracker.activeConfigEditor(), callback);
    }

    /** Like {@link #switchActiveEditor} but for either kind of document; not tied to a session. */
    public ScopeHandle switchActiveContext(BiConsumer<? super TrackedDocument, ScopeHandle> callback) {
        return new ScopedSwitch<TrackedDocument>(
                        arena, root, ScopeKind.ACTIVE_CONTEXT, document -> Optional.empty(), notifier)
                .switchActive(tracker.activeContext(), callback);
    }

    public ScopeHandle switchActiveSession(BiConsumer<? super ISession, ScopeHandle> callback) {
        return new ScopedSwitch<ISession>(
                        arena, root, ScopeKind.ACTIVE_SESSION, session -> Optional.of(session.disposables()), notifier)
                .switchActive(sessions.activeSession(), callback);
    }

    /** Runs the callback for every plain document, scoped to that document's lifetime. */
    public ScopeHandle eachEditor(BiConsumer<? super TrackedDocument, ScopeHandle> callback) {
        return documentSwitch(ScopeKind.EACH_EDITOR)
                .eachValue(editors(), (document, end) -> document.getHost().onDidDestroy(end), callback);
    }

    public ScopeHandle eachConfigEditor(BiConsumer<? super TrackedDocument, ScopeHandle> callback) {
        return documentSwitch(ScopeKind.EACH_CONFIG_EDITOR)
                .eachValue(configEditors(), (document, end) -> document.getHost().onDidDestroy(end), callback);
    }

    private ScopedSwitch<TrackedDocument> documentSwitch(ScopeKind kind) {
        Function<TrackedDocument, Optional<DisposalRegistry>> owner =
                document -> Optional.of(document.getSession().disposables());
        return new ScopedSwitch<>(arena, root, kind, owner, notifier);
    }

    // ---------------------------------------------------------------------------------------------
    // Sessions
    // ---------------------------------------------------------------------------------------------

    public void connect() {
        logger.info("Connecting");
        sessions.connect();
    }

    public void disconnect() {
        logger.info("Disconnecting");
        sessions.disconnect();
    }

    public void toggle() {
        if (sessions.isConnected()) {
            disconnect();
        } else {
            connect();
        }
    }

    public boolean isConnected() {
        return sessions.isConnected();
    }

    /** True while every session is disconnected or failed, including before any session exists. */
    public boolean isOff() {
        return off;
    }

    public boolean isOn() {
        return !isOff();
    }

    public void registerConfiguration(Consumer<ISession> callback) {
        sessions.registerConfiguration(callback);
    }

    /** Snapshot of the live sessions taken when subscribed; later additions are not emitted. */
    public Flux<ISession> sessions() {
        return Flux.defer(() -> Flux.fromIterable(sessions.getActiveSessions()));
    }

    /** The owning session, or empty if no session can own the document. */
    public Mono<ISession> sessionForDocument(IHostDocument host) {
        var tracked = documents.find(host);
        if (tracked.isPresent()) {
            return Mono.just(tracked.get().getSession());
        }
        return sessions.sessionForDocument(host);
    }

    /** The project owning the document, once. */
    public Mono<IProject> projectForDocument(IHostDocument host) {
        return sessionForDocument(host).flatMap(session -> session.projectForDocument(host).next());
    }

    /** First live session that knows a project with the same name. */
    public Optional<ISession> sessionForProject(IProject project) {
        return sessions.getActiveSessions().stream()
                .filter(session -> session.getProjects().stream()
                        .anyMatch(p -> p.getName().equals(project.getName())))
                .findFirst();
    }

    /** Emits the document each time its session reports it is connected. */
    public Flux<IHostDocument> whenDocumentConnected(IHostDocument host) {
        return sessionForDocument(host).flatMapMany(ISession::whenConnected).map(session -> host);
    }

    /**
     * Runs the request against the session of the active document, or the active session. Only the
     * first value of the callback's publisher is kept.
     */
    public <T> Mono<T> request(Function<ISession, ? extends Publisher<T>> callback) {
        var current = tracker.current();
        if (current.isPresent()) {
            return request(current.get().getHost(), callback);
        }
        return connectEagerly(sessions.activeSession()
                .next()
                .flatMap(active -> active.map(session -> Mono.<T>from(callback.apply(session)))
                        .orElseGet(Mono::empty)));
    }

    /** Runs the request against the document's session. */
    public <T> Mono<T> request(IHostDocument host, Function<ISession, ? extends Publisher<T>> callback) {
        return connectEagerly(sessionForDocument(host).flatMap(session -> Mono.<T>from(callback.apply(session))));
    }

    /**
     * Subscribes now, so the request runs even if the caller never subscribes. The eager
     * subscription is held until the request terminates; {@link #close()} cancels it.
     */
    private <T> Mono<T> connectEagerly(Mono<T> request) {
        var result = request.cache();
        var eager = Disposables.swap();
        if (!requests.add(eager)) {
            return result;
        }
        eager.update(result.doFinally(signal -> requests.remove(eager))
                .subscribe(value -> {}, error -> logger.warn("Request failed", error)));
        return result;
    }

    /** Requests whose eager subscription is still held. */
    int pendingRequestCount() {
        return requests.size();
    }

    /**
     * Joins the framework part of {@code name+framework} project entries. Entries without a
     * framework are skipped.
     */
    public static String getFrameworks(List<String> projects) {
        return FRAMEWORK_JOINER.join(projects.stream()
                .map(ActivityManager::frameworkOf)
                .filter(framework -> !framework.isEmpty())
                .iterator());
    }

    private static String frameworkOf(@Nullable String project) {
        if (project == null) {
            return "";
        }
        int plus = project.indexOf('+');
        if (plus < 0) {
            return "";
        }
        var rest = project.substring(plus + 1);
        int next = rest.indexOf('+');
        return next < 0 ? rest : rest.substring(0, next);
    }

    @Override
    public void close() {
        boolean wasActive;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            wasActive = active;
        }
        logger.info("Closing");
        if (wasActive) {
            sessions.deactivate();
        }
        root.dispose();
        source.close();
        documents.close();
        tracker.close();
        projects.close();
        diagnostics.close();
        ownedScheduler.dispose();
    }
}
