package ai.omnibridge.context;

import ai.omnibridge.INotifier;
import ai.omnibridge.session.IHostDocument;
import ai.omnibridge.session.IHostWorkspace;
import java.time.Duration;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * Watches the active pane for documents that have never been saved. Such a document cannot be bound
 * to a session until it has a path, so this waits for its first path assignment and then hands it
 * on for registration.
 */
public final class UnsavedDocumentSafeguard {
    private static final Logger logger = LogManager.getLogger(UnsavedDocumentSafeguard.class);

    static final String UNSAVED_MESSAGE = "Functionality will be limited until the file has been saved.";

    private final IHostWorkspace workspace;
    private final DocumentFilter filter;
    private final INotifier notifier;
    private final Scheduler scheduler;
    private final Duration window;

    public UnsavedDocumentSafeguard(
            IHostWorkspace workspace,
            DocumentFilter filter,
            INotifier notifier,
            Scheduler scheduler,
            long debounceMillis) {
        this.workspace = workspace;
        this.filter = filter;
        this.notifier = notifier;
        this.scheduler = scheduler;
        this.window = Duration.ofMillis(debounceMillis);
    }

    /** Documents that were active while unsaved and have just received their first path. */
    public Flux<IHostDocument> savedDocuments() {
        return ActivitySource.paneItems(workspace)
                .filter(Optional::isPresent)
                .map(Optional::get)
                .sampleTimeout(item -> Mono.delay(window, scheduler))
                .switchMap(this::awaitFirstSave);
    }

    private Mono<IHostDocument> awaitFirstSave(IHostDocument document) {
        if (document.getPath() != null || document.isDestroyed()) {
            return Mono.empty();
        }
        if (filter.isSupportedLanguage(document.getLanguageId())) {
            notifier.showNotification(INotifier.NotificationRole.INFO, UNSAVED_MESSAGE);
        }
        logger.debug("Waiting for first save of unsaved {} document", document.getLanguageId());
        return Mono.create(sink -> sink.onDispose(document.onDidChangePath(() -> sink.success(document))));
    }
}
