package ai.omnibridge.session;

import reactor.core.Disposable;

/**
 * Disposal container owned by a live value (typically a session). Everything added is disposed
 * when the owner goes away, unless it was removed first.
 */
public interface DisposalRegistry {
    void add(Disposable disposable);

    /** Removes without disposing. Removing something that is not registered is a no-op. */
    void remove(Disposable disposable);
}
