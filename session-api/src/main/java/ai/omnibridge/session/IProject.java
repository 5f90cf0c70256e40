package ai.omnibridge.session;

import reactor.core.publisher.Flux;

/** A project known to one session. */
public interface IProject {
    String getName();

    /**
     * The project's active build target (framework moniker such as {@code net8.0}). Replays the
     * current target to new subscribers.
     */
    Flux<String> activeFramework();
}
