package ai.omnibridge.scope;

import ai.omnibridge.INotifier;
import ai.omnibridge.session.DisposalRegistry;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.Function;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;

/**
 * Binds consumer side effects to the lifetime of an active value.
 *
 * <p>Each activation gets its own scope, opened under the switch's root scope and registered with
 * the value's own disposal registry when it has one. The scope is released when the value is
 * superseded, when it goes away, or when the root is released, whichever comes first. Release
 * completes before the next activation callback runs.
 *
 * <p>A callback that throws is logged and reported to the notifier. Its scope stays open and is
 * released like any other.
 */
public final class ScopedSwitch<T> {
    private static final Logger logger = LogManager.getLogger(ScopedSwitch.class);

    private final ScopeArena arena;
    private final ScopeHandle root;
    private final ScopeKind kind;
    private final Function<? super T, Optional<DisposalRegistry>> ownerRegistry;
    private final INotifier notifier;

    public ScopedSwitch(
            ScopeArena arena,
            ScopeHandle root,
            ScopeKind kind,
            Function<? super T, Optional<DisposalRegistry>> ownerRegistry,
            INotifier notifier) {
        this.arena = arena;
        this.root = root;
        this.kind = kind;
        this.ownerRegistry = ownerRegistry;
        this.notifier = notifier;
    }

    /**
     * Follows a single active value. Returns a scope that ends the switch, and the live activation,
     * when disposed.
     */
    public ScopeHandle switchActive(Flux<Optional<T>> active, BiConsumer<? super T, ScopeHandle> onActivate) {
        var outer = arena.open(root, kind.label());
        var state = new ActiveState<T>();
        outer.add(active.subscribe(
                next -> onActiveChanged(outer, state, next, onActivate),
                error -> logger.warn("{} stream failed", kind.label(), error)));
        return outer;
    }

    private void onActiveChanged(
            ScopeHandle outer, ActiveState<T> state, Optional<T> next, BiConsumer<? super T, ScopeHandle> onActivate) {
        ScopeHandle previous;
        synchronized (state) {
            if (next.isPresent() && state.value == next.get() && state.scope != null && !state.scope.isDisposed()) {
                return;
            }
            previous = state.scope;
            state.value = null;
            state.scope = null;
        }
        if (previous != null) {
            previous.dispose();
        }
        if (next.isEmpty() || outer.isDisposed()) {
            return;
        }
        var value = next.get();
        var scope = openScope(outer, value);
        synchronized (state) {
            state.value = value;
            state.scope = scope;
        }
        invoke(onActivate, value, scope);
    }

    /**
     * Follows every value the stream produces, each with its own scope. A value's scope ends when the
     * {@code endSignal} hook fires for it.
     *
     * @param endSignal registers a callback that runs once the value goes away
     */
    public ScopeHandle eachValue(
            Flux<T> values,
            BiFunction<? super T, Runnable, Disposable> endSignal,
            BiConsumer<? super T, ScopeHandle> onActivate) {
        var outer = arena.open(root, kind.label());
        Map<T, ScopeHandle> live = new IdentityHashMap<>();
        outer.add(values.subscribe(
                value -> {
                    synchronized (live) {
                        var existing = live.get(value);
                        if (existing != null && !existing.isDisposed()) {
                            return;
                        }
                    }
                    if (outer.isDisposed()) {
                        return;
                    }
                    var scope = openScope(outer, value);
                    synchronized (live) {
                        live.put(value, scope);
                    }
                    scope.add(() -> {
                        synchronized (live) {
                            live.remove(value, scope);
                        }
                    });
                    scope.add(endSignal.apply(value, scope::dispose));
                    if (!scope.isDisposed()) {
                        invoke(onActivate, value, scope);
                    }
                },
                error -> logger.warn("{} stream failed", kind.label(), error)));
        return outer;
    }

    private ScopeHandle openScope(ScopeHandle outer, T value) {
        var scope = arena.open(outer, kind.label());
        ownerRegistry.apply(value).ifPresent(registry -> {
            registry.add(scope);
            scope.onDetach(() -> registry.remove(scope));
        });
        logger.debug("Opened {} scope for {}", kind.label(), value);
        return scope;
    }

    private void invoke(BiConsumer<? super T, ScopeHandle> onActivate, T value, ScopeHandle scope) {
        try {
            onActivate.accept(value, scope);
        } catch (RuntimeException e) {
            logger.error("Error in {} callback for {}", kind.label(), value, e);
            notifier.toolError(String.valueOf(e.getMessage()), "Error in " + kind.label() + " handler");
        }
    }

    private static final class ActiveState<T> {
        @Nullable
        T value;

        @Nullable
        ScopeHandle scope;
    }
}
