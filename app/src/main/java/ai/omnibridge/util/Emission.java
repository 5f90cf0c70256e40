package ai.omnibridge.util;

import java.time.Duration;
import reactor.core.publisher.Sinks;

/** Emission into hot sinks that are fed from host threads as well as the event scheduler. */
public final class Emission {
    /** Spins while another thread holds the sink; gives up after one second. */
    public static final Sinks.EmitFailureHandler RETRY_NON_SERIALIZED =
            Sinks.EmitFailureHandler.busyLooping(Duration.ofSeconds(1));

    private Emission() {}

    /** Emits the value; a sink without subscribers drops it. */
    public static <T> void emit(Sinks.Many<T> sink, T value) {
        sink.emitNext(value, RETRY_NON_SERIALIZED);
    }
}
