package ai.omnibridge.session;

/** The latest value of some per-session stream, paired with the session that produced it. */
public record SessionValue<T>(ISession session, T value) {}
