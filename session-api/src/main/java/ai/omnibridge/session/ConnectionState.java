package ai.omnibridge.session;

/** Connection state of one analysis session. */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    ERROR;

    /** True for the states in which a session contributes nothing. */
    public boolean isOff() {
        return this == DISCONNECTED || this == ERROR;
    }
}
