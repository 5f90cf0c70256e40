package ai.omnibridge.scope;

/** Which active value a {@link ScopedSwitch} follows. Only used for labels and error reports. */
public enum ScopeKind {
    ACTIVE_EDITOR("active editor"),
    ACTIVE_CONFIG_EDITOR("active config editor"),
    ACTIVE_CONTEXT("active context"),
    ACTIVE_SESSION("active session"),
    EACH_EDITOR("each editor"),
    EACH_CONFIG_EDITOR("each config editor");

    private final String label;

    ScopeKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
