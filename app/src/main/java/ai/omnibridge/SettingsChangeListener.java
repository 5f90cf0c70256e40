package ai.omnibridge;

public interface SettingsChangeListener {
    default void aggregateAllSessionsChanged() {}

    default void documentPatternsChanged() {}

    default void timingsChanged() {}
}
