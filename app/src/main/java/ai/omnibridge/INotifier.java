package ai.omnibridge;

/**
 * User-facing notification sink. The host supplies an implementation that shows toasts; the core
 * only reports through it.
 */
public interface INotifier {
    enum NotificationRole {
        INFO,
        ERROR
    }

    void showNotification(NotificationRole role, String message);

    default void toolError(String msg, String title) {
        showNotification(NotificationRole.ERROR, title + ": " + msg);
    }
}
