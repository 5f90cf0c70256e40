package ai.omnibridge.context;

import ai.omnibridge.session.IHostDocument;
import ai.omnibridge.util.CoreSettings;
import org.jetbrains.annotations.Nullable;
import org.jspecify.annotations.NullMarked;

/** Decides which host documents the core cares about. Reads the settings on every call. */
@NullMarked
public final class DocumentFilter {
    private final CoreSettings settings;

    public DocumentFilter(CoreSettings settings) {
        this.settings = settings;
    }

    public boolean isSupportedPath(@Nullable String path) {
        return path != null && settings.getSupportedExtensions().stream().anyMatch(path::endsWith);
    }

    public boolean isConfigPath(@Nullable String path) {
        return path != null && settings.getConfigSuffixes().stream().anyMatch(path::endsWith);
    }

    public boolean isSupportedLanguage(String languageId) {
        return settings.getSupportedLanguages().contains(languageId);
    }

    /** Whether an active pane item may become the active context. */
    public boolean isCandidate(IHostDocument document) {
        return isSupportedLanguage(document.getLanguageId()) || isSupportedPath(document.getPath());
    }
}
