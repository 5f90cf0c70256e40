package ai.omnibridge.util;

import ai.omnibridge.SettingsChangeListener;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jspecify.annotations.NullMarked;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * Settings of the orchestration core, persisted as a properties file.
 *
 * <p>A missing file yields the defaults. Unparseable numeric values fall back to their default.
 */
@NullMarked
public final class CoreSettings {
    private static final Logger logger = LogManager.getLogger(CoreSettings.class);

    public static final String SETTINGS_FILE_NAME = "omnibridge.properties";

    public static final String AGGREGATE_ALL_SESSIONS_KEY = "diagnostics.aggregateAllSessions";
    public static final String SUPPORTED_EXTENSIONS_KEY = "documents.supportedExtensions";
    public static final String CONFIG_SUFFIXES_KEY = "documents.configSuffixes";
    public static final String SUPPORTED_LANGUAGES_KEY = "documents.supportedLanguages";
    public static final String CONTEXT_DEBOUNCE_KEY = "timing.contextDebounceMillis";
    public static final String DIAGNOSTICS_DEBOUNCE_KEY = "timing.diagnosticsDebounceMillis";
    public static final String UNSAVED_DEBOUNCE_KEY = "timing.unsavedDocumentDebounceMillis";

    static final String DEFAULT_SUPPORTED_EXTENSIONS = ".cs,.csx,project.json";
    static final String DEFAULT_CONFIG_SUFFIXES = "project.json";
    static final String DEFAULT_SUPPORTED_LANGUAGES = "csharp";
    public static final long DEFAULT_CONTEXT_DEBOUNCE_MS = 100;
    public static final long DEFAULT_DIAGNOSTICS_DEBOUNCE_MS = 200;
    public static final long DEFAULT_UNSAVED_DEBOUNCE_MS = 50;

    private static final Splitter LIST_SPLITTER =
            Splitter.on(',').trimResults().omitEmptyStrings();
    private static final Joiner LIST_JOINER = Joiner.on(',');

    // guarded by 'this'
    private final Properties props;

    private final Sinks.Many<Boolean> aggregateAllSessions;
    private final List<SettingsChangeListener> listeners = new CopyOnWriteArrayList<>();

    private CoreSettings(Properties props) {
        this.props = props;
        this.aggregateAllSessions = Sinks.many().replay().latestOrDefault(readAggregateAllSessions(props));
    }

    public static CoreSettings defaults() {
        return new CoreSettings(new Properties());
    }

    public static CoreSettings load(Path path) {
        return new CoreSettings(readProps(path));
    }

    private static Properties readProps(Path path) {
        var props = new Properties();
        if (Files.exists(path)) {
            try (var reader = Files.newBufferedReader(path)) {
                props.load(reader);
            } catch (IOException e) {
                logger.error("Failed to load settings from {}: {}", path, e.getMessage());
            }
        } else {
            logger.debug("No settings file at {}; using defaults", path);
        }
        return props;
    }

    public synchronized void save(Path path) throws IOException {
        var parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (var writer = Files.newBufferedWriter(path)) {
            props.store(writer, "Omnibridge settings");
        }
    }

    /**
     * Re-reads the file and applies every value that changed, notifying listeners once per changed
     * group.
     */
    public void reload(Path path) {
        var fresh = readProps(path);
        boolean aggregateChanged;
        boolean patternsChanged;
        boolean timingsChanged;
        synchronized (this) {
            aggregateChanged = readAggregateAllSessions(fresh) != readAggregateAllSessions(props);
            patternsChanged = differs(fresh, SUPPORTED_EXTENSIONS_KEY)
                    || differs(fresh, CONFIG_SUFFIXES_KEY)
                    || differs(fresh, SUPPORTED_LANGUAGES_KEY);
            timingsChanged = differs(fresh, CONTEXT_DEBOUNCE_KEY)
                    || differs(fresh, DIAGNOSTICS_DEBOUNCE_KEY)
                    || differs(fresh, UNSAVED_DEBOUNCE_KEY);
            props.clear();
            props.putAll(fresh);
        }
        if (aggregateChanged) {
            Emission.emit(aggregateAllSessions, isAggregateAllSessions());
            fire(SettingsChangeListener::aggregateAllSessionsChanged);
        }
        if (patternsChanged) {
            fire(SettingsChangeListener::documentPatternsChanged);
        }
        if (timingsChanged) {
            fire(SettingsChangeListener::timingsChanged);
        }
    }

    private boolean differs(Properties fresh, String key) {
        return !Objects.equals(fresh.getProperty(key), props.getProperty(key));
    }

    public void addSettingsChangeListener(SettingsChangeListener listener) {
        listeners.add(listener);
    }

    public void removeSettingsChangeListener(SettingsChangeListener listener) {
        listeners.remove(listener);
    }

    private void fire(Consumer<SettingsChangeListener> event) {
        for (var listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                logger.warn("Settings listener {} failed", listener, e);
            }
        }
    }

    // ---------------------------------------------------------------------------------------------
    // Diagnostics
    // ---------------------------------------------------------------------------------------------

    public synchronized boolean isAggregateAllSessions() {
        return readAggregateAllSessions(props);
    }

    /** Live view of the aggregation toggle; replays the current value. */
    public Flux<Boolean> observeAggregateAllSessions() {
        return aggregateAllSessions.asFlux();
    }

    public void setAggregateAllSessions(boolean enabled) {
        synchronized (this) {
            props.setProperty(AGGREGATE_ALL_SESSIONS_KEY, Boolean.toString(enabled));
        }
        Emission.emit(aggregateAllSessions, enabled);
        fire(SettingsChangeListener::aggregateAllSessionsChanged);
    }

    private static boolean readAggregateAllSessions(Properties props) {
        return Boolean.parseBoolean(props.getProperty(AGGREGATE_ALL_SESSIONS_KEY, "false"));
    }

    // ---------------------------------------------------------------------------------------------
    // Documents
    // ---------------------------------------------------------------------------------------------

    public synchronized List<String> getSupportedExtensions() {
        return readList(SUPPORTED_EXTENSIONS_KEY, DEFAULT_SUPPORTED_EXTENSIONS);
    }

    public synchronized List<String> getConfigSuffixes() {
        return readList(CONFIG_SUFFIXES_KEY, DEFAULT_CONFIG_SUFFIXES);
    }

    public synchronized List<String> getSupportedLanguages() {
        return readList(SUPPORTED_LANGUAGES_KEY, DEFAULT_SUPPORTED_LANGUAGES);
    }

    public void setSupportedExtensions(List<String> extensions) {
        synchronized (this) {
            props.setProperty(SUPPORTED_EXTENSIONS_KEY, LIST_JOINER.join(extensions));
        }
        fire(SettingsChangeListener::documentPatternsChanged);
    }

    public void setConfigSuffixes(List<String> suffixes) {
        synchronized (this) {
            props.setProperty(CONFIG_SUFFIXES_KEY, LIST_JOINER.join(suffixes));
        }
        fire(SettingsChangeListener::documentPatternsChanged);
    }

    private List<String> readList(String key, String defaultValue) {
        return LIST_SPLITTER.splitToList(props.getProperty(key, defaultValue));
    }

    // ---------------------------------------------------------------------------------------------
    // Timings
    // ---------------------------------------------------------------------------------------------

    public synchronized long getContextDebounceMillis() {
        return readMillis(CONTEXT_DEBOUNCE_KEY, DEFAULT_CONTEXT_DEBOUNCE_MS);
    }

    public synchronized long getDiagnosticsDebounceMillis() {
        return readMillis(DIAGNOSTICS_DEBOUNCE_KEY, DEFAULT_DIAGNOSTICS_DEBOUNCE_MS);
    }

    public synchronized long getUnsavedDocumentDebounceMillis() {
        return readMillis(UNSAVED_DEBOUNCE_KEY, DEFAULT_UNSAVED_DEBOUNCE_MS);
    }

    private long readMillis(String key, long defaultValue) {
        var raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            long value = Long.parseLong(raw.trim());
            if (value < 0) {
                logger.warn("Negative value {} for {}; using default {}", value, key, defaultValue);
                return defaultValue;
            }
            return value;
        } catch (NumberFormatException e) {
            logger.warn("Invalid value '{}' for {}; using default {}", raw, key, defaultValue);
            return defaultValue;
        }
    }
}
