package deskmigrator.config;

import deskmigrator.mapping.TranslatorScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Function;

/**
 * Loads migration configuration from properties or YAML files.
 *
 * <p>Configuration is searched in the following order:
 * <ol>
 *   <li>{@code migration.properties} on the classpath</li>
 *   <li>{@code migration.yml} on the classpath</li>
 * </ol>
 *
 * <p>System properties with the same keys override file values
 * (e.g. {@code -Dmigration.worker.threads=4}). Invalid values are logged and
 * the default is kept.
 *
 * <h2>Configuration Properties:</h2>
 * <ul>
 *   <li>{@code migration.adapter.timeout} - seconds, 0 disables</li>
 *   <li>{@code migration.translator.scope} - JOB or TARGET_INSTANCE</li>
 *   <li>{@code migration.record.parallelism} - concurrent creates per component</li>
 *   <li>{@code migration.worker.threads} - concurrent jobs</li>
 *   <li>{@code migration.history.size} - number of history entries</li>
 *   <li>{@code migration.alert.level} - DEBUG, WARNING, or ERROR</li>
 *   <li>{@code migration.snapshot.base.dir} - directory holding snapshot blobs</li>
 * </ul>
 *
 * @see MigrationConfig
 */
public final class MigrationConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(MigrationConfigLoader.class);

    private MigrationConfigLoader() {}

    /**
     * Load from classpath (migration.properties, then migration.yml).
     * @throws MigrationConfigException if neither file is present
     */
    public static MigrationConfig load() {
        return fromClasspath().orElseThrow(() -> new MigrationConfigException(
                "Config file required: migration.properties or migration.yml"));
    }

    /**
     * Like {@link #load()}, but falls back to {@link MigrationConfig#DEFAULTS}
     * (with system property overrides) when no file is on the classpath.
     */
    public static MigrationConfig loadOrDefaults() {
        return fromClasspath().orElseGet(() -> {
            log.info("No migration config on classpath, using defaults");
            return parse(new Properties());
        });
    }

    private static Optional<MigrationConfig> fromClasspath() {
        ClassLoader cl = MigrationConfigLoader.class.getClassLoader();
        InputStream props = cl.getResourceAsStream("migration.properties");
        if (props != null) {
            return Optional.of(loadProperties(props, "migration.properties"));
        }
        InputStream yml = cl.getResourceAsStream("migration.yml");
        if (yml != null) {
            return Optional.of(loadYaml(yml, "migration.yml"));
        }
        return Optional.empty();
    }

    /**
     * Loads configuration from an external file.
     *
     * @param path path to the configuration file (.properties or .yml/.yaml)
     * @return the loaded configuration
     * @throws IOException if the file cannot be read
     * @throws MigrationConfigException if the file cannot be parsed
     */
    public static MigrationConfig loadFromFile(Path path) throws IOException {
        String name = path.getFileName().toString();
        try (InputStream is = Files.newInputStream(path)) {
            if (name.endsWith(".yml") || name.endsWith(".yaml")) {
                return loadYaml(is, name);
            }
            return loadProperties(is, name);
        }
    }

    private static MigrationConfig loadProperties(InputStream is, String source) {
        try (is) {
            Properties props = new Properties();
            props.load(is);
            log.info("Loaded config from {}", source);
            return parse(props);
        } catch (IOException e) {
            throw new MigrationConfigException("Failed to load " + source, e);
        }
    }

    private static MigrationConfig loadYaml(InputStream is, String source) {
        Map<String, Object> root;
        try (is) {
            root = new Yaml().load(is);
        } catch (YAMLException | IOException e) {
            throw new MigrationConfigException("Failed to load " + source, e);
        }
        Properties props = new Properties();
        if (root != null) {
            flatten("", root, props);
        }
        log.info("Loaded config from {}", source);
        return parse(props);
    }

    @SuppressWarnings("unchecked")
    private static void flatten(String prefix, Map<String, Object> map, Properties props) {
        for (var entry : map.entrySet()) {
            String key = prefix.isEmpty() ? entry.getKey() : prefix + "." + entry.getKey();
            Object val = entry.getValue();
            if (val instanceof Map) {
                flatten(key, (Map<String, Object>) val, props);
            } else if (val != null) {
                props.setProperty(key, val.toString());
            }
        }
    }

    private static MigrationConfig parse(Properties props) {
        MigrationConfig.Builder b = MigrationConfig.builder();

        getLong(props, "migration.adapter.timeout").ifPresent(b::adapterTimeoutSeconds);

        getString(props, "migration.translator.scope").ifPresent(v -> {
            try {
                b.translatorScope(TranslatorScope.valueOf(v.toUpperCase()));
            } catch (IllegalArgumentException e) {
                log.warn("Invalid translator.scope: {}", v);
            }
        });

        getInt(props, "migration.record.parallelism").ifPresent(v -> {
            if (v > 0) b.recordParallelism(v);
            else log.warn("Invalid record.parallelism: {}", v);
        });

        getInt(props, "migration.worker.threads").ifPresent(v -> {
            if (v > 0) b.workerThreads(v);
            else log.warn("Invalid worker.threads: {}", v);
        });

        getInt(props, "migration.history.size").ifPresent(v -> {
            if (v > 0) b.historySize(v);
            else log.warn("Invalid history.size: {}", v);
        });

        getString(props, "migration.alert.level").ifPresent(v -> {
            try {
                b.alertLevel(AlertLevel.valueOf(v.toUpperCase()));
            } catch (IllegalArgumentException e) {
                log.warn("Invalid alert.level: {}", v);
            }
        });

        getString(props, "migration.snapshot.base.dir")
                .filter(v -> !v.isEmpty())
                .ifPresent(v -> b.snapshotBaseDir(Path.of(v)));

        return b.build();
    }

    private static Optional<String> getString(Properties props, String key) {
        String val = System.getProperty(key);
        if (val == null) val = props.getProperty(key);
        return val != null ? Optional.of(val.trim()) : Optional.empty();
    }

    private static Optional<Long> getLong(Properties props, String key) {
        return getNumber(props, key, Long::valueOf);
    }

    private static Optional<Integer> getInt(Properties props, String key) {
        return getNumber(props, key, Integer::valueOf);
    }

    private static <T extends Number> Optional<T> getNumber(Properties props, String key,
                                                            Function<String, T> parser) {
        Optional<String> raw = getString(props, key);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(parser.apply(raw.get()));
        } catch (NumberFormatException e) {
            log.warn("Invalid number for {}: {}", key, raw.get());
            return Optional.empty();
        }
    }
}
