package ai.treescan.scan;

import com.google.common.base.Splitter;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Scanner settings. Values are layered: {@code treescan.properties} on the classpath, then an optional properties
 * file, then {@code treescan.*} system properties, each layer overriding the one before it.
 *
 * @param parallelism number of scan worker threads
 * @param maxFileBytes files larger than this are reported as unreadable instead of parsed
 * @param workerStackBytes stack size of each worker thread; deeply nested sources need deep recursion while matching
 * @param catalogLanguages languages whose bundled queries {@link QueryCatalog} loads
 */
public record ScanConfig(int parallelism, long maxFileBytes, long workerStackBytes, List<String> catalogLanguages) {
    private static final Logger logger = LogManager.getLogger(ScanConfig.class);

    public static final String RESOURCE = "treescan.properties";

    public static final String KEY_PARALLELISM = "treescan.scan.parallelism";
    public static final String KEY_MAX_FILE_BYTES = "treescan.scan.maxFileBytes";
    public static final String KEY_WORKER_STACK_BYTES = "treescan.scan.workerStackBytes";
    public static final String KEY_CATALOG_LANGUAGES = "treescan.catalog.languages";

    public static final long DEFAULT_MAX_FILE_BYTES = 2L * 1024 * 1024;
    public static final long DEFAULT_WORKER_STACK_BYTES = 4L * 1024 * 1024;
    public static final List<String> DEFAULT_CATALOG_LANGUAGES = List.of("python", "typescript");

    private static final int MAX_PARALLELISM = 1024;

    private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

    public ScanConfig {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1, got " + parallelism);
        }
        if (maxFileBytes < 1) {
            throw new IllegalArgumentException("maxFileBytes must be >= 1, got " + maxFileBytes);
        }
        catalogLanguages = List.copyOf(catalogLanguages);
    }

    public static ScanConfig defaults() {
        return fromProperties(new Properties());
    }

    public static ScanConfig load() {
        return load(null);
    }

    /** Loads the layered configuration, with {@code file} (if present) between the classpath and system layers. */
    public static ScanConfig load(@Nullable Path file) {
        var props = new Properties();
        try (InputStream in = ScanConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException e) {
            logger.warn("Failed to load {} from classpath: {}", RESOURCE, e.getMessage());
        }
        if (file != null) {
            if (Files.exists(file)) {
                try (var reader = Files.newBufferedReader(file)) {
                    props.load(reader);
                } catch (IOException e) {
                    logger.warn("Failed to load scan settings from {}: {}", file, e.getMessage());
                }
            } else {
                logger.warn("Scan settings file {} does not exist; using defaults", file);
            }
        }
        for (var name : System.getProperties().stringPropertyNames()) {
            if (name.startsWith("treescan.")) {
                props.setProperty(name, System.getProperty(name));
            }
        }
        return fromProperties(props);
    }

    public static ScanConfig fromProperties(Properties props) {
        int parallelism = (int)
                positive(props, KEY_PARALLELISM, Runtime.getRuntime().availableProcessors(), MAX_PARALLELISM);
        long maxFileBytes = positive(props, KEY_MAX_FILE_BYTES, DEFAULT_MAX_FILE_BYTES, Integer.MAX_VALUE);
        long stackBytes = positive(props, KEY_WORKER_STACK_BYTES, DEFAULT_WORKER_STACK_BYTES, Long.MAX_VALUE);
        var languages = DEFAULT_CATALOG_LANGUAGES;
        var raw = props.getProperty(KEY_CATALOG_LANGUAGES);
        if (raw != null) {
            var parsed = LIST_SPLITTER.splitToStream(raw)
                    .map(s -> s.toLowerCase(Locale.ROOT))
                    .distinct()
                    .toList();
            if (parsed.isEmpty()) {
                logger.warn("Ignoring empty {}; using {}", KEY_CATALOG_LANGUAGES, DEFAULT_CATALOG_LANGUAGES);
            } else {
                languages = parsed;
            }
        }
        return new ScanConfig(parallelism, maxFileBytes, stackBytes, languages);
    }

    public ScanConfig withParallelism(int newParallelism) {
        return new ScanConfig(newParallelism, maxFileBytes, workerStackBytes, catalogLanguages);
    }

    public ScanConfig withMaxFileBytes(long newMaxFileBytes) {
        return new ScanConfig(parallelism, newMaxFileBytes, workerStackBytes, catalogLanguages);
    }

    private static long positive(Properties props, String key, long fallback, long max) {
        var raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            long value = Long.parseLong(raw.trim());
            if (value >= 1 && value <= max) {
                return value;
            }
            logger.warn("Value {} for {} is out of range; using {}", raw, key, fallback);
        } catch (NumberFormatException e) {
            logger.warn("Invalid value '{}' for {}; using {}", raw, key, fallback);
        }
        return fallback;
    }
}
