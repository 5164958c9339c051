package factstore.capabilities;

import java.util.Map;
import java.util.function.Supplier;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import io.github.cdimascio.dotenv.Dotenv;
import io.github.cdimascio.dotenv.DotenvEntry;

/**
 * Resolves configuration keys from the environment, then system properties,
 * then an optional {@code .env} fallback.
 */
public final class ConfigResolver {

    private static final Logger logger = Logger.getLogger(ConfigResolver.class.getName());

    private static volatile Supplier<Map<String, String>> dotenvSupplier = null;

    private ConfigResolver() {}

    public static void enableDotenvFallback(Supplier<Map<String, String>> supplier) {
        dotenvSupplier = supplier;
    }

    /**
     * Use the {@code .env} file of the working directory as fallback, if there is one.
     */
    public static void enableDotenv() {
        Dotenv dotenv = Dotenv.configure()
            .ignoreIfMissing()
            .load();

        Map<String, String> entries = dotenv.entries(Dotenv.Filter.DECLARED_IN_ENV_FILE).stream()
            .collect(Collectors.toMap(
                DotenvEntry::getKey,
                DotenvEntry::getValue,
                (a, b) -> b
            ));
        logger.fine("Loaded " + entries.size() + " entries from .env");
        enableDotenvFallback(() -> entries);
    }

    public static String resolve(String key) {
        String value = System.getenv(key);
        if (isSet(value)) return value;

        value = System.getProperty(key);
        if (isSet(value)) return value;

        Supplier<Map<String, String>> supplier = dotenvSupplier;
        if (supplier != null) {
            value = supplier.get().get(key);
            if (isSet(value)) return value;
        }

        return null;
    }

    public static String resolve(String key, String defaultValue) {
        String value = resolve(key);
        return value != null ? value : defaultValue;
    }

    /**
     * Resolve a flag. Anything other than {@code true} (ignoring case) is false.
     */
    public static boolean resolveBoolean(String key, boolean defaultValue) {
        String value = resolve(key);
        return value != null ? Boolean.parseBoolean(value.trim()) : defaultValue;
    }

    private static boolean isSet(String v) {
        return v != null && !v.isBlank();
    }
}
