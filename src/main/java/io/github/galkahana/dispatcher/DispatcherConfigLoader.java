package io.github.galkahana.dispatcher;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads a {@link DispatcherConfig} from YAML.
 * <p>
 * Recognized keys: {@code worker_count}, {@code queue_capacity}, {@code admission_limit},
 * {@code per_request_timeout}, {@code shutdown_grace_period}, {@code admission_policy},
 * {@code queue_offer_timeout}, {@code max_retries}, {@code retry_wait}. Missing keys keep their defaults.
 * Durations are written as {@code 250ms}, {@code 5s}, {@code 2m}, {@code 1h}, ISO-8601 ({@code PT5S}) or a
 * plain number of milliseconds.
 */
@Slf4j
public final class DispatcherConfigLoader {

    private static final Pattern SHORT_DURATION = Pattern.compile("(\\d+)\\s*(ms|s|m|h)");

    private final Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));

    /**
     * Load from a file path, falling back to a classpath resource of the same name.
     *
     * @throws ConfigurationException If the location cannot be found or read, or holds invalid values
     */
    public DispatcherConfig load(String location) {
        Path path = Paths.get(location);
        if (Files.exists(path)) {
            log.info("Loading dispatcher configuration from file: {}", path);
            try (InputStream is = Files.newInputStream(path)) {
                return load(is);
            } catch (IOException e) {
                throw new ConfigurationException("Failed to read configuration from: " + path, e);
            }
        }

        String resource = location.startsWith("/") ? location.substring(1) : location;
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(resource)) {
            if (is == null) throw new ConfigurationException("Configuration not found: " + location);
            log.info("Loading dispatcher configuration from classpath: {}", resource);
            return load(is);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read configuration from classpath: " + resource, e);
        }
    }

    public DispatcherConfig load(InputStream inputStream) {
        Object document;
        try {
            document = yaml.load(inputStream);
        } catch (YAMLException e) {
            throw new ConfigurationException("Malformed configuration", e);
        }
        if (document == null) return DispatcherConfig.defaults();
        if (!(document instanceof Map)) {
            throw new ConfigurationException("Configuration root must be a mapping");
        }
        return fromMap((Map<?, ?>) document);
    }

    DispatcherConfig fromMap(Map<?, ?> values) {
        DispatcherConfig.DispatcherConfigBuilder builder = DispatcherConfig.builder();
        for (Map.Entry<?, ?> entry : values.entrySet()) {
            String key = String.valueOf(entry.getKey());
            Object value = entry.getValue();
            switch (key) {
                case "worker_count" -> builder.workerCount(toInt(key, value));
                case "queue_capacity" -> builder.queueCapacity(toInt(key, value));
                case "admission_limit" -> builder.admissionLimit(toInt(key, value));
                case "per_request_timeout" -> builder.perRequestTimeout(value == null ? null : toDuration(key, value));
                case "shutdown_grace_period" -> builder.shutdownGracePeriod(toDuration(key, value));
                case "admission_policy" -> builder.admissionPolicy(toPolicy(key, value));
                case "queue_offer_timeout" -> builder.queueOfferTimeout(toDuration(key, value));
                case "max_retries" -> builder.maxRetries(toInt(key, value));
                case "retry_wait" -> builder.retryWait(toDuration(key, value));
                default -> throw new ConfigurationException("Unknown configuration key: " + key);
            }
        }
        try {
            return builder.build();
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new ConfigurationException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    private static int toInt(String key, Object value) {
        if (value instanceof Integer) return (Integer) value;
        throw new ConfigurationException(key + " must be an integer, got: " + value);
    }

    private static AdmissionPolicy toPolicy(String key, Object value) {
        try {
            return AdmissionPolicy.valueOf(String.valueOf(value).trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(key + " must be one of WAIT, REJECT, got: " + value, e);
        }
    }

    static Duration toDuration(String key, Object value) {
        if (value instanceof Integer || value instanceof Long) {
            return Duration.ofMillis(((Number) value).longValue());
        }
        String text = String.valueOf(value).trim();
        if (text.startsWith("P") || text.startsWith("p")) {
            try {
                return Duration.parse(text);
            } catch (DateTimeParseException e) {
                throw new ConfigurationException(key + " is not a valid ISO-8601 duration: " + text, e);
            }
        }
        Matcher matcher = SHORT_DURATION.matcher(text);
        if (!matcher.matches()) {
            throw new ConfigurationException(key + " is not a valid duration: " + text);
        }
        long amount = Long.parseLong(matcher.group(1));
        return switch (matcher.group(2)) {
            case "ms" -> Duration.ofMillis(amount);
            case "s" -> Duration.ofSeconds(amount);
            case "m" -> Duration.ofMinutes(amount);
            default -> Duration.ofHours(amount);
        };
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
