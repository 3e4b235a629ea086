package org.alertingupgrade.migrations.jcommander;

import java.lang.reflect.Field;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.alertingupgrade.migrations.arguments.ArgNameConstants;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Fills JCommander parameter objects from sources outside the command line: environment variables
 * (UPPER_SNAKE_CASE of the flag name behind a prefix) and flat maps keyed by flag name without leading dashes,
 * as produced from the YAML configuration file.
 * <p>
 * Call before {@code JCommander.parse} so that explicit command line values win.
 */
@Slf4j
public class EnvVarParameterPuller {

    public static final String DEFAULT_SUFFIX = "";
    private static final Pattern CAMEL_CASE_PATTERN = Pattern.compile("([A-Z])");

    @FunctionalInterface
    public interface EnvVarGetter {
        String getEnv(String name);
    }

    private EnvVarParameterPuller() {
        throw new IllegalStateException("EnvVarParameterPuller utility class should not be instantiated");
    }

    public static <T> T injectFromEnv(T params, String prefix) {
        return injectFromEnv(params, System::getenv, prefix, DEFAULT_SUFFIX);
    }

    public static <T> T injectFromEnv(T params, EnvVarGetter envVarGetter, String prefix) {
        return injectFromEnv(params, envVarGetter, prefix, DEFAULT_SUFFIX);
    }

    public static <T> T injectFromEnv(@NonNull T params, EnvVarGetter envVarGetter, String prefix, String suffix) {
        var added = inject(params, argName -> toEnvVarNames(argName, prefix, suffix), envVarGetter::getEnv);
        if (!added.isEmpty()) {
            log.info("Adding parameters from the following environment variables: {}", added);
        }
        return params;
    }

    /**
     * Applies values keyed by flag name without its leading dashes, e.g. {@code db-url}.
     * Values that are null are skipped.
     */
    public static <T> T injectFromValues(@NonNull T params, @NonNull Map<String, String> values) {
        var added = inject(params, argName -> List.of(argName.replaceAll("^-+", "")), values::get);
        if (!added.isEmpty()) {
            log.info("Adding parameters from the configuration file: {}", added);
        }
        return params;
    }

    private static List<String> inject(Object params,
                                       Function<String, List<String>> candidateNames,
                                       Function<String, String> lookup) {
        var added = new ArrayList<String>();
        injectRecursive(params, candidateNames, lookup, added);
        return added;
    }

    private static void injectRecursive(Object params,
                                        Function<String, List<String>> candidateNames,
                                        Function<String, String> lookup,
                                        List<String> added) {
        Class<?> clazz = params.getClass();
        while (clazz != null && clazz != Object.class) {
            for (Field field : clazz.getDeclaredFields()) {
                field.setAccessible(true);
                try {
                    if (field.isAnnotationPresent(ParametersDelegate.class)) {
                        var delegate = field.get(params);
                        if (delegate != null) {
                            injectRecursive(delegate, candidateNames, lookup, added);
                        }
                    } else if (field.isAnnotationPresent(Parameter.class)) {
                        var found = findValue(field.getAnnotation(Parameter.class), candidateNames, lookup);
                        if (found != null && setFieldValue(params, field, found.getValue())) {
                            added.add(found.getKey());
                        }
                    }
                } catch (IllegalAccessException e) {
                    log.warn("Could not access field: {}", field.getName(), e);
                }
            }
            clazz = clazz.getSuperclass();
        }
    }

    private static Map.Entry<String, String> findValue(Parameter annotation,
                                                       Function<String, List<String>> candidateNames,
                                                       Function<String, String> lookup) {
        for (String name : annotation.names()) {
            for (var candidate : candidateNames.apply(name)) {
                var value = lookup.apply(candidate);
                if (value != null) {
                    return Map.entry(candidate, value);
                }
            }
        }
        return null;
    }

    /**
     * Converts a flag to its environment variable names, most specific first.
     * Examples (prefix ALERTING_MIGRATION_):
     *   --db-url    -> ALERTING_MIGRATION_DB_URL
     *   --dbPassword -> ALERTING_MIGRATION_DB_PASSWORD, DB_PASSWORD
     */
    public static List<String> toEnvVarNames(final String argName, String prefix, String suffix) {
        String normalized = argName
            .replaceAll("^-+", "")
            .replace("-", "_");

        Matcher matcher = CAMEL_CASE_PATTERN.matcher(normalized);
        String envCase = matcher.replaceAll("_$1").toUpperCase();
        return Stream.concat(
            Stream.of(prefix + envCase + suffix),
            // credentials are often provisioned by deployment tooling without any prefix
            (!prefix.isEmpty() || !suffix.isEmpty()) &&
                ArgNameConstants.POSSIBLE_CREDENTIALS_ARG_FLAG_NAMES.matcher(argName).matches() ?
                Stream.of(envCase) : Stream.empty()).collect(Collectors.toList());
    }

    private static boolean setFieldValue(Object params, Field field, String value) throws IllegalAccessException {
        Class<?> type = field.getType();
        try {
            if (type == String.class) {
                field.set(params, value);
            } else if (type == int.class || type == Integer.class) {
                field.set(params, Integer.parseInt(value));
            } else if (type == boolean.class || type == Boolean.class) {
                field.set(params, Boolean.parseBoolean(value));
            } else if (type == long.class || type == Long.class) {
                field.set(params, Long.parseLong(value));
            } else if (type.isEnum()) {
                field.set(params, enumValue(type, value));
            } else {
                log.warn("Unsupported field type for parameter injection: {} (field: {})",
                    type.getName(), field.getName());
                return false;
            }
            return true;
        } catch (IllegalArgumentException e) {
            log.error("Failed to parse value '{}' for field '{}' of type {}",
                value, field.getName(), type.getName(), e);
            return false;
        }
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static Object enumValue(Class<?> type, String value) {
        return Enum.valueOf((Class<? extends Enum>) type, value.toUpperCase());
    }
}
