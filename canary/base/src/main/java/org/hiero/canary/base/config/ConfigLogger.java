// SPDX-License-Identifier: Apache-2.0
package org.hiero.canary.base.config;

import static java.lang.System.Logger.Level.INFO;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.RecordComponent;
import java.util.Map;
import java.util.TreeMap;
import org.hiero.canary.base.Loggable;

/**
 * Use this class to log configuration data.
 */
public final class ConfigLogger {
    /** The logger for this class. */
    private static final System.Logger LOGGER = System.getLogger(ConfigLogger.class.getName());
    /** banner separator line */
    private static final String BANNER_LINE = "=".repeat(120);

    /**
     * Log the configuration data.
     *
     * @param configs the configuration records to log, each annotated with {@link ConfigSection}
     */
    public static void log(@NonNull final Record... configs) {
        if (LOGGER.isLoggable(INFO)) {
            LOGGER.log(INFO, BANNER_LINE);
            LOGGER.log(INFO, "Configuration data types:");
            for (final Record config : configs) {
                LOGGER.log(INFO, "    " + config.getClass().getName());
            }
            LOGGER.log(INFO, BANNER_LINE);
            LOGGER.log(INFO, "Combined Configuration:");
            for (final var entry : collectConfig(configs).entrySet()) {
                LOGGER.log(INFO, "    " + entry.getKey() + " = " + entry.getValue());
            }
            LOGGER.log(INFO, BANNER_LINE);
        }
    }

    /**
     * Collect every component of the given configuration records into a sorted map keyed by its full config path.
     * Components that are not annotated {@link Loggable} are sensitive and masked.
     *
     * @param configs the configuration records
     * @return sorted map of properties and values, with sensitive values masked
     */
    @NonNull
    static Map<String, String> collectConfig(@NonNull final Record... configs) {
        final Map<String, String> collected = new TreeMap<>();
        for (final Record config : configs) {
            final ConfigSection section = config.getClass().getDeclaredAnnotation(ConfigSection.class);
            if (section == null) {
                continue;
            }
            for (final RecordComponent component : config.getClass().getRecordComponents()) {
                final String key = section.value() + "." + component.getName();
                try {
                    final Object rawValue = component.getAccessor().invoke(config);
                    final String value = String.valueOf(rawValue);
                    if (component.getAnnotation(Loggable.class) == null) {
                        // blank secrets are shown blank so an operator can see they were never injected
                        collected.put(key, (rawValue == null || value.isEmpty()) ? "" : "*****");
                    } else {
                        collected.put(key, value);
                    }
                } catch (IllegalAccessException | InvocationTargetException e) {
                    throw new IllegalStateException("Unable to read configuration value " + key, e);
                }
            }
        }
        return collected;
    }

    private ConfigLogger() {}
}
