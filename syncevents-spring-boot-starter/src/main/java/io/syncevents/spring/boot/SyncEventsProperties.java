package io.syncevents.spring.boot;

import io.syncevents.event.EventKind;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the sync event dispatcher.
 *
 * @see SyncEventsAutoConfiguration
 */
@ConfigurationProperties(prefix = "syncevents")
public class SyncEventsProperties {

    /**
     * Extra protocol types to route per kind, on top of the default table.
     * Keys are kind names, e.g. {@code message} or {@code state}.
     */
    private Map<EventKind, List<String>> eventTypes = new LinkedHashMap<>();

    private final Dispatch dispatch = new Dispatch();
    private final Metrics metrics = new Metrics();

    public Map<EventKind, List<String>> getEventTypes() {
        return eventTypes;
    }

    public void setEventTypes(Map<EventKind, List<String>> eventTypes) {
        this.eventTypes = eventTypes;
    }

    public Dispatch getDispatch() {
        return dispatch;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Dispatch {
        /**
         * Handler run time above which a warning is logged.
         */
        private Duration slowHandlerThreshold = Duration.ofSeconds(1);

        public Duration getSlowHandlerThreshold() {
            return slowHandlerThreshold;
        }

        public void setSlowHandlerThreshold(Duration slowHandlerThreshold) {
            this.slowHandlerThreshold = slowHandlerThreshold;
        }
    }

    public static class Metrics {
        /**
         * Whether to export dispatch metrics through Micrometer.
         */
        private boolean enabled = true;

        /**
         * Prefix for all meter names.
         */
        private String namePrefix = "syncevents";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
