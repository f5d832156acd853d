package io.castbus.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the character event bus.
 *
 * @see CastBusAutoConfiguration
 */
@ConfigurationProperties(prefix = "castbus")
public class CastBusProperties {

    private final LoopDetection loopDetection = new LoopDetection();
    private final Dispatch dispatch = new Dispatch();
    private final Relationships relationships = new Relationships();
    private final Metrics metrics = new Metrics();

    public LoopDetection getLoopDetection() {
        return loopDetection;
    }

    public Dispatch getDispatch() {
        return dispatch;
    }

    public Relationships getRelationships() {
        return relationships;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class LoopDetection {
        /**
         * Publishes of one event type allowed per window before a loop is reported.
         */
        private int threshold = 10;

        /**
         * Length of the counting window.
         */
        private Duration window = Duration.ofSeconds(1);

        /**
         * Reject publishes over the threshold instead of only logging them.
         */
        private boolean strict = false;

        public int getThreshold() {
            return threshold;
        }

        public void setThreshold(int threshold) {
            this.threshold = threshold;
        }

        public Duration getWindow() {
            return window;
        }

        public void setWindow(Duration window) {
            this.window = window;
        }

        public boolean isStrict() {
            return strict;
        }

        public void setStrict(boolean strict) {
            this.strict = strict;
        }
    }

    public static class Dispatch {
        private long drainTimeoutMs = 5000;

        public long getDrainTimeoutMs() {
            return drainTimeoutMs;
        }

        public void setDrainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
        }
    }

    public static class Relationships {
        private boolean autoSave = true;
        private boolean updateMutualRelationships = true;
        private double mutualStrengthFactor = 0.8;

        public boolean isAutoSave() {
            return autoSave;
        }

        public void setAutoSave(boolean autoSave) {
            this.autoSave = autoSave;
        }

        public boolean isUpdateMutualRelationships() {
            return updateMutualRelationships;
        }

        public void setUpdateMutualRelationships(boolean updateMutualRelationships) {
            this.updateMutualRelationships = updateMutualRelationships;
        }

        public double getMutualStrengthFactor() {
            return mutualStrengthFactor;
        }

        public void setMutualStrengthFactor(double mutualStrengthFactor) {
            this.mutualStrengthFactor = mutualStrengthFactor;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "castbus";

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
