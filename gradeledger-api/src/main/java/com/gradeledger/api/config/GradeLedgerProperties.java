package com.gradeledger.api.config;

import com.gradeledger.core.model.RetryPolicy;
import com.gradeledger.insights.AnalyzerThresholds;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings under the {@code gradeledger} prefix.
 */
@ConfigurationProperties(prefix = "gradeledger")
public class GradeLedgerProperties {

    private Store store = new Store();
    private Retry retry = new Retry();
    private Insights insights = new Insights();
    private Reconciler reconciler = new Reconciler();

    public Store getStore() {
        return store;
    }

    public void setStore(Store store) {
        this.store = store;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public Insights getInsights() {
        return insights;
    }

    public void setInsights(Insights insights) {
        this.insights = insights;
    }

    public Reconciler getReconciler() {
        return reconciler;
    }

    public void setReconciler(Reconciler reconciler) {
        this.reconciler = reconciler;
    }

    public enum StoreType {
        MEMORY,
        JDBC
    }

    public static class Store {
        /**
         * Which transactional store backs the ledger.
         */
        private StoreType type = StoreType.MEMORY;
        private Jdbc jdbc = new Jdbc();

        public StoreType getType() {
            return type;
        }

        public void setType(StoreType type) {
            this.type = type;
        }

        public Jdbc getJdbc() {
            return jdbc;
        }

        public void setJdbc(Jdbc jdbc) {
            this.jdbc = jdbc;
        }
    }

    public static class Jdbc {
        private String url = "jdbc:postgresql://localhost:5432/gradeledger";
        private String username = "gradeledger";
        private String password = "gradeledger";
        private int maximumPoolSize = 10;

        /**
         * Run db/gradeledger-schema.sql on startup. The script is idempotent.
         */
        private boolean initializeSchema = true;

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public int getMaximumPoolSize() {
            return maximumPoolSize;
        }

        public void setMaximumPoolSize(int maximumPoolSize) {
            this.maximumPoolSize = maximumPoolSize;
        }

        public boolean isInitializeSchema() {
            return initializeSchema;
        }

        public void setInitializeSchema(boolean initializeSchema) {
            this.initializeSchema = initializeSchema;
        }
    }

    /**
     * Optimistic transaction retries.
     */
    public static class Retry {
        private int maxAttempts = 8;
        private Duration initialBackoff = Duration.ofMillis(20);
        private Duration maxBackoff = Duration.ofSeconds(1);
        private double backoffMultiplier = 2.0;
        private double jitterFactor = 0.2;

        public RetryPolicy toPolicy() {
            return RetryPolicy.builder()
                .maxAttempts(maxAttempts)
                .initialBackoff(initialBackoff)
                .maxBackoff(maxBackoff)
                .backoffMultiplier(backoffMultiplier)
                .jitterFactor(jitterFactor)
                .build();
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getInitialBackoff() {
            return initialBackoff;
        }

        public void setInitialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
        }

        public Duration getMaxBackoff() {
            return maxBackoff;
        }

        public void setMaxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
        }

        public double getBackoffMultiplier() {
            return backoffMultiplier;
        }

        public void setBackoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
        }

        public double getJitterFactor() {
            return jitterFactor;
        }

        public void setJitterFactor(double jitterFactor) {
            this.jitterFactor = jitterFactor;
        }
    }

    /**
     * Analyzer window and detector thresholds.
     */
    public static class Insights {
        private Duration lookback = Duration.ofDays(30);
        private int maxEvents = 250;
        private int maxEvidence = 25;
        private Duration burstWindow = Duration.ofMinutes(60);
        private int burstMinStarts = 8;
        private int burstFireCount = 15;
        private Duration lateWindow = Duration.ofDays(30);
        private int lateMinCount = 2;
        private Duration lateRecencyWindow = Duration.ofDays(7);
        private Duration dropoffDefaultDuration = Duration.ofHours(12);
        private int dropoffCourseMin = 4;
        private int dropoffUserMin = 2;
        private double driftEpsilon = 1e-9;
        private double informationalBelow = 0.4;

        public AnalyzerThresholds toThresholds() {
            return AnalyzerThresholds.builder()
                .maxEvents(maxEvents)
                .maxEvidence(maxEvidence)
                .burstWindow(burstWindow)
                .burstMinStarts(burstMinStarts)
                .burstFireCount(burstFireCount)
                .lateWindow(lateWindow)
                .lateMinCount(lateMinCount)
                .lateRecencyWindow(lateRecencyWindow)
                .dropoffDefaultDuration(dropoffDefaultDuration)
                .dropoffCourseMin(dropoffCourseMin)
                .dropoffUserMin(dropoffUserMin)
                .driftEpsilon(driftEpsilon)
                .build();
        }

        public Duration getLookback() {
            return lookback;
        }

        public void setLookback(Duration lookback) {
            this.lookback = lookback;
        }

        public int getMaxEvents() {
            return maxEvents;
        }

        public void setMaxEvents(int maxEvents) {
            this.maxEvents = maxEvents;
        }

        public int getMaxEvidence() {
            return maxEvidence;
        }

        public void setMaxEvidence(int maxEvidence) {
            this.maxEvidence = maxEvidence;
        }

        public Duration getBurstWindow() {
            return burstWindow;
        }

        public void setBurstWindow(Duration burstWindow) {
            this.burstWindow = burstWindow;
        }

        public int getBurstMinStarts() {
            return burstMinStarts;
        }

        public void setBurstMinStarts(int burstMinStarts) {
            this.burstMinStarts = burstMinStarts;
        }

        public int getBurstFireCount() {
            return burstFireCount;
        }

        public void setBurstFireCount(int burstFireCount) {
            this.burstFireCount = burstFireCount;
        }

        public Duration getLateWindow() {
            return lateWindow;
        }

        public void setLateWindow(Duration lateWindow) {
            this.lateWindow = lateWindow;
        }

        public int getLateMinCount() {
            return lateMinCount;
        }

        public void setLateMinCount(int lateMinCount) {
            this.lateMinCount = lateMinCount;
        }

        public Duration getLateRecencyWindow() {
            return lateRecencyWindow;
        }

        public void setLateRecencyWindow(Duration lateRecencyWindow) {
            this.lateRecencyWindow = lateRecencyWindow;
        }

        public Duration getDropoffDefaultDuration() {
            return dropoffDefaultDuration;
        }

        public void setDropoffDefaultDuration(Duration dropoffDefaultDuration) {
            this.dropoffDefaultDuration = dropoffDefaultDuration;
        }

        public int getDropoffCourseMin() {
            return dropoffCourseMin;
        }

        public void setDropoffCourseMin(int dropoffCourseMin) {
            this.dropoffCourseMin = dropoffCourseMin;
        }

        public int getDropoffUserMin() {
            return dropoffUserMin;
        }

        public void setDropoffUserMin(int dropoffUserMin) {
            this.dropoffUserMin = dropoffUserMin;
        }

        public double getDriftEpsilon() {
            return driftEpsilon;
        }

        public void setDriftEpsilon(double driftEpsilon) {
            this.driftEpsilon = driftEpsilon;
        }

        public double getInformationalBelow() {
            return informationalBelow;
        }

        public void setInformationalBelow(double informationalBelow) {
            this.informationalBelow = informationalBelow;
        }
    }

    /**
     * Periodic report-only gradebook recompute.
     */
    public static class Reconciler {
        private boolean enabled = false;
        private Duration interval = Duration.ofHours(1);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }
    }
}
