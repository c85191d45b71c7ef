package com.delta.siteaudit.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "audit")
public class AuditProperties {
    private Worker worker = new Worker();
    private Generation generation = new Generation();
    private Sampling sampling = new Sampling();
    private Jobs jobs = new Jobs();

    public Worker getWorker() {
        return worker;
    }

    public void setWorker(Worker worker) {
        this.worker = worker;
    }

    public Generation getGeneration() {
        return generation;
    }

    public void setGeneration(Generation generation) {
        this.generation = generation;
    }

    public Sampling getSampling() {
        return sampling;
    }

    public void setSampling(Sampling sampling) {
        this.sampling = sampling;
    }

    public Jobs getJobs() {
        return jobs;
    }

    public void setJobs(Jobs jobs) {
        this.jobs = jobs;
    }

    public static class Worker {
        private boolean enabled = true;
        private int workerCount = 2;
        private int pollIntervalMs = 2000;
        private int heartbeatSeconds = 15;
        private int staleMinutes = 20;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getWorkerCount() {
            return Math.max(1, workerCount);
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = Math.max(1, workerCount);
        }

        public int getPollIntervalMs() {
            return Math.max(100, pollIntervalMs);
        }

        public void setPollIntervalMs(int pollIntervalMs) {
            this.pollIntervalMs = Math.max(100, pollIntervalMs);
        }

        public int getHeartbeatSeconds() {
            return Math.max(1, heartbeatSeconds);
        }

        public void setHeartbeatSeconds(int heartbeatSeconds) {
            this.heartbeatSeconds = Math.max(1, heartbeatSeconds);
        }

        public int getStaleMinutes() {
            return Math.max(1, staleMinutes);
        }

        public void setStaleMinutes(int staleMinutes) {
            this.staleMinutes = Math.max(1, staleMinutes);
        }
    }

    public static class Generation {
        private static final int MAX_ATTEMPTS_CAP = 5;

        private String baseUrl = "https://api.openai.com/v1";
        private String apiKey;
        private String model = "gpt-4o-mini";
        private int maxAttempts = 2;
        private int requestTimeoutSeconds = 120;
        private int transportRetries = 1;
        private int retryBaseDelayMs = 1000;
        private double temperature = 0.2;
        private int maxTokens = 12000;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public int getMaxAttempts() {
            return Math.min(MAX_ATTEMPTS_CAP, Math.max(1, maxAttempts));
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = Math.min(MAX_ATTEMPTS_CAP, Math.max(1, maxAttempts));
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
        }

        public int getTransportRetries() {
            return Math.max(0, transportRetries);
        }

        public void setTransportRetries(int transportRetries) {
            this.transportRetries = Math.max(0, transportRetries);
        }

        public int getRetryBaseDelayMs() {
            return Math.max(0, retryBaseDelayMs);
        }

        public void setRetryBaseDelayMs(int retryBaseDelayMs) {
            this.retryBaseDelayMs = Math.max(0, retryBaseDelayMs);
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public int getMaxTokens() {
            return Math.max(256, maxTokens);
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = Math.max(256, maxTokens);
        }

        public boolean isConfigured() {
            return apiKey != null && !apiKey.isBlank() && baseUrl != null && !baseUrl.isBlank();
        }
    }

    public static class Sampling {
        private int targetPages = 15;
        private int comparisonPages = 5;
        private int excerptChars = 1500;

        public int getTargetPages() {
            return Math.max(1, targetPages);
        }

        public void setTargetPages(int targetPages) {
            this.targetPages = Math.max(1, targetPages);
        }

        public int getComparisonPages() {
            return Math.max(0, comparisonPages);
        }

        public void setComparisonPages(int comparisonPages) {
            this.comparisonPages = Math.max(0, comparisonPages);
        }

        public int getExcerptChars() {
            return Math.max(200, excerptChars);
        }

        public void setExcerptChars(int excerptChars) {
            this.excerptChars = Math.max(200, excerptChars);
        }
    }

    public static class Jobs {
        private int maxComparisonDomains = 3;

        public int getMaxComparisonDomains() {
            return Math.max(0, maxComparisonDomains);
        }

        public void setMaxComparisonDomains(int maxComparisonDomains) {
            this.maxComparisonDomains = Math.max(0, maxComparisonDomains);
        }
    }
}
