package com.bluejay.certdiscovery.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "discovery")
public class DiscoveryProperties {
    private int maxRequestsPerMinute = 5;
    private int maxConcurrentJobs = 1;
    private int maxPages = 200;
    private int maxDepth = 8;
    private int timeoutSeconds = 120;
    private int runTimeoutSeconds = 0;
    private int rateLimitWindowSeconds = 60;
    private Firecrawl firecrawl = new Firecrawl();
    private Categorizer categorizer = new Categorizer();
    private Quality quality = new Quality();

    public int getMaxRequestsPerMinute() {
        return Math.max(1, maxRequestsPerMinute);
    }

    public void setMaxRequestsPerMinute(int maxRequestsPerMinute) {
        this.maxRequestsPerMinute = Math.max(1, maxRequestsPerMinute);
    }

    public int getMaxConcurrentJobs() {
        return Math.max(1, maxConcurrentJobs);
    }

    public void setMaxConcurrentJobs(int maxConcurrentJobs) {
        this.maxConcurrentJobs = Math.max(1, maxConcurrentJobs);
    }

    public int getMaxPages() {
        return Math.max(1, maxPages);
    }

    public void setMaxPages(int maxPages) {
        this.maxPages = Math.max(1, maxPages);
    }

    public int getMaxDepth() {
        return Math.max(1, maxDepth);
    }

    public void setMaxDepth(int maxDepth) {
        this.maxDepth = Math.max(1, maxDepth);
    }

    public int getTimeoutSeconds() {
        return Math.max(1, timeoutSeconds);
    }

    public void setTimeoutSeconds(int timeoutSeconds) {
        this.timeoutSeconds = Math.max(1, timeoutSeconds);
    }

    /**
     * Whole-run deadline in seconds; 0 disables it.
     */
    public int getRunTimeoutSeconds() {
        return Math.max(0, runTimeoutSeconds);
    }

    public void setRunTimeoutSeconds(int runTimeoutSeconds) {
        this.runTimeoutSeconds = Math.max(0, runTimeoutSeconds);
    }

    public int getRateLimitWindowSeconds() {
        return Math.max(1, rateLimitWindowSeconds);
    }

    public void setRateLimitWindowSeconds(int rateLimitWindowSeconds) {
        this.rateLimitWindowSeconds = Math.max(1, rateLimitWindowSeconds);
    }

    public Firecrawl getFirecrawl() {
        return firecrawl;
    }

    public void setFirecrawl(Firecrawl firecrawl) {
        this.firecrawl = firecrawl;
    }

    public Categorizer getCategorizer() {
        return categorizer;
    }

    public void setCategorizer(Categorizer categorizer) {
        this.categorizer = categorizer;
    }

    public Quality getQuality() {
        return quality;
    }

    public void setQuality(Quality quality) {
        this.quality = quality;
    }

    public static class Firecrawl {
        private static final String DEFAULT_BASE_URL = "https://api.firecrawl.dev";

        private String baseUrl = DEFAULT_BASE_URL;
        private String apiKey;
        private int requestTimeoutSeconds = 60;
        private int crawlPollIntervalMs = 2000;
        private int requestMaxRetries = 2;
        private int requestRetryBaseDelayMs = 500;
        private int requestRetryMaxDelayMs = 4000;

        public String getBaseUrl() {
            if (baseUrl == null || baseUrl.isBlank()) {
                return DEFAULT_BASE_URL;
            }
            String trimmed = baseUrl.trim();
            return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey == null || apiKey.isBlank() ? null : apiKey.trim();
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
        }

        public int getCrawlPollIntervalMs() {
            return Math.max(1, crawlPollIntervalMs);
        }

        public void setCrawlPollIntervalMs(int crawlPollIntervalMs) {
            this.crawlPollIntervalMs = Math.max(1, crawlPollIntervalMs);
        }

        public int getRequestMaxRetries() {
            return Math.max(0, requestMaxRetries);
        }

        public void setRequestMaxRetries(int requestMaxRetries) {
            this.requestMaxRetries = Math.max(0, requestMaxRetries);
        }

        public int getRequestRetryBaseDelayMs() {
            return Math.max(0, requestRetryBaseDelayMs);
        }

        public void setRequestRetryBaseDelayMs(int requestRetryBaseDelayMs) {
            this.requestRetryBaseDelayMs = Math.max(0, requestRetryBaseDelayMs);
        }

        public int getRequestRetryMaxDelayMs() {
            return Math.max(0, requestRetryMaxDelayMs);
        }

        public void setRequestRetryMaxDelayMs(int requestRetryMaxDelayMs) {
            this.requestRetryMaxDelayMs = Math.max(0, requestRetryMaxDelayMs);
        }
    }

    /**
     * Heuristic scoring weights. Unvalidated against labeled data; tune with care.
     */
    public static class Categorizer {
        private int patternWeight = 3;
        private int keywordWeight = 5;
        private int urlWeight = 8;
        private int titleWeight = 6;
        private int nameWeight = 5;
        private int acronymWeight = 3;
        private int bodyKeywordWeight = 1;
        private int regionWeight = 2;
        private int threshold = 10;
        private int saturationCeiling = 80;

        public int getPatternWeight() {
            return Math.max(0, patternWeight);
        }

        public void setPatternWeight(int patternWeight) {
            this.patternWeight = Math.max(0, patternWeight);
        }

        public int getKeywordWeight() {
            return Math.max(0, keywordWeight);
        }

        public void setKeywordWeight(int keywordWeight) {
            this.keywordWeight = Math.max(0, keywordWeight);
        }

        public int getUrlWeight() {
            return Math.max(0, urlWeight);
        }

        public void setUrlWeight(int urlWeight) {
            this.urlWeight = Math.max(0, urlWeight);
        }

        public int getTitleWeight() {
            return Math.max(0, titleWeight);
        }

        public void setTitleWeight(int titleWeight) {
            this.titleWeight = Math.max(0, titleWeight);
        }

        public int getNameWeight() {
            return Math.max(0, nameWeight);
        }

        public void setNameWeight(int nameWeight) {
            this.nameWeight = Math.max(0, nameWeight);
        }

        public int getAcronymWeight() {
            return Math.max(0, acronymWeight);
        }

        public void setAcronymWeight(int acronymWeight) {
            this.acronymWeight = Math.max(0, acronymWeight);
        }

        public int getBodyKeywordWeight() {
            return Math.max(0, bodyKeywordWeight);
        }

        public void setBodyKeywordWeight(int bodyKeywordWeight) {
            this.bodyKeywordWeight = Math.max(0, bodyKeywordWeight);
        }

        public int getRegionWeight() {
            return Math.max(0, regionWeight);
        }

        public void setRegionWeight(int regionWeight) {
            this.regionWeight = Math.max(0, regionWeight);
        }

        public int getThreshold() {
            return Math.max(0, threshold);
        }

        public void setThreshold(int threshold) {
            this.threshold = Math.max(0, threshold);
        }

        public int getSaturationCeiling() {
            return Math.max(1, saturationCeiling);
        }

        public void setSaturationCeiling(int saturationCeiling) {
            this.saturationCeiling = Math.max(1, saturationCeiling);
        }
    }

    public static class Quality {
        private int minBodyLength = 200;
        private int structuralBonus = 10;

        public int getMinBodyLength() {
            return Math.max(0, minBodyLength);
        }

        public void setMinBodyLength(int minBodyLength) {
            this.minBodyLength = Math.max(0, minBodyLength);
        }

        public int getStructuralBonus() {
            return Math.min(100, Math.max(0, structuralBonus));
        }

        public void setStructuralBonus(int structuralBonus) {
            this.structuralBonus = Math.min(100, Math.max(0, structuralBonus));
        }
    }
}
