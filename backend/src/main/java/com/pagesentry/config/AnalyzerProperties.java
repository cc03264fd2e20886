package com.pagesentry.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "analyzer")
public class AnalyzerProperties {
    private static final String DEFAULT_USER_AGENT = "page-sentry/1.0";

    private String userAgent;
    private Sizing sizing = new Sizing();
    private Batch batch = new Batch();
    private Extraction extraction = new Extraction();
    private Rules rules = new Rules();
    private Validation validation = new Validation();
    private Render render = new Render();
    private Escalation escalation = new Escalation();
    private Evidence evidence = new Evidence();
    private Storage storage = new Storage();
    private Search search = new Search();
    private Dlq dlq = new Dlq();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public Sizing getSizing() {
        return sizing;
    }

    public void setSizing(Sizing sizing) {
        this.sizing = sizing;
    }

    public Batch getBatch() {
        return batch;
    }

    public void setBatch(Batch batch) {
        this.batch = batch;
    }

    public Extraction getExtraction() {
        return extraction;
    }

    public void setExtraction(Extraction extraction) {
        this.extraction = extraction;
    }

    public Rules getRules() {
        return rules;
    }

    public void setRules(Rules rules) {
        this.rules = rules;
    }

    public Validation getValidation() {
        return validation;
    }

    public void setValidation(Validation validation) {
        this.validation = validation;
    }

    public Render getRender() {
        return render;
    }

    public void setRender(Render render) {
        this.render = render;
    }

    public Escalation getEscalation() {
        return escalation;
    }

    public void setEscalation(Escalation escalation) {
        this.escalation = escalation;
    }

    public Evidence getEvidence() {
        return evidence;
    }

    public void setEvidence(Evidence evidence) {
        this.evidence = evidence;
    }

    public Storage getStorage() {
        return storage;
    }

    public void setStorage(Storage storage) {
        this.storage = storage;
    }

    public Search getSearch() {
        return search;
    }

    public void setSearch(Search search) {
        this.search = search;
    }

    public Dlq getDlq() {
        return dlq;
    }

    public void setDlq(Dlq dlq) {
        this.dlq = dlq;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    /**
     * Per-core multipliers and hard caps. Resolved once into {@link RuntimeSizing}.
     */
    public static class Sizing {
        private int cores = 0;
        private int pageConcurrencyPerCore = 8;
        private int pageConcurrencyMax = 50;
        private int hitQueuePerCore = 500;
        private int hitQueueMax = 4000;
        private int screenshotQueuePerCore = 125;
        private int screenshotQueueMax = 1000;
        private int htmlCachePerCore = 125;
        private int htmlCacheMax = 1000;

        public int getCores() {
            return cores;
        }

        public void setCores(int cores) {
            this.cores = cores;
        }

        public int getPageConcurrencyPerCore() {
            return Math.max(1, pageConcurrencyPerCore);
        }

        public void setPageConcurrencyPerCore(int pageConcurrencyPerCore) {
            this.pageConcurrencyPerCore = pageConcurrencyPerCore;
        }

        public int getPageConcurrencyMax() {
            return Math.max(1, pageConcurrencyMax);
        }

        public void setPageConcurrencyMax(int pageConcurrencyMax) {
            this.pageConcurrencyMax = pageConcurrencyMax;
        }

        public int getHitQueuePerCore() {
            return Math.max(1, hitQueuePerCore);
        }

        public void setHitQueuePerCore(int hitQueuePerCore) {
            this.hitQueuePerCore = hitQueuePerCore;
        }

        public int getHitQueueMax() {
            return Math.max(1, hitQueueMax);
        }

        public void setHitQueueMax(int hitQueueMax) {
            this.hitQueueMax = hitQueueMax;
        }

        public int getScreenshotQueuePerCore() {
            return Math.max(1, screenshotQueuePerCore);
        }

        public void setScreenshotQueuePerCore(int screenshotQueuePerCore) {
            this.screenshotQueuePerCore = screenshotQueuePerCore;
        }

        public int getScreenshotQueueMax() {
            return Math.max(1, screenshotQueueMax);
        }

        public void setScreenshotQueueMax(int screenshotQueueMax) {
            this.screenshotQueueMax = screenshotQueueMax;
        }

        public int getHtmlCachePerCore() {
            return Math.max(1, htmlCachePerCore);
        }

        public void setHtmlCachePerCore(int htmlCachePerCore) {
            this.htmlCachePerCore = htmlCachePerCore;
        }

        public int getHtmlCacheMax() {
            return Math.max(1, htmlCacheMax);
        }

        public void setHtmlCacheMax(int htmlCacheMax) {
            this.htmlCacheMax = htmlCacheMax;
        }
    }

    public static class Batch {
        private int chunkSize = 50;
        private int snippetCapBytes = 1_000_000;
        private int maxSnippets = 5_000;

        public int getChunkSize() {
            return Math.max(1, chunkSize);
        }

        public void setChunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
        }

        public int getSnippetCapBytes() {
            return Math.max(1024, snippetCapBytes);
        }

        public void setSnippetCapBytes(int snippetCapBytes) {
            this.snippetCapBytes = snippetCapBytes;
        }

        public int getMaxSnippets() {
            return Math.max(1, maxSnippets);
        }

        public void setMaxSnippets(int maxSnippets) {
            this.maxSnippets = maxSnippets;
        }
    }

    public static class Extraction {
        private int maxImages = 10;
        private int maxImageBytes = 2_000_000;
        private int imageTimeoutSeconds = 10;
        private boolean ocrEnabled = true;
        private String tessDataPath = "/usr/share/tesseract-ocr/5/tessdata";
        private String ocrLanguage = "eng";

        public int getMaxImages() {
            return Math.max(0, maxImages);
        }

        public void setMaxImages(int maxImages) {
            this.maxImages = maxImages;
        }

        public int getMaxImageBytes() {
            return Math.max(1024, maxImageBytes);
        }

        public void setMaxImageBytes(int maxImageBytes) {
            this.maxImageBytes = maxImageBytes;
        }

        public int getImageTimeoutSeconds() {
            return Math.max(1, imageTimeoutSeconds);
        }

        public void setImageTimeoutSeconds(int imageTimeoutSeconds) {
            this.imageTimeoutSeconds = imageTimeoutSeconds;
        }

        public boolean isOcrEnabled() {
            return ocrEnabled;
        }

        public void setOcrEnabled(boolean ocrEnabled) {
            this.ocrEnabled = ocrEnabled;
        }

        public String getTessDataPath() {
            return tessDataPath;
        }

        public void setTessDataPath(String tessDataPath) {
            this.tessDataPath = tessDataPath;
        }

        public String getOcrLanguage() {
            return ocrLanguage == null || ocrLanguage.isBlank() ? "eng" : ocrLanguage;
        }

        public void setOcrLanguage(String ocrLanguage) {
            this.ocrLanguage = ocrLanguage;
        }
    }

    public static class Rules {
        private String keywordsFile = "classpath:keywords/keywords.yml";
        private double paymentContextThreshold = 0.30;
        private double aliasContextThreshold = 0.25;
        private int contextWindow = 80;
        private int snippetWindow = 100;

        public String getKeywordsFile() {
            return keywordsFile;
        }

        public void setKeywordsFile(String keywordsFile) {
            this.keywordsFile = keywordsFile;
        }

        public double getPaymentContextThreshold() {
            return paymentContextThreshold;
        }

        public void setPaymentContextThreshold(double paymentContextThreshold) {
            this.paymentContextThreshold = paymentContextThreshold;
        }

        public double getAliasContextThreshold() {
            return aliasContextThreshold;
        }

        public void setAliasContextThreshold(double aliasContextThreshold) {
            this.aliasContextThreshold = aliasContextThreshold;
        }

        public int getContextWindow() {
            return Math.max(1, contextWindow);
        }

        public void setContextWindow(int contextWindow) {
            this.contextWindow = contextWindow;
        }

        public int getSnippetWindow() {
            return Math.max(1, snippetWindow);
        }

        public void setSnippetWindow(int snippetWindow) {
            this.snippetWindow = snippetWindow;
        }
    }

    public static class Validation {
        private boolean enabled = false;
        private double threshold = 0.75;
        private int cacheMaxEntries = 10_000;
        private Embedding embedding = new Embedding();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public double getThreshold() {
            return Math.max(0.0, Math.min(1.0, threshold));
        }

        public void setThreshold(double threshold) {
            this.threshold = threshold;
        }

        public int getCacheMaxEntries() {
            return Math.max(1, cacheMaxEntries);
        }

        public void setCacheMaxEntries(int cacheMaxEntries) {
            this.cacheMaxEntries = cacheMaxEntries;
        }

        public Embedding getEmbedding() {
            return embedding;
        }

        public void setEmbedding(Embedding embedding) {
            this.embedding = embedding;
        }
    }

    public static class Embedding {
        private String baseUrl = "http://localhost:8081/v1";
        private String apiKey = "not-needed";
        private String modelName = "all-MiniLM-L6-v2";
        private int timeoutSeconds = 30;

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

        public String getModelName() {
            return modelName;
        }

        public void setModelName(String modelName) {
            this.modelName = modelName;
        }

        public int getTimeoutSeconds() {
            return Math.max(1, timeoutSeconds);
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }
    }

    public static class Render {
        private boolean enabled = true;
        private String baseUrl = "http://localhost:9000";
        private int timeoutSeconds = 60;
        private int screenshotTimeoutSeconds = 90;
        private int maxMatches = 5;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public int getTimeoutSeconds() {
            return Math.max(1, timeoutSeconds);
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }

        public int getScreenshotTimeoutSeconds() {
            return Math.max(1, screenshotTimeoutSeconds);
        }

        public void setScreenshotTimeoutSeconds(int screenshotTimeoutSeconds) {
            this.screenshotTimeoutSeconds = screenshotTimeoutSeconds;
        }

        public int getMaxMatches() {
            return Math.max(1, maxMatches);
        }

        public void setMaxMatches(int maxMatches) {
            this.maxMatches = maxMatches;
        }
    }

    public static class Escalation {
        private int minTextLength = 200;
        private int successThreshold = 2;
        private List<String> forcedDomains = new ArrayList<>();

        public int getMinTextLength() {
            return Math.max(0, minTextLength);
        }

        public void setMinTextLength(int minTextLength) {
            this.minTextLength = minTextLength;
        }

        public int getSuccessThreshold() {
            return Math.max(1, successThreshold);
        }

        public void setSuccessThreshold(int successThreshold) {
            this.successThreshold = successThreshold;
        }

        public List<String> getForcedDomains() {
            return forcedDomains == null ? List.of() : forcedDomains;
        }

        public void setForcedDomains(List<String> forcedDomains) {
            this.forcedDomains = forcedDomains == null ? new ArrayList<>() : new ArrayList<>(forcedDomains);
        }
    }

    public static class Evidence {
        private boolean workersEnabled = true;
        private double screenshotConfidence = 0.7;
        private int flushBatchSize = 100;
        private int flushIntervalMs = 2000;
        private int flushTimeoutSeconds = 10;
        private int screenshotWorkers = 0;
        private int stageMaxAttempts = 3;
        private int stageBackoffMs = 1000;

        public boolean isWorkersEnabled() {
            return workersEnabled;
        }

        public void setWorkersEnabled(boolean workersEnabled) {
            this.workersEnabled = workersEnabled;
        }

        public double getScreenshotConfidence() {
            return screenshotConfidence;
        }

        public void setScreenshotConfidence(double screenshotConfidence) {
            this.screenshotConfidence = screenshotConfidence;
        }

        public int getFlushBatchSize() {
            return Math.max(1, flushBatchSize);
        }

        public void setFlushBatchSize(int flushBatchSize) {
            this.flushBatchSize = flushBatchSize;
        }

        public int getFlushIntervalMs() {
            return Math.max(10, flushIntervalMs);
        }

        public void setFlushIntervalMs(int flushIntervalMs) {
            this.flushIntervalMs = flushIntervalMs;
        }

        public int getFlushTimeoutSeconds() {
            return Math.max(1, flushTimeoutSeconds);
        }

        public void setFlushTimeoutSeconds(int flushTimeoutSeconds) {
            this.flushTimeoutSeconds = flushTimeoutSeconds;
        }

        public int getScreenshotWorkers() {
            return screenshotWorkers;
        }

        public void setScreenshotWorkers(int screenshotWorkers) {
            this.screenshotWorkers = screenshotWorkers;
        }

        public int getStageMaxAttempts() {
            return Math.max(1, stageMaxAttempts);
        }

        public void setStageMaxAttempts(int stageMaxAttempts) {
            this.stageMaxAttempts = stageMaxAttempts;
        }

        public int getStageBackoffMs() {
            return Math.max(0, stageBackoffMs);
        }

        public void setStageBackoffMs(int stageBackoffMs) {
            this.stageBackoffMs = stageBackoffMs;
        }
    }

    public static class Storage {
        private String endpoint = "http://localhost:9000";
        private String region = "us-east-1";
        private String accessKey = "minioadmin";
        private String secretKey = "minioadmin";
        private String screenshotBucket = "screenshots";
        private String archiveBucket = "html-archive";
        private String publicBaseUrl;
        private boolean archiveHtml = false;

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getRegion() {
            return region;
        }

        public void setRegion(String region) {
            this.region = region;
        }

        public String getAccessKey() {
            return accessKey;
        }

        public void setAccessKey(String accessKey) {
            this.accessKey = accessKey;
        }

        public String getSecretKey() {
            return secretKey;
        }

        public void setSecretKey(String secretKey) {
            this.secretKey = secretKey;
        }

        public String getScreenshotBucket() {
            return screenshotBucket;
        }

        public void setScreenshotBucket(String screenshotBucket) {
            this.screenshotBucket = screenshotBucket;
        }

        public String getArchiveBucket() {
            return archiveBucket;
        }

        public void setArchiveBucket(String archiveBucket) {
            this.archiveBucket = archiveBucket;
        }

        public String getPublicBaseUrl() {
            if (publicBaseUrl == null || publicBaseUrl.isBlank()) {
                return endpoint;
            }
            return publicBaseUrl;
        }

        public void setPublicBaseUrl(String publicBaseUrl) {
            this.publicBaseUrl = publicBaseUrl;
        }

        public boolean isArchiveHtml() {
            return archiveHtml;
        }

        public void setArchiveHtml(boolean archiveHtml) {
            this.archiveHtml = archiveHtml;
        }
    }

    public static class Search {
        private boolean enabled = false;
        private String baseUrl = "http://localhost:9200";
        private String index = "analysis-results";
        private int timeoutSeconds = 10;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getIndex() {
            return index;
        }

        public void setIndex(String index) {
            this.index = index;
        }

        public int getTimeoutSeconds() {
            return Math.max(1, timeoutSeconds);
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }
    }

    public static class Dlq {
        private String store = "redis";
        private int maxRetries = 5;
        private int sweepIntervalSeconds = 60;
        private int ttlDays = 30;

        public String getStore() {
            return store;
        }

        public void setStore(String store) {
            this.store = store;
        }

        public int getMaxRetries() {
            return Math.max(0, maxRetries);
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public int getSweepIntervalSeconds() {
            return Math.max(1, sweepIntervalSeconds);
        }

        public void setSweepIntervalSeconds(int sweepIntervalSeconds) {
            this.sweepIntervalSeconds = sweepIntervalSeconds;
        }

        public int getTtlDays() {
            return Math.max(1, ttlDays);
        }

        public void setTtlDays(int ttlDays) {
            this.ttlDays = ttlDays;
        }
    }
}
