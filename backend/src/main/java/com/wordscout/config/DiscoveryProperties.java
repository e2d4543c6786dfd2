package com.wordscout.config;

import com.wordscout.discovery.cache.CacheMode;
import com.wordscout.discovery.client.DeviceFilter;
import com.wordscout.discovery.filter.MinusWordMode;
import com.wordscout.discovery.nlp.GeoMode;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "discovery")
public class DiscoveryProperties {
    private static final String DEFAULT_USER_AGENT = "wordscout/0.1 (+keyword-discovery)";

    private Api api = new Api();
    private RateLimit rateLimit = new RateLimit();
    private Cache cache = new Cache();
    private Scheduler scheduler = new Scheduler();
    private Filter filter = new Filter();
    private Nlp nlp = new Nlp();
    private Checkpoint checkpoint = new Checkpoint();
    private Cli cli = new Cli();

    public Api getApi() {
        return api;
    }

    public void setApi(Api api) {
        this.api = api;
    }

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    public void setRateLimit(RateLimit rateLimit) {
        this.rateLimit = rateLimit;
    }

    public Cache getCache() {
        return cache;
    }

    public void setCache(Cache cache) {
        this.cache = cache;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Filter getFilter() {
        return filter;
    }

    public void setFilter(Filter filter) {
        this.filter = filter;
    }

    public Nlp getNlp() {
        return nlp;
    }

    public void setNlp(Nlp nlp) {
        this.nlp = nlp;
    }

    public Checkpoint getCheckpoint() {
        return checkpoint;
    }

    public void setCheckpoint(Checkpoint checkpoint) {
        this.checkpoint = checkpoint;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Api {
        private String endpoint = "https://searchapi.api.cloud.yandex.net/v2/wordstat/topRequests";
        private String apiKey;
        private String folderId;
        private String userAgent;
        private int requestTimeoutSeconds = 30;

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getFolderId() {
            return folderId;
        }

        public void setFolderId(String folderId) {
            this.folderId = folderId;
        }

        public String getUserAgent() {
            return normalizeUserAgent(userAgent);
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = normalizeUserAgent(userAgent);
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
        }
    }

    public static class RateLimit {
        private int maxPerSecond = 10;
        private int maxPerHour = 1000;
        private int maxPerDay = 10000;

        public int getMaxPerSecond() {
            return maxPerSecond;
        }

        public void setMaxPerSecond(int maxPerSecond) {
            this.maxPerSecond = maxPerSecond;
        }

        public int getMaxPerHour() {
            return maxPerHour;
        }

        public void setMaxPerHour(int maxPerHour) {
            this.maxPerHour = maxPerHour;
        }

        public int getMaxPerDay() {
            return maxPerDay;
        }

        public void setMaxPerDay(int maxPerDay) {
            this.maxPerDay = maxPerDay;
        }
    }

    public static class Cache {
        private CacheMode mode = CacheMode.ON;
        private int ttlDays = 7;
        private int sweepIntervalSeconds = 60;
        private int writeTimeoutSeconds = 10;

        public CacheMode getMode() {
            return mode == null ? CacheMode.ON : mode;
        }

        public void setMode(CacheMode mode) {
            this.mode = mode;
        }

        public int getTtlDays() {
            return ttlDays;
        }

        public void setTtlDays(int ttlDays) {
            this.ttlDays = ttlDays;
        }

        public int getSweepIntervalSeconds() {
            return Math.max(1, sweepIntervalSeconds);
        }

        public void setSweepIntervalSeconds(int sweepIntervalSeconds) {
            this.sweepIntervalSeconds = Math.max(1, sweepIntervalSeconds);
        }

        public int getWriteTimeoutSeconds() {
            return Math.max(1, writeTimeoutSeconds);
        }

        public void setWriteTimeoutSeconds(int writeTimeoutSeconds) {
            this.writeTimeoutSeconds = Math.max(1, writeTimeoutSeconds);
        }
    }

    public static class Scheduler {
        private int workerCount = 3;
        private int maxDepth = 2;
        private int topN = 3;
        private int phrasesPerCall = 100;
        private DeviceFilter device = DeviceFilter.ALL;
        private List<Integer> regions = new ArrayList<>();
        private GeoMode geoMode = GeoMode.OFF;
        private boolean expandFilteredPhrases = true;
        private int maxFetchAttempts = 3;
        private int maxBackoffSeconds = 60;
        private int acquireTimeoutSeconds = 60;
        private int pollIntervalMs = 50;
        private int progressIntervalMs = 1000;
        private int autosaveIntervalSeconds = 30;
        private int eventQueueCapacity = 256;

        public int getWorkerCount() {
            return workerCount;
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = workerCount;
        }

        public int getMaxDepth() {
            return maxDepth;
        }

        public void setMaxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
        }

        public int getTopN() {
            return topN;
        }

        public void setTopN(int topN) {
            this.topN = topN;
        }

        public int getPhrasesPerCall() {
            return phrasesPerCall;
        }

        public void setPhrasesPerCall(int phrasesPerCall) {
            this.phrasesPerCall = phrasesPerCall;
        }

        public DeviceFilter getDevice() {
            return device == null ? DeviceFilter.ALL : device;
        }

        public void setDevice(DeviceFilter device) {
            this.device = device;
        }

        public List<Integer> getRegions() {
            return regions;
        }

        public void setRegions(List<Integer> regions) {
            this.regions = regions == null ? new ArrayList<>() : new ArrayList<>(regions);
        }

        public GeoMode getGeoMode() {
            return geoMode == null ? GeoMode.OFF : geoMode;
        }

        public void setGeoMode(GeoMode geoMode) {
            this.geoMode = geoMode;
        }

        public boolean isExpandFilteredPhrases() {
            return expandFilteredPhrases;
        }

        public void setExpandFilteredPhrases(boolean expandFilteredPhrases) {
            this.expandFilteredPhrases = expandFilteredPhrases;
        }

        public int getMaxFetchAttempts() {
            return maxFetchAttempts;
        }

        public void setMaxFetchAttempts(int maxFetchAttempts) {
            this.maxFetchAttempts = maxFetchAttempts;
        }

        public int getMaxBackoffSeconds() {
            return maxBackoffSeconds;
        }

        public void setMaxBackoffSeconds(int maxBackoffSeconds) {
            this.maxBackoffSeconds = maxBackoffSeconds;
        }

        public int getAcquireTimeoutSeconds() {
            return acquireTimeoutSeconds;
        }

        public void setAcquireTimeoutSeconds(int acquireTimeoutSeconds) {
            this.acquireTimeoutSeconds = acquireTimeoutSeconds;
        }

        public int getPollIntervalMs() {
            return Math.max(1, pollIntervalMs);
        }

        public void setPollIntervalMs(int pollIntervalMs) {
            this.pollIntervalMs = Math.max(1, pollIntervalMs);
        }

        public int getProgressIntervalMs() {
            return Math.max(10, progressIntervalMs);
        }

        public void setProgressIntervalMs(int progressIntervalMs) {
            this.progressIntervalMs = Math.max(10, progressIntervalMs);
        }

        public int getAutosaveIntervalSeconds() {
            return Math.max(1, autosaveIntervalSeconds);
        }

        public void setAutosaveIntervalSeconds(int autosaveIntervalSeconds) {
            this.autosaveIntervalSeconds = Math.max(1, autosaveIntervalSeconds);
        }

        public int getEventQueueCapacity() {
            return Math.max(1, eventQueueCapacity);
        }

        public void setEventQueueCapacity(int eventQueueCapacity) {
            this.eventQueueCapacity = Math.max(1, eventQueueCapacity);
        }
    }

    public static class Filter {
        private int minCount = 1;
        private int minWords = 1;
        private int maxWords = 10;
        private String includePattern = "";
        private String excludePattern = "";
        private String excludeSubstrings = "";
        private String minusWords = "";
        private MinusWordMode minusWordMode = MinusWordMode.ANY;

        public int getMinCount() {
            return minCount;
        }

        public void setMinCount(int minCount) {
            this.minCount = minCount;
        }

        public int getMinWords() {
            return minWords;
        }

        public void setMinWords(int minWords) {
            this.minWords = minWords;
        }

        public int getMaxWords() {
            return maxWords;
        }

        public void setMaxWords(int maxWords) {
            this.maxWords = maxWords;
        }

        public String getIncludePattern() {
            return includePattern;
        }

        public void setIncludePattern(String includePattern) {
            this.includePattern = includePattern;
        }

        public String getExcludePattern() {
            return excludePattern;
        }

        public void setExcludePattern(String excludePattern) {
            this.excludePattern = excludePattern;
        }

        public String getExcludeSubstrings() {
            return excludeSubstrings;
        }

        public void setExcludeSubstrings(String excludeSubstrings) {
            this.excludeSubstrings = excludeSubstrings;
        }

        public String getMinusWords() {
            return minusWords;
        }

        public void setMinusWords(String minusWords) {
            this.minusWords = minusWords;
        }

        public MinusWordMode getMinusWordMode() {
            return minusWordMode == null ? MinusWordMode.ANY : minusWordMode;
        }

        public void setMinusWordMode(MinusWordMode minusWordMode) {
            this.minusWordMode = minusWordMode;
        }
    }

    public static class Nlp {
        private List<String> extraStopWords = new ArrayList<>();
        private List<String> geoKeywords = new ArrayList<>();

        public List<String> getExtraStopWords() {
            return extraStopWords;
        }

        public void setExtraStopWords(List<String> extraStopWords) {
            this.extraStopWords = extraStopWords == null ? new ArrayList<>() : new ArrayList<>(extraStopWords);
        }

        public List<String> getGeoKeywords() {
            return geoKeywords;
        }

        public void setGeoKeywords(List<String> geoKeywords) {
            this.geoKeywords = geoKeywords == null ? new ArrayList<>() : new ArrayList<>(geoKeywords);
        }
    }

    public static class Checkpoint {
        private boolean enabled = true;
        private String path = "output.state.json";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }
    }

    public static class Cli {
        private boolean run = false;
        private String seeds = "";
        private String seedsFile;
        private boolean resume = false;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getSeeds() {
            return seeds;
        }

        public void setSeeds(String seeds) {
            this.seeds = seeds;
        }

        public String getSeedsFile() {
            return seedsFile;
        }

        public void setSeedsFile(String seedsFile) {
            this.seedsFile = seedsFile;
        }

        public boolean isResume() {
            return resume;
        }

        public void setResume(boolean resume) {
            this.resume = resume;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
