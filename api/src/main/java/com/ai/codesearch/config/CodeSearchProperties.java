package com.ai.codesearch.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration for the indexing pipeline, the retrieval side and the upstream
 * clients they share. Bound from the {@code codesearch} namespace.
 */
@ConfigurationProperties(prefix = "codesearch")
public class CodeSearchProperties {

    private final Embedding embedding = new Embedding();
    private final Completion completion = new Completion();
    private final VectorStore vectorStore = new VectorStore();
    private final Github github = new Github();
    private final Indexing indexing = new Indexing();
    private final Conversation conversation = new Conversation();

    public Embedding getEmbedding() {
        return embedding;
    }

    public Completion getCompletion() {
        return completion;
    }

    public VectorStore getVectorStore() {
        return vectorStore;
    }

    public Github getGithub() {
        return github;
    }

    public Indexing getIndexing() {
        return indexing;
    }

    public Conversation getConversation() {
        return conversation;
    }

    public static class Embedding {

        /**
         * Base URL of the Ollama server hosting the embedding model.
         */
        private String baseUrl = "http://localhost:11434";

        /**
         * Embedding model used at index time and at query time. Changing it
         * requires a full re-index.
         */
        private String model = "nomic-embed-text";

        private int dimension = 768;

        private Duration timeout = Duration.ofSeconds(30);

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public int getDimension() {
            return dimension;
        }

        public void setDimension(int dimension) {
            this.dimension = dimension;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    public static class Completion {

        private String baseUrl = "http://localhost:11434";

        /**
         * Chat model generating the grounded answers.
         */
        private String model = "qwen2.5-coder";

        /**
         * Chat model used by the clarification gate. Falls back to {@link #model}.
         */
        private String gateModel;

        private double temperature = 0.1d;

        private int maxTokens = 1000;

        private Duration timeout = Duration.ofSeconds(60);

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getGateModel() {
            return (gateModel != null && !gateModel.isBlank()) ? gateModel : model;
        }

        public void setGateModel(String gateModel) {
            this.gateModel = gateModel;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public int getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    public static class VectorStore {

        /**
         * One of {@code memory}, {@code pgvector} or {@code pinecone}.
         */
        private String type = "memory";

        private final Pinecone pinecone = new Pinecone();
        private final PgVector pgvector = new PgVector();

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public Pinecone getPinecone() {
            return pinecone;
        }

        public PgVector getPgvector() {
            return pgvector;
        }
    }

    public static class Pinecone {

        private String apiKey;

        /**
         * Data-plane host of the index, e.g. {@code https://code-index-abc123.svc.us-east-1.pinecone.io}.
         */
        private String host;

        private String namespace = "";

        private Duration timeout = Duration.ofSeconds(30);

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public String getNamespace() {
            return namespace;
        }

        public void setNamespace(String namespace) {
            this.namespace = namespace;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    public static class PgVector {

        private String table = "code_chunks";

        public String getTable() {
            return table;
        }

        public void setTable(String table) {
            this.table = table;
        }
    }

    public static class Github {

        private String rawBaseUrl = "https://raw.githubusercontent.com";

        private Duration archiveTimeout = Duration.ofSeconds(120);

        private Duration rawTimeout = Duration.ofSeconds(10);

        private long maxArchiveBytes = 200L * 1024 * 1024;

        public String getRawBaseUrl() {
            return rawBaseUrl;
        }

        public void setRawBaseUrl(String rawBaseUrl) {
            this.rawBaseUrl = rawBaseUrl;
        }

        public Duration getArchiveTimeout() {
            return archiveTimeout;
        }

        public void setArchiveTimeout(Duration archiveTimeout) {
            this.archiveTimeout = archiveTimeout;
        }

        public Duration getRawTimeout() {
            return rawTimeout;
        }

        public void setRawTimeout(Duration rawTimeout) {
            this.rawTimeout = rawTimeout;
        }

        public long getMaxArchiveBytes() {
            return maxArchiveBytes;
        }

        public void setMaxArchiveBytes(long maxArchiveBytes) {
            this.maxArchiveBytes = maxArchiveBytes;
        }
    }

    public static class Indexing {

        private int chunkSize = 3000;

        private int chunkOverlap = 1000;

        private int batchSize = 64;

        private int maxBatchChars = 64_000;

        /**
         * Attempts per embedding batch, including the first one.
         */
        private int maxAttempts = 3;

        private Duration initialBackoff = Duration.ofSeconds(1);

        private Duration maxBackoff = Duration.ofSeconds(10);

        /**
         * Embedding batches allowed to fail for good before the run is aborted.
         */
        private int maxFailedBatches = 10;

        private List<String> extensions = new ArrayList<>(List.of(
                "py", "js", "ts", "java", "cpp", "c", "h", "hpp", "cs", "rb", "go", "rs",
                "php", "swift", "kt", "scala", "r", "m", "mm", "sh", "ps1", "sql", "html",
                "css", "jsx", "tsx", "vue", "svelte"));

        private List<String> skipPatterns = new ArrayList<>(List.of(
                ".git", "__pycache__", ".pytest_cache", "node_modules", ".venv", ".env", ".ds_store"));

        public int getChunkSize() {
            return chunkSize;
        }

        public void setChunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
        }

        public int getChunkOverlap() {
            return chunkOverlap;
        }

        public void setChunkOverlap(int chunkOverlap) {
            this.chunkOverlap = chunkOverlap;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getMaxBatchChars() {
            return maxBatchChars;
        }

        public void setMaxBatchChars(int maxBatchChars) {
            this.maxBatchChars = maxBatchChars;
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

        public int getMaxFailedBatches() {
            return maxFailedBatches;
        }

        public void setMaxFailedBatches(int maxFailedBatches) {
            this.maxFailedBatches = maxFailedBatches;
        }

        public List<String> getExtensions() {
            return extensions;
        }

        public void setExtensions(List<String> extensions) {
            this.extensions = extensions;
        }

        public List<String> getSkipPatterns() {
            return skipPatterns;
        }

        public void setSkipPatterns(List<String> skipPatterns) {
            this.skipPatterns = skipPatterns;
        }
    }

    public static class Conversation {

        /**
         * Number of most recent turns forwarded to the gate and the answer model.
         */
        private int historyWindow = 10;

        public int getHistoryWindow() {
            return historyWindow;
        }

        public void setHistoryWindow(int historyWindow) {
            this.historyWindow = historyWindow;
        }
    }
}
