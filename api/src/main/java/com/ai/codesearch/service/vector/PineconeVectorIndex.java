package com.ai.codesearch.service.vector;

import com.ai.codesearch.exception.UpstreamService;
import com.ai.codesearch.exception.UpstreamUnavailableException;
import com.ai.codesearch.model.Chunk;
import com.ai.codesearch.model.IndexEntry;
import com.ai.codesearch.model.MetadataFilter;
import com.ai.codesearch.model.VectorMatch;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pinecone index accessed through its data-plane REST API.
 * <p>
 * Serverless indexes reject metadata filters on {@code describe_index_stats}
 * and {@code vectors/delete}; on a 400 from either, the partition is listed by
 * id prefix instead.
 */
public class PineconeVectorIndex implements VectorIndex {

    private static final Logger log = LoggerFactory.getLogger(PineconeVectorIndex.class);

    public static final String API_KEY_HEADER = "Api-Key";
    static final int UPSERT_BATCH_SIZE = 100;
    static final int LIST_PAGE_SIZE = 100;
    static final int DELETE_BATCH_SIZE = 1000;

    private final WebClient webClient;
    private final String namespace;
    private final Duration timeout;

    public PineconeVectorIndex(WebClient webClient, String namespace, Duration timeout) {
        this.webClient = webClient;
        this.namespace = namespace != null ? namespace : "";
        this.timeout = timeout;
    }

    @Override
    public void upsert(List<IndexEntry> entries) {
        List<PineconeVector> vectors = new ArrayList<>();
        for (IndexEntry entry : entries) {
            vectors.add(new PineconeVector(entry.id(), entry.vector(), entry.metadata()));
            if (vectors.size() >= UPSERT_BATCH_SIZE) {
                post("/vectors/upsert", new UpsertRequest(vectors, namespace));
                vectors = new ArrayList<>();
            }
        }
        if (!vectors.isEmpty()) {
            post("/vectors/upsert", new UpsertRequest(vectors, namespace));
        }
        log.debug("[PineconeVectorIndex] Upserted {} vectors", entries.size());
    }

    @Override
    public List<VectorMatch> query(float[] vector, MetadataFilter filter, int topK) {
        QueryRequest request = new QueryRequest(vector, topK, true, toPineconeFilter(filter), namespace);
        QueryResponse response = post("/query", request, QueryResponse.class);
        if (response == null || response.matches() == null) {
            return List.of();
        }
        return response.matches().stream()
                .map(match -> new VectorMatch(match.id(), match.score(), stringify(match.metadata())))
                .toList();
    }

    @Override
    public long count(MetadataFilter filter) {
        StatsResponse response;
        try {
            response = post("/describe_index_stats", new StatsRequest(toPineconeFilter(filter)), StatsResponse.class);
        } catch (UpstreamUnavailableException e) {
            if (!isBadRequest(e)) {
                throw e;
            }
            log.info("[PineconeVectorIndex] Filtered stats rejected, counting {}:{} by id prefix",
                    filter.repoName(), filter.version());
            return listIds(filter).size();
        }
        if (response == null) {
            return 0L;
        }
        if (response.namespaces() != null && response.namespaces().containsKey(namespace)) {
            return response.namespaces().get(namespace).vectorCount();
        }
        return response.totalVectorCount();
    }

    @Override
    public void deleteAll(MetadataFilter filter) {
        try {
            post("/vectors/delete", new DeleteRequest(null, toPineconeFilter(filter), namespace));
        } catch (UpstreamUnavailableException e) {
            if (!isBadRequest(e)) {
                throw e;
            }
            List<String> ids = listIds(filter);
            log.info("[PineconeVectorIndex] Filtered delete rejected, deleting {} ids of {}:{}",
                    ids.size(), filter.repoName(), filter.version());
            for (int from = 0; from < ids.size(); from += DELETE_BATCH_SIZE) {
                List<String> batch = ids.subList(from, Math.min(from + DELETE_BATCH_SIZE, ids.size()));
                post("/vectors/delete", new DeleteRequest(List.copyOf(batch), null, namespace));
            }
        }
        log.info("[PineconeVectorIndex] Deleted vectors for {}:{}", filter.repoName(), filter.version());
    }

    /**
     * Every id in the partition, following pagination tokens.
     */
    List<String> listIds(MetadataFilter filter) {
        String prefix = Chunk.vectorIdPrefix(filter.repoName(), filter.version());
        List<String> ids = new ArrayList<>();
        String token = null;
        do {
            String pageToken = token;
            ListResponse page = call("/vectors/list", webClient.get()
                    .uri(uriBuilder -> {
                        uriBuilder.path("/vectors/list")
                                .queryParam("prefix", prefix)
                                .queryParam("limit", LIST_PAGE_SIZE);
                        if (!namespace.isEmpty()) {
                            uriBuilder.queryParam("namespace", namespace);
                        }
                        if (pageToken != null) {
                            uriBuilder.queryParam("paginationToken", pageToken);
                        }
                        return uriBuilder.build();
                    })
                    .retrieve()
                    .bodyToMono(ListResponse.class));
            if (page == null) {
                break;
            }
            if (page.vectors() != null) {
                page.vectors().forEach(vector -> ids.add(vector.id()));
            }
            token = page.pagination() != null ? page.pagination().next() : null;
        } while (token != null && !token.isEmpty());
        return ids;
    }

    private static boolean isBadRequest(UpstreamUnavailableException e) {
        return e.getCause() instanceof WebClientResponseException response
                && response.getStatusCode().value() == 400;
    }

    static Map<String, Object> toPineconeFilter(MetadataFilter filter) {
        Map<String, Object> pineconeFilter = new LinkedHashMap<>();
        filter.asFieldMap().forEach((field, value) -> pineconeFilter.put(field, Map.of("$eq", value)));
        return pineconeFilter;
    }

    private void post(String path, Object body) {
        post(path, body, Map.class);
    }

    private <T> T post(String path, Object body, Class<T> responseType) {
        return call(path, webClient.post()
                .uri(path)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(responseType));
    }

    private <T> T call(String path, Mono<T> response) {
        try {
            return response.timeout(timeout).block();
        } catch (WebClientResponseException e) {
            log.error("[PineconeVectorIndex] {} returned status={}, body={}", path, e.getStatusCode(),
                    e.getResponseBodyAsString());
            throw new UpstreamUnavailableException(UpstreamService.VECTOR_INDEX,
                    "Pinecone " + path + " failed with status " + e.getStatusCode().value(), e);
        } catch (RuntimeException e) {
            log.error("[PineconeVectorIndex] {} failed: {}", path, e.getMessage());
            throw new UpstreamUnavailableException(UpstreamService.VECTOR_INDEX,
                    "Pinecone " + path + " failed: " + e.getMessage(), e);
        }
    }

    private static Map<String, String> stringify(Map<String, Object> metadata) {
        Map<String, String> result = new LinkedHashMap<>();
        if (metadata != null) {
            metadata.forEach((key, value) -> result.put(key, value != null ? String.valueOf(value) : ""));
        }
        return result;
    }

    record PineconeVector(String id, float[] values, Map<String, String> metadata) {
    }

    record UpsertRequest(List<PineconeVector> vectors, String namespace) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record QueryRequest(float[] vector, int topK, boolean includeMetadata, Map<String, Object> filter,
            String namespace) {
    }

    record QueryMatch(String id, double score, Map<String, Object> metadata) {
    }

    record QueryResponse(List<QueryMatch> matches) {
    }

    record StatsRequest(Map<String, Object> filter) {
    }

    record NamespaceStats(long vectorCount) {
    }

    record StatsResponse(Map<String, NamespaceStats> namespaces, long totalVectorCount) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record DeleteRequest(List<String> ids, Map<String, Object> filter, String namespace) {
    }

    record ListedVector(String id) {
    }

    record Pagination(String next) {
    }

    record ListResponse(List<ListedVector> vectors, Pagination pagination) {
    }
}
