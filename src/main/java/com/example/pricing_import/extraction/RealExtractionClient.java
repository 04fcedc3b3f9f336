package com.example.pricing_import.extraction;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Profile;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import com.example.pricing_import.loader.RawRow;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import reactor.core.Exceptions;

/**
 * Remote model extraction through an OpenAI-compatible chat-completions endpoint.
 */
@Component
@Profile("real")
@Primary
public class RealExtractionClient implements ExtractionClient {

    private static final Logger log = LoggerFactory.getLogger(RealExtractionClient.class);
    private static final double DEFAULT_CONFIDENCE = 0.5;

    private final ExtractionProperties properties;
    private final WebClient.Builder webClientBuilder;
    private final ObjectMapper objectMapper;

    public RealExtractionClient(ExtractionProperties properties, WebClient.Builder webClientBuilder,
            ObjectMapper objectMapper) {
        this.properties = properties;
        this.webClientBuilder = webClientBuilder;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<ExtractionResult> extract(List<RawRow> rows, ExtractionSchema schema) {
        if (!properties.isApiKeyConfigured()) {
            throw new ExtractionClientException("extraction.api-key is not configured", false);
        }
        int first = rows.get(0).position();
        log.info("POST chat/completions rows={}..{} model={}", first, rows.get(rows.size() - 1).position(),
                properties.getModel());

        String url = properties.getApiBase() + "/chat/completions";
        try {
            JsonNode response = webClient()
                    .post()
                    .uri(url)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiKey())
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(buildRequest(rows, schema))
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .timeout(properties.getCallTimeout())
                    .block();

            if (response == null) {
                throw new ExtractionClientException("empty response from extraction endpoint", true);
            }
            String content = response.path("choices").path(0).path("message").path("content").asText("");
            return parseRows(content, rows);

        } catch (WebClientResponseException e) {
            int status = e.getStatusCode().value();
            boolean retryable = status == 429 || e.getStatusCode().is5xxServerError();
            log.warn("chat/completions failed rows from {} status={} body={}", first, status,
                    e.getResponseBodyAsString());
            throw new ExtractionClientException("extraction call failed: " + status, retryable, e);
        } catch (WebClientRequestException e) {
            log.warn("chat/completions connection error rows from {}: {}", first, e.getMessage());
            throw new ExtractionClientException("extraction endpoint unreachable: " + e.getMessage(), true, e);
        } catch (ExtractionClientException e) {
            throw e;
        } catch (RuntimeException e) {
            if (Exceptions.unwrap(e) instanceof TimeoutException) {
                log.warn("chat/completions timed out after {} rows from {}", properties.getCallTimeout(), first);
                throw new ExtractionClientException("extraction call timed out", true, e);
            }
            log.error("chat/completions error rows from {}", first, e);
            throw new ExtractionClientException("extraction call error: " + e.getMessage(), false, e);
        }
    }

    private WebClient webClient() {
        return webClientBuilder
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    private Map<String, Object> buildRequest(List<RawRow> rows, ExtractionSchema schema) {
        List<Map<String, Object>> payloadRows = new ArrayList<>();
        for (RawRow row : rows) {
            Map<String, Object> r = new LinkedHashMap<>();
            r.put("row", row.position());
            r.put("cells", row.cells());
            payloadRows.add(r);
        }

        String instructions = "Extract one pricing record per input row. "
                + "Return a JSON object {\"rows\": [...]} with one element per input row, each having "
                + "\"row\" (the input row number), \"confidence\" (0..1) and these fields: "
                + schema.fields() + ". "
                + "Categories: " + schema.categoryNames() + ". "
                + "Copy prices exactly as written. Use null for unknown fields. "
                + "If a row is not a product line, return {\"row\": n, \"extracted\": false}.";

        String rowsJson;
        try {
            rowsJson = objectMapper.writeValueAsString(payloadRows);
        } catch (JsonProcessingException e) {
            throw new ExtractionClientException("cannot serialize rows: " + e.getOriginalMessage(), false, e);
        }

        return Map.of(
                "model", properties.getModel(),
                "temperature", 0,
                "response_format", Map.of("type", "json_object"),
                "messages", List.of(
                        Map.of("role", "system", "content", instructions),
                        Map.of("role", "user", "content", rowsJson)));
    }

    /**
     * Maps the model's JSON answer onto the requested rows. Rows the model skipped come back as "no extraction".
     */
    List<ExtractionResult> parseRows(String content, List<RawRow> requested) {
        JsonNode root;
        try {
            root = objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new ExtractionClientException("unparseable extraction response", false, e);
        }
        JsonNode items = root.isArray() ? root : root.path("rows");

        Set<Integer> wanted = new HashSet<>();
        requested.forEach(r -> wanted.add(r.position()));

        Map<Integer, ExtractionResult> byRow = new LinkedHashMap<>();
        for (JsonNode item : items) {
            int row = item.path("row").asInt(-1);
            if (!wanted.contains(row) || byRow.containsKey(row)) {
                continue;
            }
            if (!item.path("extracted").asBoolean(true) || text(item, ExtractionSchema.PRODUCT_NAME) == null) {
                byRow.put(row, ExtractionResult.none(row));
                continue;
            }
            ExtractedRecord record = ExtractedRecord.builder()
                    .rowPosition(row)
                    .productName(text(item, ExtractionSchema.PRODUCT_NAME))
                    .unitPrice(text(item, ExtractionSchema.UNIT_PRICE))
                    .numericPrice(item.path(ExtractionSchema.UNIT_PRICE).isNumber())
                    .unit(text(item, ExtractionSchema.UNIT))
                    .categoryHint(text(item, ExtractionSchema.CATEGORY_HINT))
                    .supplierSku(text(item, ExtractionSchema.SUPPLIER_SKU))
                    .currency(text(item, ExtractionSchema.CURRENCY))
                    .supplier(text(item, ExtractionSchema.SUPPLIER))
                    .freeSample(item.path(ExtractionSchema.FREE_SAMPLE).asBoolean(false))
                    .confidence(item.path("confidence").asDouble(DEFAULT_CONFIDENCE))
                    .build();
            byRow.put(row, new ExtractionResult(row, record));
        }

        List<ExtractionResult> results = new ArrayList<>(requested.size());
        for (RawRow r : requested) {
            results.add(byRow.getOrDefault(r.position(), ExtractionResult.none(r.position())));
        }
        return results;
    }

    private static String text(JsonNode item, String field) {
        JsonNode node = item.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        String s = node.asText().trim();
        return s.isEmpty() ? null : s;
    }
}
