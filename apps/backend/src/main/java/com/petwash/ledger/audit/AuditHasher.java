package com.petwash.ledger.audit;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.petwash.ledger.audit.dto.AuditEvent;
import com.petwash.ledger.audit.exception.AuditValidationException;
import com.petwash.ledger.audit.support.JsonCanonicalizer;
import org.apache.commons.codec.digest.DigestUtils;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Signs audit records.
 *
 * <p>The digest is {@code SHA-256} over the canonical JSON object
 * <pre>
 * {"eventType":..,"ipAddress":..,"metadata":{..},"previousHash":..,"subjectId":..,"timestamp":..,"userAgent":..}
 * </pre>
 * with keys sorted at every level and missing values written as {@code null}. Every stored column
 * except the id and the chain position feeds the digest.</p>
 */
public final class AuditHasher {
    private AuditHasher() {}

    public static String sha256Hex(String s) {
        return DigestUtils.sha256Hex(s);
    }

    /** Producer-facing signature: metadata is normalized first. */
    public static String sign(ObjectMapper om, AuditEvent event, Instant timestamp, String previousHash) {
        JsonNode metadata = normalizeMetadata(om, event.metadata());
        return sign(om, event.eventType(), event.subjectId(), metadata,
                event.ipAddress(), event.userAgent(), timestamp, previousHash);
    }

    public static String sign(ObjectMapper om,
                              String eventType, String subjectId, JsonNode metadata,
                              String ipAddress, String userAgent,
                              Instant timestamp, String previousHash) {
        return sha256Hex(canonicalPayload(om, eventType, subjectId, metadata,
                ipAddress, userAgent, timestamp, previousHash));
    }

    public static String canonicalPayload(ObjectMapper om,
                                          String eventType, String subjectId, JsonNode metadata,
                                          String ipAddress, String userAgent,
                                          Instant timestamp, String previousHash) {
        Objects.requireNonNull(timestamp, "timestamp");
        ObjectNode payload = om.createObjectNode();
        payload.put("eventType", eventType);
        payload.put("subjectId", subjectId);
        payload.set("metadata", metadata);
        payload.put("timestamp", formatTimestamp(timestamp));
        payload.put("ipAddress", ipAddress);
        payload.put("userAgent", userAgent);
        payload.put("previousHash", previousHash);
        return canonicalize(om, payload);
    }

    /**
     * Serializes the producer's map and reads it back, so a payload canonicalizes the same way
     * whether it arrives as Java objects or as stored JSON text. {@code null} becomes {@code {}}.
     */
    public static JsonNode normalizeMetadata(ObjectMapper om, Map<String, Object> metadata) {
        Map<String, Object> source = metadata == null ? Map.of() : metadata;
        String text;
        try {
            text = om.writeValueAsString(source);
        } catch (JsonProcessingException e) {
            throw new AuditValidationException("metadata is not serializable: " + e.getOriginalMessage(), e);
        }
        // NaN and infinities would otherwise be written as strings
        String nonFinite = findNonFinite(om.valueToTree(source), "metadata");
        if (nonFinite != null) {
            throw new AuditValidationException(nonFinite + " is not a finite number");
        }
        try {
            return om.readTree(text);
        } catch (JsonProcessingException e) {
            throw new AuditValidationException("metadata cannot be read back: " + e.getOriginalMessage(), e);
        }
    }

    private static String findNonFinite(JsonNode node, String path) {
        if (node == null) return null;
        if (node.isFloatingPointNumber() && !Double.isFinite(node.doubleValue())) {
            return path;
        }
        if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> e = fields.next();
                String found = findNonFinite(e.getValue(), path + "." + e.getKey());
                if (found != null) return found;
            }
        } else if (node.isArray()) {
            for (int i = 0; i < node.size(); i++) {
                String found = findNonFinite(node.get(i), path + "[" + i + "]");
                if (found != null) return found;
            }
        }
        return null;
    }

    /**
     * Parses stored metadata text; empty when the text is missing, not JSON, carries content after
     * the first value, or repeats a key.
     */
    public static Optional<JsonNode> readStoredMetadata(ObjectMapper om, String metadataJson) {
        if (metadataJson == null) return Optional.empty();
        try {
            JsonNode node = om.reader()
                    .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                    .with(JsonParser.Feature.STRICT_DUPLICATE_DETECTION)
                    .readTree(metadataJson);
            return node == null || node.isMissingNode() ? Optional.empty() : Optional.of(node);
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    public static String canonicalize(ObjectMapper om, JsonNode node) {
        try {
            return JsonCanonicalizer.canonicalize(om, node);
        } catch (JsonProcessingException e) {
            throw new AuditValidationException("payload cannot be rendered as JSON", e);
        }
    }

    public static String formatTimestamp(Instant timestamp) {
        return DateTimeFormatter.ISO_INSTANT.format(timestamp);
    }

    public static long toEpochMicros(Instant timestamp) {
        return ChronoUnit.MICROS.between(Instant.EPOCH, timestamp);
    }

    public static Instant fromEpochMicros(long micros) {
        return Instant.EPOCH.plus(micros, ChronoUnit.MICROS);
    }
}
