package com.petwash.ledger.audit.support;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Key-sorted JSON rendering. Object fields are ordered recursively, array order is kept,
 * scalar nodes are written as Jackson prints them.
 */
public final class JsonCanonicalizer {
    private JsonCanonicalizer() {}

    public static JsonNode normalize(ObjectMapper mapper, JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return NullNode.getInstance();

        if (node.isObject()) {
            ObjectNode dst = mapper.createObjectNode();
            List<String> fields = new ArrayList<>();
            node.fieldNames().forEachRemaining(fields::add);
            Collections.sort(fields);
            for (String f : fields) {
                dst.set(f, normalize(mapper, node.get(f)));
            }
            return dst;
        }
        if (node.isArray()) {
            ArrayNode arr = mapper.createArrayNode();
            for (JsonNode it : node) arr.add(normalize(mapper, it));
            return arr;
        }
        return node;
    }

    public static String canonicalize(ObjectMapper mapper, JsonNode node) throws JsonProcessingException {
        return mapper.writeValueAsString(normalize(mapper, node));
    }
}
