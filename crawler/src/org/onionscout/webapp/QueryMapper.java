package org.onionscout.webapp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.net.URLDecoder;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Maps a query string onto an object. Bracketed names nest: {@code a[b]=1} sets field b of object a, and
 * {@code a[0]=x} or {@code a[]=x} add to list a.
 */
public class QueryMapper {
    private static final ObjectMapper mapper = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS).build();

    public static <T> T parse(String queryString, Class<T> clazz) throws JsonProcessingException {
        return mapper.treeToValue(parse(queryString), clazz);
    }

    public static JsonNode parse(String queryString) {
        ObjectNode result = mapper.createObjectNode();
        if (queryString == null || queryString.isEmpty()) {
            return result;
        }

        for (String param : queryString.split("&")) {
            if (param.isEmpty()) continue;
            String[] pair = param.split("=", 2);
            String name = URLDecoder.decode(pair[0], UTF_8);
            String value = pair.length > 1 ? pair[1] : "";
            String[] keys = name.split("]\\[|\\[|]", -1);
            int keysLen = keys.length;
            if (keysLen > 1) {
                keysLen--; // ignore trailing "" after ]
            }

            JsonNode node = result;
            for (int i = 0; i < keysLen; i++) {
                String key = keys[i];
                JsonNode child;
                if (key.isEmpty()) {
                    child = null;
                } else if (key.matches("\\d+")) {
                    child = node.get(Integer.parseInt(key));
                } else {
                    child = node.get(key);
                }
                if (child == null) {
                    if (i + 1 >= keysLen) {
                        child = mapper.getNodeFactory().textNode(URLDecoder.decode(value, UTF_8));
                    } else if (keys[i + 1].matches("\\d+|")) {
                        child = mapper.createArrayNode();
                    } else {
                        child = mapper.createObjectNode();
                    }
                    set(node, key, child);
                }
                node = child;
            }
        }

        return result;
    }

    private static void set(JsonNode node, String key, JsonNode value) {
        if (node instanceof ObjectNode objectNode) {
            objectNode.set(key, value);
        } else if (node instanceof ArrayNode arrayNode) {
            if (key.isEmpty()) {
                arrayNode.add(value);
            } else {
                int index = Integer.parseInt(key);
                for (int i = arrayNode.size(); i <= index; i++) {
                    arrayNode.addNull();
                }
                arrayNode.set(index, value);
            }
        } else {
            throw new IllegalArgumentException("Parameter '" + key + "' conflicts with a plain value");
        }
    }
}
