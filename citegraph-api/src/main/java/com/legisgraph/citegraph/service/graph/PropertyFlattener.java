package com.legisgraph.citegraph.service.graph;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a node model into the flat scalar map a graph node can hold. Nested objects are
 * inlined as {@code parent_child}, dates are written as ISO-8601 strings, nulls are dropped,
 * lists survive only when every element is a scalar.
 */
@Component
public class PropertyFlattener {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public PropertyFlattener(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public Map<String, Object> flatten(Object model) {
        if (model == null) {
            return Map.of();
        }
        Map<String, Object> tree = objectMapper.convertValue(model, MAP);
        Map<String, Object> flat = new LinkedHashMap<>();
        flattenInto("", tree, flat);
        return flat;
    }

    private void flattenInto(String prefix, Map<?, ?> source, Map<String, Object> target) {
        source.forEach((key, value) -> {
            if (value == null) {
                return;
            }
            String name = prefix + key;
            if (value instanceof Map<?, ?> nested) {
                flattenInto(name + "_", nested, target);
            } else if (value instanceof Collection<?> items) {
                if (items.stream().allMatch(PropertyFlattener::isScalar)) {
                    target.put(name, List.copyOf(items));
                }
            } else {
                target.put(name, value);
            }
        });
    }

    private static boolean isScalar(Object value) {
        return value != null && !(value instanceof Map<?, ?>) && !(value instanceof Collection<?>);
    }
}
