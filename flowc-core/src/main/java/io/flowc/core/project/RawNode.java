package io.flowc.core.project;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Node record exactly as authored in a flow document, before kind validation.
///
/// `data` is deep-copied into unmodifiable maps and lists (declaration order kept, null
/// entries dropped), so a snapshot never shares mutable state with its source document.
///
/// @param id node id, not null
/// @param type wire kind string, e.g. `agent`, may be null (rejected by the parser)
/// @param x horizontal layout position
/// @param y vertical layout position
/// @param data kind-specific configuration, not null (may be empty)
public record RawNode(String id, String type, double x, double y, Map<String, Object> data) {

    public RawNode {
        Objects.requireNonNull(id, "id must not be null");
        data = data != null ? freezeMap(data) : Map.of();
    }

    private static Map<String, Object> freezeMap(Map<?, ?> map) {
        Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach(
                (k, v) -> {
                    if (k != null && v != null) {
                        copy.put(k.toString(), freeze(v));
                    }
                });
        return Collections.unmodifiableMap(copy);
    }

    private static Object freeze(Object value) {
        if (value instanceof Map<?, ?> map) {
            return freezeMap(map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>();
            for (Object item : list) {
                if (item != null) {
                    copy.add(freeze(item));
                }
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }
}
