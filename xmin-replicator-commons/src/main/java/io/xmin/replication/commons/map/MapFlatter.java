package io.xmin.replication.commons.map;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Turns nested YAML documents into the flat {@code a.b.c} keys the components read.
 * Lists of scalars become comma separated values.
 */
public class MapFlatter {
    private final String delimiter;

    public MapFlatter(String delimiter) {
        this.delimiter = delimiter;
    }

    public Map<String, Object> flattenMap(Map<String, Object> map) {
        Map<String, Object> flattenMap = new HashMap<>();

        this.flattenMap(null, map, flattenMap);

        return flattenMap;
    }

    @SuppressWarnings("unchecked")
    private void flattenMap(String path, Map<String, Object> map, Map<String, Object> flattenMap) {
        for (Map.Entry<String, Object> entry : map.entrySet()) {
            String flattenPath = (path != null) ? String.format("%s%s%s", path, this.delimiter, entry.getKey()) : entry.getKey();

            if (entry.getValue() instanceof Map) {
                this.flattenMap(flattenPath, (Map<String, Object>) entry.getValue(), flattenMap);
            } else if (entry.getValue() instanceof Collection) {
                flattenMap.put(flattenPath, ((Collection<Object>) entry.getValue()).stream()
                        .map(String::valueOf)
                        .collect(Collectors.joining(",")));
            } else {
                flattenMap.put(flattenPath, entry.getValue());
            }
        }
    }
}
