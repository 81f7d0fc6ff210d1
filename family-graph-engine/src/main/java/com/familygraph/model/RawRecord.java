package com.familygraph.model;

import java.util.List;
import java.util.Map;

/**
 * One record as handed over by the record store: a path, the raw property map
 * and any tags. Only the extractor reads the property map.
 */
public record RawRecord(
    String path,
    Map<String, Object> properties,
    List<String> tags
) {
    public RawRecord {
        properties = properties != null ? properties : Map.of();
        tags = tags != null ? List.copyOf(tags) : List.of();
    }

    /** File name without folders or extension, e.g. "People/John Smith.md" gives "John Smith". */
    public String basename() {
        if (path == null) {
            return "";
        }
        String name = path.substring(path.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
