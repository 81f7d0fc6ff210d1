package com.familygraph.testutil;

import com.familygraph.model.RawRecord;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds raw records for tests.
 */
public final class Records {

    private Records() {
    }

    /** A person record at "People/{name}.md" with cr_type person and the given extra properties. */
    public static RawRecord person(String id, String name, Object... keyValues) {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put("cr_type", "person");
        props.put("cr_id", id);
        props.put("name", name);
        putAll(props, keyValues);
        return new RawRecord("People/" + name + ".md", props, List.of());
    }

    /** A record with only the given properties. */
    public static RawRecord record(String path, Object... keyValues) {
        Map<String, Object> props = new LinkedHashMap<>();
        putAll(props, keyValues);
        return new RawRecord(path, props, List.of());
    }

    private static void putAll(Map<String, Object> props, Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected key/value pairs");
        }
        for (int i = 0; i < keyValues.length; i += 2) {
            props.put((String) keyValues[i], keyValues[i + 1]);
        }
    }
}
