package com.familygraph.service;

import com.familygraph.model.RawRecord;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Link index built from one batch of records: a wikilink target resolves when it
 * matches a record's path (with or without extension), its file name, or its
 * "name" property. Paths win over names when both match different records.
 */
public final class RecordPathLinkIndex implements LinkResolutionIndex {

    private final Map<String, String> idsByPath;
    private final Map<String, String> idsByName;

    private RecordPathLinkIndex(Map<String, String> idsByPath, Map<String, String> idsByName) {
        this.idsByPath = idsByPath;
        this.idsByName = idsByName;
    }

    public static RecordPathLinkIndex of(Collection<RawRecord> records) {
        return of(records, record -> {
            Object id = record.properties().get("cr_id");
            return id != null ? id.toString() : null;
        });
    }

    /**
     * @param idOf identity key of a record, or null when it has none
     */
    public static RecordPathLinkIndex of(Collection<RawRecord> records, Function<RawRecord, String> idOf) {
        Map<String, String> byPath = new HashMap<>();
        Map<String, String> byName = new HashMap<>();
        for (RawRecord record : records) {
            String crId = idOf.apply(record);
            if (crId == null || crId.isBlank()) {
                continue;
            }
            crId = crId.trim();
            if (record.path() != null) {
                String path = record.path().toLowerCase();
                byPath.putIfAbsent(path, crId);
                byPath.putIfAbsent(stripExtension(path), crId);
                byPath.putIfAbsent(record.basename().toLowerCase(), crId);
            }
            Object name = record.properties().get("name");
            if (name instanceof String && !((String) name).isBlank()) {
                byName.putIfAbsent(((String) name).trim().toLowerCase(), crId);
            }
        }
        return new RecordPathLinkIndex(byPath, byName);
    }

    @Override
    public Optional<String> resolve(String reference) {
        if (reference == null || reference.isBlank()) {
            return Optional.empty();
        }
        String target = linkTarget(reference).toLowerCase();
        String id = idsByPath.get(target);
        if (id == null) {
            id = idsByPath.get(target.substring(target.lastIndexOf('/') + 1));
        }
        if (id == null) {
            id = idsByName.get(target);
        }
        return Optional.ofNullable(id);
    }

    /** "[[People/John Smith|John]]" gives "People/John Smith"; plain text is returned trimmed. */
    static String linkTarget(String reference) {
        String s = reference.trim();
        if (s.startsWith("[[") && s.endsWith("]]")) {
            s = s.substring(2, s.length() - 2);
        }
        int pipe = s.indexOf('|');
        if (pipe >= 0) {
            s = s.substring(0, pipe);
        }
        int heading = s.indexOf('#');
        if (heading >= 0) {
            s = s.substring(0, heading);
        }
        return s.trim();
    }

    private static String stripExtension(String path) {
        return path.endsWith(".md") ? path.substring(0, path.length() - 3) : path;
    }
}
