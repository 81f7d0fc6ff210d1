package com.familygraph.service;

import java.util.Optional;

/**
 * Maps a textual reference such as "[[John Smith]]" to the identity key it denotes.
 * Implementations are pure lookups.
 */
public interface LinkResolutionIndex {

    Optional<String> resolve(String reference);

    static LinkResolutionIndex none() {
        return reference -> Optional.empty();
    }
}
