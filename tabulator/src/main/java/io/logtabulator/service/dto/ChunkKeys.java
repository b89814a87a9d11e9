package io.logtabulator.service.dto;

import java.util.Set;

/**
 * Field names seen by one parser in one chunk, and the number of records it produced there.
 */
public record ChunkKeys(long recordCount, Set<String> keys) {

    public ChunkKeys {
        keys = Set.copyOf(keys);
    }
}
