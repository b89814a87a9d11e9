package io.logtabulator.service.dto;

import java.util.Map;

public record ChunkParseSummary(int chunkId, long lines, Map<String, Long> matched, long unparsed) {

    public ChunkParseSummary {
        matched = Map.copyOf(matched);
    }
}
