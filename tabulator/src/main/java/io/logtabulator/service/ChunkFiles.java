package io.logtabulator.service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Naming of the staging directories and chunk files. Chunk files carry their id in the name
 * ({@code chunk_<id>...}), which is the only source of ordering between stages.
 */
public final class ChunkFiles {

    public static final String SPLIT_DIR = ".0_split";
    public static final String PARSED_DIR = ".1_parsed";
    public static final String TABULARIZED_DIR = ".2_tabularized";

    public static final String UNPARSED_NAME = "na";
    public static final String RECORDS_EXT = ".records";
    public static final String KEYS_EXT = ".keys";

    private static final String CHUNK_PREFIX = "chunk_";
    private static final Pattern CHUNK_NAME = Pattern.compile("^chunk_(?<id>\\d+)(?:[.].*)?$");

    private ChunkFiles() {
    }

    public static String chunkFileName(int id, String extension) {
        if (id < 1) {
            throw new IllegalArgumentException("Chunk ids start at 1, got " + id);
        }
        return CHUNK_PREFIX + id + extension;
    }

    public static int chunkId(String fileName) {
        Matcher matcher = CHUNK_NAME.matcher(fileName);
        if (!matcher.matches()) {
            throw new IllegalStateException("File name `" + fileName + "` does not match the chunk file mask");
        }
        return Integer.parseInt(matcher.group("id"));
    }

    public static int chunkId(Path file) {
        return chunkId(file.getFileName().toString());
    }

    /**
     * Regular files of {@code dir} whose name ends with {@code suffix}, in ascending chunk id order.
     * A missing directory yields an empty list.
     */
    public static List<Path> listSorted(Path dir, String suffix) {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(file -> file.getFileName().toString().endsWith(suffix))
                    .sorted(Comparator.comparingInt((Path file) -> chunkId(file)))
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + dir, e);
        }
    }

    /**
     * File name without its last extension: {@code chunk_3.kv.records} gives {@code chunk_3.kv}.
     */
    public static String stem(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot <= 0 ? name : name.substring(0, dot);
    }

    /**
     * Last extension including the dot, or an empty string.
     */
    public static String extension(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot <= 0 ? "" : name.substring(dot);
    }
}
