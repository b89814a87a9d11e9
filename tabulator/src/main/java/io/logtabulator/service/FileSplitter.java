package io.logtabulator.service;

import java.io.BufferedOutputStream;
import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Splits a source file into line-aligned chunk files {@code chunk_1<ext>}, {@code chunk_2<ext>}, ...
 * <p>
 * A chunk is closed before the line that would push it past the target size, so chunks only exceed the
 * target when a single line is longer than the target itself. Line terminators are kept as they are.
 */
@Slf4j
@Component
public class FileSplitter {

    private static final int BUFFER_SIZE = 64 * 1024;

    public List<Path> split(Path source, Path destDir, long chunkByteSize) {
        if (!Files.isRegularFile(source)) {
            throw new IllegalArgumentException("Source file does not exist: " + source);
        }
        if (chunkByteSize <= 0) {
            throw new IllegalArgumentException("Chunk byte size must be positive: " + chunkByteSize);
        }
        String extension = ChunkFiles.extension(source);
        try {
            long size = Files.size(source);
            if (size <= chunkByteSize) {
                Path target = destDir.resolve(ChunkFiles.chunkFileName(1, extension));
                log.debug("Source is {} bytes, copying as a single chunk: {}", size, target);
                Files.copy(source, target);
                return List.of(target);
            }
            return splitLines(source, destDir, extension, chunkByteSize);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to split " + source, e);
        }
    }

    private List<Path> splitLines(Path source, Path destDir, String extension, long chunkByteSize) throws IOException {
        byte[] buffer = new byte[BUFFER_SIZE];
        ByteArrayOutputStream pendingLine = new ByteArrayOutputStream();
        try (InputStream in = Files.newInputStream(source);
             ChunkWriter writer = new ChunkWriter(destDir, extension, chunkByteSize)) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                int lineStart = 0;
                for (int i = 0; i < read; i++) {
                    if (buffer[i] == '\n') {
                        pendingLine.write(buffer, lineStart, i - lineStart + 1);
                        writer.writeLine(pendingLine);
                        lineStart = i + 1;
                    }
                }
                pendingLine.write(buffer, lineStart, read - lineStart);
            }
            if (pendingLine.size() > 0) {
                writer.writeLine(pendingLine);
            }
            return writer.chunks();
        }
    }

    private static final class ChunkWriter implements Closeable {
        private final Path destDir;
        private final String extension;
        private final long chunkByteSize;
        private final List<Path> chunks = new ArrayList<>();
        private OutputStream current;
        private long currentSize;

        ChunkWriter(Path destDir, String extension, long chunkByteSize) {
            this.destDir = destDir;
            this.extension = extension;
            this.chunkByteSize = chunkByteSize;
        }

        void writeLine(ByteArrayOutputStream line) throws IOException {
            int length = line.size();
            if (current == null || (currentSize > 0 && currentSize + length > chunkByteSize)) {
                openNext();
            }
            line.writeTo(current);
            currentSize += length;
            line.reset();
        }

        List<Path> chunks() {
            return List.copyOf(chunks);
        }

        private void openNext() throws IOException {
            close();
            Path next = destDir.resolve(ChunkFiles.chunkFileName(chunks.size() + 1, extension));
            log.debug("Creating file: {}", next);
            current = new BufferedOutputStream(Files.newOutputStream(next), BUFFER_SIZE);
            currentSize = 0;
            chunks.add(next);
        }

        @Override
        public void close() throws IOException {
            if (current != null) {
                current.close();
                current = null;
            }
        }
    }
}
