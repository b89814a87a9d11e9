package io.logtabulator.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileSplitterTest {

    @TempDir
    Path tempDir;

    private FileSplitter splitter;
    private Path destDir;

    @BeforeEach
    void setUp() throws IOException {
        splitter = new FileSplitter();
        destDir = Files.createDirectory(tempDir.resolve("split"));
    }

    @Test
    void copiesSmallFileAsSingleChunk() throws IOException {
        Path source = write("app.log", "INFO a=1\nGARBAGE\n");

        List<Path> chunks = splitter.split(source, destDir, 1_000);

        assertThat(chunks).containsExactly(destDir.resolve("chunk_1.log"));
        assertThat(Files.readString(chunks.get(0))).isEqualTo("INFO a=1\nGARBAGE\n");
    }

    @Test
    void fileOfExactlyTheChunkSizeIsNotSplit() throws IOException {
        Path source = write("app.log", "0123456789");

        assertThat(splitter.split(source, destDir, 10)).hasSize(1);
    }

    @Test
    void closesChunkBeforeTheLineThatWouldOverflowIt() throws IOException {
        Path source = write("app.log", "aaaa\nbb\ncc\n");

        List<Path> chunks = splitter.split(source, destDir, 5);

        assertThat(chunks).extracting(path -> path.getFileName().toString())
                .containsExactly("chunk_1.log", "chunk_2.log", "chunk_3.log");
        assertThat(Files.readString(chunks.get(0))).isEqualTo("aaaa\n");
        assertThat(Files.readString(chunks.get(1))).isEqualTo("bb\n");
        assertThat(Files.readString(chunks.get(2))).isEqualTo("cc\n");
    }

    @Test
    void lineLongerThanChunkSizeGetsItsOwnChunk() throws IOException {
        Path source = write("app", "a\n" + "x".repeat(50) + "\nb\nc");

        List<Path> chunks = splitter.split(source, destDir, 4);

        assertThat(chunks).extracting(path -> path.getFileName().toString())
                .containsExactly("chunk_1", "chunk_2", "chunk_3");
        assertThat(Files.readString(chunks.get(1))).isEqualTo("x".repeat(50) + "\n");
        assertThat(Files.readString(chunks.get(2))).isEqualTo("b\nc");
    }

    @Test
    void keepsCarriageReturns() throws IOException {
        Path source = write("win.log", "one\r\ntwo\r\nthree\r\n");

        List<Path> chunks = splitter.split(source, destDir, 6);

        assertThat(concat(chunks)).isEqualTo("one\r\ntwo\r\nthree\r\n".getBytes(StandardCharsets.UTF_8));
        assertThat(Files.readString(chunks.get(0))).isEqualTo("one\r\n");
    }

    @Test
    void concatenatedChunksReproduceTheSource() throws IOException {
        Random random = new Random(42);
        for (int round = 0; round < 25; round++) {
            Path roundDir = Files.createDirectory(tempDir.resolve("round" + round));
            byte[] content = randomLines(random, random.nextInt(300));
            Path source = roundDir.resolve("source.txt");
            Files.write(source, content);
            long chunkSize = 1 + random.nextInt(120);
            Path chunkDir = Files.createDirectory(roundDir.resolve("chunks"));

            List<Path> chunks = splitter.split(source, chunkDir, chunkSize);

            assertThat(concat(chunks)).isEqualTo(content);
            for (int i = 0; i < chunks.size(); i++) {
                assertThat(chunks.get(i).getFileName().toString()).isEqualTo("chunk_" + (i + 1) + ".txt");
                byte[] chunk = Files.readAllBytes(chunks.get(i));
                boolean singleLine = indexOfNewline(chunk) >= chunk.length - 1;
                if (!singleLine && chunks.size() > 1) {
                    assertThat((long) chunk.length).isLessThanOrEqualTo(chunkSize);
                }
                if (i < chunks.size() - 1) {
                    assertThat(chunk[chunk.length - 1]).isEqualTo((byte) '\n');
                }
            }
        }
    }

    @Test
    void rejectsMissingSourceAndNonPositiveSize() throws IOException {
        Path source = write("app.log", "x\n");

        assertThatThrownBy(() -> splitter.split(tempDir.resolve("missing.log"), destDir, 10))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> splitter.split(source, destDir, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private Path write(String name, String content) throws IOException {
        return Files.writeString(tempDir.resolve(name), content);
    }

    private static byte[] randomLines(Random random, int lines) {
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < lines; i++) {
            int length = random.nextInt(40);
            for (int c = 0; c < length; c++) {
                text.append((char) ('a' + random.nextInt(26)));
            }
            if (i < lines - 1 || random.nextBoolean()) {
                text.append('\n');
            }
        }
        return text.toString().getBytes(StandardCharsets.UTF_8);
    }

    private static int indexOfNewline(byte[] bytes) {
        for (int i = 0; i < bytes.length; i++) {
            if (bytes[i] == '\n') return i;
        }
        return bytes.length;
    }

    private static byte[] concat(List<Path> chunks) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (Path chunk : chunks) {
            out.write(Files.readAllBytes(chunk));
        }
        return out.toByteArray();
    }
}
