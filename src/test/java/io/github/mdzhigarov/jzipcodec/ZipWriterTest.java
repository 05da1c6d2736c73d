package io.github.mdzhigarov.jzipcodec;

import io.github.mdzhigarov.jzipcodec.checksum.Crc32;
import io.github.mdzhigarov.jzipcodec.codec.CodecRegistry;
import io.github.mdzhigarov.jzipcodec.codec.CompressionMethod;
import io.github.mdzhigarov.jzipcodec.io.ByteArraySink;
import io.github.mdzhigarov.jzipcodec.io.ByteArraySource;
import io.github.mdzhigarov.jzipcodec.model.CentralDirectory;
import io.github.mdzhigarov.jzipcodec.model.ZipConstants;
import io.github.mdzhigarov.jzipcodec.model.ZipEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Enumeration;
import java.util.zip.ZipFile;
import java.util.zip.ZipInputStream;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ZipWriterTest {

    private static byte[] content(int i) {
        return ("Entry number " + i + " ").repeat(i % 7 + 1).getBytes(StandardCharsets.UTF_8);
    }

    private static int localFlags(byte[] zip, long localHeaderOffset) {
        return ByteBuffer.wrap(zip).order(ByteOrder.LITTLE_ENDIAN).getShort((int) localHeaderOffset + 6) & 0xFFFF;
    }

    @ParameterizedTest(name = "{0} entries")
    @ValueSource(ints = {0, 1, 100})
    @DisplayName("Should write archives that read back with identical names and contents")
    void shouldRoundTripEntries(int count) throws IOException {
        // Given
        ByteArraySink sink = new ByteArraySink();

        // When
        try (ZipWriter writer = ZipWriter.newBuilder(sink).build()) {
            for (int i = 0; i < count; i++) {
                CompressionMethod method = i % 2 == 0 ? CompressionMethod.DEFLATE : CompressionMethod.STORED;
                try (OutputStream out = writer.startEntry("dir/entry-" + i + ".txt",
                        EntryOptions.defaults().withMethod(method))) {
                    out.write(content(i));
                }
            }
        }
        byte[] zip = sink.toByteArray();

        // Then
        try (ZipReader reader = ZipReader.newBuilder(new ByteArraySource(zip)).build()) {
            assertEquals(count, reader.getEntries().size());
            for (int i = 0; i < count; i++) {
                ZipEntry entry = reader.getEntry(i);
                assertEquals("dir/entry-" + i + ".txt", entry.getName());
                assertEquals(content(i).length, entry.getUncompressedSize());
                assertEquals(Crc32.toUnsigned(Crc32.compute(content(i))), entry.getCrc32());
                assertFalse(entry.hasDataDescriptor());
                try (InputStream in = reader.openEntry(entry)) {
                    assertArrayEquals(content(i), in.readAllBytes());
                }
            }
        }
        try (ZipInputStream jdk = new ZipInputStream(new ByteArrayInputStream(zip))) {
            int seen = 0;
            java.util.zip.ZipEntry entry;
            while ((entry = jdk.getNextEntry()) != null) {
                assertEquals("dir/entry-" + seen + ".txt", entry.getName());
                assertArrayEquals(content(seen), jdk.readAllBytes());
                seen++;
            }
            assertEquals(count, seen);
        }
    }

    @Test
    @DisplayName("Should patch the local header in place on a seekable sink")
    void shouldPatchLocalHeader() throws IOException {
        // Given
        ByteArraySink sink = new ByteArraySink();
        ZipWriter writer = ZipWriter.newBuilder(sink).withDefaultMethod(CompressionMethod.STORED).build();

        // When
        writer.startEntry("a.txt");
        writer.write(ZipFixtures.HELLO);
        ZipEntry entry = writer.finishEntry();
        writer.close();
        byte[] zip = sink.toByteArray();

        // Then
        ByteBuffer buf = ByteBuffer.wrap(zip).order(ByteOrder.LITTLE_ENDIAN);
        assertEquals(ZipConstants.VERSION_STORED, buf.getShort(4));
        assertEquals(0, localFlags(zip, 0));
        assertEquals(0x3610a686, buf.getInt(14));
        assertEquals(5, buf.getInt(18));
        assertEquals(5, buf.getInt(22));
        assertEquals(0x3610a686L, entry.getCrc32());
        assertEquals(0, entry.getIndex());
    }

    @Test
    @DisplayName("Should append data descriptors when the sink cannot seek")
    void shouldWriteDataDescriptorsToStreams() throws IOException {
        // Given
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] big = new byte[64 * 1024];
        for (int i = 0; i < big.length; i++) {
            big[i] = (byte) (i * 31 % 17);
        }

        // When
        try (ZipWriter writer = ZipWriter.newBuilder(out).build()) {
            writer.startEntry("small.txt").write(ZipFixtures.HELLO);
            writer.finishEntry();
            try (OutputStream entry = writer.startEntry("big.bin")) {
                entry.write(big);
            }
        }
        byte[] zip = out.toByteArray();

        // Then - the JDK's streaming reader relies on the descriptors
        try (ZipInputStream jdk = new ZipInputStream(new ByteArrayInputStream(zip))) {
            assertEquals("small.txt", jdk.getNextEntry().getName());
            assertArrayEquals(ZipFixtures.HELLO, jdk.readAllBytes());
            assertEquals("big.bin", jdk.getNextEntry().getName());
            assertArrayEquals(big, jdk.readAllBytes());
            assertNull(jdk.getNextEntry());
        }
        try (ZipReader reader = ZipReader.newBuilder(new ByteArraySource(zip)).build()) {
            ZipEntry entry = reader.getEntry(1);
            assertTrue(entry.hasDataDescriptor());
            assertEquals(ZipConstants.FLAG_DATA_DESCRIPTOR, localFlags(zip, entry.getLocalHeaderOffset()));
            try (InputStream in = reader.openEntry(entry)) {
                assertArrayEquals(big, in.readAllBytes());
            }
        }
    }

    @Test
    @DisplayName("Should produce files the JDK ZipFile can open, including stored entries with descriptors")
    void shouldBeReadableByJdkZipFile(@TempDir Path tempDir) throws IOException {
        // Given
        Path file = tempDir.resolve("out.zip");
        LocalDateTime modified = LocalDateTime.of(2021, 7, 4, 10, 30, 0);

        // When
        try (OutputStream fileOut = Files.newOutputStream(file);
             ZipWriter writer = ZipWriter.newBuilder(fileOut).withComment("archive comment").build()) {
            writer.startEntry("stored.txt", EntryOptions.defaults()
                .withMethod(CompressionMethod.STORED)
                .withLastModified(modified)
                .withComment("entry comment")).write(ZipFixtures.HELLO);
            writer.finishEntry();
            writer.startEntry("empty/").close();
        }

        // Then
        try (ZipFile zipFile = new ZipFile(file.toFile())) {
            assertEquals("archive comment", zipFile.getComment());
            java.util.zip.ZipEntry stored = zipFile.getEntry("stored.txt");
            assertEquals("entry comment", stored.getComment());
            assertEquals(modified, stored.getTimeLocal());
            try (InputStream in = zipFile.getInputStream(stored)) {
                assertArrayEquals(ZipFixtures.HELLO, in.readAllBytes());
            }
            assertTrue(zipFile.getEntry("empty/").isDirectory());
            Enumeration<? extends java.util.zip.ZipEntry> entries = zipFile.entries();
            assertEquals("stored.txt", entries.nextElement().getName());
        }
    }

    @Test
    @DisplayName("Should write to a file created through ZipWriter.create")
    void shouldCreateFile(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("created.zip");

        try (ZipWriter writer = ZipWriter.create(file)) {
            writer.startEntry("a.txt").write(ZipFixtures.HELLO);
        }

        try (ZipReader reader = ZipReader.open(file);
             InputStream in = reader.getFile("a.txt").orElseThrow()) {
            assertArrayEquals(ZipFixtures.HELLO, in.readAllBytes());
            assertFalse(reader.getEntry(0).hasDataDescriptor());
        }
    }

    @Test
    @DisplayName("Should move through idle, entry open and finished states")
    void shouldFollowStateMachine() throws IOException {
        // Given
        ByteArraySink sink = new ByteArraySink();
        ZipWriter writer = ZipWriter.newBuilder(sink).build();
        assertEquals(ZipWriter.State.IDLE, writer.getState());

        // When / Then
        assertThrows(IllegalStateException.class, () -> writer.write(new byte[1]));
        assertThrows(IllegalStateException.class, writer::finishEntry);

        writer.startEntry("one.txt");
        assertEquals(ZipWriter.State.ENTRY_OPEN, writer.getState());
        long position = sink.position();
        assertThrows(EntryInProgressException.class, () -> writer.startEntry("two.txt"));
        assertThrows(EntryInProgressException.class, writer::finishArchive);
        assertEquals(position, sink.position());

        writer.finishEntry();
        assertEquals(ZipWriter.State.IDLE, writer.getState());
        assertEquals(1, writer.getEntries().size());

        CentralDirectory directory = writer.finishArchive();
        assertEquals(ZipWriter.State.FINISHED, writer.getState());
        assertEquals(1, directory.size());
        assertEquals(sink.position(), directory.getTrailer().getPosition() + 22);

        long finalSize = sink.position();
        assertThrows(WriterClosedException.class, () -> writer.startEntry("three.txt"));
        assertThrows(WriterClosedException.class, () -> writer.write(new byte[1]));
        assertThrows(WriterClosedException.class, writer::finishArchive);
        assertThrows(WriterClosedException.class, () -> writer.setComment("late"));
        writer.close();
        assertEquals(finalSize, sink.position());
    }

    @Test
    @DisplayName("Should stop accepting bytes through an entry stream once its entry is finished")
    void shouldInvalidateStaleEntryStreams() throws IOException {
        // Given
        ByteArraySink sink = new ByteArraySink();
        ZipWriter writer = ZipWriter.newBuilder(sink).build();
        OutputStream first = writer.startEntry("first.txt");
        first.write('x');
        writer.finishEntry();
        OutputStream second = writer.startEntry("second.txt");

        // When / Then
        assertThrows(IllegalStateException.class, () -> first.write('y'));
        first.close();
        assertEquals(ZipWriter.State.ENTRY_OPEN, writer.getState());
        second.write('z');
        second.close();
        assertEquals(ZipWriter.State.IDLE, writer.getState());
        writer.close();

        try (ZipReader reader = ZipReader.newBuilder(new ByteArraySource(sink.toByteArray())).build()) {
            assertEquals(2, reader.getEntries().size());
            assertEquals(1, reader.getEntry(1).getUncompressedSize());
        }
    }

    @Test
    @DisplayName("Should finish an open entry and the archive on close")
    void shouldFinishOnClose() throws IOException {
        // Given
        ByteArraySink sink = new ByteArraySink();
        ZipWriter writer = ZipWriter.newBuilder(sink).withComment("closing").build();
        writer.startEntry("open.txt").write(ZipFixtures.HELLO);

        // When
        writer.close();

        // Then
        assertEquals(ZipWriter.State.FINISHED, writer.getState());
        try (ZipReader reader = ZipReader.newBuilder(new ByteArraySource(sink.toByteArray())).build()) {
            assertEquals("closing", reader.getDirectory().getComment());
            try (InputStream in = reader.openEntry(0)) {
                assertArrayEquals(ZipFixtures.HELLO, in.readAllBytes());
            }
        }
    }

    @Test
    @DisplayName("Should read back a non-ASCII archive comment exactly as written")
    void shouldRoundTripNonAsciiComment() throws IOException {
        // Given
        ByteArraySink fromText = new ByteArraySink();
        ByteArraySink fromBytes = new ByteArraySink();
        byte[] raw = {'n', 'o', 't', 'e', ' ', (byte) 0xE9};

        // When
        ZipWriter.newBuilder(fromText).withComment("café").build().close();
        ZipWriter bytesWriter = ZipWriter.newBuilder(fromBytes).build();
        bytesWriter.setComment(raw);
        bytesWriter.close();

        // Then
        try (ZipReader reader = ZipReader.newBuilder(new ByteArraySource(fromText.toByteArray())).build()) {
            assertEquals("café", reader.getDirectory().getComment());
        }
        try (ZipReader reader = ZipReader.newBuilder(new ByteArraySource(fromBytes.toByteArray())).build()) {
            assertArrayEquals(raw, reader.getDirectory().getRawComment());
        }
        assertThrows(IllegalArgumentException.class, () -> ZipWriter.newBuilder(new ByteArraySink()).withComment("日本語"));
    }

    @Test
    @DisplayName("Should leave the output stream open when asked to")
    void shouldNotCloseSinkWhenConfigured() throws IOException {
        // Given
        boolean[] closed = {false};
        ByteArrayOutputStream out = new ByteArrayOutputStream() {
            @Override
            public void close() {
                closed[0] = true;
            }
        };

        // When
        ZipWriter.newBuilder(out).withCloseSink(false).build().close();

        // Then
        assertFalse(closed[0]);
        assertEquals(22, out.size());
    }

    @Test
    @DisplayName("Should write precomputed stored entries without descriptors even to a stream")
    void shouldHonourPrecomputedValues() throws IOException {
        // Given
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        long crc = Crc32.toUnsigned(Crc32.compute(ZipFixtures.HELLO));

        // When
        try (ZipWriter writer = ZipWriter.newBuilder(out).build()) {
            writer.startEntry("a.txt", EntryOptions.defaults()
                .withMethod(CompressionMethod.STORED)
                .withPrecomputed(crc, ZipFixtures.HELLO.length)).write(ZipFixtures.HELLO);
        }
        byte[] zip = out.toByteArray();

        // Then
        assertEquals(0, localFlags(zip, 0));
        try (ZipInputStream jdk = new ZipInputStream(new ByteArrayInputStream(zip))) {
            assertEquals("a.txt", jdk.getNextEntry().getName());
            assertArrayEquals(ZipFixtures.HELLO, jdk.readAllBytes());
        }
    }

    @Test
    @DisplayName("Should fail and refuse further calls when data contradicts precomputed values")
    void shouldRejectWrongPrecomputedValues() throws IOException {
        ZipWriter writer = ZipWriter.newBuilder(new ByteArraySink()).build();
        writer.startEntry("a.txt", EntryOptions.defaults()
            .withMethod(CompressionMethod.STORED)
            .withPrecomputed(0x12345678L, 5)).write(ZipFixtures.HELLO);

        assertThrows(ZipIntegrityException.class, writer::finishEntry);
        assertThrows(WriterClosedException.class, () -> writer.startEntry("b.txt"));
        assertThrows(IllegalArgumentException.class, () -> EntryOptions.defaults().withPrecomputed(0, -1));
        assertThrows(IllegalArgumentException.class, () -> ZipWriter.newBuilder(new ByteArraySink()).build()
            .startEntry("c.bin", EntryOptions.defaults().withMethod(CompressionMethod.DEFLATE).withPrecomputed(0, 0)));
    }

    @Test
    @DisplayName("Should reject invalid entries before writing anything")
    void shouldValidateBeforeWriting() {
        // Given
        ByteArraySink sink = new ByteArraySink();
        ZipWriter writer = ZipWriter.newBuilder(sink).build();
        byte[] zip64Extra = {1, 0, 8, 0, 0, 0, 0, 0, 0, 0, 0, 0};
        ZipWriter noCodecs = ZipWriter.newBuilder(new ByteArraySink()).withCodecRegistry(CodecRegistry.empty()).build();

        // When / Then
        assertThrows(IllegalArgumentException.class, () -> writer.startEntry("x".repeat(70000)));
        assertThrows(IllegalArgumentException.class,
            () -> writer.startEntry("z.bin", EntryOptions.defaults().withExtra(zip64Extra)));
        assertThrows(IllegalArgumentException.class, () -> writer.setComment("c".repeat(70000)));
        assertThrows(UnsupportedZipFeatureException.class, () -> noCodecs.startEntry("a.txt"));
        assertThrows(UnsupportedZipFeatureException.class,
            () -> writer.startEntry("bz.bin", EntryOptions.defaults().withMethod(CompressionMethod.of(12))));
        assertEquals(0, sink.position());
        assertEquals(ZipWriter.State.IDLE, writer.getState());
    }

    @Test
    @DisplayName("Should flag non-ASCII names as UTF-8 and give directories directory attributes")
    void shouldSetNameFlagsAndAttributes() throws IOException {
        // Given
        ByteArraySink sink = new ByteArraySink();

        // When
        try (ZipWriter writer = ZipWriter.newBuilder(sink).build()) {
            writer.startEntry("plain.txt").close();
            writer.startEntry("日本語.txt").close();
            writer.startEntry("folder/").close();
            writer.startEntry("custom.sh", EntryOptions.defaults().withExternalAttributes(0100755L << 16)).close();
        }

        // Then
        try (ZipReader reader = ZipReader.newBuilder(new ByteArraySource(sink.toByteArray())).build()) {
            assertFalse(reader.getEntry(0).isUtf8());
            assertTrue(reader.getEntry(1).isUtf8());
            assertEquals("日本語.txt", reader.getEntry(1).getName());
            assertTrue(reader.getEntry(2).isDirectory());
            assertEquals(ZipConstants.UNIX_DIRECTORY_ATTRIBUTES, reader.getEntry(2).getExternalAttributes());
            assertEquals(0100755L << 16, reader.getEntry(3).getExternalAttributes());
            assertNotEquals(0, reader.getEntry(0).getDosDate());
        }
    }
}
