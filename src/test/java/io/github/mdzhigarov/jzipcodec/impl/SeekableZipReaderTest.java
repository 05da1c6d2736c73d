package io.github.mdzhigarov.jzipcodec.impl;

import io.github.mdzhigarov.jzipcodec.UnsupportedZipFeatureException;
import io.github.mdzhigarov.jzipcodec.ZipFixtures;
import io.github.mdzhigarov.jzipcodec.ZipReader;
import io.github.mdzhigarov.jzipcodec.codec.CodecRegistry;
import io.github.mdzhigarov.jzipcodec.codec.StoredCodec;
import io.github.mdzhigarov.jzipcodec.io.ByteArraySource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SeekableZipReaderTest {

    @Test
    @DisplayName("Should read correctly with a one-byte read buffer")
    void shouldReadWithTinyBuffer() throws IOException {
        // Given
        byte[] zip = ZipFixtures.storedAndDeflated();

        // When
        try (ZipReader reader = new SeekableZipReader.Builder(new ByteArraySource(zip)).withBufferSize(1).build();
             InputStream in = reader.openEntry(1)) {
            // Then
            assertArrayEquals(new byte[10000], in.readAllBytes());
            assertEquals(-1, in.read());
        }
        assertThrows(IllegalArgumentException.class,
            () -> new SeekableZipReader.Builder(new ByteArraySource(zip)).withBufferSize(0));
    }

    @Test
    @DisplayName("Should only decode methods present in the configured registry")
    void shouldUseConfiguredRegistry() throws IOException {
        // Given
        CodecRegistry storedOnly = CodecRegistry.empty().register(new StoredCodec());

        // When
        try (ZipReader reader = new SeekableZipReader.Builder(new ByteArraySource(ZipFixtures.storedAndDeflated()))
                .withCodecRegistry(storedOnly)
                .build()) {
            // Then
            try (InputStream in = reader.openEntry(0)) {
                assertArrayEquals(ZipFixtures.HELLO, in.readAllBytes());
            }
            assertThrows(UnsupportedZipFeatureException.class, () -> reader.openEntry(1));
        }
    }

    @Test
    @DisplayName("Should reject reads from a closed entry stream")
    void shouldRejectReadAfterStreamClose() throws IOException {
        try (ZipReader reader = new SeekableZipReader.Builder(new ByteArraySource(ZipFixtures.storedAndDeflated())).build()) {
            InputStream in = reader.openEntry(0);
            in.close();
            in.close();

            assertThrows(IOException.class, in::read);
        }
    }
}
