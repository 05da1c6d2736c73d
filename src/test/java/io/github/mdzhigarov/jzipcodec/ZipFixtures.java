package io.github.mdzhigarov.jzipcodec;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.zip.CRC32;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Builds test archives with the JDK's ZipOutputStream, plus helpers to corrupt them
 * at known offsets.
 */
public final class ZipFixtures {

    public static final byte[] HELLO = "hello".getBytes(StandardCharsets.US_ASCII);

    private ZipFixtures() {
    }

    /**
     * Creates an empty ZIP file.
     */
    public static byte[] emptyZip() throws IOException {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        try (ZipOutputStream zos = new ZipOutputStream(baos)) {
            zos.finish();
        }
        return baos.toByteArray();
    }

    /**
     * Stored "a.txt" holding "hello", then deflated "b.bin" holding 10000 zero bytes.
     * The stored entry's local header is at 0 and its data at 35; the deflated entry
     * carries a data descriptor.
     */
    public static byte[] storedAndDeflated() throws IOException {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        try (ZipOutputStream zos = new ZipOutputStream(baos)) {
            putStored(zos, "a.txt", HELLO);
            ZipEntry deflated = new ZipEntry("b.bin");
            deflated.setMethod(ZipEntry.DEFLATED);
            zos.putNextEntry(deflated);
            zos.write(new byte[10000]);
            zos.closeEntry();
        }
        return baos.toByteArray();
    }

    /**
     * Creates a ZIP file with many small deflated files named file_0.txt, file_1.txt, ...
     */
    public static byte[] manyFilesZip(int count) throws IOException {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        try (ZipOutputStream zos = new ZipOutputStream(baos)) {
            for (int i = 0; i < count; i++) {
                zos.putNextEntry(new ZipEntry("file_" + i + ".txt"));
                zos.write(("Content of file " + i).getBytes(StandardCharsets.UTF_8));
                zos.closeEntry();
            }
        }
        return baos.toByteArray();
    }

    /**
     * A directory entry followed by a file inside it.
     */
    public static byte[] directoryZip() throws IOException {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        try (ZipOutputStream zos = new ZipOutputStream(baos)) {
            zos.putNextEntry(new ZipEntry("docs/"));
            zos.closeEntry();
            zos.putNextEntry(new ZipEntry("docs/readme.txt"));
            zos.write("Read me".getBytes(StandardCharsets.UTF_8));
            zos.closeEntry();
        }
        return baos.toByteArray();
    }

    public static byte[] commentedZip(String comment) throws IOException {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        try (ZipOutputStream zos = new ZipOutputStream(baos)) {
            putStored(zos, "a.txt", HELLO);
            zos.setComment(comment);
        }
        return baos.toByteArray();
    }

    public static void putStored(ZipOutputStream zos, String name, byte[] content) throws IOException {
        ZipEntry entry = new ZipEntry(name);
        entry.setMethod(ZipEntry.STORED);
        entry.setSize(content.length);
        entry.setCompressedSize(content.length);
        CRC32 crc32 = new CRC32();
        crc32.update(content);
        entry.setCrc(crc32.getValue());
        zos.putNextEntry(entry);
        zos.write(content);
        zos.closeEntry();
    }

    /**
     * @return Offset of the last occurrence of a 4-byte little-endian signature
     */
    public static int lastIndexOfSignature(byte[] zip, int signature) {
        ByteBuffer buf = ByteBuffer.wrap(zip).order(ByteOrder.LITTLE_ENDIAN);
        for (int i = zip.length - 4; i >= 0; i--) {
            if (buf.getInt(i) == signature) {
                return i;
            }
        }
        throw new IllegalArgumentException("Signature not found: " + Integer.toHexString(signature));
    }

    /**
     * @return Offset of the n-th (0-based) occurrence of a signature
     */
    public static int indexOfSignature(byte[] zip, int signature, int occurrence) {
        ByteBuffer buf = ByteBuffer.wrap(zip).order(ByteOrder.LITTLE_ENDIAN);
        int seen = 0;
        for (int i = 0; i <= zip.length - 4; i++) {
            if (buf.getInt(i) == signature && seen++ == occurrence) {
                return i;
            }
        }
        throw new IllegalArgumentException("Signature occurrence not found: " + Integer.toHexString(signature));
    }

    public static byte[] putInt(byte[] zip, int offset, int value) {
        byte[] copy = zip.clone();
        ByteBuffer.wrap(copy).order(ByteOrder.LITTLE_ENDIAN).putInt(offset, value);
        return copy;
    }

    public static byte[] putShort(byte[] zip, int offset, int value) {
        byte[] copy = zip.clone();
        ByteBuffer.wrap(copy).order(ByteOrder.LITTLE_ENDIAN).putShort(offset, (short) value);
        return copy;
    }
}
