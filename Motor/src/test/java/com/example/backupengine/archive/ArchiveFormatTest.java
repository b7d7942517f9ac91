package com.example.backupengine.archive;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import com.example.backupengine.archive.ArchiveFormat.ArchiveContents;
import com.example.backupengine.archive.ArchiveFormat.ArchiveInfo;
import com.example.backupengine.archive.ArchiveFormat.Manifest;
import com.example.backupengine.archive.ArchiveFormat.ManifestEntry;
import com.example.backupengine.codec.Compression.CompressionAlgorithm;
import com.example.backupengine.crypto.CryptoLayer;
import com.example.backupengine.error.BackupException;
import com.example.backupengine.error.BackupException.Kind;

class ArchiveFormatTest {

    private static final Instant WHEN = Instant.parse("2024-05-01T12:00:00Z");

    @TempDir
    Path tmp;

    private final CryptoLayer crypto = new CryptoLayer(1_000);
    private final ArchiveFormat.Writer writer = new ArchiveFormat.Writer(crypto);
    private final ArchiveFormat.Reader reader = new ArchiveFormat.Reader(crypto);

    private final byte[] first = "hello".getBytes(StandardCharsets.UTF_8);
    private final byte[] second = "world!!".getBytes(StandardCharsets.UTF_8);

    private Manifest manifest() throws Exception {
        return new Manifest("SHA-256", WHEN.toEpochMilli(), List.of(
                ManifestEntry.directory("docs", 0755, WHEN),
                ManifestEntry.file("docs/a.txt", first.length, 0644, sha256(first), WHEN),
                ManifestEntry.file("b.txt", second.length, 0600, sha256(second), WHEN)));
    }

    private byte[] payload() {
        byte[] all = Arrays.copyOf(first, first.length + second.length);
        System.arraycopy(second, 0, all, first.length, second.length);
        return all;
    }

    private static String sha256(byte[] data) throws Exception {
        return ArchiveFormat.hex(MessageDigest.getInstance("SHA-256").digest(data));
    }

    @ParameterizedTest
    @EnumSource(CompressionAlgorithm.class)
    void writesAndReadsBackEncryptedAndPlain(CompressionAlgorithm algorithm) throws Exception {
        for (String password : new String[]{"", "secret"}) {
            Path file = tmp.resolve(algorithm + "-" + password.length() + ".bin");
            ArchiveInfo info = writer.write(file, algorithm, password, manifest(), payload());

            assertThat(info.size()).isEqualTo(Files.size(file));
            assertThat(info.encrypted()).isEqualTo(!password.isEmpty());

            ArchiveContents contents = reader.read(file, password);
            assertThat(contents.header().algorithm()).isEqualTo(algorithm);
            assertThat(contents.header().encrypted()).isEqualTo(!password.isEmpty());
            assertThat(contents.payload()).isEqualTo(payload());
            assertThat(contents.entries()).extracting(ManifestEntry::path)
                    .containsExactly("docs", "docs/a.txt", "b.txt");
            assertThat(contents.offsetOf(contents.entries().get(2))).isEqualTo(first.length);
            assertThat(contents.checksumMismatches()).isEmpty();
        }
    }

    @Test
    void headerStartsWithMagicVersionAlgorithmAndFlag() throws Exception {
        Path file = tmp.resolve("a.bin");
        writer.write(file, CompressionAlgorithm.JOINED, "secret", manifest(), payload());

        byte[] raw = Files.readAllBytes(file);
        assertThat(Arrays.copyOf(raw, 4)).isEqualTo(ArchiveFormat.MAGIC);
        assertThat(raw[4]).isEqualTo((byte) ArchiveFormat.VERSION);
        assertThat(raw[5]).isEqualTo((byte) CompressionAlgorithm.JOINED.id());
        assertThat(raw[6]).isEqualTo((byte) 1);
    }

    @Test
    void noTemporaryFilesAreLeftBehind() throws Exception {
        writer.write(tmp.resolve("a.bin"), CompressionAlgorithm.LZSS, "", manifest(), payload());

        try (var listing = Files.list(tmp)) {
            assertThat(listing.map(p -> p.getFileName().toString())).containsExactly("a.bin");
        }
    }

    @Test
    void emptyArchiveIsValid() throws Exception {
        Path file = tmp.resolve("empty.bin");
        writer.write(file, CompressionAlgorithm.HUFFMAN, "", new Manifest("SHA-256", 0, List.of()), new byte[0]);

        ArchiveContents contents = reader.read(file, "");
        assertThat(contents.entries()).isEmpty();
        assertThat(contents.payload()).isEmpty();
    }

    @Test
    void tamperedByteAnywhereFailsAuthentication() throws Exception {
        for (String password : new String[]{"", "secret"}) {
            Path file = tmp.resolve("t" + password.length() + ".bin");
            writer.write(file, CompressionAlgorithm.LZSS, password, manifest(), payload());
            byte[] raw = Files.readAllBytes(file);

            // um byte no meio do payload e um no último byte da tag
            for (int index : new int[]{raw.length - 20, raw.length - 1}) {
                byte[] copy = raw.clone();
                copy[index] ^= 0x01;
                Files.write(file, copy);
                expectKind(() -> reader.read(file, password), Kind.AUTHENTICATION_FAILED);
            }
        }
    }

    @Test
    void tamperedManifestFailsAuthentication() throws Exception {
        Path file = tmp.resolve("m.bin");
        writer.write(file, CompressionAlgorithm.LZSS, "", manifest(), payload());
        byte[] raw = Files.readAllBytes(file);
        String text = new String(raw, StandardCharsets.ISO_8859_1);
        int at = text.indexOf("b.txt");
        raw[at] = 'c';
        Files.write(file, raw);

        expectKind(() -> reader.read(file, ""), Kind.AUTHENTICATION_FAILED);
    }

    @Test
    void wrongOrMissingPasswordFailsAuthentication() throws Exception {
        Path file = tmp.resolve("enc.bin");
        writer.write(file, CompressionAlgorithm.HUFFMAN, "secret", manifest(), payload());

        expectKind(() -> reader.read(file, "errada"), Kind.AUTHENTICATION_FAILED);
        expectKind(() -> reader.read(file, ""), Kind.AUTHENTICATION_FAILED);
    }

    @Test
    void passwordForPlainArchiveIsIgnored() throws Exception {
        Path file = tmp.resolve("plain.bin");
        writer.write(file, CompressionAlgorithm.HUFFMAN, "", manifest(), payload());

        assertThat(reader.read(file, "qualquer").payload()).isEqualTo(payload());
    }

    @Test
    void badMagicOrVersionIsUnsupported() throws Exception {
        Path file = tmp.resolve("v.bin");
        writer.write(file, CompressionAlgorithm.LZSS, "", manifest(), payload());
        byte[] raw = Files.readAllBytes(file);

        byte[] badMagic = raw.clone();
        badMagic[0] = 'Z';
        Files.write(file, badMagic);
        expectKind(() -> reader.read(file, ""), Kind.UNSUPPORTED_FORMAT);

        byte[] badVersion = raw.clone();
        badVersion[4] = 9;
        Files.write(file, badVersion);
        expectKind(() -> reader.read(file, ""), Kind.UNSUPPORTED_FORMAT);

        byte[] badAlgorithm = raw.clone();
        badAlgorithm[5] = 7;
        Files.write(file, badAlgorithm);
        expectKind(() -> reader.read(file, ""), Kind.UNSUPPORTED_FORMAT);
    }

    @Test
    void truncatedFileIsCorrupt() throws Exception {
        Path file = tmp.resolve("cut.bin");
        writer.write(file, CompressionAlgorithm.LZSS, "", manifest(), payload());
        byte[] raw = Files.readAllBytes(file);
        Files.write(file, Arrays.copyOf(raw, raw.length - 5));

        expectKind(() -> reader.read(file, ""), Kind.CORRUPT_ARCHIVE);

        Files.write(file, Arrays.copyOf(raw, 8));
        expectKind(() -> reader.read(file, ""), Kind.CORRUPT_ARCHIVE);
    }

    @Test
    void authenticatedButEscapingPathIsCorrupt() throws Exception {
        Path file = tmp.resolve("evil.bin");
        Manifest evil = new Manifest("SHA-256", 0, List.of(
                ManifestEntry.file("../fora.txt", first.length, 0644, sha256(first), WHEN)));
        writer.write(file, CompressionAlgorithm.LZSS, "", evil, first);

        expectKind(() -> reader.read(file, ""), Kind.CORRUPT_ARCHIVE);
    }

    @Test
    void checksumMismatchIsReportedPerEntry() throws Exception {
        Path file = tmp.resolve("sum.bin");
        Manifest wrong = new Manifest("SHA-256", 0, List.of(
                ManifestEntry.file("a.txt", first.length, 0644, sha256(second), WHEN),
                ManifestEntry.file("b.txt", second.length, 0644, sha256(second), WHEN)));
        writer.write(file, CompressionAlgorithm.LZSS, "", wrong, payload());

        assertThat(reader.read(file, "").checksumMismatches()).containsExactly("a.txt");
    }

    @Test
    void missingDestinationDirectoryIsInvalidPath() {
        Path file = tmp.resolve("nao-existe").resolve("a.bin");
        expectKind(() -> writer.write(file, CompressionAlgorithm.LZSS, "", manifest(), payload()), Kind.INVALID_PATH);
    }

    @Test
    void missingArchiveIsInvalidPath() {
        expectKind(() -> reader.read(tmp.resolve("sumiu.bin"), ""), Kind.INVALID_PATH);
    }

    @Test
    void manifestSerializesAsReadableJson() throws Exception {
        String json = manifest().toJson();
        assertThat(json).contains("\"checksumAlgorithm\"", "\"docs/a.txt\"", "\"DIRECTORY\"")
                .doesNotContain("\"file\"");
    }

    private static void expectKind(ThrowingCallable call, Kind kind) {
        assertThatThrownBy(call)
                .isInstanceOfSatisfying(BackupException.class, e -> assertThat(e.kind()).isEqualTo(kind));
    }
}
