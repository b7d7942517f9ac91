package com.example.backupengine.codec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import com.example.backupengine.codec.Compression.CompressionAlgorithm;
import com.example.backupengine.codec.Compression.CompressionCodec;
import com.example.backupengine.error.BackupException;

class CompressionTest {

    private static byte[] text(int repetitions) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < repetitions; i++) {
            sb.append("O rato roeu a roupa do rei de Roma, linha ").append(i % 7).append('\n');
        }
        return sb.toString().getBytes(StandardCharsets.UTF_8);
    }

    private static byte[] random(int size, long seed) {
        byte[] data = new byte[size];
        new Random(seed).nextBytes(data);
        return data;
    }

    @ParameterizedTest
    @EnumSource(CompressionAlgorithm.class)
    void roundTripsTypicalInputs(CompressionAlgorithm algorithm) throws BackupException {
        CompressionCodec codec = Compression.codecFor(algorithm);
        List<byte[]> inputs = new ArrayList<>();
        inputs.add(new byte[0]);
        inputs.add(new byte[]{42});
        inputs.add(new byte[10_000]); // um único símbolo repetido
        inputs.add(text(500));
        inputs.add(random(70_000, 7));

        for (byte[] input : inputs) {
            byte[] encoded = codec.encode(input);
            assertThat(codec.decode(encoded)).isEqualTo(input);
        }
    }

    @ParameterizedTest
    @EnumSource(CompressionAlgorithm.class)
    void redundantTextShrinks(CompressionAlgorithm algorithm) {
        byte[] input = text(2000);
        byte[] encoded = Compression.codecFor(algorithm).encode(input);
        assertThat(encoded.length).isLessThan(input.length);
    }

    @Test
    void dictionaryCodersBeatPureHuffmanOnRepetitiveData() {
        byte[] input = text(2000);
        int huffman = Compression.codecFor(CompressionAlgorithm.HUFFMAN).encode(input).length;
        int lzss = Compression.codecFor(CompressionAlgorithm.LZSS).encode(input).length;
        int joined = Compression.codecFor(CompressionAlgorithm.JOINED).encode(input).length;

        assertThat(lzss).isLessThan(huffman);
        assertThat(joined).isLessThan(huffman);
    }

    @Test
    void encodingIsDeterministic() {
        byte[] input = text(300);
        for (CompressionAlgorithm algorithm : CompressionAlgorithm.values()) {
            CompressionCodec codec = Compression.codecFor(algorithm);
            assertThat(codec.encode(input)).isEqualTo(codec.encode(input.clone()));
        }
    }

    @Test
    void overlappingMatchesReproduceRuns() throws BackupException {
        byte[] input = "abababababababababababababababababab".getBytes(StandardCharsets.US_ASCII);
        CompressionCodec codec = Compression.codecFor(CompressionAlgorithm.LZSS);
        assertThat(codec.decode(codec.encode(input))).isEqualTo(input);
    }

    @ParameterizedTest
    @EnumSource(CompressionAlgorithm.class)
    void truncatedStreamIsCorrupt(CompressionAlgorithm algorithm) {
        CompressionCodec codec = Compression.codecFor(algorithm);
        byte[] encoded = codec.encode(text(200));
        byte[] truncated = Arrays.copyOf(encoded, encoded.length / 2);

        assertThatThrownBy(() -> codec.decode(truncated))
                .isInstanceOf(BackupException.class)
                .extracting(e -> ((BackupException) e).kind())
                .isEqualTo(BackupException.Kind.CORRUPT_ARCHIVE);
    }

    @ParameterizedTest
    @EnumSource(CompressionAlgorithm.class)
    void absurdDeclaredSizeIsRejectedBeforeAllocating(CompressionAlgorithm algorithm) {
        CompressionCodec codec = Compression.codecFor(algorithm);
        byte[] encoded = codec.encode(text(10));
        // tamanho original nos 4 primeiros bytes (big-endian)
        encoded[0] = 0x7F;
        encoded[1] = (byte) 0xFF;
        encoded[2] = (byte) 0xFF;
        encoded[3] = (byte) 0xF0;

        assertThatThrownBy(() -> codec.decode(encoded))
                .isInstanceOf(BackupException.class)
                .extracting(e -> ((BackupException) e).kind())
                .isEqualTo(BackupException.Kind.CORRUPT_ARCHIVE);
    }

    @Test
    void algorithmIdsAndNamesParse() throws BackupException {
        assertThat(CompressionAlgorithm.fromId(2)).isEqualTo(CompressionAlgorithm.JOINED);
        assertThat(CompressionAlgorithm.parse("lzss")).isEqualTo(CompressionAlgorithm.LZSS);
        assertThat(CompressionAlgorithm.parse("0")).isEqualTo(CompressionAlgorithm.HUFFMAN);
        assertThatThrownBy(() -> CompressionAlgorithm.fromId(9))
                .isInstanceOf(BackupException.class)
                .extracting(e -> ((BackupException) e).kind())
                .isEqualTo(BackupException.Kind.UNSUPPORTED_FORMAT);
        assertThatThrownBy(() -> CompressionAlgorithm.parse("zstd"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
