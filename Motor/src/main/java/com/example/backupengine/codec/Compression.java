package com.example.backupengine.codec;

import java.io.ByteArrayOutputStream;
import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;
import java.util.PriorityQueue;

import com.example.backupengine.error.BackupException;

/**
 * Codecs de compressão do payload.
 *
 * Três algoritmos, todos sem estado entre chamadas e determinísticos (a mesma entrada gera
 * sempre os mesmos bytes):
 * - Huffman: código canônico de redundância mínima sobre bytes;
 * - LZSS: dicionário de janela deslizante com um bit de flag por token;
 * - Joined: tokens LZSS codificados com Huffman num alfabeto único (literais + comprimentos).
 *
 * Todo fluxo começa com o tamanho original (4 bytes, big-endian). Fluxos truncados ou
 * inconsistentes falham com {@link BackupException.Kind#CORRUPT_ARCHIVE}.
 */
public final class Compression {

    static final int WINDOW_SIZE = 4096;
    static final int MIN_MATCH = 3;
    static final int MAX_MATCH = 18;
    static final int OFFSET_BITS = 12;
    static final int LENGTH_BITS = 4;

    /** Códigos acima disso não cabem no acumulador de 64 bits. */
    static final int MAX_CODE_LENGTH = 63;

    private Compression() {}

    // ==================== CONTRATO ====================

    /**
     * Algoritmo gravado no cabeçalho do arquivo (um byte).
     */
    public enum CompressionAlgorithm {
        HUFFMAN(0),
        LZSS(1),
        JOINED(2);

        private final int id;

        CompressionAlgorithm(int id) {
            this.id = id;
        }

        public int id() {
            return id;
        }

        public static CompressionAlgorithm fromId(int id) throws BackupException {
            for (CompressionAlgorithm a : values()) {
                if (a.id == id) {
                    return a;
                }
            }
            throw new BackupException(BackupException.Kind.UNSUPPORTED_FORMAT, "Algoritmo de compressão desconhecido: " + id);
        }

        /** Aceita o nome ("lzss", "Joined") ou o id numérico ("1"). */
        public static CompressionAlgorithm parse(String raw) {
            Objects.requireNonNull(raw, "raw");
            String v = raw.trim().toUpperCase(Locale.ROOT);
            for (CompressionAlgorithm a : values()) {
                if (a.name().equals(v) || Integer.toString(a.id).equals(v)) {
                    return a;
                }
            }
            throw new IllegalArgumentException("Algoritmo de compressão inválido: " + raw);
        }
    }

    /**
     * Codec de bytes para bytes. {@code decode(encode(x))} devolve {@code x} para qualquer entrada,
     * inclusive vazia.
     */
    public interface CompressionCodec {
        CompressionAlgorithm algorithm();

        byte[] encode(byte[] input);

        byte[] decode(byte[] encoded) throws BackupException;
    }

    public static CompressionCodec codecFor(CompressionAlgorithm algorithm) {
        switch (Objects.requireNonNull(algorithm, "algorithm")) {
            case HUFFMAN:
                return new HuffmanCodec();
            case LZSS:
                return new LzssCodec();
            case JOINED:
                return new JoinedCodec();
            default:
                throw new IllegalArgumentException("Algoritmo sem codec: " + algorithm);
        }
    }

    // ==================== HUFFMAN ====================

    /**
     * Huffman canônico sobre o alfabeto de 256 bytes.
     * Formato: tamanho original | 256 bytes de comprimento de código | bits MSB-first.
     */
    public static final class HuffmanCodec implements CompressionCodec {
        static final int ALPHABET = 256;

        @Override
        public CompressionAlgorithm algorithm() {
            return CompressionAlgorithm.HUFFMAN;
        }

        @Override
        public byte[] encode(byte[] input) {
            Objects.requireNonNull(input, "input");
            long[] freq = new long[ALPHABET];
            for (byte b : input) {
                freq[b & 0xFF]++;
            }
            int[] lengths = CanonicalCode.lengthsFor(freq);
            CanonicalCode code = CanonicalCode.trusted(lengths);

            BitWriter out = new BitWriter(input.length / 2 + ALPHABET + 8);
            out.writeInt(input.length);
            for (int len : lengths) {
                out.writeByte(len);
            }
            for (byte b : input) {
                code.write(out, b & 0xFF);
            }
            return out.toByteArray();
        }

        @Override
        public byte[] decode(byte[] encoded) throws BackupException {
            BitReader in = new BitReader(Objects.requireNonNull(encoded, "encoded"));
            int size = in.readInt();
            int[] lengths = new int[ALPHABET];
            for (int i = 0; i < ALPHABET; i++) {
                lengths[i] = in.readByte();
            }
            // Cada símbolo ocupa pelo menos 1 bit.
            if (size < 0 || size > in.remainingBits()) {
                throw corrupt("tamanho original incompatível com o fluxo Huffman: " + size);
            }
            CanonicalCode code = CanonicalCode.fromLengths(lengths);
            byte[] out = new byte[size];
            for (int i = 0; i < size; i++) {
                out[i] = (byte) code.read(in);
            }
            return out;
        }
    }

    // ==================== LZSS ====================

    /**
     * LZSS com janela de 4096 bytes e matches de 3 a 18 bytes.
     * Token literal: flag 1 + 8 bits. Token de match: flag 0 + 12 bits (offset-1) + 4 bits (len-3).
     */
    public static final class LzssCodec implements CompressionCodec {
        private static final int HASH_BITS = 15;
        private static final int MAX_CHAIN = 256;

        @Override
        public CompressionAlgorithm algorithm() {
            return CompressionAlgorithm.LZSS;
        }

        @Override
        public byte[] encode(byte[] input) {
            Objects.requireNonNull(input, "input");
            BitWriter out = new BitWriter(input.length / 2 + 8);
            out.writeInt(input.length);
            tokenize(input, new TokenSink() {
                @Override
                public void literal(int value) {
                    out.writeBit(1);
                    out.writeBits(value, 8);
                }

                @Override
                public void match(int offset, int length) {
                    out.writeBit(0);
                    out.writeBits(offset - 1, OFFSET_BITS);
                    out.writeBits(length - MIN_MATCH, LENGTH_BITS);
                }
            });
            return out.toByteArray();
        }

        @Override
        public byte[] decode(byte[] encoded) throws BackupException {
            BitReader in = new BitReader(Objects.requireNonNull(encoded, "encoded"));
            int size = in.readInt();
            // Um token tem no mínimo 9 bits e produz no máximo MAX_MATCH bytes.
            if (size < 0 || size > (in.remainingBits() / 9 + 1) * MAX_MATCH) {
                throw corrupt("tamanho original incompatível com o fluxo LZSS: " + size);
            }
            byte[] out = new byte[size];
            int pos = 0;
            while (pos < size) {
                if (in.readBit() == 1) {
                    out[pos++] = (byte) in.readBits(8);
                } else {
                    int offset = (int) in.readBits(OFFSET_BITS) + 1;
                    int length = (int) in.readBits(LENGTH_BITS) + MIN_MATCH;
                    pos = copyMatch(out, pos, offset, length);
                }
            }
            return out;
        }

        /**
         * Quebra a entrada em literais e matches. Entre matches de mesmo comprimento vence o de menor
         * offset: a cadeia de hash é percorrida da posição mais recente para a mais antiga e um
         * candidato só substitui o atual se for estritamente maior.
         */
        static void tokenize(byte[] input, TokenSink sink) {
            int n = input.length;
            int[] head = new int[1 << HASH_BITS];
            Arrays.fill(head, -1);
            int[] prev = new int[n];

            int pos = 0;
            while (pos < n) {
                int bestLength = 0;
                int bestOffset = 0;
                if (pos + MIN_MATCH <= n) {
                    int maxLength = Math.min(MAX_MATCH, n - pos);
                    int candidate = head[hash(input, pos)];
                    int chain = 0;
                    while (candidate >= 0 && pos - candidate <= WINDOW_SIZE && chain++ < MAX_CHAIN) {
                        int length = 0;
                        while (length < maxLength && input[candidate + length] == input[pos + length]) {
                            length++;
                        }
                        if (length > bestLength) {
                            bestLength = length;
                            bestOffset = pos - candidate;
                            if (length == maxLength) {
                                break;
                            }
                        }
                        candidate = prev[candidate];
                    }
                }

                if (bestLength >= MIN_MATCH) {
                    sink.match(bestOffset, bestLength);
                    for (int i = 0; i < bestLength; i++) {
                        insert(input, head, prev, pos + i);
                    }
                    pos += bestLength;
                } else {
                    sink.literal(input[pos] & 0xFF);
                    insert(input, head, prev, pos);
                    pos++;
                }
            }
        }

        private static void insert(byte[] input, int[] head, int[] prev, int pos) {
            if (pos + MIN_MATCH <= input.length) {
                int h = hash(input, pos);
                prev[pos] = head[h];
                head[h] = pos;
            }
        }

        private static int hash(byte[] data, int pos) {
            int v = ((data[pos] & 0xFF) << 16) | ((data[pos + 1] & 0xFF) << 8) | (data[pos + 2] & 0xFF);
            return (v * 0x9E3779B1) >>> (32 - HASH_BITS);
        }
    }

    /**
     * Destino dos tokens produzidos por {@link LzssCodec#tokenize(byte[], TokenSink)}.
     */
    interface TokenSink {
        void literal(int value);

        void match(int offset, int length);
    }

    // ==================== JOINED (LZSS + HUFFMAN) ====================

    /**
     * LZSS seguido de Huffman. Alfabeto de 272 símbolos: 0..255 são literais e 256..271 são matches
     * de comprimento 3..18; cada símbolo de match é seguido por 12 bits crus com (offset-1).
     */
    public static final class JoinedCodec implements CompressionCodec {
        static final int MATCH_BASE = 256;
        static final int ALPHABET = MATCH_BASE + (MAX_MATCH - MIN_MATCH + 1);

        @Override
        public CompressionAlgorithm algorithm() {
            return CompressionAlgorithm.JOINED;
        }

        @Override
        public byte[] encode(byte[] input) {
            Objects.requireNonNull(input, "input");
            int[] symbols = new int[input.length];
            int[] offsets = new int[input.length];
            long[] freq = new long[ALPHABET];
            int[] count = new int[1];

            LzssCodec.tokenize(input, new TokenSink() {
                @Override
                public void literal(int value) {
                    symbols[count[0]] = value;
                    freq[value]++;
                    count[0]++;
                }

                @Override
                public void match(int offset, int length) {
                    int symbol = MATCH_BASE + (length - MIN_MATCH);
                    symbols[count[0]] = symbol;
                    offsets[count[0]] = offset;
                    freq[symbol]++;
                    count[0]++;
                }
            });

            int[] lengths = CanonicalCode.lengthsFor(freq);
            CanonicalCode code = CanonicalCode.trusted(lengths);

            BitWriter out = new BitWriter(input.length / 3 + ALPHABET + 8);
            out.writeInt(input.length);
            for (int len : lengths) {
                out.writeByte(len);
            }
            for (int i = 0; i < count[0]; i++) {
                int symbol = symbols[i];
                code.write(out, symbol);
                if (symbol >= MATCH_BASE) {
                    out.writeBits(offsets[i] - 1, OFFSET_BITS);
                }
            }
            return out.toByteArray();
        }

        @Override
        public byte[] decode(byte[] encoded) throws BackupException {
            BitReader in = new BitReader(Objects.requireNonNull(encoded, "encoded"));
            int size = in.readInt();
            int[] lengths = new int[ALPHABET];
            for (int i = 0; i < ALPHABET; i++) {
                lengths[i] = in.readByte();
            }
            if (size < 0 || size > (in.remainingBits() + 1) * MAX_MATCH) {
                throw corrupt("tamanho original incompatível com o fluxo Joined: " + size);
            }
            CanonicalCode code = CanonicalCode.fromLengths(lengths);
            byte[] out = new byte[size];
            int pos = 0;
            while (pos < size) {
                int symbol = code.read(in);
                if (symbol < MATCH_BASE) {
                    out[pos++] = (byte) symbol;
                } else {
                    int length = symbol - MATCH_BASE + MIN_MATCH;
                    int offset = (int) in.readBits(OFFSET_BITS) + 1;
                    pos = copyMatch(out, pos, offset, length);
                }
            }
            return out;
        }
    }

    // ==================== CÓDIGO CANÔNICO ====================

    /**
     * Código de prefixo canônico: só os comprimentos são armazenados, os códigos são reconstruídos
     * ordenando por (comprimento, símbolo).
     */
    static final class CanonicalCode {
        private final int[] lengths;
        private final long[] codes;
        private final int maxLength;
        private final int[] countPerLength;
        private final int[] sortedSymbols;

        private CanonicalCode(int[] lengths, long[] codes, int maxLength, int[] countPerLength, int[] sortedSymbols) {
            this.lengths = lengths;
            this.codes = codes;
            this.maxLength = maxLength;
            this.countPerLength = countPerLength;
            this.sortedSymbols = sortedSymbols;
        }

        /**
         * Comprimentos de código de redundância mínima. Empates de peso são resolvidos pelo menor
         * símbolo contido em cada subárvore, o que torna a árvore (e o fluxo) reprodutível.
         * Um único símbolo presente recebe comprimento 1.
         */
        static int[] lengthsFor(long[] freq) {
            int[] lengths = new int[freq.length];
            PriorityQueue<Node> queue = new PriorityQueue<>();
            for (int s = 0; s < freq.length; s++) {
                if (freq[s] > 0) {
                    queue.add(new Node(freq[s], s, null, null));
                }
            }
            if (queue.isEmpty()) {
                return lengths;
            }
            if (queue.size() == 1) {
                lengths[queue.peek().minSymbol] = 1;
                return lengths;
            }
            while (queue.size() > 1) {
                Node a = queue.poll();
                Node b = queue.poll();
                queue.add(new Node(a.weight + b.weight, Math.min(a.minSymbol, b.minSymbol), a, b));
            }
            assignDepths(queue.poll(), 0, lengths);
            return lengths;
        }

        private static void assignDepths(Node node, int depth, int[] lengths) {
            if (node.left == null) {
                lengths[node.minSymbol] = depth;
                return;
            }
            assignDepths(node.left, depth + 1, lengths);
            assignDepths(node.right, depth + 1, lengths);
        }

        /** Para comprimentos gerados localmente por {@link #lengthsFor(long[])}. */
        static CanonicalCode trusted(int[] lengths) {
            try {
                return fromLengths(lengths);
            } catch (BackupException e) {
                throw new IllegalStateException("Tabela Huffman gerada é inválida", e);
            }
        }

        /**
         * Reconstrói o código a partir dos comprimentos lidos do fluxo, rejeitando tabelas
         * super-inscritas (que não formam um código de prefixo).
         */
        static CanonicalCode fromLengths(int[] lengths) throws BackupException {
            int maxLength = 0;
            for (int len : lengths) {
                if (len < 0 || len > MAX_CODE_LENGTH) {
                    throw corrupt("comprimento de código fora da faixa: " + len);
                }
                maxLength = Math.max(maxLength, len);
            }
            int[] countPerLength = new int[maxLength + 1];
            for (int len : lengths) {
                if (len > 0) {
                    countPerLength[len]++;
                }
            }

            long available = 1;
            for (int len = 1; len <= maxLength; len++) {
                available = (available << 1) - countPerLength[len];
                if (available < 0) {
                    throw corrupt("tabela de códigos super-inscrita");
                }
            }

            long[] nextCode = new long[maxLength + 2];
            long code = 0;
            for (int len = 1; len <= maxLength; len++) {
                code = (code + countPerLength[len - 1]) << 1;
                nextCode[len] = code;
            }

            long[] codes = new long[lengths.length];
            int[] sortedSymbols = new int[lengths.length];
            int filled = 0;
            for (int len = 1; len <= maxLength; len++) {
                for (int s = 0; s < lengths.length; s++) {
                    if (lengths[s] == len) {
                        sortedSymbols[filled++] = s;
                    }
                }
            }
            for (int s = 0; s < lengths.length; s++) {
                if (lengths[s] != 0) {
                    codes[s] = nextCode[lengths[s]]++;
                }
            }
            return new CanonicalCode(lengths.clone(), codes, maxLength, countPerLength,
                    Arrays.copyOf(sortedSymbols, filled));
        }

        void write(BitWriter out, int symbol) {
            out.writeBits(codes[symbol], lengths[symbol]);
        }

        int read(BitReader in) throws BackupException {
            long code = 0;
            long first = 0;
            int index = 0;
            for (int len = 1; len <= maxLength; len++) {
                code |= in.readBit();
                int count = countPerLength[len];
                if (code - first < count) {
                    return sortedSymbols[index + (int) (code - first)];
                }
                index += count;
                first = (first + count) << 1;
                code <<= 1;
            }
            throw corrupt("código Huffman inválido no fluxo");
        }

        private static final class Node implements Comparable<Node> {
            final long weight;
            final int minSymbol;
            final Node left;
            final Node right;

            Node(long weight, int minSymbol, Node left, Node right) {
                this.weight = weight;
                this.minSymbol = minSymbol;
                this.left = left;
                this.right = right;
            }

            @Override
            public int compareTo(Node other) {
                int byWeight = Long.compare(weight, other.weight);
                return byWeight != 0 ? byWeight : Integer.compare(minSymbol, other.minSymbol);
            }
        }
    }

    // ==================== UTILITÁRIOS DE BITS ====================

    /**
     * Copia um match byte a byte (offset menor que o comprimento repete o padrão).
     */
    private static int copyMatch(byte[] out, int pos, int offset, int length) throws BackupException {
        if (offset > pos || length > out.length - pos) {
            throw corrupt("match fora dos limites (pos=" + pos + ", offset=" + offset + ", len=" + length + ")");
        }
        for (int i = 0; i < length; i++) {
            out[pos + i] = out[pos + i - offset];
        }
        return pos + length;
    }

    private static BackupException corrupt(String detail) {
        return new BackupException(BackupException.Kind.CORRUPT_ARCHIVE, "Fluxo comprimido corrompido: " + detail);
    }

    /**
     * Escritor de bits MSB-first. O último byte é completado com zeros.
     */
    static final class BitWriter {
        private final ByteArrayOutputStream out;
        private int current;
        private int filled;

        BitWriter(int expectedSize) {
            this.out = new ByteArrayOutputStream(Math.max(16, expectedSize));
        }

        void writeBit(int bit) {
            current = (current << 1) | (bit & 1);
            if (++filled == 8) {
                out.write(current);
                current = 0;
                filled = 0;
            }
        }

        void writeBits(long value, int count) {
            for (int i = count - 1; i >= 0; i--) {
                writeBit((int) (value >>> i) & 1);
            }
        }

        void writeByte(int value) {
            writeBits(value & 0xFF, 8);
        }

        void writeInt(int value) {
            writeBits(value & 0xFFFFFFFFL, 32);
        }

        byte[] toByteArray() {
            if (filled > 0) {
                out.write(current << (8 - filled));
                current = 0;
                filled = 0;
            }
            return out.toByteArray();
        }
    }

    /**
     * Leitor de bits MSB-first; fim de fluxo vira CORRUPT_ARCHIVE.
     */
    static final class BitReader {
        private final byte[] data;
        private long position;

        BitReader(byte[] data) {
            this.data = data;
        }

        int readBit() throws BackupException {
            if (position >= (long) data.length * 8) {
                throw corrupt("fim inesperado do fluxo");
            }
            int b = data[(int) (position >>> 3)] & 0xFF;
            int bit = (b >>> (7 - (int) (position & 7))) & 1;
            position++;
            return bit;
        }

        long readBits(int count) throws BackupException {
            long v = 0;
            for (int i = 0; i < count; i++) {
                v = (v << 1) | readBit();
            }
            return v;
        }

        int readByte() throws BackupException {
            return (int) readBits(8);
        }

        int readInt() throws BackupException {
            return (int) readBits(32);
        }

        long remainingBits() {
            return (long) data.length * 8 - position;
        }
    }
}
