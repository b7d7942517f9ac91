package com.example.backupengine.archive;

import java.io.BufferedOutputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.RandomAccessFile;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import javax.crypto.SecretKey;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.backupengine.codec.Compression;
import com.example.backupengine.codec.Compression.CompressionAlgorithm;
import com.example.backupengine.crypto.CryptoLayer;
import com.example.backupengine.error.BackupException;
import com.example.backupengine.error.BackupException.Kind;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Formato de arquivo de backup (single-file, versionado).
 *
 * Estrutura:
 * - Header: "BKP1" (4 bytes) + versão (1) + algoritmo (1) + flag cifrado (1)
 * - Se cifrado: salt (16) + nonce (12)
 * - Manifest: tamanho (varint) + JSON UTF-8 com as entradas na ordem do walk
 * - Payload: tamanho (varint) + bytes comprimidos (e cifrados, se houver senha)
 * - Tag (16): tag GCM quando cifrado; senão os 16 primeiros bytes do SHA-256 de todo o resto
 *
 * Responsabilidades:
 * - Escrita (Writer): gera em arquivo temporário no mesmo diretório e faz rename atômico;
 * - Leitura (Reader): valida magic/versão, limites, tag, e só então interpreta manifest e payload.
 */
public final class ArchiveFormat {

    private static final Logger log = LoggerFactory.getLogger(ArchiveFormat.class);

    static final byte[] MAGIC = {'B', 'K', 'P', '1'};
    static final int VERSION = 1;
    public static final int TAG_LENGTH = 16;
    public static final long DEFAULT_MAX_MANIFEST_BYTES = 64L * 1024 * 1024;
    private static final String TAG_DIGEST = "SHA-256";
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final HexFormat HEX = HexFormat.of();

    private ArchiveFormat() {}

    // ==================== TIPOS COMPARTILHADOS ====================

    public enum EntryKind {
        FILE,
        DIRECTORY,
        SYMLINK
    }

    /**
     * Entrada do manifest. Caminho relativo à raiz da origem, sempre com '/'.
     * {@code mode} são os bits de permissão POSIX (-1 quando o sistema de arquivos não expõe).
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ManifestEntry {
        private final String path;
        private final EntryKind kind;
        private final long size;
        private final int mode;
        private final String checksum;
        private final String linkTarget;
        private final long modifiedAt;

        @JsonCreator
        public ManifestEntry(@JsonProperty("path") String path,
                             @JsonProperty("kind") EntryKind kind,
                             @JsonProperty("size") long size,
                             @JsonProperty("mode") int mode,
                             @JsonProperty("checksum") String checksum,
                             @JsonProperty("linkTarget") String linkTarget,
                             @JsonProperty("modifiedAt") long modifiedAt) {
            this.path = Objects.requireNonNull(path, "path");
            this.kind = Objects.requireNonNull(kind, "kind");
            this.size = size;
            this.mode = mode;
            this.checksum = checksum;
            this.linkTarget = linkTarget;
            this.modifiedAt = modifiedAt;
        }

        public static ManifestEntry file(String path, long size, int mode, String checksum, Instant modifiedAt) {
            return new ManifestEntry(path, EntryKind.FILE, size, mode, checksum, null, millis(modifiedAt));
        }

        public static ManifestEntry directory(String path, int mode, Instant modifiedAt) {
            return new ManifestEntry(path, EntryKind.DIRECTORY, 0, mode, null, null, millis(modifiedAt));
        }

        public static ManifestEntry symlink(String path, String target, Instant modifiedAt) {
            return new ManifestEntry(path, EntryKind.SYMLINK, 0, -1, null, Objects.requireNonNull(target, "target"),
                    millis(modifiedAt));
        }

        private static long millis(Instant instant) {
            return instant != null ? instant.toEpochMilli() : 0L;
        }

        @JsonProperty("path") public String path() { return path; }
        @JsonProperty("kind") public EntryKind kind() { return kind; }
        @JsonProperty("size") public long size() { return size; }
        @JsonProperty("mode") public int mode() { return mode; }
        @JsonProperty("checksum") public String checksum() { return checksum; }
        @JsonProperty("linkTarget") public String linkTarget() { return linkTarget; }
        @JsonProperty("modifiedAt") public long modifiedAt() { return modifiedAt; }

        @JsonIgnore
        public boolean isFile() { return kind == EntryKind.FILE; }

        @Override
        public String toString() {
            return kind + " " + path + (kind == EntryKind.FILE ? " (" + size + " bytes)" : "")
                    + (linkTarget != null ? " -> " + linkTarget : "");
        }
    }

    /**
     * Documento JSON gravado na seção MANIFEST.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Manifest {
        private final String checksumAlgorithm;
        private final long createdAt;
        private final List<ManifestEntry> entries;

        @JsonCreator
        public Manifest(@JsonProperty("checksumAlgorithm") String checksumAlgorithm,
                        @JsonProperty("createdAt") long createdAt,
                        @JsonProperty("entries") List<ManifestEntry> entries) {
            this.checksumAlgorithm = Objects.requireNonNull(checksumAlgorithm, "checksumAlgorithm");
            this.createdAt = createdAt;
            this.entries = entries == null ? List.of() : List.copyOf(entries);
        }

        @JsonProperty("checksumAlgorithm") public String checksumAlgorithm() { return checksumAlgorithm; }
        @JsonProperty("createdAt") public long createdAt() { return createdAt; }
        @JsonProperty("entries") public List<ManifestEntry> entries() { return entries; }

        /** Soma dos tamanhos dos arquivos, ou seja, o tamanho esperado do payload descomprimido. */
        public long payloadSize() {
            return entries.stream().filter(ManifestEntry::isFile).mapToLong(ManifestEntry::size).sum();
        }

        public String toJson() throws JsonProcessingException {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(this);
        }
    }

    /**
     * Campos fixos do cabeçalho.
     */
    public static final class Header {
        private final int version;
        private final CompressionAlgorithm algorithm;
        private final boolean encrypted;

        Header(int version, CompressionAlgorithm algorithm, boolean encrypted) {
            this.version = version;
            this.algorithm = algorithm;
            this.encrypted = encrypted;
        }

        public int version() { return version; }
        public CompressionAlgorithm algorithm() { return algorithm; }
        public boolean encrypted() { return encrypted; }
    }

    /**
     * Resultado de uma escrita.
     */
    public static final class ArchiveInfo {
        private final Path path;
        private final long size;
        private final CompressionAlgorithm algorithm;
        private final boolean encrypted;
        private final int entries;
        private final long originalBytes;
        private final long compressedBytes;

        ArchiveInfo(Path path, long size, CompressionAlgorithm algorithm, boolean encrypted,
                    int entries, long originalBytes, long compressedBytes) {
            this.path = path;
            this.size = size;
            this.algorithm = algorithm;
            this.encrypted = encrypted;
            this.entries = entries;
            this.originalBytes = originalBytes;
            this.compressedBytes = compressedBytes;
        }

        public Path path() { return path; }
        public long size() { return size; }
        public CompressionAlgorithm algorithm() { return algorithm; }
        public boolean encrypted() { return encrypted; }
        public int entries() { return entries; }
        public long originalBytes() { return originalBytes; }
        public long compressedBytes() { return compressedBytes; }
    }

    /**
     * Conteúdo autenticado e descomprimido de um arquivo.
     */
    public static final class ArchiveContents {
        private final Header header;
        private final Manifest manifest;
        private final byte[] payload;

        private final Map<String, Integer> offsets;

        ArchiveContents(Header header, Manifest manifest, byte[] payload) {
            this.header = header;
            this.manifest = manifest;
            this.payload = payload;
            Map<String, Integer> map = new HashMap<>();
            long offset = 0;
            for (ManifestEntry e : manifest.entries()) {
                if (e.isFile()) {
                    map.put(e.path(), (int) offset);
                    offset += e.size();
                }
            }
            this.offsets = map;
        }

        public Header header() { return header; }
        public Manifest manifest() { return manifest; }
        public List<ManifestEntry> entries() { return manifest.entries(); }

        /** Stream concatenado dos arquivos, na ordem do manifest. */
        public byte[] payload() { return payload; }

        /** Posição do conteúdo de {@code entry} dentro de {@link #payload()}. */
        public int offsetOf(ManifestEntry entry) {
            Integer offset = offsets.get(entry.path());
            if (offset == null || !entry.isFile()) {
                throw new IllegalArgumentException("Entrada não é arquivo deste manifest: " + entry.path());
            }
            return offset;
        }

        /**
         * Recalcula o checksum de cada arquivo e devolve os caminhos divergentes (lista vazia = íntegro).
         */
        public List<String> checksumMismatches() throws BackupException {
            MessageDigest digest = newDigest(manifest.checksumAlgorithm());
            List<String> mismatches = new ArrayList<>();
            for (ManifestEntry e : manifest.entries()) {
                if (!e.isFile()) {
                    continue;
                }
                digest.reset();
                digest.update(payload, offsetOf(e), (int) e.size());
                String actual = HEX.formatHex(digest.digest());
                if (!actual.equalsIgnoreCase(String.valueOf(e.checksum()))) {
                    mismatches.add(e.path());
                }
            }
            return mismatches;
        }
    }

    // ==================== WRITER (CRIAÇÃO) ====================

    /**
     * Writer de arquivos de backup.
     */
    public static final class Writer {
        private final CryptoLayer crypto;

        public Writer(CryptoLayer crypto) {
            this.crypto = Objects.requireNonNull(crypto, "crypto");
        }

        /**
         * Comprime, cifra (se {@code password} não for vazia) e grava o arquivo em {@code destination}.
         * O destino só aparece com o nome final depois de completamente escrito.
         */
        public ArchiveInfo write(Path destination, CompressionAlgorithm algorithm, String password,
                                 Manifest manifest, byte[] payload) throws BackupException {
            Objects.requireNonNull(destination, "destination");
            Objects.requireNonNull(algorithm, "algorithm");
            Objects.requireNonNull(manifest, "manifest");
            Objects.requireNonNull(payload, "payload");
            boolean encrypted = password != null && !password.isEmpty();

            long started = System.nanoTime();
            byte[] compressed = Compression.codecFor(algorithm).encode(payload);
            byte[] manifestBytes;
            try {
                manifestBytes = MAPPER.writeValueAsBytes(manifest);
            } catch (JsonProcessingException e) {
                throw new BackupException(Kind.IO_ERROR, "Falha ao serializar manifest: " + e.getOriginalMessage(), e);
            }

            byte[] salt = encrypted ? CryptoLayer.newSalt() : null;
            byte[] nonce = encrypted ? CryptoLayer.newNonce() : null;

            ByteArrayOutputStream prefix = new ByteArrayOutputStream(64 + manifestBytes.length);
            prefix.writeBytes(MAGIC);
            prefix.write(VERSION);
            prefix.write(algorithm.id());
            prefix.write(encrypted ? 1 : 0);
            if (encrypted) {
                prefix.writeBytes(salt);
                prefix.writeBytes(nonce);
            }
            writeVarint(prefix, manifestBytes.length);
            prefix.writeBytes(manifestBytes);
            writeVarint(prefix, compressed.length);
            byte[] prefixBytes = prefix.toByteArray();

            byte[] body;
            byte[] tag;
            if (encrypted) {
                SecretKey key = crypto.deriveKey(password, salt);
                CryptoLayer.Sealed sealed = crypto.seal(key, nonce, prefixBytes, compressed);
                body = sealed.ciphertext();
                tag = sealed.tag();
            } else {
                body = compressed;
                tag = integrityTag(prefixBytes, compressed);
            }

            Path parent = destination.toAbsolutePath().getParent();
            if (parent == null || !Files.isDirectory(parent)) {
                throw new BackupException(Kind.INVALID_PATH, "Diretório de destino inexistente: " + parent);
            }

            Path temp = null;
            try {
                temp = Files.createTempFile(parent, "." + destination.getFileName() + "-", ".tmp");
                try (FileOutputStream fos = new FileOutputStream(temp.toFile());
                     OutputStream out = new BufferedOutputStream(fos)) {
                    out.write(prefixBytes);
                    out.write(body);
                    out.write(tag);
                    out.flush();
                    fos.getFD().sync();
                }
                moveAtomically(temp, destination);
                temp = null;
            } catch (IOException e) {
                throw BackupException.classify(e, "Falha ao gravar arquivo de backup " + destination);
            } finally {
                if (temp != null) {
                    deleteQuietly(temp);
                }
            }

            long size = (long) prefixBytes.length + body.length + tag.length;
            long elapsedMs = (System.nanoTime() - started) / 1_000_000;
            log.info("Arquivo gravado: {} ({} entradas, {} -> {} bytes, algoritmo={}, cifrado={}, {} ms)",
                    destination, manifest.entries().size(), payload.length, compressed.length,
                    algorithm, encrypted, elapsedMs);

            return new ArchiveInfo(destination, size, algorithm, encrypted,
                    manifest.entries().size(), payload.length, compressed.length);
        }

        private void moveAtomically(Path temp, Path destination) throws IOException {
            try {
                Files.move(temp, destination, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("Rename atômico não suportado em {}; usando move simples", destination.getParent());
                Files.move(temp, destination, StandardCopyOption.REPLACE_EXISTING);
            }
        }

        private static void deleteQuietly(Path temp) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException e) {
                log.warn("Não foi possível remover temporário {}: {}", temp, e.toString());
            }
        }
    }

    // ==================== READER (LEITURA) ====================

    /**
     * Reader de arquivos de backup.
     */
    public static final class Reader {
        private final CryptoLayer crypto;
        private final long maxManifestBytes;

        public Reader(CryptoLayer crypto) {
            this(crypto, DEFAULT_MAX_MANIFEST_BYTES);
        }

        public Reader(CryptoLayer crypto, long maxManifestBytes) {
            this.crypto = Objects.requireNonNull(crypto, "crypto");
            if (maxManifestBytes <= 0) {
                throw new IllegalArgumentException("maxManifestBytes deve ser positivo");
            }
            this.maxManifestBytes = maxManifestBytes;
        }

        /**
         * Lê, autentica e descomprime. Nenhum byte do manifest ou do payload é interpretado antes
         * da tag ser validada.
         */
        public ArchiveContents read(Path archive, String password) throws BackupException {
            Objects.requireNonNull(archive, "archive");
            if (!Files.isRegularFile(archive)) {
                throw new BackupException(Kind.INVALID_PATH, "Arquivo de backup não encontrado: " + archive);
            }

            try (RandomAccessFile raf = new RandomAccessFile(archive.toFile(), "r")) {
                long length = raf.length();

                // Header
                byte[] magic = new byte[MAGIC.length];
                if (length < MAGIC.length + 3) {
                    throw new BackupException(Kind.UNSUPPORTED_FORMAT,
                            "Arquivo curto demais para ser um backup: " + archive + " (" + length + " bytes)");
                }
                raf.readFully(magic);
                if (!Arrays.equals(magic, MAGIC)) {
                    throw new BackupException(Kind.UNSUPPORTED_FORMAT, String.format(
                            "Magic header incorreto em %s: encontrado [%02X %02X %02X %02X]",
                            archive, magic[0], magic[1], magic[2], magic[3]));
                }
                int version = raf.readUnsignedByte();
                if (version != VERSION) {
                    throw new BackupException(Kind.UNSUPPORTED_FORMAT, "Versão de formato não suportada: " + version);
                }
                CompressionAlgorithm algorithm = CompressionAlgorithm.fromId(raf.readUnsignedByte());
                int flag = raf.readUnsignedByte();
                if (flag > 1) {
                    throw new BackupException(Kind.UNSUPPORTED_FORMAT, "Flag de criptografia inválida: " + flag);
                }
                boolean encrypted = flag == 1;

                byte[] salt = null;
                byte[] nonce = null;
                if (encrypted) {
                    salt = new byte[CryptoLayer.SALT_LENGTH];
                    nonce = new byte[CryptoLayer.NONCE_LENGTH];
                    raf.readFully(salt);
                    raf.readFully(nonce);
                }

                // Manifest (limites antes de alocar)
                long manifestLength = readVarint(raf);
                long remaining = length - raf.getFilePointer();
                if (manifestLength > maxManifestBytes || manifestLength > remaining - 1 - TAG_LENGTH) {
                    throw new BackupException(Kind.CORRUPT_ARCHIVE, "Tamanho de manifest inválido: " + manifestLength);
                }
                byte[] manifestBytes = new byte[(int) manifestLength];
                raf.readFully(manifestBytes);

                // Payload: precisa ocupar exatamente o espaço até a tag
                long payloadLength = readVarint(raf);
                long payloadStart = raf.getFilePointer();
                if (payloadLength != length - payloadStart - TAG_LENGTH || payloadLength > Integer.MAX_VALUE - 8) {
                    throw new BackupException(Kind.CORRUPT_ARCHIVE, "Tamanho de payload inconsistente: " + payloadLength);
                }
                byte[] body = new byte[(int) payloadLength];
                raf.readFully(body);
                byte[] tag = new byte[TAG_LENGTH];
                raf.readFully(tag);

                byte[] prefix = new byte[(int) payloadStart];
                raf.seek(0);
                raf.readFully(prefix);

                // Autenticação
                byte[] compressed;
                if (encrypted) {
                    if (password == null || password.isEmpty()) {
                        throw new BackupException(Kind.AUTHENTICATION_FAILED, "Arquivo cifrado exige senha: " + archive);
                    }
                    SecretKey key = crypto.deriveKey(password, salt);
                    compressed = crypto.open(key, nonce, prefix, body, tag);
                } else {
                    if (!MessageDigest.isEqual(tag, integrityTag(prefix, body))) {
                        throw new BackupException(Kind.AUTHENTICATION_FAILED,
                                "Tag de integridade não confere: arquivo adulterado ou truncado: " + archive);
                    }
                    if (password != null && !password.isEmpty()) {
                        log.debug("Senha informada para arquivo não cifrado {}; ignorada", archive);
                    }
                    compressed = body;
                }

                // Só agora o conteúdo é confiável
                Manifest manifest = parseManifest(manifestBytes);
                byte[] payload = Compression.codecFor(algorithm).decode(compressed);
                if (payload.length != manifest.payloadSize()) {
                    throw new BackupException(Kind.CORRUPT_ARCHIVE, "Payload com " + payload.length
                            + " bytes, manifest declara " + manifest.payloadSize());
                }

                log.debug("Arquivo lido: {} ({} entradas, algoritmo={}, cifrado={})",
                        archive, manifest.entries().size(), algorithm, encrypted);
                return new ArchiveContents(new Header(version, algorithm, encrypted), manifest, payload);

            } catch (EOFException e) {
                throw new BackupException(Kind.CORRUPT_ARCHIVE, "Arquivo truncado: " + archive, e);
            } catch (BackupException e) {
                throw e;
            } catch (IOException e) {
                throw BackupException.classify(e, "Falha ao ler " + archive);
            }
        }

        private static Manifest parseManifest(byte[] bytes) throws BackupException {
            Manifest manifest;
            try {
                manifest = MAPPER.readValue(bytes, Manifest.class);
            } catch (IOException | RuntimeException e) {
                throw new BackupException(Kind.CORRUPT_ARCHIVE, "Manifest ilegível: " + e.getMessage(), e);
            }
            validate(manifest.entries());
            return manifest;
        }

        /**
         * Caminhos precisam ser relativos, sem "..", únicos, e nenhum pode ficar "dentro" de um symlink.
         */
        private static void validate(List<ManifestEntry> entries) throws BackupException {
            Set<String> seen = new HashSet<>();
            List<String> symlinks = new ArrayList<>();
            for (ManifestEntry e : entries) {
                String p = e.path();
                if (p.isEmpty() || p.startsWith("/") || p.contains("\\") || p.contains("\0")) {
                    throw new BackupException(Kind.CORRUPT_ARCHIVE, "Caminho inválido no manifest: " + p);
                }
                for (String segment : p.split("/", -1)) {
                    if (segment.isEmpty() || segment.equals(".") || segment.equals("..")) {
                        throw new BackupException(Kind.CORRUPT_ARCHIVE, "Caminho inválido no manifest: " + p);
                    }
                }
                if (!seen.add(p)) {
                    throw new BackupException(Kind.CORRUPT_ARCHIVE, "Caminho duplicado no manifest: " + p);
                }
                if (e.size() < 0 || (e.kind() == EntryKind.SYMLINK && e.linkTarget() == null)) {
                    throw new BackupException(Kind.CORRUPT_ARCHIVE, "Entrada inconsistente no manifest: " + p);
                }
                for (String link : symlinks) {
                    if (p.startsWith(link + "/")) {
                        throw new BackupException(Kind.CORRUPT_ARCHIVE, "Entrada sob symlink no manifest: " + p);
                    }
                }
                if (e.kind() == EntryKind.SYMLINK) {
                    symlinks.add(p);
                }
            }
        }
    }

    // ==================== UTILITÁRIOS ====================

    /**
     * Cria o {@link MessageDigest} usado nos checksums por entrada.
     */
    public static MessageDigest newDigest(String algorithm) throws BackupException {
        try {
            return MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new BackupException(Kind.UNSUPPORTED_FORMAT, "Algoritmo de hash indisponível: " + algorithm, e);
        }
    }

    /** Hex minúsculo, como gravado no manifest. */
    public static String hex(byte[] bytes) {
        return HEX.formatHex(bytes);
    }

    static byte[] integrityTag(byte[] prefix, byte[] body) throws BackupException {
        try {
            MessageDigest digest = MessageDigest.getInstance(TAG_DIGEST);
            digest.update(prefix);
            digest.update(body);
            return Arrays.copyOf(digest.digest(), TAG_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new BackupException(Kind.IO_ERROR, "Algoritmo de hash indisponível: " + TAG_DIGEST, e);
        }
    }

    /** Varint LEB128 sem sinal. */
    static void writeVarint(ByteArrayOutputStream out, long value) {
        long v = value;
        while ((v & ~0x7FL) != 0) {
            out.write((int) ((v & 0x7F) | 0x80));
            v >>>= 7;
        }
        out.write((int) v);
    }

    static long readVarint(RandomAccessFile raf) throws IOException {
        long result = 0;
        for (int shift = 0; shift < 63; shift += 7) {
            int b = raf.readUnsignedByte();
            result |= (long) (b & 0x7F) << shift;
            if ((b & 0x80) == 0) {
                return result;
            }
        }
        throw new BackupException(Kind.CORRUPT_ARCHIVE, "Varint longo demais");
    }
}
