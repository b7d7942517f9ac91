package com.example.backupengine.backup;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.backupengine.archive.ArchiveFormat;
import com.example.backupengine.archive.ArchiveFormat.ArchiveContents;
import com.example.backupengine.archive.ArchiveFormat.ArchiveInfo;
import com.example.backupengine.archive.ArchiveFormat.Manifest;
import com.example.backupengine.archive.ArchiveFormat.ManifestEntry;
import com.example.backupengine.codec.Compression.CompressionAlgorithm;
import com.example.backupengine.config.AppConfig;
import com.example.backupengine.crypto.CryptoLayer;
import com.example.backupengine.error.BackupException;
import com.example.backupengine.error.BackupException.Kind;
import com.example.backupengine.filter.FileFilter;
import com.example.backupengine.filter.FileFilter.FilterOptions;
import com.example.backupengine.restore.Restore.RestoreExecutor;
import com.example.backupengine.restore.Restore.RestoreReport;
import com.example.backupengine.scan.Scanner.ScanResult;
import com.example.backupengine.scan.Scanner.ScanService;
import com.example.backupengine.scan.Scanner.ScannedEntry;

/**
 * Orquestra o pipeline: varredura → filtro → compressão → (criptografia) → arquivo, e o caminho
 * inverso para restore/verify.
 * <p>
 * Os métodos públicos devolvem {@code true}/{@code false} e nunca lançam: o motivo de uma falha fica
 * em {@link #lastFailure()} e no log. Algoritmo, senha e filtro são lidos uma única vez no início de
 * cada chamada, então mudar a configuração durante uma operação só afeta as próximas.
 */
public final class BackupEngine {

    private static final Logger log = LoggerFactory.getLogger(BackupEngine.class);
    private static final int MAX_PAYLOAD_BYTES = Integer.MAX_VALUE - 8;

    public enum Operation {
        BACKUP,
        RESTORE,
        VERIFY
    }

    private final ScanService scanService;
    private final ArchiveFormat.Writer writer;
    private final ArchiveFormat.Reader reader;
    private final RestoreExecutor restoreExecutor;
    private final String checksumAlgorithm;

    private volatile CompressionAlgorithm algorithm;
    private volatile String password = "";
    private volatile FilterOptions filterOptions = FilterOptions.disabled();
    private volatile List<Path> excludedPaths = List.of();
    private volatile BackupFailure lastFailure;

    public BackupEngine() {
        this(new CryptoLayer(), "SHA-256", ArchiveFormat.DEFAULT_MAX_MANIFEST_BYTES, CompressionAlgorithm.LZSS);
    }

    public BackupEngine(AppConfig config) {
        this(new CryptoLayer(config.kdfIterations()), config.hashAlgorithm(), config.maxManifestBytes(),
                config.defaultAlgorithm());
    }

    public BackupEngine(CryptoLayer crypto, String checksumAlgorithm, long maxManifestBytes,
                        CompressionAlgorithm defaultAlgorithm) {
        Objects.requireNonNull(crypto, "crypto");
        this.checksumAlgorithm = Objects.requireNonNull(checksumAlgorithm, "checksumAlgorithm");
        this.algorithm = Objects.requireNonNull(defaultAlgorithm, "defaultAlgorithm");
        this.scanService = new ScanService();
        this.writer = new ArchiveFormat.Writer(crypto);
        this.reader = new ArchiveFormat.Reader(crypto, maxManifestBytes);
        this.restoreExecutor = new RestoreExecutor();
    }

    // ==========================
    // CONFIGURAÇÃO
    // ==========================

    public void setCompressionAlgorithm(CompressionAlgorithm algorithm) {
        this.algorithm = Objects.requireNonNull(algorithm, "algorithm");
    }

    /** Senha vazia (ou null) desliga a criptografia. */
    public void setPassword(String password) {
        this.password = password == null ? "" : password;
    }

    /** {@code null} desliga o filtro. */
    public void setFilter(FilterOptions options) {
        this.filterOptions = options == null ? FilterOptions.disabled() : options;
    }

    /**
     * Caminhos (arquivos ou diretórios) que a varredura deve pular, por exemplo o diretório de destino
     * quando ele fica dentro da origem. O próprio arquivo de destino é sempre excluído.
     */
    public void setExcludedPaths(Collection<Path> paths) {
        this.excludedPaths = paths == null ? List.of() : List.copyOf(paths);
    }

    public CompressionAlgorithm compressionAlgorithm() {
        return algorithm;
    }

    public FilterOptions filter() {
        return filterOptions;
    }

    public boolean encrypted() {
        return !password.isEmpty();
    }

    /** Motivo da última falha desta instância, se houver. */
    public Optional<BackupFailure> lastFailure() {
        return Optional.ofNullable(lastFailure);
    }

    // ==========================
    // API PÚBLICA (bool)
    // ==========================

    /**
     * Gera o arquivo {@code dst} a partir de {@code src} (diretório ou arquivo único).
     */
    public boolean backup(Path src, Path dst) {
        try {
            createArchive(src, dst);
            return true;
        } catch (BackupException e) {
            return fail(Operation.BACKUP, src + " -> " + dst, e);
        } catch (RuntimeException e) {
            return fail(Operation.BACKUP, src + " -> " + dst,
                    new BackupException(Kind.IO_ERROR, "Erro inesperado: " + e, e));
        }
    }

    /**
     * Restaura o arquivo {@code src} dentro do diretório {@code dst}. Tudo ou nada.
     */
    public boolean restore(Path src, Path dst) {
        try {
            restoreArchive(src, dst);
            return true;
        } catch (BackupException e) {
            return fail(Operation.RESTORE, src + " -> " + dst, e);
        } catch (RuntimeException e) {
            return fail(Operation.RESTORE, src + " -> " + dst,
                    new BackupException(Kind.IO_ERROR, "Erro inesperado: " + e, e));
        }
    }

    /**
     * Autentica, descomprime e confere o checksum de cada entrada sem escrever nada em disco.
     */
    public boolean verify(Path src) {
        try {
            verifyArchive(src);
            return true;
        } catch (BackupException e) {
            return fail(Operation.VERIFY, String.valueOf(src), e);
        } catch (RuntimeException e) {
            return fail(Operation.VERIFY, String.valueOf(src),
                    new BackupException(Kind.IO_ERROR, "Erro inesperado: " + e, e));
        }
    }

    // ==========================
    // IMPLEMENTAÇÃO (lança)
    // ==========================

    /**
     * Variante que lança, para quem precisa do {@link ArchiveInfo}.
     */
    public ArchiveInfo createArchive(Path src, Path dst) throws BackupException {
        Objects.requireNonNull(src, "src");
        Objects.requireNonNull(dst, "dst");
        CompressionAlgorithm algo = this.algorithm;
        String pwd = this.password;
        FilterOptions options = this.filterOptions;
        List<Path> excluded = this.excludedPaths;

        log.info("=== JOB START: Backup {} -> {} (algoritmo={}, cifrado={}) ===", src, dst, algo, !pwd.isEmpty());
        Instant started = Instant.now();

        if (!Files.exists(src, LinkOption.NOFOLLOW_LINKS)) {
            throw new BackupException(Kind.INVALID_PATH, "Origem não encontrada: " + src);
        }
        if (Files.isDirectory(dst)) {
            throw new BackupException(Kind.INVALID_PATH, "Destino é um diretório, esperado caminho de arquivo: " + dst);
        }

        // 1. FILTRO (regex compilada antes de tocar no disco)
        FileFilter filter = FileFilter.compile(options);

        // 2. SCAN
        ScanResult scan = scanService.scan(src, filter, exclusions(dst, excluded));

        // 3. LEITURA + CHECKSUM
        MessageDigest digest = ArchiveFormat.newDigest(checksumAlgorithm);
        ByteArrayOutputStream payload = new ByteArrayOutputStream();
        List<ManifestEntry> entries = new ArrayList<>(scan.entries().size());
        byte[] buffer = new byte[64 * 1024];

        for (ScannedEntry entry : scan.entries()) {
            switch (entry.type()) {
                case DIRECTORY:
                    entries.add(ManifestEntry.directory(entry.relativePath(), entry.mode(), entry.modifiedAt()));
                    break;
                case SYMLINK:
                    entries.add(ManifestEntry.symlink(entry.relativePath(), entry.linkTarget(), entry.modifiedAt()));
                    break;
                case FILE:
                    digest.reset();
                    long read = 0;
                    try (InputStream in = Files.newInputStream(entry.absolutePath(), LinkOption.NOFOLLOW_LINKS)) {
                        int n;
                        while ((n = in.read(buffer)) != -1) {
                            if ((long) payload.size() + n > MAX_PAYLOAD_BYTES) {
                                throw new BackupException(Kind.IO_ERROR,
                                        "Árvore grande demais para um único arquivo de backup: " + src);
                            }
                            digest.update(buffer, 0, n);
                            payload.write(buffer, 0, n);
                            read += n;
                        }
                    } catch (BackupException e) {
                        throw e;
                    } catch (IOException e) {
                        throw BackupException.classify(e, "Falha ao ler " + entry.absolutePath());
                    }
                    if (read != entry.size()) {
                        log.warn("Arquivo {} mudou de tamanho durante o backup ({} -> {} bytes); gravando o conteúdo lido.",
                                entry.relativePath(), entry.size(), read);
                    }
                    entries.add(ManifestEntry.file(entry.relativePath(), read, entry.mode(),
                            ArchiveFormat.hex(digest.digest()), entry.modifiedAt()));
                    break;
                default:
                    throw new IllegalStateException("Tipo de entrada não tratado: " + entry.type());
            }
        }
        log.info("Scan finalizado: {} entradas, {} bytes de conteúdo.", entries.size(), payload.size());

        // 4. PACK (compressão + criptografia + escrita atômica)
        Manifest manifest = new Manifest(checksumAlgorithm, started.toEpochMilli(), entries);
        ArchiveInfo info = writer.write(dst, algo, pwd, manifest, payload.toByteArray());

        log.info("=== JOB END: Backup concluído em {} ms: {} bytes em {} ===",
                Duration.between(started, Instant.now()).toMillis(), info.size(), info.path());
        return info;
    }

    /**
     * Variante que lança, para quem precisa do {@link RestoreReport}.
     */
    public RestoreReport restoreArchive(Path src, Path dst) throws BackupException {
        Objects.requireNonNull(src, "src");
        Objects.requireNonNull(dst, "dst");
        log.info("=== JOB START: Restore {} -> {} ===", src, dst);
        ArchiveContents contents = reader.read(src, this.password);
        return restoreExecutor.restore(contents, dst);
    }

    /**
     * Variante que lança; devolve o conteúdo já verificado.
     */
    public ArchiveContents verifyArchive(Path src) throws BackupException {
        Objects.requireNonNull(src, "src");
        ArchiveContents contents = reader.read(src, this.password);
        List<String> mismatches = contents.checksumMismatches();
        if (!mismatches.isEmpty()) {
            throw new BackupException(Kind.CORRUPT_ARCHIVE, "Checksum divergente em: " + mismatches);
        }
        log.info("Verificação OK: {} ({} entradas)", src, contents.entries().size());
        return contents;
    }

    /**
     * O destino e seus temporários ({@code .<nome>-*.tmp}) nunca entram no backup, mais os caminhos configurados.
     * Comparação feita sobre caminhos reais, como os que a varredura produz.
     */
    private static Predicate<Path> exclusions(Path dst, List<Path> configured) {
        Path dstFile = realOrAbsolute(dst);
        Path dstParent = dstFile.getParent();
        String tempPrefix = "." + dstFile.getFileName() + "-";
        List<Path> roots = new ArrayList<>(configured.size());
        for (Path p : configured) {
            roots.add(realOrAbsolute(p));
        }
        return path -> {
            if (path.equals(dstFile)) {
                return true;
            }
            String name = path.getFileName() == null ? "" : path.getFileName().toString();
            if (Objects.equals(path.getParent(), dstParent) && name.startsWith(tempPrefix) && name.endsWith(".tmp")) {
                return true;
            }
            for (Path root : roots) {
                if (path.startsWith(root)) {
                    return true;
                }
            }
            return false;
        };
    }

    /** Resolve links do diretório pai quando o próprio caminho ainda não existe. */
    private static Path realOrAbsolute(Path path) {
        Path absolute = path.toAbsolutePath().normalize();
        try {
            return absolute.toRealPath();
        } catch (IOException e) {
            Path parent = absolute.getParent();
            if (parent != null && absolute.getFileName() != null) {
                try {
                    return parent.toRealPath().resolve(absolute.getFileName().toString());
                } catch (IOException parentMissing) {
                    log.debug("Caminho {} ainda não existe; comparando pelo caminho absoluto", absolute);
                }
            }
            return absolute;
        }
    }

    private boolean fail(Operation operation, String context, BackupException e) {
        BackupFailure failure = new BackupFailure(operation, e.kind(), context, e.getMessage(), Instant.now());
        this.lastFailure = failure;
        log.error("{} falhou [{}] {}: {}", operation, e.kind(), context, e.getMessage());
        log.debug("Detalhes da falha", e);
        return false;
    }

    // ==================================================================================
    // Registro de falha
    // ==================================================================================

    /**
     * Registro detalhado de uma falha: tipo, operação e contexto.
     */
    public static final class BackupFailure {
        private final Operation operation;
        private final Kind kind;
        private final String context;
        private final String message;
        private final Instant occurredAt;

        public BackupFailure(Operation operation, Kind kind, String context, String message, Instant occurredAt) {
            this.operation = Objects.requireNonNull(operation, "operation");
            this.kind = Objects.requireNonNull(kind, "kind");
            this.context = context;
            this.message = message;
            this.occurredAt = Objects.requireNonNull(occurredAt, "occurredAt");
        }

        public Operation operation() { return operation; }
        public Kind kind() { return kind; }
        public String context() { return context; }
        public String message() { return message; }
        public Instant occurredAt() { return occurredAt; }

        @Override
        public String toString() {
            return operation + " [" + kind + "] " + context + ": " + message;
        }
    }
}
