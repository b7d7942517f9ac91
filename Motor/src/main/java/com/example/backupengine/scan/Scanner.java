package com.example.backupengine.scan;

import java.io.IOException;
import java.nio.file.FileSystemLoopException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.PosixFileAttributes;
import java.nio.file.attribute.PosixFilePermission;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.backupengine.error.BackupException;
import com.example.backupengine.error.BackupException.Kind;
import com.example.backupengine.filter.FileFilter;

/**
 * Módulo de varredura da árvore de origem.
 *
 * Responsabilidades principais:
 * - Caminhar a árvore a partir de um root sem seguir symlinks (eles viram entradas próprias);
 * - Aplicar o {@link FileFilter} apenas a arquivos regulares (diretórios e links sempre entram,
 *   pois são necessários para reconstruir a estrutura);
 * - Capturar modo POSIX, dono e mtime para o manifest e para o filtro;
 * - Pular arquivos especiais (FIFO, socket, dispositivos) e {@code .DS_Store}.
 *
 * Diferente de um scan tolerante, aqui qualquer falha de acesso aborta a varredura: um backup
 * que silenciosamente deixa arquivos de fora não é um backup.
 */
public final class Scanner {

    private static final Logger log = LoggerFactory.getLogger(Scanner.class);
    private static final String DS_STORE = ".DS_Store";

    private Scanner() {}

    public enum EntryType {
        FILE,
        DIRECTORY,
        SYMLINK
    }

    /**
     * Entrada encontrada durante o scan (snapshot dos atributos no momento da visita).
     * É imutável para facilitar log e montagem do manifest.
     */
    public static final class ScannedEntry {
        private final Path absolutePath;
        private final String relativePath;
        private final EntryType type;
        private final long size;
        private final Instant modifiedAt;
        private final int mode;
        private final String owner;
        private final String linkTarget;

        public ScannedEntry(Path absolutePath, String relativePath, EntryType type, long size,
                            Instant modifiedAt, int mode, String owner, String linkTarget) {
            this.absolutePath = Objects.requireNonNull(absolutePath, "absolutePath");
            this.relativePath = Objects.requireNonNull(relativePath, "relativePath");
            this.type = Objects.requireNonNull(type, "type");
            this.size = size;
            this.modifiedAt = Objects.requireNonNull(modifiedAt, "modifiedAt");
            this.mode = mode;
            this.owner = owner;
            this.linkTarget = linkTarget;
        }

        public Path absolutePath() { return absolutePath; }

        /** Caminho relativo ao root, sempre com '/'. */
        public String relativePath() { return relativePath; }
        public EntryType type() { return type; }
        public long size() { return size; }
        public Instant modifiedAt() { return modifiedAt; }

        /** Bits de permissão POSIX ou -1 quando indisponíveis. */
        public int mode() { return mode; }
        public String owner() { return owner; }
        public String linkTarget() { return linkTarget; }

        @Override
        public String toString() {
            return type + " " + relativePath;
        }
    }

    /**
     * Estatísticas agregadas de um scan.
     */
    public static final class ScanStatistics {
        private final long filesIncluded;
        private final long filesExcludedByFilter;
        private final long directoriesVisited;
        private final long symlinksRecorded;
        private final long specialFilesSkipped;

        public ScanStatistics(long filesIncluded, long filesExcludedByFilter, long directoriesVisited,
                              long symlinksRecorded, long specialFilesSkipped) {
            this.filesIncluded = filesIncluded;
            this.filesExcludedByFilter = filesExcludedByFilter;
            this.directoriesVisited = directoriesVisited;
            this.symlinksRecorded = symlinksRecorded;
            this.specialFilesSkipped = specialFilesSkipped;
        }

        public long filesIncluded() { return filesIncluded; }
        public long filesExcludedByFilter() { return filesExcludedByFilter; }
        public long directoriesVisited() { return directoriesVisited; }
        public long symlinksRecorded() { return symlinksRecorded; }
        public long specialFilesSkipped() { return specialFilesSkipped; }

        @Override
        public String toString() {
            return "ScanStatistics{arquivos=" + filesIncluded +
                    ", excluidosPorFiltro=" + filesExcludedByFilter +
                    ", diretorios=" + directoriesVisited +
                    ", symlinks=" + symlinksRecorded +
                    ", especiaisIgnorados=" + specialFilesSkipped + "}";
        }
    }

    /**
     * Resultado agregado: entradas na ordem de visita + estatísticas.
     */
    public static final class ScanResult {
        private final Path root;
        private final List<ScannedEntry> entries;
        private final ScanStatistics statistics;

        public ScanResult(Path root, List<ScannedEntry> entries, ScanStatistics statistics) {
            this.root = Objects.requireNonNull(root, "root");
            this.entries = List.copyOf(entries);
            this.statistics = Objects.requireNonNull(statistics, "statistics");
        }

        public Path root() { return root; }
        public List<ScannedEntry> entries() { return entries; }
        public ScanStatistics statistics() { return statistics; }
    }

    // ==================== SERVIÇO ====================

    /**
     * Serviço de varredura. Sem estado entre chamadas; pode ser compartilhado entre threads.
     */
    public static final class ScanService {

        /**
         * Varre {@code source}. Se for um arquivo, devolve uma árvore de uma entrada só cujo
         * caminho relativo é o nome do arquivo.
         *
         * @throws BackupException INVALID_PATH se a origem não existir, PERMISSION_DENIED se algo
         *                         não puder ser lido, IO_ERROR nos demais casos
         */
        public ScanResult scan(Path source, FileFilter filter) throws BackupException {
            return scan(source, filter, path -> false);
        }

        /**
         * Como {@link #scan(Path, FileFilter)}, pulando os caminhos (e subárvores) aceitos por {@code excluded}.
         * Os caminhos testados são absolutos e reais, a partir de {@code source.toRealPath()}.
         */
        public ScanResult scan(Path source, FileFilter filter, Predicate<Path> excluded) throws BackupException {
            Objects.requireNonNull(source, "source");
            Objects.requireNonNull(excluded, "excluded");
            final FileFilter effectiveFilter = filter != null ? filter : FileFilter.acceptAll();
            Path root = normalize(source);

            List<ScannedEntry> entries = new ArrayList<>();
            final long[] filesIncluded = new long[1];
            final long[] filesExcluded = new long[1];
            final long[] dirsVisited = new long[1];
            final long[] symlinks = new long[1];
            final long[] specials = new long[1];

            try {
                BasicFileAttributes rootAttrs = Files.readAttributes(root, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
                if (rootAttrs.isRegularFile()) {
                    ScannedEntry single = describe(root, root.getFileName().toString(), rootAttrs);
                    if (effectiveFilter.matches(root, rootAttrs.size(), single.modifiedAt(), single.owner())) {
                        entries.add(single);
                        filesIncluded[0]++;
                    } else {
                        filesExcluded[0]++;
                    }
                    return new ScanResult(root, entries,
                            new ScanStatistics(filesIncluded[0], filesExcluded[0], 0, 0, 0));
                }
                if (!rootAttrs.isDirectory()) {
                    throw new BackupException(Kind.INVALID_PATH, "Origem não é arquivo nem diretório: " + root);
                }

                Files.walkFileTree(root, EnumSet.noneOf(FileVisitOption.class), Integer.MAX_VALUE, new SimpleFileVisitor<>() {

                    @Override
                    public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                        // O root não vira entrada: tudo é relativo a ele.
                        if (!dir.equals(root) && excluded.test(dir)) {
                            log.debug("Subárvore excluída da varredura: {}", dir);
                            return FileVisitResult.SKIP_SUBTREE;
                        }
                        dirsVisited[0]++;
                        if (!dir.equals(root)) {
                            entries.add(describe(dir, relativize(root, dir), attrs));
                        }
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                        if (excluded.test(file)) {
                            return FileVisitResult.CONTINUE;
                        }
                        if (attrs.isSymbolicLink()) {
                            entries.add(describe(file, relativize(root, file), attrs));
                            symlinks[0]++;
                            return FileVisitResult.CONTINUE;
                        }
                        if (!attrs.isRegularFile()) {
                            log.warn("Arquivo especial ignorado (FIFO/socket/dispositivo): {}", file);
                            specials[0]++;
                            return FileVisitResult.CONTINUE;
                        }
                        if (DS_STORE.equals(file.getFileName().toString())) {
                            return FileVisitResult.CONTINUE;
                        }

                        ScannedEntry entry = describe(file, relativize(root, file), attrs);
                        if (effectiveFilter.matches(file, attrs.size(), entry.modifiedAt(), entry.owner())) {
                            entries.add(entry);
                            filesIncluded[0]++;
                        } else {
                            filesExcluded[0]++;
                        }
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
                        throw exc;
                    }

                    @Override
                    public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                        if (exc != null) {
                            throw exc;
                        }
                        return FileVisitResult.CONTINUE;
                    }
                });
            } catch (FileSystemLoopException loop) {
                throw new BackupException(Kind.IO_ERROR, "Loop de sistema de arquivos detectado: " + loop.getFile(), loop);
            } catch (IOException e) {
                throw BackupException.classify(e, "Falha na varredura de " + root);
            }

            ScanStatistics stats = new ScanStatistics(filesIncluded[0], filesExcluded[0], dirsVisited[0],
                    symlinks[0], specials[0]);
            log.info("Scan de {} concluído: {}", root, stats);
            return new ScanResult(root, entries, stats);
        }

        // --- Métodos Auxiliares ---

        /**
         * Normaliza o root:
         * - tenta {@code toRealPath()} (resolve links, normaliza);
         * - se falhar, devolve INVALID_PATH (a origem precisa existir).
         */
        private Path normalize(Path root) throws BackupException {
            try {
                return root.toRealPath();
            } catch (IOException e) {
                throw BackupException.classify(e, "Origem inválida: " + root);
            }
        }

        private static String relativize(Path root, Path path) {
            return root.relativize(path).toString().replace('\\', '/');
        }

        private static ScannedEntry describe(Path path, String relative, BasicFileAttributes attrs) throws IOException {
            Instant modified = attrs.lastModifiedTime().toInstant();
            if (attrs.isSymbolicLink()) {
                String target = Files.readSymbolicLink(path).toString();
                return new ScannedEntry(path, relative, EntryType.SYMLINK, 0, modified, -1, null, target);
            }
            EntryType type = attrs.isDirectory() ? EntryType.DIRECTORY : EntryType.FILE;
            int mode = -1;
            String owner = null;
            if (PosixModes.supported(path)) {
                PosixFileAttributes posix = Files.readAttributes(path, PosixFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
                mode = PosixModes.toMode(posix.permissions());
                owner = posix.owner().getName();
            } else {
                owner = Files.getOwner(path, LinkOption.NOFOLLOW_LINKS).getName();
            }
            long size = type == EntryType.FILE ? attrs.size() : 0;
            return new ScannedEntry(path, relative, type, size, modified, mode, owner, null);
        }
    }

    // ==================== MODO POSIX ====================

    /**
     * Conversão entre {@link PosixFilePermission} e o inteiro octal gravado no manifest (ex.: 0644).
     */
    public static final class PosixModes {
        private static final PosixFilePermission[] ORDER = {
                PosixFilePermission.OWNER_READ, PosixFilePermission.OWNER_WRITE, PosixFilePermission.OWNER_EXECUTE,
                PosixFilePermission.GROUP_READ, PosixFilePermission.GROUP_WRITE, PosixFilePermission.GROUP_EXECUTE,
                PosixFilePermission.OTHERS_READ, PosixFilePermission.OTHERS_WRITE, PosixFilePermission.OTHERS_EXECUTE
        };

        private PosixModes() {}

        public static boolean supported(Path path) {
            return path.getFileSystem().supportedFileAttributeViews().contains("posix");
        }

        public static int toMode(Set<PosixFilePermission> permissions) {
            int mode = 0;
            for (int i = 0; i < ORDER.length; i++) {
                if (permissions.contains(ORDER[i])) {
                    mode |= 1 << (8 - i);
                }
            }
            return mode;
        }

        public static Set<PosixFilePermission> fromMode(int mode) {
            Set<PosixFilePermission> permissions = EnumSet.noneOf(PosixFilePermission.class);
            for (int i = 0; i < ORDER.length; i++) {
                if ((mode & (1 << (8 - i))) != 0) {
                    permissions.add(ORDER[i]);
                }
            }
            return permissions;
        }
    }
}
