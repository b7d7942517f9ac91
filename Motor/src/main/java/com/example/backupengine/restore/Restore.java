package com.example.backupengine.restore;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.backupengine.archive.ArchiveFormat.ArchiveContents;
import com.example.backupengine.archive.ArchiveFormat.EntryKind;
import com.example.backupengine.archive.ArchiveFormat.ManifestEntry;
import com.example.backupengine.error.BackupException;
import com.example.backupengine.error.BackupException.Kind;
import com.example.backupengine.scan.Scanner.PosixModes;

/**
 * Agrega as classes do fluxo de restauração.
 * <p>
 * A árvore é materializada inteira num diretório de staging e só então publicada (rename ou mescla
 * com rollback). Uma falha no meio nunca deixa árvore parcial no destino.
 */
public final class Restore {

    private Restore() {}

    // ==================================================================================
    // DTOs
    // ==================================================================================

    /** Resumo de uma restauração concluída. */
    public static final class RestoreReport {
        private final Path destination;
        private final int files;
        private final int directories;
        private final int symlinks;
        private final long bytes;

        public RestoreReport(Path destination, int files, int directories, int symlinks, long bytes) {
            this.destination = Objects.requireNonNull(destination, "destination");
            this.files = files;
            this.directories = directories;
            this.symlinks = symlinks;
            this.bytes = bytes;
        }

        public Path destination() { return destination; }
        public int files() { return files; }
        public int directories() { return directories; }
        public int symlinks() { return symlinks; }
        public long bytes() { return bytes; }

        @Override
        public String toString() {
            return "RestoreReport{destino=" + destination + ", arquivos=" + files + ", diretorios=" + directories
                    + ", symlinks=" + symlinks + ", bytes=" + bytes + "}";
        }
    }

    // ==================================================================================
    // EXECUTOR
    // ==================================================================================

    /**
     * Reconstrói a árvore descrita pelo manifest sob o destino.
     */
    public static final class RestoreExecutor {
        private static final Logger log = LoggerFactory.getLogger(RestoreExecutor.class);

        /**
         * Restaura {@code contents} em {@code destination}.
         * <p>
         * Se o destino não existe, o staging vira o destino por rename atômico. Se existe, o staging é
         * mesclado nele: arquivos do arquivo de backup sobrescrevem os do destino, o resto fica intacto.
         */
        public RestoreReport restore(ArchiveContents contents, Path destination) throws BackupException {
            Objects.requireNonNull(contents, "contents");
            Objects.requireNonNull(destination, "destination");

            List<String> mismatches = contents.checksumMismatches();
            if (!mismatches.isEmpty()) {
                throw new BackupException(Kind.CORRUPT_ARCHIVE, "Checksum divergente em: " + mismatches);
            }

            Path target = destination.toAbsolutePath().normalize();
            Path staging = null;
            try {
                // 1. Preparação (Atomicidade)
                boolean targetExists = Files.exists(target, LinkOption.NOFOLLOW_LINKS);
                if (targetExists && !Files.isDirectory(target, LinkOption.NOFOLLOW_LINKS)) {
                    throw new BackupException(Kind.INVALID_PATH, "Destino existe e não é diretório: " + target);
                }
                Path parent = target.getParent();
                if (parent == null) {
                    throw new BackupException(Kind.INVALID_PATH, "Destino inválido: " + destination);
                }
                if (targetExists) {
                    staging = Files.createTempDirectory(target, ".restore-staging-");
                } else {
                    Files.createDirectories(parent);
                    staging = Files.createTempDirectory(parent, "." + target.getFileName() + ".restore-");
                }

                // 2. Materialização
                RestoreReport counts = materialize(contents, staging, target);

                // 3. Publicação
                if (targetExists) {
                    publishInto(staging, target);
                } else {
                    moveAtomically(staging, target);
                    staging = null;
                }

                // 4. Modos e datas dos diretórios por último (filhos antes dos pais)
                applyDirectoryAttributes(contents.entries(), target);

                log.info("Restore concluído: {}", counts);
                return counts;
            } catch (IOException e) {
                throw BackupException.classify(e, "Falha ao restaurar em " + target);
            } finally {
                cleanup(staging);
            }
        }

        private RestoreReport materialize(ArchiveContents contents, Path staging, Path target) throws IOException {
            byte[] payload = contents.payload();
            int files = 0;
            int directories = 0;
            int symlinks = 0;
            long bytes = 0;

            for (ManifestEntry entry : contents.entries()) {
                Path path = resolveInside(staging, entry.path());
                switch (entry.kind()) {
                    case DIRECTORY:
                        Files.createDirectories(path);
                        directories++;
                        break;
                    case FILE:
                        createParents(path);
                        try (OutputStream out = Files.newOutputStream(path, StandardOpenOption.CREATE_NEW,
                                StandardOpenOption.WRITE)) {
                            out.write(payload, contents.offsetOf(entry), (int) entry.size());
                        }
                        applyMode(path, entry.mode());
                        if (entry.modifiedAt() > 0) {
                            Files.setLastModifiedTime(path, FileTime.fromMillis(entry.modifiedAt()));
                        }
                        files++;
                        bytes += entry.size();
                        break;
                    case SYMLINK:
                        createParents(path);
                        Files.createSymbolicLink(path, path.getFileSystem().getPath(entry.linkTarget()));
                        symlinks++;
                        break;
                    default:
                        throw new BackupException(Kind.CORRUPT_ARCHIVE, "Tipo de entrada desconhecido: " + entry.kind());
                }
            }
            return new RestoreReport(target, files, directories, symlinks, bytes);
        }

        /**
         * Mescla o staging no destino existente. Diretórios que já existem recebem o conteúdo; arquivos e
         * symlinks existentes são substituídos, mas antes vão para um diretório de guarda, de onde voltam se
         * algum movimento falhar. Tipos incompatíveis (diretório contra arquivo) abortam antes de mover nada.
         */
        private void publishInto(Path staging, Path target) throws IOException {
            checkCompatible(staging, target);

            Path previous = Files.createTempDirectory(target, ".restore-previous-");
            List<Move> done = new ArrayList<>();
            boolean restored = true;
            try {
                merge(staging, target, previous, done);
            } catch (IOException | RuntimeException e) {
                restored = rollback(done, e);
                throw e;
            } finally {
                if (restored) {
                    cleanup(previous);
                } else {
                    log.error("Originais substituídos preservados em {}", previous);
                }
            }
            log.debug("Restore mesclado em {}: {} movimento(s)", target, done.size());
        }

        private void checkCompatible(Path stagedDir, Path finalDir) throws IOException {
            for (Path staged : children(stagedDir)) {
                Path finalPath = finalDir.resolve(staged.getFileName().toString());
                if (!Files.exists(finalPath, LinkOption.NOFOLLOW_LINKS)) {
                    continue;
                }
                boolean stagedIsDir = Files.isDirectory(staged, LinkOption.NOFOLLOW_LINKS);
                boolean finalIsDir = Files.isDirectory(finalPath, LinkOption.NOFOLLOW_LINKS);
                if (stagedIsDir != finalIsDir) {
                    throw new BackupException(Kind.INVALID_PATH, "Tipo incompatível no destino: " + finalPath,
                            new FileAlreadyExistsException(finalPath.toString()));
                }
                if (stagedIsDir) {
                    checkCompatible(staged, finalPath);
                }
            }
        }

        private void merge(Path stagedDir, Path finalDir, Path previousDir, List<Move> done) throws IOException {
            for (Path staged : children(stagedDir)) {
                String name = staged.getFileName().toString();
                Path finalPath = finalDir.resolve(name);
                boolean exists = Files.exists(finalPath, LinkOption.NOFOLLOW_LINKS);

                if (exists && Files.isDirectory(staged, LinkOption.NOFOLLOW_LINKS)) {
                    merge(staged, finalPath, previousDir.resolve(name), done);
                    continue;
                }
                if (exists) {
                    Path kept = previousDir.resolve(name);
                    Files.createDirectories(previousDir);
                    moveAtomically(finalPath, kept);
                    done.add(new Move(finalPath, kept));
                }
                moveAtomically(staged, finalPath);
                done.add(new Move(staged, finalPath));
            }
        }

        /** Desfaz os movimentos do mais recente ao mais antigo. Retorna false se algum não pôde ser desfeito. */
        private boolean rollback(List<Move> done, Exception cause) {
            boolean complete = true;
            for (int i = done.size() - 1; i >= 0; i--) {
                Move move = done.get(i);
                try {
                    moveAtomically(move.to, move.from);
                } catch (IOException e) {
                    complete = false;
                    cause.addSuppressed(e);
                    log.error("Rollback falhou para {}: {}", move.to, e.toString());
                }
            }
            return complete;
        }

        private static List<Path> children(Path dir) throws IOException {
            try (Stream<Path> listing = Files.list(dir)) {
                return listing.sorted().collect(Collectors.toList());
            }
        }

        private void applyDirectoryAttributes(List<ManifestEntry> entries, Path target) throws IOException {
            for (int i = entries.size() - 1; i >= 0; i--) {
                ManifestEntry entry = entries.get(i);
                if (entry.kind() != EntryKind.DIRECTORY) {
                    continue;
                }
                Path dir = resolveInside(target, entry.path());
                if (entry.modifiedAt() > 0) {
                    Files.setLastModifiedTime(dir, FileTime.fromMillis(entry.modifiedAt()));
                }
                applyMode(dir, entry.mode());
            }
        }

        private static void applyMode(Path path, int mode) throws IOException {
            if (mode >= 0 && PosixModes.supported(path)) {
                Files.setPosixFilePermissions(path, PosixModes.fromMode(mode));
            }
        }

        private static void createParents(Path path) throws IOException {
            Path parent = path.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        }

        /** O manifest já foi validado, mas o destino final nunca pode escapar da raiz. */
        private static Path resolveInside(Path root, String relative) throws BackupException {
            Path resolved = root.resolve(relative).normalize();
            if (!resolved.startsWith(root) || resolved.equals(root)) {
                throw new BackupException(Kind.CORRUPT_ARCHIVE, "Caminho escapa do destino: " + relative);
            }
            return resolved;
        }

        private static void moveAtomically(Path source, Path destination) throws IOException {
            try {
                // Tenta rename atômico (rápido e seguro)
                Files.move(source, destination, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(source, destination);
            }
        }

        private void cleanup(Path staging) {
            if (staging == null || !Files.exists(staging, LinkOption.NOFOLLOW_LINKS)) {
                return;
            }
            try (Stream<Path> walk = Files.walk(staging)) {
                walk.sorted(Comparator.reverseOrder()).forEach(p -> {
                    try {
                        Files.deleteIfExists(p);
                    } catch (IOException e) {
                        log.warn("Não foi possível remover {} do staging: {}", p, e.toString());
                    }
                });
            } catch (IOException e) {
                log.warn("Falha ao limpar staging {}: {}", staging, e.toString());
            }
        }

        private static final class Move {
            final Path from;
            final Path to;

            Move(Path from, Path to) {
                this.from = from;
                this.to = to;
            }
        }
    }
}
