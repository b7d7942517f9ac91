package com.example.backupengine.retention;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.backupengine.error.BackupException;
import com.example.backupengine.error.BackupException.Kind;

/**
 * Nomes dos arquivos gerados pelo agendador e a política de retenção sobre eles.
 */
public final class Retention {

    private Retention() {}

    // ==================================================================================
    // NOMES
    // ==================================================================================

    /**
     * Formato {@code <prefixo>_<yyyyMMdd_HHmmss_SSS>.bin}. O timestamp embutido é o que ordena a retenção,
     * não a data de modificação do arquivo.
     */
    public static final class ArchiveNaming {
        public static final String SUFFIX = ".bin";
        private static final String SEPARATOR = "_";
        private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");
        private static final int STAMP_LENGTH = "yyyyMMdd_HHmmss_SSS".length();

        private ArchiveNaming() {}

        public static String fileName(String prefix, LocalDateTime timestamp) {
            validatePrefix(prefix);
            Objects.requireNonNull(timestamp, "timestamp");
            return prefix + SEPARATOR + STAMP.format(timestamp) + SUFFIX;
        }

        /**
         * Próximo caminho livre em {@code dst}, nunca mais antigo que o arquivo mais recente do prefixo
         * (relógio parado ou atrasado não pode gerar um nome que a retenção apagaria primeiro). Se o nome já
         * existe, avança o timestamp 1 ms por vez. Quem chama deve segurar o lock do destino até o arquivo existir.
         */
        public static Path nextArchivePath(Path dst, String prefix, LocalDateTime now) throws BackupException {
            Objects.requireNonNull(dst, "dst");
            Objects.requireNonNull(now, "now");
            LocalDateTime stamp = now.truncatedTo(ChronoUnit.MILLIS);
            Optional<LocalDateTime> newest = newestTimestamp(dst, prefix);
            if (newest.isPresent() && !stamp.isAfter(newest.get())) {
                stamp = newest.get().plus(1, ChronoUnit.MILLIS);
            }
            Path candidate = dst.resolve(fileName(prefix, stamp));
            while (Files.exists(candidate, LinkOption.NOFOLLOW_LINKS)) {
                stamp = stamp.plus(1, ChronoUnit.MILLIS);
                candidate = dst.resolve(fileName(prefix, stamp));
            }
            return candidate;
        }

        private static Optional<LocalDateTime> newestTimestamp(Path dst, String prefix) throws BackupException {
            LocalDateTime newest = null;
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(dst)) {
                for (Path p : stream) {
                    Optional<LocalDateTime> ts = parseTimestamp(p.getFileName().toString(), prefix);
                    if (ts.isPresent() && (newest == null || ts.get().isAfter(newest))) {
                        newest = ts.get();
                    }
                }
            } catch (IOException e) {
                throw BackupException.classify(e, "Falha ao listar " + dst);
            }
            return Optional.ofNullable(newest);
        }

        /**
         * Extrai o timestamp de um nome gerado por {@link #fileName}. Vazio se o nome não pertence ao prefixo.
         */
        public static Optional<LocalDateTime> parseTimestamp(String fileName, String prefix) {
            if (fileName == null || prefix == null) {
                return Optional.empty();
            }
            String head = prefix + SEPARATOR;
            if (!fileName.startsWith(head) || !fileName.endsWith(SUFFIX)) {
                return Optional.empty();
            }
            String stamp = fileName.substring(head.length(), fileName.length() - SUFFIX.length());
            if (stamp.length() != STAMP_LENGTH) {
                return Optional.empty();
            }
            try {
                return Optional.of(LocalDateTime.parse(stamp, STAMP));
            } catch (DateTimeParseException e) {
                return Optional.empty();
            }
        }

        public static void validatePrefix(String prefix) {
            Objects.requireNonNull(prefix, "prefix");
            if (prefix.isBlank() || prefix.contains("/") || prefix.contains("\\") || prefix.startsWith(".")) {
                throw new IllegalArgumentException("Prefixo inválido: '" + prefix + "'");
            }
        }
    }

    // ==================================================================================
    // RETENÇÃO
    // ==================================================================================

    /**
     * Remove os arquivos mais antigos de um prefixo, mantendo os {@code keepCount} mais recentes.
     */
    public static final class RetentionManager {
        private static final Logger log = LoggerFactory.getLogger(RetentionManager.class);

        /** Mais novo primeiro; empate de timestamp resolve pelo nome. */
        private static final Comparator<Candidate> NEWEST_FIRST =
                Comparator.comparing(Candidate::timestamp).reversed()
                        .thenComparing(c -> c.path().getFileName().toString());

        /**
         * @return arquivos apagados, do mais novo para o mais antigo
         */
        public List<Path> prune(Path dst, String prefix, int keepCount) throws BackupException {
            Objects.requireNonNull(dst, "dst");
            ArchiveNaming.validatePrefix(prefix);
            if (keepCount <= 0) {
                log.debug("Retenção desativada para {} ({}): keepCount={}", dst, prefix, keepCount);
                return List.of();
            }

            List<Candidate> candidates = new ArrayList<>();
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(dst)) {
                for (Path p : stream) {
                    if (!Files.isRegularFile(p, LinkOption.NOFOLLOW_LINKS)) {
                        continue;
                    }
                    ArchiveNaming.parseTimestamp(p.getFileName().toString(), prefix)
                            .ifPresent(ts -> candidates.add(new Candidate(p, ts)));
                }
            } catch (IOException e) {
                throw BackupException.classify(e, "Falha ao listar " + dst);
            }

            if (candidates.size() <= keepCount) {
                return List.of();
            }
            candidates.sort(NEWEST_FIRST);

            List<Path> deleted = new ArrayList<>();
            IOException firstError = null;
            for (Candidate c : candidates.subList(keepCount, candidates.size())) {
                try {
                    Files.deleteIfExists(c.path());
                    deleted.add(c.path());
                    log.info("Retenção: removido {}", c.path().getFileName());
                } catch (IOException e) {
                    log.warn("Retenção: não foi possível remover {}: {}", c.path(), e.toString());
                    if (firstError == null) {
                        firstError = e;
                    } else {
                        firstError.addSuppressed(e);
                    }
                }
            }
            if (firstError != null) {
                throw BackupException.classify(firstError, "Retenção incompleta em " + dst);
            }
            return deleted;
        }

        private static final class Candidate {
            private final Path path;
            private final LocalDateTime timestamp;

            Candidate(Path path, LocalDateTime timestamp) {
                this.path = path;
                this.timestamp = timestamp;
            }

            Path path() { return path; }
            LocalDateTime timestamp() { return timestamp; }
        }
    }
}
