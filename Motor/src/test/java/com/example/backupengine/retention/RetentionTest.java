package com.example.backupengine.retention;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.example.backupengine.error.BackupException;
import com.example.backupengine.retention.Retention.ArchiveNaming;
import com.example.backupengine.retention.Retention.RetentionManager;

class RetentionTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2024, 3, 10, 8, 30, 0);

    @TempDir
    Path dst;

    private final RetentionManager retention = new RetentionManager();

    private List<String> names() throws Exception {
        try (Stream<Path> listing = Files.list(dst)) {
            return listing.map(p -> p.getFileName().toString()).sorted().collect(Collectors.toList());
        }
    }

    private Path archive(String prefix, LocalDateTime when) throws Exception {
        return Files.write(dst.resolve(ArchiveNaming.fileName(prefix, when)), new byte[]{1});
    }

    @Test
    void keepsTheThreeNewestOfSeven() throws Exception {
        List<String> created = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            created.add(archive("docs", T0.plusMinutes(i)).getFileName().toString());
        }

        List<Path> deleted = retention.prune(dst, "docs", 3);

        assertThat(deleted).hasSize(4);
        assertThat(names()).containsExactlyElementsOf(created.subList(4, 7));
    }

    @Test
    void ordersByEmbeddedTimestampNotByModificationTime() throws Exception {
        Path newest = archive("docs", T0.plusDays(1));
        Path oldest = archive("docs", T0);
        Files.setLastModifiedTime(oldest, Files.getLastModifiedTime(newest));
        archive("docs", T0.plusHours(1));

        retention.prune(dst, "docs", 2);

        assertThat(dst.resolve(oldest.getFileName())).doesNotExist();
        assertThat(newest).exists();
    }

    @Test
    void onlyTouchesFilesOfTheSamePrefix() throws Exception {
        for (int i = 0; i < 4; i++) {
            archive("docs", T0.plusSeconds(i));
            archive("fotos", T0.plusSeconds(i));
        }
        archive("docs_extra", T0.plusSeconds(9));
        Files.writeString(dst.resolve("docs_notas.txt"), "não é backup");
        Files.writeString(dst.resolve("docs_lixo.bin"), "timestamp inválido");

        retention.prune(dst, "docs", 1);

        assertThat(names())
                .contains(ArchiveNaming.fileName("docs", T0.plusSeconds(3)), "docs_notas.txt", "docs_lixo.bin",
                        ArchiveNaming.fileName("docs_extra", T0.plusSeconds(9)))
                .filteredOn(n -> n.startsWith("fotos_")).hasSize(4);
        assertThat(names()).filteredOn(n -> n.startsWith("docs_2")).hasSize(1);
    }

    @Test
    void nonPositiveKeepCountDisablesPruning() throws Exception {
        for (int i = 0; i < 3; i++) {
            archive("docs", T0.plusSeconds(i));
        }

        assertThat(retention.prune(dst, "docs", 0)).isEmpty();
        assertThat(retention.prune(dst, "docs", -1)).isEmpty();
        assertThat(names()).hasSize(3);
    }

    @Test
    void namingRoundTripsTheTimestamp() {
        LocalDateTime when = LocalDateTime.of(2023, 12, 31, 23, 59, 58, 123_000_000);
        String name = ArchiveNaming.fileName("proj", when);

        assertThat(name).isEqualTo("proj_20231231_235958_123.bin");
        assertThat(ArchiveNaming.parseTimestamp(name, "proj")).contains(when);
        assertThat(ArchiveNaming.parseTimestamp(name, "pro")).isEmpty();
        assertThat(ArchiveNaming.parseTimestamp("proj_2023.bin", "proj")).isEmpty();
    }

    @Test
    void nextPathNeverCollidesNorGoesBackInTime() throws Exception {
        Path first = ArchiveNaming.nextArchivePath(dst, "docs", T0);
        Files.write(first, new byte[0]);

        Path sameInstant = ArchiveNaming.nextArchivePath(dst, "docs", T0);
        assertThat(sameInstant).isNotEqualTo(first);
        Files.write(sameInstant, new byte[0]);

        Path clockBehind = ArchiveNaming.nextArchivePath(dst, "docs", T0.minusHours(1));
        assertThat(ArchiveNaming.parseTimestamp(clockBehind.getFileName().toString(), "docs").orElseThrow())
                .isAfter(ArchiveNaming.parseTimestamp(sameInstant.getFileName().toString(), "docs").orElseThrow());
    }

    @Test
    void rejectsPrefixesThatCouldEscapeTheDirectory() {
        assertThatThrownBy(() -> ArchiveNaming.fileName("../x", T0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ArchiveNaming.fileName(" ", T0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void missingDirectoryIsInvalidPath() {
        assertThatThrownBy(() -> retention.prune(dst.resolve("nada"), "docs", 3))
                .isInstanceOfSatisfying(BackupException.class,
                        e -> assertThat(e.kind()).isEqualTo(BackupException.Kind.INVALID_PATH));
    }
}
