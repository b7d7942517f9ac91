package com.example.backupengine.filter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.example.backupengine.error.BackupException;
import com.example.backupengine.filter.FileFilter.FilterOptions;

class FileFilterTest {

    private static Path p(String name) {
        return Paths.get("dir", name);
    }

    @Test
    @DisplayName("Sufixo .txt com limite de 500 bytes: a.txt passa, b.jpg e c.txt grande são excluídos")
    void suffixAndMaxSize() throws BackupException {
        FileFilter filter = FileFilter.compile(FilterOptions.builder()
                .suffix("txt")
                .maxSize(500)
                .build());

        assertThat(filter.matches(p("a.txt"), 100)).isTrue();
        assertThat(filter.matches(p("b.jpg"), 100)).isFalse();
        assertThat(filter.matches(p("c.txt"), 1000)).isFalse();
    }

    @Test
    void disabledFilterAcceptsEverythingRegardlessOfRules() throws BackupException {
        FileFilter filter = FileFilter.compile(FilterOptions.builder()
                .enabled(false)
                .suffix(".txt")
                .maxSize(1)
                .nameRegex("^nunca$")
                .build());

        assertThat(filter.matches(p("foto.jpg"), 10_000)).isTrue();
        assertThat(FileFilter.acceptAll().matches(p("qualquer"), Long.MAX_VALUE)).isTrue();
    }

    @Test
    void suffixesAreNormalizedAndCaseInsensitive() throws BackupException {
        FileFilter filter = FileFilter.compile(FilterOptions.builder().suffix("TXT").suffix(".Md").build());

        assertThat(filter.options().suffixes()).containsExactlyInAnyOrder(".txt", ".md");
        assertThat(filter.matches(p("LEIAME.MD"), 1)).isTrue();
        assertThat(filter.matches(p("notas.Txt"), 1)).isTrue();
        assertThat(filter.matches(p("semextensao"), 1)).isFalse();
    }

    @Test
    void regexSearchesInsideTheFileName() throws BackupException {
        FileFilter filter = FileFilter.compile(FilterOptions.builder().nameRegex("rel\\d{4}").build());

        assertThat(filter.matches(p("rel2024-final.pdf"), 1)).isTrue();
        assertThat(filter.matches(p("relatorio.pdf"), 1)).isFalse();
    }

    @Test
    void malformedRegexIsInvalidFilter() {
        FilterOptions options = FilterOptions.builder().nameRegex("([a-z").build();

        assertThatThrownBy(() -> FileFilter.compile(options))
                .isInstanceOf(BackupException.class)
                .extracting(e -> ((BackupException) e).kind())
                .isEqualTo(BackupException.Kind.INVALID_FILTER);
    }

    @Test
    void minSizeAndZeroMaxSizeMeaningUnbounded() throws BackupException {
        FileFilter filter = FileFilter.compile(FilterOptions.builder().minSize(10).build());

        assertThat(filter.matches(p("x.bin"), 9)).isFalse();
        assertThat(filter.matches(p("x.bin"), 10)).isTrue();
        assertThat(filter.matches(p("x.bin"), Long.MAX_VALUE)).isTrue();
    }

    @Test
    void negativeSizesAreRejected() {
        assertThatThrownBy(() -> FilterOptions.builder().maxSize(-1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void keywordsDateRangeAndOwnerOnlyApplyWhenKnown() throws BackupException {
        Instant after = Instant.parse("2024-01-01T00:00:00Z");
        FileFilter filter = FileFilter.compile(FilterOptions.builder()
                .nameKeyword("contrato")
                .modifiedAfter(after)
                .owner("alice")
                .build());

        assertThat(filter.matches(p("contrato-v2.doc"), 1, after.plusSeconds(60), "alice")).isTrue();
        assertThat(filter.matches(p("contrato-v2.doc"), 1, after.minusSeconds(60), "alice")).isFalse();
        assertThat(filter.matches(p("contrato-v2.doc"), 1, after.plusSeconds(60), "bob")).isFalse();
        assertThat(filter.matches(p("proposta.doc"), 1, after.plusSeconds(60), "alice")).isFalse();
        // data e dono desconhecidos: só nome e tamanho contam
        assertThat(filter.matches(p("contrato-v2.doc"), 1)).isTrue();
    }

    @Test
    void keywordsAreCombinedWithRegexNotSubstituted() throws BackupException {
        FileFilter filter = FileFilter.compile(FilterOptions.builder()
                .nameRegex("^relatorio")
                .nameKeyword("2024")
                .build());

        assertThat(filter.matches(p("relatorio-2024.pdf"), 1)).isTrue();
        assertThat(filter.matches(p("relatorio-2023.pdf"), 1)).isFalse();
        assertThat(filter.matches(p("resumo-2024.pdf"), 1)).isFalse();
    }

    @Test
    void extensionOfHandlesDotsAndHiddenFiles() {
        assertThat(FileFilter.extensionOf("arquivo.tar.GZ")).isEqualTo(".gz");
        assertThat(FileFilter.extensionOf("Makefile")).isEmpty();
    }
}
