package com.example.backupengine.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;

import org.junit.jupiter.api.Test;

import com.example.backupengine.codec.Compression.CompressionAlgorithm;

class AppConfigTest {

    @Test
    void defaultsWhenNothingIsConfigured() {
        AppConfig config = AppConfig.fromMap(Map.of());

        assertThat(config.defaultAlgorithm()).isEqualTo(CompressionAlgorithm.LZSS);
        assertThat(config.kdfIterations()).isEqualTo(210_000);
        assertThat(config.hashAlgorithm()).isEqualTo("SHA-256");
        assertThat(config.maxManifestBytes()).isEqualTo(64L * 1024 * 1024);
        assertThat(config.password()).isEmpty();
        assertThat(config.workerThreads()).isEqualTo(4);
        assertThat(config.debounceMillis()).isEqualTo(2000);
        assertThat(config.pollIntervalMillis()).isEqualTo(1000);
    }

    @Test
    void numericValuesAreClampedAndGarbageFallsBackToDefault() {
        AppConfig config = AppConfig.fromMap(Map.of(
                AppConfig.KDF_ITERATIONS, "5",
                AppConfig.WORKER_THREADS, "1000",
                AppConfig.DEBOUNCE_MS, "abc",
                AppConfig.MAX_MANIFEST_MB, " 8 "));

        assertThat(config.kdfIterations()).isEqualTo(10_000);
        assertThat(config.workerThreads()).isEqualTo(64);
        assertThat(config.debounceMillis()).isEqualTo(2000);
        assertThat(config.maxManifestBytes()).isEqualTo(8L * 1024 * 1024);
    }

    @Test
    void algorithmAcceptsNameOrIdAndRejectsUnknown() {
        assertThat(AppConfig.fromMap(Map.of(AppConfig.DEFAULT_ALGORITHM, "huffman")).defaultAlgorithm())
                .isEqualTo(CompressionAlgorithm.HUFFMAN);
        assertThat(AppConfig.fromMap(Map.of(AppConfig.DEFAULT_ALGORITHM, "2")).defaultAlgorithm())
                .isEqualTo(CompressionAlgorithm.JOINED);
        assertThatThrownBy(() -> AppConfig.fromMap(Map.of(AppConfig.DEFAULT_ALGORITHM, "zip")).defaultAlgorithm())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining(AppConfig.DEFAULT_ALGORITHM);
    }

    @Test
    void overridesWinAndCanBeRemoved() {
        AppConfig config = AppConfig.fromMap(Map.of(AppConfig.HASH_ALGORITHM, "SHA-512"));

        config.override(AppConfig.HASH_ALGORITHM, "SHA-256");
        assertThat(config.hashAlgorithm()).isEqualTo("SHA-256");

        config.override(AppConfig.HASH_ALGORITHM, null);
        assertThat(config.hashAlgorithm()).isEqualTo("SHA-512");
    }

    @Test
    void blankValuesCountAsMissing() {
        AppConfig config = AppConfig.fromMap(Map.of(AppConfig.BACKUP_PASSWORD, "   "));

        assertThat(config.password()).isEmpty();
        assertThatThrownBy(() -> config.require(AppConfig.BACKUP_PASSWORD))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void toStringNeverShowsThePassword() {
        AppConfig config = AppConfig.fromMap(Map.of(
                AppConfig.BACKUP_PASSWORD, "super-secreta",
                AppConfig.DEFAULT_ALGORITHM, "invalido"));

        assertThat(config.toString())
                .contains("password=set", "algorithm=error:IllegalStateException")
                .doesNotContain("super-secreta");
    }

    @Test
    void boolAcceptsCommonSpellings() {
        AppConfig config = AppConfig.fromMap(Map.of("A", "YES", "B", "1", "C", "nao"));

        assertThat(config.bool("A", false)).isTrue();
        assertThat(config.bool("B", false)).isTrue();
        assertThat(config.bool("C", true)).isFalse();
        assertThat(config.bool("D", true)).isTrue();
    }
}
