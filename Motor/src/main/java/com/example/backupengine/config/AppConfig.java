package com.example.backupengine.config;

import io.github.cdimascio.dotenv.Dotenv;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import com.example.backupengine.codec.Compression.CompressionAlgorithm;

/**
 * AppConfig
 * ----------
 * Responsável por carregar, validar e expor configurações do motor e do agendador.
 *
 * PRINCÍPIOS:
 * - Falhar cedo (validar assim que possível).
 * - Evitar "strings mágicas" (constantes centralizadas).
 * - Precedência previsível: overrides > System properties > variáveis de ambiente > .env.
 * - Métodos tipados com limites (int/long/MB).
 * - Sem vazamento de segredos em logs (toString() sanitizado).
 */
public final class AppConfig {

    // ======= CHAVES DE CONFIGURAÇÃO =======

    /** Algoritmo de compressão padrão: HUFFMAN, LZSS ou JOINED (ou o id numérico). */
    public static final String DEFAULT_ALGORITHM = "BACKUP_DEFAULT_ALGORITHM";
    /** Iterações do PBKDF2. */
    public static final String KDF_ITERATIONS = "BACKUP_KDF_ITERATIONS";
    /** Algoritmo de hash dos checksums por entrada (ex.: SHA-256). */
    public static final String HASH_ALGORITHM = "BACKUP_HASH_ALGORITHM";
    /** Tamanho máximo (MB) aceito para o manifest ao ler um arquivo. */
    public static final String MAX_MANIFEST_MB = "BACKUP_MAX_MANIFEST_MB";
    /** Senha usada pela CLI quando nenhuma outra é informada. NÃO logar. */
    public static final String BACKUP_PASSWORD = "BACKUP_PASSWORD";

    /** Threads do pool que executa os disparos do agendador. */
    public static final String WORKER_THREADS = "SCHEDULER_WORKER_THREADS";
    /** Janela de debounce (ms) das tarefas em tempo real. */
    public static final String DEBOUNCE_MS = "REALTIME_DEBOUNCE_MS";
    /** Intervalo (ms) de varredura do monitor de diretórios. */
    public static final String POLL_INTERVAL_MS = "REALTIME_POLL_INTERVAL_MS";

    // ======= ARMAZENAMENTO INTERNO =======

    /** Overrides em runtime (ex.: testes). Têm precedência sobre qualquer fonte. */
    private final ConcurrentHashMap<String, String> overrides = new ConcurrentHashMap<>();

    /** Valores efetivos carregados. */
    private final ConcurrentHashMap<String, String> values;

    // ======= CONSTRUÇÃO / CARGA =======

    private AppConfig(Map<String, String> values) {
        this.values = new ConcurrentHashMap<>(values);
    }

    /**
     * Carrega configurações de três fontes, com a seguinte precedência:
     * 1) System properties (java -Dchave=valor)
     * 2) Variáveis de ambiente (System.getenv)
     * 3) Arquivo .env (se existir)
     */
    public static AppConfig load() {
        Dotenv dotenv = Dotenv.configure()
                .ignoreIfMissing()
                .load();

        Map<String, String> map = new ConcurrentHashMap<>();

        // 1) .env (menor prioridade)
        dotenv.entries().forEach(e -> map.put(e.getKey(), e.getValue()));

        // 2) Variáveis de ambiente
        System.getenv().forEach(map::put);

        // 3) System properties (maior prioridade)
        System.getProperties().forEach((k, v) -> {
            if (k != null && v != null) {
                map.put(String.valueOf(k), String.valueOf(v));
            }
        });

        return new AppConfig(map);
    }

    /**
     * Útil para testes: cria AppConfig a partir de um Map já resolvido.
     */
    public static AppConfig fromMap(Map<String, String> values) {
        return new AppConfig(values);
    }

    // ======= API BÁSICA DE ACESSO =======

    /**
     * Busca valor (overrides > values) e devolve Optional sem brancos.
     */
    public Optional<String> find(String key) {
        Objects.requireNonNull(key, "key");
        String override = overrides.get(key);
        if (override != null) {
            return Optional.of(override);
        }
        String value = values.get(key);
        return value != null && !value.isBlank() ? Optional.of(value.trim()) : Optional.empty();
    }

    /**
     * Busca valor obrigatório; lança IllegalStateException se ausente.
     */
    public String require(String key) {
        return find(key).orElseThrow(() -> new IllegalStateException("Configuração obrigatória ausente: " + key));
    }

    public String getOrDefault(String key, String defaultValue) {
        return find(key).orElse(defaultValue);
    }

    /**
     * Seta/remove override em runtime. Se value==null, remove o override.
     */
    public void override(String key, String value) {
        if (value == null) {
            overrides.remove(key);
        } else {
            overrides.put(key, value);
        }
    }

    // ======= GETTERS ESPECÍFICOS (COM VALIDAÇÃO) =======

    /**
     * Algoritmo de compressão padrão. Valor desconhecido falha cedo.
     */
    public CompressionAlgorithm defaultAlgorithm() {
        String raw = getOrDefault(DEFAULT_ALGORITHM, CompressionAlgorithm.LZSS.name());
        try {
            return CompressionAlgorithm.parse(raw);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException(DEFAULT_ALGORITHM + " inválido: " + raw, e);
        }
    }

    /** Iterações do PBKDF2. Limites: [10000, 10000000]. Padrão 210000. */
    public int kdfIterations() {
        return intConfig(KDF_ITERATIONS, 210_000, 10_000, 10_000_000);
    }

    /** Algoritmo de hash para checksums (ex.: "SHA-256"). */
    public String hashAlgorithm() {
        return getOrDefault(HASH_ALGORITHM, "SHA-256");
    }

    /** Limite do manifest em bytes. Padrão 64 MB, mínimo 1 MB. */
    public long maxManifestBytes() {
        return longConfig(MAX_MANIFEST_MB, 64, 1, 2047) * 1024L * 1024L;
    }

    /** Senha padrão (opcional). */
    public Optional<String> password() {
        return find(BACKUP_PASSWORD);
    }

    /** Threads de execução do agendador. Limites: [1, 64]. Padrão 4. */
    public int workerThreads() {
        return intConfig(WORKER_THREADS, 4, 1, 64);
    }

    /** Debounce das tarefas em tempo real. Limites: [100, 600000]. Padrão 2000 ms. */
    public long debounceMillis() {
        return longConfig(DEBOUNCE_MS, 2000, 100, 600_000);
    }

    /** Intervalo do monitor de diretórios. Limites: [100, 60000]. Padrão 1000 ms. */
    public long pollIntervalMillis() {
        return longConfig(POLL_INTERVAL_MS, 1000, 100, 60_000);
    }

    // ======= HELPERS TIPADOS =======

    /**
     * Lê uma flag booleana tolerante a formatos:
     * "true/1/yes" (case-insensitive) → true; senão, false.
     */
    public boolean bool(String key, boolean def) {
        String raw = getOrDefault(key, Boolean.toString(def));
        return raw.equalsIgnoreCase("true")
                || raw.equalsIgnoreCase("1")
                || raw.equalsIgnoreCase("yes");
    }

    /** Parser long com faixa [min, max]; se inválido, retorna default. */
    private long longConfig(String key, long def, long min, long max) {
        String raw = getOrDefault(key, Long.toString(def));
        try {
            long v = Long.parseLong(raw.trim());
            if (v < min) return min;
            if (v > max) return max;
            return v;
        } catch (NumberFormatException e) {
            return def;
        }
    }

    /** Parser int com faixa [min, max]; se inválido, retorna default. */
    private int intConfig(String key, int def, int min, int max) {
        String raw = getOrDefault(key, Integer.toString(def));
        try {
            int v = Integer.parseInt(raw.trim());
            if (v < min) return min;
            if (v > max) return max;
            return v;
        } catch (NumberFormatException e) {
            return def;
        }
    }

    // ======= LOGGING SEGURO =======

    /**
     * Representação segura para logs: nunca inclui a senha, só se ela está "set/unset".
     */
    @Override
    public String toString() {
        String algo = safe(() -> defaultAlgorithm().name());
        return "AppConfig{" +
                "algorithm=" + algo +
                ", kdfIterations=" + kdfIterations() +
                ", hash=" + hashAlgorithm() +
                ", maxManifestMB=" + maxManifestBytes() / (1024 * 1024) +
                ", workers=" + workerThreads() +
                ", debounceMs=" + debounceMillis() +
                ", pollMs=" + pollIntervalMillis() +
                ", password=" + (password().isPresent() ? "set" : "unset") +
                "}";
    }

    /** Helper para não explodir toString() caso getters lancem. */
    private static String safe(SupplierLike supplier) {
        try { return supplier.get(); } catch (RuntimeException e) { return "error:" + e.getClass().getSimpleName(); }
    }

    @FunctionalInterface
    private interface SupplierLike { String get(); }
}
