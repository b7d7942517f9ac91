package com.example.backupengine;

import java.io.PrintStream;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.backupengine.archive.ArchiveFormat.ArchiveContents;
import com.example.backupengine.backup.BackupEngine;
import com.example.backupengine.codec.Compression.CompressionAlgorithm;
import com.example.backupengine.config.AppConfig;
import com.example.backupengine.error.BackupException;
import com.example.backupengine.tasks.BackupScheduler;
import com.fasterxml.jackson.core.JsonProcessingException;

/**
 * Entrada headless (sem UI): executa uma operação do motor ou mantém o agendador rodando até o processo
 * receber sinal de término.
 */
public final class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE = String.join(System.lineSeparator(),
            "Uso:",
            "  backup  <origem> <arquivo-destino>",
            "  restore <arquivo> <diretorio-destino>",
            "  verify  <arquivo>",
            "  list    <arquivo>",
            "  schedule <origem> <diretorio-destino> <prefixo> <intervaloSegundos> <manter>",
            "  watch   <origem> <diretorio-destino> <prefixo> <manter>",
            "Opções: --algo=HUFFMAN|LZSS|JOINED  --password-env=VARIAVEL");

    private final AppConfig config;
    private final PrintStream out;
    private final PrintStream err;

    public Main(AppConfig config, PrintStream out, PrintStream err) {
        this.config = Objects.requireNonNull(config, "config");
        this.out = Objects.requireNonNull(out, "out");
        this.err = Objects.requireNonNull(err, "err");
    }

    public static void main(String[] args) {
        AppConfig config = AppConfig.load();
        log.debug("Configuração: {}", config);
        System.exit(new Main(config, System.out, System.err).run(args));
    }

    /**
     * @return código de saída (0 sucesso, 1 falha, 2 uso incorreto)
     */
    public int run(String[] args) {
        List<String> positional = new ArrayList<>();
        CompressionAlgorithm algorithm = null;
        String password = config.password().orElse("");

        for (String arg : args) {
            if (arg.startsWith("--algo=")) {
                try {
                    algorithm = CompressionAlgorithm.parse(arg.substring("--algo=".length()));
                } catch (IllegalArgumentException e) {
                    return usage("Algoritmo desconhecido: " + arg);
                }
            } else if (arg.startsWith("--password-env=")) {
                String variable = arg.substring("--password-env=".length());
                password = config.find(variable).orElse(null);
                if (password == null) {
                    return usage("Variável de senha não definida: " + variable);
                }
            } else if (arg.startsWith("--")) {
                return usage("Opção desconhecida: " + arg);
            } else {
                positional.add(arg);
            }
        }
        if (positional.isEmpty()) {
            return usage(null);
        }

        String command = positional.get(0);
        List<String> params = positional.subList(1, positional.size());
        try {
            switch (command) {
                case "backup":
                    requireArgs(params, 2);
                    return exit(engine(algorithm, password).backup(path(params.get(0)), path(params.get(1))));
                case "restore":
                    requireArgs(params, 2);
                    return exit(engine(algorithm, password).restore(path(params.get(0)), path(params.get(1))));
                case "verify":
                    requireArgs(params, 1);
                    return exit(engine(algorithm, password).verify(path(params.get(0))));
                case "list":
                    requireArgs(params, 1);
                    return list(engine(algorithm, password), path(params.get(0)));
                case "schedule":
                    requireArgs(params, 5);
                    return serve(false, params, algorithm, password);
                case "watch":
                    requireArgs(params, 4);
                    return serve(true, params, algorithm, password);
                default:
                    return usage("Comando desconhecido: " + command);
            }
        } catch (IllegalArgumentException e) {
            return usage(e.getMessage());
        }
    }

    private BackupEngine engine(CompressionAlgorithm algorithm, String password) {
        BackupEngine engine = new BackupEngine(config);
        if (algorithm != null) {
            engine.setCompressionAlgorithm(algorithm);
        }
        engine.setPassword(password);
        return engine;
    }

    private int list(BackupEngine engine, Path archive) {
        try {
            ArchiveContents contents = engine.verifyArchive(archive);
            out.println(contents.manifest().toJson());
            return EXIT_OK;
        } catch (BackupException e) {
            err.println("Falha [" + e.kind() + "]: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (JsonProcessingException e) {
            err.println("Falha ao serializar manifest: " + e.getOriginalMessage());
            return EXIT_FAILURE;
        }
    }

    private int serve(boolean realtime, List<String> params, CompressionAlgorithm algorithm, String password) {
        Path src = path(params.get(0));
        Path dst = path(params.get(1));
        String prefix = params.get(2);
        BackupScheduler scheduler = new BackupScheduler(config);

        long id = realtime
                ? scheduler.addRealtimeTask(src, dst, prefix, parseInt(params.get(3), "manter"))
                : scheduler.addScheduledTask(src, dst, prefix, parseLong(params.get(3), "intervaloSegundos"),
                        parseInt(params.get(4), "manter"));
        if (id == BackupScheduler.INVALID_TASK_ID) {
            err.println("Não foi possível registrar a tarefa para " + src);
            return EXIT_FAILURE;
        }
        scheduler.setTaskPassword(id, password);
        if (algorithm != null) {
            scheduler.setTaskCompressionAlgorithm(id, algorithm);
        }

        CountDownLatch latch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            scheduler.stop();
            latch.countDown();
        }, "backup-shutdown"));
        scheduler.start();
        log.info("Agendador headless iniciado (tarefa {}). Ctrl+C para encerrar.", id);
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            scheduler.stop();
        }
        return EXIT_OK;
    }

    private int exit(boolean ok) {
        return ok ? EXIT_OK : EXIT_FAILURE;
    }

    private int usage(String problem) {
        if (problem != null) {
            err.println(problem);
        }
        err.println(USAGE);
        return EXIT_USAGE;
    }

    private static void requireArgs(List<String> params, int expected) {
        if (params.size() != expected) {
            throw new IllegalArgumentException("Esperados " + expected + " argumentos, recebidos " + params.size());
        }
    }

    private static Path path(String raw) {
        try {
            return Paths.get(raw);
        } catch (InvalidPathException e) {
            throw new IllegalArgumentException("Caminho inválido: " + raw, e);
        }
    }

    private static int parseInt(String raw, String name) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " deve ser inteiro: " + raw, e);
        }
    }

    private static long parseLong(String raw, String name) {
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " deve ser inteiro: " + raw, e);
        }
    }
}
