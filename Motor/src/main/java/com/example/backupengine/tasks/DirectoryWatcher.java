package com.example.backupengine.tasks;

import java.io.File;
import java.io.FileFilter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.commons.io.monitor.FileAlterationListenerAdaptor;
import org.apache.commons.io.monitor.FileAlterationMonitor;
import org.apache.commons.io.monitor.FileAlterationObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.backupengine.error.BackupException;
import com.example.backupengine.error.BackupException.Kind;

/**
 * Observa uma árvore por polling (commons-io) e avisa a cada criação, alteração ou remoção.
 * <p>
 * O callback roda na thread do monitor e deve ser rápido; o debounce fica com quem chama.
 * Uma subárvore ignorada (o destino dos backups, quando fica dentro da origem) é podada da varredura.
 */
final class DirectoryWatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DirectoryWatcher.class);
    private static final AtomicInteger THREAD_SEQ = new AtomicInteger();

    private final Path source;
    private final Path ignored;
    private final long pollIntervalMillis;
    private final Runnable onChange;
    private FileAlterationMonitor monitor;

    DirectoryWatcher(Path source, Path ignored, long pollIntervalMillis, Runnable onChange) {
        this.source = Objects.requireNonNull(source, "source").toAbsolutePath().normalize();
        this.ignored = ignored == null ? null : ignored.toAbsolutePath().normalize();
        this.pollIntervalMillis = pollIntervalMillis;
        this.onChange = Objects.requireNonNull(onChange, "onChange");
    }

    /**
     * Faz a primeira leitura da árvore e inicia o polling.
     */
    synchronized void start() throws BackupException {
        if (monitor != null) {
            return;
        }
        if (!Files.isDirectory(source)) {
            throw new BackupException(Kind.INVALID_PATH, "Origem para monitoramento não é diretório: " + source);
        }
        FileFilter prune = file -> ignored == null
                || !file.toPath().toAbsolutePath().normalize().startsWith(ignored);
        FileAlterationObserver observer = new FileAlterationObserver(source.toFile(), prune);
        observer.addListener(new Listener());
        try {
            observer.initialize();
        } catch (Exception e) {
            throw new BackupException(Kind.IO_ERROR, "Falha ao inicializar observador de " + source, e);
        }

        FileAlterationMonitor m = new FileAlterationMonitor(pollIntervalMillis, observer);
        m.setThreadFactory(r -> {
            Thread t = new Thread(r, "backup-watch-" + THREAD_SEQ.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        try {
            m.start();
        } catch (Exception e) {
            throw new BackupException(Kind.IO_ERROR, "Falha ao iniciar monitor de " + source, e);
        }
        monitor = m;
        log.info("Monitorando {} (polling {} ms)", source, pollIntervalMillis);
    }

    @Override
    public synchronized void close() {
        if (monitor == null) {
            return;
        }
        try {
            monitor.stop();
            log.info("Monitor de {} encerrado.", source);
        } catch (Exception e) {
            log.warn("Falha ao encerrar monitor de {}: {}", source, e.toString());
        } finally {
            monitor = null;
        }
    }

    private void changed(File file, String what) {
        log.debug("Mudança detectada ({}): {}", what, file);
        try {
            onChange.run();
        } catch (RuntimeException e) {
            log.error("Callback de mudança falhou para {}", source, e);
        }
    }

    private final class Listener extends FileAlterationListenerAdaptor {
        @Override public void onFileCreate(File file) { changed(file, "arquivo criado"); }
        @Override public void onFileChange(File file) { changed(file, "arquivo alterado"); }
        @Override public void onFileDelete(File file) { changed(file, "arquivo removido"); }
        @Override public void onDirectoryCreate(File dir) { changed(dir, "diretório criado"); }
        @Override public void onDirectoryDelete(File dir) { changed(dir, "diretório removido"); }
    }
}
