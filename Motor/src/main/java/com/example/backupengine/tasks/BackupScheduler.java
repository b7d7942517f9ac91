package com.example.backupengine.tasks;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.backupengine.backup.BackupEngine;
import com.example.backupengine.codec.Compression.CompressionAlgorithm;
import com.example.backupengine.config.AppConfig;
import com.example.backupengine.error.BackupException;
import com.example.backupengine.error.BackupException.Kind;
import com.example.backupengine.filter.FileFilter.FilterOptions;
import com.example.backupengine.retention.Retention.ArchiveNaming;
import com.example.backupengine.retention.Retention.RetentionManager;

/**
 * Agendador de backups: tarefas por intervalo (timer) e em tempo real (monitor de diretório + debounce).
 * <p>
 * Regras de concorrência:
 * - O registro de tarefas é protegido por um único lock;
 * - Disparos de uma mesma tarefa nunca se sobrepõem;
 * - Um lock por destino+prefixo serializa escrita e retenção entre tarefas diferentes;
 * - {@link #stop()} cancela timers e monitores e espera os backups em andamento terminarem (sem interromper).
 * <p>
 * Falha em um disparo é logada e a tarefa continua no próximo ciclo.
 */
public final class BackupScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BackupScheduler.class);

    /** Id devolvido quando o registro de uma tarefa falha. */
    public static final long INVALID_TASK_ID = -1L;

    public enum TaskKind {
        INTERVAL,
        REALTIME
    }

    private enum State {
        IDLE,
        RUNNING,
        STOPPED
    }

    private final Supplier<BackupEngine> engineFactory;
    private final RetentionManager retention;
    private final int workerThreads;
    private final Duration debounce;
    private final Duration pollInterval;
    private final Clock clock;

    // Registro: tudo abaixo é guardado por registryLock
    private final ReentrantLock registryLock = new ReentrantLock();
    private final Map<Long, Task> tasks = new LinkedHashMap<>();
    private long nextId = 1;
    private State state = State.IDLE;
    private ScheduledExecutorService timer;
    private ExecutorService workers;

    private final ConcurrentHashMap<String, ReentrantLock> destinationLocks = new ConcurrentHashMap<>();

    public BackupScheduler(AppConfig config) {
        this(() -> new BackupEngine(config), new RetentionManager(), config.workerThreads(),
                Duration.ofMillis(config.debounceMillis()), Duration.ofMillis(config.pollIntervalMillis()),
                Clock.systemDefaultZone());
    }

    public BackupScheduler(Supplier<BackupEngine> engineFactory,
                           RetentionManager retention,
                           int workerThreads,
                           Duration debounce,
                           Duration pollInterval,
                           Clock clock) {
        this.engineFactory = Objects.requireNonNull(engineFactory, "engineFactory");
        this.retention = Objects.requireNonNull(retention, "retention");
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads deve ser >= 1: " + workerThreads);
        }
        this.workerThreads = workerThreads;
        this.debounce = requirePositive(debounce, "debounce");
        this.pollInterval = requirePositive(pollInterval, "pollInterval");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    // ==========================
    // CICLO DE VIDA
    // ==========================

    /**
     * Sobe timers e pool de execução. Tarefas por intervalo registradas antes do start são armadas agora;
     * os monitores das tarefas em tempo real já estão abertos desde o registro.
     */
    public void start() {
        registryLock.lock();
        try {
            if (state == State.RUNNING) {
                log.debug("Agendador já está em execução.");
                return;
            }
            timer = Executors.newSingleThreadScheduledExecutor(threads("backup-timer"));
            workers = Executors.newFixedThreadPool(workerThreads, threads("backup-worker"));
            state = State.RUNNING;
            tasks.values().forEach(this::arm);
            log.info("Agendador iniciado: {} tarefa(s), {} worker(s).", tasks.size(), workerThreads);
        } finally {
            registryLock.unlock();
        }
    }

    /**
     * Para tudo e descarta o registro. Só retorna depois que os backups em andamento terminarem.
     */
    public void stop() {
        List<DirectoryWatcher> watchers = new ArrayList<>();
        ScheduledExecutorService oldTimer;
        ExecutorService oldWorkers;
        registryLock.lock();
        try {
            boolean wasRunning = state == State.RUNNING;
            state = State.STOPPED;
            for (Task task : tasks.values()) {
                disarm(task, watchers);
            }
            tasks.clear();
            oldTimer = wasRunning ? timer : null;
            oldWorkers = wasRunning ? workers : null;
            timer = null;
            workers = null;
        } finally {
            registryLock.unlock();
        }

        watchers.forEach(DirectoryWatcher::close);
        if (oldTimer == null) {
            return;
        }

        // O timer só enfileira disparos; pode ser interrompido
        oldTimer.shutdownNow();
        awaitQuietly(oldTimer, "timer");

        // Workers terminam o backup em andamento
        oldWorkers.shutdown();
        awaitQuietly(oldWorkers, "workers");
        log.info("Agendador parado.");
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        registryLock.lock();
        try {
            return state == State.RUNNING;
        } finally {
            registryLock.unlock();
        }
    }

    // ==========================
    // REGISTRO
    // ==========================

    /**
     * Tarefa por intervalo: a cada {@code intervalSeconds} gera {@code dst/<prefixo>_<timestamp>.bin} e aplica a retenção.
     *
     * @return id da tarefa, ou {@link #INVALID_TASK_ID} se o destino não puder ser criado
     */
    public long addScheduledTask(Path src, Path dst, String prefix, long intervalSeconds, int keepCount) {
        if (intervalSeconds <= 0) {
            throw new IllegalArgumentException("intervalSeconds deve ser positivo: " + intervalSeconds);
        }
        return addScheduledTask(src, dst, prefix, Duration.ofSeconds(intervalSeconds), keepCount);
    }

    /** Variante com resolução sub-segundo. */
    public long addScheduledTask(Path src, Path dst, String prefix, Duration interval, int keepCount) {
        requirePositive(interval, "interval");
        return register(TaskKind.INTERVAL, src, dst, prefix, interval, keepCount);
    }

    /**
     * Tarefa em tempo real: mudanças em {@code src} disparam um backup após o período de silêncio.
     * O monitor é aberto aqui, mesmo com o agendador parado; mudanças só disparam backup depois do start.
     *
     * @return id da tarefa, ou {@link #INVALID_TASK_ID} se o monitoramento não puder ser estabelecido
     */
    public long addRealtimeTask(Path src, Path dst, String prefix, int keepCount) {
        return register(TaskKind.REALTIME, src, dst, prefix, null, keepCount);
    }

    private long register(TaskKind kind, Path src, Path dst, String prefix, Duration interval, int keepCount) {
        Objects.requireNonNull(src, "src");
        Objects.requireNonNull(dst, "dst");
        ArchiveNaming.validatePrefix(prefix);

        Path source = src.toAbsolutePath().normalize();
        Path destination = dst.toAbsolutePath().normalize();
        if (kind == TaskKind.REALTIME && !Files.isDirectory(source)) {
            log.error("Tarefa em tempo real recusada: origem não é diretório: {}", source);
            return INVALID_TASK_ID;
        }
        try {
            Files.createDirectories(destination);
        } catch (IOException e) {
            log.error("Tarefa recusada: não foi possível criar o destino {}: {}", destination, e.toString());
            return INVALID_TASK_ID;
        }

        long id;
        registryLock.lock();
        try {
            id = nextId++;
        } finally {
            registryLock.unlock();
        }
        Task task = new Task(id, kind, source, destination, prefix, keepCount, interval);

        if (kind == TaskKind.REALTIME) {
            DirectoryWatcher watcher = new DirectoryWatcher(source, destination, pollInterval.toMillis(),
                    () -> debounce(id));
            try {
                watcher.start();
            } catch (BackupException e) {
                log.error("Tarefa em tempo real recusada: monitoramento de {} falhou [{}]: {}",
                        source, e.kind(), e.getMessage());
                return INVALID_TASK_ID;
            }
            task.watcher = watcher;
        }

        registryLock.lock();
        try {
            if (state == State.RUNNING) {
                arm(task);
            }
            tasks.put(id, task);
            log.info("Tarefa {} registrada: {}", id, task);
            return id;
        } finally {
            registryLock.unlock();
        }
    }

    /**
     * Remove a tarefa. Idempotente; um backup já em andamento termina normalmente.
     *
     * @return true se a tarefa existia
     */
    public boolean removeTask(long taskId) {
        List<DirectoryWatcher> watchers = new ArrayList<>();
        registryLock.lock();
        try {
            Task task = tasks.remove(taskId);
            if (task == null) {
                return false;
            }
            disarm(task, watchers);
        } finally {
            registryLock.unlock();
        }
        watchers.forEach(DirectoryWatcher::close);
        log.info("Tarefa {} removida.", taskId);
        return true;
    }

    /** Vale para os próximos disparos. Senha vazia desliga a criptografia. */
    public boolean setTaskPassword(long taskId, String password) {
        return mutate(taskId, task -> task.password = password == null ? "" : password);
    }

    public boolean setTaskCompressionAlgorithm(long taskId, CompressionAlgorithm algorithm) {
        Objects.requireNonNull(algorithm, "algorithm");
        return mutate(taskId, task -> task.algorithm = algorithm);
    }

    public boolean setTaskFilter(long taskId, FilterOptions filter) {
        return mutate(taskId, task -> task.filter = filter == null ? FilterOptions.disabled() : filter);
    }

    /** Snapshot dos ids registrados, em ordem de criação. */
    public List<Long> taskIds() {
        registryLock.lock();
        try {
            return List.copyOf(tasks.keySet());
        } finally {
            registryLock.unlock();
        }
    }

    /**
     * Dispara a tarefa agora pelo mesmo pool e espera o resultado.
     *
     * @return false se a tarefa não existe, o agendador não está rodando ou o backup falhou
     */
    public boolean runNow(long taskId) {
        ExecutorService pool;
        registryLock.lock();
        try {
            if (state != State.RUNNING || !tasks.containsKey(taskId)) {
                return false;
            }
            pool = workers;
        } finally {
            registryLock.unlock();
        }

        Future<Boolean> outcome;
        try {
            outcome = pool.submit(() -> runTrigger(taskId));
        } catch (RejectedExecutionException e) {
            log.warn("Disparo manual da tarefa {} recusado: agendador parando.", taskId);
            return false;
        }
        try {
            return outcome.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException e) {
            log.error("Disparo manual da tarefa {} falhou", taskId, e.getCause());
            return false;
        }
    }

    // ==========================
    // DISPAROS
    // ==========================

    /** Chamado com registryLock. Tarefas em tempo real já têm o monitor aberto. */
    private void arm(Task task) {
        if (task.kind == TaskKind.INTERVAL) {
            long period = task.interval.toMillis();
            task.timerFuture = timer.scheduleAtFixedRate(() -> submit(task.id), period, period, TimeUnit.MILLISECONDS);
        }
    }

    /** Chamado com registryLock; monitores são fechados fora do lock. */
    private static void disarm(Task task, List<DirectoryWatcher> watchersToClose) {
        if (task.timerFuture != null) {
            task.timerFuture.cancel(false);
            task.timerFuture = null;
        }
        if (task.pendingDebounce != null) {
            task.pendingDebounce.cancel(false);
            task.pendingDebounce = null;
        }
        if (task.watcher != null) {
            watchersToClose.add(task.watcher);
            task.watcher = null;
        }
    }

    /** Cada evento reinicia a janela de silêncio; só o último agenda o backup. */
    private void debounce(long taskId) {
        registryLock.lock();
        try {
            Task task = tasks.get(taskId);
            if (task == null || state != State.RUNNING) {
                return;
            }
            if (task.pendingDebounce != null) {
                task.pendingDebounce.cancel(false);
            }
            task.pendingDebounce = timer.schedule(() -> submit(taskId), debounce.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Debounce da tarefa {} ignorado: agendador parando.", taskId);
        } finally {
            registryLock.unlock();
        }
    }

    private void submit(long taskId) {
        ExecutorService pool;
        registryLock.lock();
        try {
            if (state != State.RUNNING) {
                return;
            }
            pool = workers;
        } finally {
            registryLock.unlock();
        }
        try {
            pool.execute(() -> runTrigger(taskId));
        } catch (RejectedExecutionException e) {
            log.debug("Disparo da tarefa {} ignorado: agendador parando.", taskId);
        }
    }

    private boolean runTrigger(long taskId) {
        Task task;
        TaskSnapshot snapshot;
        registryLock.lock();
        try {
            task = tasks.get(taskId);
            if (task == null || state != State.RUNNING) {
                return false;
            }
            snapshot = task.snapshot();
        } finally {
            registryLock.unlock();
        }

        if (!task.running.compareAndSet(false, true)) {
            log.warn("Tarefa {} [{}]: disparo anterior ainda em andamento; este foi descartado.",
                    taskId, Kind.ALREADY_RUNNING);
            if (task.kind == TaskKind.REALTIME) {
                task.rerun.set(true);
            }
            return false;
        }
        try {
            return execute(snapshot);
        } finally {
            task.running.set(false);
            if (task.rerun.getAndSet(false)) {
                debounce(taskId);
            }
        }
    }

    private boolean execute(TaskSnapshot s) {
        long started = System.currentTimeMillis();
        log.info("[TASK {}] Disparo: {} -> {} (prefixo={})", s.id, s.source, s.destination, s.prefix);
        ReentrantLock lock = destinationLocks.computeIfAbsent(s.destination + "\u0000" + s.prefix,
                k -> new ReentrantLock());
        lock.lock();
        try {
            BackupEngine engine = engineFactory.get();
            if (s.algorithm != null) {
                engine.setCompressionAlgorithm(s.algorithm);
            }
            engine.setPassword(s.password);
            engine.setFilter(s.filter);
            engine.setExcludedPaths(List.of(s.destination));

            Path archive = ArchiveNaming.nextArchivePath(s.destination, s.prefix, LocalDateTime.now(clock));
            if (!engine.backup(s.source, archive)) {
                log.error("[TASK {}] Backup falhou: {}", s.id,
                        engine.lastFailure().map(Object::toString).orElse("motivo desconhecido"));
                return false;
            }
            try {
                List<Path> removed = retention.prune(s.destination, s.prefix, s.keepCount);
                if (!removed.isEmpty()) {
                    log.info("[TASK {}] Retenção removeu {} arquivo(s).", s.id, removed.size());
                }
            } catch (BackupException e) {
                log.warn("[TASK {}] Backup gravado, mas a retenção falhou [{}]: {}", s.id, e.kind(), e.getMessage());
            }
            log.info("[TASK {}] Concluída em {} ms: {}", s.id, System.currentTimeMillis() - started,
                    archive.getFileName());
            return true;
        } catch (BackupException e) {
            log.error("[TASK {}] Falha [{}]: {}", s.id, e.kind(), e.getMessage());
            return false;
        } catch (RuntimeException e) {
            log.error("[TASK {}] Erro inesperado", s.id, e);
            return false;
        } finally {
            lock.unlock();
        }
    }

    // ==========================
    // AUXILIARES
    // ==========================

    private boolean mutate(long taskId, Consumer<Task> change) {
        registryLock.lock();
        try {
            Task task = tasks.get(taskId);
            if (task == null) {
                return false;
            }
            change.accept(task);
            return true;
        } finally {
            registryLock.unlock();
        }
    }

    private static void awaitQuietly(ExecutorService executor, String name) {
        try {
            while (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.info("Aguardando {} terminarem o trabalho em andamento...", name);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrompido enquanto aguardava {}.", name);
        }
    }

    private static ThreadFactory threads(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private static Duration requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name);
        if (d.isNegative() || d.isZero()) {
            throw new IllegalArgumentException(name + " deve ser positivo: " + d);
        }
        return d;
    }

    // ==================================================================================
    // Tarefa
    // ==================================================================================

    /** Estado mutável guardado por registryLock, exceto os flags atômicos. */
    private static final class Task {
        final long id;
        final TaskKind kind;
        final Path source;
        final Path destination;
        final String prefix;
        final int keepCount;
        final Duration interval;
        final AtomicBoolean running = new AtomicBoolean();
        final AtomicBoolean rerun = new AtomicBoolean();

        String password = "";
        /** null = padrão do motor. */
        CompressionAlgorithm algorithm;
        FilterOptions filter = FilterOptions.disabled();
        ScheduledFuture<?> timerFuture;
        ScheduledFuture<?> pendingDebounce;
        DirectoryWatcher watcher;

        Task(long id, TaskKind kind, Path source, Path destination, String prefix, int keepCount,
             Duration interval) {
            this.id = id;
            this.kind = kind;
            this.source = source;
            this.destination = destination;
            this.prefix = prefix;
            this.keepCount = keepCount;
            this.interval = interval;
        }

        TaskSnapshot snapshot() {
            return new TaskSnapshot(id, source, destination, prefix, keepCount, password, algorithm, filter);
        }

        @Override
        public String toString() {
            return kind + "{" + source + " -> " + destination + ", prefixo=" + prefix + ", manter=" + keepCount
                    + (interval != null ? ", intervalo=" + interval : "") + "}";
        }
    }

    /** Configuração congelada no início de um disparo. */
    private static final class TaskSnapshot {
        final long id;
        final Path source;
        final Path destination;
        final String prefix;
        final int keepCount;
        final String password;
        final CompressionAlgorithm algorithm;
        final FilterOptions filter;

        TaskSnapshot(long id, Path source, Path destination, String prefix, int keepCount, String password,
                     CompressionAlgorithm algorithm, FilterOptions filter) {
            this.id = id;
            this.source = source;
            this.destination = destination;
            this.prefix = prefix;
            this.keepCount = keepCount;
            this.password = password;
            this.algorithm = algorithm;
            this.filter = filter;
        }
    }
}
