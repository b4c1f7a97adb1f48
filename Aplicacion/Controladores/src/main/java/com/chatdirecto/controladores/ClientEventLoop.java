package com.chatdirecto.controladores;

import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Hilo único donde se muta todo el estado de los sincronizadores. Las continuaciones de las
 * llamadas remotas y las entregas del feed se encolan aquí.
 */
public final class ClientEventLoop implements Executor, AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(ClientEventLoop.class.getName());

    static final String THREAD_NAME = "chat-sync-loop";

    private final ExecutorService executor;
    private final long shutdownTimeoutMs;
    private volatile Thread loopThread;

    public ClientEventLoop(long shutdownTimeoutMs) {
        this.shutdownTimeoutMs = shutdownTimeoutMs;
        this.executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, THREAD_NAME);
            thread.setDaemon(true);
            loopThread = thread;
            return thread;
        });
    }

    @Override
    public void execute(Runnable task) {
        executor.execute(() -> {
            try {
                task.run();
            } catch (RuntimeException ex) {
                LOGGER.log(Level.WARNING, "Una tarea del loop terminó con error", ex);
            }
        });
    }

    public boolean isLoopThread() {
        return Thread.currentThread() == loopThread;
    }

    public boolean isShutdown() {
        return executor.isShutdown();
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownTimeoutMs, TimeUnit.MILLISECONDS)) {
                LOGGER.warning(() -> "El loop no terminó en " + shutdownTimeoutMs + " ms, se interrumpe");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
