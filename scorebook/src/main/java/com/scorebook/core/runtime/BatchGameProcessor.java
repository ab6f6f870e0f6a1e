package com.scorebook.core.runtime;

import com.scorebook.config.ScorebookConfig;
import com.scorebook.core.model.Game;
import com.scorebook.core.model.GameFeed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Procesa muchos partidos con un pool fijo de workers alimentado por una cola acotada. Con la cola llena
 * el hilo que envía se bloquea hasta que un worker libere lugar (BLOCK). Un partido que falla queda en su
 * {@link GameResult} y no frena a los demás.
 */
public class BatchGameProcessor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BatchGameProcessor.class);

    private final GamePipeline pipeline;
    private final int workerThreads;
    private final int queueCapacity;
    private final ThreadPoolExecutor workersPool;

    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    /** Resultado de un partido; viene exactamente uno de {@code game} y {@code failure}. */
    public record GameResult(String gameId, Game game, Throwable failure) {
        public boolean ok() { return failure == null; }
    }

    public BatchGameProcessor(GamePipeline pipeline, ScorebookConfig.BatchConfig batch) {
        this(pipeline, batch.effectiveWorkers(), batch.queueCapacity);
    }

    public BatchGameProcessor(GamePipeline pipeline, int workerThreads, int queueCapacity) {
        if (workerThreads < 1) throw new IllegalArgumentException("workerThreads " + workerThreads);
        if (queueCapacity < 1) throw new IllegalArgumentException("queueCapacity " + queueCapacity);
        this.pipeline = pipeline;
        this.workerThreads = workerThreads;
        this.queueCapacity = queueCapacity;

        AtomicInteger seq = new AtomicInteger();
        this.workersPool = new ThreadPoolExecutor(workerThreads, workerThreads, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueCapacity),
                r -> {
                    Thread t = new Thread(r, "scorebook-worker-" + seq.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                },
                BatchGameProcessor::blockUntilQueued);
        log.info("Batch processor started: workers={} qCap={}", workerThreads, queueCapacity);
    }

    /** Procesa cada feed y devuelve los resultados en el orden en que llegaron. */
    public List<GameResult> processAll(List<GameFeed> feeds) throws InterruptedException {
        List<Future<GameResult>> futures = new ArrayList<>(feeds.size());
        for (GameFeed feed : feeds) {
            futures.add(workersPool.submit(() -> processOne(feed)));
        }
        List<GameResult> results = new ArrayList<>(feeds.size());
        for (int i = 0; i < futures.size(); i++) {
            try {
                results.add(futures.get(i).get());
            } catch (ExecutionException e) {
                // processOne atrapa todo lo que puede; esto es un Error del worker
                results.add(new GameResult(feeds.get(i).gameId(), null, e.getCause()));
            }
        }
        return results;
    }

    private GameResult processOne(GameFeed feed) {
        try {
            Game game = pipeline.process(feed);
            processed.incrementAndGet();
            return new GameResult(feed.gameId(), game, null);
        } catch (RuntimeException e) {
            failed.incrementAndGet();
            log.error("Game {} failed: {}", feed.gameId(), e.getMessage(), e);
            return new GameResult(feed.gameId(), null, e);
        }
    }

    private static void blockUntilQueued(Runnable task, ThreadPoolExecutor pool) {
        if (pool.isShutdown()) throw new RejectedExecutionException("Batch processor is closed");
        try {
            pool.getQueue().put(task);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RejectedExecutionException("Interrupted while waiting for queue space", e);
        }
    }

    @Override
    public void close() {
        workersPool.shutdown();
        try {
            if (!workersPool.awaitTermination(30, TimeUnit.SECONDS)) workersPool.shutdownNow();
        } catch (InterruptedException e) {
            workersPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Batch processor stopped: processed={} failed={}", processed.get(), failed.get());
    }

    // --- Stats
    public long getProcessed() { return processed.get(); }
    public long getFailed() { return failed.get(); }
    public int getWorkerThreads() { return workerThreads; }
    public int getQueueCapacity() { return queueCapacity; }
}
