package org.javai.runner.concurrent;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;

/**
 * Runs independent tasks concurrently under one shared cancelable context.
 *
 * <p>The first task to fail cancels the shared context so its siblings can stop early.
 * Once every task has returned, the first captured failure is rethrown unchanged.</p>
 */
public final class ParallelRunner {

    private static final Logger logger = LogManager.getLogger(ParallelRunner.class);

    private final ExecutorService executor;

    public ParallelRunner(ExecutorService executor) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    /**
     * Runs all tasks and waits for them to finish.
     *
     * @throws Exception the first failure raised by any task
     */
    public void runAll(RunContext ctx, List<? extends ContextTask> tasks) throws Exception {
        Objects.requireNonNull(ctx, "ctx must not be null");
        if (tasks.isEmpty()) {
            return;
        }

        RunContext shared = ctx.withCancel();
        BlockingQueue<Exception> errors = new ArrayBlockingQueue<>(tasks.size());
        CountDownLatch finished = new CountDownLatch(tasks.size());
        List<ContextTask> snapshot = new ArrayList<>(tasks);

        try {
            for (int i = 0; i < snapshot.size(); i++) {
                ContextTask task = snapshot.get(i);
                int index = i;
                executor.execute(() -> {
                    try {
                        task.run(shared);
                    } catch (Exception e) {
                        logger.debug("Parallel task {} failed: {}", index, e.getMessage());
                        errors.offer(e);
                        shared.cancel();
                    } finally {
                        finished.countDown();
                    }
                });
            }
            awaitAll(finished, shared);
        } finally {
            shared.cancel();
        }

        Exception first = errors.poll();
        if (first != null) {
            throw first;
        }
    }

    private static void awaitAll(CountDownLatch finished, RunContext shared) {
        boolean interrupted = false;
        while (true) {
            try {
                finished.await();
                break;
            } catch (InterruptedException e) {
                // keep waiting so no task outlives the call, but stop the siblings
                interrupted = true;
                shared.cancel();
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }
}
