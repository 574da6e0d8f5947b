package com.friendfeed.aggregate.scheduler;

import com.friendfeed.aggregate.model.TaskOutcome;
import com.friendfeed.config.AggregatorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;

/**
 * Runs independent tasks with at most {@code ceiling} of them executing at once.
 *
 * <p>Permits are taken on the submitting thread, in list order, before a task is handed to the
 * executor, so admission is first-in first-out and no more than {@code ceiling} tasks are ever in
 * flight. A task that throws is reported as a failed {@link TaskOutcome}; it never stops the others.
 */
@Component
public class BoundedTaskScheduler {
    private static final Logger log = LoggerFactory.getLogger(BoundedTaskScheduler.class);

    private final ExecutorService executor;
    private final int ceiling;
    private final Semaphore permits;

    @Autowired
    public BoundedTaskScheduler(
        @Qualifier("feedExecutor") ExecutorService executor,
        AggregatorProperties properties
    ) {
        this(executor, properties.getConcurrency());
    }

    public BoundedTaskScheduler(ExecutorService executor, int ceiling) {
        if (ceiling < 1) {
            throw new IllegalArgumentException("Concurrency ceiling must be at least 1, was " + ceiling);
        }
        this.executor = executor;
        this.ceiling = ceiling;
        this.permits = new Semaphore(ceiling, true);
    }

    public int ceiling() {
        return ceiling;
    }

    /**
     * Blocks until every task has finished. Outcomes are returned in submission order.
     */
    public <T> List<TaskOutcome<T>> runAll(List<? extends Callable<T>> tasks) {
        List<CompletableFuture<TaskOutcome<T>>> futures = new ArrayList<>(tasks.size());
        for (int i = 0; i < tasks.size(); i++) {
            int index = i;
            Callable<T> task = tasks.get(i);
            permits.acquireUninterruptibly();
            try {
                futures.add(CompletableFuture
                    .supplyAsync(() -> invoke(index, task), executor)
                    .whenComplete((outcome, error) -> permits.release())
                    .exceptionally(error -> TaskOutcome.failed(index, unwrap(error))));
            } catch (RejectedExecutionException e) {
                permits.release();
                log.warn("Task {} rejected by executor", index, e);
                futures.add(CompletableFuture.completedFuture(TaskOutcome.failed(index, e)));
            }
        }

        List<TaskOutcome<T>> outcomes = new ArrayList<>(futures.size());
        for (CompletableFuture<TaskOutcome<T>> future : futures) {
            outcomes.add(future.join());
        }
        return outcomes;
    }

    private Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    private <T> TaskOutcome<T> invoke(int index, Callable<T> task) {
        try {
            return TaskOutcome.completed(index, task.call());
        } catch (Exception e) {
            log.warn("Task {} failed", index, e);
            return TaskOutcome.failed(index, e);
        }
    }
}
