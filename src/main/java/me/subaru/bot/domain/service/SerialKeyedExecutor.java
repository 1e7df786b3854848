package me.subaru.bot.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Runs tasks on a shared pool while keeping tasks with the same key strictly
 * sequential and in submission order.
 *
 * <p>
 * Each key gets a runner holding a FIFO of pending tasks; at most one task per
 * key is on the pool at any time. Tasks with different keys run in parallel.
 * Idle runners are evicted; a runner that has been retired refuses new tasks
 * and the submitter creates a fresh one.
 *
 * <p>
 * A task the pool refuses (after shutdown) is handed to the rejection handler
 * instead of being run.
 */
@Slf4j
public class SerialKeyedExecutor<K> {

    private static final long IDLE_POLL_MS = 20;

    private final String name;
    private final ExecutorService executor;
    private final Map<K, KeyRunner> runners = new ConcurrentHashMap<>();
    private final AtomicInteger pending = new AtomicInteger();
    private final Consumer<Runnable> rejectionHandler;

    public SerialKeyedExecutor(String name, ExecutorService executor) {
        this(name, executor, task -> {
        });
    }

    public SerialKeyedExecutor(String name, ExecutorService executor, Consumer<Runnable> rejectionHandler) {
        this.name = name;
        this.executor = executor;
        this.rejectionHandler = Objects.requireNonNull(rejectionHandler, "rejectionHandler");
    }

    public void submit(K key, Runnable task) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(task, "task");
        pending.incrementAndGet();
        while (true) {
            KeyRunner runner = runners.computeIfAbsent(key, KeyRunner::new);
            if (runner.enqueue(task)) {
                return;
            }
            runners.remove(key, runner);
        }
    }

    /**
     * Number of tasks queued or running.
     */
    public int pendingCount() {
        return pending.get();
    }

    /**
     * Blocks until every task has finished or the timeout elapses.
     *
     * @return {@code true} if idle
     */
    public boolean awaitIdle(long timeout, TimeUnit unit) {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (pending.get() > 0) {
            if (System.nanoTime() >= deadline) {
                return false;
            }
            try {
                Thread.sleep(IDLE_POLL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return pending.get() == 0;
            }
        }
        return true;
    }

    /**
     * Removes every task that has not started yet.
     *
     * @return the removed tasks, in per-key order
     */
    public List<Runnable> abandonPending() {
        List<Runnable> abandoned = new ArrayList<>();
        for (KeyRunner runner : runners.values()) {
            abandoned.addAll(runner.drain());
        }
        pending.addAndGet(-abandoned.size());
        return abandoned;
    }

    private final class KeyRunner {

        private final K key;
        private final Object lock = new Object();
        private final Deque<Runnable> queue = new ArrayDeque<>();

        private boolean running;
        private boolean retired;

        private KeyRunner(K key) {
            this.key = key;
        }

        boolean enqueue(Runnable task) {
            synchronized (lock) {
                if (retired) {
                    return false;
                }
                if (running) {
                    queue.addLast(task);
                    return true;
                }
                running = true;
            }
            startRun(task);
            return true;
        }

        List<Runnable> drain() {
            synchronized (lock) {
                List<Runnable> drained = new ArrayList<>(queue);
                queue.clear();
                return drained;
            }
        }

        private void startRun(Runnable task) {
            try {
                executor.execute(() -> {
                    try {
                        task.run();
                    } catch (Exception e) { // NOSONAR - must not kill the worker or stall the key
                        log.error("[{}] task failed for {}: {}", name, key, e.getMessage(), e);
                    } finally {
                        pending.decrementAndGet();
                        onRunComplete();
                    }
                });
            } catch (RejectedExecutionException e) {
                log.warn("[{}] executor rejected task for {}, dropping", name, key);
                pending.decrementAndGet();
                try {
                    rejectionHandler.accept(task);
                } finally {
                    onRunComplete();
                }
            }
        }

        private void onRunComplete() {
            Runnable next;
            synchronized (lock) {
                next = queue.pollFirst();
                if (next == null) {
                    running = false;
                    retired = true;
                }
            }
            if (next != null) {
                startRun(next);
                return;
            }
            if (runners.remove(key, this)) {
                log.trace("[{}] evicted idle runner: {}", name, key);
            }
        }
    }
}
