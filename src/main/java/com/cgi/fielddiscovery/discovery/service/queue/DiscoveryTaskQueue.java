package com.cgi.fielddiscovery.discovery.service.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Bounded, thread-safe queue of discovery tasks.
 * Submission never blocks the caller: a full queue rejects the task.
 */
@Component
public class DiscoveryTaskQueue implements DisposableBean {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryTaskQueue.class);

    private final BlockingQueue<DiscoveryTask> taskQueue;
    private final AtomicBoolean isShutdown = new AtomicBoolean(false);

    public DiscoveryTaskQueue(@Value("${fielddiscovery.discovery.queue-capacity:100}") int queueCapacity) {
        this.taskQueue = new LinkedBlockingQueue<>(queueCapacity);
        log.info("Discovery task queue initialized with capacity {}", queueCapacity);
    }

    /**
     * Adds a task to the queue.
     *
     * @param task Task to add
     * @return false if the queue is full
     * @throws IllegalStateException If the queue is shutdown
     */
    public boolean offer(DiscoveryTask task) {
        if (isShutdown.get()) {
            throw new IllegalStateException("Queue is shutdown");
        }
        boolean added = taskQueue.offer(task);
        if (added) {
            log.debug("Added task to queue: {}", task);
        } else {
            log.warn("Discovery queue is full, rejecting {}", task);
        }
        return added;
    }

    /**
     * Takes a task from the queue.
     * Blocks until a task is available or timeout is reached.
     *
     * @param timeout Timeout value
     * @param unit Timeout unit
     * @return Task, or null if timeout occurred
     * @throws InterruptedException If the thread is interrupted while waiting
     */
    public DiscoveryTask takeTask(long timeout, TimeUnit unit) throws InterruptedException {
        return taskQueue.poll(timeout, unit);
    }

    public int getPendingTaskCount() {
        return taskQueue.size();
    }

    public boolean isShutdown() {
        return isShutdown.get();
    }

    /**
     * Shuts down the queue.
     * After calling this method, no more tasks can be added.
     */
    public void shutdown() {
        log.info("Shutting down discovery task queue");
        isShutdown.set(true);
    }

    @Override
    public void destroy() {
        shutdown();
    }
}
