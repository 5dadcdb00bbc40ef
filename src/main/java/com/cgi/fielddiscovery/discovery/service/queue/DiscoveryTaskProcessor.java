package com.cgi.fielddiscovery.discovery.service.queue;

import com.cgi.fielddiscovery.discovery.service.DiscoveryOrchestrator;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Processor for discovery tasks.
 * A fixed pool of daemon threads polls the queue and hands each task to the orchestrator.
 */
@Component
public class DiscoveryTaskProcessor implements DisposableBean {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryTaskProcessor.class);

    private static final long POLL_TIMEOUT_MS = 500;

    private final DiscoveryTaskQueue taskQueue;
    private final DiscoveryOrchestrator orchestrator;
    private final ExecutorService executorService;
    private final int numThreads;
    private final AtomicInteger processedTaskCount = new AtomicInteger(0);
    private final AtomicInteger failedTaskCount = new AtomicInteger(0);

    public DiscoveryTaskProcessor(DiscoveryTaskQueue taskQueue,
                                  DiscoveryOrchestrator orchestrator,
                                  @Value("${fielddiscovery.discovery.worker-threads:2}") int numThreads) {
        this.taskQueue = taskQueue;
        this.orchestrator = orchestrator;
        this.numThreads = numThreads;

        this.executorService = Executors.newFixedThreadPool(numThreads, r -> {
            Thread t = new Thread(r);
            t.setName("discovery-worker-" + t.getId());
            t.setDaemon(true);
            return t;
        });

        log.info("Discovery task processor initialized with {} threads", numThreads);
    }

    /**
     * Starts the consumer threads.
     */
    @PostConstruct
    public void init() {
        for (int i = 0; i < numThreads; i++) {
            executorService.submit(this::processTasksLoop);
        }
        log.info("Started {} consumer threads for discovery", numThreads);
    }

    private void processTasksLoop() {
        while (!Thread.currentThread().isInterrupted()) {
            try {
                DiscoveryTask task = taskQueue.takeTask(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
                if (task == null) {
                    if (taskQueue.isShutdown()) {
                        break;
                    }
                    continue;
                }

                orchestrator.run(task);
                processedTaskCount.incrementAndGet();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.debug("Consumer thread interrupted, exiting loop");
            } catch (Exception e) {
                failedTaskCount.incrementAndGet();
                log.error("Error processing discovery task: {}", e.getMessage(), e);
            }
        }
    }

    public int getProcessedTaskCount() {
        return processedTaskCount.get();
    }

    public int getFailedTaskCount() {
        return failedTaskCount.get();
    }

    /**
     * Shuts down the processor.
     */
    public void shutdown() {
        log.info("Shutting down discovery task processor");

        taskQueue.shutdown();
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(10, TimeUnit.SECONDS)) {
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executorService.shutdownNow();
        }

        log.info("Discovery task processor shutdown complete");
    }

    @Override
    public void destroy() {
        shutdown();
    }
}
