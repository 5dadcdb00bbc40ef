package com.cgi.fielddiscovery.discovery.service;

import com.cgi.fielddiscovery.catalog.model.TableGroup;
import com.cgi.fielddiscovery.catalog.service.CatalogAssetService;
import com.cgi.fielddiscovery.classifier.cache.TableAnalysisCache;
import com.cgi.fielddiscovery.classifier.model.TableAnalysis;
import com.cgi.fielddiscovery.classifier.service.ClassificationMetricsCollector;
import com.cgi.fielddiscovery.classifier.service.ClassificationPipelineService;
import com.cgi.fielddiscovery.common.exception.PersistenceException;
import com.cgi.fielddiscovery.discovery.model.DiscoveredField;
import com.cgi.fielddiscovery.discovery.model.DiscoverySession;
import com.cgi.fielddiscovery.discovery.model.enums.FieldClassification;
import com.cgi.fielddiscovery.discovery.repository.DiscoverySessionRepository;
import com.cgi.fielddiscovery.discovery.service.queue.DiscoveryTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one discovery session end to end.
 * <p>
 * Table groups are analysed in batches on a bounded pool; each group is persisted atomically
 * on the calling worker thread as soon as its analysis is available. A table whose analysis
 * times out or fails is re-analysed with the rule-based classifier so the run never stalls on
 * the AI provider.
 */
@Service
public class DiscoveryOrchestrator implements DisposableBean {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryOrchestrator.class);

    static final int PROGRESS_STARTED = 10;
    static final int PROGRESS_GROUPED = 40;
    static final int PROGRESS_TABLES_SPAN = 50;

    private final DiscoverySessionRepository sessionRepository;
    private final CatalogAssetService catalogAssetService;
    private final ClassificationPipelineService pipelineService;
    private final TableAnalysisCache analysisCache;
    private final DiscoveredFieldAssembler assembler;
    private final FieldPersistenceService persistenceService;
    private final ClassificationMetricsCollector metricsCollector;
    private final int parallelism;
    private final long tableTimeoutSeconds;
    private final ExecutorService tablePool;

    private final Map<String, Object> sessionLocks = new ConcurrentHashMap<>();

    public DiscoveryOrchestrator(DiscoverySessionRepository sessionRepository,
                                 CatalogAssetService catalogAssetService,
                                 ClassificationPipelineService pipelineService,
                                 TableAnalysisCache analysisCache,
                                 DiscoveredFieldAssembler assembler,
                                 FieldPersistenceService persistenceService,
                                 ClassificationMetricsCollector metricsCollector,
                                 @Value("${fielddiscovery.discovery.parallelism:10}") int parallelism,
                                 @Value("${fielddiscovery.discovery.table-timeout-seconds:60}") long tableTimeoutSeconds) {
        this.sessionRepository = sessionRepository;
        this.catalogAssetService = catalogAssetService;
        this.pipelineService = pipelineService;
        this.analysisCache = analysisCache;
        this.assembler = assembler;
        this.persistenceService = persistenceService;
        this.metricsCollector = metricsCollector;
        this.parallelism = Math.max(1, parallelism);
        this.tableTimeoutSeconds = tableTimeoutSeconds;

        this.tablePool = Executors.newFixedThreadPool(this.parallelism, r -> {
            Thread t = new Thread(r);
            t.setName("discovery-table-" + t.getId());
            t.setDaemon(true);
            return t;
        });

        log.info("Discovery orchestrator initialized with parallelism {} and table timeout {}s",
                this.parallelism, tableTimeoutSeconds);
    }

    /**
     * Runs a queued discovery task. Never throws: a run that cannot finish marks its session failed.
     *
     * @param task Task to run
     */
    public void run(DiscoveryTask task) {
        String sessionId = task.getSessionId();
        long startTime = System.currentTimeMillis();

        try {
            if (!sessionRepository.markProcessing(sessionId, PROGRESS_STARTED, LocalDateTime.now())) {
                log.warn("Session {} is no longer pending, skipping", sessionId);
                return;
            }
            log.info("Starting discovery session {} for data source {}", sessionId, task.getDataSourceId());

            List<TableGroup> groups = catalogAssetService.fetchTableGroups(
                    task.getDataSourceId(), task.getSchemas(), task.getTables());
            updateProgress(sessionId, PROGRESS_GROUPED);
            log.info("Session {}: {} table groups to analyse", sessionId, groups.size());

            RunTally tally = processGroups(task, groups);

            DiscoverySession completed = DiscoverySession.builder()
                    .id(sessionId)
                    .fieldsDiscovered(tally.fieldsDiscovered)
                    .fieldsClassified(tally.fieldsClassified)
                    .piiFieldsFound(tally.piiFields)
                    .phiFieldsFound(tally.phiFields)
                    .financialFieldsFound(tally.financialFields)
                    .failedTableGroups(tally.failedTableGroups)
                    .errorMessage(tally.failedTableGroups > 0
                            ? tally.failedTableGroups + " table group(s) could not be persisted"
                            : null)
                    .durationMs(System.currentTimeMillis() - startTime)
                    .build();

            if (sessionRepository.complete(completed, LocalDateTime.now())) {
                log.info("Session {} completed: {} fields, {} PII, {} PHI, {} financial, {} failed groups in {} ms",
                        sessionId, tally.fieldsDiscovered, tally.piiFields, tally.phiFields,
                        tally.financialFields, tally.failedTableGroups, completed.getDurationMs());
            } else {
                log.warn("Session {} left processing before completion, result counts dropped", sessionId);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Discovery session {} interrupted", sessionId);
            failSession(sessionId, "Discovery interrupted");
        } catch (Exception e) {
            log.error("Discovery session {} failed: {}", sessionId, e.getMessage(), e);
            failSession(sessionId, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        } finally {
            sessionLocks.remove(sessionId);
        }
    }

    private RunTally processGroups(DiscoveryTask task, List<TableGroup> groups) throws InterruptedException {
        RunTally tally = new RunTally();
        int total = groups.size();
        int done = 0;

        for (int from = 0; from < total; from += parallelism) {
            List<TableGroup> batch = groups.subList(from, Math.min(from + parallelism, total));

            List<Future<TableAnalysis>> futures = new ArrayList<>(batch.size());
            for (TableGroup group : batch) {
                futures.add(tablePool.submit(() -> analyze(group, task.isForceRefresh())));
            }
            // Every table of the batch shares one deadline counted from submission.
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(tableTimeoutSeconds);

            for (int i = 0; i < batch.size(); i++) {
                TableGroup group = batch.get(i);
                TableAnalysis analysis = awaitAnalysis(futures.get(i), group, deadline);
                persist(task, analysis, tally);

                done++;
                updateProgress(task.getSessionId(), PROGRESS_GROUPED + done * PROGRESS_TABLES_SPAN / total);
            }
        }
        return tally;
    }

    TableAnalysis analyze(TableGroup group, boolean forceRefresh) {
        if (!forceRefresh) {
            Optional<TableAnalysis> cached = analysisCache.lookup(group);
            if (cached.isPresent()) {
                return cached.get();
            }
        }

        long start = System.currentTimeMillis();
        TableAnalysis analysis = pipelineService.analyzeTable(group, false);
        metricsCollector.recordTableProcessed(System.currentTimeMillis() - start);

        if (!analysis.isDegraded()) {
            analysisCache.store(group, analysis);
        }
        return analysis;
    }

    private TableAnalysis awaitAnalysis(Future<TableAnalysis> future, TableGroup group, long deadline)
            throws InterruptedException {
        try {
            return future.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Analysis of {} timed out after {}s, using rule-based classification",
                    group.getQualifiedName(), tableTimeoutSeconds);
        } catch (ExecutionException e) {
            future.cancel(true);
            log.warn("Analysis of {} failed, using rule-based classification: {}",
                    group.getQualifiedName(), e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
        }
        return pipelineService.analyzeTable(group, true);
    }

    private void persist(DiscoveryTask task, TableAnalysis analysis, RunTally tally) {
        List<DiscoveredField> fields = assembler.assemble(task.getDataSourceId(), analysis, LocalDateTime.now());
        tally.fieldsDiscovered += fields.size();

        try {
            List<DiscoveredField> saved = persistenceService.saveTableFields(task.getSessionId(), fields);
            tally.fieldsClassified += saved.size();
            for (DiscoveredField field : saved) {
                if (field.getClassification() == FieldClassification.PII) {
                    tally.piiFields++;
                } else if (field.getClassification() == FieldClassification.PHI) {
                    tally.phiFields++;
                } else if (field.getClassification() == FieldClassification.FINANCIAL) {
                    tally.financialFields++;
                }
            }
        } catch (PersistenceException e) {
            tally.failedTableGroups++;
            metricsCollector.recordTableFailed();
            log.error("Could not persist fields of {}.{} for session {}: {}",
                    analysis.getSchema(), analysis.getTableName(), task.getSessionId(), e.getMessage());
        }
    }

    private void updateProgress(String sessionId, int progress) {
        Object lock = sessionLocks.computeIfAbsent(sessionId, k -> new Object());
        synchronized (lock) {
            sessionRepository.updateProgress(sessionId, progress, LocalDateTime.now());
        }
    }

    private void failSession(String sessionId, String message) {
        try {
            sessionRepository.fail(sessionId, message, LocalDateTime.now());
        } catch (PersistenceException e) {
            log.error("Could not mark session {} as failed: {}", sessionId, e.getMessage());
        }
    }

    @Override
    public void destroy() {
        log.info("Shutting down discovery table pool");
        tablePool.shutdown();
        try {
            if (!tablePool.awaitTermination(10, TimeUnit.SECONDS)) {
                tablePool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            tablePool.shutdownNow();
        }
    }

    private static final class RunTally {
        private int fieldsDiscovered;
        private int fieldsClassified;
        private int piiFields;
        private int phiFields;
        private int financialFields;
        private int failedTableGroups;
    }
}
