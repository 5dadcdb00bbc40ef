package com.cgi.fielddiscovery.discovery.api.controller;

import com.cgi.fielddiscovery.classifier.service.ClassificationMetricsCollector;
import com.cgi.fielddiscovery.common.api.dto.ApiResponse;
import com.cgi.fielddiscovery.common.exception.ValidationException;
import com.cgi.fielddiscovery.discovery.api.dto.BulkActionRequest;
import com.cgi.fielddiscovery.discovery.api.dto.ClassifyFieldRequest;
import com.cgi.fielddiscovery.discovery.api.dto.StartDiscoveryRequest;
import com.cgi.fielddiscovery.discovery.api.dto.UpdateStatusRequest;
import com.cgi.fielddiscovery.discovery.model.BulkUpdateResult;
import com.cgi.fielddiscovery.discovery.model.ClassificationHistoryEntry;
import com.cgi.fielddiscovery.discovery.model.DiscoveredField;
import com.cgi.fielddiscovery.discovery.model.DiscoverySession;
import com.cgi.fielddiscovery.discovery.model.DiscoveryStats;
import com.cgi.fielddiscovery.discovery.model.FieldFilter;
import com.cgi.fielddiscovery.discovery.model.FieldPage;
import com.cgi.fielddiscovery.discovery.model.enums.ExportFormat;
import com.cgi.fielddiscovery.discovery.model.enums.FieldClassification;
import com.cgi.fielddiscovery.discovery.model.enums.FieldStatus;
import com.cgi.fielddiscovery.discovery.model.enums.Sensitivity;
import com.cgi.fielddiscovery.discovery.service.DiscoveryService;
import com.cgi.fielddiscovery.discovery.service.DiscoveryStatsService;
import com.cgi.fielddiscovery.discovery.service.FieldExportService;
import com.cgi.fielddiscovery.discovery.service.FieldReviewService;
import com.cgi.fielddiscovery.discovery.service.queue.DiscoveryTaskProcessor;
import com.cgi.fielddiscovery.discovery.service.queue.DiscoveryTaskQueue;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * REST Controller for field discovery, review and export.
 */
@RestController
@RequestMapping("/api/field-discovery")
@Tag(name = "Field Discovery", description = "API for discovering, classifying and reviewing data fields")
public class FieldDiscoveryController {
    private static final Logger log = LoggerFactory.getLogger(FieldDiscoveryController.class);

    static final String USER_HEADER = "X-User-Id";
    static final String DEFAULT_USER = "user";

    private final DiscoveryService discoveryService;
    private final FieldReviewService reviewService;
    private final DiscoveryStatsService statsService;
    private final FieldExportService exportService;
    private final ClassificationMetricsCollector metricsCollector;
    private final DiscoveryTaskQueue taskQueue;
    private final DiscoveryTaskProcessor taskProcessor;

    @Autowired
    public FieldDiscoveryController(DiscoveryService discoveryService,
                                    FieldReviewService reviewService,
                                    DiscoveryStatsService statsService,
                                    FieldExportService exportService,
                                    ClassificationMetricsCollector metricsCollector,
                                    DiscoveryTaskQueue taskQueue,
                                    DiscoveryTaskProcessor taskProcessor) {
        this.discoveryService = discoveryService;
        this.reviewService = reviewService;
        this.statsService = statsService;
        this.exportService = exportService;
        this.metricsCollector = metricsCollector;
        this.taskQueue = taskQueue;
        this.taskProcessor = taskProcessor;
    }

    @Operation(summary = "Start a discovery session; processing continues in the background")
    @PostMapping("/discover")
    public ResponseEntity<ApiResponse<DiscoverySession>> startDiscovery(
            @Valid @RequestBody StartDiscoveryRequest request,
            @RequestHeader(value = USER_HEADER, defaultValue = DEFAULT_USER) String userId) {

        log.info("Discovery requested by {} for data source {}", userId, request.getDataSourceId());

        DiscoverySession session = discoveryService.startDiscovery(request.getDataSourceId(),
                request.getSchemas(), request.getTables(), request.isForceRefresh(), userId);

        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(ApiResponse.success(session, "Discovery started"));
    }

    @Operation(summary = "List recent discovery sessions")
    @GetMapping("/sessions")
    public ResponseEntity<ApiResponse<List<DiscoverySession>>> listSessions(
            @RequestParam(required = false) String dataSourceId,
            @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(ApiResponse.success(discoveryService.listSessions(dataSourceId, limit)));
    }

    @Operation(summary = "Get a discovery session with its progress")
    @GetMapping("/sessions/{sessionId}")
    public ResponseEntity<ApiResponse<DiscoverySession>> getSession(@PathVariable String sessionId) {
        return ResponseEntity.ok(ApiResponse.success(discoveryService.getSession(sessionId)));
    }

    @Operation(summary = "Delete a completed or failed discovery session")
    @DeleteMapping("/sessions/{sessionId}")
    public ResponseEntity<ApiResponse<Void>> deleteSession(@PathVariable String sessionId) {
        discoveryService.deleteSession(sessionId);
        return ResponseEntity.ok(ApiResponse.success(null, "Session deleted"));
    }

    @Operation(summary = "List discovered fields")
    @GetMapping("/fields")
    public ResponseEntity<ApiResponse<FieldPage>> getFields(
            @RequestParam(required = false) String dataSourceId,
            @RequestParam(required = false) String schema,
            @RequestParam(required = false) String table,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String classification,
            @RequestParam(required = false) String sensitivity,
            @RequestParam(required = false) String search,
            @RequestParam(defaultValue = "50") int limit,
            @RequestParam(defaultValue = "0") int offset) {

        FieldFilter filter = buildFilter(dataSourceId, schema, table, status, classification, sensitivity, search)
                .toBuilder()
                .limit(limit)
                .offset(offset)
                .build();
        return ResponseEntity.ok(ApiResponse.success(discoveryService.getDiscoveredFields(filter)));
    }

    @Operation(summary = "Get a discovered field")
    @GetMapping("/fields/{fieldId}")
    public ResponseEntity<ApiResponse<DiscoveredField>> getField(@PathVariable String fieldId) {
        return ResponseEntity.ok(ApiResponse.success(discoveryService.getField(fieldId)));
    }

    @Operation(summary = "Get the classification history of a field")
    @GetMapping("/fields/{fieldId}/history")
    public ResponseEntity<ApiResponse<List<ClassificationHistoryEntry>>> getFieldHistory(
            @PathVariable String fieldId) {
        return ResponseEntity.ok(ApiResponse.success(discoveryService.getFieldHistory(fieldId)));
    }

    @Operation(summary = "Accept, reject or reset the review status of a field")
    @PatchMapping("/fields/{fieldId}/status")
    public ResponseEntity<ApiResponse<DiscoveredField>> updateFieldStatus(
            @PathVariable String fieldId,
            @Valid @RequestBody UpdateStatusRequest request,
            @RequestHeader(value = USER_HEADER, defaultValue = DEFAULT_USER) String userId) {

        DiscoveredField field = reviewService.updateFieldStatus(fieldId, request.getStatus(), userId);
        return ResponseEntity.ok(ApiResponse.success(field));
    }

    @Operation(summary = "Override the classification of a field")
    @PostMapping("/fields/{fieldId}/classify")
    public ResponseEntity<ApiResponse<DiscoveredField>> classifyField(
            @PathVariable String fieldId,
            @Valid @RequestBody ClassifyFieldRequest request,
            @RequestHeader(value = USER_HEADER, defaultValue = DEFAULT_USER) String userId) {

        DiscoveredField field = reviewService.classifyField(fieldId, request.getClassification(),
                request.getSensitivity(), userId);
        return ResponseEntity.ok(ApiResponse.success(field));
    }

    @Operation(summary = "Accept or reject several fields")
    @PostMapping("/fields/bulk-action")
    public ResponseEntity<ApiResponse<BulkUpdateResult>> bulkAction(
            @Valid @RequestBody BulkActionRequest request,
            @RequestHeader(value = USER_HEADER, defaultValue = DEFAULT_USER) String userId) {

        BulkUpdateResult result = reviewService.bulkUpdateStatus(request.getFieldIds(), request.getAction(), userId);
        return ResponseEntity.ok(ApiResponse.success(result));
    }

    @Operation(summary = "Get discovery statistics")
    @GetMapping("/stats")
    public ResponseEntity<ApiResponse<DiscoveryStats>> getStats(
            @RequestParam(required = false) String dataSourceId) {
        return ResponseEntity.ok(ApiResponse.success(statsService.getStats(dataSourceId)));
    }

    @Operation(summary = "Export discovered fields as json, csv, sql or markdown")
    @GetMapping("/export")
    public ResponseEntity<String> exportFields(
            @RequestParam(defaultValue = "json") String format,
            @RequestParam(required = false) String dataSourceId,
            @RequestParam(required = false) String schema,
            @RequestParam(required = false) String table,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String classification,
            @RequestParam(required = false) String sensitivity) {

        ExportFormat exportFormat = parse(format, ExportFormat::fromValue);
        if (exportFormat == null) {
            throw new ValidationException("format is required");
        }
        FieldFilter filter = buildFilter(dataSourceId, schema, table, status, classification, sensitivity, null);
        FieldExportService.ExportResult export = exportService.exportFields(filter, exportFormat);

        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=" + export.getFilename())
                .contentType(MediaType.parseMediaType(export.getContentType()))
                .body(export.getContent());
    }

    @Operation(summary = "Get classification pipeline and discovery queue metrics")
    @GetMapping("/metrics")
    public ResponseEntity<ApiResponse<Map<String, Object>>> getMetrics() {
        Map<String, Object> report = new LinkedHashMap<>(metricsCollector.getMetricsReport());
        report.put("queuedTasks", taskQueue.getPendingTaskCount());
        report.put("processedTasks", taskProcessor.getProcessedTaskCount());
        report.put("failedTasks", taskProcessor.getFailedTaskCount());
        return ResponseEntity.ok(ApiResponse.success(report));
    }

    private static FieldFilter buildFilter(String dataSourceId, String schema, String table, String status,
                                           String classification, String sensitivity, String search) {
        return FieldFilter.builder()
                .dataSourceId(dataSourceId)
                .schema(schema)
                .table(table)
                .status(parse(status, FieldStatus::fromValue))
                .classification(parse(classification, FieldClassification::fromValue))
                .sensitivity(parse(sensitivity, Sensitivity::fromValue))
                .search(search)
                .build();
    }

    private static <T> T parse(String value, Function<String, T> parser) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return parser.apply(value);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage());
        }
    }
}
