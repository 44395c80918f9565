package com.phillippitts.selfspy.presentation.controller;

import com.phillippitts.selfspy.domain.ActivityStats;
import com.phillippitts.selfspy.domain.ExportFormat;
import com.phillippitts.selfspy.domain.MonitorStatus;
import com.phillippitts.selfspy.service.engine.ActivityEngine;
import com.phillippitts.selfspy.service.export.ActivityExporter;
import com.phillippitts.selfspy.service.stats.StatsAggregator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Locale;

/**
 * Read-only reporting endpoints over the engine and the store.
 */
@RestController
@RequestMapping("/api")
class ActivityController {

    private static final Logger log = LogManager.getLogger(ActivityController.class);

    private final ActivityEngine engine;
    private final StatsAggregator stats;
    private final ActivityExporter exporter;

    ActivityController(ActivityEngine engine, StatsAggregator stats, ActivityExporter exporter) {
        this.engine = engine;
        this.stats = stats;
        this.exporter = exporter;
    }

    @GetMapping("/status")
    MonitorStatus status() {
        return engine.status();
    }

    @GetMapping("/stats")
    ActivityStats stats(@RequestParam(defaultValue = "1") int days) {
        return stats.getStats(days);
    }

    @GetMapping("/export")
    ResponseEntity<String> export(@RequestParam(defaultValue = "1") int days,
                                  @RequestParam(defaultValue = "json") String format) {
        ExportFormat fmt = ExportFormat.from(format);
        String body = exporter.exportRange(days, fmt);
        log.info("Export served: days={}, format={}, chars={}", days, fmt, body.length());
        MediaType type = switch (fmt) {
            case JSON -> MediaType.APPLICATION_JSON;
            case CSV -> MediaType.parseMediaType("text/csv");
            case SQL -> MediaType.TEXT_PLAIN;
        };
        return ResponseEntity.ok()
                .contentType(type)
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        "inline; filename=\"selfspy-export." + fmt.name().toLowerCase(Locale.ROOT) + "\"")
                .body(body);
    }
}
