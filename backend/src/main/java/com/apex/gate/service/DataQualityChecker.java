package com.apex.gate.service;

import com.apex.gate.config.DataQualityProperties;
import com.apex.gate.model.Bar;
import com.apex.gate.model.QualityReport;
import com.apex.gate.model.QualitySeverity;
import com.apex.gate.model.QualityStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Service
@Slf4j
@RequiredArgsConstructor
public class DataQualityChecker {

    public static final String CHECK_EMPTY = "empty_data";
    public static final String CHECK_MISSING_VALUES = "missing_values";
    public static final String CHECK_OHLC = "ohlc_relationships";
    public static final String CHECK_DUPLICATES = "duplicate_timestamps";
    public static final String CHECK_GAPS = "gaps";
    public static final String CHECK_OUTLIERS = "outliers";
    public static final String CHECK_FRESHNESS = "freshness";

    private final DataQualityProperties properties;

    public QualityReport validate(List<Bar> bars) {
        QualityReport report = new QualityReport();
        if (bars == null || bars.isEmpty()) {
            report.addIssue(QualitySeverity.ERROR, CHECK_EMPTY, "No data provided", Map.of());
            report.addRecommendation("Fetch market data for the requested range before validating");
            return report;
        }

        checkMissingValues(bars, report);
        checkOhlcRelationships(bars, report);
        checkDuplicateTimestamps(bars, report);
        checkGaps(bars, report);
        checkOutliers(bars, report);
        addRecommendations(report);

        log.debug("Data quality check complete: status={} issues={}", report.getOverallStatus(), report.getIssues().size());
        return report;
    }

    public Map<String, QualityReport> validateAll(Map<String, List<Bar>> barsBySymbol) {
        Map<String, QualityReport> reports = new LinkedHashMap<>();
        if (barsBySymbol == null) {
            return reports;
        }
        barsBySymbol.forEach((symbol, bars) -> {
            QualityReport report = validate(bars);
            if (report.getOverallStatus() != QualityStatus.PASS) {
                log.warn("Data quality {} for {}: {}", report.getOverallStatus(), symbol, report.getValidationErrors());
            }
            reports.put(symbol, report);
        });
        return reports;
    }

    public QualityReport checkFreshness(LocalDateTime lastUpdated, Integer maxAgeHours) {
        QualityReport report = new QualityReport();
        report.markPerformed(CHECK_FRESHNESS);
        int limit = maxAgeHours != null ? maxAgeHours : properties.getMaxAgeHours();
        if (lastUpdated == null) {
            report.addIssue(QualitySeverity.WARNING, CHECK_FRESHNESS, "Data has never been updated", Map.of());
            report.addRecommendation("Refresh the market data cache");
            return report;
        }
        double ageHours = Duration.between(lastUpdated, LocalDateTime.now()).toMinutes() / 60.0;
        if (ageHours > limit) {
            report.addIssue(QualitySeverity.WARNING, CHECK_FRESHNESS,
                    String.format(Locale.ROOT, "Data is stale (%.1f hours old, threshold: %d hours)", ageHours, limit),
                    Map.of("age_hours", ageHours, "threshold_hours", limit));
            report.addRecommendation("Refresh the market data cache");
        }
        return report;
    }

    private void checkMissingValues(List<Bar> bars, QualityReport report) {
        report.markPerformed(CHECK_MISSING_VALUES);
        int missing = 0;
        for (int i = 0; i < bars.size(); i++) {
            Bar bar = bars.get(i);
            if (bar == null || !bar.isComplete()) {
                missing++;
                report.addIssue(QualitySeverity.ERROR, CHECK_MISSING_VALUES,
                        "Bar " + i + " is missing required fields", Map.of("index", i));
            }
        }
        if (missing > 0) {
            log.debug("Found {} bars with missing fields", missing);
        }
    }

    private void checkOhlcRelationships(List<Bar> bars, QualityReport report) {
        report.markPerformed(CHECK_OHLC);
        for (int i = 0; i < bars.size(); i++) {
            Bar bar = bars.get(i);
            if (bar == null || bar.getOpen() == null || bar.getHigh() == null || bar.getLow() == null || bar.getClose() == null) {
                continue;
            }
            List<String> problems = new ArrayList<>();
            if (bar.getHigh() < bar.getLow()) {
                problems.add("high < low");
            }
            if (bar.getHigh() < bar.getOpen()) {
                problems.add("high < open");
            }
            if (bar.getHigh() < bar.getClose()) {
                problems.add("high < close");
            }
            if (bar.getLow() > bar.getOpen()) {
                problems.add("low > open");
            }
            if (bar.getLow() > bar.getClose()) {
                problems.add("low > close");
            }
            for (String problem : problems) {
                report.addIssue(QualitySeverity.ERROR, CHECK_OHLC,
                        "Invalid OHLC at bar " + i + ": " + problem,
                        detailsOf(bar, i));
            }
        }
    }

    private void checkDuplicateTimestamps(List<Bar> bars, QualityReport report) {
        report.markPerformed(CHECK_DUPLICATES);
        Map<LocalDateTime, Integer> counts = new LinkedHashMap<>();
        for (Bar bar : bars) {
            if (bar != null && bar.getTimestamp() != null) {
                counts.merge(bar.getTimestamp(), 1, Integer::sum);
            }
        }
        counts.forEach((timestamp, count) -> {
            if (count > 1) {
                report.addIssue(QualitySeverity.WARNING, CHECK_DUPLICATES,
                        "Duplicate timestamp " + timestamp + " appears " + count + " times",
                        Map.of("timestamp", timestamp.toString(), "count", count));
            }
        });
    }

    private void checkGaps(List<Bar> bars, QualityReport report) {
        report.markPerformed(CHECK_GAPS);
        List<LocalDateTime> timestamps = bars.stream()
                .filter(bar -> bar != null && bar.getTimestamp() != null)
                .map(Bar::getTimestamp)
                .sorted()
                .toList();
        int threshold = properties.getGapThresholdDays();
        for (int i = 1; i < timestamps.size(); i++) {
            LocalDateTime previous = timestamps.get(i - 1);
            LocalDateTime current = timestamps.get(i);
            long days = Duration.between(previous, current).toDays();
            if (days > threshold) {
                Map<String, Object> gap = Map.of(
                        "start", previous.toString(),
                        "end", current.toString(),
                        "days", days);
                report.addGap(gap);
                report.addIssue(QualitySeverity.WARNING, CHECK_GAPS,
                        "Gap of " + days + " days between " + previous + " and " + current, gap);
            }
        }
    }

    private void checkOutliers(List<Bar> bars, QualityReport report) {
        report.markPerformed(CHECK_OUTLIERS);
        List<Bar> ordered = bars.stream()
                .filter(bar -> bar != null && bar.getTimestamp() != null)
                .sorted(Comparator.comparing(Bar::getTimestamp))
                .toList();
        double outlierPct = properties.getOutlierThresholdPct();
        int lookback = properties.getVolumeLookbackBars();
        for (int i = 1; i < ordered.size(); i++) {
            Bar previous = ordered.get(i - 1);
            Bar current = ordered.get(i);
            if (previous.getClose() != null && current.getClose() != null && previous.getClose() > 0) {
                double change = (current.getClose() - previous.getClose()) / previous.getClose();
                if (Math.abs(change) > outlierPct) {
                    Map<String, Object> outlier = Map.of(
                            "timestamp", current.getTimestamp().toString(),
                            "type", "price",
                            "pct_change", change);
                    report.addOutlier(outlier);
                    report.addIssue(QualitySeverity.WARNING, CHECK_OUTLIERS,
                            String.format(Locale.ROOT, "Price moved %.2f%% at %s", change * 100, current.getTimestamp()), outlier);
                }
            }
            if (i >= lookback && current.getVolume() != null) {
                double average = averageVolume(ordered.subList(i - lookback, i));
                if (average > 0 && current.getVolume() > average * properties.getVolumeSpikeMultiplier()) {
                    Map<String, Object> outlier = Map.of(
                            "timestamp", current.getTimestamp().toString(),
                            "type", "volume",
                            "volume", current.getVolume(),
                            "average_volume", average);
                    report.addOutlier(outlier);
                    report.addIssue(QualitySeverity.WARNING, CHECK_OUTLIERS,
                            "Volume spike of " + current.getVolume() + " at " + current.getTimestamp(), outlier);
                }
            }
        }
    }

    private double averageVolume(List<Bar> window) {
        return window.stream()
                .filter(bar -> bar.getVolume() != null)
                .mapToLong(Bar::getVolume)
                .average()
                .orElse(0.0);
    }

    private void addRecommendations(QualityReport report) {
        if (!report.issuesFor(CHECK_MISSING_VALUES).isEmpty()) {
            report.addRecommendation("Re-fetch or drop bars with missing OHLCV fields");
        }
        if (!report.issuesFor(CHECK_OHLC).isEmpty()) {
            report.addRecommendation("Inspect the data source for corrupted OHLC values");
        }
        if (!report.issuesFor(CHECK_DUPLICATES).isEmpty()) {
            report.addRecommendation("Deduplicate bars by timestamp");
        }
        if (!report.getGaps().isEmpty()) {
            report.addRecommendation("Backfill missing date ranges or confirm they are market holidays");
        }
        if (!report.getOutliers().isEmpty()) {
            report.addRecommendation("Verify outliers against a second data source");
        }
    }

    private Map<String, Object> detailsOf(Bar bar, int index) {
        Map<String, Object> details = new HashMap<>();
        details.put("index", index);
        details.put("open", bar.getOpen());
        details.put("high", bar.getHigh());
        details.put("low", bar.getLow());
        details.put("close", bar.getClose());
        if (bar.getTimestamp() != null) {
            details.put("timestamp", bar.getTimestamp().toString());
        }
        return details;
    }
}
