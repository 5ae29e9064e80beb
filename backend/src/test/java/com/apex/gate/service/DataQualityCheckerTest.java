package com.apex.gate.service;

import com.apex.gate.config.DataQualityProperties;
import com.apex.gate.model.Bar;
import com.apex.gate.model.QualityReport;
import com.apex.gate.model.QualitySeverity;
import com.apex.gate.model.QualityStatus;
import com.apex.gate.util.TestBarFactory;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DataQualityCheckerTest {

    private final DataQualityChecker checker = new DataQualityChecker(new DataQualityProperties());

    @Test
    void validBarsPass() {
        QualityReport report = checker.validate(TestBarFactory.trendingBars(30, 100, 0.5));

        assertThat(report.getOverallStatus()).isEqualTo(QualityStatus.PASS);
        assertThat(report.getIssues()).isEmpty();
        assertThat(report.getChecksPerformed()).containsExactly(
                DataQualityChecker.CHECK_MISSING_VALUES,
                DataQualityChecker.CHECK_OHLC,
                DataQualityChecker.CHECK_DUPLICATES,
                DataQualityChecker.CHECK_GAPS,
                DataQualityChecker.CHECK_OUTLIERS);
    }

    @Test
    void highBelowLowFailsOhlcCheck() {
        List<Bar> bars = new ArrayList<>(TestBarFactory.flatBars(5, 100));
        bars.set(2, TestBarFactory.bar(bars.get(2).getTimestamp(), 100, 95, 105, 100, 1_000_000L));

        QualityReport report = checker.validate(bars);

        assertThat(report.getOverallStatus()).isEqualTo(QualityStatus.FAIL);
        assertThat(report.hasIssue(DataQualityChecker.CHECK_OHLC, QualitySeverity.ERROR)).isTrue();
        assertThat(report.getValidationErrors()).anyMatch(error -> error.contains("high < low"));
    }

    @Test
    void emptyInputFails() {
        QualityReport report = checker.validate(List.of());

        assertThat(report.getOverallStatus()).isEqualTo(QualityStatus.FAIL);
        assertThat(report.hasIssue(DataQualityChecker.CHECK_EMPTY, QualitySeverity.ERROR)).isTrue();
    }

    @Test
    void missingCloseIsAnError() {
        List<Bar> bars = new ArrayList<>(TestBarFactory.flatBars(5, 100));
        bars.get(1).setClose(null);

        QualityReport report = checker.validate(bars);

        assertThat(report.getOverallStatus()).isEqualTo(QualityStatus.FAIL);
        assertThat(report.issuesFor(DataQualityChecker.CHECK_MISSING_VALUES)).hasSize(1);
    }

    @Test
    void duplicatesGapsAndOutliersAreWarnings() {
        LocalDateTime start = TestBarFactory.START;
        List<Bar> bars = List.of(
                TestBarFactory.bar(start, 100, 101, 99, 100, 1_000L),
                TestBarFactory.bar(start, 100, 101, 99, 100, 1_000L),
                TestBarFactory.bar(start.plusDays(1), 100, 101, 99, 100, 1_000L),
                TestBarFactory.bar(start.plusDays(2), 100, 101, 99, 100, 1_000L),
                TestBarFactory.bar(start.plusDays(3), 100, 101, 99, 100, 1_000L),
                TestBarFactory.bar(start.plusDays(10), 100, 121, 99, 120, 1_000L),
                TestBarFactory.bar(start.plusDays(11), 120, 121, 119, 120, 50_000L));

        QualityReport report = checker.validate(bars);

        assertThat(report.getOverallStatus()).isEqualTo(QualityStatus.WARNING);
        assertThat(report.hasIssue(DataQualityChecker.CHECK_DUPLICATES, QualitySeverity.WARNING)).isTrue();
        assertThat(report.getGaps()).hasSize(1);
        assertThat(report.getGaps().get(0)).containsEntry("days", 7L);
        assertThat(report.getOutliers()).extracting(outlier -> outlier.get("type")).contains("price", "volume");
        assertThat(report.getRecommendations()).isNotEmpty();
    }

    @Test
    void validateAllReportsPerSymbol() {
        Map<String, QualityReport> reports = checker.validateAll(Map.of(
                "AAPL", TestBarFactory.flatBars(10, 100),
                "MSFT", List.of()));

        assertThat(reports.get("AAPL").getOverallStatus()).isEqualTo(QualityStatus.PASS);
        assertThat(reports.get("MSFT").getOverallStatus()).isEqualTo(QualityStatus.FAIL);
    }

    @Test
    void staleDataWarns() {
        QualityReport stale = checker.checkFreshness(LocalDateTime.now().minusHours(48), null);
        QualityReport fresh = checker.checkFreshness(LocalDateTime.now().minusHours(1), 24);

        assertThat(stale.getOverallStatus()).isEqualTo(QualityStatus.WARNING);
        assertThat(fresh.getOverallStatus()).isEqualTo(QualityStatus.PASS);
    }
}
