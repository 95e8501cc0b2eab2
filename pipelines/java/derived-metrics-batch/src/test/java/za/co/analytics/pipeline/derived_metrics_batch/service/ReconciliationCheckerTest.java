package za.co.analytics.pipeline.derived_metrics_batch.service;

import za.co.analytics.pipeline.derived_metrics_batch.config.DerivedMetricsProperties;
import za.co.analytics.pipeline.derived_metrics_batch.model.DebtorTotals;
import za.co.analytics.pipeline.derived_metrics_batch.model.ImportActivityReport;
import za.co.analytics.pipeline.derived_metrics_batch.model.ImportBatch;
import za.co.analytics.pipeline.derived_metrics_batch.model.PharmacyImportActivity;
import za.co.analytics.pipeline.derived_metrics_batch.model.ReconciliationReport;
import za.co.analytics.pipeline.derived_metrics_batch.repository.ImportManifestRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ReconciliationChecker Unit Tests")
class ReconciliationCheckerTest {

    private static final OffsetDateTime UPLOADED = OffsetDateTime.of(2026, 10, 18, 9, 30, 0, 0, ZoneOffset.UTC);

    @Mock
    private ImportManifestRepository importManifestRepository;

    private ReconciliationChecker reconciliationChecker;

    @BeforeEach
    void setUp() {
        DerivedMetricsProperties properties = new DerivedMetricsProperties(
                new DerivedMetricsProperties.Usage(List.of(30, 90, 180), 3, Duration.ofMinutes(5), 500),
                new DerivedMetricsProperties.Coverage(30),
                new DerivedMetricsProperties.Reconciliation(5));
        reconciliationChecker = new ReconciliationChecker(importManifestRepository, properties);
    }

    @Test
    @DisplayName("check - reports problematic batches and the last successful one")
    void check_ProblematicAndSuccessful() {
        // Given
        ImportBatch lost = batch(7L, 50, 0);
        ImportBatch loaded = batch(6L, 50, 50);
        when(importManifestRepository.findProblematic(5)).thenReturn(List.of(lost));
        when(importManifestRepository.findLastSuccessful()).thenReturn(Optional.of(loaded));

        // When
        ReconciliationReport report = reconciliationChecker.check();

        // Then
        assertThat(report.problematicBatches()).containsExactly(lost);
        assertThat(report.lastSuccessful()).contains(loaded);
        assertThat(report.hasSuccessfulBatch()).isTrue();
    }

    @Test
    @DisplayName("check - no successful batch is reported explicitly")
    void check_NoSuccessfulBatch() {
        // Given
        when(importManifestRepository.findProblematic(3)).thenReturn(List.of());
        when(importManifestRepository.findLastSuccessful()).thenReturn(Optional.empty());

        // When
        ReconciliationReport report = reconciliationChecker.check(3);

        // Then
        assertThat(report.hasProblematicBatches()).isFalse();
        assertThat(report.hasSuccessfulBatch()).isFalse();
        verify(importManifestRepository).findProblematic(3);
    }

    @Test
    @DisplayName("check - limit below one is rejected")
    void check_InvalidLimit() {
        assertThatThrownBy(() -> reconciliationChecker.check(0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("importActivity - latest batch and per pharmacy counts")
    void importActivity_Summary() {
        // Given
        ImportBatch latest = batch(9L, 12, 12);
        PharmacyImportActivity reitz = new PharmacyImportActivity(1, "Reitz", 4, UPLOADED);
        when(importManifestRepository.findLatest()).thenReturn(Optional.of(latest));
        when(importManifestRepository.findActivityByPharmacy()).thenReturn(List.of(reitz));
        DebtorTotals totals = new DebtorTotals(1, 50, new BigDecimal("12500.75"));
        when(importManifestRepository.findDebtorTotals()).thenReturn(totals);

        // When
        ImportActivityReport report = reconciliationChecker.importActivity();

        // Then
        assertThat(report.latest()).contains(latest);
        assertThat(report.byPharmacy()).containsExactly(reitz);
        assertThat(report.totals()).isEqualTo(totals);
    }

    private static ImportBatch batch(Long id, int claimed, long derived) {
        return new ImportBatch(id, 1, "Reitz", "debtors_" + id + ".csv", UPLOADED, claimed, derived,
                derived > 0 ? "completed" : "failed", null);
    }
}
