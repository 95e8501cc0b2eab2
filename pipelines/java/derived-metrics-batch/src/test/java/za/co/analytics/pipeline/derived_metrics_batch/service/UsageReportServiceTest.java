package za.co.analytics.pipeline.derived_metrics_batch.service;

import za.co.analytics.pipeline.derived_metrics_batch.exception.DataUnavailableException;
import za.co.analytics.pipeline.derived_metrics_batch.model.ProductUsage;
import za.co.analytics.pipeline.derived_metrics_batch.model.ProductUsageView;
import za.co.analytics.pipeline.derived_metrics_batch.model.UsageWindow;
import za.co.analytics.pipeline.derived_metrics_batch.repository.ProductUsageRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("UsageReportService Unit Tests")
class UsageReportServiceTest {

    @Mock
    private ProductUsageRepository productUsageRepository;

    @InjectMocks
    private UsageReportService usageReportService;

    @Test
    @DisplayName("topUsage - returns the ranking from the store")
    void topUsage_ReturnsRanking() {
        // Given
        ProductUsageView view = view("LP9103984");
        when(productUsageRepository.findTopByLookbackAverage(1, 10)).thenReturn(List.of(view));

        // When / Then
        assertThat(usageReportService.topUsage(1, 10)).containsExactly(view);
    }

    @Test
    @DisplayName("topUsage - limit outside 1..200 is rejected")
    void topUsage_InvalidLimit() {
        assertThatThrownBy(() -> usageReportService.topUsage(1, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> usageReportService.topUsage(1, 201)).isInstanceOf(IllegalArgumentException.class);
        verify(productUsageRepository, never()).findTopByLookbackAverage(anyInt(), anyInt());
    }

    @Test
    @DisplayName("usage - missing summary is unavailable data")
    void usage_Missing() {
        // Given
        when(productUsageRepository.findByProductCode(1, "LP1")).thenReturn(Optional.empty());

        // When / Then
        assertThatThrownBy(() -> usageReportService.usage(1, "LP1"))
                .isInstanceOf(DataUnavailableException.class);
    }

    private static ProductUsageView view(String code) {
        return new ProductUsageView(code, "Paracetamol 500mg",
                new ProductUsage(1, 501L, Map.of(new UsageWindow(180), new BigDecimal("2.500")), OffsetDateTime.now()));
    }
}
