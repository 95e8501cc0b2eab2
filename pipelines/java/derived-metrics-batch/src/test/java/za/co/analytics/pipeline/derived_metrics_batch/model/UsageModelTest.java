package za.co.analytics.pipeline.derived_metrics_batch.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Usage model Unit Tests")
class UsageModelTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 10, 19);

    @Test
    @DisplayName("UsageWindows - sorts windows and uses the widest as lookback")
    void usageWindows_LookbackIsWidest() {
        // When
        UsageWindows windows = UsageWindows.ofDays(List.of(90, 180, 30, 90), 3);

        // Then
        assertThat(windows.windows()).extracting(UsageWindow::days).containsExactly(30, 90, 180);
        assertThat(windows.lookback().days()).isEqualTo(180);
        assertThat(windows.lookbackStart(TODAY)).isEqualTo(TODAY.minusDays(179));
    }

    @Test
    @DisplayName("UsageWindows - rejects an empty window set")
    void usageWindows_RejectsEmpty() {
        assertThatThrownBy(() -> UsageWindows.ofDays(List.of(), 3))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("UsageWindow - contains its first and last day only")
    void usageWindow_Contains() {
        // Given
        UsageWindow window = new UsageWindow(30);

        // Then
        assertThat(window.columnName()).isEqualTo("avg_qty_30d");
        assertThat(window.contains(TODAY, TODAY)).isTrue();
        assertThat(window.contains(TODAY.minusDays(29), TODAY)).isTrue();
        assertThat(window.contains(TODAY.minusDays(30), TODAY)).isFalse();
        assertThat(window.contains(TODAY.plusDays(1), TODAY)).isFalse();
    }

    @Test
    @DisplayName("UsageScope - single-key scope needs pharmacy and product code")
    void usageScope_Validation() {
        assertThat(UsageScope.all().isAll()).isTrue();
        assertThat(UsageScope.product(2, "LP9103984").isAll()).isFalse();
        assertThatThrownBy(() -> new UsageScope(2, null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> UsageScope.product(2, " ")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("ProductUsage - unknown window is rejected")
    void productUsage_UnknownWindow() {
        // Given
        ProductUsage usage = new ProductUsage(1, 1L, Map.of(new UsageWindow(30), BigDecimal.ONE), OffsetDateTime.now());

        // Then
        assertThat(usage.averageFor(30)).isEqualByComparingTo("1");
        assertThatThrownBy(() -> usage.averageFor(90)).isInstanceOf(IllegalArgumentException.class);
    }
}
