package za.co.analytics.pipeline.derived_metrics_batch.runner;

import za.co.analytics.pipeline.derived_metrics_batch.model.DebtorTotals;
import za.co.analytics.pipeline.derived_metrics_batch.model.ImportActivityReport;
import za.co.analytics.pipeline.derived_metrics_batch.model.PharmacyImportActivity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ReportPrinter Unit Tests")
class ReportPrinterTest {

    private ByteArrayOutputStream buffer;
    private ReportPrinter printer;

    @BeforeEach
    void setUp() {
        buffer = new ByteArrayOutputStream();
        printer = new ReportPrinter(new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("printImportActivity - ends with the store-wide debtor totals")
    void printImportActivity_DebtorTotals() {
        // Given
        ImportActivityReport report = new ImportActivityReport(null,
                List.of(new PharmacyImportActivity(1, "Reitz Apteek", 3,
                        OffsetDateTime.of(2026, 10, 18, 9, 30, 0, 0, ZoneOffset.UTC))),
                new DebtorTotals(2, 1375, new BigDecimal("1234567.5")));

        // When
        printer.printImportActivity(report);

        // Then
        String output = buffer.toString(StandardCharsets.UTF_8);
        assertThat(output).contains("No imports found.");
        assertThat(output).contains("Reitz Apteek: 3 import(s)");
        assertThat(output).contains("TOTAL DEBTORS SUMMARY");
        assertThat(output).contains("Pharmacies with debtors: 2");
        assertThat(output).contains("Total debtor accounts: 1375");
        assertThat(output).contains("Total outstanding: R 1,234,567.50");
    }

    @Test
    @DisplayName("printImportActivity - no debtors prints zero totals")
    void printImportActivity_NoDebtors() {
        printer.printImportActivity(new ImportActivityReport(null, List.of(), DebtorTotals.empty()));

        assertThat(buffer.toString(StandardCharsets.UTF_8))
                .contains("Total debtor accounts: 0")
                .contains("Total outstanding: R 0.00");
    }
}
