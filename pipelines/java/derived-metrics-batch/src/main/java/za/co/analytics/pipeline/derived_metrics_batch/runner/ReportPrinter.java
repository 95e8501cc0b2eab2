package za.co.analytics.pipeline.derived_metrics_batch.runner;

import za.co.analytics.pipeline.derived_metrics_batch.model.CoverageRow;
import za.co.analytics.pipeline.derived_metrics_batch.model.DateRange;
import za.co.analytics.pipeline.derived_metrics_batch.model.DebtorTotals;
import za.co.analytics.pipeline.derived_metrics_batch.model.ImportActivityReport;
import za.co.analytics.pipeline.derived_metrics_batch.model.ImportBatch;
import za.co.analytics.pipeline.derived_metrics_batch.model.PharmacyImportActivity;
import za.co.analytics.pipeline.derived_metrics_batch.model.ProductUsage;
import za.co.analytics.pipeline.derived_metrics_batch.model.ProductUsageView;
import za.co.analytics.pipeline.derived_metrics_batch.model.ReconciliationReport;
import za.co.analytics.pipeline.derived_metrics_batch.model.ReportKind;
import za.co.analytics.pipeline.derived_metrics_batch.model.UsageWindow;

import java.io.PrintStream;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Plain-text rendering of the pipeline results for the console.
 */
public class ReportPrinter {

    private static final String RULE = "=".repeat(70);

    private final PrintStream out;

    public ReportPrinter(PrintStream out) {
        this.out = out;
    }

    public void printRefreshedCount(long summaryRows) {
        out.printf("Refreshed product usage averages: %d summary records present%n", summaryRows);
    }

    public void printUsage(String productCode, ProductUsage usage) {
        out.printf("Usage averages for %s (pharmacy %d):%n", productCode, usage.pharmacyId());
        for (UsageWindow window : usage.averages().keySet()) {
            out.printf("  %dd: %s%n", window.days(), usage.averageFor(window).toPlainString());
        }
        out.printf("  Last recalc: %s%n", usage.lastRecalc());
    }

    public void printNoUsage(String productCode, int pharmacyId) {
        out.printf("No usage data found for product %s (pharmacy %d)%n", productCode, pharmacyId);
    }

    public void printUsageRanking(int pharmacyId, List<ProductUsageView> ranking) {
        if (ranking.isEmpty()) {
            out.printf("No usage summaries for pharmacy %d%n", pharmacyId);
            return;
        }
        List<UsageWindow> windows = List.copyOf(ranking.get(0).usage().averages().keySet());
        String header = windows.stream()
                .map(window -> String.format("%10s", "avg_" + window.days() + "d"))
                .collect(Collectors.joining(" | "));
        out.printf("%-14s | %-30s | %s%n", "product_code", "description", header);
        out.println("-".repeat(50 + windows.size() * 13));
        for (ProductUsageView view : ranking) {
            String averages = windows.stream()
                    .map(window -> String.format("%10s", view.usage().averageFor(window).toPlainString()))
                    .collect(Collectors.joining(" | "));
            out.printf("%-14s | %-30s | %s%n", view.productCode(), truncate(view.description(), 30), averages);
        }
    }

    public void printLogbook(DateRange range, List<CoverageRow> rows) {
        if (rows.isEmpty()) {
            out.println("No rows found for the chosen filters.");
            return;
        }
        out.printf("Logbook: %s%n", range);
        StringBuilder header = new StringBuilder(String.format("%-10s | %11s | %-27s |", "date", "pharmacy_id", "pharmacy"));
        for (ReportKind kind : ReportKind.values()) {
            header.append(String.format(" %-9s |", kind.code()));
        }
        header.append(" missing");
        out.println(header);
        out.println("-".repeat(header.length() + 10));

        for (CoverageRow row : rows) {
            StringBuilder line = new StringBuilder(String.format("%-10s | %11d | %-27s |",
                    row.businessDate(), row.pharmacyId(), truncate(row.pharmacyName(), 27)));
            for (ReportKind kind : ReportKind.values()) {
                line.append(String.format(" %-9s |", row.hasReceived(kind) ? "    Y" : ""));
            }
            line.append(' ').append(row.isComplete() ? "-" : row.missing().stream()
                    .map(ReportKind::code)
                    .collect(Collectors.joining(",")));
            out.println(line);
        }
    }

    public void printReconciliation(ReconciliationReport report) {
        out.println(RULE);
        out.println("PROBLEMATIC IMPORTS (claim records but have none linked)");
        out.println(RULE);
        if (report.hasProblematicBatches()) {
            for (ImportBatch batch : report.problematicBatches()) {
                out.printf("%nBatch ID: %d%n", batch.batchId());
                out.printf("  Pharmacy: %s (ID: %d)%n", batch.pharmacyName(), batch.pharmacyId());
                out.printf("  Filename: %s%n", batch.sourceFilename());
                out.printf("  Uploaded: %s%n", batch.uploadedAt());
                out.printf("  Expected records: %d%n", batch.claimedRecordCount());
                out.printf("  Actual records: %d%n", batch.derivedRecordCount());
                out.printf("  Status: %s%n", batch.status());
                if (batch.errorMessage() != null) {
                    out.printf("  Error: %s%n", batch.errorMessage());
                }
            }
        } else {
            out.println("\nNo problematic imports found");
        }

        out.println();
        out.println(RULE);
        out.println("LAST SUCCESSFUL INSERTION");
        out.println(RULE);
        report.lastSuccessful().ifPresentOrElse(batch -> {
            out.printf("Batch ID: %d%n", batch.batchId());
            out.printf("Pharmacy: %s%n", batch.pharmacyName());
            out.printf("Uploaded: %s%n", batch.uploadedAt());
            out.printf("Expected: %d records%n", batch.claimedRecordCount());
            out.printf("Actual: %d records%n", batch.derivedRecordCount());
        }, () -> out.println("No successful insertions found: every import has 0 linked records"));
    }

    public void printImportActivity(ImportActivityReport report) {
        out.println();
        out.println(RULE);
        out.println("LAST IMPORT");
        out.println(RULE);
        report.latest().ifPresentOrElse(batch -> {
            out.printf("Batch ID: %d%n", batch.batchId());
            out.printf("Pharmacy: %s (ID: %d)%n", batch.pharmacyName(), batch.pharmacyId());
            out.printf("Filename: %s%n", batch.sourceFilename());
            out.printf("Uploaded At: %s%n", batch.uploadedAt());
            out.printf("Status: %s%n", batch.status());
        }, () -> out.println("No imports found."));

        out.println();
        out.println(RULE);
        out.println("IMPORTS BY PHARMACY");
        out.println(RULE);
        for (PharmacyImportActivity activity : report.byPharmacy()) {
            out.printf("%s: %d import(s), last import: %s%n",
                    activity.pharmacyName(), activity.batchCount(), activity.lastUploadedAt());
        }

        DebtorTotals totals = report.totals();
        out.println();
        out.println(RULE);
        out.println("TOTAL DEBTORS SUMMARY");
        out.println(RULE);
        out.printf("Pharmacies with debtors: %d%n", totals.pharmacyCount());
        out.printf("Total debtor accounts: %d%n", totals.accountCount());
        out.printf(Locale.ROOT, "Total outstanding: R %,.2f%n", totals.totalOutstanding());
    }

    public void printError(String message) {
        out.println("ERROR: " + message);
    }

    private static String truncate(String value, int width) {
        if (value == null) {
            return "";
        }
        return value.length() <= width ? value : value.substring(0, width);
    }
}
