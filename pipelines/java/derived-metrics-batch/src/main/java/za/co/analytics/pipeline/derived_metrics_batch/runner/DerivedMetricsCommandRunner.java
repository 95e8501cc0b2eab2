package za.co.analytics.pipeline.derived_metrics_batch.runner;

import za.co.analytics.pipeline.derived_metrics_batch.exception.DataUnavailableException;
import za.co.analytics.pipeline.derived_metrics_batch.model.CoverageQuery;
import za.co.analytics.pipeline.derived_metrics_batch.model.CoverageRow;
import za.co.analytics.pipeline.derived_metrics_batch.model.DateRange;
import za.co.analytics.pipeline.derived_metrics_batch.model.ProductUsage;
import za.co.analytics.pipeline.derived_metrics_batch.service.CoverageLedger;
import za.co.analytics.pipeline.derived_metrics_batch.service.ReconciliationChecker;
import za.co.analytics.pipeline.derived_metrics_batch.service.UsageAggregator;
import za.co.analytics.pipeline.derived_metrics_batch.service.UsageReportService;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;

/**
 * Dispatches the command named by the first non-option argument.
 *
 * <pre>
 * usage-refresh --all
 * usage-refresh --product=CODE [--product=CODE ...] [--pharmacy=ID]
 * usage-show --product=CODE [--pharmacy=ID]
 * usage-top --pharmacy=ID [--limit=N]
 * logbook [--days-back=N | --since=YYYY-MM-DD] [--until=YYYY-MM-DD] [--pharmacy-id=ID]
 *         [--pharmacy-like=TEXT] [--missing-only] [--order-asc]
 * import-diagnostics
 * </pre>
 */
@Component
public class DerivedMetricsCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_USAGE = 64;
    static final int DEFAULT_PHARMACY_ID = 1;
    static final int DEFAULT_TOP_LIMIT = 10;

    private static final Logger log = LoggerFactory.getLogger(DerivedMetricsCommandRunner.class);

    private final UsageAggregator usageAggregator;
    private final UsageReportService usageReportService;
    private final CoverageLedger coverageLedger;
    private final ReconciliationChecker reconciliationChecker;
    private final ReportPrinter printer;

    private int exitCode;

    public DerivedMetricsCommandRunner(UsageAggregator usageAggregator,
                                       UsageReportService usageReportService,
                                       CoverageLedger coverageLedger,
                                       ReconciliationChecker reconciliationChecker,
                                       ReportPrinter printer) {
        this.usageAggregator = usageAggregator;
        this.usageReportService = usageReportService;
        this.coverageLedger = coverageLedger;
        this.reconciliationChecker = reconciliationChecker;
        this.printer = printer;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> commands = args.getNonOptionArgs();
        if (commands.isEmpty()) {
            usageError("No command given. Expected one of: usage-refresh, usage-show, usage-top, logbook, import-diagnostics");
            return;
        }

        try {
            switch (commands.get(0)) {
                case "usage-refresh" -> refreshUsage(args);
                case "usage-show" -> showUsage(args);
                case "usage-top" -> topUsage(args);
                case "logbook" -> logbook(args);
                case "import-diagnostics" -> importDiagnostics();
                default -> usageError("Unknown command: " + commands.get(0));
            }
        } catch (IllegalArgumentException | DateTimeParseException e) {
            usageError(e.getMessage());
        }
    }

    private void refreshUsage(ApplicationArguments args) {
        if (args.containsOption("all")) {
            printer.printRefreshedCount(usageAggregator.refreshAll());
            return;
        }

        List<String> productCodes = optionValues(args, "product");
        if (productCodes.isEmpty()) {
            usageError("usage-refresh needs --all or at least one --product=CODE");
            return;
        }
        int pharmacyId = intOption(args, "pharmacy", DEFAULT_PHARMACY_ID);
        for (String productCode : productCodes) {
            try {
                Optional<ProductUsage> refreshed = usageAggregator.refreshProduct(pharmacyId, productCode);
                if (refreshed.isPresent()) {
                    printer.printUsage(productCode, refreshed.get());
                } else {
                    printer.printNoUsage(productCode, pharmacyId);
                }
            } catch (DataUnavailableException e) {
                log.warn("Skipping refresh of {}: {}", productCode, e.getMessage());
                printer.printError(e.getMessage());
                exitCode = e.getExitCode();
            }
        }
    }

    private void showUsage(ApplicationArguments args) {
        String productCode = requiredOption(args, "product");
        int pharmacyId = intOption(args, "pharmacy", DEFAULT_PHARMACY_ID);
        printer.printUsage(productCode, usageReportService.usage(pharmacyId, productCode).usage());
    }

    private void topUsage(ApplicationArguments args) {
        int pharmacyId = Integer.parseInt(requiredOption(args, "pharmacy"));
        int limit = intOption(args, "limit", DEFAULT_TOP_LIMIT);
        printer.printUsageRanking(pharmacyId, usageReportService.topUsage(pharmacyId, limit));
    }

    private void logbook(ApplicationArguments args) {
        CoverageQuery query = coverageQuery(args);
        List<CoverageRow> rows = coverageLedger.find(query);
        printer.printLogbook(query.range(), rows);
    }

    CoverageQuery coverageQuery(ApplicationArguments args) {
        String daysBack = singleOption(args, "days-back");
        String since = singleOption(args, "since");
        String until = singleOption(args, "until");
        String pharmacyId = singleOption(args, "pharmacy-id");

        DateRange range = coverageLedger.resolveRange(
                daysBack != null ? Integer.valueOf(daysBack) : null,
                since != null ? LocalDate.parse(since) : null,
                until != null ? LocalDate.parse(until) : null);

        return CoverageQuery.of(range)
                .withPharmacyId(pharmacyId != null ? Integer.valueOf(pharmacyId) : null)
                .withPharmacyNameLike(singleOption(args, "pharmacy-like"))
                .withMissingOnly(args.containsOption("missing-only"))
                .withAscending(args.containsOption("order-asc"));
    }

    private void importDiagnostics() {
        printer.printReconciliation(reconciliationChecker.check());
        printer.printImportActivity(reconciliationChecker.importActivity());
    }

    private void usageError(String message) {
        printer.printError(message);
        exitCode = EXIT_USAGE;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private static List<String> optionValues(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return values != null ? values : List.of();
    }

    private static @Nullable String singleOption(ApplicationArguments args, String name) {
        List<String> values = optionValues(args, name);
        if (values.size() > 1) {
            throw new IllegalArgumentException("--" + name + " given more than once");
        }
        return values.isEmpty() || values.get(0).isBlank() ? null : values.get(0);
    }

    private static String requiredOption(ApplicationArguments args, String name) {
        String value = singleOption(args, name);
        if (value == null) {
            throw new IllegalArgumentException("--" + name + " is required");
        }
        return value;
    }

    private static int intOption(ApplicationArguments args, String name, int defaultValue) {
        String value = singleOption(args, name);
        return value != null ? Integer.parseInt(value) : defaultValue;
    }
}
