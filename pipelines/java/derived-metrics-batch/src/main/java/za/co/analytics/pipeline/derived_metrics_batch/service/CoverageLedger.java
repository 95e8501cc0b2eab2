package za.co.analytics.pipeline.derived_metrics_batch.service;

import za.co.analytics.pipeline.derived_metrics_batch.config.DerivedMetricsProperties;
import za.co.analytics.pipeline.derived_metrics_batch.exception.StoreOperationException;
import za.co.analytics.pipeline.derived_metrics_batch.model.CoverageQuery;
import za.co.analytics.pipeline.derived_metrics_batch.model.CoverageRow;
import za.co.analytics.pipeline.derived_metrics_batch.model.DateRange;
import za.co.analytics.pipeline.derived_metrics_batch.repository.ReportCoverageRepository;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * The report logbook: per pharmacy and business date, which daily reports arrived and
 * which are still missing. Read only.
 */
@Service
public class CoverageLedger {

    private static final Logger log = LoggerFactory.getLogger(CoverageLedger.class);

    private final ReportCoverageRepository reportCoverageRepository;
    private final DerivedMetricsProperties properties;
    private final Clock clock;

    public CoverageLedger(ReportCoverageRepository reportCoverageRepository,
                          DerivedMetricsProperties properties,
                          Clock clock) {
        this.reportCoverageRepository = reportCoverageRepository;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Resolves the logbook range selectors against today.
     *
     * @see DateRange#resolve
     */
    public DateRange resolveRange(@Nullable Integer daysBack, @Nullable LocalDate since, @Nullable LocalDate until) {
        return DateRange.resolve(daysBack, since, until, LocalDate.now(clock), properties.coverage().defaultDaysBack());
    }

    public DateRange defaultRange() {
        return resolveRange(null, null, null);
    }

    /**
     * @return matching rows, each carrying its missing kinds; empty when nothing matches
     */
    public List<CoverageRow> find(CoverageQuery query) {
        try {
            List<CoverageRow> rows = reportCoverageRepository.find(query);
            log.debug("Logbook {} returned {} rows", query.range(), rows.size());
            return rows;
        } catch (DataAccessException e) {
            throw new StoreOperationException("Logbook lookup for " + query.range() + " failed: " + e.getMessage(), e);
        }
    }
}
