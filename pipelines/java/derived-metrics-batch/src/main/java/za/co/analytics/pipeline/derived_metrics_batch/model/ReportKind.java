package za.co.analytics.pipeline.derived_metrics_batch.model;

/**
 * The fixed set of daily reports a pharmacy sends in. Each kind owns one boolean
 * column of the coverage ledger.
 */
public enum ReportKind {

    TURNOVER("INV249", "inv249_turnover"),
    TRADING_STOCK("STK261", "stk261_trading"),
    SCRIPTS_DISPENSED("PHM080", "phm080_scripts"),
    GROSS_PROFIT("STK260_GP", "stk260_gp");

    private final String code;
    private final String columnName;

    ReportKind(String code, String columnName) {
        this.code = code;
        this.columnName = columnName;
    }

    public String code() {
        return code;
    }

    public String columnName() {
        return columnName;
    }
}
