package com.srtpnl.reporting;

import com.srtpnl.domain.model.PeriodRecord;
import lombok.Builder;
import lombok.Getter;

/**
 * Narrow projection of a {@link PeriodRecord} for ledger views: when it happened, which
 * regime applied, what was received and where PnL stood.
 */
@Getter
@Builder
public class LedgerRow {

    private final String scenarioId;
    private final int period;
    private final int year;
    private final int quarter;
    private final String amortisationType;
    private final double quarterlyCashflow;
    private final double cumulativePnl;
    private final double riskAdjustedPnl;

    public static LedgerRow from(PeriodRecord record) {
        return LedgerRow.builder()
                .scenarioId(record.getScenarioId())
                .period(record.getPeriod())
                .year(record.getYear())
                .quarter(record.getQuarter())
                .amortisationType(record.getAmortisationRegime().getLabel())
                .quarterlyCashflow(record.getQuarterlyCashflow())
                .cumulativePnl(record.getCumulativePnl())
                .riskAdjustedPnl(record.getRiskAdjustedPnl())
                .build();
    }
}
