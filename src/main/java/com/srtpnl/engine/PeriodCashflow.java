package com.srtpnl.engine;

import com.srtpnl.domain.enums.AmortisationRegime;
import lombok.Builder;
import lombok.Getter;

/**
 * What one waterfall step produced for the investor in a single period.
 */
@Getter
@Builder
public class PeriodCashflow {

    private final AmortisationRegime regime;
    private final double periodLosses;
    private final double principalPayment;
    private final double quarterlyCoupon;
    private final double quarterlyCashflow;
}
