package com.srtpnl.unit.validation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import com.srtpnl.domain.model.DealParameters;
import com.srtpnl.domain.model.ScenarioInput;
import com.srtpnl.exception.ErrorCode;
import com.srtpnl.exception.InvalidConfigurationException;
import com.srtpnl.validation.ConfigurationValidator;
import com.srtpnl.validation.ConfigurationViolation;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ConfigurationValidatorTest {

    private ConfigurationValidator validator;
    private DealParameters deal;

    @BeforeEach
    void setUp() {
        validator = new ConfigurationValidator();
        deal = DealParameters.builder()
                .trancheSize(50_000_000)
                .notionalAmount(500_000_000)
                .couponRate(0.11)
                .annualLossRate(0.0006)
                .clnPrice(45_000_000)
                .amortisationRate(0.33)
                .riskFreeRates(List.of(0.01))
                .build();
    }

    @Test
    void validDealPasses() {
        assertThatCode(() -> validator.validateDeal(deal)).doesNotThrowAnyException();
    }

    @Test
    void builderAppliesStructuralDefaults() {
        assertThat(deal.getMaturity()).isEqualTo(8);
        assertThat(deal.getReplenishmentPeriod()).isEqualTo(3);
        assertThat(deal.getPeriodsPerYear()).isEqualTo(4);
        assertThat(deal.getTotalPeriods()).isEqualTo(32);
    }

    @Test
    void rejectsNonPositivePeriodsPerYear() {
        assertThatThrownBy(() -> validator.validateDeal(deal.toBuilder().periodsPerYear(-1).build()))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("periodsPerYear must be greater than 0 (was -1)");
    }

    @Test
    void rejectsNonPositiveMaturity() {
        assertThatThrownBy(() -> validator.validateDeal(
                        deal.toBuilder().maturity(0).replenishmentPeriod(0).build()))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("maturity must be greater than 0 (was 0)");
    }

    @Test
    void rejectsEmptyRiskFreeCurve() {
        assertThatThrownBy(() -> validator.validateDeal(deal.toBuilder().riskFreeRates(List.of()).build()))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("riskFreeRates");
    }

    @Test
    void rejectsReplenishmentNotShorterThanMaturity() {
        assertThatThrownBy(() -> validator.validateDeal(deal.toBuilder().replenishmentPeriod(8).build()))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("replenishmentPeriod must be less than maturity 8 (was 8)");
        assertThatThrownBy(() -> validator.validateDeal(deal.toBuilder().replenishmentPeriod(-1).build()))
                .hasMessageContaining("replenishmentPeriod must not be negative (was -1)");
    }

    @Test
    void reportsEveryViolationAtOnce() {
        DealParameters broken = deal.toBuilder()
                .periodsPerYear(0)
                .riskFreeRates(List.of())
                .build();

        InvalidConfigurationException ex = catchThrowableOfType(
                () -> validator.validateDeal(broken), InvalidConfigurationException.class);

        assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.INVALID_CONFIGURATION);
        assertThat(ex.getViolations())
                .extracting(ConfigurationViolation::getField)
                .containsExactly("periodsPerYear", "riskFreeRates");
        assertThat(ex.getDetails()).containsOnlyKeys("periodsPerYear", "riskFreeRates");
    }

    @Test
    void rejectsNullAndNonFiniteRates() {
        InvalidConfigurationException ex = catchThrowableOfType(
                () -> validator.validateDeal(deal.toBuilder()
                        .riskFreeRates(Arrays.asList(0.01, null, Double.NaN))
                        .build()),
                InvalidConfigurationException.class);

        assertThat(ex.getViolations())
                .extracting(ConfigurationViolation::getField)
                .containsExactly("riskFreeRates[1]", "riskFreeRates[2]");
        assertThat(ex.getMessage()).contains("riskFreeRates[1] must be a finite rate (was null)");
    }

    @Test
    void rejectsHorizonBeyondPeriodCap() {
        assertThatThrownBy(() -> validator.validateDeal(deal.toBuilder().maturity(301).build()))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("maturity times periodsPerYear must not exceed 1200 periods (was 1204)");
        assertThatCode(() -> validator.validateDeal(deal.toBuilder().maturity(300).build()))
                .doesNotThrowAnyException();
    }

    @Test
    void horizonCheckDoesNotOverflow() {
        DealParameters huge = deal.toBuilder()
                .maturity(Integer.MAX_VALUE)
                .periodsPerYear(Integer.MAX_VALUE)
                .build();

        assertThatThrownBy(() -> validator.validateDeal(huge))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("(was " + (long) Integer.MAX_VALUE * Integer.MAX_VALUE + ")");
    }

    @Test
    void periodCapIsConfigurable() {
        ConfigurationValidator strict = new ConfigurationValidator(16);

        assertThatThrownBy(() -> strict.validateDeal(deal))
                .hasMessageContaining("must not exceed 16 periods (was 32)");
        assertThatCode(() -> strict.validateDeal(deal.toBuilder().maturity(4).build()))
                .doesNotThrowAnyException();
    }

    @Test
    void rejectsMissingScenario() {
        InvalidConfigurationException ex = catchThrowableOfType(
                () -> validator.validateScenario("Stress 4", null, 8), InvalidConfigurationException.class);

        assertThat(ex.getMessage()).isEqualTo("Invalid scenario Stress 4: scenario must not be null (was null)");
        assertThat(ex.getViolations()).extracting(ConfigurationViolation::getField).containsExactly("scenario");
    }

    @Test
    void validScenarioPasses() {
        assertThatCode(() -> validator.validateScenario("Stress 1", ScenarioInput.of(2.5, 8), 8))
                .doesNotThrowAnyException();
    }

    @Test
    void rejectsNonPositiveStress() {
        assertThatThrownBy(() -> validator.validateScenario("Stress 2", ScenarioInput.of(0, 4), 8))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("scenario Stress 2")
                .hasMessageContaining("stressMultiplier");
        assertThatThrownBy(() -> validator.validateScenario("Stress 2", ScenarioInput.of(Double.NaN, 4), 8))
                .isInstanceOf(InvalidConfigurationException.class);
    }

    @Test
    void rejectsTriggerYearOutsideDealLife() {
        assertThatThrownBy(() -> validator.validateScenario("Stress 3", ScenarioInput.of(1, 0), 8))
                .hasMessageContaining("triggerYear must be between 1 and 8 (was 0)");
        assertThatThrownBy(() -> validator.validateScenario("Stress 3", ScenarioInput.of(1, 9), 8))
                .hasMessageContaining("(was 9)");
    }
}
