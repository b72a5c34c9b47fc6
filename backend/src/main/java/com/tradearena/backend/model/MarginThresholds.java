package com.tradearena.backend.model;

import com.tradearena.backend.config.RiskProperties;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Margin level percentages in descending order: safe > warning > marginCall > liquidation.
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MarginThresholds {

    @Column(name = "margin_safe_level", nullable = false, precision = 9, scale = 4)
    private BigDecimal safe;

    @Column(name = "margin_warning_level", nullable = false, precision = 9, scale = 4)
    private BigDecimal warning;

    @Column(name = "margin_call_level", nullable = false, precision = 9, scale = 4)
    private BigDecimal marginCall;

    @Column(name = "margin_liquidation_level", nullable = false, precision = 9, scale = 4)
    private BigDecimal liquidation;

    public static MarginThresholds defaults(RiskProperties riskProperties) {
        RiskProperties.Thresholds thresholds = riskProperties.getThresholds();
        return new MarginThresholds(
                thresholds.getSafe(),
                thresholds.getWarning(),
                thresholds.getMarginCall(),
                thresholds.getLiquidation());
    }

    /**
     * Unset levels fall back to the configured platform defaults.
     */
    public static MarginThresholds resolve(MarginThresholds requested, RiskProperties riskProperties) {
        MarginThresholds defaults = defaults(riskProperties);
        if (requested == null) {
            return defaults;
        }
        return new MarginThresholds(
                requested.getSafe() != null ? requested.getSafe() : defaults.getSafe(),
                requested.getWarning() != null ? requested.getWarning() : defaults.getWarning(),
                requested.getMarginCall() != null ? requested.getMarginCall() : defaults.getMarginCall(),
                requested.getLiquidation() != null ? requested.getLiquidation() : defaults.getLiquidation());
    }

    public boolean isDescending() {
        return safe.compareTo(warning) > 0
                && warning.compareTo(marginCall) > 0
                && marginCall.compareTo(liquidation) > 0
                && liquidation.signum() > 0;
    }
}
