package com.company.workflowsla.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

public class SloCalculator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private SloCalculator() {
    }

    /**
     * Share of executions that met the SLA, in percent with two decimals.
     * Defined as 100 when nothing was executed.
     */
    public static BigDecimal percentage(long totalExecutions, long breachedExecutions) {
        if (totalExecutions <= 0) {
            return HUNDRED.setScale(2, RoundingMode.HALF_UP);
        }
        long met = Math.max(0, totalExecutions - breachedExecutions);
        return BigDecimal.valueOf(met)
                .multiply(HUNDRED)
                .divide(BigDecimal.valueOf(totalExecutions), 2, RoundingMode.HALF_UP);
    }

    public static boolean meetsTarget(BigDecimal percentage, BigDecimal targetPercentage) {
        if (targetPercentage == null) {
            return true;
        }
        return percentage.compareTo(targetPercentage) >= 0;
    }

    public static long breachMargin(long actualDurationMs, long targetDurationMs) {
        return Math.max(0, actualDurationMs - targetDurationMs);
    }
}
