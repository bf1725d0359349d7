package scanagram.core.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Decimal rounding for reported figures.
 */
public final class Decimals {

    private Decimals() {}

    /**
     * Round half-up to the given number of decimal places.
     *
     * @param value  the value, must be finite
     * @param places decimal places
     * @return the rounded value
     */
    public static double round(double value, int places) {
        return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_UP).doubleValue();
    }
}
