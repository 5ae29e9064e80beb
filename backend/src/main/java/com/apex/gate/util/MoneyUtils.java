package com.apex.gate.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class MoneyUtils {

    public static final int QUANTITY_SCALE = 2;
    public static final int PRICE_SCALE = 4;

    private MoneyUtils() {
    }

    public static double roundQuantity(double quantity) {
        return round(quantity, QUANTITY_SCALE);
    }

    public static double roundPrice(double price) {
        return round(price, PRICE_SCALE);
    }

    public static double round(double value, int scale) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return 0.0;
        }
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }

    public static BigDecimal bd(double value) {
        return BigDecimal.valueOf(value).setScale(PRICE_SCALE, RoundingMode.HALF_UP);
    }
}
