package com.commerceforecast.common.scoring;

import com.commerceforecast.common.payload.PayloadReader;

/**
 * Price band parsed from the product unit's optimal price range.
 *
 * <p>Accepted forms: {@code "40-60"}, {@code "$40 - $60"}, {@code "40-60 USD"}, or a single
 * price {@code p} (number or numeric string) which widens to {@code 0.8p – 1.2p}. Anything
 * else, including a blank string, an inverted range or a non-positive bound, yields
 * {@link #DEFAULT} (40–60, midpoint 50).
 */
public record PriceBand(double min, double mid, double max) {

    public static final PriceBand DEFAULT = new PriceBand(40.0, 50.0, 60.0);

    static final double MIN_VALID_PRICE = 0.01;

    public static PriceBand parse(Object raw) {
        if (raw instanceof Number n) {
            return fromSinglePrice(n.doubleValue());
        }
        if (!(raw instanceof String s)) {
            return DEFAULT;
        }
        String cleaned = s.replace("$", "")
            .replaceAll("(?i)usd", "")
            .replace('–', '-')
            .trim();
        if (cleaned.isEmpty()) {
            return DEFAULT;
        }
        if (!cleaned.contains("-")) {
            return fromSinglePrice(PayloadReader.toDouble(cleaned, Double.NaN));
        }
        String[] parts = cleaned.split("-");
        if (parts.length != 2) {
            return DEFAULT;
        }
        double min = PayloadReader.toDouble(parts[0].trim(), Double.NaN);
        double max = PayloadReader.toDouble(parts[1].trim(), Double.NaN);
        if (Double.isNaN(min) || Double.isNaN(max) || min < MIN_VALID_PRICE || max < min) {
            return DEFAULT;
        }
        return new PriceBand(min, (min + max) / 2.0, max);
    }

    private static PriceBand fromSinglePrice(double price) {
        if (Double.isNaN(price) || price < MIN_VALID_PRICE) {
            return DEFAULT;
        }
        return new PriceBand(price * 0.8, price, price * 1.2);
    }

    public PriceBand scaled(double multiplier) {
        return new PriceBand(min * multiplier, mid * multiplier, max * multiplier);
    }
}
