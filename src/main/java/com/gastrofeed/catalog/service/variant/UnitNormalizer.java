package com.gastrofeed.catalog.service.variant;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Converts a (value, unit) pair to the canonical units used in the catalog: {@code mm} for
 * lengths, {@code W} for power and {@code L} for volume.
 *
 * <p>Unknown units pass through lower-cased. A value that cannot be parsed yields
 * {@code null}.
 */
public final class UnitNormalizer {
    private static final BigDecimal TEN = BigDecimal.TEN;
    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1000);

    private static final Set<String> CENTIMETERS = Set.of("cm", "centimeter", "centimeters");
    private static final Set<String> METERS = Set.of("m", "meter", "meters");
    private static final Set<String> LITERS = Set.of("l", "liter", "liters", "litre", "litres", "litrov", "litra");

    private UnitNormalizer() {}

    /**
     * A normalized measurement. Equality ignores trailing zeros, so 2000 equals 2000.0.
     */
    public record Measure(BigDecimal value, String unit) {
        /** Renders as {@code "400 mm"}, without trailing zeros. */
        public String render() {
            String v = value.stripTrailingZeros().toPlainString();
            return unit == null || unit.isEmpty() ? v : v + " " + unit;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Measure other)) return false;
            return value.compareTo(other.value) == 0 && Objects.equals(unit, other.unit);
        }

        @Override
        public int hashCode() {
            return Objects.hash(value.stripTrailingZeros(), unit);
        }

        @Override
        public String toString() {
            return render();
        }
    }

    public static Measure normalize(String value, String unit) {
        if (value == null) return null;
        BigDecimal v;
        try {
            v = new BigDecimal(value.trim().replace(',', '.'));
        } catch (NumberFormatException e) {
            return null;
        }
        return normalize(v, unit);
    }

    public static Measure normalize(double value, String unit) {
        return normalize(BigDecimal.valueOf(value), unit);
    }

    public static Measure normalize(BigDecimal value, String unit) {
        if (value == null) return null;
        String u = unit != null ? unit.trim().toLowerCase(Locale.ROOT) : "";
        if (CENTIMETERS.contains(u)) return new Measure(value.multiply(TEN), "mm");
        if (METERS.contains(u)) return new Measure(value.multiply(THOUSAND), "mm");
        if ("kw".equals(u)) return new Measure(value.multiply(THOUSAND), "W");
        if ("w".equals(u)) return new Measure(value, "W");
        if (LITERS.contains(u)) return new Measure(value, "L");
        return new Measure(value, u);
    }
}
