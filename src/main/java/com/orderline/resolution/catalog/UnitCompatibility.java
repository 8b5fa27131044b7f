package com.orderline.resolution.catalog;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Unit groups that describe interchangeable packaging or measures, and the
 * conversion factors between measure units of the same dimension.
 */
public final class UnitCompatibility {

    private static final List<Set<String>> COMPATIBLE_GROUPS = List.of(
            Set.of("kg", "g"),
            Set.of("ml", "l"),
            Set.of("piece", "each", "pcs"),
            Set.of("bag", "packet", "pack"),
            Set.of("box", "tray")
    );

    // factor to the base unit of each dimension
    private static final Map<String, BigDecimal> TO_BASE = Map.of(
            "kg", BigDecimal.ONE,
            "g", new BigDecimal("0.001"),
            "l", BigDecimal.ONE,
            "ml", new BigDecimal("0.001")
    );

    private static final Map<String, String> DIMENSION = Map.of(
            "kg", "mass", "g", "mass",
            "l", "volume", "ml", "volume"
    );

    private UnitCompatibility() {
    }

    /**
     * True when both units are equal or belong to the same compatibility group.
     */
    public static boolean areCompatible(String unit1, String unit2) {
        if (unit1 == null || unit2 == null) {
            return false;
        }
        String a = unit1.toLowerCase(Locale.ROOT);
        String b = unit2.toLowerCase(Locale.ROOT);
        if (a.equals(b)) {
            return true;
        }
        for (Set<String> group : COMPATIBLE_GROUPS) {
            if (group.contains(a) && group.contains(b)) {
                return true;
            }
        }
        return false;
    }

    /**
     * True for weight and volume units, which can be drawn down fractionally.
     */
    public static boolean isMeasure(String unit) {
        return unit != null && TO_BASE.containsKey(unit.toLowerCase(Locale.ROOT));
    }

    /**
     * Converts {@code quantity} expressed in {@code from} into {@code to}.
     * Empty when the units measure different dimensions or are not measures at all.
     */
    public static Optional<BigDecimal> convert(BigDecimal quantity, String from, String to) {
        if (from == null || to == null) {
            return Optional.empty();
        }
        String f = from.toLowerCase(Locale.ROOT);
        String t = to.toLowerCase(Locale.ROOT);
        if (f.equals(t)) {
            return Optional.of(quantity);
        }
        String fromDimension = DIMENSION.get(f);
        if (fromDimension == null || !fromDimension.equals(DIMENSION.get(t))) {
            return Optional.empty();
        }
        BigDecimal converted = quantity.multiply(TO_BASE.get(f))
                .divide(TO_BASE.get(t), MathContext.DECIMAL64)
                .stripTrailingZeros();
        return Optional.of(converted.scale() < 0 ? converted.setScale(0) : converted);
    }
}
