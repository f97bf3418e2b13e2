package io.tiller.core.router;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/// One result returned by a source.
///
/// @param name display name, not null
/// @param price price, may be null when the source does not report one
/// @param attributes remaining source-specific attributes, never null
public record ResultItem(String name, BigDecimal price, Map<String, Object> attributes) {

    public ResultItem {
        Objects.requireNonNull(name, "name must not be null");
        attributes =
                attributes != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes))
                        : Map.of();
    }

    public static ResultItem of(String name, BigDecimal price) {
        return new ResultItem(name, price, Map.of());
    }

    /// Identity used to collapse duplicates across sources: normalized name plus price.
    ///
    /// @return dedupe key, never null
    public String dedupeKey() {
        String normalizedPrice = price != null ? price.stripTrailingZeros().toPlainString() : "";
        return name.trim().toLowerCase(Locale.ROOT) + "|" + normalizedPrice;
    }
}
