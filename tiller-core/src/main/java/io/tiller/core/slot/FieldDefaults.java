package io.tiller.core.slot;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/// Intent-specific default values for required fields the user never supplied.
///
/// Suppliers are evaluated lazily so that date defaults are relative to the turn
/// in which they are injected.
///
/// ### Usage
/// {@snippet :
/// FieldDefaults defaults = FieldDefaults.travel(Clock.systemUTC());
/// defaults.register("product", "country", () -> "US");
/// Map<String, Supplier<Object>> travel = defaults.forIntent("travel");
/// }
///
/// @implNote Thread-safe for concurrent reads after registration.
public final class FieldDefaults {

    static final int TRAVEL_DEFAULT_ADULTS = 2;
    static final int TRAVEL_DEFAULT_DURATION_DAYS = 5;
    static final int TRAVEL_DEFAULT_LEAD_DAYS = 30;

    private final Map<String, Map<String, Supplier<Object>>> byIntent = new ConcurrentHashMap<>();

    public static FieldDefaults none() {
        return new FieldDefaults();
    }

    /// Returns the travel preset: two adults, five days, departing 30 days from today.
    ///
    /// @param clock source of "today", not null
    /// @return new defaults holding the travel preset, never null
    public static FieldDefaults travel(Clock clock) {
        Objects.requireNonNull(clock, "clock must not be null");
        FieldDefaults defaults = new FieldDefaults();
        Supplier<Object> departure =
                () -> LocalDate.now(clock).plusDays(TRAVEL_DEFAULT_LEAD_DAYS).toString();
        defaults.register("travel", "adults", () -> TRAVEL_DEFAULT_ADULTS);
        defaults.register("travel", "duration_days", () -> TRAVEL_DEFAULT_DURATION_DAYS);
        defaults.register("travel", "departure_date", departure);
        defaults.register("travel", "check_in", departure);
        return defaults;
    }

    /// Registers a default for one field of an intent.
    ///
    /// @param intent intent name, not null
    /// @param field field name, not null
    /// @param value lazily evaluated default, not null
    public void register(String intent, String field, Supplier<Object> value) {
        Objects.requireNonNull(intent, "intent must not be null");
        Objects.requireNonNull(field, "field must not be null");
        Objects.requireNonNull(value, "value must not be null");
        byIntent.computeIfAbsent(intent, k -> new LinkedHashMap<>()).put(field, value);
    }

    /// Returns the defaults declared for an intent.
    ///
    /// @param intent intent name, not null
    /// @return field to default supplier, in registration order, never null
    public Map<String, Supplier<Object>> forIntent(String intent) {
        Map<String, Supplier<Object>> defaults = byIntent.get(intent);
        return defaults != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(defaults))
                : Map.of();
    }
}
