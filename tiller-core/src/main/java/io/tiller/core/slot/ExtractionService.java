package io.tiller.core.slot;

import java.util.Map;

/// Extracts field values from conversation text.
///
/// The only behaviour assumed of an implementation: text and a field list in,
/// a map of `field name -> value or null` out. Implementations typically call a
/// language model; tests substitute a deterministic fake.
///
/// ### Contracts
/// - **Postcondition**: the returned map is never null; keys outside
///   {@link ExtractionRequest#fields()} are ignored by callers
///
/// @see SlotClarifier
@FunctionalInterface
public interface ExtractionService {

    /// Extracts values for the requested fields.
    ///
    /// @param request instruction, fields and context, not null
    /// @return extracted values by field name; values may be null, never null
    /// @throws RuntimeException on transport or parsing failures
    Map<String, Object> extract(ExtractionRequest request);
}
