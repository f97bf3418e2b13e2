package io.tiller.core.router;

/// Consent signals carried by a request.
///
/// @param standingOptIn the user enabled extended search in their settings
/// @param perQuery the user confirmed deeper search for this query
public record ConsentFlags(boolean standingOptIn, boolean perQuery) {

    private static final ConsentFlags NONE = new ConsentFlags(false, false);

    public static ConsentFlags none() {
        return NONE;
    }

    public ConsentFlags withPerQuery() {
        return new ConsentFlags(standingOptIn, true);
    }

    /// Returns whether these flags unlock a gated tier.
    ///
    /// @param mode combination rule, not null
    /// @return true if consent is satisfied
    public boolean satisfies(ConsentMode mode) {
        return switch (mode) {
            case EITHER -> standingOptIn || perQuery;
            case BOTH -> standingOptIn && perQuery;
        };
    }

    /// Returns the consent still missing under a mode.
    ///
    /// @param mode combination rule, not null
    /// @return consent to ask for, never null
    public ConsentType missing(ConsentMode mode) {
        if (mode == ConsentMode.BOTH && !standingOptIn) {
            return ConsentType.ACCOUNT_TOGGLE;
        }
        return ConsentType.PER_QUERY;
    }
}
