package com.raditha.staleflag.model;

/**
 * A stale flag to clean up.
 *
 * @param flagName  the flag identifier the query argument must resolve to
 * @param api       the call shape that queries flags
 * @param treatment the outcome every matching query is fixed to
 */
public record FlagSpec(String flagName, ApiPattern api, Treatment treatment) {

    public FlagSpec {
        if (flagName == null || flagName.isBlank()) {
            throw new IllegalArgumentException("flagName cannot be empty");
        }
        if (api == null) {
            throw new IllegalArgumentException("api cannot be null");
        }
        if (treatment == null) {
            throw new IllegalArgumentException("treatment cannot be null");
        }
    }

    public static FlagSpec of(String flagName, String api, boolean treatment) {
        return new FlagSpec(flagName, ApiPattern.parse(api), Treatment.ofBoolean(treatment));
    }

    @Override
    public String toString() {
        return flagName + " via " + api + " = " + treatment;
    }
}
