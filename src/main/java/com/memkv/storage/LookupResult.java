package com.memkv.storage;

public final class LookupResult {
    private static final LookupResult MISSING = new LookupResult(null, false);

    private final String value;
    private final boolean found;

    private LookupResult(String value, boolean found) {
        this.value = value;
        this.found = found;
    }

    static LookupResult found(String value) {
        return new LookupResult(value, true);
    }

    static LookupResult missing() {
        return MISSING;
    }

    public String getValue() {
        return value;
    }

    public boolean isFound() {
        return found;
    }

    @Override
    public String toString() {
        return found ? "found(" + value + ")" : "missing";
    }
}
