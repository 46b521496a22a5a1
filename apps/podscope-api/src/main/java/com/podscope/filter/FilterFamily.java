package com.podscope.filter;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

public enum FilterFamily {
    ID("id"),
    NAME("name"),
    CTR_IDS("ctr-ids"),
    CTR_NAMES("ctr-names"),
    CTR_NUMBER("ctr-number"),
    CTR_STATUS("ctr-status"),
    STATUS("status"),
    LABEL("label"),
    UNTIL("until"),
    NETWORK("network");

    private final String key;

    FilterFamily(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static Optional<FilterFamily> fromKey(String key) {
        return Arrays.stream(values())
                .filter(family -> family.key.equals(key))
                .findFirst();
    }

    public static List<String> keys() {
        return Arrays.stream(values()).map(FilterFamily::key).toList();
    }
}
