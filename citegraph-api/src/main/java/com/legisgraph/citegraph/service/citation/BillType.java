package com.legisgraph.citegraph.service.citation;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

public enum BillType {
    HR("House bill"),
    S("Senate bill"),
    HJRES("House joint resolution"),
    SJRES("Senate joint resolution"),
    HCONRES("House concurrent resolution"),
    SCONRES("Senate concurrent resolution"),
    HRES("House simple resolution"),
    SRES("Senate simple resolution");

    // keyed by the lower-case spelling with periods and whitespace removed
    private static final Map<String, BillType> ALIASES = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(type -> type.name().toLowerCase(Locale.ROOT), Function.identity()));

    private final String description;

    BillType(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves spellings such as {@code "H.R."}, {@code "h r"}, {@code "S. Con. Res."} or {@code "HJRES"}.
     */
    public static Optional<BillType> fromAlias(String alias) {
        if (alias == null) {
            return Optional.empty();
        }
        String key = alias.replaceAll("[\\s.]+", "").toLowerCase(Locale.ROOT);
        return Optional.ofNullable(ALIASES.get(key));
    }
}
