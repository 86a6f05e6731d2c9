package io.github.flameyossnowy.querycraft.api.filter;

import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.Map;

/**
 * Comparison kinds a lookup path can end with, e.g. {@code amount__gt}.
 */
public enum LookupType {
    EXACT("exact"),
    IEXACT("iexact"),
    CONTAINS("contains"),
    ICONTAINS("icontains"),
    GT("gt"),
    GTE("gte"),
    LT("lt"),
    LTE("lte"),
    IN("in"),
    STARTSWITH("startswith"),
    ISTARTSWITH("istartswith"),
    ENDSWITH("endswith"),
    IENDSWITH("iendswith"),
    RANGE("range"),
    ISNULL("isnull");

    private static final Map<String, LookupType> BY_KEYWORD = new HashMap<>();

    static {
        for (LookupType type : values()) {
            BY_KEYWORD.put(type.keyword, type);
        }
    }

    private final String keyword;

    LookupType(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    public static @Nullable LookupType byKeyword(String keyword) {
        return BY_KEYWORD.get(keyword);
    }

    /**
     * Whether the value is matched with a LIKE pattern built from it.
     */
    public boolean isPatternMatch() {
        return switch (this) {
            case CONTAINS, ICONTAINS, STARTSWITH, ISTARTSWITH, ENDSWITH, IENDSWITH -> true;
            default -> false;
        };
    }
}
