package io.github.flameyossnowy.querycraft.api.filter;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * A field path split into segments plus the comparison it ends with.
 *
 * <p>Segments are separated by {@code __} or {@code .}; both
 * {@code customer__name__icontains} and {@code customer.name__icontains} parse to
 * {@code [customer, name]} with {@link LookupType#ICONTAINS}.</p>
 */
public record LookupPath(List<String> segments, LookupType lookupType) {
    public static final String LOOKUP_SEP = "__";

    private static final Pattern SEPARATOR = Pattern.compile("__|\\.");

    public LookupPath {
        segments = List.copyOf(segments);
        if (segments.isEmpty()) {
            throw new IllegalArgumentException("Lookup path must name at least one field");
        }
    }

    public static @NotNull LookupPath parse(@NotNull String expression) {
        List<String> parts = split(expression);
        LookupType type = LookupType.EXACT;
        if (parts.size() > 1) {
            LookupType suffix = LookupType.byKeyword(parts.get(parts.size() - 1));
            if (suffix != null) {
                type = suffix;
                parts = parts.subList(0, parts.size() - 1);
            }
        }
        return new LookupPath(parts, type);
    }

    /**
     * Splits a plain field path, without looking for a comparison suffix.
     */
    public static @NotNull List<String> split(@NotNull String path) {
        List<String> parts = new ArrayList<>();
        for (String part : SEPARATOR.split(path, -1)) {
            if (part.isEmpty()) {
                throw new IllegalArgumentException("Malformed field path '" + path + "'");
            }
            parts.add(part);
        }
        return parts;
    }

    public String first() {
        return segments.get(0);
    }

    public String joined() {
        return String.join(LOOKUP_SEP, segments);
    }
}
