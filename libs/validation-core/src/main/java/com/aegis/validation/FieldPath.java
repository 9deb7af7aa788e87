package com.aegis.validation;

import java.util.ArrayList;
import java.util.List;

/**
 * Location of a violation inside a (possibly nested) record.
 *
 * <p>Segments are field names ({@link String}) or collection indices ({@link Integer}). The
 * rendered form is {@code crew[2].years_experience}; the root path renders as the empty string
 * and denotes the record itself.
 *
 * @param segments ordered path segments, outermost first
 */
public record FieldPath(List<Object> segments) {

    private static final FieldPath ROOT = new FieldPath(List.of());

    public FieldPath {
        for (Object segment : segments) {
            if (!(segment instanceof String) && !(segment instanceof Integer)) {
                throw new IllegalArgumentException("path segment must be a field name or an index: " + segment);
            }
        }
        segments = List.copyOf(segments);
    }

    /** The path of the record itself. */
    public static FieldPath root() {
        return ROOT;
    }

    /** A single-segment path naming a top-level field. */
    public static FieldPath of(String field) {
        return ROOT.field(field);
    }

    /** Returns a new path with a field name appended. */
    public FieldPath field(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        return append(name);
    }

    /** Returns a new path with a collection index appended. */
    public FieldPath index(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0");
        }
        return append(index);
    }

    /** Returns {@code nested} re-rooted under this path. */
    public FieldPath resolve(FieldPath nested) {
        if (nested.isRoot()) {
            return this;
        }
        var joined = new ArrayList<>(segments);
        joined.addAll(nested.segments);
        return new FieldPath(joined);
    }

    public boolean isRoot() {
        return segments.isEmpty();
    }

    private FieldPath append(Object segment) {
        var joined = new ArrayList<>(segments);
        joined.add(segment);
        return new FieldPath(joined);
    }

    @Override
    public String toString() {
        var sb = new StringBuilder();
        for (Object segment : segments) {
            if (segment instanceof Integer index) {
                sb.append('[').append(index).append(']');
            } else {
                if (sb.length() > 0) {
                    sb.append('.');
                }
                sb.append(segment);
            }
        }
        return sb.toString();
    }
}
