package com.polygen.core.ast;

import java.util.Objects;

/**
 * Timezone argument of {@code auto_create} / {@code auto_update}.
 *
 * @param kind how the zone was written
 * @param offsetMinutes offset from UTC in minutes, for {@link Kind#OFFSET}
 * @param zoneName zone identifier, for {@link Kind#NAMED}
 */
public record Timezone(
    Kind kind,
    int offsetMinutes,
    String zoneName
) {
    public enum Kind { UTC, LOCAL, OFFSET, NAMED }

    public Timezone {
        Objects.requireNonNull(kind, "kind must not be null");
        if (kind == Kind.NAMED) {
            Objects.requireNonNull(zoneName, "zoneName must not be null");
        }
    }

    public static Timezone utc() {
        return new Timezone(Kind.UTC, 0, null);
    }

    public static Timezone local() {
        return new Timezone(Kind.LOCAL, 0, null);
    }

    public static Timezone offset(int minutes) {
        return new Timezone(Kind.OFFSET, minutes, null);
    }

    public static Timezone named(String zoneName) {
        return new Timezone(Kind.NAMED, 0, zoneName);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case UTC -> "utc";
            case LOCAL -> "local";
            case NAMED -> zoneName;
            case OFFSET -> {
                int abs = Math.abs(offsetMinutes);
                yield String.format("%s%02d:%02d", offsetMinutes < 0 ? "-" : "+", abs / 60, abs % 60);
            }
        };
    }
}
