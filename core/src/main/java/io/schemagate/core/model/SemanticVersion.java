package io.schemagate.core.model;

import java.util.Comparator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Strict {@code major.minor.patch} version. Ordering compares the three
 * components as integers, so {@code 1.10.0} sorts after {@code 1.9.3}.
 *
 * @param major major component, non-negative
 * @param minor minor component, non-negative
 * @param patch patch component, non-negative
 */
public record SemanticVersion(int major, int minor, int patch) implements Comparable<SemanticVersion> {

    private static final Pattern FORMAT = Pattern.compile("^(\\d+)\\.(\\d+)\\.(\\d+)$");
    private static final Comparator<SemanticVersion> ORDER = Comparator.comparingInt(SemanticVersion::major)
            .thenComparingInt(SemanticVersion::minor)
            .thenComparingInt(SemanticVersion::patch);

    /** The bootstrap version holding only the core fields. */
    public static final SemanticVersion INITIAL = new SemanticVersion(1, 0, 0);

    /** Which component {@link #bump(Bump)} increments. */
    public enum Bump {
        MAJOR,
        MINOR,
        PATCH
    }

    public SemanticVersion {
        if (major < 0 || minor < 0 || patch < 0) {
            throw new IllegalArgumentException(
                    "version components must be non-negative: " + major + "." + minor + "." + patch);
        }
    }

    /**
     * Parses a version string.
     *
     * @param value e.g. {@code "1.2.0"}
     * @return the parsed version
     * @throws IllegalArgumentException if the string is not strict {@code x.y.z}
     */
    public static SemanticVersion parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("version must not be null");
        }
        Matcher m = FORMAT.matcher(value.trim());
        if (!m.matches()) {
            throw new IllegalArgumentException("Version '" + value + "' is not in major.minor.patch form");
        }
        try {
            return new SemanticVersion(
                    Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), Integer.parseInt(m.group(3)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Version '" + value + "' has a component out of range", e);
        }
    }

    /**
     * Increments one component and resets the lower ones to zero.
     *
     * @param kind component to increment
     * @return the bumped version
     * @throws ArithmeticException if the component is already {@link Integer#MAX_VALUE}
     */
    public SemanticVersion bump(Bump kind) {
        return switch (kind) {
            case MAJOR -> new SemanticVersion(Math.addExact(major, 1), 0, 0);
            case MINOR -> new SemanticVersion(major, Math.addExact(minor, 1), 0);
            case PATCH -> new SemanticVersion(major, minor, Math.addExact(patch, 1));
        };
    }

    /** Whether {@link #bump(Bump)} can increment {@code kind} without overflowing. */
    public boolean canBump(Bump kind) {
        int component = switch (kind) {
            case MAJOR -> major;
            case MINOR -> minor;
            case PATCH -> patch;
        };
        return component < Integer.MAX_VALUE;
    }

    public boolean isAfter(SemanticVersion other) {
        return compareTo(other) > 0;
    }

    @Override
    public int compareTo(SemanticVersion other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return major + "." + minor + "." + patch;
    }
}
