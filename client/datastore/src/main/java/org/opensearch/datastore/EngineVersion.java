/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.datastore;

import java.util.Objects;

/**
 * Version number reported by the engine in its root endpoint, reduced to major, minor and revision.
 * Qualifiers such as {@code -SNAPSHOT} or {@code -rc1} are ignored when comparing.
 */
public final class EngineVersion implements Comparable<EngineVersion> {

    private final int major;
    private final int minor;
    private final int revision;

    public EngineVersion(int major, int minor, int revision) {
        if (major < 0 || minor < 0 || revision < 0) {
            throw new IllegalArgumentException("version components must not be negative: " + major + "." + minor + "." + revision);
        }
        this.major = major;
        this.minor = minor;
        this.revision = revision;
    }

    /**
     * Parses {@code major.minor[.revision][-qualifier]}.
     */
    public static EngineVersion fromString(String version) {
        if (version == null || version.isEmpty()) {
            throw new IllegalArgumentException("version must not be null or empty");
        }
        int qualifier = version.indexOf('-');
        String numeric = qualifier == -1 ? version : version.substring(0, qualifier);
        String[] parts = numeric.split("\\.");
        if (parts.length < 2 || parts.length > 3) {
            throw new IllegalArgumentException("the version needs to contain major, minor, and optionally revision: " + version);
        }
        try {
            int major = Integer.parseInt(parts[0]);
            int minor = Integer.parseInt(parts[1]);
            int revision = parts.length == 3 ? Integer.parseInt(parts[2]) : 0;
            return new EngineVersion(major, minor, revision);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("unable to parse version " + version, e);
        }
    }

    public int getMajor() {
        return major;
    }

    public int getMinor() {
        return minor;
    }

    public int getRevision() {
        return revision;
    }

    public boolean onOrAfter(EngineVersion other) {
        return compareTo(other) >= 0;
    }

    public boolean before(EngineVersion other) {
        return compareTo(other) < 0;
    }

    @Override
    public int compareTo(EngineVersion other) {
        int cmp = Integer.compare(major, other.major);
        if (cmp != 0) {
            return cmp;
        }
        cmp = Integer.compare(minor, other.minor);
        if (cmp != 0) {
            return cmp;
        }
        return Integer.compare(revision, other.revision);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        EngineVersion that = (EngineVersion) o;
        return major == that.major && minor == that.minor && revision == that.revision;
    }

    @Override
    public int hashCode() {
        return Objects.hash(major, minor, revision);
    }

    @Override
    public String toString() {
        return major + "." + minor + "." + revision;
    }
}
