package me.golemcore.toolrouter.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Semantic version of a published tool definition ({@code MAJOR.MINOR.PATCH}
 * with an optional pre-release suffix). Ordering follows semver precedence: a
 * pre-release sorts before its release.
 */
public record SemanticVersion(int major, int minor, int patch, String preRelease)
        implements Comparable<SemanticVersion> {

    private static final Pattern SEMVER = Pattern
            .compile("^(\\d+)\\.(\\d+)\\.(\\d+)(?:-([0-9A-Za-z.-]+))?$");

    public static SemanticVersion parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Version is required");
        }
        Matcher matcher = SEMVER.matcher(value.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Not a semantic version: " + value);
        }
        return new SemanticVersion(
                Integer.parseInt(matcher.group(1)),
                Integer.parseInt(matcher.group(2)),
                Integer.parseInt(matcher.group(3)),
                matcher.group(4));
    }

    public static boolean isValid(String value) {
        return value != null && SEMVER.matcher(value.trim()).matches();
    }

    @Override
    public int compareTo(SemanticVersion other) {
        int result = Integer.compare(major, other.major);
        if (result == 0) {
            result = Integer.compare(minor, other.minor);
        }
        if (result == 0) {
            result = Integer.compare(patch, other.patch);
        }
        if (result != 0) {
            return result;
        }
        if (preRelease == null) {
            return other.preRelease == null ? 0 : 1;
        }
        if (other.preRelease == null) {
            return -1;
        }
        return preRelease.compareTo(other.preRelease);
    }

    @Override
    public String toString() {
        String base = major + "." + minor + "." + patch;
        return preRelease != null ? base + "-" + preRelease : base;
    }
}
