/*
 * JBoss, Home of Professional Open Source.
 * Copyright 2025 Red Hat, Inc., and individual contributors
 * as indicated by the @author tags.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */
package io.waypoint.util;

import java.util.Objects;

/**
 * A view of a range of characters inside of a path. Creating a segment never copies the underlying characters, the
 * characters are only copied when {@link #toString()} is called.
 *
 * <p>
 * Two segments are equal when they contain the same characters, regardless of the source they were taken from.
 *
 * <p>
 * Instances of this class are immutable, but are only thread-safe if the underlying {@link CharSequence} is.
 */
public final class PathSegment implements CharSequence {

    private final CharSequence source;
    private final int start;
    private final int end;

    /**
     * @param source The character sequence that contains the segment.
     * @param start Index of the first character of the segment.
     * @param end Index immediately after the last character of the segment.
     */
    public PathSegment(final CharSequence source, final int start, final int end) {
        this.source = Objects.requireNonNull(source);
        if (start < 0 || end < start || end > source.length()) {
            throw new IndexOutOfBoundsException("start=" + start + ", end=" + end + ", length=" + source.length());
        }
        this.start = start;
        this.end = end;
    }

    /**
     * @return The character sequence that contains this segment.
     */
    public CharSequence getSource() {
        return source;
    }

    /**
     * @return Index of the first character of this segment inside of {@link #getSource()}.
     */
    public int getStart() {
        return start;
    }

    /**
     * @return Index immediately after the last character of this segment inside of {@link #getSource()}.
     */
    public int getEnd() {
        return end;
    }

    @Override
    public int length() {
        return end - start;
    }

    @Override
    public char charAt(final int index) {
        if (index < 0 || index >= end - start) {
            throw new IndexOutOfBoundsException("index=" + index + ", length=" + length());
        }
        return source.charAt(start + index);
    }

    @Override
    public PathSegment subSequence(final int from, final int to) {
        if (from < 0 || to < from || to > end - start) {
            throw new IndexOutOfBoundsException("from=" + from + ", to=" + to + ", length=" + length());
        }
        return new PathSegment(source, start + from, start + to);
    }

    /**
     * Tests if this segment contains exactly the specified characters.
     *
     * @param value The characters.
     * @param ignoreCase True to ignore differences in case.
     * @return True if the content is equal.
     */
    public boolean contentEquals(final String value, final boolean ignoreCase) {
        return value.length() == end - start && regionMatches(0, value, ignoreCase);
    }

    /**
     * @param prefix The prefix.
     * @param ignoreCase True to ignore differences in case.
     * @return True if this segment starts with the specified prefix.
     */
    public boolean startsWith(final String prefix, final boolean ignoreCase) {
        return prefix.length() <= end - start && regionMatches(0, prefix, ignoreCase);
    }

    /**
     * @param suffix The suffix.
     * @param ignoreCase True to ignore differences in case.
     * @return True if this segment ends with the specified suffix.
     */
    public boolean endsWith(final String suffix, final boolean ignoreCase) {
        final int offset = (end - start) - suffix.length();
        return offset >= 0 && regionMatches(offset, suffix, ignoreCase);
    }

    private boolean regionMatches(final int offset, final String value, final boolean ignoreCase) {
        final int len = value.length();
        final int base = start + offset;
        for (int i = 0; i < len; i++) {
            final char a = source.charAt(base + i);
            final char b = value.charAt(i);
            if (a == b) {
                continue;
            }
            if (!ignoreCase || foldCase(a) != foldCase(b)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Folds a character for comparisons that ignore case. Two characters are equal ignoring case if their folded forms are
     * equal, which is the same rule as {@link String#regionMatches(boolean, int, String, int, int)}.
     *
     * @param c The character.
     * @return The folded character.
     */
    static char foldCase(final char c) {
        return Character.toLowerCase(Character.toUpperCase(c));
    }

    /**
     * @param value The characters.
     * @return The characters folded with {@link #foldCase(char)}.
     */
    static String foldCase(final CharSequence value) {
        final int len = value.length();
        final char[] folded = new char[len];
        for (int i = 0; i < len; i++) {
            folded[i] = foldCase(value.charAt(i));
        }
        return new String(folded);
    }

    @Override
    public String toString() {
        return source.subSequence(start, end).toString();
    }

    @Override
    public int hashCode() {
        int h = 0;
        for (int i = start; i < end; i++) {
            h = 31 * h + source.charAt(i);
        }
        return h;
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final PathSegment other = (PathSegment) obj;
        final int len = end - start;
        if (len != other.end - other.start) {
            return false;
        }
        for (int i = 0; i < len; i++) {
            if (source.charAt(start + i) != other.source.charAt(other.start + i)) {
                return false;
            }
        }
        return true;
    }
}
