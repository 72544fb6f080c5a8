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

import io.waypoint.WaypointMessages;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Splits paths into non-empty segments.
 *
 * <p>
 * Leading, trailing and repeated separators never produce segments, so {@code "/a//b/"} and {@code "a/b"} both split
 * into {@code ["a", "b"]} and the paths {@code ""}, {@code "/"} and {@code "///"} do not contain any segments at all.
 *
 * <p>
 * Splitting is lazy and never copies characters: segments are {@link PathSegment} views into the original path. Every call
 * to {@link #iterator()} starts a new, independent pass over the path, so the same instance can be iterated by any number of
 * readers, sequentially or concurrently.
 *
 * <p>
 * A bounded instance (see {@link #split(CharSequence, char, int)}) stops splitting after a maximum number of splits and
 * returns the untouched remainder of the path - separators included - as its final segment.
 */
public final class PathSegmenter implements Iterable<PathSegment> {

    /**
     * The default path separator.
     */
    public static final char DEFAULT_SEPARATOR = '/';

    private static final int UNBOUNDED = -1;

    private final CharSequence path;
    private final char separator;
    private final int maxSplits;

    private PathSegmenter(final CharSequence path, final char separator, final int maxSplits) {
        this.path = Objects.requireNonNull(path);
        this.separator = separator;
        this.maxSplits = maxSplits;
    }

    /**
     * Splits the specified path on {@link #DEFAULT_SEPARATOR}.
     *
     * @param path The path.
     * @return The segments.
     */
    public static PathSegmenter split(final CharSequence path) {
        return new PathSegmenter(path, DEFAULT_SEPARATOR, UNBOUNDED);
    }

    /**
     * Splits the specified path on the specified separator.
     *
     * @param path The path.
     * @param separator The separator.
     * @return The segments.
     */
    public static PathSegmenter split(final CharSequence path, final char separator) {
        return new PathSegmenter(path, separator, UNBOUNDED);
    }

    /**
     * Splits the specified path on the specified separator, but splits at most {@code maxSplits} times. The first
     * {@code maxSplits} segments are identical to the segments returned by {@link #split(CharSequence, char)}. If any
     * characters remain after that, then they are returned - as is - as one final segment.
     *
     * @param path The path.
     * @param separator The separator.
     * @param maxSplits Maximum number of splits. Must not be negative.
     * @return The segments.
     */
    public static PathSegmenter split(final CharSequence path, final char separator, final int maxSplits) {
        if (maxSplits < 0) {
            throw WaypointMessages.MESSAGES.maxSplitsMustNotBeNegative(maxSplits);
        }
        return new PathSegmenter(path, separator, maxSplits);
    }

    /**
     * @return The path that is split by this instance.
     */
    public CharSequence getPath() {
        return path;
    }

    /**
     * @return The separator.
     */
    public char getSeparator() {
        return separator;
    }

    /**
     * @return True if this instance stops splitting after a maximum number of splits.
     */
    public boolean isBounded() {
        return maxSplits != UNBOUNDED;
    }

    @Override
    public Iterator<PathSegment> iterator() {
        return new SegmentIterator(path, separator, maxSplits);
    }

    /**
     * @return All segments, copied into strings.
     */
    public List<String> toList() {
        final List<String> result = new ArrayList<>();
        for (final PathSegment segment : this) {
            result.add(segment.toString());
        }
        return result;
    }

    /**
     * Counts the segments in the specified path without creating any segment instances.
     *
     * @param path The path.
     * @param separator The separator.
     * @return Number of segments.
     */
    public static int count(final CharSequence path, final char separator) {
        final int len = path.length();
        int count = 0;
        boolean inSegment = false;
        for (int i = 0; i < len; i++) {
            if (path.charAt(i) == separator) {
                inSegment = false;
            } else if (!inSegment) {
                inSegment = true;
                count++;
            }
        }
        return count;
    }

    @Override
    public String toString() {
        return "PathSegmenter{" + "path=" + path + ", separator=" + separator
                + (isBounded() ? ", maxSplits=" + maxSplits : "") + '}';
    }

    private static final class SegmentIterator implements Iterator<PathSegment> {

        private final CharSequence path;
        private final char separator;
        private final int end;

        //Index of the first character of the next segment, or 'end' when done.
        private int current;
        //Number of segments that may still be returned by splitting; -1 means no limit.
        private int availableSplits;

        private SegmentIterator(final CharSequence path, final char separator, final int maxSplits) {
            this.path = path;
            this.separator = separator;
            this.end = path.length();
            this.availableSplits = maxSplits;
            this.current = skipSeparators(0);
        }

        private int skipSeparators(final int from) {
            int idx = from;
            while (idx < end && path.charAt(idx) == separator) {
                idx++;
            }
            return idx;
        }

        @Override
        public boolean hasNext() {
            return current < end;
        }

        @Override
        public PathSegment next() {
            if (current >= end) {
                throw new NoSuchElementException();
            }

            final int start = current;
            if (availableSplits == 0) {
                current = end;
                return new PathSegment(path, start, end);
            }
            if (availableSplits > 0) {
                availableSplits--;
            }

            int idx = start;
            while (idx < end && path.charAt(idx) != separator) {
                idx++;
            }
            current = skipSeparators(idx);
            return new PathSegment(path, start, idx);
        }
    }
}
