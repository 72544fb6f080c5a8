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

import io.waypoint.WaypointLogger;
import io.waypoint.WaypointMessages;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Parses route pattern strings into the components that {@link PathTrie.Builder} inserts into a trie.
 *
 * <p>
 * <b>Route pattern strings</b>
 *
 * <p>
 * A route pattern is split into segments with {@link PathSegmenter}, so leading, trailing and repeated separators are
 * ignored and {@code ""} and {@code "/"} both describe the root of the trie. Every segment is parsed into exactly one
 * component:
 *
 * <table>
 * <caption>Pattern tokens</caption>
 * <tr><th>Token</th><th>Component</th><th>Matches</th></tr>
 * <tr><td>{@code books}</td><td>{@link Literal}</td><td>exactly the segment {@code books}</td></tr>
 * <tr><td>{@code :bookId} or {@code {bookId}}</td><td>{@link Parameter}</td><td>any segment, captured as
 * {@code bookId}</td></tr>
 * <tr><td>{@code *} or <code>{}</code></td><td>{@link Wildcard}</td><td>any segment, nothing is captured</td></tr>
 * <tr><td>{@code {file}.jpg}, {@code file.{ext}}, {@code v{version}-beta}</td><td>{@link PartialCapture}</td><td>segments
 * with the literal prefix and suffix and at least one character in between, which is captured</td></tr>
 * <tr><td>{@code *.jpg}, {@code file.*}, <code>v{}-beta</code></td><td>{@link PartialWildcard}</td><td>the same segments
 * as a partial capture, but nothing is captured</td></tr>
 * <tr><td>{@code **}</td><td>{@link CatchAll}</td><td>zero or more remaining segments. Must be the last segment of the
 * pattern</td></tr>
 * </table>
 *
 * <p>
 * A segment with a single unbalanced brace, such as <code>text}</code> or <code>{text</code>, does not contain a capture group and is
 * parsed as a literal. A {@code *} that is neither the first nor the last character of a segment is literal text too.
 *
 * <p>
 * The following patterns are rejected with an {@link InvalidRoutePatternException}:
 * <ul>
 * <li>Patterns with any segment after a {@code **} segment.</li>
 * <li>Segments with more than one capture group, i.e. <code>{name}.{ext}</code>.</li>
 * <li>Segments that combine a capture group with a {@code *}, i.e. <code>*.{ext}</code>.</li>
 * <li>Segments that consist of a single {@code :}.</li>
 * </ul>
 */
public final class PathTrieParser {

    private static final String CATCH_ALL = "**";
    private static final String WILDCARD = "*";

    private PathTrieParser() {
    }

    //<editor-fold defaultstate="collapsed" desc="Kind enum">
    /**
     * The closed set of component kinds. The trie dispatches on this enum, never on the component classes.
     */
    public enum Kind {
        LITERAL,
        PARAMETER,
        WILDCARD,
        PARTIAL_CAPTURE,
        PARTIAL_WILDCARD,
        CATCH_ALL
    }

    //</editor-fold>
    //
    //<editor-fold defaultstate="collapsed" desc="PathComponent inner classes">
    /**
     * One segment of a parsed route pattern.
     *
     * <p>
     * This class is not meant to be extended outside of the parser. Instances are immutable.
     */
    public abstract static class PathComponent {

        private final Kind kind;

        private PathComponent(final Kind kind) {
            this.kind = kind;
        }

        /**
         * @return The kind of this component.
         */
        public Kind getKind() {
            return kind;
        }

        /**
         * @return Name of the parameter captured by this component, or {@code null} if nothing is captured.
         */
        public String getParameterName() {
            return null;
        }
    }

    /**
     * A segment that must match exactly.
     */
    public static final class Literal extends PathComponent {

        private final String text;

        private Literal(final String text) {
            super(Kind.LITERAL);
            this.text = text;
        }

        public String getText() {
            return text;
        }

        @Override
        public String toString() {
            return "Literal{" + "text=" + text + '}';
        }

        @Override
        public int hashCode() {
            return text.hashCode();
        }

        @Override
        public boolean equals(final Object obj) {
            if (this == obj) {
                return true;
            }
            if (obj == null || getClass() != obj.getClass()) {
                return false;
            }
            return text.equals(((Literal) obj).text);
        }
    }

    /**
     * A segment that matches any segment and captures it by name.
     */
    public static final class Parameter extends PathComponent {

        private final String name;

        private Parameter(final String name) {
            super(Kind.PARAMETER);
            this.name = name;
        }

        @Override
        public String getParameterName() {
            return name;
        }

        @Override
        public String toString() {
            return "Parameter{" + "name=" + name + '}';
        }

        @Override
        public int hashCode() {
            return name.hashCode();
        }

        @Override
        public boolean equals(final Object obj) {
            if (this == obj) {
                return true;
            }
            if (obj == null || getClass() != obj.getClass()) {
                return false;
            }
            return name.equals(((Parameter) obj).name);
        }
    }

    /**
     * A segment that matches any segment without capturing it.
     */
    public static final class Wildcard extends PathComponent {

        private static final Wildcard INSTANCE = new Wildcard();

        private Wildcard() {
            super(Kind.WILDCARD);
        }

        @Override
        public String toString() {
            return "Wildcard{}";
        }
    }

    /**
     * Parent of {@link PartialCapture} and {@link PartialWildcard}: matches segments that start with a prefix and end with a
     * suffix, with at least one character in between.
     */
    public abstract static class PartialComponent extends PathComponent {

        private final String prefix;
        private final String suffix;

        private PartialComponent(final Kind kind, final String prefix, final String suffix) {
            super(kind);
            this.prefix = Objects.requireNonNull(prefix);
            this.suffix = Objects.requireNonNull(suffix);
            if (prefix.isEmpty() && suffix.isEmpty()) {
                throw new IllegalArgumentException("Partial components require a prefix or a suffix");
            }
        }

        public String getPrefix() {
            return prefix;
        }

        public String getSuffix() {
            return suffix;
        }

        /**
         * Tests if the specified segment has the prefix and suffix of this component, without the two overlapping and with at
         * least one character remaining between them.
         *
         * @param segment The segment.
         * @param ignoreCase True to compare the prefix and suffix without regard to case.
         * @return True if the segment matches.
         */
        public boolean matches(final PathSegment segment, final boolean ignoreCase) {
            return segment.length() > prefix.length() + suffix.length()
                    && segment.startsWith(prefix, ignoreCase)
                    && segment.endsWith(suffix, ignoreCase);
        }

        @Override
        public int hashCode() {
            int hash = 7;
            hash = 31 * hash + getKind().hashCode();
            hash = 31 * hash + prefix.hashCode();
            hash = 31 * hash + suffix.hashCode();
            hash = 31 * hash + Objects.hashCode(getParameterName());
            return hash;
        }

        @Override
        public boolean equals(final Object obj) {
            if (this == obj) {
                return true;
            }
            if (obj == null || getClass() != obj.getClass()) {
                return false;
            }
            final PartialComponent other = (PartialComponent) obj;
            return prefix.equals(other.prefix)
                    && suffix.equals(other.suffix)
                    && Objects.equals(getParameterName(), other.getParameterName());
        }
    }

    /**
     * A partial component that captures the text between its prefix and suffix.
     */
    public static final class PartialCapture extends PartialComponent {

        private final String name;

        private PartialCapture(final String prefix, final String name, final String suffix) {
            super(Kind.PARTIAL_CAPTURE, prefix, suffix);
            this.name = Objects.requireNonNull(name);
        }

        @Override
        public String getParameterName() {
            return name;
        }

        @Override
        public String toString() {
            return "PartialCapture{" + "prefix=" + getPrefix() + ", name=" + name + ", suffix=" + getSuffix() + '}';
        }
    }

    /**
     * A partial component that does not capture anything.
     */
    public static final class PartialWildcard extends PartialComponent {

        private PartialWildcard(final String prefix, final String suffix) {
            super(Kind.PARTIAL_WILDCARD, prefix, suffix);
        }

        @Override
        public String toString() {
            return "PartialWildcard{" + "prefix=" + getPrefix() + ", suffix=" + getSuffix() + '}';
        }
    }

    /**
     * Matches all remaining segments of a path, including none at all.
     */
    public static final class CatchAll extends PathComponent {

        private static final CatchAll INSTANCE = new CatchAll();

        private CatchAll() {
            super(Kind.CATCH_ALL);
        }

        @Override
        public String toString() {
            return "CatchAll{}";
        }
    }

    //</editor-fold>
    //
    //<editor-fold defaultstate="collapsed" desc="RoutePattern inner class">
    /**
     * A parsed route pattern. Instances are immutable.
     */
    public static final class RoutePattern {

        private final String pattern;
        private final List<PathComponent> components;
        private final boolean literal;

        private RoutePattern(final String pattern, final List<PathComponent> components) {
            this.pattern = pattern;
            this.components = Collections.unmodifiableList(components);

            boolean allLiteral = true;
            for (final PathComponent component : components) {
                if (component.getKind() != Kind.LITERAL) {
                    allLiteral = false;
                    break;
                }
            }
            this.literal = allLiteral;
        }

        /**
         * @return The pattern string that was parsed.
         */
        public String getPattern() {
            return pattern;
        }

        /**
         * @return The components, in the order in which they appear in the pattern.
         */
        public List<PathComponent> getComponents() {
            return components;
        }

        /**
         * @return True if all components are literals. The empty pattern is a literal pattern.
         */
        public boolean isLiteral() {
            return literal;
        }

        /**
         * @return True if the last component is a catch-all.
         */
        public boolean endsWithCatchAll() {
            return !components.isEmpty() && components.get(components.size() - 1).getKind() == Kind.CATCH_ALL;
        }

        @Override
        public String toString() {
            return "RoutePattern{" + "pattern=" + pattern + ", components=" + components + '}';
        }
    }

    //</editor-fold>
    //
    /**
     * Parses the specified pattern using {@link PathSegmenter#DEFAULT_SEPARATOR}.
     *
     * @param pattern The pattern.
     * @return The parsed pattern.
     * @throws InvalidRoutePatternException If the pattern is not valid.
     */
    public static RoutePattern parsePattern(final String pattern) {
        return parsePattern(pattern, PathSegmenter.DEFAULT_SEPARATOR);
    }

    /**
     * Parses the specified pattern.
     *
     * @param pattern The pattern.
     * @param separator The separator used to split the pattern into segments.
     * @return The parsed pattern.
     * @throws InvalidRoutePatternException If the pattern is not valid.
     */
    public static RoutePattern parsePattern(final String pattern, final char separator) {
        if (pattern == null) {
            throw WaypointMessages.MESSAGES.nullRoutePattern();
        }

        final List<PathComponent> components = new ArrayList<>();
        PathComponent previous = null;
        for (final PathSegment segment : PathSegmenter.split(pattern, separator)) {
            final String text = segment.toString();
            if (previous != null && previous.getKind() == Kind.CATCH_ALL) {
                throw WaypointMessages.MESSAGES.componentAfterCatchAll(pattern, text);
            }
            previous = parseComponent(pattern, text);
            components.add(previous);
        }
        return new RoutePattern(pattern, components);
    }

    /**
     * Parses one segment of a pattern.
     *
     * @param pattern The complete pattern, used in error messages.
     * @param segment The segment. Must not be empty or contain separators.
     * @return The component.
     * @throws InvalidRoutePatternException If the segment is not valid.
     */
    static PathComponent parseComponent(final String pattern, final String segment) {
        if (CATCH_ALL.equals(segment)) {
            return CatchAll.INSTANCE;
        }
        if (WILDCARD.equals(segment)) {
            return Wildcard.INSTANCE;
        }
        if (segment.charAt(0) == ':') {
            if (segment.length() == 1) {
                throw WaypointMessages.MESSAGES.emptyParameterName(pattern);
            }
            return new Parameter(segment.substring(1));
        }

        final int open = segment.indexOf('{');
        final int close = open < 0 ? -1 : segment.indexOf('}', open + 1);
        if (close > 0) {
            return parseCaptureGroup(pattern, segment, open, close);
        }
        if (open >= 0 || segment.indexOf('}') >= 0) {
            WaypointLogger.ROOT_LOGGER.unbalancedBracesInPattern(pattern, segment);
            return new Literal(segment);
        }

        final int star = segment.indexOf('*');
        final int lastStar = segment.lastIndexOf('*');
        if (star == 0 && lastStar == 0) {
            return new PartialWildcard("", segment.substring(1));
        }
        if (star == segment.length() - 1) {
            return new PartialWildcard(segment.substring(0, star), "");
        }
        return new Literal(segment);
    }

    private static PathComponent parseCaptureGroup(
            final String pattern,
            final String segment,
            final int open,
            final int close
    ) {
        final String prefix = segment.substring(0, open);
        final String name = segment.substring(open + 1, close);
        final String suffix = segment.substring(close + 1);

        if (hasBrace(prefix) || hasBrace(name) || hasBrace(suffix)) {
            throw WaypointMessages.MESSAGES.ambiguousCaptureGroup(pattern, segment);
        }
        if (prefix.indexOf('*') >= 0 || suffix.indexOf('*') >= 0) {
            throw WaypointMessages.MESSAGES.wildcardInCaptureGroup(pattern, segment);
        }

        if (prefix.isEmpty() && suffix.isEmpty()) {
            return name.isEmpty() ? Wildcard.INSTANCE : new Parameter(name);
        }
        return name.isEmpty()
                ? new PartialWildcard(prefix, suffix)
                : new PartialCapture(prefix, name, suffix);
    }

    private static boolean hasBrace(final String value) {
        return value.indexOf('{') >= 0 || value.indexOf('}') >= 0;
    }
}
