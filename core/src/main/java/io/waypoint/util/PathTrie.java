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
import io.waypoint.WaypointOptions;
import io.waypoint.util.PathTrieParser.PartialComponent;
import io.waypoint.util.PathTrieParser.PathComponent;
import io.waypoint.util.PathTrieParser.RoutePattern;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiFunction;
import org.xnio.OptionMap;

/**
 * A trie over path segments that maps route patterns to values and resolves request paths to the best matching value.
 *
 * <p>
 * Tries are created in two phases:
 * <ol>
 * <li>The <i>setup phase</i>, during which route patterns (see {@link PathTrieParser} for the syntax) and their values are
 * added to a {@link Builder}. Builders are not thread-safe and are expected to be used by a single thread, typically while a
 * service starts.</li>
 * <li>The <i>routing phase</i>, during which the trie returned by {@link Builder#build()} resolves request paths. Tries are
 * immutable and can be used by any number of threads concurrently without synchronisation.</li>
 * </ol>
 *
 * <p>
 * <b>Routing methodology</b>
 *
 * <p>
 * Every node of the trie represents one segment position. When a request path is resolved, each node tries the current
 * segment of the path against its children in a fixed order and descends into the first child that matches:
 * <ol>
 * <li>The literal child that is equal to the segment.</li>
 * <li>Partial captures and partial wildcards (i.e. {@code {file}.jpg} or {@code *.jpg}), in the order in which they were
 * added.</li>
 * <li>Parameters (i.e. {@code :id}), in the order in which they were added. Patterns that use different names at the
 * same position lead to different children, so {@code {a}/x} and {@code {b}/y} can both be added.</li>
 * <li>The wildcard child ({@code *}).</li>
 * <li>The catch-all ({@code **}), which matches the current and all remaining segments.</li>
 * </ol>
 * If the remaining segments cannot be matched below the chosen child, then the next child in the same order is tried. A
 * path is only matched when all of its segments are consumed by a node that has a value, or by a catch-all. A catch-all
 * also matches when no segments remain, so {@code /files} matches the pattern {@code files/**} with an empty catch-all.
 *
 * <p>
 * Resolving a path never recurses, so the stack depth does not depend on the number of segments in the requested path. Each
 * node of the trie is visited at most once per call to {@link #resolve(String)}.
 *
 * @param <T> Value type.
 */
public final class PathTrie<T> {

    private final Node<T> root;
    private final char separator;
    private final boolean caseInsensitive;
    private final int maxPathSegments;
    private final List<String> patterns;

    private PathTrie(
            final Node<T> root,
            final char separator,
            final boolean caseInsensitive,
            final int maxPathSegments,
            final List<String> patterns
    ) {
        this.root = root;
        this.separator = separator;
        this.caseInsensitive = caseInsensitive;
        this.maxPathSegments = maxPathSegments;
        this.patterns = Collections.unmodifiableList(new ArrayList<>(patterns));
    }

    /**
     * @param <T> Value type.
     * @return A new builder with default options.
     */
    public static <T> Builder<T> builder() {
        return new Builder<>(OptionMap.EMPTY);
    }

    /**
     * @param options Options, see {@link WaypointOptions}.
     * @param <T> Value type.
     * @return A new builder.
     */
    public static <T> Builder<T> builder(final OptionMap options) {
        return new Builder<>(options);
    }

    /**
     * @return The separator that is used to split request paths.
     */
    public char getSeparator() {
        return separator;
    }

    /**
     * @return True if literal text is compared without regard to case.
     */
    public boolean isCaseInsensitive() {
        return caseInsensitive;
    }

    /**
     * @return The route patterns in this trie, in the order in which they were first added.
     */
    public List<String> getPatterns() {
        return patterns;
    }

    @Override
    public String toString() {
        return "PathTrie{" + "patterns=" + patterns + '}';
    }

    //<editor-fold defaultstate="collapsed" desc="Match inner class">
    /**
     * The result of successfully resolving a path. Instances are immutable.
     *
     * @param <T> Value type.
     */
    public static final class Match<T> {

        private final T value;
        private final String pattern;
        private final PathParameters parameters;

        private Match(final T value, final String pattern, final PathParameters parameters) {
            this.value = value;
            this.pattern = pattern;
            this.parameters = parameters;
        }

        /**
         * @return The value of the matched route.
         */
        public T getValue() {
            return value;
        }

        /**
         * @return The pattern of the matched route, as it was passed to {@link Builder#addEntry(String, Object)}.
         */
        public String getPattern() {
            return pattern;
        }

        /**
         * @return Parameters captured from the path.
         */
        public PathParameters getParameters() {
            return parameters;
        }

        @Override
        public String toString() {
            return "Match{" + "value=" + value + ", pattern=" + pattern + ", parameters=" + parameters + '}';
        }
    }

    //</editor-fold>
    //
    //<editor-fold defaultstate="collapsed" desc="Node inner classes">
    /**
     * A partial capture / partial wildcard with the node that follows it. Immutable.
     */
    private static final class PartialEdge<T> {

        private final PartialComponent component;
        private final int prefixLength;
        private final int suffixLength;
        private final String parameterName;
        private final Node<T> node;

        private PartialEdge(final PartialComponent component, final Node<T> node) {
            this.component = component;
            this.prefixLength = component.getPrefix().length();
            this.suffixLength = component.getSuffix().length();
            this.parameterName = component.getParameterName();
            this.node = node;
        }
    }

    /**
     * A named parameter with the node that follows it. Immutable.
     */
    private static final class ParameterEdge<T> {

        private final String name;
        private final Node<T> node;

        private ParameterEdge(final String name, final Node<T> node) {
            this.name = name;
            this.node = node;
        }
    }

    /**
     * One segment position in a built trie. Immutable once constructed, {@code null} fields are absent children / values.
     */
    private static final class Node<T> {

        private final Map<String, Node<T>> literals;
        private final PartialEdge<T>[] partials;
        private final ParameterEdge<T>[] parameters;
        private final Node<T> wildcard;
        private final T catchAllValue;
        private final String catchAllPattern;
        private final T value;
        private final String pattern;

        @SuppressWarnings("unchecked")
        private Node(final BuilderNode<T> source) {
            if (source.literals.isEmpty()) {
                this.literals = Collections.emptyMap();
            } else {
                final Map<String, Node<T>> map = new HashMap<>((int) (source.literals.size() / 0.75d) + 1);
                for (final Map.Entry<String, BuilderNode<T>> entry : source.literals.entrySet()) {
                    map.put(entry.getKey(), new Node<>(entry.getValue()));
                }
                this.literals = Collections.unmodifiableMap(map);
            }

            this.partials = new PartialEdge[source.partials.size()];
            for (int i = 0; i < partials.length; i++) {
                final BuilderPartial<T> partial = source.partials.get(i);
                partials[i] = new PartialEdge<>(partial.component, new Node<>(partial.node));
            }

            this.parameters = new ParameterEdge[source.parameters.size()];
            int idx = 0;
            for (final Map.Entry<String, BuilderNode<T>> entry : source.parameters.entrySet()) {
                parameters[idx++] = new ParameterEdge<>(entry.getKey(), new Node<>(entry.getValue()));
            }
            this.wildcard = source.wildcard == null ? null : new Node<>(source.wildcard);
            this.catchAllValue = source.catchAllValue;
            this.catchAllPattern = source.catchAllPattern;
            this.value = source.value;
            this.pattern = source.pattern;
        }
    }

    /**
     * A partial component with the node that follows it, during the setup phase.
     */
    private static final class BuilderPartial<T> {

        private final PartialComponent component;
        private final BuilderNode<T> node = new BuilderNode<>();

        private BuilderPartial(final PartialComponent component) {
            this.component = component;
        }
    }

    /**
     * One segment position during the setup phase. Mutable, used by a single thread.
     */
    private static final class BuilderNode<T> {

        private final Map<String, BuilderNode<T>> literals = new LinkedHashMap<>();
        private final List<BuilderPartial<T>> partials = new ArrayList<>();
        private final Map<String, BuilderNode<T>> parameters = new LinkedHashMap<>();
        private BuilderNode<T> wildcard;
        private T catchAllValue;
        private String catchAllPattern;
        private T value;
        private String pattern;

        /**
         * @return The existing child for the component, or {@code null}. Catch-all components do not have children.
         */
        private BuilderNode<T> getChild(final PathComponent component, final String literalKey) {
            switch (component.getKind()) {
                case LITERAL:
                    return literals.get(literalKey);
                case PARAMETER:
                    return parameters.get(component.getParameterName());
                case WILDCARD:
                    return wildcard;
                case PARTIAL_CAPTURE:
                case PARTIAL_WILDCARD:
                    final BuilderPartial<T> partial = findPartial((PartialComponent) component);
                    return partial == null ? null : partial.node;
                default:
                    return null;
            }
        }

        private BuilderNode<T> getOrCreateChild(final PathComponent component, final String literalKey) {
            final BuilderNode<T> existing = getChild(component, literalKey);
            if (existing != null) {
                return existing;
            }
            switch (component.getKind()) {
                case LITERAL:
                    final BuilderNode<T> literal = new BuilderNode<>();
                    literals.put(literalKey, literal);
                    return literal;
                case PARAMETER:
                    final BuilderNode<T> parameter = new BuilderNode<>();
                    parameters.put(component.getParameterName(), parameter);
                    return parameter;
                case WILDCARD:
                    wildcard = new BuilderNode<>();
                    return wildcard;
                case PARTIAL_CAPTURE:
                case PARTIAL_WILDCARD:
                    final BuilderPartial<T> partial = new BuilderPartial<>((PartialComponent) component);
                    partials.add(partial);
                    return partial.node;
                default:
                    throw new IllegalStateException("Catch-all components do not have child nodes");
            }
        }

        private BuilderPartial<T> findPartial(final PartialComponent component) {
            for (final BuilderPartial<T> partial : partials) {
                if (partial.component.equals(component)) {
                    return partial;
                }
            }
            return null;
        }

        private int countNodes() {
            int count = 1;
            for (final BuilderNode<T> child : literals.values()) {
                count += child.countNodes();
            }
            for (final BuilderPartial<T> partial : partials) {
                count += partial.node.countNodes();
            }
            for (final BuilderNode<T> child : parameters.values()) {
                count += child.countNodes();
            }
            if (wildcard != null) {
                count += wildcard.countNodes();
            }
            return count;
        }
    }

    //</editor-fold>
    //
    //<editor-fold defaultstate="collapsed" desc="Builder inner class">
    /**
     * Accumulates route patterns and their values, then creates an immutable {@link PathTrie}.
     *
     * <p>
     * Builders are not thread-safe. A builder can only build one trie, after {@link #build()} has been called all mutating
     * methods throw {@link IllegalStateException}.
     *
     * @param <T> Value type.
     */
    public static final class Builder<T> {

        private final BuilderNode<T> root = new BuilderNode<>();
        private final List<String> patterns = new ArrayList<>();
        //Pattern shape (parameter names removed) to the first pattern added with that shape.
        private final Map<List<String>, String> shapes = new HashMap<>();
        private final char separator;
        private final boolean caseInsensitive;
        private final int maxPathSegments;
        private boolean built;

        private Builder(final OptionMap options) {
            final String separatorOption = options.get(WaypointOptions.PATH_SEPARATOR, WaypointOptions.DEFAULT_PATH_SEPARATOR);
            if (separatorOption.length() != 1) {
                throw WaypointMessages.MESSAGES.invalidPathSeparator(separatorOption);
            }
            this.separator = separatorOption.charAt(0);
            this.caseInsensitive = options.get(WaypointOptions.CASE_INSENSITIVE, false);
            this.maxPathSegments = options.get(WaypointOptions.MAX_PATH_SEGMENTS, WaypointOptions.DEFAULT_MAX_PATH_SEGMENTS);
            if (maxPathSegments == 0 || maxPathSegments < -1) {
                throw WaypointMessages.MESSAGES.invalidMaxPathSegments(maxPathSegments);
            }
        }

        /**
         * Adds a route. Adding the same literal pattern again replaces the previous value.
         *
         * @param pattern The route pattern, see {@link PathTrieParser}.
         * @param value The value. Must not be {@code null}.
         * @return This builder.
         * @throws InvalidRoutePatternException If the pattern is not valid, if the pattern contains parameters or wildcards and
         * the same pattern was already added, if the pattern only differs from a previously added pattern in the names of its
         * parameters (so that one of the two could never be matched) or if the pattern needs more segments than
         * {@link WaypointOptions#MAX_PATH_SEGMENTS} allows. The builder is not modified when this exception is thrown.
         */
        public Builder<T> addEntry(final String pattern, final T value) {
            return addEntry(pattern, value, null);
        }

        /**
         * Adds a route, merging the value with the value of an existing route with the same pattern.
         *
         * @param pattern The route pattern, see {@link PathTrieParser}.
         * @param value The value. Must not be {@code null}.
         * @param merge Called with the existing and the new value if a route with the same pattern exists, returns the value
         * that is kept. If {@code null}, then literal patterns replace the existing value and other patterns are rejected.
         * @return This builder.
         * @throws InvalidRoutePatternException See {@link #addEntry(String, Object)}.
         */
        public Builder<T> addEntry(
                final String pattern,
                final T value,
                final BiFunction<? super T, ? super T, ? extends T> merge
        ) {
            if (built) {
                throw WaypointMessages.MESSAGES.builderAlreadyBuilt();
            }
            if (value == null) {
                throw WaypointMessages.MESSAGES.valueCannotBeNull();
            }

            final RoutePattern routePattern = PathTrieParser.parsePattern(pattern, separator);
            final List<PathComponent> components = routePattern.getComponents();
            final int nodeComponents = routePattern.endsWithCatchAll() ? components.size() - 1 : components.size();
            if (maxPathSegments > 0 && nodeComponents > maxPathSegments) {
                throw WaypointMessages.MESSAGES.routePatternExceedsMaxPathSegments(pattern, nodeComponents, maxPathSegments);
            }

            //Validate against the existing nodes before anything is changed.
            BuilderNode<T> node = root;
            boolean existingPath = true;
            for (int i = 0; i < nodeComponents; i++) {
                final PathComponent component = components.get(i);
                final BuilderNode<T> child = node.getChild(component, literalKey(component));
                if (child == null) {
                    existingPath = false;
                    break;
                }
                node = child;
            }
            final boolean existingRoute = existingPath
                    && (routePattern.endsWithCatchAll() ? node.catchAllValue : node.value) != null;
            if (existingRoute && merge == null && !routePattern.isLiteral()) {
                throw WaypointMessages.MESSAGES.duplicateRoutePattern(pattern);
            }
            final List<String> shape = shapeOf(components);
            if (!existingRoute) {
                final String shadowing = shapes.get(shape);
                if (shadowing != null) {
                    throw WaypointMessages.MESSAGES.shadowedRoutePattern(pattern, shadowing);
                }
            }

            node = root;
            for (int i = 0; i < nodeComponents; i++) {
                final PathComponent component = components.get(i);
                node = node.getOrCreateChild(component, literalKey(component));
            }

            if (routePattern.endsWithCatchAll()) {
                final T existing = node.catchAllValue;
                node.catchAllValue = mergedValue(pattern, existing, value, merge);
                if (existing == null) {
                    node.catchAllPattern = pattern;
                    patterns.add(pattern);
                }
            } else {
                final T existing = node.value;
                node.value = mergedValue(pattern, existing, value, merge);
                if (existing == null) {
                    node.pattern = pattern;
                    patterns.add(pattern);
                }
            }
            shapes.putIfAbsent(shape, pattern);
            return this;
        }

        /**
         * Two patterns with the same shape match exactly the same paths. The resolver always picks the same one of them.
         */
        private List<String> shapeOf(final List<PathComponent> components) {
            final List<String> shape = new ArrayList<>(components.size());
            for (final PathComponent component : components) {
                switch (component.getKind()) {
                    case LITERAL:
                        shape.add("L" + literalKey(component));
                        break;
                    case PARAMETER:
                        shape.add("P");
                        break;
                    case WILDCARD:
                        shape.add("W");
                        break;
                    case PARTIAL_CAPTURE:
                    case PARTIAL_WILDCARD:
                        final PartialComponent partial = (PartialComponent) component;
                        shape.add((component.getKind() == PathTrieParser.Kind.PARTIAL_CAPTURE ? "C" : "w")
                                + foldIfCaseInsensitive(partial.getPrefix()) + '\u0000'
                                + foldIfCaseInsensitive(partial.getSuffix()));
                        break;
                    default:
                        shape.add("**");
                        break;
                }
            }
            return shape;
        }

        private String foldIfCaseInsensitive(final String text) {
            return caseInsensitive ? PathSegment.foldCase(text) : text;
        }

        private T mergedValue(
                final String pattern,
                final T existing,
                final T value,
                final BiFunction<? super T, ? super T, ? extends T> merge
        ) {
            if (existing == null) {
                return value;
            }
            if (merge == null) {
                WaypointLogger.ROOT_LOGGER.routeValueReplaced(pattern);
                return value;
            }
            final T merged = merge.apply(existing, value);
            if (merged == null) {
                throw WaypointMessages.MESSAGES.valueCannotBeNull();
            }
            return merged;
        }

        private String literalKey(final PathComponent component) {
            if (component.getKind() != PathTrieParser.Kind.LITERAL) {
                return null;
            }
            return foldIfCaseInsensitive(((PathTrieParser.Literal) component).getText());
        }

        /**
         * Creates the trie. This builder can not be used any more after this method has been called.
         *
         * @return The trie.
         */
        public PathTrie<T> build() {
            if (built) {
                throw WaypointMessages.MESSAGES.builderAlreadyBuilt();
            }
            built = true;

            final PathTrie<T> trie = new PathTrie<>(new Node<>(root), separator, caseInsensitive, maxPathSegments, patterns);
            if (WaypointLogger.ROOT_LOGGER.isDebugEnabled()) {
                WaypointLogger.ROOT_LOGGER.pathTrieBuilt(patterns.size(), root.countNodes(), separator, caseInsensitive);
            }
            return trie;
        }
    }

    //</editor-fold>
    //
    //<editor-fold defaultstate="collapsed" desc="Resolve">
    /**
     * Resolves the specified path to the value of the best matching route.
     *
     * <p>
     * The empty path, {@code "/"} and any path that consists of separators only are equivalent and match the route that was
     * added with the empty pattern.
     *
     * @param path The request path. Percent-decoding, if required, is the responsibility of the caller.
     * @return The match, or {@code null} if the path does not match any route.
     */
    public Match<T> resolve(final String path) {
        Objects.requireNonNull(path);

        final int segmentCount = PathSegmenter.count(path, separator);
        if (maxPathSegments > 0 && segmentCount > maxPathSegments) {
            WaypointLogger.ROUTING_LOGGER.tooManyPathSegments(segmentCount, maxPathSegments);
            return null;
        }

        final PathSegment[] segments = new PathSegment[segmentCount];
        int idx = 0;
        for (final PathSegment segment : PathSegmenter.split(path, separator)) {
            segments[idx++] = segment;
        }

        final Match<T> match = search(path, segments);
        if (match == null) {
            WaypointLogger.ROUTING_LOGGER.tracef("No route matched path %s", path);
        } else {
            WaypointLogger.ROUTING_LOGGER.tracef("Matched path %s to route %s", path, match.pattern);
        }
        return match;
    }

    /**
     * Depth first search with an explicit stack. Frame {@code depth} holds the node that is reached after consuming
     * {@code depth} segments, the next alternative that the frame will try and the number of bindings that existed when the
     * frame was entered. Popping a frame discards the bindings made below it.
     */
    @SuppressWarnings("unchecked")
    private Match<T> search(final String path, final PathSegment[] segments) {
        final int segmentCount = segments.length;
        final Node<T>[] nodes = new Node[segmentCount + 1];
        final int[] stages = new int[segmentCount + 1];
        final int[] marks = new int[segmentCount + 1];

        //At most one binding per consumed segment.
        final String[] bindingNames = new String[segmentCount];
        final int[] bindingStarts = new int[segmentCount];
        final int[] bindingEnds = new int[segmentCount];
        int bindings = 0;

        int depth = 0;
        nodes[0] = root;

        while (depth >= 0) {
            final Node<T> node = nodes[depth];
            final int stage = stages[depth]++;

            if (depth == segmentCount) {
                if (stage == 0) {
                    if (node.value != null) {
                        return createMatch(node.value, node.pattern, path, segments, bindingNames,
                                bindingStarts, bindingEnds, bindings, -1);
                    }
                    if (node.catchAllValue != null) {
                        return createMatch(node.catchAllValue, node.catchAllPattern, path, segments, bindingNames,
                                bindingStarts, bindingEnds, bindings, depth);
                    }
                }
                bindings = marks[depth--];
                continue;
            }

            final PathSegment segment = segments[depth];
            final PartialEdge<T>[] partials = node.partials;
            final ParameterEdge<T>[] parameters = node.parameters;
            Node<T> child = null;
            String bindingName = null;
            int bindingStart = segment.getStart();
            int bindingEnd = segment.getEnd();

            if (stage == 0) {
                if (!node.literals.isEmpty()) {
                    child = node.literals.get(caseInsensitive ? PathSegment.foldCase(segment) : segment.toString());
                }
            } else if (stage <= partials.length) {
                final PartialEdge<T> edge = partials[stage - 1];
                if (edge.component.matches(segment, caseInsensitive)) {
                    child = edge.node;
                    bindingName = edge.parameterName;
                    bindingStart += edge.prefixLength;
                    bindingEnd -= edge.suffixLength;
                }
            } else if (stage <= partials.length + parameters.length) {
                final ParameterEdge<T> edge = parameters[stage - partials.length - 1];
                child = edge.node;
                bindingName = edge.name;
            } else {
                switch (stage - partials.length - parameters.length) {
                    case 1:
                        child = node.wildcard;
                        break;
                    case 2:
                        if (node.catchAllValue != null) {
                            return createMatch(node.catchAllValue, node.catchAllPattern, path, segments, bindingNames,
                                    bindingStarts, bindingEnds, bindings, depth);
                        }
                        break;
                    default:
                        //All alternatives failed, backtrack.
                        bindings = marks[depth--];
                        continue;
                }
            }

            if (child != null) {
                depth++;
                nodes[depth] = child;
                stages[depth] = 0;
                marks[depth] = bindings;
                if (bindingName != null) {
                    bindingNames[bindings] = bindingName;
                    bindingStarts[bindings] = bindingStart;
                    bindingEnds[bindings] = bindingEnd;
                    bindings++;
                }
            }
        }
        return null;
    }

    private static <T> Match<T> createMatch(
            final T value,
            final String pattern,
            final String path,
            final PathSegment[] segments,
            final String[] bindingNames,
            final int[] bindingStarts,
            final int[] bindingEnds,
            final int bindings,
            final int catchAllFrom
    ) {
        final Map<String, String> parameters;
        if (bindings == 0) {
            parameters = Collections.emptyMap();
        } else {
            parameters = new LinkedHashMap<>((int) (bindings / 0.75d) + 1);
            for (int i = 0; i < bindings; i++) {
                parameters.put(bindingNames[i], path.substring(bindingStarts[i], bindingEnds[i]));
            }
        }

        if (catchAllFrom < 0) {
            return new Match<>(value, pattern, new PathParameters(parameters, null, null));
        }

        final List<String> catchAll = new ArrayList<>(segments.length - catchAllFrom);
        for (int i = catchAllFrom; i < segments.length; i++) {
            catchAll.add(segments[i].toString());
        }
        final String catchAllPath = catchAll.isEmpty()
                ? ""
                : path.substring(segments[catchAllFrom].getStart(), segments[segments.length - 1].getEnd());
        return new Match<>(value, pattern, new PathParameters(parameters, catchAll, catchAllPath));
    }
    //</editor-fold>
}
