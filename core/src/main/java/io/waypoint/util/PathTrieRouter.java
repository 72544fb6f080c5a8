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
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiFunction;
import org.xnio.OptionMap;

/**
 * Routes requested URL paths to targets, falling back to a default target when no route matches.
 *
 * <p>
 * This is the view of a {@link PathTrie} that request dispatchers use: {@link #route(String)} never returns {@code null},
 * which lets the dispatcher treat "no route" (typically a 404 response) like any other target. The same router can
 * also be used to normalise requested paths to route patterns, for example to summarise access logs.
 *
 * <p>
 * Implementations of this interface must be thread-safe.
 *
 * @param <T> Target type.
 */
public interface PathTrieRouter<T> {

    /**
     * @return The default target for requests that do not match any route.
     */
    T getDefaultTarget();

    /**
     * Routes the requested URL path to the best available target.
     *
     * <p>
     * If the requested path matches a route, then the result contains the target and pattern of the most specific route
     * together with the captured parameters. Otherwise the result contains {@link #getDefaultTarget()} and an empty
     * Optional in {@link PathTrieRouteResult#getPattern()}.
     *
     * @param path The requested URL path.
     * @return The routing result.
     */
    PathTrieRouteResult<T> route(String path);

    /**
     * @return The route patterns known to this router, in the order in which they were first added.
     */
    List<String> getRoutes();

    /**
     * @param defaultTarget The default target.
     * @param <T> Target type.
     * @return A new builder with default options.
     */
    static <T> Builder<T> builder(final T defaultTarget) {
        return new Builder<>(OptionMap.EMPTY, defaultTarget);
    }

    /**
     * @param options Options, see {@link io.waypoint.WaypointOptions}.
     * @param defaultTarget The default target.
     * @param <T> Target type.
     * @return A new builder.
     */
    static <T> Builder<T> builder(final OptionMap options, final T defaultTarget) {
        return new Builder<>(options, defaultTarget);
    }

    /**
     * Creates a router for an existing trie.
     *
     * @param trie The trie.
     * @param defaultTarget The default target.
     * @param <T> Target type.
     * @return The router.
     */
    static <T> PathTrieRouter<T> of(final PathTrie<T> trie, final T defaultTarget) {
        return new TrieRouter<>(trie, defaultTarget);
    }

    /**
     * Builder for routers, see {@link PathTrie.Builder} for the rules that apply to adding routes.
     *
     * @param <T> Target type.
     */
    final class Builder<T> {

        private final PathTrie.Builder<T> trieBuilder;
        private T defaultTarget;

        private Builder(final OptionMap options, final T defaultTarget) {
            this.trieBuilder = PathTrie.builder(options);
            this.defaultTarget = requireTarget(defaultTarget);
        }

        private static <T> T requireTarget(final T target) {
            if (target == null) {
                throw WaypointMessages.MESSAGES.valueCannotBeNull();
            }
            return target;
        }

        /**
         * @param defaultTarget The new default target.
         * @return This builder.
         */
        public Builder<T> updateDefaultTarget(final T defaultTarget) {
            this.defaultTarget = requireTarget(defaultTarget);
            return this;
        }

        /**
         * @param pattern The route pattern.
         * @param target The target.
         * @return This builder.
         */
        public Builder<T> addRoute(final String pattern, final T target) {
            trieBuilder.addEntry(pattern, target);
            return this;
        }

        /**
         * @param pattern The route pattern.
         * @param target The target.
         * @param merge Merges the target with the target of an existing route with the same pattern.
         * @return This builder.
         */
        public Builder<T> addRoute(
                final String pattern,
                final T target,
                final BiFunction<? super T, ? super T, ? extends T> merge
        ) {
            trieBuilder.addEntry(pattern, target, merge);
            return this;
        }

        /**
         * @return The router. This builder cannot be used after this method has been called.
         */
        public PathTrieRouter<T> build() {
            return new TrieRouter<>(trieBuilder.build(), defaultTarget);
        }
    }

    /**
     * Router backed by a {@link PathTrie}. Immutable and therefore thread-safe.
     *
     * @param <T> Target type.
     */
    final class TrieRouter<T> implements PathTrieRouter<T> {

        private final PathTrie<T> trie;
        private final T defaultTarget;
        private final PathTrieRouteResult<T> defaultResult;

        private TrieRouter(final PathTrie<T> trie, final T defaultTarget) {
            this.trie = Objects.requireNonNull(trie);
            this.defaultTarget = Objects.requireNonNull(defaultTarget);
            this.defaultResult = new PathTrieRouteResult<>(defaultTarget, Optional.empty(), PathParameters.empty());
        }

        @Override
        public T getDefaultTarget() {
            return defaultTarget;
        }

        @Override
        public PathTrieRouteResult<T> route(final String path) {
            final PathTrie.Match<T> match = trie.resolve(path);
            if (match == null) {
                return defaultResult;
            }
            return new PathTrieRouteResult<>(match.getValue(), Optional.of(match.getPattern()), match.getParameters());
        }

        @Override
        public List<String> getRoutes() {
            return trie.getPatterns();
        }

        @Override
        public String toString() {
            return "TrieRouter{" + "routes=" + trie.getPatterns() + ", defaultTarget=" + defaultTarget + '}';
        }
    }
}
