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
import java.util.Optional;

/**
 * Result for routing a requested URL path with a {@link PathTrieRouter}. Results for requests that matched a route contain
 * the route pattern in {@link #getPattern()}. Results for requests that did not match any route contain the default target
 * of the router, an empty Optional in {@link #getPattern()} and empty parameters.
 *
 * <p>
 * Instances are immutable and therefore thread-safe.
 *
 * @param <T> Target type.
 */
public class PathTrieRouteResult<T> {

    private final T target;
    private final Optional<String> pattern;
    private final PathParameters parameters;

    /**
     * @param target The target.
     * @param pattern The route pattern that was matched. If no route matched the request, then this Optional will be
     * empty.
     * @param parameters The parameters that were captured by the route.
     */
    public PathTrieRouteResult(
            final T target,
            final Optional<String> pattern,
            final PathParameters parameters
    ) {
        this.target = Objects.requireNonNull(target);
        this.pattern = Objects.requireNonNull(pattern);
        this.parameters = Objects.requireNonNull(parameters);
    }

    @Override
    public String toString() {
        return "PathTrieRouteResult{" + "target=" + target + ", pattern=" + pattern
                + ", parameters=" + parameters + '}';
    }

    /**
     * @return The target.
     */
    public T getTarget() {
        return target;
    }

    /**
     * @return The route pattern that was matched. If no route matched the request, then this Optional will be empty.
     */
    public Optional<String> getPattern() {
        return pattern;
    }

    /**
     * @return True if the request matched a route.
     */
    public boolean isMatched() {
        return pattern.isPresent();
    }

    /**
     * @return The parameters captured from the requested path.
     */
    public PathParameters getParameters() {
        return parameters;
    }
}
