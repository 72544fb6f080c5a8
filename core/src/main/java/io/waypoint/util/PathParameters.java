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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;

/**
 * Parameters captured from a request path while it was resolved against a {@link PathTrie}.
 *
 * <p>
 * Named parameters are kept in the order in which they were captured. If the same name was captured more than once, then the
 * value captured last - deepest in the path - is kept.
 *
 * <p>
 * The segments matched by a catch-all ({@code **}) are kept separately. {@link #findCatchAll()} distinguishes between a match
 * that did not involve a catch-all (empty Optional) and a catch-all that matched zero segments (Optional of an empty list).
 *
 * <p>
 * Instances are immutable and therefore thread-safe.
 */
public final class PathParameters {

    private static final PathParameters EMPTY = new PathParameters(Collections.emptyMap(), null, null);

    private final Map<String, String> parameters;
    private final List<String> catchAll;
    private final String catchAllPath;

    /**
     * @param parameters Named parameters. The map is used as is and must not be modified afterwards.
     * @param catchAll The segments matched by a catch-all or {@code null} if no catch-all was matched.
     * @param catchAllPath The unsplit text matched by a catch-all or {@code null} if no catch-all was matched.
     */
    PathParameters(
            final Map<String, String> parameters,
            final List<String> catchAll,
            final String catchAllPath
    ) {
        this.parameters = Collections.unmodifiableMap(parameters);
        this.catchAll = catchAll == null ? null : Collections.unmodifiableList(catchAll);
        this.catchAllPath = catchAllPath;
    }

    /**
     * @return Parameters without any named parameters or catch-all.
     */
    public static PathParameters empty() {
        return EMPTY;
    }

    /**
     * Creates parameters from a map, without a catch-all.
     *
     * @param parameters The named parameters.
     * @return The parameters.
     */
    public static PathParameters of(final Map<String, String> parameters) {
        return new PathParameters(new LinkedHashMap<>(parameters), null, null);
    }

    /**
     * @param name Name of the parameter.
     * @return The captured value or {@code null} if no parameter with the specified name was captured.
     */
    public String get(final String name) {
        return parameters.get(name);
    }

    /**
     * Returns the captured value converted by the specified function.
     *
     * @param name Name of the parameter.
     * @param converter Converts the captured value. Signals values that cannot be converted by throwing
     * {@link IllegalArgumentException} (which includes {@link NumberFormatException}).
     * @param <R> Type of the converted value.
     * @return The converted value or {@code null} if the parameter was not captured or could not be converted.
     */
    public <R> R get(final String name, final Function<String, ? extends R> converter) {
        final String value = parameters.get(name);
        if (value == null) {
            return null;
        }
        try {
            return converter.apply(value);
        } catch (IllegalArgumentException e) {
            WaypointLogger.ROUTING_LOGGER.debugf(e, "Path parameter %s with value %s could not be converted", name, value);
            return null;
        }
    }

    /**
     * @param name Name of the parameter.
     * @return The captured value.
     * @throws IllegalArgumentException If no parameter with the specified name was captured.
     */
    public String require(final String name) {
        final String value = parameters.get(name);
        if (value == null) {
            throw WaypointMessages.MESSAGES.missingPathParameter(name);
        }
        return value;
    }

    /**
     * @param name Name of the parameter.
     * @param converter Converts the captured value, see {@link #get(String, Function)}.
     * @param <R> Type of the converted value.
     * @return The converted value.
     * @throws IllegalArgumentException If no parameter with the specified name was captured or if the captured value could
     * not be converted.
     */
    public <R> R require(final String name, final Function<String, ? extends R> converter) {
        final String value = require(name);
        final R result;
        try {
            result = converter.apply(value);
        } catch (IllegalArgumentException e) {
            throw WaypointMessages.MESSAGES.pathParameterConversionFailed(name, value, e);
        }
        if (result == null) {
            throw WaypointMessages.MESSAGES.pathParameterConversionFailed(name, value, null);
        }
        return result;
    }

    public Integer getInteger(final String name) {
        return get(name, Integer::valueOf);
    }

    public int requireInteger(final String name) {
        return require(name, Integer::valueOf);
    }

    public Long getLong(final String name) {
        return get(name, Long::valueOf);
    }

    public UUID getUUID(final String name) {
        return get(name, UUID::fromString);
    }

    public UUID requireUUID(final String name) {
        return require(name, UUID::fromString);
    }

    /**
     * @param name Name of the parameter.
     * @return True if a parameter with the specified name was captured.
     */
    public boolean contains(final String name) {
        return parameters.containsKey(name);
    }

    /**
     * @return Names of all captured parameters, in the order in which they were captured.
     */
    public Set<String> names() {
        return parameters.keySet();
    }

    /**
     * @return Number of named parameters. The catch-all is not counted.
     */
    public int size() {
        return parameters.size();
    }

    /**
     * @return True if there are no named parameters and no catch-all.
     */
    public boolean isEmpty() {
        return parameters.isEmpty() && catchAll == null;
    }

    /**
     * @return The named parameters as an unmodifiable map.
     */
    public Map<String, String> asMap() {
        return parameters;
    }

    /**
     * @return The segments matched by a catch-all. Empty if the catch-all matched no segments or if the matched route does
     * not contain a catch-all.
     */
    public List<String> getCatchAll() {
        return catchAll == null ? Collections.emptyList() : catchAll;
    }

    /**
     * @return The segments matched by a catch-all, or an empty Optional if the matched route does not contain a catch-all.
     */
    public Optional<List<String>> findCatchAll() {
        return Optional.ofNullable(catchAll);
    }

    /**
     * @return The text matched by a catch-all, from the first to the last matched segment with the separators between
     * them intact. {@code null} if the matched route does not contain a catch-all.
     */
    public String getCatchAllPath() {
        return catchAllPath;
    }

    @Override
    public String toString() {
        return "PathParameters{" + "parameters=" + parameters
                + (catchAll == null ? "" : ", catchAll=" + catchAll) + '}';
    }

    @Override
    public int hashCode() {
        return 31 * parameters.hashCode() + Objects.hashCode(catchAll);
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final PathParameters other = (PathParameters) obj;
        return parameters.equals(other.parameters) && Objects.equals(catchAll, other.catchAll);
    }
}
