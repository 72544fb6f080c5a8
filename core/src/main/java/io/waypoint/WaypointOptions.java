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

package io.waypoint;

import org.xnio.Option;

/**
 * Options that control how path tries are built and how request paths are resolved.
 */
public class WaypointOptions {

    /**
     * The character that separates the segments of patterns and request paths. Must be a string of exactly one
     * character.
     */
    public static final Option<String> PATH_SEPARATOR = Option.simple(WaypointOptions.class, "PATH_SEPARATOR", String.class);

    /**
     * The default path separator.
     */
    public static final String DEFAULT_PATH_SEPARATOR = "/";

    /**
     * If literal text in route patterns should be compared to request paths without regard to case. Captured parameter
     * values always keep the case of the request path. Defaults to false.
     */
    public static final Option<Boolean> CASE_INSENSITIVE = Option.simple(WaypointOptions.class, "CASE_INSENSITIVE", Boolean.class);

    /**
     * The maximum number of segments in a request path. Paths that contain more segments do not match any route and are
     * rejected before the trie is searched. Route patterns that need more segments are rejected when they are added.
     *
     * <code>-1</code> or missing value disables this functionality.
     */
    public static final Option<Integer> MAX_PATH_SEGMENTS = Option.simple(WaypointOptions.class, "MAX_PATH_SEGMENTS", Integer.class);

    /**
     * The default maximum number of segments in a request path.
     */
    public static final int DEFAULT_MAX_PATH_SEGMENTS = -1;

    private WaypointOptions() {

    }
}
