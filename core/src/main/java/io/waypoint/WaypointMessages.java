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

import io.waypoint.util.InvalidRoutePatternException;
import org.jboss.logging.Messages;
import org.jboss.logging.annotations.Cause;
import org.jboss.logging.annotations.Message;
import org.jboss.logging.annotations.MessageBundle;

/**
 * Exception messages. Ids 1 - 99 are used by route pattern parsing and trie building, ids from 100 by everything else.
 */
@MessageBundle(projectCode = "WAYPT")
public interface WaypointMessages {

    WaypointMessages MESSAGES = Messages.getBundle(WaypointMessages.class);

    @Message(id = 1, value = "Route pattern '%s' contains '%s' after a catch-all, a catch-all must be the last component")
    InvalidRoutePatternException componentAfterCatchAll(String pattern, String component);

    @Message(id = 2, value = "Route pattern '%s' contains component '%s' with more than one capture group")
    InvalidRoutePatternException ambiguousCaptureGroup(String pattern, String component);

    @Message(id = 3, value = "Route pattern '%s' contains component '%s' that combines a wildcard with a capture group")
    InvalidRoutePatternException wildcardInCaptureGroup(String pattern, String component);

    @Message(id = 4, value = "Route pattern '%s' contains a parameter without a name")
    InvalidRoutePatternException emptyParameterName(String pattern);

    @Message(id = 5, value = "Route pattern '%s' duplicates a previously added pattern")
    InvalidRoutePatternException duplicateRoutePattern(String pattern);

    @Message(id = 6, value = "Route pattern must not be null")
    InvalidRoutePatternException nullRoutePattern();

    @Message(id = 7, value = "Route pattern '%s' matches exactly the same paths as route pattern '%s', only one of them can ever be matched")
    InvalidRoutePatternException shadowedRoutePattern(String pattern, String existingPattern);

    @Message(id = 8, value = "Route pattern '%s' requires %s path segments, but request paths are limited to %s segments")
    InvalidRoutePatternException routePatternExceedsMaxPathSegments(String pattern, int segments, int maxPathSegments);

    @Message(id = 100, value = "This builder has already been used to build a path trie and can no longer be modified")
    IllegalStateException builderAlreadyBuilt();

    @Message(id = 101, value = "Maximum number of splits must not be negative, was %s")
    IllegalArgumentException maxSplitsMustNotBeNegative(int maxSplits);

    @Message(id = 102, value = "Path separator must be exactly one character, was '%s'")
    IllegalArgumentException invalidPathSeparator(String separator);

    @Message(id = 103, value = "Maximum number of path segments must be larger than zero or -1, was %s")
    IllegalArgumentException invalidMaxPathSegments(int maxPathSegments);

    @Message(id = 104, value = "Path parameter '%s' is not present")
    IllegalArgumentException missingPathParameter(String name);

    @Message(id = 105, value = "Path parameter '%s' with value '%s' could not be converted")
    IllegalArgumentException pathParameterConversionFailed(String name, String value, @Cause Exception cause);

    @Message(id = 106, value = "Value cannot be null")
    IllegalArgumentException valueCannotBeNull();
}
