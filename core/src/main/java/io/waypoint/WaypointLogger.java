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

import org.jboss.logging.BasicLogger;
import org.jboss.logging.Logger;
import org.jboss.logging.annotations.LogMessage;
import org.jboss.logging.annotations.Message;
import org.jboss.logging.annotations.MessageLogger;

import static org.jboss.logging.Logger.Level.DEBUG;

/**
 * log messages start at 5000
 */
@MessageLogger(projectCode = "WAYPT")
public interface WaypointLogger extends BasicLogger {

    WaypointLogger ROOT_LOGGER = Logger.getMessageLogger(WaypointLogger.class, WaypointLogger.class.getPackage().getName());

    /**
     * Logger used while resolving request paths. Messages are only ever logged at DEBUG or TRACE level, as anything else
     * would allow clients to fill up the logs by requesting unknown paths.
     */
    WaypointLogger ROUTING_LOGGER = Logger.getMessageLogger(WaypointLogger.class, WaypointLogger.class.getPackage().getName() + ".routing");

    @LogMessage(level = DEBUG)
    @Message(id = 5001, value = "Route pattern '%s' was added again, the previous value has been replaced")
    void routeValueReplaced(String pattern);

    @LogMessage(level = DEBUG)
    @Message(id = 5002, value = "Built path trie with %s routes and %s nodes (separator '%s', case insensitive: %s)")
    void pathTrieBuilt(int routes, int nodes, char separator, boolean caseInsensitive);

    @LogMessage(level = DEBUG)
    @Message(id = 5003, value = "Route pattern '%s' contains segment '%s' with unbalanced braces, it will only match the literal text")
    void unbalancedBracesInPattern(String pattern, String segment);

    @LogMessage(level = DEBUG)
    @Message(id = 5004, value = "Rejected path with %s segments, the maximum is %s")
    void tooManyPathSegments(int segments, int max);
}
