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

/**
 * Thrown when a route pattern cannot be added to a {@link PathTrie.Builder}. The builder is left unchanged, so the caller
 * may correct the pattern and carry on adding routes.
 */
public class InvalidRoutePatternException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public InvalidRoutePatternException(final String message) {
        super(message);
    }

    public InvalidRoutePatternException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
