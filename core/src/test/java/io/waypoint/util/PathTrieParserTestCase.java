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

import io.waypoint.testutils.category.UnitTest;
import io.waypoint.util.PathTrieParser.Kind;
import io.waypoint.util.PathTrieParser.PartialComponent;
import io.waypoint.util.PathTrieParser.PathComponent;
import io.waypoint.util.PathTrieParser.RoutePattern;
import org.junit.Assert;
import org.junit.Test;
import org.junit.experimental.categories.Category;

@Category(UnitTest.class)
public class PathTrieParserTestCase {

    private static PathComponent component(final String segment) {
        final RoutePattern pattern = PathTrieParser.parsePattern("/test/" + segment);
        Assert.assertEquals(2, pattern.getComponents().size());
        return pattern.getComponents().get(1);
    }

    private static void assertPartial(
            final String segment,
            final Kind kind,
            final String prefix,
            final String name,
            final String suffix
    ) {
        final PathComponent component = component(segment);
        Assert.assertEquals(kind, component.getKind());
        Assert.assertEquals(prefix, ((PartialComponent) component).getPrefix());
        Assert.assertEquals(suffix, ((PartialComponent) component).getSuffix());
        Assert.assertEquals(name, component.getParameterName());
    }

    @SuppressWarnings("ThrowableResultIgnored")
    private static void assertInvalidPattern(final String pattern) {
        Assert.assertThrows(InvalidRoutePatternException.class, () -> PathTrieParser.parsePattern(pattern));
    }

    @Test
    public void testComponentKinds() {
        Assert.assertEquals(Kind.LITERAL, component("books").getKind());
        Assert.assertEquals("books", ((PathTrieParser.Literal) component("books")).getText());

        Assert.assertEquals(Kind.PARAMETER, component(":param").getKind());
        Assert.assertEquals("param", component(":param").getParameterName());
        Assert.assertEquals(Kind.PARAMETER, component("{param}").getKind());
        Assert.assertEquals("param", component("{param}").getParameterName());

        Assert.assertEquals(Kind.WILDCARD, component("*").getKind());
        Assert.assertEquals(Kind.WILDCARD, component("{}").getKind());
        Assert.assertNull(component("*").getParameterName());

        Assert.assertEquals(Kind.CATCH_ALL, component("**").getKind());
    }

    @Test
    public void testPartialComponents() {
        assertPartial("*.jpg", Kind.PARTIAL_WILDCARD, "", null, ".jpg");
        assertPartial("test.*", Kind.PARTIAL_WILDCARD, "test.", null, "");
        assertPartial("v{}-beta", Kind.PARTIAL_WILDCARD, "v", null, "-beta");
        assertPartial("{image}.jpg", Kind.PARTIAL_CAPTURE, "", "image", ".jpg");
        assertPartial("test.{ext}", Kind.PARTIAL_CAPTURE, "test.", "ext", "");
        assertPartial("v{version}-beta", Kind.PARTIAL_CAPTURE, "v", "version", "-beta");
    }

    @Test
    public void testUnbalancedBracesAreLiterals() {
        Assert.assertEquals(Kind.LITERAL, component("text}").getKind());
        Assert.assertEquals(Kind.LITERAL, component("{text").getKind());
        Assert.assertEquals(Kind.LITERAL, component("}text{").getKind());
        Assert.assertEquals("text}", ((PathTrieParser.Literal) component("text}")).getText());
    }

    @Test
    public void testEmbeddedStarsAreLiterals() {
        Assert.assertEquals(Kind.LITERAL, component("a*b").getKind());
        Assert.assertEquals(Kind.LITERAL, component("*a*").getKind());
        Assert.assertEquals(Kind.LITERAL, component("***").getKind());
    }

    @Test
    public void testPatternSegmentation() {
        Assert.assertTrue(PathTrieParser.parsePattern("").getComponents().isEmpty());
        Assert.assertTrue(PathTrieParser.parsePattern("/").getComponents().isEmpty());
        Assert.assertTrue(PathTrieParser.parsePattern("").isLiteral());

        final RoutePattern pattern = PathTrieParser.parsePattern("//users//:id/files/**");
        Assert.assertEquals("//users//:id/files/**", pattern.getPattern());
        Assert.assertEquals(4, pattern.getComponents().size());
        Assert.assertFalse(pattern.isLiteral());
        Assert.assertTrue(pattern.endsWithCatchAll());

        Assert.assertTrue(PathTrieParser.parsePattern("/usr/local/bin").isLiteral());
        Assert.assertEquals(3, PathTrieParser.parsePattern("a.b.:c", '.').getComponents().size());
    }

    @Test
    public void testInvalidPatterns() {
        assertInvalidPattern("**/a");
        assertInvalidPattern("/files/**/*.jpg");
        assertInvalidPattern("/{name}.{ext}");
        assertInvalidPattern("/{a{b}}");
        assertInvalidPattern("/*.{ext}");
        assertInvalidPattern("/{name}.*");
        assertInvalidPattern("/users/:");
        assertInvalidPattern(null);
    }

    @Test
    public void testPartialMatching() {
        final PartialComponent jpg = (PartialComponent) component("{file}.jpg");
        Assert.assertTrue(jpg.matches(segment("hello.jpg"), false));
        Assert.assertFalse(jpg.matches(segment(".jpg"), false));
        Assert.assertFalse(jpg.matches(segment("hello.png"), false));
        Assert.assertFalse(jpg.matches(segment("hello.JPG"), false));
        Assert.assertTrue(jpg.matches(segment("hello.JPG"), true));

        //Prefix and suffix may not overlap
        final PartialComponent aba = (PartialComponent) component("ab{x}ba");
        Assert.assertFalse(aba.matches(segment("aba"), false));
        Assert.assertFalse(aba.matches(segment("abba"), false));
        Assert.assertTrue(aba.matches(segment("abcba"), false));
    }

    private static PathSegment segment(final String value) {
        return new PathSegment(value, 0, value.length());
    }
}
