package com.pixelservices.invoke.components.http.routing.trie;

import com.pixelservices.invoke.components.http.HttpMethod;
import com.pixelservices.invoke.components.http.routing.RoutePrecedence;
import com.pixelservices.invoke.components.http.routing.models.RouteEntry;
import com.pixelservices.invoke.components.http.routing.models.RouteMatch;
import com.pixelservices.invoke.exceptions.DuplicateRouteException;
import org.junit.Test;

import static org.junit.Assert.*;

public class RouteTrieTest {

    private static RouteEntry entry(HttpMethod method, String path) {
        return new RouteEntry(method, path, ctx -> { }, null);
    }

    @Test
    public void testSharedPrefixReusesNodes() {
        RouteTrie trie = new RouteTrie(false, RoutePrecedence.SPECIFICITY);
        trie.insert(entry(HttpMethod.GET, "/api/users"));
        trie.insert(entry(HttpMethod.GET, "/api/orders"));

        assertEquals(1, trie.getRoot().getChildren().size());
        TrieNode api = trie.getRoot().getChildren().get(0);
        assertEquals(2, api.getChildren().size());
        assertEquals(1, api.getLevel());
        assertEquals("/api/users", api.getChildren().get(0).getFullPath());
        assertEquals(2, trie.size());
    }

    @Test
    public void testMethodsBranchAtEveryDepth() {
        RouteTrie trie = new RouteTrie(false, RoutePrecedence.SPECIFICITY);
        trie.insert(entry(HttpMethod.GET, "/items"));
        trie.insert(entry(HttpMethod.POST, "/items"));

        assertEquals(2, trie.getRoot().getChildren().size());
        assertEquals(HttpMethod.GET, trie.search(HttpMethod.GET, "/items").entry().getMethod());
        assertEquals(HttpMethod.POST, trie.search(HttpMethod.POST, "/items").entry().getMethod());
        assertEquals(RouteMatch.Outcome.NOT_FOUND, trie.search(HttpMethod.PUT, "/items").outcome());
    }

    @Test(expected = DuplicateRouteException.class)
    public void testDuplicateRegistrationFails() {
        RouteTrie trie = new RouteTrie(false, RoutePrecedence.SPECIFICITY);
        trie.insert(entry(HttpMethod.GET, "/user/:name"));
        trie.insert(entry(HttpMethod.GET, "/user/:name"));
    }

    @Test
    public void testParamBinding() {
        RouteTrie trie = new RouteTrie(false, RoutePrecedence.SPECIFICITY);
        trie.insert(entry(HttpMethod.GET, "/user/:name"));

        RouteMatch match = trie.search(HttpMethod.GET, "/user/alice");
        assertTrue(match.isMatched());
        assertEquals("alice", match.params().get("name"));
    }

    @Test
    public void testRegexIsAnchoredToWholeSegment() {
        RouteTrie trie = new RouteTrie(false, RoutePrecedence.SPECIFICITY);
        trie.insert(entry(HttpMethod.POST, "/product/{id:[0-9]+}"));

        RouteMatch match = trie.search(HttpMethod.POST, "/product/123");
        assertTrue(match.isMatched());
        assertEquals("123", match.params().get("id"));

        assertEquals(RouteMatch.Outcome.NOT_FOUND, trie.search(HttpMethod.POST, "/product/abc").outcome());
        assertEquals(RouteMatch.Outcome.NOT_FOUND, trie.search(HttpMethod.POST, "/product/12a").outcome());
    }

    @Test
    public void testIntermediateNodeWithoutHandler() {
        RouteTrie trie = new RouteTrie(false, RoutePrecedence.SPECIFICITY);
        trie.insert(entry(HttpMethod.GET, "/a/b"));

        assertEquals(RouteMatch.Outcome.NO_HANDLER, trie.search(HttpMethod.GET, "/a").outcome());
        assertEquals(RouteMatch.Outcome.NOT_FOUND, trie.search(HttpMethod.GET, "/a/b/c").outcome());
    }

    @Test
    public void testParamRejectsEmptySegment() {
        RouteTrie trie = new RouteTrie(false, RoutePrecedence.SPECIFICITY);
        trie.insert(entry(HttpMethod.GET, "/a/:x/b"));

        assertEquals(RouteMatch.Outcome.NOT_FOUND, trie.search(HttpMethod.GET, "/a//b").outcome());
    }

    @Test
    public void testRootRoute() {
        RouteTrie trie = new RouteTrie(false, RoutePrecedence.SPECIFICITY);
        trie.insert(entry(HttpMethod.GET, "/"));

        assertTrue(trie.search(HttpMethod.GET, "/").isMatched());
    }

    @Test
    public void testCaseInsensitiveMatchingKeepsParamCase() {
        RouteTrie trie = new RouteTrie(false, RoutePrecedence.SPECIFICITY);
        trie.insert(entry(HttpMethod.GET, "/Users/:name"));

        RouteMatch match = trie.search(HttpMethod.GET, "/USERS/Alice");
        assertTrue(match.isMatched());
        assertEquals("Alice", match.params().get("name"));
    }

    @Test
    public void testCaseSensitiveMatching() {
        RouteTrie trie = new RouteTrie(true, RoutePrecedence.SPECIFICITY);
        trie.insert(entry(HttpMethod.GET, "/Users"));

        assertTrue(trie.search(HttpMethod.GET, "/Users").isMatched());
        assertFalse(trie.search(HttpMethod.GET, "/users").isMatched());
    }

    @Test
    public void testSpecificityPrefersStaticOverEarlierParam() {
        RouteTrie trie = new RouteTrie(false, RoutePrecedence.SPECIFICITY);
        RouteEntry param = entry(HttpMethod.GET, "/user/:name");
        RouteEntry regex = entry(HttpMethod.GET, "/user/{id:[0-9]+}");
        RouteEntry literal = entry(HttpMethod.GET, "/user/me");
        trie.insert(param);
        trie.insert(regex);
        trie.insert(literal);

        assertSame(literal, trie.search(HttpMethod.GET, "/user/me").entry());
        assertSame(regex, trie.search(HttpMethod.GET, "/user/42").entry());
        assertSame(param, trie.search(HttpMethod.GET, "/user/bob").entry());
    }

    @Test
    public void testRegistrationOrderLetsEarlierParamShadowStatic() {
        RouteTrie trie = new RouteTrie(false, RoutePrecedence.REGISTRATION_ORDER);
        RouteEntry param = entry(HttpMethod.GET, "/user/:name");
        RouteEntry literal = entry(HttpMethod.GET, "/user/me");
        trie.insert(param);
        trie.insert(literal);

        RouteMatch match = trie.search(HttpMethod.GET, "/user/me");
        assertSame(param, match.entry());
        assertEquals("me", match.params().get("name"));
    }

    @Test
    public void testRegistrationOrderDoesNotBacktrack() {
        RouteTrie trie = new RouteTrie(false, RoutePrecedence.REGISTRATION_ORDER);
        trie.insert(entry(HttpMethod.GET, "/files/:name/raw"));
        trie.insert(entry(HttpMethod.GET, "/files/latest/meta"));

        assertEquals(RouteMatch.Outcome.NOT_FOUND, trie.search(HttpMethod.GET, "/files/latest/meta").outcome());
    }

    @Test
    public void testSpecificityBacktracksOutOfDeadEnds() {
        RouteTrie trie = new RouteTrie(false, RoutePrecedence.SPECIFICITY);
        RouteEntry raw = entry(HttpMethod.GET, "/files/:name/raw");
        trie.insert(raw);
        trie.insert(entry(HttpMethod.GET, "/files/latest/meta"));

        RouteMatch match = trie.search(HttpMethod.GET, "/files/latest/raw");
        assertSame(raw, match.entry());
        assertEquals("latest", match.params().get("name"));
    }

    @Test
    public void testFailedBranchLeavesNoParams() {
        RouteTrie trie = new RouteTrie(false, RoutePrecedence.SPECIFICITY);
        trie.insert(entry(HttpMethod.GET, "/a/:x/b"));
        trie.insert(entry(HttpMethod.GET, "/a/:z/c"));

        RouteMatch match = trie.search(HttpMethod.GET, "/a/q/c");
        assertTrue(match.isMatched());
        assertEquals(1, match.params().size());
        assertEquals("q", match.params().get("z"));
    }

    @Test
    public void testEntriesListsEveryRoute() {
        RouteTrie trie = new RouteTrie(false, RoutePrecedence.SPECIFICITY);
        trie.insert(entry(HttpMethod.GET, "/a"));
        trie.insert(entry(HttpMethod.GET, "/a/b"));
        trie.insert(entry(HttpMethod.DELETE, "/c"));

        assertEquals(3, trie.entries().size());
        assertEquals("/a", trie.entries().get(0).getPath());
    }
}
