// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package espresso.site;

import java.util.List;
import espresso.util.condition.ConditionContext;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The hierarchy of routes of a site, rooted at the route with the empty path.
 * <p>
 * Not thread-safe. During a build, {@link SiteBuilder} owns the tree and serializes every mutation.
 */
public final class RouteTree {
    RouteTree() {
    }

    public Route root() {
        return root;
    }

    /**
     * Resolves the given path to its route.
     * <p>
     * Signals a fatal {@link RouteNotFoundCondition} if any segment of the path has no route.
     */
    public Route lookup(final String path) {
        var node = root;
        for (final var segment : segments(path)) {
            final var child = node.child(segment);
            if (child == null) {
                throw ConditionContext.error(new RouteNotFoundCondition(path, segment));
            }
            node = child;
        }
        return node;
    }

    /**
     * Resolves the given path to its route, returning {@code null} if there is no such route.
     */
    public @Nullable Route find(final String path) {
        var node = root;
        for (final var segment : segments(path)) {
            final var child = node.child(segment);
            if (child == null) {
                return null;
            }
            node = child;
        }
        return node;
    }

    /**
     * Appends the given page to the route of its path, creating the missing routes along the way.
     * <p>
     * Signals a fatal {@link MalformedRoutePathCondition} if the path has an empty segment. The tree is left unchanged
     * then.
     */
    void insert(final Page page) {
        routeFor(page.routePath()).addPage(page);
    }

    /**
     * Makes the given page the index page of the route of its path, creating the missing routes along the way.
     * <p>
     * Signals a fatal {@link MalformedRoutePathCondition} if the path has an empty segment, or a fatal
     * {@link DuplicateIndexPageCondition} if the route already has an index page.
     */
    void insertIndex(final IndexPage page) {
        final var route = routeFor(page.routePath());
        if (route.indexPage() != null) {
            throw ConditionContext.error(new DuplicateIndexPageCondition(page.routePath()));
        }
        route.setIndexPage(page);
    }

    private Route routeFor(final String path) {
        final var segments = segments(path);
        if (segments.contains("")) {
            throw ConditionContext.error(new MalformedRoutePathCondition(path));
        }
        var node = root;
        for (final var segment : segments) {
            node = node.childOrCreate(segment);
        }
        return node;
    }

    /**
     * Splits a route path into its segments. The empty path, denoting the root, has none; any other path keeps its
     * empty segments, which match no route.
     */
    static List<String> segments(final String path) {
        if (path.isEmpty()) {
            return List.of();
        }
        return List.of(path.split("/", -1));
    }

    private final Route root = new Route("", "");
}
