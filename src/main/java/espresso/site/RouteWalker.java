// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package espresso.site;

import java.util.function.Consumer;

/**
 * Depth-bounded traversal over the route tree.
 * <p>
 * Walks are read-only, and must not overlap with content registration.
 */
public final class RouteWalker {
    private RouteWalker() {
    }

    /**
     * Invokes {@code function} on every route below {@code root}, excluding {@code root} itself.
     * <p>
     * Routes are visited in pre-order, children in ascending key order. Descent stops once {@code depth} levels have
     * been visited: a depth of 1 visits exactly the children of {@code root}. A depth of {@link #unbounded} visits the
     * whole subtree.
     */
    public static void walk(final Route root, final int depth, final Consumer<? super Route> function) {
        if (depth < unbounded) {
            throw new IllegalArgumentException("Invalid walk depth " + depth);
        }
        walkChildren(root, depth, 0, function);
    }

    /**
     * Invokes {@code function} on {@code root}, then on every route below it as {@link #walk} with unbounded depth.
     */
    public static void walkAll(final Route root, final Consumer<? super Route> function) {
        function.accept(root);
        walkChildren(root, unbounded, 0, function);
    }

    private static void walkChildren(
        final Route route,
        final int depth,
        final int currentDepth,
        final Consumer<? super Route> function
    ) {
        if (depth != unbounded && currentDepth == depth) {
            return;
        }
        for (final var child : route.children()) {
            function.accept(child);
            walkChildren(child, depth, currentDepth + 1, function);
        }
    }

    /**
     * The depth that walks the whole subtree.
     */
    public static final int unbounded = -1;
}
