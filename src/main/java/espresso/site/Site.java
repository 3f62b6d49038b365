// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package espresso.site;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * A finished site model, as returned by {@link SiteBuilder#finish()}. Read-only from then on.
 */
public final class Site {
    Site(final RouteTree tree, final Nav nav, final Footer footer) {
        this.tree = tree;
        this.nav = nav;
        this.footer = footer;
    }

    public RouteTree tree() {
        return tree;
    }

    public Route root() {
        return tree.root();
    }

    public Nav nav() {
        return nav;
    }

    public Footer footer() {
        return footer;
    }

    /**
     * Invokes {@code function} on every route of the site, the root first, then in pre-order with children by key.
     */
    public void forEachRoute(final Consumer<? super Route> function) {
        RouteWalker.walkAll(tree.root(), function);
    }

    /**
     * Returns every registered page, hidden ones included, in the order of {@link #forEachRoute(Consumer)} and
     * registration order within a route.
     */
    public List<Page> pages() {
        final var pages = new ArrayList<Page>();
        forEachRoute(route -> pages.addAll(route.pages()));
        return pages;
    }

    private final RouteTree tree;
    private final Nav nav;
    private final Footer footer;
}
