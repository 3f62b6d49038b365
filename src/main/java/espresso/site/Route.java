// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package espresso.site;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.TreeMap;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A node of the route tree. For example, the route {@code blog/coffee} is the child {@code coffee} of the child
 * {@code blog} of the root route.
 * <p>
 * Routes are only mutated by {@link SiteBuilder}, which serializes all mutation; reading a route while content is
 * still being registered is not supported.
 */
public final class Route {
    Route(final String key, final String path) {
        this.key = key;
        this.path = path;
    }

    /**
     * Retrieves the segment this route is keyed by in its parent, {@code ""} for the root.
     */
    public String key() {
        return key;
    }

    /**
     * Retrieves the full path of this route: the keys of its ancestors and its own, joined by slashes.
     */
    public String path() {
        return path;
    }

    public boolean isRoot() {
        return path.isEmpty();
    }

    /**
     * Retrieves the pages registered directly under this route, in registration order.
     */
    public List<Page> pages() {
        return Collections.unmodifiableList(pages);
    }

    /**
     * Retrieves the child routes, ordered by key.
     */
    public Collection<Route> children() {
        return Collections.unmodifiableCollection(children.values());
    }

    public @Nullable Route child(final String key) {
        return children.get(key);
    }

    public @Nullable IndexPage indexPage() {
        return indexPage;
    }

    /**
     * Retrieves the derived list page. Always {@code null} for a route with an index page.
     */
    public @Nullable ListPage listPage() {
        return listPage;
    }

    /**
     * Returns the first page under this route whose article has the given identifier, or {@code null}.
     */
    public @Nullable Page findPage(final String articleId) {
        for (final var page : pages) {
            if (page.id().equals(articleId)) {
                return page;
            }
        }
        return null;
    }

    Route childOrCreate(final String segment) {
        return children.computeIfAbsent(segment, s -> new Route(s, path.isEmpty() ? s : path + '/' + s));
    }

    void addPage(final Page page) {
        assert page.routePath().equals(path) : "Page of route \"" + page.routePath() + "\" added to \"" + path + '"';
        pages.add(page);
    }

    void setIndexPage(final IndexPage page) {
        assert page.routePath().equals(path) : "Index page of \"" + page.routePath() + "\" set on \"" + path + '"';
        indexPage = page;
    }

    void setListPage(final ListPage page) {
        assert indexPage == null : "List page derived for route \"" + path + "\", which has an index page";
        listPage = page;
    }

    @Override
    public String toString() {
        return "Route[" + (path.isEmpty() ? "<root>" : path) + ']';
    }

    private final String key;
    private final String path;
    private final ArrayList<Page> pages = new ArrayList<>();
    private final TreeMap<String, Route> children = new TreeMap<>();
    private @Nullable IndexPage indexPage = null;
    private @Nullable ListPage listPage = null;
}
