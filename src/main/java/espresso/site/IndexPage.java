// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package espresso.site;

import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The user-supplied landing page of a route, from a content file named {@code index}.
 * <p>
 * Besides its own article, an index page aggregates every visible page of the whole site, not just of its subtree.
 */
public final class IndexPage {
    public IndexPage(final String routePath, final Article article) {
        this.routePath = routePath;
        this.article = article;
    }

    public String routePath() {
        return routePath;
    }

    public Article article() {
        return article;
    }

    /**
     * Retrieves the visible pages of the whole site.
     * <p>
     * Empty until the index aggregation pass has run. Index pages of the same site share the same read-only list.
     */
    public List<Page> articlePages() {
        final var pages = articlePages;
        return (pages == null) ? List.of() : pages;
    }

    void attachArticlePages(final List<Page> pages) {
        assert articlePages == null : "Index page of route \"" + routePath + "\" aggregated twice";
        articlePages = pages;
    }

    @Override
    public String toString() {
        return "IndexPage[" + routePath + ']';
    }

    private final String routePath;
    private final Article article;
    private @Nullable List<Page> articlePages = null;
}
