// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package espresso.site;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import espresso.util.Trace;

/**
 * Attaches the visible pages of the whole site to every index page.
 * <p>
 * The pages are collected in a single walk, in canonical order: the root first, then pre-order with children by key,
 * registration order within a route. All index pages share the resulting read-only list.
 */
final class IndexPageAggregator {
    private IndexPageAggregator() {
    }

    static void aggregate(final Route root, final boolean sortPages) {
        try (final var trace = new Trace("Aggregating pages into index pages")) {
            trace.use();
            final var indexPages = new ArrayList<IndexPage>();
            final var pages = new ArrayList<Page>();
            RouteWalker.walkAll(root, route -> {
                pages.addAll(route.pages());
                final var indexPage = route.indexPage();
                if (indexPage != null) {
                    indexPages.add(indexPage);
                }
            });
            if (indexPages.isEmpty()) {
                return;
            }
            final var shared = Collections.unmodifiableList(ListPageAssembler.visiblePages(pages, sortPages));
            for (final var indexPage : indexPages) {
                indexPage.attachArticlePages(shared);
            }
        }
    }
}
