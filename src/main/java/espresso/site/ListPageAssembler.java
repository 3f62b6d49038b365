// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package espresso.site;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import espresso.util.Trace;

/**
 * Derives the list page of every route that has no index page.
 */
final class ListPageAssembler {
    private ListPageAssembler() {
    }

    static void assemble(final Route root, final boolean sortPages) {
        try (final var trace = new Trace("Assembling list pages")) {
            trace.use();
            RouteWalker.walkAll(root, route -> {
                if (route.indexPage() == null) {
                    route.setListPage(new ListPage(route.path(), visiblePages(route.pages(), sortPages)));
                }
            });
        }
    }

    /**
     * Returns the visible pages among the given ones, newest first if {@code sortPages} is set.
     * <p>
     * The sort is stable: pages with the same date stay in their original relative order.
     */
    static List<Page> visiblePages(final List<Page> pages, final boolean sortPages) {
        final var visible = new ArrayList<Page>(pages.size());
        for (final var page : pages) {
            if (page.article().isVisible()) {
                visible.add(page);
            }
        }
        if (sortPages) {
            visible.sort(newestFirst);
        }
        return visible;
    }

    private static final Comparator<Page> newestFirst =
        Comparator.comparing((final Page page) -> page.article().date()).reversed();
}
