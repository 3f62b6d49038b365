// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package espresso.site;

import java.util.List;

/**
 * The overview page of a route that has no user-supplied index page.
 *
 * @param routePath The path of the route.
 * @param pages     The visible pages registered directly under the route.
 */
public record ListPage(String routePath, List<Page> pages) {
    public ListPage {
        pages = List.copyOf(pages);
    }
}
