// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package espresso.site;

/**
 * An article bound to the route it is published under.
 *
 * @param routePath The path of the route, {@code ""} for the root route.
 * @param article   The article.
 */
public record Page(String routePath, Article article) {
    /**
     * Retrieves the identifier of the page's article.
     */
    public String id() {
        return article.id();
    }

    /**
     * Retrieves the site-relative path of the page, such as {@code blog/coffee/roasting-basics}.
     */
    public String fullPath() {
        return routePath.isEmpty() ? article.id() : routePath + '/' + article.id();
    }
}
