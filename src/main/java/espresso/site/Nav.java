// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package espresso.site;

import java.util.List;

/**
 * The site navigation.
 *
 * @param brand The brand shown in the navigation, the site title.
 * @param items The navigation items, configured ones first.
 */
public record Nav(String brand, List<NavItem> items) {
    public Nav {
        items = List.copyOf(items);
    }
}
