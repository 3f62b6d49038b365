// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The site model: the route tree, its construction by {@link espresso.site.SiteBuilder}, and the passes deriving
 * list pages, index pages, navigation, footer and related-article links from it.
 */
@NonNullByDefault
package espresso.site;

import espresso.util.annotation.NonNullByDefault;
