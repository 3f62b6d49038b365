// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package espresso.site;

import espresso.article.RelatedLink;

/**
 * The outcome of resolving a {@link RelatedLink} against the route tree.
 */
public sealed interface Resolution {
    /**
     * The link points to a registered page.
     */
    record Found(Page page) implements Resolution {
    }

    /**
     * The link points nowhere.
     */
    record Missing(RelatedLink link, Reason reason) implements Resolution {
    }

    enum Reason {
        /**
         * No route has the link's route path.
         */
        UNKNOWN_ROUTE,
        /**
         * The route exists, but none of its pages has the link's article identifier.
         */
        UNKNOWN_ARTICLE,
    }
}
