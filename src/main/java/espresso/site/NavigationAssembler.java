// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package espresso.site;

import java.util.ArrayList;
import espresso.config.Settings;
import espresso.util.Trace;

final class NavigationAssembler {
    private NavigationAssembler() {
    }

    /**
     * Builds the navigation: the configured items, followed by one item per top-level route unless the configuration
     * overrides them.
     */
    static Nav assemble(final Settings settings, final Route root) {
        try (final var trace = new Trace("Assembling the navigation")) {
            trace.use();
            final var items = new ArrayList<NavItem>();
            for (final var item : settings.nav().items()) {
                items.add(new NavItem(item.label(), item.target()));
            }
            if (!settings.nav().override()) {
                RouteWalker.walk(root, 1, route -> items.add(new NavItem(titleCase(route.key()), route.key())));
            }
            return new Nav(settings.title(), items);
        }
    }

    /**
     * Upper-cases the first letter of every word, words being separated by anything but letters, digits and
     * underscores: {@code coffee-beans} becomes {@code Coffee-Beans}.
     */
    static String titleCase(final String string) {
        final var builder = new StringBuilder(string.length());
        var atWordStart = true;
        for (var i = 0; i < string.length(); ) {
            final var codePoint = string.codePointAt(i);
            builder.appendCodePoint(atWordStart ? Character.toTitleCase(codePoint) : codePoint);
            atWordStart = !Character.isLetterOrDigit(codePoint) && codePoint != '_';
            i += Character.charCount(codePoint);
        }
        return builder.toString();
    }
}
