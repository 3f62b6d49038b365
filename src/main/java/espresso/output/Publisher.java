// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package espresso.output;

import java.util.List;
import espresso.site.Site;
import espresso.util.Trace;

/**
 * Delivers a finished site model to output plugins.
 */
public final class Publisher {
    private Publisher() {
    }

    /**
     * Delivers every visible article page of the site to every plugin, in the site's canonical route order, then
     * lets every plugin finish.
     * <p>
     * Index pages are not article pages and are not delivered. Hidden articles are never delivered.
     */
    public static void publish(
        final Site site,
        final List<? extends OutputPlugin> plugins,
        final OutputContext context
    ) {
        try (final var trace = new Trace("Publishing the site model to output plugins")) {
            trace.use();
            for (final var page : site.pages()) {
                if (!page.article().isVisible()) {
                    continue;
                }
                for (final var plugin : plugins) {
                    try (
                        final var innerTrace = new Trace(() -> "Delivering " + page.fullPath() + " to " + plugin.name())
                    ) {
                        innerTrace.use();
                        plugin.onPage(page, context);
                    }
                }
            }
            for (final var plugin : plugins) {
                try (final var innerTrace = new Trace(() -> "Finishing output plugin " + plugin.name())) {
                    innerTrace.use();
                    plugin.finish(context);
                }
            }
        }
    }
}
