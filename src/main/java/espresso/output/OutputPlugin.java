// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package espresso.output;

import espresso.site.Page;

/**
 * A consumer of the finished site model, such as a feed generator.
 * <p>
 * Plugins report failures by signaling conditions, like the rest of the build.
 */
public interface OutputPlugin {
    /**
     * Retrieves the user-readable name of the plugin, used in traces.
     */
    default String name() {
        return getClass().getSimpleName();
    }

    /**
     * Processes a visible article page. Called once per page, before {@link #finish(OutputContext)}.
     */
    void onPage(Page page, OutputContext context);

    /**
     * Flushes whatever the plugin accumulated. Called once, after every page has been delivered.
     */
    void finish(OutputContext context);
}
