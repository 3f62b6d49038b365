// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package espresso.config;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The user-facing site settings the site model depends on.
 * <p>
 * Absent sections are treated as empty, never as errors.
 *
 * @param title  The site title, used as the navigation brand.
 * @param nav    The navigation settings.
 * @param footer The footer settings.
 */
public record Settings(String title, NavSettings nav, FooterSettings footer) {
    public Settings(
        final @Nullable String title,
        final @Nullable NavSettings nav,
        final @Nullable FooterSettings footer
    ) {
        this.title = (title == null) ? "" : title;
        this.nav = (nav == null) ? NavSettings.empty() : nav;
        this.footer = (footer == null) ? FooterSettings.empty() : footer;
    }

    /**
     * Returns settings with the given title and no navigation or footer configuration.
     */
    public static Settings titled(final String title) {
        return new Settings(title, null, null);
    }
}
