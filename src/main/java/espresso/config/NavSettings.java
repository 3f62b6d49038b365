// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package espresso.config;

import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Navigation settings.
 *
 * @param items    The configured navigation items, shown first.
 * @param override If {@code true}, only the configured items are shown; otherwise one item per top-level route
 *                 follows them.
 */
public record NavSettings(List<LinkSetting> items, boolean override) {
    public NavSettings(final @Nullable List<LinkSetting> items, final boolean override) {
        this.items = (items == null) ? List.of() : List.copyOf(items);
        this.override = override;
    }

    public static NavSettings empty() {
        return empty;
    }

    private static final NavSettings empty = new NavSettings(List.of(), false);
}
