// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package espresso.config;

import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Footer settings.
 *
 * @param text  The footer text, such as a copyright line.
 * @param items The links shown in the footer.
 */
public record FooterSettings(String text, List<LinkSetting> items) {
    public FooterSettings(final @Nullable String text, final @Nullable List<LinkSetting> items) {
        this.text = (text == null) ? "" : text;
        this.items = (items == null) ? List.of() : List.copyOf(items);
    }

    public static FooterSettings empty() {
        return empty;
    }

    private static final FooterSettings empty = new FooterSettings("", List.of());
}
