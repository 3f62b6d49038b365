// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package espresso.config;

/**
 * A configured link, as used by the navigation and the footer.
 *
 * @param label  The text shown for the link.
 * @param target The route or URL the link points to.
 */
public record LinkSetting(String label, String target) {
}
