// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Miscellaneous utilities: operation traces and concurrent helpers.
 */
@NonNullByDefault
package espresso.util;

import espresso.util.annotation.NonNullByDefault;
