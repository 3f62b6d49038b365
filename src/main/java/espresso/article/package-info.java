// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The boundary to the content parser: what a parsed content unit looks like before it gets an identity in the site.
 */
@NonNullByDefault
package espresso.article;

import espresso.util.annotation.NonNullByDefault;
