// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Handing a finished site model over to output plugins, such as feed generators.
 */
@NonNullByDefault
package espresso.output;

import espresso.util.annotation.NonNullByDefault;
