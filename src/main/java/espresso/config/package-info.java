// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Site settings and build options, as handed over by whatever loads the configuration.
 */
@NonNullByDefault
package espresso.config;

import espresso.util.annotation.NonNullByDefault;
