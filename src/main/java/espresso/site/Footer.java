// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package espresso.site;

import java.util.List;

public record Footer(String text, List<FooterItem> items) {
    public Footer {
        items = List.copyOf(items);
    }
}
