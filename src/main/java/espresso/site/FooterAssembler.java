// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package espresso.site;

import java.util.ArrayList;
import espresso.config.Settings;

final class FooterAssembler {
    private FooterAssembler() {
    }

    static Footer assemble(final Settings settings) {
        final var items = new ArrayList<FooterItem>();
        for (final var item : settings.footer().items()) {
            items.add(new FooterItem(item.label(), item.target()));
        }
        return new Footer(settings.footer().text(), items);
    }
}
