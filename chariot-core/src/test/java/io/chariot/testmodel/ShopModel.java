package io.chariot.testmodel;

import io.chariot.core.ChariotConfiguration;
import io.chariot.session.Chariot;

/**
 * Entry points for tests using the shop model.
 */
public final class ShopModel {

    public static final Class<?>[] ENTITIES = { Shop.class, Member.class, Product.class, Purchase.class };

    private ShopModel() {
    }

    public static Chariot open() {
        return open(ChariotConfiguration.defaults());
    }

    public static Chariot open(ChariotConfiguration configuration) {
        return Chariot.open(configuration, ENTITIES);
    }
}
