package io.chariot.testmodel;

import io.chariot.query.Attribute;
import io.chariot.query.Relationship;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

@Entity
@Table(name = "product")
public record Product(@Id @GeneratedValue Long id,
                      @Column(nullable = false) String name,
                      Integer price,
                      @ManyToOne(targetEntity = Shop.class) @JoinColumn(name = "shop_id", nullable = false) Long shopId) {

    public static final Attribute<Product, String> NAME = Attribute.of(Product.class, "name", String.class);
    public static final Attribute<Product, Integer> PRICE = Attribute.of(Product.class, "price", Integer.class);
    public static final Relationship<Product, Shop> SHOP = Relationship.toOne(Product.class, "shopId", Shop.class);
    public static final Relationship<Product, Purchase> PURCHASES =
            Relationship.inverse(Product.class, "purchases", Purchase.PRODUCTS);

    public static Product of(String name, Integer price, Shop shop) {
        return new Product(null, name, price, shop.id());
    }
}
