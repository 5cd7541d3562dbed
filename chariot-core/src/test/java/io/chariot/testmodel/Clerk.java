package io.chariot.testmodel;

import io.chariot.query.Relationship;
import jakarta.persistence.DiscriminatorValue;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

@DiscriminatorValue("clerk")
@Table(name = "clerk")
public record Clerk(Long id,
                    String nickname,
                    @ManyToOne(targetEntity = Shop.class) @JoinColumn(name = "shop_id") Long shopId) implements Member {

    public static final Relationship<Clerk, Shop> SHOP = Relationship.toOne(Clerk.class, "shopId", Shop.class);
    public static final Relationship<Clerk, Purchase> PURCHASES =
            Relationship.inverse(Clerk.class, "purchases", Purchase.CLERK);
}
