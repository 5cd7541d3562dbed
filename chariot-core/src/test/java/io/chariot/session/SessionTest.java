package io.chariot.session;

import io.chariot.core.ChariotConfiguration;
import io.chariot.core.ChariotException;
import io.chariot.core.ConstraintViolationException;
import io.chariot.core.ConstraintViolationException.Constraint;
import io.chariot.logging.CapturedLogs;
import io.chariot.testmodel.Bakery;
import io.chariot.testmodel.Buyer;
import io.chariot.testmodel.Clerk;
import io.chariot.testmodel.Kiosk;
import io.chariot.testmodel.Member;
import io.chariot.testmodel.Product;
import io.chariot.testmodel.Purchase;
import io.chariot.testmodel.Shop;
import io.chariot.testmodel.ShopModel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionTest {

    private Chariot chariot;
    private Session session;

    @BeforeEach
    void setUp() {
        chariot = ShopModel.open();
        session = chariot.openSession();
    }

    @AfterEach
    void tearDown() {
        session.close();
        chariot.close();
    }

    @Test
    @DisplayName("Should assign generated ids per family")
    void shouldAssignIds() {
        Shop kiosk = session.add(new Kiosk(null, "Corner"));
        Shop bakery = session.add(new Bakery(null, "Crust", "stone"));
        Member clerk = session.add(new Clerk(null, "danny", null));

        assertThat(kiosk.id()).isEqualTo(1L);
        assertThat(bakery.id()).isEqualTo(2L);
        assertThat(clerk.id()).isEqualTo(1L);
        assertThat(bakery).isEqualTo(new Bakery(2L, "Crust", "stone"));
    }

    @Test
    @DisplayName("Should store base, specialization and junction rows on commit")
    void shouldWriteAllRowsOnCommit() {
        Shop shop = session.add(new Bakery(null, "Crust", "stone"));
        Product bread = session.add(Product.of("Bread", 250, shop));
        Product roll = session.add(Product.of("Roll", 90, shop));
        Clerk clerk = session.add(new Clerk(null, "danny", shop.id()));
        Buyer buyer = session.add(new Buyer(null, "frenchy"));
        session.add(new Purchase(null, clerk.id(), buyer.id(), List.of(bread.id(), roll.id())));

        assertThat(chariot.store().table("shop").rowCount()).isZero();

        session.commit();

        assertThat(chariot.store().table("shop").row(0)).containsExactly(1L, "bakery", "Crust");
        assertThat(chariot.store().table("bakery").row(0)).containsExactly(1L, "stone");
        assertThat(chariot.store().table("member").rowCount()).isEqualTo(2);
        assertThat(chariot.store().table("clerk").row(0)).containsExactly(1L, 1L);
        assertThat(chariot.store().table("buyer").row(0)).containsExactly(2L);
        assertThat(chariot.store().table("purchase_products").rowCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should return the identical instance for a row within a session")
    void shouldKeepIdentity() {
        Shop shop = session.add(new Kiosk(null, "Corner"));
        session.commit();

        assertThat(session.get(Shop.class, shop.id())).get().isSameAs(shop);

        try (Session other = chariot.openSession()) {
            Shop loaded = other.get(Shop.class, shop.id()).orElseThrow();
            assertThat(loaded).isNotSameAs(shop).isEqualTo(shop);
            assertThat(other.get(Kiosk.class, shop.id())).get().isSameAs(loaded);
        }
    }

    @Test
    @DisplayName("Should materialize the variant named by the discriminator")
    void shouldDispatchOnDiscriminator() {
        Shop bakery = session.add(new Bakery(null, "Crust", "stone"));
        Member buyer = session.add(new Buyer(null, "frenchy"));
        session.commit();

        try (Session other = chariot.openSession()) {
            assertThat(other.get(Shop.class, bakery.id())).get().isInstanceOf(Bakery.class)
                    .isEqualTo(new Bakery(1L, "Crust", "stone"));
            assertThat(other.get(Member.class, buyer.id())).get().isInstanceOf(Buyer.class);
            assertThat(other.get(Clerk.class, buyer.id())).isEmpty();
            assertThat(other.get(Member.class, 99L)).isEmpty();
            assertThat(other.get(Shop.class, bakery.id()).orElseThrow().kind()).isEqualTo("bakery");
        }
    }

    @Test
    @DisplayName("Should read junction lists back in insertion order")
    void shouldMaterializeJunctionList() {
        Shop shop = session.add(new Kiosk(null, "Corner"));
        Product a = session.add(Product.of("A", 1, shop));
        Product b = session.add(Product.of("B", 2, shop));
        Purchase purchase = session.add(new Purchase(null, null, null, List.of(b.id(), a.id())));
        session.commit();

        try (Session other = chariot.openSession()) {
            assertThat(other.get(Purchase.class, purchase.id()).orElseThrow().productIds())
                    .containsExactly(b.id(), a.id());
        }
    }

    @Test
    @DisplayName("Should roll back the whole unit of work on a constraint violation")
    void shouldRollBackOnViolation() {
        session.add(new Kiosk(null, "Corner"));
        session.commit();
        Shop duplicate = session.add(new Kiosk(null, "Corner"));
        Shop fresh = session.add(new Kiosk(null, "Fresh"));

        assertThatThrownBy(session::commit)
                .isInstanceOfSatisfying(ConstraintViolationException.class, e -> {
                    assertThat(e.table()).isEqualTo("shop");
                    assertThat(e.column()).isEqualTo("name");
                    assertThat(e.constraint()).isEqualTo(Constraint.UNIQUE);
                });

        assertThat(chariot.store().table("shop").rowCount()).isEqualTo(1);
        assertThat(session.get(Shop.class, duplicate.id())).isEmpty();
        assertThat(session.get(Shop.class, fresh.id())).isEmpty();
    }

    @Test
    @DisplayName("Should reject dangling foreign keys at commit")
    void shouldRejectDanglingForeignKey() {
        session.add(new Product(null, "Orphan", 1, 42L));

        assertThatThrownBy(session::commit)
                .isInstanceOfSatisfying(ConstraintViolationException.class, e -> {
                    assertThat(e.column()).isEqualTo("shop_id");
                    assertThat(e.constraint()).isEqualTo(Constraint.FOREIGN_KEY);
                });
    }

    @Test
    @DisplayName("Should reject missing required values at commit")
    void shouldRejectMissingValue() {
        session.add(new Kiosk(null, null));

        assertThatThrownBy(session::commit)
                .isInstanceOfSatisfying(ConstraintViolationException.class,
                        e -> assertThat(e.constraint()).isEqualTo(Constraint.NOT_NULL));
    }

    @Test
    @DisplayName("Should discard pending work on rollback")
    void shouldDiscardOnRollback() {
        Shop shop = session.add(new Kiosk(null, "Corner"));

        session.rollback();
        session.commit();

        assertThat(chariot.store().table("shop").rowCount()).isZero();
        assertThat(session.get(Shop.class, shop.id())).isEmpty();
    }

    @Test
    @DisplayName("Should keep sequences ahead of explicit ids")
    void shouldRespectExplicitIds() {
        session.add(new Kiosk(7L, "Seven"));
        Shop next = session.add(new Kiosk(null, "Eight"));

        assertThat(next.id()).isEqualTo(8L);
    }

    @Test
    @DisplayName("Should keep serving the committed row when a pending entity reuses its id")
    void shouldNotShadowCommittedRow() {
        session.add(new Kiosk(5L, "Corner"));
        session.commit();
        try (Session other = chariot.openSession()) {
            other.add(new Kiosk(5L, "Impostor"));

            assertThat(other.get(Shop.class, 5L)).contains(new Kiosk(5L, "Corner"));
            assertThat(other.query(Shop.class).all()).containsExactly(new Kiosk(5L, "Corner"));
            assertThatThrownBy(other::commit)
                    .isInstanceOfSatisfying(ConstraintViolationException.class,
                            e -> assertThat(e.constraint()).isEqualTo(Constraint.PRIMARY_KEY));
            assertThat(other.get(Shop.class, 5L)).contains(new Kiosk(5L, "Corner"));
        }
    }

    @Test
    @DisplayName("Should ignore adding the same instance twice")
    void shouldAddOnce() {
        Shop shop = session.add(new Kiosk(null, "Corner"));

        assertThat(session.add(shop)).isSameAs(shop);
        session.commit();

        assertThat(chariot.store().table("shop").rowCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should reject unmapped entities")
    void shouldRejectUnmappedEntity() {
        assertThatThrownBy(() -> session.add("not an entity"))
                .isInstanceOf(ChariotException.class)
                .hasMessageContaining("is not a mapped entity");
    }

    @Test
    @DisplayName("Should echo the unit of work when enabled")
    void shouldEchoStatements() {
        CapturedLogs.clear();
        try (Chariot echoing = ShopModel.open(ChariotConfiguration.builder().echo(true).build());
             Session echoSession = echoing.openSession()) {
            echoSession.add(new Kiosk(null, "Corner"));
            echoSession.commit();
        }

        assertThat(CapturedLogs.messages("io.chariot.sql.echo")).containsExactly(
                "BEGIN (implicit)",
                "INSERT INTO shop (id, kind, name) VALUES (?, ?, ?)",
                "[parameters] [1, kiosk, Corner]",
                "COMMIT");
    }

    @Test
    @DisplayName("Should stay quiet when echo is off")
    void shouldNotEchoByDefault() {
        CapturedLogs.clear();

        session.add(new Kiosk(null, "Corner"));
        session.commit();

        assertThat(CapturedLogs.messages("io.chariot.sql.echo")).isEmpty();
    }

    @Test
    @DisplayName("Should fail after close and roll back pending work")
    void shouldFailAfterClose() {
        session.add(new Kiosk(null, "Corner"));

        session.close();

        assertThat(session.isClosed()).isTrue();
        assertThat(chariot.store().table("shop").rowCount()).isZero();
        assertThatThrownBy(() -> session.query(Shop.class))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Session is closed");
    }

    @Test
    @DisplayName("Should not create tables when schema creation is off")
    void shouldHonourCreateSchemaFlag() {
        try (Chariot bare = ShopModel.open(ChariotConfiguration.builder().createSchema(false).build())) {
            assertThat(bare.store().hasTable("shop")).isFalse();

            bare.createAll();

            assertThat(bare.store().hasTable("purchase_products")).isTrue();
        }
    }
}
