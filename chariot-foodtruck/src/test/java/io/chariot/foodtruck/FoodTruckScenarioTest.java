package io.chariot.foodtruck;

import io.chariot.core.ChariotConfiguration;
import io.chariot.core.ConstraintViolationException;
import io.chariot.core.ConstraintViolationException.Constraint;
import io.chariot.foodtruck.OrderQueryComposer.ItemLoading;
import io.chariot.query.Fetch;
import io.chariot.query.QueryResult;
import io.chariot.session.Chariot;
import io.chariot.session.Session;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FoodTruckScenarioTest {

    private static final String SUPER = "NA, Frenchy Super Burrito 1000 Hell's Chariot taco_truck";
    private static final String CALIFORNIA = "NA, Frenchy California Burrito 700 Hell's Chariot taco_truck";

    private Chariot chariot;
    private Session session;
    private Fixture fixture;

    @BeforeEach
    void setUp() {
        chariot = FoodTruckSchema.open(ChariotConfiguration.builder().url("mem:scenario").build());
        session = chariot.openSession();
        fixture = new FixtureBuilder(session).build();
    }

    @AfterEach
    void tearDown() {
        session.close();
        chariot.close();
    }

    @Test
    @DisplayName("Should build the fixture with ids assigned")
    void shouldBuildFixture() {
        assertThat(fixture.foodTruck().id()).isEqualTo(1L);
        assertThat(fixture.menuItems()).extracting(MenuItem::name)
                .containsExactly("Super Burrito", "California Burrito", "Shrimp Burrito");
        assertThat(fixture.menuItems()).allMatch(item -> item.foodTruckId().equals(fixture.foodTruck().id()));
        assertThat(fixture.employees()).extracting(Person::displayName).containsExactly("Zuko, Danny", "Dee, Sandra");
        assertThat(fixture.orders().get(0).menuItemIds())
                .containsExactly(fixture.menuItems().get(0).id(), fixture.menuItems().get(1).id());
        assertThat(fixture.orders().get(1).employeeId()).isEqualTo(fixture.employees().get(1).id());
        assertThat(chariot.store().table("menu_item_orders").rowCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should render every item of the orders containing a 700 cent item")
    void shouldRenderAllItemsOfMatchingOrders() {
        QueryResult<Order> result = new OrderQueryComposer(session).compose(700).execute();

        assertThat(result.roots()).containsExactlyElementsOf(fixture.orders());
        assertThat(new OrderRenderer(System.out).render(result))
                .extracting(OrderLine::toString)
                .containsExactly(SUPER, CALIFORNIA, CALIFORNIA);
    }

    @Test
    @DisplayName("Should render only the matching items when fetched from the joined rows")
    void shouldRenderMatchingItemsOnly() {
        QueryResult<Order> result = new OrderQueryComposer(session).compose(700, ItemLoading.MATCHING_ITEMS)
                .execute();

        assertThat(new OrderRenderer(System.out).render(result))
                .extracting(OrderLine::toString)
                .containsExactly(CALIFORNIA, CALIFORNIA);
    }

    @Test
    @DisplayName("Should return nothing for a price no item has")
    void shouldReturnNothingForUnknownPrice() {
        QueryResult<Order> result = new OrderQueryComposer(session).compose(123).execute();

        assertThat(result.isEmpty()).isTrue();
        assertThat(new OrderRenderer(System.out).render(result)).isEmpty();
    }

    @Test
    @DisplayName("Should return the same orders and items when run twice")
    void shouldBeIdempotent() {
        OrderQueryComposer composer = new OrderQueryComposer(session);
        OrderRenderer renderer = new OrderRenderer(System.out);

        List<OrderLine> first = renderer.render(composer.compose(700).execute());
        List<OrderLine> second = renderer.render(composer.compose(700).execute());

        assertThat(second).isEqualTo(first);
    }

    @Test
    @DisplayName("Should find orders through the 800 cent item only once")
    void shouldFilterOnOtherPrices() {
        assertThat(new OrderQueryComposer(session).compose(10_00).all()).containsExactly(fixture.orders().get(0));
        assertThat(new OrderQueryComposer(session).compose(8_00).all()).isEmpty();
    }

    @Test
    @DisplayName("Should reject a second food truck with an existing name")
    void shouldRejectDuplicateTruckName() {
        session.add(new PlainFoodTruck(null, "Hell's Chariot"));

        assertThatThrownBy(session::commit)
                .isInstanceOfSatisfying(ConstraintViolationException.class, e -> {
                    assertThat(e.table()).isEqualTo("food_truck");
                    assertThat(e.column()).isEqualTo("name");
                    assertThat(e.constraint()).isEqualTo(Constraint.UNIQUE);
                });
        assertThat(session.query(FoodTruck.class).all()).containsExactly(fixture.foodTruck());
    }

    @Test
    @DisplayName("Should reach the same menu item instance through the truck and through an order")
    void shouldKeepIdentityAcrossRelationships() {
        try (Session reader = chariot.openSession()) {
            QueryResult<FoodTruck> trucks = reader.query(FoodTruck.class)
                    .options(Fetch.joined(FoodTruck.MENU_ITEMS))
                    .execute();
            QueryResult<Order> orders = reader.query(Order.class)
                    .options(Fetch.joined(Order.MENU_ITEMS))
                    .execute();

            FoodTruck truck = trucks.roots().get(0);
            Order order = orders.roots().get(0);
            MenuItem viaTruck = trucks.graph().many(truck, FoodTruck.MENU_ITEMS).get(1);
            MenuItem viaOrder = orders.graph().many(order, Order.MENU_ITEMS).get(1);

            assertThat(viaTruck).isSameAs(viaOrder).isNotSameAs(fixture.menuItems().get(1));
            assertThat(reader.get(MenuItem.class, viaTruck.id())).containsSame(viaTruck);
        }
    }

    @Test
    @DisplayName("Should materialize the taco truck variant from the base type")
    void shouldDispatchVariants() {
        try (Session reader = chariot.openSession()) {
            assertThat(reader.query(FoodTruck.class).all()).singleElement()
                    .isInstanceOf(TacoTruck.class)
                    .extracting(FoodTruck::type).isEqualTo("taco_truck");
            assertThat(reader.query(Person.class).all())
                    .extracting(Person::type)
                    .containsExactly("employee", "employee", "customer");
        }
    }

    @Test
    @DisplayName("Should walk inverse relationships from the truck and the employees")
    void shouldNavigateInverses() {
        try (Session reader = chariot.openSession()) {
            QueryResult<FoodTruck> trucks = reader.query(FoodTruck.class)
                    .options(Fetch.joined(FoodTruck.EMPLOYEES).then(Employee.ORDERS_SERVED))
                    .execute();
            FoodTruck truck = trucks.roots().get(0);
            List<Employee> employees = trucks.graph().many(truck, FoodTruck.EMPLOYEES);

            assertThat(employees).extracting(Employee::lastName).containsExactly("Zuko", "Dee");
            assertThat(trucks.graph().many(employees.get(0), Employee.ORDERS_SERVED))
                    .containsExactly(fixture.orders().get(0));

            assertThat(reader.query(MenuItem.class)
                    .join(MenuItem.ORDERS)
                    .join(Order.CUSTOMER)
                    .filter(Person.FIRST_NAME.eq("Frenchy"))
                    .all())
                    .extracting(MenuItem::name)
                    .containsExactly("Super Burrito", "California Burrito");
        }
    }
}
