package io.chariot.foodtruck;

import io.chariot.core.ChariotConfiguration;
import io.chariot.core.RelationshipAbsentException;
import io.chariot.query.Fetch;
import io.chariot.query.QueryResult;
import io.chariot.session.Chariot;
import io.chariot.session.Session;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OrderRendererTest {

    private Chariot chariot;
    private Session session;

    @BeforeEach
    void setUp() {
        chariot = FoodTruckSchema.open(ChariotConfiguration.defaults());
        session = chariot.openSession();
    }

    @AfterEach
    void tearDown() {
        session.close();
        chariot.close();
    }

    @Test
    @DisplayName("Should render NA for fetched relationships without a target")
    void shouldRenderPlaceholders() {
        // Given an order without customer whose employee has no truck
        FoodTruck truck = session.add(new PlainFoodTruck(null, "Lonely"));
        MenuItem item = session.add(MenuItem.of("Taco", 300, truck));
        Employee drifter = session.add(Employee.of(null, "Drifter", null));
        session.add(Order.of(drifter, null, item));
        session.commit();

        // When
        QueryResult<Order> result = new OrderQueryComposer(session).compose(300).execute();

        // Then
        assertThat(new OrderRenderer(System.out).render(result))
                .containsExactly(new OrderLine("NA", "Taco", 300, "NA", "NA"));
    }

    @Test
    @DisplayName("Should render NA for an order without employee")
    void shouldRenderMissingEmployee() {
        FoodTruck truck = session.add(new TacoTruck(null, "Tacos"));
        MenuItem item = session.add(MenuItem.of("Taco", 300, truck));
        Customer customer = session.add(new Customer(null, "Kenickie", "Murdoch"));
        session.add(Order.of(null, customer, item));
        session.commit();

        QueryResult<Order> result = new OrderQueryComposer(session).compose(300).execute();

        assertThat(new OrderRenderer(System.out).render(result)).extracting(OrderLine::toString)
                .containsExactly("Murdoch, Kenickie Taco 300 NA NA");
    }

    @Test
    @DisplayName("Should fail when the query did not fetch what the renderer reads")
    void shouldRejectUnfetchedRelationships() {
        FoodTruck truck = session.add(new TacoTruck(null, "Tacos"));
        MenuItem item = session.add(MenuItem.of("Taco", 300, truck));
        session.add(Order.of(null, null, item));
        session.commit();

        QueryResult<Order> result = session.query(Order.class)
                .options(Fetch.joined(Order.MENU_ITEMS))
                .execute();

        assertThatThrownBy(() -> new OrderRenderer(System.out).render(result))
                .isInstanceOf(RelationshipAbsentException.class)
                .hasMessageContaining("Order.customer");
    }

    @Test
    @DisplayName("Should print one space separated line per item")
    void shouldPrintLines() {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        OrderRenderer renderer = new OrderRenderer(new PrintStream(bytes, true, StandardCharsets.UTF_8));

        renderer.print(List.of(new OrderLine("Dee, Sandra", "Taco", null, "Tacos", "taco_truck")));

        assertThat(bytes.toString(StandardCharsets.UTF_8))
                .isEqualTo("Dee, Sandra Taco NA Tacos taco_truck" + System.lineSeparator());
    }
}
