package io.chariot.foodtruck;

import io.chariot.core.ChariotConfiguration;
import io.chariot.query.Query;
import io.chariot.session.Chariot;
import io.chariot.session.Session;
import io.chariot.sql.StatementPrinter;

import java.io.PrintStream;

/**
 * Builds the fixture, prints the order query for items priced 700 cents, then the matching
 * order lines.
 */
public final class FoodTruckApplication {

    static final int PRICE = 7_00;
    static final String BANNER = "-".repeat(25) + " STARTING " + "-".repeat(25);

    private FoodTruckApplication() {
    }

    public static void main(String[] args) {
        run(ChariotConfiguration.load("chariot.properties"), System.out);
    }

    static void run(ChariotConfiguration configuration, PrintStream out) {
        try (Chariot chariot = FoodTruckSchema.open(configuration);
             Session session = chariot.openSession()) {
            new FixtureBuilder(session).build();

            Query<Order> query = new OrderQueryComposer(session).compose(PRICE);
            new StatementPrinter(out, configuration.colorOutput()).print(query.statement());

            out.println(BANNER);
            OrderRenderer renderer = new OrderRenderer(out);
            renderer.print(renderer.render(query.execute()));
        }
    }
}
