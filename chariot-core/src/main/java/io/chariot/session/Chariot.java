package io.chariot.session;

import io.chariot.core.ChariotConfiguration;
import io.chariot.schema.Schema;
import io.chariot.storage.Store;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Handle on a store and the schema of the entities it holds. Open one, hand out sessions, close
 * it when done; nothing is shared between handles.
 *
 * <pre>{@code
 * try (Chariot chariot = Chariot.open(ChariotConfiguration.load("chariot.properties"),
 *         FoodTruck.class, Person.class, MenuItem.class, Order.class);
 *      Session session = chariot.openSession()) {
 *     ...
 * }
 * }</pre>
 */
public final class Chariot implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Chariot.class);

    private final ChariotConfiguration configuration;
    private final Schema schema;
    private final Store store;

    private Chariot(ChariotConfiguration configuration, Schema schema, Store store) {
        this.configuration = configuration;
        this.schema = schema;
        this.store = store;
    }

    /**
     * Extract the schema, open the store and, when configured, create every table.
     *
     * @param configuration the configuration
     * @param entityTypes   entity family roots
     * @return the open handle
     * @throws io.chariot.core.ChariotException on a malformed entity or unsupported url
     */
    public static Chariot open(ChariotConfiguration configuration, Class<?>... entityTypes) {
        Schema schema = Schema.of(List.of(entityTypes));
        Store store = Store.open(configuration.url());
        Chariot chariot = new Chariot(configuration, schema, store);
        if (configuration.createSchema()) {
            chariot.createAll();
        }
        log.debug("Opened {} over {}", schema, configuration.url());
        return chariot;
    }

    /**
     * Create every table of the schema that does not exist yet.
     */
    public void createAll() {
        store.createAll(schema.tableDefinitions());
    }

    public Session openSession() {
        if (store.isClosed()) {
            throw new IllegalStateException("Store is closed");
        }
        return new Session(schema, store, configuration.echo());
    }

    public ChariotConfiguration configuration() {
        return configuration;
    }

    public Schema schema() {
        return schema;
    }

    public Store store() {
        return store;
    }

    @Override
    public void close() {
        store.close();
    }
}
