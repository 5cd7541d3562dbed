package io.chariot.foodtruck;

/**
 * One printed row: who ordered, what, for how much, and which truck served it.
 */
public record OrderLine(String customer, String item, Integer price, String foodTruck, String foodTruckType) {

    @Override
    public String toString() {
        return customer + " " + item + " " + (price == null ? Person.MISSING_NAME : price) + " " + foodTruck + " "
                + foodTruckType;
    }
}
