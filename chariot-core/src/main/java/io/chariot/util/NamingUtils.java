package io.chariot.util;

/**
 * Naming conventions shared by the mapping and SQL layers.
 */
public final class NamingUtils {

    private NamingUtils() {
    }

    /**
     * Converts a camelCase property name to a snake_case column name.
     * <p>
     * Examples:
     * <ul>
     *   <li>firstName → first_name</li>
     *   <li>foodTruckId → food_truck_id</li>
     *   <li>SKUCode → sku_code (consecutive capitals stay together)</li>
     *   <li>id → id</li>
     * </ul>
     *
     * @param camelCase the property name
     * @return the column name
     */
    public static String toSnakeCase(String camelCase) {
        if (camelCase == null || camelCase.isEmpty()) {
            return camelCase;
        }
        StringBuilder result = new StringBuilder(camelCase.length() + 4);
        for (int i = 0; i < camelCase.length(); i++) {
            char c = camelCase.charAt(i);
            if (Character.isUpperCase(c)) {
                boolean afterLower = i > 0 && !Character.isUpperCase(camelCase.charAt(i - 1));
                boolean beforeLower = i > 0 && i + 1 < camelCase.length()
                        && Character.isLowerCase(camelCase.charAt(i + 1))
                        && Character.isUpperCase(camelCase.charAt(i - 1));
                if (afterLower || beforeLower) {
                    result.append('_');
                }
                result.append(Character.toLowerCase(c));
            } else {
                result.append(c);
            }
        }
        return result.toString();
    }

    /**
     * Derives a relationship name from the property that stores its keys.
     * <p>
     * Examples: foodTruckId → foodTruck, menuItemIds → menuItems, owner → owner.
     *
     * @param property the key property
     * @return the relationship name
     */
    public static String relationshipName(String property) {
        if (property.endsWith("Ids") && property.length() > 3) {
            return property.substring(0, property.length() - 3) + "s";
        }
        if (property.endsWith("Id") && property.length() > 2) {
            return property.substring(0, property.length() - 2);
        }
        return property;
    }
}
