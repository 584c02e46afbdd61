package shopping;

import org.junit.jupiter.api.Test;

import java.util.*;
import static org.junit.jupiter.api.Assertions.*;

class ProductOrderingTest {

    @Test
    void by_name_ignores_case_then_priority_then_creation() {
        Product bread = new Product("bread", 3);
        Product apples = new Product("Apples", 3);
        assertTrue(ProductOrdering.BY_NAME.compare(apples, bread) < 0);

        Product milkLow = new Product("Milk", 3);
        Product milkHigh = new Product("milk", 1);
        assertTrue(ProductOrdering.BY_NAME.compare(milkHigh, milkLow) < 0, "priority breaks name ties");

        Product older = new Product("Eggs", 2);
        Product newer = new Product("EGGS", 2);
        assertTrue(ProductOrdering.BY_NAME.compare(older, newer) < 0, "creation order breaks full ties");
        assertTrue(ProductOrdering.BY_NAME.compare(newer, older) > 0);
    }

    @Test
    void by_priority_then_name_then_creation() {
        Product zucchini = new Product("Zucchini", 1);
        Product apples = new Product("Apples", 2);
        assertTrue(ProductOrdering.BY_PRIORITY.compare(zucchini, apples) < 0);

        Product eggs = new Product("Eggs", 2);
        Product milk = new Product("milk", 2);
        assertTrue(ProductOrdering.BY_PRIORITY.compare(eggs, milk) < 0);

        Product older = new Product("Tea", 2);
        Product newer = new Product("tea", 2);
        assertTrue(ProductOrdering.BY_PRIORITY.compare(older, newer) < 0);
    }

    @Test
    void only_the_same_product_compares_equal() {
        List<Product> products = Arrays.asList(
                new Product("Milk", 2), new Product("milk", 2), new Product("Bread", 1), new Product("bread", 3));
        for (ProductOrdering ordering : ProductOrdering.values()) {
            for (Product a : products) {
                for (Product b : products) {
                    int c = ordering.compare(a, b);
                    assertEquals(a == b, c == 0, ordering + " " + a + " vs " + b);
                    assertEquals(Integer.signum(c), -Integer.signum(ordering.compare(b, a)));
                }
            }
        }
    }

    @Test
    void parse_accepts_labels_and_constant_names() {
        assertEquals(ProductOrdering.BY_NAME, ProductOrdering.parse("name"));
        assertEquals(ProductOrdering.BY_NAME, ProductOrdering.parse(" Name "));
        assertEquals(ProductOrdering.BY_PRIORITY, ProductOrdering.parse("PRIORITY"));
        assertEquals(ProductOrdering.BY_PRIORITY, ProductOrdering.parse("by_priority"));
        assertThrows(IllegalArgumentException.class, () -> ProductOrdering.parse("size"));
        assertThrows(IllegalArgumentException.class, () -> ProductOrdering.parse(null));
    }
}
