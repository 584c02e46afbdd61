package shopping;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

class ProductRegistryTest {

    @Test
    void put_refuses_taken_keys() {
        ProductRegistry registry = new ProductRegistry();
        Product milk = new Product("Milk", 2);

        assertTrue(registry.put(milk.key(), milk));
        assertFalse(registry.put("milk", new Product("milk", 1)));
        assertSame(milk, registry.get("milk").orElseThrow());
        assertEquals(1, registry.size());
    }

    @Test
    void remove_returns_the_removed_product() {
        ProductRegistry registry = new ProductRegistry();
        Product bread = new Product("Bread", 1);
        registry.put(bread.key(), bread);

        assertTrue(registry.has("bread"));
        assertSame(bread, registry.remove("bread"));
        assertFalse(registry.has("bread"));
        assertTrue(registry.get("bread").isEmpty());
        assertNull(registry.remove("bread"));
        assertEquals(0, registry.size());
    }

    @Test
    void values_is_a_read_only_view() {
        ProductRegistry registry = new ProductRegistry();
        Product eggs = new Product("Eggs", 2);
        registry.put(eggs.key(), eggs);

        assertEquals(1, registry.values().size());
        assertThrows(UnsupportedOperationException.class, () -> registry.values().clear());
    }
}
