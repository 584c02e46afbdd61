package bench;

import bst.Traversal;
import shopping.AddResult;
import shopping.ProductOrdering;
import shopping.SearchResult;
import shopping.ShoppingList;

import java.util.List;
import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * Times the shopping list phases on random products: fill, search, re-order (rebuild), traverse.
 * Usage: {@code TreeBench [count] [seed]}.
 */
public class TreeBench {

    public static final class Result {
        final int added;
        final int found;
        final int traversed;
        final long fillNanos;
        final long searchNanos;
        final long rebuildNanos;
        final long traverseNanos;

        Result(int added, int found, int traversed, long fillNanos, long searchNanos, long rebuildNanos, long traverseNanos) {
            this.added = added;
            this.found = found;
            this.traversed = traversed;
            this.fillNanos = fillNanos;
            this.searchNanos = searchNanos;
            this.rebuildNanos = rebuildNanos;
            this.traverseNanos = traverseNanos;
        }

        public int added()     { return added; }
        public int found()     { return found; }
        public int traversed() { return traversed; }
    }

    public static void main(String[] args) {
        int count = (args.length >= 1) ? Integer.parseInt(args[0]) : 10_000;
        long seed = (args.length >= 2) ? Long.parseLong(args[1]) : 42L;

        // Warm up
        for (int i = 0; i < 3; i++) run(count, seed + i);

        Result r = run(count, seed);
        System.out.printf("Products=%d (added=%d), Seed=%d%n", count, r.added, seed);
        System.out.printf("  fill      : %8.2f ms%n", millis(r.fillNanos));
        System.out.printf("  search    : %8.2f ms (%d found)%n", millis(r.searchNanos), r.found);
        System.out.printf("  rebuild   : %8.2f ms%n", millis(r.rebuildNanos));
        System.out.printf("  in-order  : %8.2f ms (%d products)%n", millis(r.traverseNanos), r.traversed);
    }

    public static Result run(int count, long seed) {
        Random rnd = new Random(seed);
        ShoppingList list = new ShoppingList(ProductOrdering.BY_NAME);
        String[] names = new String[count];
        for (int i = 0; i < count; i++) {
            names[i] = "item-" + Integer.toString(rnd.nextInt(count * 4), 36);
        }

        long t0 = System.nanoTime();
        int added = 0;
        for (String name : names) {
            if (list.addEntity(name, 1 + rnd.nextInt(3)) == AddResult.ADDED) added++;
        }
        long t1 = System.nanoTime();

        int found = 0;
        for (int i = 0; i < count; i++) {
            String probe = "item-" + Integer.toString(rnd.nextInt(count * 4), 36);
            if (list.searchEntity(probe) == SearchResult.FOUND) found++;
        }
        long t2 = System.nanoTime();

        list.changeOrdering(ProductOrdering.BY_PRIORITY);
        long t3 = System.nanoTime();

        List<?> inOrder = list.traverse(Traversal.IN_ORDER);
        long t4 = System.nanoTime();

        return new Result(added, found, inOrder.size(), t1 - t0, t2 - t1, t3 - t2, t4 - t3);
    }

    private static double millis(long nanos) {
        return nanos / (double) TimeUnit.MILLISECONDS.toNanos(1);
    }
}
