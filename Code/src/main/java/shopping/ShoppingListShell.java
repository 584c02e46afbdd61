package shopping;

import bst.Traversal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Line-oriented console over a {@link ShoppingList}. One command per line, a status line after each.
 *
 * <pre>
 * add Milk 2        search Milk       delete Milk
 * order priority    inorder           preorder
 * postorder         tree              help       quit
 * </pre>
 */
public class ShoppingListShell {
    private static final Logger log = LoggerFactory.getLogger(ShoppingListShell.class);

    private static final String HELP =
            "Commands: add <name> [priority], search <name>, delete <name>, order name|priority,\n"
          + "          inorder, preorder, postorder, tree, help, quit";

    private final ShoppingList list;
    private final BufferedReader in;
    private final PrintWriter out;

    public ShoppingListShell(final ShoppingList list, final BufferedReader in, final PrintWriter out) {
        this.list = list;
        this.in = in;
        this.out = out;
    }

    public static void main(String[] args) throws IOException {
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        PrintWriter out = new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8), true);
        new ShoppingListShell(new ShoppingList(initialOrdering(args, out)), in, out).run();
    }

    // args[0] if it names an ordering, BY_NAME otherwise
    static ProductOrdering initialOrdering(final String[] args, final PrintWriter out) {
        if (args.length < 1) return ProductOrdering.BY_NAME;
        try {
            return ProductOrdering.parse(args[0]);
        } catch (IllegalArgumentException e) {
            out.println(e.getMessage());
            out.println("Falling back to ordering by name.");
            return ProductOrdering.BY_NAME;
        }
    }

    /** Reads commands until end of input or quit. */
    public void run() throws IOException {
        out.println("Ready. Ordering: " + list.ordering().label() + ". Type 'help' for commands.");
        out.flush();
        String line;
        while ((line = in.readLine()) != null) {
            if (!execute(line)) break;
            out.flush();
        }
        out.flush();
    }

    /** Runs one command line. Returns false when the shell should stop. */
    boolean execute(final String line) {
        final String trimmed = line.strip();
        if (trimmed.isEmpty()) return true;

        final String[] tokens = trimmed.split("(?U)\\s+");
        final String verb = tokens[0].toLowerCase(Locale.ROOT);
        final List<String> rest = Arrays.asList(tokens).subList(1, tokens.length);

        switch (verb) {
            case "add":       add(rest); break;
            case "search":    search(String.join(" ", rest)); break;
            case "delete":    delete(String.join(" ", rest)); break;
            case "order":     order(String.join(" ", rest)); break;
            case "inorder":   print(Traversal.IN_ORDER, "in-order"); break;
            case "preorder":  print(Traversal.PRE_ORDER, "pre-order"); break;
            case "postorder": print(Traversal.POST_ORDER, "post-order"); break;
            case "tree":      tree(); break;
            case "help":      out.println(HELP); break;
            case "quit":
            case "exit":
                return false;
            default:
                log.warn("Unknown command '{}'", verb);
                out.println("Unknown command: " + verb + ". Type 'help' for commands.");
        }
        return true;
    }

    private void add(final List<String> args) {
        String name = String.join(" ", args);
        String priority = null;
        if (args.size() > 1 && isInteger(args.get(args.size() - 1))) {
            name = String.join(" ", args.subList(0, args.size() - 1));
            priority = args.get(args.size() - 1);
        }
        switch (list.addEntity(name, priority)) {
            case ADDED:
                out.println("Added: " + list.find(name).orElseThrow() + ".");
                break;
            case ALREADY_EXISTS:
                out.println("\"" + name.strip() + "\" already exists.");
                break;
            case INVALID_NAME:
                out.println("Enter a product name.");
                break;
        }
    }

    private void search(final String name) {
        switch (list.searchEntity(name)) {
            case FOUND:        out.println("\"" + name + "\" is on the list."); break;
            case NOT_FOUND:    out.println("\"" + name + "\" is not on the list."); break;
            case INVALID_NAME: out.println("Enter a product name."); break;
        }
    }

    private void delete(final String name) {
        switch (list.deleteEntity(name)) {
            case DELETED:      out.println("Deleted: " + name + "."); break;
            case NOT_FOUND:    out.println("Cannot delete: \"" + name + "\" is not on the list."); break;
            case INVALID_NAME: out.println("Enter a product name."); break;
        }
    }

    private void order(final String mode) {
        final ProductOrdering ordering;
        try {
            ordering = ProductOrdering.parse(mode);
        } catch (IllegalArgumentException e) {
            out.println(e.getMessage());
            return;
        }
        list.changeOrdering(ordering);
        out.println("Ordering applied: " + ordering.label() + ".");
    }

    private void print(final Traversal traversal, final String title) {
        final List<Product> products = list.traverse(traversal);
        if (products.isEmpty()) {
            out.println("(no results)");
        }
        for (Product p : products) {
            out.println(p.name() + " (Priority " + p.priority() + ")");
        }
        out.println("Traversal: " + title + ".");
    }

    private void tree() {
        final String text = list.dumpText();
        out.println(text.isEmpty() ? "(empty tree)" : text);
    }

    private static boolean isInteger(final String s) {
        return s.matches("[+-]?\\d+");
    }
}
