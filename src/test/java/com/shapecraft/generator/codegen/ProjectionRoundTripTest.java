package com.shapecraft.generator.codegen;

import com.shapecraft.generator.ShapeFixtures;
import com.shapecraft.generator.codegen.model.output.GeneratedFile;
import com.shapecraft.generator.model.ShapeFile;
import com.shapecraft.generator.schema.TypeSchema;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.tools.JavaCompiler;
import javax.tools.ToolProvider;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.lang.reflect.Method;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;
import static org.assertj.core.api.Assumptions.assumeThat;

/**
 * Compiles generated projections together with a small domain model and runs
 * the forward and reverse transforms.
 */
class ProjectionRoundTripTest {

    private static final String SCHEMA = """
        type rt.Order
          id: long
          customer: rt.Customer?
          items: List<rt.Item>!
          extras: rt.Item[]!
          tagged: Set<rt.Item>!
        end
        type rt.Customer
          name: String!
          address: rt.Address?
        end
        type rt.Address
          city: rt.City?
        end
        type rt.City
          name: String!
        end
        type rt.Item
          sku: String!
          quantity: int
        end
        """;

    private static final String SHAPES = """
        package rt.views;
        import rt.*;

        projection OrderSummary from Order o => {
            id: o.id,
            customerName: o.customer?.name,
            customerCity: o.customer?.address?.city?.name
        };

        projection OrderLines from Order o => {
            o.id,
            lines: o.items.map(i => { i.sku, i.quantity }).toList()
        };

        projection OrderBundles from Order o => {
            o.id,
            extras: o.extras.map(i => { i.sku }).toList(),
            tagged: o.tagged.map(i => { i.sku }).toList()
        };
        """;

    private static final String DOMAIN = """
        package rt;

        import java.util.ArrayList;
        import java.util.LinkedHashSet;
        import java.util.List;
        import java.util.Set;

        public class Order {
            private long id;
            private Customer customer;
            private List<Item> items = new ArrayList<>();
            private Item[] extras = new Item[0];
            private Set<Item> tagged = new LinkedHashSet<>();

            public long getId() { return id; }
            public void setId(long id) { this.id = id; }
            public Customer getCustomer() { return customer; }
            public void setCustomer(Customer customer) { this.customer = customer; }
            public List<Item> getItems() { return items; }
            public void setItems(List<Item> items) { this.items = items; }
            public Item[] getExtras() { return extras; }
            public void setExtras(Item[] extras) { this.extras = extras; }
            public Set<Item> getTagged() { return tagged; }
            public void setTagged(Set<Item> tagged) { this.tagged = tagged; }
        }
        """;

    private static final String CUSTOMER = """
        package rt;

        public class Customer {
            private String name;
            private Address address;

            public String getName() { return name; }
            public void setName(String name) { this.name = name; }
            public Address getAddress() { return address; }
            public void setAddress(Address address) { this.address = address; }
        }
        """;

    private static final String ADDRESS = """
        package rt;

        public class Address {
            private City city;

            public City getCity() { return city; }
            public void setCity(City city) { this.city = city; }
        }
        """;

    private static final String CITY = """
        package rt;

        public class City {
            private String name;

            public String getName() { return name; }
            public void setName(String name) { this.name = name; }
        }
        """;

    private static final String ITEM = """
        package rt;

        public class Item {
            private String sku;
            private int quantity;

            public String getSku() { return sku; }
            public void setSku(String sku) { this.sku = sku; }
            public int getQuantity() { return quantity; }
            public void setQuantity(int quantity) { this.quantity = quantity; }
        }
        """;

    private static final String SCENARIO = """
        package rt;

        import java.util.ArrayList;
        import java.util.LinkedHashSet;
        import java.util.List;
        import rt.views.OrderBundles;
        import rt.views.OrderLines;
        import rt.views.OrderSummary;
        import rt.views.OrdersProjections;

        public class Scenario {

            public static String summary() {
                Customer alice = new Customer();
                alice.setName("Alice");
                Order order = new Order();
                order.setId(1L);
                order.setCustomer(alice);

                OrderSummary dto = OrdersProjections.orderSummary().apply(order);
                Order back = OrdersProjections.orderSummaryReverse(dto);
                return dto.getId() + "|" + dto.getCustomerName() + "|" + dto.getCustomerCity()
                        + "|" + back.getCustomer().getName() + "|" + back.getCustomer().getAddress();
            }

            public static String lines() {
                Item item = new Item();
                item.setSku("A-1");
                item.setQuantity(3);
                Order order = new Order();
                order.setId(7L);
                order.setItems(new ArrayList<>(List.of(item)));

                OrderLines dto = OrdersProjections.orderLines().apply(order);
                Order back = OrdersProjections.orderLinesReverse(dto);
                return dto.getLines().size() + "|" + dto.getLines().get(0).getSku()
                        + "|" + back.getId() + "|" + back.getItems().get(0).getSku()
                        + "|" + back.getItems().get(0).getQuantity();
            }

            public static String bundles() {
                Order order = new Order();
                order.setId(9L);
                order.setExtras(new Item[] {item("X-1"), item("X-2")});
                order.setTagged(new LinkedHashSet<>(List.of(item("T-1"), item("T-2"))));

                OrderBundles dto = OrdersProjections.orderBundles().apply(order);
                Order back = OrdersProjections.orderBundlesReverse(dto);
                return dto.getExtras().size() + "|" + dto.getTagged().size()
                        + "|" + back.getExtras().getClass().getSimpleName() + ":" + back.getExtras()[1].getSku()
                        + "|" + back.getTagged().getClass().getSimpleName() + ":"
                        + back.getTagged().iterator().next().getSku();
            }

            private static Item item(String sku) {
                Item item = new Item();
                item.setSku(sku);
                return item;
            }

            public static String nullSource() {
                return String.valueOf(OrdersProjections.orderSummary().apply(null));
            }
        }
        """;

    @TempDir
    Path tempDir;

    @Test
    void testNullSafeChainRoundTrip() throws Exception {
        assertThat(runScenario("summary")).isEqualTo("1|Alice|null|Alice|null");
    }

    @Test
    void testNestedCollectionRoundTrip() throws Exception {
        assertThat(runScenario("lines")).isEqualTo("1|A-1|7|A-1|3");
    }

    @Test
    void testReverseRebuildsArrayAndSetMembers() throws Exception {
        assertThat(runScenario("bundles")).isEqualTo("2|2|Item[]:X-2|LinkedHashSet:T-1");
    }

    @Test
    void testReverseCollectionKindsInGeneratedSource() {
        String projections = compile().getFiles().stream()
                .filter(file -> file.getTypeName().equals("rt.views.OrdersProjections"))
                .map(GeneratedFile::getContents)
                .findFirst()
                .orElseThrow();

        assertThat(projections)
                .contains(".toArray(Item[]::new)")
                .contains("Collectors.toCollection(LinkedHashSet::new)")
                .contains("Collectors.toCollection(ArrayList::new)");
    }

    @Test
    void testNullSourceProjectsToNull() throws Exception {
        assertThat(runScenario("nullSource")).isEqualTo("null");
    }

    private String runScenario(String method) throws Exception {
        JavaCompiler compiler = ToolProvider.getSystemJavaCompiler();
        assumeThat(compiler).as("a JDK compiler is required").isNotNull();

        CompilationOutput output = compile();
        assertThat(output.getDiagnostics().hasErrors()).as("%s", output.getDiagnostics().getEntries()).isFalse();

        Path sources = tempDir.resolve("src");
        List<String> arguments = new ArrayList<>(List.of("-d", tempDir.resolve("classes").toString()));
        for (GeneratedFile file : output.getFiles()) {
            arguments.add(write(sources.resolve(file.getPath()), file.getContents()));
        }
        arguments.add(write(sources.resolve("rt/Order.java"), DOMAIN));
        arguments.add(write(sources.resolve("rt/Customer.java"), CUSTOMER));
        arguments.add(write(sources.resolve("rt/Address.java"), ADDRESS));
        arguments.add(write(sources.resolve("rt/City.java"), CITY));
        arguments.add(write(sources.resolve("rt/Item.java"), ITEM));
        arguments.add(write(sources.resolve("rt/Scenario.java"), SCENARIO));

        ByteArrayOutputStream errors = new ByteArrayOutputStream();
        int status = compiler.run(null, null, errors, arguments.toArray(new String[0]));
        assertThat(status).as("javac failed:%n%s%n%s", errors, dump(sources)).isZero();

        try (URLClassLoader loader = new URLClassLoader(new URL[] {tempDir.resolve("classes").toUri().toURL()},
                getClass().getClassLoader())) {
            Method scenario = loader.loadClass("rt.Scenario").getMethod(method);
            return (String) scenario.invoke(null);
        }
    }

    private static CompilationOutput compile() {
        TypeSchema schema = ShapeFixtures.schema(SCHEMA);
        ShapeFile shapes = ShapeFixtures.shapeFile("orders.shape", SHAPES);
        return new ProjectionCompiler(GeneratorConfig.defaults(), schema).compile(List.of(shapes));
    }

    private static String write(Path path, String contents) throws IOException {
        Files.createDirectories(path.getParent());
        Files.writeString(path, contents);
        return path.toString();
    }

    private static String dump(Path sources) throws IOException {
        StringBuilder sb = new StringBuilder();
        try (Stream<Path> files = Files.walk(sources)) {
            for (Path file : (Iterable<Path>) files.filter(p -> p.toString().contains("views"))
                    .filter(Files::isRegularFile)::iterator) {
                sb.append("// ").append(file.getFileName()).append('\n').append(Files.readString(file));
            }
        }
        return sb.toString();
    }
}
