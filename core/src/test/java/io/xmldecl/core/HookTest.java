package io.xmldecl.core;

import static io.xmldecl.core.Processors.array;
import static io.xmldecl.core.Processors.dictionary;
import static io.xmldecl.core.Processors.integer;
import static io.xmldecl.core.Processors.namedTuple;
import static io.xmldecl.core.Processors.string;
import static io.xmldecl.core.Processors.userObject;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.xmldecl.core.error.HookFailureException;
import io.xmldecl.core.model.Hooks;
import io.xmldecl.core.model.Processor;
import io.xmldecl.core.model.ValueHook;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Value hooks")
class HookTest {

    public static class User {
        String name;
        Integer age;

        public User() {}

        User(String name, Integer age) {
            this.name = name;
            this.age = age;
        }
    }

    public record UserTuple(String name, Integer age) {}

    private static final Hooks REJECT_ALL = Hooks.both((state, value) -> {
        throw state.raiseError("Invalid value");
    });

    private static final String USER_XML = "<data><user><name>Bob</name><age>24</age></user></data>";
    private static final String FLAT_XML = "<data><name>Bob</name><age>24</age></data>";

    @Nested
    @DisplayName("validation failures are reported at the processor's own location")
    class Validation {

        @Test
        @DisplayName("primitive")
        void primitive() {
            Processor processor = dictionary("data", integer("value").hooks(REJECT_ALL));

            assertRejected(processor, "<data><value>1</value></data>", Map.of("value", 1), "data/value");
        }

        @Test
        @DisplayName("nested array inside a dictionary")
        void arrayNonRoot() {
            Processor processor = dictionary("data", array(integer("value"), "values").hooks(REJECT_ALL));

            assertRejected(
                    processor,
                    "<data><values><value>1</value></values></data>",
                    Map.of("values", List.of(1)),
                    "data/values");
        }

        @Test
        @DisplayName("array at the document root")
        void arrayRoot() {
            Processor processor = array(integer("value"), "data").hooks(REJECT_ALL);

            assertRejected(processor, "<data><value>1</value></data>", List.of(1), "data");
        }

        @Test
        @DisplayName("dictionary inside a dictionary")
        void dictionaryNonRoot() {
            Processor processor = dictionary("data", dictionary("user", string("name"), integer("age")).hooks(REJECT_ALL));

            assertRejected(processor, USER_XML, Map.of("user", Map.of("name", "Bob", "age", 24)), "data/user");
        }

        @Test
        @DisplayName("dictionary at the document root")
        void dictionaryRoot() {
            Processor processor = dictionary("data", string("name"), integer("age")).hooks(REJECT_ALL);

            assertRejected(processor, FLAT_XML, Map.of("name", "Bob", "age", 24), "data");
        }

        @Test
        @DisplayName("named tuple inside a dictionary and at the root")
        void namedTuples() {
            Processor nonRoot = dictionary("data",
                    namedTuple("user", UserTuple.class, string("name"), integer("age")).hooks(REJECT_ALL));
            Processor root = namedTuple("data", UserTuple.class, string("name"), integer("age")).hooks(REJECT_ALL);

            assertRejected(nonRoot, USER_XML, Map.of("user", new UserTuple("Bob", 24)), "data/user");
            assertRejected(root, FLAT_XML, new UserTuple("Bob", 24), "data");
        }

        @Test
        @DisplayName("user object inside a dictionary and at the root")
        void userObjects() {
            Processor nonRoot = dictionary("data",
                    userObject("user", User.class, string("name"), integer("age")).hooks(REJECT_ALL));
            Processor root = userObject("data", User.class, string("name"), integer("age")).hooks(REJECT_ALL);

            assertRejected(nonRoot, USER_XML, Map.of("user", new User("Bob", 24)), "data/user");
            assertRejected(root, FLAT_XML, new User("Bob", 24), "data");
        }

        private void assertRejected(Processor processor, String xml, Object value, String location) {
            assertThatThrownBy(() -> XmlMapper.decode(processor, xml))
                    .isInstanceOf(HookFailureException.class)
                    .hasMessage("Invalid value at " + location);
            assertThatThrownBy(() -> XmlMapper.encode(processor, value))
                    .isInstanceOf(HookFailureException.class)
                    .hasMessage("Invalid value at " + location);
        }
    }

    @Nested
    @DisplayName("value transforms")
    class Transforms {

        private final ValueHook pairsToMap = (state, value) -> {
            Map<Object, Object> map = new LinkedHashMap<>();
            for (Object item : (List<?>) value) {
                Map<?, ?> pair = (Map<?, ?>) item;
                map.put(pair.get("key"), pair.get("value"));
            }
            return map;
        };

        private final ValueHook mapToPairs = (state, value) -> {
            List<Object> pairs = new ArrayList<>();
            ((Map<?, ?>) value).forEach((k, v) -> pairs.add(Map.of("key", k, "value", v)));
            return pairs;
        };

        private final Processor pair = dictionary("value", string(".", "key"), integer(".").alias("value"));

        @Test
        @DisplayName("an array hook turns key/value items into a map and back")
        void arrayToMap() {
            Processor processor = dictionary("data",
                    string("name"),
                    array(pair).alias("values").hooks(new Hooks(pairsToMap, mapToPairs)));
            String xml = "<data><name>Dataset 1</name><value key=\"a\">17</value><value key=\"b\">42</value></data>";

            Object decoded = XmlMapper.decode(processor, xml);

            Map<String, Object> expectedValues = new LinkedHashMap<>();
            expectedValues.put("a", 17);
            expectedValues.put("b", 42);
            assertThat(decoded).isEqualTo(Map.of("name", "Dataset 1", "values", expectedValues));
            assertThat(XmlMapper.encodeToString(processor, decoded)).isEqualTo(xml);
        }

        @Test
        @DisplayName("hooks on items of an array of arrays")
        void arrayOfArrays() {
            Processor processor = dictionary("data",
                    array(array(pair, "values").hooks(new Hooks(pairsToMap, mapToPairs))).alias("sets"));
            String xml = "<data><values><value key=\"a\">1</value></values>"
                    + "<values><value key=\"x\">2</value><value key=\"y\">3</value></values></data>";

            Object decoded = XmlMapper.decode(processor, xml);

            assertThat(decoded).isEqualTo(Map.of("sets", List.of(Map.of("a", 1), Map.of("x", 2, "y", 3))));
            assertThat(XmlMapper.encodeToString(processor, decoded)).isEqualTo(xml);
        }

        @Test
        @DisplayName("a primitive hook changes the value in both directions")
        void primitive() {
            Processor processor = dictionary("data",
                    string("name").hooks(new Hooks((s, v) -> ((String) v).toUpperCase(), (s, v) -> ((String) v).toLowerCase())));

            assertThat(XmlMapper.decode(processor, "<data><name>bob</name></data>")).isEqualTo(Map.of("name", "BOB"));
            assertThat(XmlMapper.encodeToString(processor, Map.of("name", "BOB"))).isEqualTo("<data><name>bob</name></data>");
        }

        @Test
        @DisplayName("a before-encode hook runs before omitEmpty is checked")
        void beforeOmitEmpty() {
            Processor processor = dictionary("data",
                    string("note").optional().omitEmpty().hooks(Hooks.beforeEncode((s, v) -> ((String) v).trim())));

            assertThat(XmlMapper.encodeToString(processor, Map.of("note", "   "))).isEqualTo("<data/>");
        }

        @Test
        @DisplayName("hooks never see defaults")
        void defaultsBypassHooks() {
            List<Object> seen = new ArrayList<>();
            Processor processor = dictionary("data",
                    integer("count").optional().defaultValue(0).hooks(Hooks.both((s, v) -> {
                        seen.add(v);
                        return v;
                    })));

            assertThat(XmlMapper.decode(processor, "<data/>")).isEqualTo(Map.of("count", 0));
            assertThat(XmlMapper.encodeToString(processor, Map.of())).isEqualTo("<data><count>0</count></data>");
            assertThat(seen).isEmpty();
        }

        @Test
        @DisplayName("an exception thrown by a hook is wrapped with its location")
        void foreignException() {
            Processor processor = dictionary("data",
                    integer("count").hooks(Hooks.afterDecode((s, v) -> {
                        throw new IllegalStateException("counter overflow");
                    })));

            assertThatThrownBy(() -> XmlMapper.decode(processor, "<data><count>1</count></data>"))
                    .isInstanceOf(HookFailureException.class)
                    .hasMessage("counter overflow at data/count")
                    .hasCauseInstanceOf(IllegalStateException.class);
        }
    }

    @Test
    @DisplayName("hooks see the location of the value being processed")
    void locations() {
        List<String> locations = new ArrayList<>();
        Hooks trace = Hooks.both((state, value) -> {
            locations.add(state.phase() + " " + state.location());
            return value;
        });
        Processor processor = dictionary("data", array(integer("value").hooks(trace), "values"));

        XmlMapper.decode(processor, "<data><values><value>1</value><value>2</value></values></data>");
        XmlMapper.encode(processor, Map.of("values", List.of(1, 2)));

        assertThat(locations).containsExactly(
                "DECODE data/values/value[0]",
                "DECODE data/values/value[1]",
                "ENCODE data/values/value[0]",
                "ENCODE data/values/value[1]");
    }
}
