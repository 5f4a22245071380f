package io.xmldecl.core.model;

import static io.xmldecl.core.Processors.array;
import static io.xmldecl.core.Processors.dictionary;
import static io.xmldecl.core.Processors.integer;
import static io.xmldecl.core.Processors.namedTuple;
import static io.xmldecl.core.Processors.string;
import static io.xmldecl.core.Processors.userObject;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.xmldecl.core.error.InvalidRootProcessorException;
import io.xmldecl.core.error.XmlProcessingException.Phase;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Declaration-time checks and alias derivation. Nothing here touches a document. */
@DisplayName("Processor declarations")
class ProcessorDeclarationTest {

    static class Book {
        String title;
        Integer year;
    }

    record Point(double x, double y) {}

    @Nested
    @DisplayName("alias derivation")
    class Aliases {

        @Test
        @DisplayName("defaults to the last path segment")
        void lastSegment() {
            assertThat(integer("location/coordinates/lat").alias()).isEqualTo("lat");
            assertThat(dictionary("author").alias()).isEqualTo("author");
        }

        @Test
        @DisplayName("attribute name wins over the element name")
        void attribute() {
            assertThat(string("file", "name").alias()).isEqualTo("name");
            assertThat(string(".", "id").alias()).isEqualTo("id");
        }

        @Test
        @DisplayName("explicit alias wins over everything")
        void explicit() {
            assertThat(string("file", "name").alias("fileName").alias()).isEqualTo("fileName");
        }

        @Test
        @DisplayName("arrays use the nested container, then the item alias")
        void arrays() {
            assertThat(array(string("book"), "books").alias()).isEqualTo("books");
            assertThat(array(string("book")).alias()).isEqualTo("book");
            assertThat(array(string("book")).alias("titles").alias()).isEqualTo("titles");
        }

        @Test
        @DisplayName("'.' without attribute or alias cannot derive an alias")
        void selfNeedsAlias() {
            assertThatThrownBy(() -> string(".").alias())
                    .isInstanceOf(InvalidRootProcessorException.class)
                    .hasMessageContaining("explicit alias");
            assertThatThrownBy(() -> dictionary("root", dictionary(".", integer("x"))))
                    .isInstanceOf(InvalidRootProcessorException.class);
            assertThat(dictionary("root", string(".").alias("text")).children()).hasSize(1);
        }

        @Test
        @DisplayName("sibling aliases must be unique")
        void duplicateAliases() {
            assertThatThrownBy(() -> dictionary("point", integer("x"), integer("other/x")))
                    .isInstanceOf(InvalidRootProcessorException.class)
                    .hasMessageContaining("Duplicate alias 'x'");
        }
    }

    @Nested
    @DisplayName("settings")
    class Settings {

        @Test
        @DisplayName("processors start out required without default or hooks")
        void defaults() {
            Processor processor = integer("age");

            assertThat(processor.required()).isTrue();
            assertThat(processor.settings().defaultValue()).isNull();
            assertThat(processor.settings().omitEmpty()).isFalse();
            assertThat(processor.hooks()).isEqualTo(Hooks.none());
        }

        @Test
        @DisplayName("fluent methods return copies and never change the receiver")
        void fluentCopies() {
            PrimitiveProcessor original = integer("age");
            Processor changed = original.optional().defaultValue(7).omitEmpty();

            assertThat(original.required()).isTrue();
            assertThat(changed.required()).isFalse();
            assertThat(changed.settings().defaultValue()).isEqualTo(7);
            assertThat(changed.settings().omitEmpty()).isTrue();
            assertThat(changed).isInstanceOf(PrimitiveProcessor.class);
        }

        @Test
        @DisplayName("omitEmpty on a required processor is a declaration error")
        void omitEmptyNeedsOptional() {
            assertThatThrownBy(() -> integer("value").omitEmpty())
                    .isInstanceOf(InvalidRootProcessorException.class)
                    .satisfies(e -> assertThat(((InvalidRootProcessorException) e).phase())
                            .isEqualTo(Phase.DECLARATION));
        }

        @Test
        @DisplayName("array required follows the item processor")
        void arrayRequired() {
            assertThat(array(integer("value")).required()).isTrue();
            assertThat(array(integer("value").optional()).required()).isFalse();
            assertThat(array(integer("value"), "values").optional().required()).isFalse();
        }
    }

    @Nested
    @DisplayName("arrays")
    class Arrays {

        @Test
        @DisplayName("items must name an element")
        void itemNeedsElement() {
            assertThatThrownBy(() -> array(string(".", "id")))
                    .isInstanceOf(InvalidRootProcessorException.class)
                    .hasMessageContaining("must name an element");
        }

        @Test
        @DisplayName("an embedded array cannot be an item")
        void noEmbeddedItems() {
            assertThatThrownBy(() -> array(array(integer("value"))))
                    .isInstanceOf(InvalidRootProcessorException.class);
        }

        @Test
        @DisplayName("a nested array can be an item")
        void nestedItems() {
            ArrayProcessor grid = array(array(integer("cell"), "row"), "grid");

            assertThat(grid.item()).isInstanceOf(ArrayProcessor.class);
            assertThat(grid.path().names()).containsExactly("grid");
        }

        @Test
        @DisplayName("a nested container cannot be '.'")
        void nestedNotSelf() {
            assertThatThrownBy(() -> array(integer("value"), "."))
                    .isInstanceOf(InvalidRootProcessorException.class);
        }
    }

    @Nested
    @DisplayName("object processors")
    class Objects {

        @Test
        @DisplayName("user objects reject children without a matching field")
        void unknownField() {
            assertThatThrownBy(() -> userObject("book", Book.class, string("title"), string("author")))
                    .isInstanceOf(InvalidRootProcessorException.class)
                    .hasMessageContaining("no field 'author'");
        }

        @Test
        @DisplayName("user objects need a no-argument constructor")
        void noArgConstructor() {
            assertThatThrownBy(() -> userObject("point", Point.class, integer("x")))
                    .isInstanceOf(InvalidRootProcessorException.class)
                    .hasMessageContaining("no-argument constructor");
        }

        @Test
        @DisplayName("a null binding is a declaration error")
        void nullBinding() {
            assertThatThrownBy(() -> userObject("book", (ObjectBinding<Book>) null, string("title")))
                    .isInstanceOf(InvalidRootProcessorException.class);
        }

        @Test
        @DisplayName("named tuples reject children that are not record components")
        void unknownComponent() {
            assertThatThrownBy(() -> namedTuple("point", Point.class, integer("x"), integer("z")))
                    .isInstanceOf(InvalidRootProcessorException.class)
                    .hasMessageContaining("no component 'z'");
        }

        @Test
        @DisplayName("named tuples need a record type")
        @SuppressWarnings({"unchecked", "rawtypes"})
        void recordOnly() {
            assertThatThrownBy(() -> TupleBinding.of((Class) Book.class))
                    .isInstanceOf(InvalidRootProcessorException.class)
                    .hasMessageContaining("must be a record class");
        }
    }
}
