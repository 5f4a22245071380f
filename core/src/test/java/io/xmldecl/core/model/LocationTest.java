package io.xmldecl.core.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Location")
class LocationTest {

    @Test
    @DisplayName("root is empty and renders as the empty string")
    void root() {
        assertThat(Location.root().isEmpty()).isTrue();
        assertThat(Location.root()).hasToString("");
    }

    @Test
    @DisplayName("descending renders slash-joined segments with indexed items")
    void descend() {
        Location location = Location.root()
                .descend(List.of("genre-authors", "authors"))
                .item("author", 1)
                .item("book", 0)
                .child("year-published");

        assertThat(location).hasToString("genre-authors/authors/author[1]/book[0]/year-published");
        assertThat(location.segments()).hasSize(5);
    }

    @Test
    @DisplayName("descending never changes the original")
    void immutable() {
        Location parent = Location.root().child("data");
        Location child = parent.child("user");

        assertThat(parent).hasToString("data");
        assertThat(child).hasToString("data/user");
        assertThat(parent.descend(List.of())).isEqualTo(parent);
    }
}
