package dk.cloudcreate.toggles.eventstore.postgresql.types;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class GenerationTest {
    @Test
    void test_first_generation_is_zero() {
        assertThat(Generation.first()).isEqualTo(Generation.of(0));
        assertThat(Generation.first().longValue()).isEqualTo(0L);
    }

    @Test
    void test_next_increments_by_one_without_changing_the_original() {
        // Given
        var generation = Generation.of(41);

        // When
        var next = generation.next();

        // Then
        assertThat(next).isEqualTo(Generation.of(42));
        assertThat(generation).isEqualTo(Generation.of(41));
    }

    @Test
    void test_plus_advances_the_requested_number_of_generations() {
        assertThat(Generation.first().plus(0)).isEqualTo(Generation.first());
        assertThat(Generation.first().plus(3)).isEqualTo(Generation.first().next().next().next());
    }

    @Test
    void test_negative_generations_are_rejected() {
        assertThatThrownBy(() -> Generation.of(-1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
