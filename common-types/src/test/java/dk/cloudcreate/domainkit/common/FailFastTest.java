package dk.cloudcreate.domainkit.common;

import org.junit.jupiter.api.Test;

import static dk.cloudcreate.domainkit.common.FailFast.*;
import static org.assertj.core.api.Assertions.*;

class FailFastTest {
    @Test
    void requireNonNull_returns_the_value() {
        var value = "value";
        assertThat(requireNonNull(value, "No value")).isSameAs(value);
    }

    @Test
    void requireNonNull_fails_with_the_supplied_message() {
        assertThatThrownBy(() -> requireNonNull(null, "No value provided"))
                .isExactlyInstanceOf(IllegalArgumentException.class)
                .hasMessage("No value provided");
    }

    @Test
    void requireTrue_and_requireFalse() {
        assertThat(requireTrue(true, "must be true")).isTrue();
        assertThat(requireFalse(false, "must be false")).isFalse();
        assertThatThrownBy(() -> requireTrue(false, "must be true"))
                .isExactlyInstanceOf(IllegalArgumentException.class)
                .hasMessage("must be true");
        assertThatThrownBy(() -> requireFalse(true, "must be false"))
                .isExactlyInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void requireNonBlank_rejects_whitespace() {
        assertThatThrownBy(() -> requireNonBlank("  ", "blank"))
                .isExactlyInstanceOf(IllegalArgumentException.class);
        assertThat(requireNonBlank("Orders", "blank")).isEqualTo("Orders");
    }

    @Test
    void requireMustBeInstanceOf_casts_or_fails() {
        Object value = 42L;
        Long   cast  = requireMustBeInstanceOf(value, Long.class);
        assertThat(cast).isEqualTo(42L);
        assertThatThrownBy(() -> requireMustBeInstanceOf(value, String.class))
                .isExactlyInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("java.lang.String");
    }
}
