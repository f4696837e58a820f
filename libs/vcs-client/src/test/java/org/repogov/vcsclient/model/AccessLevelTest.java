package org.repogov.vcsclient.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("AccessLevel")
class AccessLevelTest {

    @Test
    @DisplayName("should map raw values to labels")
    void shouldMapRawValues() {
        assertThat(AccessLevel.fromValue(30)).isEqualTo(AccessLevel.DEVELOPER);
        assertThat(AccessLevel.fromValue(30).getLabel()).isEqualTo("developer");
        assertThat(AccessLevel.fromValue(50).getLabel()).isEqualTo("owner");
        assertThat(AccessLevel.fromValue(0)).isEqualTo(AccessLevel.NO_ACCESS);
    }

    @ParameterizedTest
    @ValueSource(ints = {-1, 15, 60})
    @DisplayName("should fail loudly on unknown values")
    void shouldRejectUnknownValues(int value) {
        assertThatThrownBy(() -> AccessLevel.fromValue(value))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(String.valueOf(value));
    }
}
