package io.kyhttp.json.spi;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class JsonCodecsTest {

    @Test
    void discoverReturnsEmptyWithoutProviders() {
        assertThat(JsonCodecs.discover(JsonCodecsTest.class.getClassLoader())).isEmpty();
    }
}
