package com.retryloop.core.backoff;

import com.retryloop.config.RetryLoopProperties;
import com.retryloop.core.spi.Backoff;
import com.retryloop.core.spi.BackoffProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackoffRegistryTest {

    private RetryLoopProperties props;

    @BeforeEach
    void setUp() {
        props = new RetryLoopProperties();
    }

    @Test
    @DisplayName("Should register the built-in strategies")
    void shouldRegisterBuiltIns() {
        BackoffRegistry registry = new BackoffRegistry(props);

        assertThat(registry.names()).contains("none", "fixed", "exponential", "random");
    }

    @Test
    @DisplayName("Should build built-in strategies from the backoff properties")
    void shouldCreateFromProperties() {
        props.getBackoff().setInterval(Duration.ofMillis(300));
        props.getBackoff().setInitial(Duration.ofMillis(200));
        props.getBackoff().setRandomizationFactor(0);
        props.getBackoff().setSeed(5L);
        BackoffRegistry registry = new BackoffRegistry(props);

        Backoff fixed = registry.factory("fixed").get();
        Backoff exponential = registry.factory("EXPONENTIAL").get();

        assertThat(fixed).isInstanceOf(FixedBackoff.class);
        assertThat(fixed.next()).isEqualTo(Duration.ofMillis(300));
        assertThat(exponential).isInstanceOf(ExponentialBackoff.class);
        assertThat(exponential.next()).isEqualTo(Duration.ofMillis(200));
    }

    @Test
    @DisplayName("Factory should create a fresh backoff for every call")
    void factoryShouldNotShareState() {
        props.getBackoff().setInitial(Duration.ofMillis(200));
        props.getBackoff().setRandomizationFactor(0);
        Supplier<Backoff> factory = new BackoffRegistry(props).factory("exponential");

        Backoff first = factory.get();
        first.next();
        first.next();
        Backoff second = factory.get();

        assertThat(second).isNotSameAs(first);
        assertThat(second.next()).isEqualTo(Duration.ofMillis(200));
    }

    @Test
    @DisplayName("Should resolve user providers through the spi: prefix")
    void shouldResolveSpiProvider() {
        BackoffProvider custom = BackoffProvider.of("linear", b -> SequenceBackoff.generate(() -> Duration.ofMillis(7)));
        BackoffRegistry registry = new BackoffRegistry(props, List.of(custom));

        assertThat(registry.resolve("spi:linear")).isSameAs(custom);
        assertThat(registry.resolve("linear")).isSameAs(custom);
        assertThat(registry.factory("spi:Linear").get().next()).isEqualTo(Duration.ofMillis(7));
    }

    @Test
    @DisplayName("Unknown or blank strategy should fall back to fixed")
    void shouldFallbackToFixed() {
        BackoffRegistry registry = new BackoffRegistry(props);

        assertThat(registry.resolve("spi:missing").name()).isEqualTo("fixed");
        assertThat(registry.resolve(null).name()).isEqualTo("fixed");
        assertThat(registry.resolve(" ").name()).isEqualTo("fixed");
    }

    @Test
    @DisplayName("Registered provider should override a built-in")
    void shouldOverrideBuiltIn() {
        BackoffRegistry registry = new BackoffRegistry(props)
                .registry("fixed", BackoffProvider.of("fixed", b -> Backoffs.fixed(Duration.ofSeconds(9))));

        assertThat(registry.defaultFactory().get().next()).isEqualTo(Duration.ofSeconds(9));
    }

    @Test
    @DisplayName("Should validate backoff properties eagerly")
    void shouldValidateProperties() {
        props.getBackoff().setRandomizationFactor(1.5);
        assertThatThrownBy(() -> new BackoffRegistry(props).afterPropertiesSet())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("randomization-factor");

        props.getBackoff().setRandomizationFactor(0.5);
        props.getBackoff().setMin(Duration.ofSeconds(10));
        props.getBackoff().setMax(Duration.ofSeconds(1));
        assertThatThrownBy(() -> new BackoffRegistry(props).afterPropertiesSet())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("max");

        props.getBackoff().setMin(Duration.ZERO);
        props.setMaxTries(-1);
        assertThatThrownBy(() -> new BackoffRegistry(props).afterPropertiesSet())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("max-tries");
    }
}
