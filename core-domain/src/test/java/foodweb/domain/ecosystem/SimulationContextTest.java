package foodweb.domain.ecosystem;

import foodweb.domain.compartment.Autotroph;
import foodweb.domain.compartment.CarbonPool;
import foodweb.domain.compartment.NutrientPool;
import foodweb.domain.compartment.ThermalPerformance;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SimulationContextTest {

    private Ecosystem ecosystem;

    @BeforeEach
    void setUp() {
        ThermalPerformance rate = ThermalPerformance.constant(1.0, 293.0);
        ecosystem = Ecosystem.of(
                new Autotroph(0.5, 1.0, rate, rate, 0.01, 0.001),
                new CarbonPool(false),
                new NutrientPool(1.0));
    }

    @Test
    @DisplayName("Índices fuera de rango: se rechazan al construir el contexto")
    void constructor_withIndexOutOfBounds_shouldThrow() {
        assertThatThrownBy(() -> new SimulationContext(293.0, 3, 1, ecosystem))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("resourceIndex");
        assertThatThrownBy(() -> new SimulationContext(293.0, 2, -1, ecosystem))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("consumerIndex");
    }

    @Test
    @DisplayName("s_i == c_i: invariante violada")
    void constructor_withSameIndices_shouldThrow() {
        assertThatThrownBy(() -> new SimulationContext(293.0, 2, 2, ecosystem))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("distintos");
    }

    @Test
    @DisplayName("Temperatura: debe ser absoluta, finita y positiva")
    void constructor_withNonPositiveTemperature_shouldThrow() {
        assertThatThrownBy(() -> new SimulationContext(0.0, 2, 1, ecosystem))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SimulationContext(-5.0, 2, 1, ecosystem))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SimulationContext(Double.NaN, 2, 1, ecosystem))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Sin ecosistema no hay contexto")
    void constructor_withoutEcosystem_shouldThrow() {
        assertThatThrownBy(() -> new SimulationContext(293.0, 0, 1, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("withTemperature: devuelve una copia y deja intacto el original")
    void withTemperature_shouldReturnNewContext() {
        SimulationContext original = SimulationContext.builder()
                .temperature(293.0).resourceIndex(2).consumerIndex(1).ecosystem(ecosystem).build();

        SimulationContext warmer = original.withTemperature(303.0);

        assertThat(original.temperature()).isEqualTo(293.0);
        assertThat(warmer.temperature()).isEqualTo(303.0);
        assertThat(warmer.ecosystem()).isSameAs(ecosystem);
        assertThatThrownBy(() -> original.withTemperature(-1.0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("isResourcePosition: sólo s_i y c_i")
    void isResourcePosition_shouldMatchOnlyBothIndices() {
        SimulationContext context = new SimulationContext(293.0, 2, 1, ecosystem);

        assertThat(context.isResourcePosition(0)).isFalse();
        assertThat(context.isResourcePosition(1)).isTrue();
        assertThat(context.isResourcePosition(2)).isTrue();
    }
}
