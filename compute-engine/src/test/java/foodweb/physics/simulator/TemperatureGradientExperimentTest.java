package foodweb.physics.simulator;

import foodweb.domain.compartment.Autotroph;
import foodweb.domain.compartment.CarbonPool;
import foodweb.domain.compartment.Heterotroph;
import foodweb.domain.compartment.NutrientPool;
import foodweb.domain.compartment.ThermalPerformance;
import foodweb.domain.ecosystem.Ecosystem;
import foodweb.domain.ecosystem.SimulationContext;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

@Slf4j
class TemperatureGradientExperimentTest {

    private static final double TR = 293.15;
    private static final double[] GRADIENT = {283.15, 288.15, 293.15, 298.15, 303.15};

    private SimulationContext baseContext;
    private double[] initialState;

    @BeforeEach
    void setUp() {
        // Red completa: autótrofo + heterótrofo, reservorios enlazados
        Autotroph algae = new Autotroph(0.6, 1.0,
                new ThermalPerformance(1.0, 0.32, TR),
                new ThermalPerformance(0.1, 0.65, TR), 0.02, 0.01);
        Heterotroph bacteria = new Heterotroph(0.3, 1.0, 2.0,
                new ThermalPerformance(0.8, 0.65, TR),
                new ThermalPerformance(0.2, 0.65, TR), 0.03, 0.01);
        Ecosystem ecosystem = Ecosystem.of(algae, bacteria, new CarbonPool(true), new NutrientPool(0.5));

        baseContext = new SimulationContext(TR, 3, 2, ecosystem);
        initialState = new double[]{1.0, 0.5, 1.0, 4.0};
    }

    @Test
    @DisplayName("Una ejecución por temperatura, en el orden del gradiente")
    void run_shouldProduceOneRunPerTemperatureInOrder() {
        TemperatureGradientExperiment experiment = new TemperatureGradientExperiment(new FoodWebSimulator());

        List<TemperatureGradientExperiment.Run> runs = experiment.run(baseContext, GRADIENT, initialState, 0, 20, 1);

        assertThat(runs).hasSize(GRADIENT.length);
        for (int k = 0; k < GRADIENT.length; k++) {
            assertThat(runs.get(k).temperature()).isEqualTo(GRADIENT[k]);
            assertThat(runs.get(k).trajectory().getTimestepCount()).isEqualTo(21);
            log.info("T={} K -> biomasa final autótrofo={}", GRADIENT[k],
                    runs.get(k).trajectory().getFinalState().orElseThrow()[0]);
        }
    }

    @Test
    @DisplayName("Paralelo y secuencial producen exactamente las mismas trayectorias")
    void run_parallel_shouldMatchSequential() {
        FoodWebSimulator simulator = new FoodWebSimulator();
        List<TemperatureGradientExperiment.Run> sequential =
                new TemperatureGradientExperiment(simulator, false).run(baseContext, GRADIENT, initialState, 0, 10, 1);
        List<TemperatureGradientExperiment.Run> parallel =
                new TemperatureGradientExperiment(simulator, true).run(baseContext, GRADIENT, initialState, 0, 10, 1);

        for (int k = 0; k < GRADIENT.length; k++) {
            assertThat(parallel.get(k).temperature()).isEqualTo(sequential.get(k).temperature());
            assertArrayEquals(sequential.get(k).trajectory().getFinalState().orElseThrow(),
                    parallel.get(k).trajectory().getFinalState().orElseThrow());
        }
    }

    @Test
    @DisplayName("Con E > 0 el reservorio de nutrientes se agota antes cuanto más calor hace")
    void run_warmerTemperatures_shouldDrawNutrientsFaster() {
        TemperatureGradientExperiment experiment = new TemperatureGradientExperiment(new FoodWebSimulator());

        List<TemperatureGradientExperiment.Run> runs = experiment.run(
                baseContext, new double[]{283.15, 303.15}, initialState, 0, 1, 1);

        double coldNutrient = runs.get(0).trajectory().getStateAt(1)[3];
        double warmNutrient = runs.get(1).trajectory().getStateAt(1)[3];
        assertThat(warmNutrient).isLessThan(coldNutrient);
    }

    @Test
    @DisplayName("Gradiente vacío o temperatura inválida: falla antes de simular nada")
    void run_withInvalidGradient_shouldFailBeforeSimulating() {
        FoodWebSimulator simulator = mock(FoodWebSimulator.class);
        TemperatureGradientExperiment experiment = new TemperatureGradientExperiment(simulator);

        assertThatThrownBy(() -> experiment.run(baseContext, new double[0], initialState, 0, 10, 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> experiment.run(baseContext, new double[]{293.15, -4.0}, initialState, 0, 10, 1))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(simulator);
    }
}
