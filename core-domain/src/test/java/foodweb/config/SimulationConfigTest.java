package foodweb.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SimulationConfigTest {

    @Test
    @DisplayName("Valores por defecto: Dormand-Prince 5(4) con paso máximo 1")
    void defaults_shouldMatchStandardSolverSetup() {
        SimulationConfig config = SimulationConfig.defaults();

        assertThat(config.getIntegratorType()).isEqualTo(SimulationConfig.IntegratorType.DORMAND_PRINCE_54);
        assertThat(config.getMaxStepSize()).isEqualTo(1.0);
        assertThat(config.getMaxEvaluations()).isEqualTo(Integer.MAX_VALUE);
        assertThat(config.getAbsoluteTolerance()).isPositive();
        assertThat(config.getRelativeTolerance()).isPositive();
    }

    @Test
    @DisplayName("with*: crea una copia modificada sin tocar la original")
    void with_shouldCopy() {
        SimulationConfig base = SimulationConfig.defaults();

        SimulationConfig fixedStep = base
                .withIntegratorType(SimulationConfig.IntegratorType.CLASSICAL_RUNGE_KUTTA)
                .withMaxStepSize(0.1);

        assertThat(base.getMaxStepSize()).isEqualTo(1.0);
        assertThat(fixedStep.getMaxStepSize()).isEqualTo(0.1);
        assertThat(fixedStep.getMinStepSize()).isEqualTo(base.getMinStepSize());
    }
}
