package foodweb.config;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

/**
 * Configuración del integrador externo utilizado por el simulador.
 * Agrupa el algoritmo elegido con sus límites de paso, tolerancias y presupuesto de evaluaciones.
 */
@Value
@Builder
@With
@Jacksonized
public class SimulationConfig {

    /**
     * Algoritmo de integración.
     */
    @Builder.Default
    IntegratorType integratorType = IntegratorType.DORMAND_PRINCE_54;

    /**
     * Paso interno máximo. En el integrador de paso fijo es el propio paso.
     */
    @Builder.Default
    double maxStepSize = 1.0;

    /**
     * Paso interno mínimo de los integradores adaptativos.
     */
    @Builder.Default
    double minStepSize = 1.0e-8;

    @Builder.Default
    double absoluteTolerance = 1.0e-8;

    @Builder.Default
    double relativeTolerance = 1.0e-8;

    /**
     * Número máximo de evaluaciones de la función derivada por tramo de integración.
     */
    @Builder.Default
    int maxEvaluations = Integer.MAX_VALUE;

    public static SimulationConfig defaults() {
        return SimulationConfig.builder().build();
    }

    /**
     * Algoritmos de integración disponibles.
     */
    public enum IntegratorType {
        /**
         * Runge-Kutta embebido 5(4) con control de paso adaptativo (Default).
         */
        DORMAND_PRINCE_54,

        /**
         * Runge-Kutta embebido 8(5,3). Más caro por paso, más preciso en problemas suaves.
         */
        DORMAND_PRINCE_853,

        /**
         * Runge-Kutta clásico de 4º orden con paso fijo = maxStepSize.
         */
        CLASSICAL_RUNGE_KUTTA
    }
}
