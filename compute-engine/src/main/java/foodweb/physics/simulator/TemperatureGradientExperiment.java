package foodweb.physics.simulator;

import foodweb.domain.ecosystem.SimulationContext;
import foodweb.domain.simulation.Trajectory;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Experimento de gradiente térmico: una simulación independiente por temperatura.
 * <p>
 * Todas las ejecuciones comparten ecosistema, índices y condición inicial; sólo cambia
 * la temperatura del contexto. Como cada ejecución es independiente y el núcleo no tiene
 * estado compartido, pueden lanzarse en paralelo.
 */
@Slf4j
public class TemperatureGradientExperiment {

    private final FoodWebSimulator simulator;
    private final boolean useParallelExecution;

    public TemperatureGradientExperiment(FoodWebSimulator simulator) {
        this(simulator, false);
    }

    /**
     * @param simulator            Simulador usado en cada ejecución.
     * @param useParallelExecution Si es true, reparte las ejecuciones en el ForkJoinPool común.
     */
    public TemperatureGradientExperiment(FoodWebSimulator simulator, boolean useParallelExecution) {
        this.simulator = simulator;
        this.useParallelExecution = useParallelExecution;
    }

    /**
     * Ejecuta el experimento.
     *
     * @return Una ejecución por temperatura, en el mismo orden que {@code temperatures}.
     */
    public List<Run> run(SimulationContext baseContext, double[] temperatures, double[] initialState,
                         double start, double stop, double samplingInterval) {
        if (temperatures == null || temperatures.length == 0) {
            throw new IllegalArgumentException("El gradiente de temperaturas no puede estar vacío");
        }
        // Los contextos se construyen antes de lanzar nada: una temperatura inválida aborta el experimento entero
        SimulationContext[] contexts = Arrays.stream(temperatures)
                .mapToObj(baseContext::withTemperature)
                .toArray(SimulationContext[]::new);

        log.info("Experimento de gradiente térmico: {} temperaturas, paralelo={}", temperatures.length, useParallelExecution);

        IntStream indices = IntStream.range(0, contexts.length);
        if (useParallelExecution) {
            indices = indices.parallel();
        }
        // toList() sobre un stream ordenado conserva el orden de encuentro
        return indices
                .mapToObj(k -> new Run(temperatures[k],
                        simulator.simulate(contexts[k], initialState, start, stop, samplingInterval)))
                .toList();
    }

    /**
     * Resultado de una ejecución del experimento.
     *
     * @param temperature Temperatura absoluta de la ejecución (K).
     * @param trajectory  Trayectoria resuelta.
     */
    public record Run(double temperature, Trajectory trajectory) {
    }
}
