package foodweb.physics.simulator;

import foodweb.config.SimulationConfig;
import foodweb.domain.compartment.CarbonPool;
import foodweb.domain.compartment.NutrientPool;
import foodweb.domain.ecosystem.Ecosystem;
import foodweb.domain.ecosystem.SimulationContext;
import foodweb.domain.simulation.Trajectory;
import foodweb.physics.solver.DerivativeAssembler;
import foodweb.physics.solver.OdeIntegratorFactory;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.exception.MathRuntimeException;
import org.apache.commons.math3.exception.MaxCountExceededException;
import org.apache.commons.math3.ode.FirstOrderDifferentialEquations;
import org.apache.commons.math3.ode.FirstOrderIntegrator;

import java.util.Arrays;

/**
 * Orquesta la simulación de la red trófica.
 * <p>
 * Valida las precondiciones, construye la malla de instantes de muestreo y delega
 * en el integrador externo, que avanza de muestra en muestra. Sólo se guardan los
 * estados en los instantes pedidos (sin salida densa).
 * <p>
 * Ante cualquier fallo se lanza una excepción: nunca se devuelve una trayectoria
 * truncada ni rellenada con ceros.
 */
@Slf4j
public class FoodWebSimulator {

    public static final double DEFAULT_SAMPLING_INTERVAL = 1.0;
    public static final double DEFAULT_STOP = 500.0;

    // Tolerancia relativa al intervalo para decidir si 'stop' cae en la malla
    private static final double GRID_TOLERANCE = 1.0e-9;

    // Margen bajo Integer.MAX_VALUE para el tamaño de los arrays de la trayectoria
    private static final long MAX_SAMPLE_INTERVALS = Integer.MAX_VALUE - 100L;

    @Getter
    private final SimulationConfig config;
    private final OdeIntegratorFactory integratorFactory;

    public FoodWebSimulator() {
        this(SimulationConfig.defaults());
    }

    public FoodWebSimulator(SimulationConfig config) {
        this(config, new OdeIntegratorFactory());
    }

    public FoodWebSimulator(SimulationConfig config, OdeIntegratorFactory integratorFactory) {
        if (config == null) {
            throw new IllegalArgumentException("La configuración de simulación es obligatoria");
        }
        this.config = config;
        this.integratorFactory = integratorFactory;
    }

    public Trajectory simulate(SimulationContext context, double[] initialState) {
        return simulate(context, initialState, 0.0, DEFAULT_STOP, DEFAULT_SAMPLING_INTERVAL);
    }

    public Trajectory simulate(SimulationContext context, double[] initialState, double start, double stop) {
        return simulate(context, initialState, start, stop, DEFAULT_SAMPLING_INTERVAL);
    }

    /**
     * Integra el sistema entre {@code start} y {@code stop}.
     *
     * @param context          Contexto de parámetros (solo lectura durante toda la integración).
     * @param initialState     Condición inicial. No se modifica.
     * @param start            Instante inicial.
     * @param stop             Instante final (debe ser > start).
     * @param samplingInterval Separación entre instantes de muestreo (debe ser > 0).
     * @return La trayectoria en los instantes start, start + Δ, ... hasta stop.
     * @throws IllegalArgumentException si alguna precondición no se cumple.
     * @throws IllegalStateException    si el sistema produce una derivada no finita. Los fallos propios del
     *                                  integrador (presupuesto agotado, paso demasiado pequeño) se propagan
     *                                  tal cual como excepciones de Commons Math. El presupuesto de
     *                                  evaluaciones de la configuración cubre la ejecución completa.
     */
    public Trajectory simulate(SimulationContext context, double[] initialState,
                               double start, double stop, double samplingInterval) {
        validate(context, initialState, start, stop, samplingInterval);

        double[] sampleTimes = buildSampleTimes(start, stop, samplingInterval);
        DerivativeAssembler assembler = new DerivativeAssembler(context);
        FirstOrderDifferentialEquations equations = new FiniteDerivativeGuard(assembler);
        FirstOrderIntegrator integrator = integratorFactory.create(config);

        log.info("Iniciando simulación {} con {}: {} compartimentos, T={} K, t=[{}, {}], {} muestras.",
                assembler.getName(), integrator.getName(), assembler.getDimension(),
                context.temperature(), start, stop, sampleTimes.length);

        long startMillis = System.currentTimeMillis();
        double[][] states = new double[sampleTimes.length][];
        states[0] = initialState.clone();

        int budget = config.getMaxEvaluations();
        long totalEvaluations = 0;
        double[] current = initialState.clone();
        for (int k = 1; k < sampleTimes.length; k++) {
            double[] next = new double[current.length];
            try {
                // El integrador reinicia su contador en cada tramo: se le pasa lo que queda del presupuesto
                long remaining = budget - totalEvaluations;
                if (remaining <= 0) {
                    throw new MaxCountExceededException(budget);
                }
                integrator.setMaxEvaluations((int) remaining);
                integrator.integrate(equations, sampleTimes[k - 1], current, sampleTimes[k], next);
            } catch (MathIllegalArgumentException | MathIllegalStateException | MathRuntimeException e) {
                log.error("El integrador falló en el tramo [{}, {}] ({} evaluaciones en tramos anteriores)",
                        sampleTimes[k - 1], sampleTimes[k], totalEvaluations, e);
                throw e;
            }
            totalEvaluations += integrator.getEvaluations();
            states[k] = next;
            current = next;
            log.debug("t={} -> {}", sampleTimes[k], Arrays.toString(next));
        }

        long elapsed = System.currentTimeMillis() - startMillis;
        log.info("Simulación completada en {} ms ({} evaluaciones de la derivada).",
                elapsed, totalEvaluations);
        return new Trajectory(sampleTimes, states, elapsed);
    }

    /**
     * Malla de instantes de muestreo: start, start + Δ, ... sin sobrepasar stop.
     */
    static double[] buildSampleTimes(double start, double stop, double samplingInterval) {
        int intervals = (int) countSampleIntervals(start, stop, samplingInterval);
        double[] times = new double[intervals + 1];
        for (int k = 0; k <= intervals; k++) {
            // Se calcula desde 'start' para no acumular error de redondeo
            times[k] = start + (k * samplingInterval);
        }
        return times;
    }

    private static long countSampleIntervals(double start, double stop, double samplingInterval) {
        return (long) Math.floor(((stop - start) / samplingInterval) + GRID_TOLERANCE);
    }

    private static void validate(SimulationContext context, double[] initialState,
                                 double start, double stop, double samplingInterval) {
        if (context == null) {
            throw new IllegalArgumentException("El contexto de simulación es obligatorio");
        }
        if (initialState == null) {
            throw new IllegalArgumentException("El estado inicial es obligatorio");
        }
        if (!(stop > start)) {
            throw new IllegalArgumentException("stop (" + stop + ") debe ser mayor que start (" + start + ")");
        }
        if (!(samplingInterval > 0)) {
            throw new IllegalArgumentException("El intervalo de muestreo debe ser > 0: " + samplingInterval);
        }
        // Validación de memoria: la trayectoria guarda un estado por instante de muestreo
        if (countSampleIntervals(start, stop, samplingInterval) > MAX_SAMPLE_INTERVALS) {
            throw new IllegalArgumentException("La simulación es demasiado larga para indexar en un array Java: "
                    + "t=[" + start + ", " + stop + "] con intervalo de muestreo " + samplingInterval);
        }

        Ecosystem ecosystem = context.ecosystem();
        if (initialState.length != ecosystem.size()) {
            throw new IllegalArgumentException("El estado inicial tiene " + initialState.length
                    + " valores pero el ecosistema tiene " + ecosystem.size() + " compartimentos");
        }
        long carbonPools = ecosystem.count(CarbonPool.class);
        if (carbonPools != 1) {
            throw new IllegalArgumentException(
                    "El ecosistema debe tener exactamente un reservorio de carbono, tiene " + carbonPools);
        }
        long nutrientPools = ecosystem.count(NutrientPool.class);
        if (nutrientPools != 1) {
            throw new IllegalArgumentException(
                    "El ecosistema debe tener exactamente un reservorio de nutrientes, tiene " + nutrientPools);
        }
    }

    /**
     * Envuelve la función derivada y corta la integración en cuanto aparece un valor no finito.
     * Los integradores adaptativos aceptan pasos con error NaN, así que la comprobación se hace aquí.
     */
    private static final class FiniteDerivativeGuard implements FirstOrderDifferentialEquations {

        private final DerivativeAssembler delegate;

        private FiniteDerivativeGuard(DerivativeAssembler delegate) {
            this.delegate = delegate;
        }

        @Override
        public int getDimension() {
            return delegate.getDimension();
        }

        @Override
        public void computeDerivatives(double t, double[] y, double[] yDot) {
            delegate.computeDerivatives(t, y, yDot);
            for (int i = 0; i < yDot.length; i++) {
                if (!Double.isFinite(yDot[i])) {
                    log.error("Derivada no finita en t={} para el compartimento {}: {}", t, i, yDot[i]);
                    throw new IllegalStateException("Derivada no finita en t=" + t + " para el compartimento "
                            + i + " (" + delegate.getContext().ecosystem().get(i).getClass().getSimpleName()
                            + "): " + yDot[i]);
                }
            }
        }
    }
}
