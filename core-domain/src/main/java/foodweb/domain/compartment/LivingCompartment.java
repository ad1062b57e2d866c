package foodweb.domain.compartment;

import foodweb.domain.ecosystem.SimulationContext;
import foodweb.physics.model.MetabolicRates;

/**
 * Compartimento vivo (autótrofo o heterótrofo).
 * <p>
 * Toda la contabilidad del compartimento se deriva de la captación bruta
 * ({@link #grossUptake}): la especie retiene la fracción ε y devuelve al
 * reservorio de carbono la fracción (1 - ε) más su mortalidad. Las funciones de
 * exportación que usan los reservorios son así, por construcción, el reflejo
 * exacto del término de ganancia de {@link #flux}.
 */
public interface LivingCompartment extends Compartment {

    /**
     * Fracción de la captación retenida como biomasa (ε).
     */
    double efficiency();

    /**
     * Tasa de respiración dependiente de la temperatura.
     */
    ThermalPerformance respiration();

    /**
     * Pérdida lineal independiente de la densidad (D).
     */
    double mortalityRate();

    /**
     * Coeficiente de autolimitación dependiente de la densidad (a).
     */
    double selfLimitation();

    /**
     * Captación bruta del recurso compartido por el compartimento situado en {@code index}.
     */
    double grossUptake(SimulationContext context, double[] state, int index);

    @Override
    default double flux(SimulationContext context, double[] state, int index) {
        double biomass = state[index];
        double gain = efficiency() * grossUptake(context, state, index);
        double loss = (biomass * MetabolicRates.boltzmann(respiration(), context.temperature()))
                + (biomass * mortalityRate())
                + (biomass * biomass * selfLimitation());
        return gain - loss;
    }

    /**
     * Carbono que entra al reservorio de carbono desde este compartimento:
     * captación no retenida más mortalidad.
     */
    default double carbonOut(SimulationContext context, double[] state, int index) {
        return ((1.0 - efficiency()) * grossUptake(context, state, index))
                + (state[index] * mortalityRate());
    }

    /**
     * Nutriente que sale del reservorio de nutrientes hacia este compartimento.
     * Independiente de la eficiencia de retención.
     */
    default double nutrientOut(SimulationContext context, double[] state, int index) {
        return grossUptake(context, state, index);
    }

    static void requireNonNegative(double value, String name) {
        if (!(value >= 0)) {
            throw new IllegalArgumentException(name + " debe ser >= 0, recibido: " + value);
        }
    }

    static void requireFraction(double value, String name) {
        if (!(value >= 0 && value <= 1)) {
            throw new IllegalArgumentException(name + " debe estar en [0, 1], recibido: " + value);
        }
    }
}
