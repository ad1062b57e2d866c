package foodweb.domain.compartment;

import foodweb.domain.ecosystem.SimulationContext;
import foodweb.physics.model.MetabolicRates;
import lombok.Builder;
import lombok.With;

/**
 * Especie heterótrofa: además del recurso compartido necesita un segundo recurso
 * (el compartimento consumido, C[c_i]). Esa parte de su captación se extrae del
 * reservorio de carbono.
 *
 * @param efficiency             Fracción de la captación retenida (ε).
 * @param halfSaturation         Semisaturación del recurso compartido (ks).
 * @param consumerHalfSaturation Semisaturación del segundo recurso (kc).
 * @param consumption            TPC de la tasa de consumo/crecimiento (μ).
 * @param respiration            TPC de la tasa de respiración (R).
 * @param mortalityRate          Pérdida lineal (D).
 * @param selfLimitation         Coeficiente de autolimitación cuadrática (a).
 */
@Builder
@With
public record Heterotroph(
        double efficiency,
        double halfSaturation,
        double consumerHalfSaturation,
        ThermalPerformance consumption,
        ThermalPerformance respiration,
        double mortalityRate,
        double selfLimitation
) implements LivingCompartment {

    public Heterotroph {
        LivingCompartment.requireFraction(efficiency, "efficiency");
        LivingCompartment.requireNonNegative(halfSaturation, "halfSaturation");
        LivingCompartment.requireNonNegative(consumerHalfSaturation, "consumerHalfSaturation");
        LivingCompartment.requireNonNegative(mortalityRate, "mortalityRate");
        LivingCompartment.requireNonNegative(selfLimitation, "selfLimitation");
        if (consumption == null || respiration == null) {
            throw new IllegalArgumentException("Las TPC de consumo y respiración son obligatorias");
        }
    }

    @Override
    public double grossUptake(SimulationContext context, double[] state, int index) {
        return state[index]
                * MetabolicRates.limitation(state[context.resourceIndex()], halfSaturation)
                * MetabolicRates.boltzmann(consumption, context.temperature())
                * MetabolicRates.limitation(state[context.consumerIndex()], consumerHalfSaturation);
    }
}
