package foodweb.domain.compartment;

import foodweb.domain.ecosystem.SimulationContext;
import foodweb.physics.model.MetabolicRates;
import lombok.Builder;
import lombok.With;

/**
 * Especie autótrofa: crece a partir de un único recurso limitante (el reservorio de nutrientes).
 * <p>
 * Ganancia: C[i] * ε * lim(C[s_i], ks) * B(P, T)<br>
 * Pérdida: C[i] * B(R, T) + C[i] * D + C[i]² * a
 *
 * @param efficiency     Fracción de la captación retenida (ε).
 * @param halfSaturation Constante de semisaturación del recurso compartido (ks).
 * @param photosynthesis TPC de la tasa fotosintética (P).
 * @param respiration    TPC de la tasa de respiración (R).
 * @param mortalityRate  Pérdida lineal (D).
 * @param selfLimitation Coeficiente de autolimitación cuadrática (a).
 */
@Builder
@With
public record Autotroph(
        double efficiency,
        double halfSaturation,
        ThermalPerformance photosynthesis,
        ThermalPerformance respiration,
        double mortalityRate,
        double selfLimitation
) implements LivingCompartment {

    public Autotroph {
        LivingCompartment.requireFraction(efficiency, "efficiency");
        LivingCompartment.requireNonNegative(halfSaturation, "halfSaturation");
        LivingCompartment.requireNonNegative(mortalityRate, "mortalityRate");
        LivingCompartment.requireNonNegative(selfLimitation, "selfLimitation");
        if (photosynthesis == null || respiration == null) {
            throw new IllegalArgumentException("Las TPC de fotosíntesis y respiración son obligatorias");
        }
    }

    @Override
    public double grossUptake(SimulationContext context, double[] state, int index) {
        return state[index]
                * MetabolicRates.limitation(state[context.resourceIndex()], halfSaturation)
                * MetabolicRates.boltzmann(photosynthesis, context.temperature());
    }
}
