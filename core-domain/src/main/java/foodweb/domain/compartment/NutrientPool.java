package foodweb.domain.compartment;

import foodweb.domain.ecosystem.Ecosystem;
import foodweb.domain.ecosystem.SimulationContext;

/**
 * Reservorio de nutrientes: reposición externa constante menos la captación
 * de todos los compartimentos vivos.
 *
 * @param supplyRate Tasa de reposición externa (R).
 */
public record NutrientPool(double supplyRate) implements Compartment {

    public NutrientPool {
        LivingCompartment.requireNonNegative(supplyRate, "supplyRate");
    }

    @Override
    public double flux(SimulationContext context, double[] state, int index) {
        double uptake = 0.0;
        Ecosystem ecosystem = context.ecosystem();

        // Los índices s_i / c_i se leen siempre del contexto.
        for (int j = 0; j < ecosystem.size(); j++) {
            if (context.isResourcePosition(j)) {
                continue;
            }
            if (ecosystem.get(j) instanceof LivingCompartment living) {
                uptake += living.nutrientOut(context, state, j);
            }
        }
        return supplyRate - uptake;
    }
}
