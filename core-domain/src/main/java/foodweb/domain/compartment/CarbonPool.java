package foodweb.domain.compartment;

import foodweb.domain.ecosystem.Ecosystem;
import foodweb.domain.ecosystem.SimulationContext;

/**
 * Reservorio de carbono compartido.
 * <p>
 * Recibe el carbono no retenido y la mortalidad de todos los compartimentos vivos
 * y cede a los heterótrofos la parte de su captación que procede del carbono.
 * Si no está enlazado a la red su flujo es idénticamente 0.
 *
 * @param linked Indica si el reservorio participa en la red trófica.
 */
public record CarbonPool(boolean linked) implements Compartment {

    @Override
    public double flux(SimulationContext context, double[] state, int index) {
        if (!linked) {
            return 0.0;
        }

        double gain = 0.0;
        double loss = 0.0;
        Ecosystem ecosystem = context.ecosystem();

        for (int j = 0; j < ecosystem.size(); j++) {
            if (context.isResourcePosition(j)) {
                continue;
            }
            if (ecosystem.get(j) instanceof LivingCompartment living) {
                gain += living.carbonOut(context, state, j);
                // Captación heterótrofa procedente del reservorio
                if (living instanceof Heterotroph heterotroph) {
                    loss += heterotroph.grossUptake(context, state, j);
                }
            }
        }
        return gain - loss;
    }
}
