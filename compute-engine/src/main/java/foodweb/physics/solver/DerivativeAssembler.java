package foodweb.physics.solver;

import foodweb.domain.ecosystem.Ecosystem;
import foodweb.domain.ecosystem.SimulationContext;
import lombok.Getter;
import org.apache.commons.math3.ode.FirstOrderDifferentialEquations;

/**
 * Ensambla el vector derivada del sistema completo: la entrada {@code i} es el
 * flujo neto del compartimento {@code i} del ecosistema.
 * <p>
 * Es la función que se entrega al integrador externo. No tiene estado mutable:
 * el integrador puede invocarla tantas veces y en el orden que quiera.
 */
public class DerivativeAssembler implements FirstOrderDifferentialEquations {

    @Getter
    private final SimulationContext context;

    public DerivativeAssembler(SimulationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("El contexto de simulación es obligatorio");
        }
        this.context = context;
    }

    /**
     * Nombre corto con el que la función aparece en los logs.
     */
    public String getName() {
        return "FoodWeb_dCdt";
    }

    /**
     * Calcula dC/dt para el estado dado.
     *
     * @param state Vector de estado (longitud N_sp). No se modifica.
     * @return Un nuevo vector con la derivada de cada compartimento.
     */
    public double[] derivative(double[] state) {
        double[] result = new double[getDimension()];
        fill(state, result);
        return result;
    }

    @Override
    public int getDimension() {
        return context.ecosystem().size();
    }

    @Override
    public void computeDerivatives(double t, double[] y, double[] yDot) {
        fill(y, yDot);
    }

    private void fill(double[] state, double[] out) {
        Ecosystem ecosystem = context.ecosystem();
        int n = ecosystem.size();
        if (state.length != n) {
            throw new IllegalArgumentException(
                    "Longitud del estado (" + state.length + ") distinta del número de compartimentos (" + n + ")");
        }
        for (int i = 0; i < n; i++) {
            out[i] = ecosystem.get(i).flux(context, state, i);
        }
    }
}
