package foodweb.domain.compartment;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import foodweb.domain.ecosystem.SimulationContext;

/**
 * Nodo de la red trófica (especie o reservorio) cuya concentración evoluciona en el tiempo.
 * <p>
 * El conjunto de variantes es cerrado: {@link Autotroph}, {@link Heterotroph},
 * {@link CarbonPool} y {@link NutrientPool}. Cada una aporta su propia regla de flujo.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Autotroph.class, name = "autotroph"),
        @JsonSubTypes.Type(value = Heterotroph.class, name = "heterotroph"),
        @JsonSubTypes.Type(value = CarbonPool.class, name = "carbonPool"),
        @JsonSubTypes.Type(value = NutrientPool.class, name = "nutrientPool")
})
public interface Compartment {

    /**
     * Flujo neto instantáneo (ganancia - pérdida) del compartimento.
     *
     * @param context Contexto de parámetros (temperatura, índices de recurso y ecosistema).
     * @param state   Vector de estado completo del sistema. No se modifica.
     * @param index   Posición de este compartimento dentro del vector de estado.
     * @return dC[index]/dt
     */
    double flux(SimulationContext context, double[] state, int index);
}
