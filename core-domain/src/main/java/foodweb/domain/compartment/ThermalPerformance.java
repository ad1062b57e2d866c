package foodweb.domain.compartment;

import lombok.Builder;
import lombok.With;

/**
 * Curva de rendimiento térmico (TPC) de una tasa metabólica.
 *
 * @param b0                   Tasa a la temperatura de referencia.
 * @param activationEnergy     Energía de activación E en eV.
 * @param referenceTemperature Temperatura de referencia Tr en Kelvin.
 */
@Builder
@With
public record ThermalPerformance(
        double b0,
        double activationEnergy,
        double referenceTemperature
) {
    public ThermalPerformance {
        if (b0 < 0) {
            throw new IllegalArgumentException("B0 no puede ser negativa: " + b0);
        }
        if (!(referenceTemperature > 0)) {
            throw new IllegalArgumentException("La temperatura de referencia debe ser > 0 K: " + referenceTemperature);
        }
    }

    /**
     * TPC independiente de la temperatura (E = 0): siempre devuelve {@code rate}.
     */
    public static ThermalPerformance constant(double rate, double referenceTemperature) {
        return new ThermalPerformance(rate, 0.0, referenceTemperature);
    }
}
