package foodweb.physics.model;

import foodweb.domain.compartment.ThermalPerformance;

/**
 * Leyes de velocidad compartidas por todos los compartimentos de la red trófica.
 * <p>
 * Agrupa las dos funciones "hoja" del modelo de flujos:
 * <ul>
 * <li><b>Respuesta térmica:</b> escalado exponencial tipo Boltzmann-Arrhenius de una tasa de referencia.</li>
 * <li><b>Limitación por recurso:</b> cinética de Michaelis-Menten, saturante en [0, 1).</li>
 * </ul>
 * Ninguna de las dos protege su dominio: una temperatura no positiva o una pareja
 * (N = 0, kN = 0) producen valores no finitos que el integrador debe detectar.
 */
public final class MetabolicRates {

    /**
     * Constante de Boltzmann en eV/K. Las energías de activación de las TPC se expresan en eV.
     */
    public static final double BOLTZMANN_CONSTANT = 8.617e-5;

    private MetabolicRates() {
    }

    /**
     * Tasa metabólica a la temperatura absoluta indicada.
     * <p>
     * Fórmula: B(T) = B0 * exp((-E/k) * (1/T - 1/Tr)). Con T = Tr devuelve exactamente B0.
     *
     * @param tpc         Parámetros de la curva de rendimiento térmico.
     * @param temperature Temperatura absoluta en Kelvin (debe ser > 0).
     * @return La tasa corregida por temperatura.
     */
    public static double boltzmann(ThermalPerformance tpc, double temperature) {
        return tpc.b0() * Math.exp((-tpc.activationEnergy() / BOLTZMANN_CONSTANT)
                * ((1.0 / temperature) - (1.0 / tpc.referenceTemperature())));
    }

    /**
     * Término limitante de Michaelis-Menten: N / (N + kN).
     *
     * @param concentration  Concentración del recurso (N >= 0).
     * @param halfSaturation Constante de semisaturación (kN > 0).
     * @return Un factor en [0, 1). Exactamente 0 si N = 0.
     */
    public static double limitation(double concentration, double halfSaturation) {
        return concentration / (concentration + halfSaturation);
    }
}
