package foodweb.domain.ecosystem;

import lombok.Builder;
import lombok.With;

/**
 * Contexto de parámetros de solo lectura que recibe cada cálculo de flujo.
 * <p>
 * Los índices se validan aquí una única vez, no en cada acceso desde los bucles
 * de agregación de los reservorios.
 *
 * @param temperature   Temperatura absoluta en Kelvin.
 * @param resourceIndex Índice del recurso compartido (s_i), normalmente el reservorio de nutrientes.
 * @param consumerIndex Índice del segundo recurso de los heterótrofos (c_i), normalmente el reservorio de carbono.
 * @param ecosystem     Ecosistema simulado.
 */
@Builder
@With
public record SimulationContext(
        double temperature,
        int resourceIndex,
        int consumerIndex,
        Ecosystem ecosystem
) {
    public SimulationContext {
        if (ecosystem == null) {
            throw new IllegalArgumentException("El contexto necesita un ecosistema");
        }
        if (!Double.isFinite(temperature) || temperature <= 0) {
            throw new IllegalArgumentException("La temperatura debe ser absoluta (K) y > 0: " + temperature);
        }
        checkIndex(resourceIndex, "resourceIndex", ecosystem.size());
        checkIndex(consumerIndex, "consumerIndex", ecosystem.size());
        if (resourceIndex == consumerIndex) {
            throw new IllegalArgumentException(
                    "resourceIndex y consumerIndex deben ser distintos (ambos = " + resourceIndex + ")");
        }
    }

    /**
     * Indica si {@code index} es una de las posiciones de recurso (s_i o c_i),
     * excluidas de las agregaciones de los reservorios.
     */
    public boolean isResourcePosition(int index) {
        return index == resourceIndex || index == consumerIndex;
    }

    private static void checkIndex(int index, String name, int size) {
        if (index < 0 || index >= size) {
            throw new IllegalArgumentException(
                    name + " fuera de rango: " + index + " (compartimentos: " + size + ")");
        }
    }
}
