package foodweb.domain.simulation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;

import java.util.Arrays;
import java.util.Optional;

/**
 * Trayectoria resuelta: una secuencia ordenada de pares (tiempo, vector de estado)
 * en los instantes de muestreo solicitados.
 * <p>
 * Los arrays se copian en la entrada y en cada acceso; la instancia es inmutable.
 */
public class Trajectory {

    private final double[] times;
    private final double[][] states;

    /**
     * Tiempo de cálculo de la integración en milisegundos (métrica de rendimiento).
     */
    @Getter
    private final long simulationTime;

    @JsonCreator
    public Trajectory(@JsonProperty("times") double[] times,
                      @JsonProperty("states") double[][] states,
                      @JsonProperty("simulationTime") long simulationTime) {
        if (times == null || states == null || times.length != states.length) {
            throw new IllegalArgumentException("Cada instante de muestreo necesita exactamente un estado");
        }
        this.times = times.clone();
        this.states = new double[states.length][];
        for (int k = 0; k < states.length; k++) {
            this.states[k] = states[k].clone();
        }
        this.simulationTime = simulationTime;
    }

    @JsonIgnore
    public int getTimestepCount() {
        return times.length;
    }

    public double getTimeAt(int index) {
        return times[index];
    }

    public double[] getStateAt(int index) {
        return states[index].clone();
    }

    public double[] getTimes() {
        return times.clone();
    }

    public double[][] getStates() {
        double[][] copy = new double[states.length][];
        for (int k = 0; k < states.length; k++) {
            copy[k] = states[k].clone();
        }
        return copy;
    }

    /**
     * Serie temporal de un único compartimento.
     */
    public double[] getSeries(int compartmentIndex) {
        return Arrays.stream(states).mapToDouble(state -> state[compartmentIndex]).toArray();
    }

    /**
     * Helper para obtener el último estado (útil para encadenar simulaciones).
     */
    @JsonIgnore
    public Optional<double[]> getFinalState() {
        if (getTimestepCount() == 0) {
            return Optional.empty();
        }
        return Optional.of(getStateAt(getTimestepCount() - 1));
    }
}
