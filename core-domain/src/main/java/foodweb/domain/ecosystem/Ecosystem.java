package foodweb.domain.ecosystem;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import foodweb.domain.compartment.Compartment;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.OptionalInt;
import java.util.stream.IntStream;

/**
 * Colección ordenada e inmutable de compartimentos.
 * <p>
 * El orden de la lista define el orden del vector de estado: la posición {@code i}
 * del estado corresponde siempre a {@code get(i)}.
 */
@Getter
@EqualsAndHashCode
@ToString
public class Ecosystem {

    private final List<Compartment> compartments;

    @JsonCreator
    public Ecosystem(@JsonProperty("compartments") List<Compartment> compartments) {
        if (compartments == null || compartments.isEmpty()) {
            throw new IllegalArgumentException("El ecosistema necesita al menos un compartimento");
        }
        // List.copyOf rechaza elementos nulos
        this.compartments = List.copyOf(compartments);
    }

    public static Ecosystem of(Compartment... compartments) {
        return new Ecosystem(List.of(compartments));
    }

    /**
     * Número de compartimentos (N_sp).
     */
    @JsonIgnore
    public int size() {
        return compartments.size();
    }

    public Compartment get(int index) {
        return compartments.get(index);
    }

    public long count(Class<? extends Compartment> kind) {
        return compartments.stream().filter(kind::isInstance).count();
    }

    /**
     * Índice del primer compartimento del tipo indicado, si existe.
     */
    public OptionalInt indexOf(Class<? extends Compartment> kind) {
        return IntStream.range(0, compartments.size())
                .filter(i -> kind.isInstance(compartments.get(i)))
                .findFirst();
    }
}
