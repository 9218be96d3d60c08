package projectphoton.physics.solver;

import projectphoton.physics.matrix.TransferMatrix;

import java.util.Objects;

/**
 * Matrices parciales de un apilamiento en una longitud de onda.
 * <p>
 * Para cada capa m = 1..N-1 (base 0): {@code S'_m} compone el sistema desde la interfaz
 * con el superestrato hasta la interfaz de entrada a la capa m, y {@code S''_m} desde la
 * interfaz de salida de la capa m hasta el medio final. Para la capa de salida S' es la
 * matriz del sistema completo y S'' la identidad.
 * <p>
 * S'' de las capas interiores incluye la propagación por el espesor declarado de la capa de
 * salida. Es un factor diagonal que se cancela entre numerador y denominador del campo.
 */
public final class PartialMatrices {

    private final TransferMatrix[] prime;
    private final TransferMatrix[] doublePrime;

    /**
     * @param prime       Array de longitud N con S' de cada capa (la posición 0 se ignora).
     * @param doublePrime Array de longitud N con S'' de cada capa (la posición 0 se ignora).
     */
    public PartialMatrices(TransferMatrix[] prime, TransferMatrix[] doublePrime) {
        Objects.requireNonNull(prime, "Las matrices S' no pueden ser nulas.");
        Objects.requireNonNull(doublePrime, "Las matrices S'' no pueden ser nulas.");
        if (prime.length != doublePrime.length || prime.length < 2) {
            throw new IllegalArgumentException("S' y S'' deben cubrir las mismas capas (al menos dos).");
        }
        this.prime = prime.clone();
        this.doublePrime = doublePrime.clone();
    }

    public int getLayerCount() {
        return prime.length;
    }

    public TransferMatrix getPrime(int layer) {
        validateLayer(layer);
        return prime[layer];
    }

    public TransferMatrix getDoublePrime(int layer) {
        validateLayer(layer);
        return doublePrime[layer];
    }

    /**
     * Matriz del sistema completo S (= S' de la capa de salida).
     */
    public TransferMatrix getSystemMatrix() {
        return prime[prime.length - 1];
    }

    private void validateLayer(int layer) {
        if (layer < 1 || layer >= prime.length) {
            throw new IndexOutOfBoundsException("Solo hay matrices parciales para las capas 1.." + (prime.length - 1) + ", se pidió " + layer);
        }
    }
}
