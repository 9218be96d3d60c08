package projectphoton.domain.simulation;

import lombok.Getter;

import java.util.Objects;

/**
 * Tasa de generación de excitones G(x) [s⁻¹·cm⁻³] en los puntos de la capa activa,
 * integrada sobre el espectro solar.
 */
public final class GenerationProfile {

    @Getter
    private final int activeLayer;
    private final double[] positions;
    private final double[] rates;

    public GenerationProfile(int activeLayer, double[] positions, double[] rates) {
        Objects.requireNonNull(positions, "Las posiciones no pueden ser nulas.");
        Objects.requireNonNull(rates, "Las tasas de generación no pueden ser nulas.");
        if (positions.length != rates.length) {
            throw new IllegalArgumentException("Posiciones y tasas de generación deben tener la misma longitud.");
        }
        this.activeLayer = activeLayer;
        this.positions = positions.clone();
        this.rates = rates.clone();
    }

    public int size() {
        return rates.length;
    }

    public double[] clonePositions() {
        return positions.clone();
    }

    public double[] cloneRates() {
        return rates.clone();
    }
}
