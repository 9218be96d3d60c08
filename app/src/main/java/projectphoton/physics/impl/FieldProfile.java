package projectphoton.physics.impl;

/**
 * Campo eléctrico complejo normalizado en los puntos de la rejilla para una longitud de onda.
 * Los arrays se usan tal cual, sin copiar.
 */
public record FieldProfile(double[] real, double[] imag) {

    public FieldProfile {
        if (real.length != imag.length) {
            throw new IllegalArgumentException("Parte real e imaginaria deben tener la misma longitud.");
        }
    }

    public int size() {
        return real.length;
    }

    /**
     * |E|² en cada punto.
     */
    public double[] intensity() {
        double[] out = new double[real.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = real[i] * real[i] + imag[i] * imag[i];
        }
        return out;
    }
}
