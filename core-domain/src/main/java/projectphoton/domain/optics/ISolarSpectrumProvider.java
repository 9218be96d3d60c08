package projectphoton.domain.optics;

/**
 * Fuente del espectro solar de referencia (p. ej. AM1.5G).
 * Solo se necesita para calcular la generación de excitones y Jsc.
 */
@FunctionalInterface
public interface ISolarSpectrumProvider {

    /**
     * Irradiancia espectral en cada longitud de onda pedida [mW·cm⁻²·nm⁻¹].
     */
    double[] lookupIrradiance(double[] wavelengths);
}
