package projectphoton.physics.solver;

/**
 * Resultado del sistema de matrices para una longitud de onda.
 *
 * @param wavelength             Longitud de onda [nm].
 * @param substrateReflectance   Reflectancia incoherente aire/sustrato.
 * @param substrateTransmittance Transmitancia incoherente aire/sustrato.
 * @param coherentReflectance    Reflectancia coherente del apilamiento, |S21/S11|².
 * @param fieldTransmission      Amplitud del campo transmitida al apilamiento, corregida por las reflexiones múltiples en el sustrato.
 * @param reflection             Reflexión total (sustrato + apilamiento).
 * @param transmission           Transmisión total hasta el medio de salida.
 * @param partialMatrices        S' y S'' de cada capa.
 */
public record WavelengthSolution(
        double wavelength,
        double substrateReflectance,
        double substrateTransmittance,
        double coherentReflectance,
        double fieldTransmission,
        double reflection,
        double transmission,
        PartialMatrices partialMatrices
) {
}
