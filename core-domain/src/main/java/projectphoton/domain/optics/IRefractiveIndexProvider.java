package projectphoton.domain.optics;

import org.apache.commons.math3.complex.Complex;
import projectphoton.domain.exception.UnknownMaterialException;

/**
 * Fuente de índices de refracción complejos n + ik por material y longitud de onda.
 * <p>
 * Desacopla el núcleo numérico de la carga de datos: el solver solo ve este contrato,
 * lo que permite pruebas con tablas sintéticas.
 */
@FunctionalInterface
public interface IRefractiveIndexProvider {

    /**
     * Devuelve el índice complejo del material en cada longitud de onda pedida.
     *
     * @param materialName Nombre del material.
     * @param wavelengths  Longitudes de onda [nm].
     * @return Un array de la misma longitud que {@code wavelengths}.
     * @throws UnknownMaterialException si el material no existe en la tabla.
     */
    Complex[] lookupIndex(String materialName, double[] wavelengths);
}
