package projectphoton.physics;

/**
 * Constantes físicas y factores de conversión del modelo óptico.
 * Los valores se mantienen con esta precisión para obtener resultados comparables bit a bit.
 */
public final class PhysicalConstants {

    /**
     * Constante de Planck [J·s].
     */
    public static final double PLANCK = 6.62606957e-34;
    /**
     * Velocidad de la luz en el vacío [m/s].
     */
    public static final double SPEED_OF_LIGHT = 2.99792458e8;
    /**
     * Carga elemental [C].
     */
    public static final double ELEMENTARY_CHARGE = 1.60217657e-19;

    public static final double NM_TO_CM = 1e-7;
    public static final double NM_TO_M = 1e-9;
    public static final double MILLI = 1e-3;

    private PhysicalConstants() {
    }
}
