package projectphoton.utils;

/**
 * Interpolación lineal a trozos sobre una tabla de abscisas estrictamente crecientes.
 * Fuera del rango tabulado extrapola con la recta de los dos puntos extremos.
 */
public final class LinearInterpolator {

    /**
     * Prohibido construir esta clase utilidad
     */
    private LinearInterpolator() {
    }

    /**
     * @param xs      Abscisas tabuladas, estrictamente crecientes.
     * @param ys      Ordenadas tabuladas.
     * @param targets Puntos donde evaluar.
     * @return Los valores interpolados, uno por punto.
     */
    public static double[] interpolate(double[] xs, double[] ys, double[] targets) {
        if (xs.length != ys.length) {
            throw new IllegalArgumentException("Las abscisas (" + xs.length + ") y ordenadas (" + ys.length + ") deben tener la misma longitud.");
        }
        if (xs.length == 0) {
            throw new IllegalArgumentException("No se puede interpolar sobre una tabla vacía.");
        }
        double[] out = new double[targets.length];
        for (int i = 0; i < targets.length; i++) {
            out[i] = interpolate(xs, ys, targets[i]);
        }
        return out;
    }

    /**
     * Evalúa la tabla en un único punto.
     */
    public static double interpolate(double[] xs, double[] ys, double target) {
        final int n = xs.length;
        if (n == 1) {
            return ys[0];
        }
        int upper;
        if (target <= xs[0]) {
            upper = 1;
        } else if (target >= xs[n - 1]) {
            upper = n - 1;
        } else {
            upper = upperIndex(xs, target);
        }
        int lower = upper - 1;
        double slope = (ys[upper] - ys[lower]) / (xs[upper] - xs[lower]);
        return ys[lower] + slope * (target - xs[lower]);
    }

    /**
     * Número de puntos que quedan fuera de [xs[0], xs[n-1]].
     */
    public static int countOutOfRange(double[] xs, double[] targets) {
        final double min = xs[0];
        final double max = xs[xs.length - 1];
        int count = 0;
        for (double t : targets) {
            if (t < min || t > max) {
                count++;
            }
        }
        return count;
    }

    // Primer índice con xs[i] > target (búsqueda binaria, target dentro del rango)
    private static int upperIndex(double[] xs, double target) {
        int lo = 1;
        int hi = xs.length - 1;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (xs[mid] > target) {
                hi = mid;
            } else {
                lo = mid + 1;
            }
        }
        return lo;
    }
}
