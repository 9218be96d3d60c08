package projectphoton.physics.matrix;

import org.apache.commons.math3.complex.Complex;

/**
 * Matriz compleja 2x2 inmutable usada en el método de matrices de transferencia.
 * <p>
 * Los elementos se guardan como pares de {@code double} para que el producto, que es la
 * operación del bucle caliente, no cree objetos intermedios. Los accesores devuelven
 * {@link Complex} para el resto del código.
 * <pre>
 * | m11  m12 |
 * | m21  m22 |
 * </pre>
 */
public final class TransferMatrix {

    private static final TransferMatrix IDENTITY = new TransferMatrix(1, 0, 0, 0, 0, 0, 1, 0);

    private final double re11, im11, re12, im12;
    private final double re21, im21, re22, im22;

    private TransferMatrix(double re11, double im11, double re12, double im12,
                           double re21, double im21, double re22, double im22) {
        this.re11 = re11;
        this.im11 = im11;
        this.re12 = re12;
        this.im12 = im12;
        this.re21 = re21;
        this.im21 = im21;
        this.re22 = re22;
        this.im22 = im22;
    }

    public static TransferMatrix identity() {
        return IDENTITY;
    }

    public static TransferMatrix of(Complex m11, Complex m12, Complex m21, Complex m22) {
        return new TransferMatrix(
                m11.getReal(), m11.getImaginary(), m12.getReal(), m12.getImaginary(),
                m21.getReal(), m21.getImaginary(), m22.getReal(), m22.getImaginary());
    }

    public static TransferMatrix diagonal(Complex d1, Complex d2) {
        return of(d1, Complex.ZERO, Complex.ZERO, d2);
    }

    /**
     * Producto matricial {@code this · other}. El orden importa: el producto no es conmutativo.
     */
    public TransferMatrix multiply(TransferMatrix o) {
        return new TransferMatrix(
                re11 * o.re11 - im11 * o.im11 + re12 * o.re21 - im12 * o.im21,
                re11 * o.im11 + im11 * o.re11 + re12 * o.im21 + im12 * o.re21,
                re11 * o.re12 - im11 * o.im12 + re12 * o.re22 - im12 * o.im22,
                re11 * o.im12 + im11 * o.re12 + re12 * o.im22 + im12 * o.re22,
                re21 * o.re11 - im21 * o.im11 + re22 * o.re21 - im22 * o.im21,
                re21 * o.im11 + im21 * o.re11 + re22 * o.im21 + im22 * o.re21,
                re21 * o.re12 - im21 * o.im12 + re22 * o.re22 - im22 * o.im22,
                re21 * o.im12 + im21 * o.re12 + re22 * o.im22 + im22 * o.re22);
    }

    public Complex m11() {
        return new Complex(re11, im11);
    }

    public Complex m12() {
        return new Complex(re12, im12);
    }

    public Complex m21() {
        return new Complex(re21, im21);
    }

    public Complex m22() {
        return new Complex(re22, im22);
    }

    /**
     * Elemento (fila, columna) con índices base 1, como en la notación física.
     */
    public Complex get(int row, int column) {
        if (row == 1 && column == 1) return m11();
        if (row == 1 && column == 2) return m12();
        if (row == 2 && column == 1) return m21();
        if (row == 2 && column == 2) return m22();
        throw new IndexOutOfBoundsException("Elemento (" + row + ", " + column + ") fuera de una matriz 2x2.");
    }

    public boolean isFinite() {
        return Double.isFinite(re11) && Double.isFinite(im11) && Double.isFinite(re12) && Double.isFinite(im12)
                && Double.isFinite(re21) && Double.isFinite(im21) && Double.isFinite(re22) && Double.isFinite(im22);
    }

    /**
     * Mayor módulo de la diferencia elemento a elemento.
     */
    public double maxDifference(TransferMatrix o) {
        double d = Math.hypot(re11 - o.re11, im11 - o.im11);
        d = Math.max(d, Math.hypot(re12 - o.re12, im12 - o.im12));
        d = Math.max(d, Math.hypot(re21 - o.re21, im21 - o.im21));
        return Math.max(d, Math.hypot(re22 - o.re22, im22 - o.im22));
    }

    /**
     * Mayor módulo entre los cuatro elementos.
     */
    public double maxNorm() {
        return Math.max(Math.max(Math.hypot(re11, im11), Math.hypot(re12, im12)),
                Math.max(Math.hypot(re21, im21), Math.hypot(re22, im22)));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof TransferMatrix)) return false;
        TransferMatrix o = (TransferMatrix) obj;
        return Double.compare(re11, o.re11) == 0 && Double.compare(im11, o.im11) == 0
                && Double.compare(re12, o.re12) == 0 && Double.compare(im12, o.im12) == 0
                && Double.compare(re21, o.re21) == 0 && Double.compare(im21, o.im21) == 0
                && Double.compare(re22, o.re22) == 0 && Double.compare(im22, o.im22) == 0;
    }

    @Override
    public int hashCode() {
        int result = Double.hashCode(re11);
        result = 31 * result + Double.hashCode(im11);
        result = 31 * result + Double.hashCode(re12);
        result = 31 * result + Double.hashCode(im12);
        result = 31 * result + Double.hashCode(re21);
        result = 31 * result + Double.hashCode(im21);
        result = 31 * result + Double.hashCode(re22);
        result = 31 * result + Double.hashCode(im22);
        return result;
    }

    @Override
    public String toString() {
        return String.format("[[(%g%+gi), (%g%+gi)], [(%g%+gi), (%g%+gi)]]",
                re11, im11, re12, im12, re21, im21, re22, im22);
    }
}
