package projectphoton.domain.stack;

import lombok.With;
import projectphoton.domain.exception.InvalidGeometryException;

import java.util.Objects;

/**
 * Una capa del dispositivo: nombre del material y espesor.
 * <p>
 * El nombre debe existir en la librería de índices de refracción. El espesor de la
 * primera capa del apilamiento se ignora (superestrato incoherente).
 *
 * @param name      Nombre del material (ej: "ITO", "P3HTPCBM").
 * @param thickness Espesor en nanómetros (>= 0).
 */
@With
public record Layer(String name, double thickness) {

    public Layer {
        Objects.requireNonNull(name, "El nombre de la capa no puede ser nulo.");
        if (name.isBlank()) {
            throw new InvalidGeometryException("El nombre de la capa no puede estar vacío.");
        }
        if (!Double.isFinite(thickness) || thickness < 0) {
            throw new InvalidGeometryException(
                    String.format("Espesor inválido para la capa '%s': %s nm", name, thickness));
        }
    }

    public static Layer of(String name, double thickness) {
        return new Layer(name, thickness);
    }
}
