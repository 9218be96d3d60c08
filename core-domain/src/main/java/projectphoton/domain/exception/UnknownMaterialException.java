package projectphoton.domain.exception;

import lombok.Getter;

/**
 * Se lanza cuando un proveedor de índices de refracción no conoce el material
 * solicitado. Afecta a todas las longitudes de onda, por lo que la ejecución
 * completa se aborta.
 */
@Getter
public class UnknownMaterialException extends RuntimeException {

    private final String materialName;

    public UnknownMaterialException(String materialName) {
        super("Material desconocido en la librería de índices de refracción: '" + materialName + "'");
        this.materialName = materialName;
    }

    public UnknownMaterialException(String materialName, Throwable cause) {
        super("Material desconocido en la librería de índices de refracción: '" + materialName + "'", cause);
        this.materialName = materialName;
    }
}
