package projectphoton.domain.stack;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import projectphoton.domain.exception.InvalidGeometryException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

class PositionGridTest {

    private static LayerStack twoFilmStack(double exitThickness) {
        return LayerStack.of(
                Layer.of("Glass", 0),
                Layer.of("A", 10),
                Layer.of("B", 5),
                Layer.of("Air", exitThickness));
    }

    @Test
    @DisplayName("Los puntos empiezan en paso/2 y cubren toda la profundidad")
    void create_placesPointsAtCellCentres() {
        // ACT
        PositionGrid grid = PositionGrid.create(twoFilmStack(0), 1.0);

        // ASSERT
        assertEquals(15, grid.size());
        assertEquals(0.5, grid.getPosition(0), 1e-12);
        assertEquals(14.5, grid.getPosition(14), 1e-12);
        assertEquals(10, grid.countInLayer(1));
        assertEquals(5, grid.countInLayer(2));
        assertEquals(0, grid.countInLayer(0));
        assertEquals(0, grid.countInLayer(3));
    }

    @Test
    @DisplayName("Un punto sobre una frontera pertenece a la capa anterior")
    void pointOnBoundary_goesToEarlierLayer() {
        // Paso 4: puntos en 2, 6, 10, 14. El 10 cae justo en la frontera A|B
        PositionGrid grid = PositionGrid.create(twoFilmStack(0), 4.0);

        assertThat(grid.clonePositions()).containsExactly(2.0, 6.0, 10.0, 14.0);
        assertEquals(1, grid.getLayerIndexAt(2));
        assertEquals(10.0, grid.getLocalDepth(2), 1e-12);
        assertEquals(2, grid.getLayerIndexAt(3));
        assertEquals(4.0, grid.getLocalDepth(3), 1e-12);
    }

    @Test
    @DisplayName("La capa de salida solo recibe puntos si tiene espesor declarado")
    void exitLayer_withThickness_receivesPoints() {
        PositionGrid grid = PositionGrid.create(twoFilmStack(5), 1.0);

        assertEquals(20, grid.size());
        assertEquals(5, grid.countInLayer(3));
        assertThat(grid.getIndicesInLayer(3)).containsExactly(15, 16, 17, 18, 19);
        assertEquals(0.5, grid.getLocalDepth(15), 1e-12);
    }

    @Test
    @DisplayName("Un paso no positivo se rechaza")
    void nonPositiveStep_shouldThrow() {
        assertThatThrownBy(() -> PositionGrid.create(twoFilmStack(0), 0.0))
                .isInstanceOf(InvalidGeometryException.class);
    }
}
