package io.poseflow.domain.pose;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class PoseObservationTest {

  @Test
  void constructorCopiesCallerArrays() {
    double[] translation = {1d, 2d, 3d};
    List<double[]> vertices = new ArrayList<>(List.of(new double[] {4d, 5d, 6d}));
    PoseObservation observation = new PoseObservation(
        0, List.of(), true, vertices, null, translation, null, 0.8, 12L, null);

    translation[0] = 99d;
    vertices.get(0)[0] = 99d;
    vertices.clear();

    assertArrayEquals(new double[] {1d, 2d, 3d}, observation.cameraTranslation());
    assertArrayEquals(new double[] {4d, 5d, 6d}, observation.meshVertices().get(0));
  }

  @Test
  void accessorsHandOutCopies() {
    PoseObservation observation = new PoseObservation(
        0, List.of(), true, List.of(new double[] {4d, 5d, 6d}), List.of(new int[] {0, 1, 2}),
        new double[] {1d, 2d, 3d}, null, 0.8, 12L, null);

    observation.cameraTranslation()[0] = 99d;
    observation.meshVertices().get(0)[0] = 99d;
    observation.meshFaces().get(0)[0] = 99;
    observation.mesh().orElseThrow().get(0)[1] = 99d;

    assertEquals(1d, observation.cameraTranslation()[0]);
    assertArrayEquals(new double[] {4d, 5d, 6d}, observation.meshVertices().get(0));
    assertArrayEquals(new int[] {0, 1, 2}, observation.meshFaces().get(0));
    assertThrows(UnsupportedOperationException.class, () -> observation.meshVertices().clear());
  }

  @Test
  void absentMeshStaysAbsent() {
    PoseObservation observation = PoseObservation.of(3, List.of());

    assertNull(observation.meshVertices());
    assertNull(observation.meshFaces());
    assertNull(observation.cameraTranslation());
    assertEquals(0d, observation.confidence());
  }
}
