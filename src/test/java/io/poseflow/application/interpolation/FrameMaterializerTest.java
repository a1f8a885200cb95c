package io.poseflow.application.interpolation;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.poseflow.domain.frame.InterpolationRecipe;
import io.poseflow.domain.pose.Keypoint;
import io.poseflow.domain.pose.PoseObservation;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FrameMaterializerTest {
  private final FrameMaterializer materializer = new FrameMaterializer();

  @Test
  void blendsGeometryLinearlyAndAnglesAlongShortestPath() {
    PoseObservation left = new PoseObservation(
        2,
        List.of(new Keypoint("wrist", 100, 200, 1.0, 0.9), new Keypoint("elbow", 50, 50, 0.0, 0.8)),
        true,
        List.of(new double[] {0, 0, 0}, new double[] {1, 1, 1}),
        List.of(new int[] {0, 1, 0}),
        new double[] {0, 0, 10},
        Map.of("hip_yaw", 170d, "knee", 10d),
        0.85,
        30L,
        null);
    PoseObservation right = new PoseObservation(
        5,
        List.of(new Keypoint("wrist", 130, 260, 4.0, 0.7), new Keypoint("elbow", 80, 20, 3.0, 0.95)),
        true,
        List.of(new double[] {3, 3, 3}, new double[] {4, 4, 4}),
        List.of(new int[] {0, 1, 0}, new int[] {1, 0, 1}),
        new double[] {3, 0, 13},
        Map.of("hip_yaw", -170d, "knee", 40d),
        0.75,
        40L,
        null);

    PoseObservation blended = materializer.blend(3, left, right, InterpolationRecipe.between(2, 5, 3));

    assertEquals(3, blended.frameNumber());
    Keypoint wrist = blended.keypoints().get(0);
    assertEquals(110, wrist.x(), 1e-9);
    assertEquals(220, wrist.y(), 1e-9);
    assertEquals(2.0, wrist.z(), 1e-9);
    assertEquals(0.7, wrist.confidence(), 1e-9);
    assertEquals("wrist", wrist.name());
    assertTrue(blended.has3D());
    assertArrayEquals(new double[] {1, 1, 1}, blended.meshVertices().get(0), 1e-9);
    assertEquals(2, blended.meshFaces().size());
    assertArrayEquals(new double[] {1, 0, 11}, blended.cameraTranslation(), 1e-9);
    assertEquals(176.6666666, blended.jointAngles().get("hip_yaw"), 1e-6);
    assertEquals(20d, blended.jointAngles().get("knee"), 1e-9);
    assertEquals(0.75, blended.confidence(), 1e-9);
    assertNull(blended.error());
  }

  @Test
  void missingThreeDimensionalDataOnOneSideIsDropped() {
    PoseObservation flat = PoseObservation.of(0, List.of(Keypoint.of2d("a", 0, 0, 0.9)));
    PoseObservation deep = new PoseObservation(
        2, List.of(new Keypoint("a", 10, 10, 5.0, 0.9)), true,
        List.of(new double[] {1, 2, 3}), null, new double[] {1, 1, 1}, Map.of("knee", 5d), 0.9, 0L, null);

    PoseObservation blended = materializer.blend(1, flat, deep, InterpolationRecipe.between(0, 2, 1));

    assertFalse(blended.has3D());
    assertNull(blended.meshVertices());
    assertNull(blended.cameraTranslation());
    assertNull(blended.jointAngles());
    assertNull(blended.keypoints().get(0).z());
    assertEquals(5, blended.keypoints().get(0).x(), 1e-9);
  }

  @Test
  void unevenKeypointCountsArePaddedFromTheShorterSide() {
    PoseObservation left = PoseObservation.of(0, List.of(Keypoint.of2d("a", 0, 0, 0.9)));
    PoseObservation right = PoseObservation.of(2, List.of(
        Keypoint.of2d("a", 10, 0, 0.9), Keypoint.of2d("b", 20, 0, 0.9)));

    PoseObservation blended = materializer.blend(1, left, right, InterpolationRecipe.between(0, 2, 1));

    assertEquals(2, blended.keypoints().size());
    assertEquals(10, blended.keypoints().get(1).x(), 1e-9);
    assertEquals("a", blended.keypoints().get(1).name());
  }
}
