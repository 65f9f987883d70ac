package ca.gc.cra.beacon.application.port;

/**
 * Receives camera inventory broadcasts relayed on the alert socket.
 *
 * @since BEACON 0.1
 */
@FunctionalInterface
public interface CameraInventorySink {
  /**
   * Hands over the raw camera list document.
   *
   * @param rawCameraJson JSON document exactly as carried in {@code data._raw_camera_json}
   */
  void onCameraInventory(String rawCameraJson);
}
