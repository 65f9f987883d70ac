package ca.gc.cra.beacon.domain.event;

/**
 * Vehicle details attached to vehicle-related alerts.
 *
 * @param number registration number; may be {@code null}
 * @param transporter transporter or fleet operator; may be {@code null}
 */
public record VehicleInfo(String number, String transporter) {

  /**
   * Returns {@code true} when neither field carries a value.
   *
   * @return whether the record is empty
   */
  public boolean isEmpty() {
    return (number == null || number.isBlank()) && (transporter == null || transporter.isBlank());
  }
}
