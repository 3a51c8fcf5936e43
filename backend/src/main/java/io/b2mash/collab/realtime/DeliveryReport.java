package io.b2mash.collab.realtime;

/** Per-send tally of a dispatch. Delivery is best-effort; failures are reported, never thrown. */
public record DeliveryReport(int attempted, int delivered, int failed) {

  public static final DeliveryReport EMPTY = new DeliveryReport(0, 0, 0);

  public DeliveryReport plus(DeliveryReport other) {
    return new DeliveryReport(
        attempted + other.attempted, delivered + other.delivered, failed + other.failed);
  }
}
