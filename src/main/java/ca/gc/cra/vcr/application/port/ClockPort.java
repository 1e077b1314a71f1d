package ca.gc.cra.vcr.application.port;

/**
 * <strong>What:</strong> Port supplying time to the recorder.
 * <p><strong>Why:</strong> Exchange durations are persisted in cassettes; tests inject a deterministic clock to assert
 * them.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @implNote Default implementation delegates to {@link System#nanoTime()} for elapsed time.
 * @since 0.1.0
 */
public interface ClockPort {
  /**
   * Returns a monotonic timestamp in nanoseconds, meaningful only as a difference between two readings.
   *
   * @return monotonic nanoseconds
   */
  long nanoTime();

  /**
   * Default {@link ClockPort} using {@link System#nanoTime()}.
   */
  ClockPort SYSTEM = System::nanoTime;
}
