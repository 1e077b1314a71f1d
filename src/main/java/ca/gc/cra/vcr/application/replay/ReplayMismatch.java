package ca.gc.cra.vcr.application.replay;

/**
 * Difference between a recorded response and the response a handler produced on replay.
 *
 * @param interactionId position of the recorded interaction
 * @param method request method
 * @param url request URL as recorded
 * @param expectedCode recorded status code
 * @param actualCode status code produced on replay; {@code -1} when the request failed
 * @param bodyMatches whether the bodies were identical
 * @param detail human-readable description
 * @since 0.1.0
 */
public record ReplayMismatch(
    int interactionId,
    String method,
    String url,
    int expectedCode,
    int actualCode,
    boolean bodyMatches,
    String detail) {}
