/**
 * <strong>Purpose:</strong> Input validation helpers shared by configuration, CLI, and cassette naming.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe.
 * <p><strong>Observability:</strong> Failures surface as {@link java.lang.IllegalArgumentException}s; nothing is logged.
 *
 * @since 0.1.0
 */
package ca.gc.cra.vcr.validation;
