/**
 * Command-line entry points for the BEACON feed client.
 *
 * <p>{@link ca.gc.cra.beacon.api.Main} dispatches {@code run}, {@code status}, {@code channels}, and
 * {@code reset-client}. Arguments are {@code key=value} pairs plus {@code --flags}; each command returns an
 * {@link ca.gc.cra.beacon.api.ExitCode}.</p>
 */
package ca.gc.cra.beacon.api;
