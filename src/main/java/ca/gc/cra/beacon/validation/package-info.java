/**
 * Input validation helpers shared by configuration and CLI layers.
 * <p><strong>Concurrency:</strong> Stateless utilities; thread-safe.</p>
 * <p><strong>Security:</strong> Rejects control characters, unexpected URI schemes, and unwritable state directories
 * before any adapter is constructed.</p>
 */
package ca.gc.cra.beacon.validation;
