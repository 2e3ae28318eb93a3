package org.gutensearch.core.model;

/**
 * Liveness payload served on {@code GET /status} by both services.
 */
public record ServiceStatus(
		String service,
		String status,
		String backend,
		long timestamp
) {
	public static ServiceStatus running(String service, String backend) {
		return new ServiceStatus(service, "running", backend, System.currentTimeMillis());
	}
}
