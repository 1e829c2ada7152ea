/**
 * Configuration loading and hot-reload support.
 *
 * <p>The gateway and the workers read the same YAML document; each uses the sections
 * that concern it.
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code server} - HTTP server settings (port, backlog, handler threads)</li>
 *   <li>{@code workers} - Physical nodes of the hash ring</li>
 *   <li>{@code ring} - Virtual nodes per physical node</li>
 *   <li>{@code batch} - Worker batch size, batch deadline and result wait</li>
 *   <li>{@code compute} - Simulated compute engine profile</li>
 *   <li>{@code disruptor} - Ring buffer, wait strategy and global in-flight cap</li>
 *   <li>{@code timeouts} - Forwarding, connect and health check timeouts</li>
 *   <li>{@code retry} - Fallback to ring successors, off by default</li>
 *   <li>{@code healthCheck} - Health probing and circuit breaker settings</li>
 *   <li>{@code stats} - Load balance target</li>
 *   <li>{@code metrics} - Prometheus metrics settings</li>
 * </ul>
 *
 * <h2>Hot-Reload</h2>
 * <p>A modified file is validated before listeners see it. The worker list and the retry
 * policy apply at once; the virtual node count only on restart.
 *
 * @see fr.lapetina.inference.router.infrastructure.config.RouterConfig
 * @see fr.lapetina.inference.router.infrastructure.config.ConfigLoader
 */
package fr.lapetina.inference.router.infrastructure.config;
