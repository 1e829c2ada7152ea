/**
 * LMAX Disruptor pipeline of the gateway.
 *
 * <p>Requests are published into a pre-allocated ring buffer by the HTTP handler
 * threads and flow through the handlers in sequence:
 * <pre>
 * Validation → Routing → Admission → Dispatch → Metrics → Completion
 * </pre>
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.inference.router.disruptor.GatewayPipeline} - pipeline orchestrator</li>
 *   <li>{@link fr.lapetina.inference.router.disruptor.exception.BackpressureException} - thrown when the ring buffer is full</li>
 * </ul>
 *
 * @see com.lmax.disruptor.dsl.Disruptor
 */
package fr.lapetina.inference.router.disruptor;
