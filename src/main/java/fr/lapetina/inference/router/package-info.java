/**
 * Inference Router - consistent-hash gateway in front of dynamically batching inference workers.
 *
 * <p>The gateway places every worker on a hash ring with virtual nodes and sends each request
 * to the worker owning its routing key. Each worker groups the requests it receives into
 * batches, closed by size or by deadline, and runs them through a compute engine.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.inference.router.GatewayFactory} - Wires a gateway from YAML configuration</li>
 *   <li>{@link fr.lapetina.inference.router.GatewayApplication} - Standalone gateway process</li>
 *   <li>{@link fr.lapetina.inference.router.WorkerApplication} - Standalone worker process</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (GatewayFactory factory = GatewayFactory.create("router.yaml").start()) {
 *     GatewayPipeline pipeline = factory.getPipeline();
 *
 *     InferenceRequest request = InferenceRequest.of("req-1", Map.of("input", List.of(1, 2, 3)));
 *     ForwardOutcome outcome = pipeline.submit(request).get();
 *
 *     System.out.println(outcome.result().workerId());
 * }
 * }</pre>
 *
 * @see fr.lapetina.inference.router.domain.ring.HashRing
 * @see fr.lapetina.inference.router.batch.BatchQueue
 * @see fr.lapetina.inference.router.disruptor.GatewayPipeline
 */
package fr.lapetina.inference.router;
