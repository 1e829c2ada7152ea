/**
 * Domain model classes shared by the gateway and the workers.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.inference.router.domain.model.InferenceRequest} - Immutable request routed and batched</li>
 *   <li>{@link fr.lapetina.inference.router.domain.model.InferenceResult} - Immutable per-request outcome</li>
 *   <li>{@link fr.lapetina.inference.router.domain.model.WorkerEndpoint} - Thread-safe view of a worker process</li>
 *   <li>{@link fr.lapetina.inference.router.domain.model.ErrorType} - Error taxonomy for results</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>{@code InferenceRequest} and {@code InferenceResult} are immutable records.
 * {@code WorkerEndpoint} uses atomics for its health state.
 */
package fr.lapetina.inference.router.domain.model;
