package fr.lapetina.inference.router.batch;

import java.util.List;

/**
 * Executes a closed batch.
 *
 * <p>Implementations must return exactly one output per request, in the batch's
 * request order. A failure applies to the whole batch.
 */
@FunctionalInterface
public interface ComputeEngine {

    /**
     * @param batch the batch to execute
     * @return one output per request, index-aligned with {@link Batch#requests()}
     * @throws ComputeException if the batch could not be executed
     */
    List<Object> execute(Batch batch) throws ComputeException;
}
