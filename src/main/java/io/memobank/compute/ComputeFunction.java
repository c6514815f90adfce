package io.memobank.compute;

import java.util.Map;

/**
 * User-supplied computation bound to a collection. Any exception thrown is captured into the
 * resource's error state and never reaches the caller of {@code fetch}.
 *
 * <p>The returned value is serialized with Jackson; maps, lists, strings, numbers, booleans,
 * {@code null} and Jackson trees are all accepted.
 */
@FunctionalInterface
public interface ComputeFunction {
    Object compute(String identifier, Map<String, Object> args, ComputeContext context) throws Exception;
}
