/**
 * Resource lifecycle and fetch orchestration.
 *
 * <p>{@link io.memobank.runtime.MemoProject} owns the collection registry; each
 * {@link io.memobank.runtime.ResourceCollection} pairs a compute function with its resource
 * store and status index. {@link io.memobank.runtime.FetchOrchestrator} keeps at most one
 * computation per resource in flight and runs it inline or on its own daemon thread.
 */
package io.memobank.runtime;
