/**
 * Broker orchestration package.
 *
 * <p>{@link io.meshbroker.runtime.MeshBroker} owns the cross-component wiring:
 * frame decoding and dispatch, the task timer lane, and the read/write
 * projections served by the management API.
 */
package io.meshbroker.runtime;
