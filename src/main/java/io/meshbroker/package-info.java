/**
 * MeshBroker source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.meshbroker.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.meshbroker.cli.MeshBrokerCommand} maps commands to broker APIs.</li>
 *   <li>{@code io.meshbroker.runtime.MeshBroker} wires registries, routing, dispatch and the offline queue.</li>
 *   <li>{@code io.meshbroker.registry.ConnectionRegistry} owns nodes and their capability index entries.</li>
 * </ul>
 */
package io.meshbroker;
