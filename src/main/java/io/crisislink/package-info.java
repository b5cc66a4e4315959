/**
 * CrisisLink source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.crisislink.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.crisislink.cli.CrisisLinkCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.crisislink.runtime.CrisisLinkRuntime} wires connections, sessions, delivery and escalation.</li>
 *   <li>{@code io.crisislink.delivery.DeliveryPipeline} owns per-session ordering, retries and offline queueing.</li>
 *   <li>{@code io.crisislink.storage.SqliteSessionStore} is the durable store for sessions, messages and escalations.</li>
 * </ul>
 */
package io.crisislink;
