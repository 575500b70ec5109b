/**
 * Configuration entry points: {@link ca.gc.cra.clicore.config.CliSettings}, the YAML settings loader and the
 * {@link ca.gc.cra.clicore.config.CliBuilder} composition root.
 * <p><strong>Role:</strong> Wires ports to adapters and applies user settings before the first invocation.</p>
 * <p><strong>Concurrency:</strong> Builders are single-threaded; loaders are stateless.</p>
 * <p><strong>Security:</strong> YAML is read with SnakeYAML's default loader into plain maps and scalars only.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.clicore.config;
