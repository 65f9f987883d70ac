/**
 * Configuration loading and wiring for the BEACON feed client.
 *
 * <p>{@link ca.gc.cra.beacon.config.DefaultsForMode} holds the embedded defaults,
 * {@link ca.gc.cra.beacon.config.YamlConfigLoader} reads the optional YAML file, and
 * {@link ca.gc.cra.beacon.config.ConfigMerger} applies CLI overrides on top. The merged map becomes a
 * {@link ca.gc.cra.beacon.config.FeedConfig}, which {@link ca.gc.cra.beacon.config.CompositionRoot} turns into a
 * running client.</p>
 */
package ca.gc.cra.beacon.config;
