/**
 * Tool discovery and registry.
 * <ul>
 *   <li>{@link com.tooldeck.registry.ToolSourceScanner} – lists {@code code*.jar} candidates</li>
 *   <li>{@link com.tooldeck.registry.ToolLoader} – resolves a candidate via {@link com.tooldeck.registry.UnitResolver} and validates its {@code run} entry point</li>
 *   <li>{@link com.tooldeck.registry.JarUnitResolver} – loads the manifest's {@code Tool-Class} under a {@link com.tooldeck.registry.RestrictedToolClassLoader}</li>
 *   <li>{@link com.tooldeck.registry.ToolMetadataExtractor} – {@link com.tooldeck.annotations.DeckTool} plus defaults → {@link com.tooldeck.registry.ToolDescriptor}</li>
 *   <li>{@link com.tooldeck.registry.OrderingPolicy} – priority or numeric-id ordering</li>
 *   <li>{@link com.tooldeck.registry.ToolDiscovery} – the whole pass → {@link com.tooldeck.registry.ToolRegistry}</li>
 *   <li>{@link com.tooldeck.registry.ToolRegistryCache} – runs discovery once per host lifetime</li>
 * </ul>
 */
package com.tooldeck.registry;
