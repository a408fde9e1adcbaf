/**
 * Tool Deck annotations: metadata and lifecycle contracts a tool JAR may use.
 * <ul>
 *   <li>{@link com.tooldeck.annotations.DeckTool} – display name, description and sort order of a tool</li>
 *   <li>{@link com.tooldeck.annotations.ResourceCleanup} – onExit() for shutdown</li>
 * </ul>
 * Both types are visible to tool JARs through the host's restricted class loader.
 */
package com.tooldeck.annotations;
