/**
 * Tool contract for Tool Deck: a tool is a JAR named {@code code*.jar} whose manifest names an
 * entry class implementing {@link com.tooldeck.tools.Tool}.
 * <p>
 * Tools compile against this module and {@code tooldeck-annotations}; at runtime only these
 * packages, {@code org.slf4j} and the JDK are visible to them.
 */
package com.tooldeck.tools;
