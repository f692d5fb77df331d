/**
 * In-process transport binding.
 *
 * <p>Useful for wiring components inside one JVM and for integration tests that
 * need real delivery without a medium.</p>
 */
package com.questrail.uprotocol.transport.local;
