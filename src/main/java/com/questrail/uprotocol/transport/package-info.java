/**
 * Transport Contract
 * =============================================================================
 *
 * The abstract {@link com.questrail.uprotocol.transport.UTransport} and the
 * listener lifecycle types every concrete transport shares.
 *
 * <h2>What lives here</h2>
 * <ul>
 *   <li>{@link com.questrail.uprotocol.transport.UTransport}: send / register
 *       orchestration over transport-specific hooks</li>
 *   <li>{@link com.questrail.uprotocol.transport.CallableConn}: identity-comparable
 *       connection to a listener</li>
 *   <li>{@link com.questrail.uprotocol.transport.ListenerHandle}: single-owner
 *       handle whose release unregisters exactly once</li>
 * </ul>
 *
 * <h2>Constraints on implementations</h2>
 * Concrete transports MUST:
 * <ul>
 *   <li>Move messages only; identifiers are stamped by senders</li>
 *   <li>Report failures as statuses, not exceptions</li>
 *   <li>Not retry on behalf of the caller</li>
 *   <li>Deliver through {@link com.questrail.uprotocol.transport.CallableConn#invoke}
 *       so a released listener is never called again</li>
 * </ul>
 */
package com.questrail.uprotocol.transport;
