// SPDX-License-Identifier: MIT OR Apache-2.0
package io.strand.events;

import io.strand.core.error.InvalidArgumentException;
import io.strand.core.error.PermissionDeniedException;
import io.strand.core.error.ServiceClosedException;

/**
 * Receives block, filtered block, chaincode and transaction status events.
 *
 * <p>
 * Every registration gets its own bounded {@link EventChannel}. Call
 * {@link #unregister(Registration)} once the registration is no longer needed; the
 * channel is closed at that point.
 *
 * <p>
 * <strong>Thread Safety:</strong> All methods may be called concurrently with each
 * other and with active event dispatch. None of them performs network I/O.
 */
public interface EventService {

    /**
     * Registers for full block events.
     *
     * @param filters at most one filter deciding which blocks are delivered; none delivers every block
     * @return the registration and its channel
     * @throws InvalidArgumentException   if more than one filter is given
     * @throws PermissionDeniedException  if the caller may not receive full blocks
     * @throws ServiceClosedException     if the service is closed
     */
    EventRegistration<BlockEvent> registerBlockEvent(BlockFilter... filters);

    /**
     * Registers for filtered block events.
     *
     * @return the registration and its channel
     * @throws PermissionDeniedException if the caller may not receive filtered blocks
     * @throws ServiceClosedException    if the service is closed
     */
    EventRegistration<FilteredBlockEvent> registerFilteredBlockEvent();

    /**
     * Registers for chaincode events.
     *
     * <p>
     * The event name pattern is a {@link java.util.regex.Pattern regular expression}
     * matched with search semantics: it matches if it is found anywhere in the event
     * name. Anchor it ({@code ^name$}) to require a full match.
     *
     * @param chaincodeId      the exact chaincode id
     * @param eventNamePattern regular expression for the event name
     * @return the registration and its channel
     * @throws InvalidArgumentException  if the chaincode id is blank or the pattern does not compile
     * @throws PermissionDeniedException if the caller may not receive chaincode events
     * @throws ServiceClosedException    if the service is closed
     */
    EventRegistration<CcEvent> registerChaincodeEvent(String chaincodeId, String eventNamePattern);

    /**
     * Registers for the commit status of one transaction.
     *
     * @param txId the exact transaction id
     * @return the registration and its channel
     * @throws InvalidArgumentException  if the transaction id is null or empty
     * @throws PermissionDeniedException if the caller may not receive transaction status events
     * @throws ServiceClosedException    if the service is closed
     */
    EventRegistration<TxStatusEvent> registerTxStatusEvent(String txId);

    /**
     * Removes a registration and closes its channel.
     *
     * <p>
     * Unknown, foreign and already removed registrations are ignored.
     *
     * @param registration the handle returned by one of the register methods
     */
    void unregister(Registration registration);
}
