// SPDX-License-Identifier: MIT OR Apache-2.0
package io.strand.events;

import io.strand.core.error.InvalidArgumentException;
import io.strand.core.error.PermissionDeniedException;
import io.strand.core.error.ServiceClosedException;
import io.strand.events.internal.BoundedEventChannel;
import io.strand.events.internal.ConnectionManager;
import io.strand.events.internal.Dispatcher;
import io.strand.events.internal.EventFilters;
import io.strand.events.internal.Subscriber;
import io.strand.events.internal.SubscriberRegistry;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Function;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;

/**
 * Default {@link EventClient}: a subscriber registry, a dispatcher and a connection
 * manager over one {@link EventSource}.
 *
 * <p>
 * Registrations may be made before or after {@link #connect()}. Events for a block
 * reach each channel in block order; a subscriber that registers mid-stream
 * receives events starting at whatever block is dispatched next.
 *
 * <p>
 * <strong>Thread Safety:</strong> All methods are thread-safe. Register and
 * unregister never block on network I/O.
 *
 * @see EventServiceConfig
 */
public final class DefaultEventClient implements EventClient {

    private final EventServiceConfig config;
    private final AuthorizationChecker authorization;
    private final Logger log;
    private final SubscriberRegistry registry;
    private final Dispatcher dispatcher;
    private final ConnectionManager connectionManager;

    private DefaultEventClient(
            final EventSource source, final AuthorizationChecker authorization, final EventServiceConfig config) {
        this.config = config;
        this.authorization = authorization;
        this.log = config.logger();
        this.registry = new SubscriberRegistry();
        this.dispatcher = new Dispatcher(registry, config);
        this.connectionManager = new ConnectionManager(source, dispatcher, registry, config);
    }

    /**
     * Creates a builder for a client reading from the given source.
     *
     * @param source the upstream event source
     * @return a new builder
     */
    public static Builder builder(final EventSource source) {
        return new Builder(source);
    }

    /**
     * Creates a client with default configuration that permits every event kind.
     *
     * @param source the upstream event source
     * @return a new client, not yet connected
     */
    public static DefaultEventClient create(final EventSource source) {
        return builder(source).build();
    }

    @Override
    public EventRegistration<BlockEvent> registerBlockEvent(final BlockFilter... filters) {
        ensureOpen();
        if (filters != null && filters.length > 1) {
            throw new InvalidArgumentException("At most one block filter may be given, got " + filters.length);
        }
        BlockFilter filter = filters == null || filters.length == 0 ? null : filters[0];
        return register(EventKind.BLOCK, channel -> new Subscriber.BlockSubscriber(filter, channel));
    }

    @Override
    public EventRegistration<FilteredBlockEvent> registerFilteredBlockEvent() {
        ensureOpen();
        return register(EventKind.FILTERED_BLOCK, Subscriber.FilteredBlockSubscriber::new);
    }

    @Override
    public EventRegistration<CcEvent> registerChaincodeEvent(final String chaincodeId, final String eventNamePattern) {
        ensureOpen();
        if (chaincodeId == null || chaincodeId.isBlank()) {
            throw new InvalidArgumentException("chaincodeId must not be blank");
        }
        Pattern pattern = EventFilters.compileEventNamePattern(eventNamePattern);
        return register(EventKind.CHAINCODE, channel -> new Subscriber.ChaincodeSubscriber(chaincodeId, pattern, channel));
    }

    @Override
    public EventRegistration<TxStatusEvent> registerTxStatusEvent(final String txId) {
        ensureOpen();
        if (txId == null || txId.isEmpty()) {
            throw new InvalidArgumentException("txId must not be empty");
        }
        return register(EventKind.TX_STATUS, channel -> new Subscriber.TxStatusSubscriber(txId, channel));
    }

    @Override
    public EventRegistration<ConnectionEvent> registerConnectionEvent() {
        ensureOpen();
        return register(EventKind.CONNECTION, Subscriber.ConnectionSubscriber::new);
    }

    @Override
    public void unregister(final Registration registration) {
        if (registration == null) {
            return;
        }
        Subscriber removed = registry.remove(registration);
        if (removed == null) {
            log.debug("Ignoring unknown registration {}", registration);
            return;
        }
        removed.channel().close();
        log.debug("Unregistered {} subscriber {}", removed.kind(), registration);
    }

    @Override
    public void connect() {
        connect(config.connectTimeout());
    }

    @Override
    public void connect(final Duration timeout) {
        connectionManager.connect(timeout);
    }

    @Override
    public boolean closeIfIdle() {
        return connectionManager.closeIfIdle();
    }

    @Override
    public ConnectionState connectionState() {
        return connectionManager.state();
    }

    @Override
    public void close() {
        connectionManager.close();
    }

    /**
     * Returns the number of outstanding registrations.
     */
    public int registrationCount() {
        return registry.size();
    }

    /**
     * Returns the number of the last block dispatched to subscribers, or -1 if none.
     */
    public long lastBlockNumber() {
        return dispatcher.lastBlockNumber();
    }

    private <T> EventRegistration<T> register(
            final EventKind kind, final Function<BoundedEventChannel<T>, Subscriber> factory) {
        if (!authorization.isAuthorized(kind)) {
            log.warn("Registration for {} events denied", kind);
            throw new PermissionDeniedException(kind.name());
        }
        BoundedEventChannel<T> channel = new BoundedEventChannel<>(config.bufferSize());
        Registration registration = registry.insert(factory.apply(channel));
        log.debug("Registered {} subscriber {}", kind, registration);
        return new EventRegistration<>(registration, channel);
    }

    private void ensureOpen() {
        if (connectionManager.isClosed() || registry.isSealed()) {
            throw new ServiceClosedException("Event service is closed");
        }
    }

    /**
     * Builder for {@link DefaultEventClient}.
     */
    public static final class Builder {
        private final EventSource source;
        private @Nullable AuthorizationChecker authorization;
        private @Nullable EventServiceConfig config;

        private Builder(final EventSource source) {
            this.source = Objects.requireNonNull(source, "source");
        }

        /**
         * Sets the authorization checker. Default: {@link AuthorizationChecker#permitAll()}.
         */
        public Builder authorization(final AuthorizationChecker authorization) {
            this.authorization = authorization;
            return this;
        }

        /**
         * Sets the service configuration. Default: {@link EventServiceConfig#defaults()}.
         */
        public Builder config(final EventServiceConfig config) {
            this.config = config;
            return this;
        }

        public DefaultEventClient build() {
            return new DefaultEventClient(
                    source,
                    authorization != null ? authorization : AuthorizationChecker.permitAll(),
                    config != null ? config : EventServiceConfig.defaults());
        }
    }
}
