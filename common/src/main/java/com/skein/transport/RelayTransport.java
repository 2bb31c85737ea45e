package com.skein.transport;

import java.util.OptionalLong;

/**
 * Opens subscriptions to the relay's commit firehose.
 */
public interface RelayTransport {

    /**
     * Subscribes starting after {@code cursor}, or at the live tip when empty.
     */
    RelayStream connect(OptionalLong cursor) throws ConnectionLostException;
}
