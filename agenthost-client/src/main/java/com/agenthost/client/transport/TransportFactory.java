package com.agenthost.client.transport;

import com.agenthost.protocol.TransportKind;

@FunctionalInterface
public interface TransportFactory {

    Transport create(TransportKind kind);
}
