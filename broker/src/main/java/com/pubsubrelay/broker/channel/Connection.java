package com.pubsubrelay.broker.channel;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pubsubrelay.core.msg.WireFrame;
import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.concurrent.atomic.AtomicLong;

/**
 * One client socket bound to a channel.
 * <p>
 * State, metadata and the outbound sink are touched only on the broker loop; the transport only
 * subscribes to {@link #outbound()}.
 * </p>
 */
@Getter
public class Connection {
    private static final Logger log = LoggerFactory.getLogger(Connection.class);
    private static final AtomicLong SEQUENCE = new AtomicLong();

    private final long id;
    private final String clientId;
    private final String channel;
    private final ConnectionLink link;
    private final Sinks.Many<WireFrame> sink;
    @Setter
    private ObjectNode metadata;
    @Setter
    private ConnectionState state;

    Connection(String clientId, String channel, ObjectNode metadata, ConnectionLink link) {
        this.id = SEQUENCE.incrementAndGet();
        this.clientId = clientId;
        this.channel = channel;
        this.metadata = metadata;
        this.link = link;
        this.sink = Sinks.many().unicast().onBackpressureBuffer();
        this.state = ConnectionState.BINDING;
    }

    /**
     * Frames for the transport, in emission order. Single subscriber.
     */
    public Flux<WireFrame> outbound() {
        return sink.asFlux();
    }

    public boolean isOpen() {
        return state == ConnectionState.OPEN;
    }

    void send(WireFrame frame) {
        Sinks.EmitResult result = sink.tryEmitNext(frame);
        if (result.isFailure()) {
            log.debug("Dropped outbound frame for connection {} ({}): {}", id, clientId, result);
        }
    }

    void completeOutbound() {
        sink.tryEmitComplete();
    }

    @Override
    public String toString() {
        return "Connection{id=" + id + ", clientId=" + clientId + ", channel=" + channel + ", state=" + state + "}";
    }
}
