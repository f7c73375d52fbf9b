package in.the13th.intel.transport.ws;

import io.undertow.websockets.core.WebSocketCallback;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.function.Consumer;

/**
 * Adapts an Undertow {@link WebSocketChannel} to {@link ObserverChannel}.
 *
 * Writes are asynchronous; a write that fails later is reported through {@code onFailure}.
 */
final class UndertowObserverChannel implements ObserverChannel {
    private static final Logger log = LoggerFactory.getLogger(UndertowObserverChannel.class);

    private final WebSocketChannel channel;
    private final Consumer<UndertowObserverChannel> onFailure;

    UndertowObserverChannel(WebSocketChannel channel, Consumer<UndertowObserverChannel> onFailure) {
        this.channel = channel;
        this.onFailure = onFailure;
    }

    @Override
    public SendResult send(String text) {
        if (!channel.isOpen() || channel.isCloseFrameSent()) {
            return SendResult.FAILED;
        }
        try {
            WebSockets.sendText(text, channel, new WebSocketCallback<Void>() {
                @Override
                public void complete(WebSocketChannel ch, Void context) {
                }

                @Override
                public void onError(WebSocketChannel ch, Void context, Throwable throwable) {
                    log.debug("WS send to {} failed: {}", describe(), throwable.toString());
                    onFailure.accept(UndertowObserverChannel.this);
                }
            });
            return SendResult.OK;
        } catch (RuntimeException e) {
            log.debug("WS send to {} rejected: {}", describe(), e.toString());
            return SendResult.FAILED;
        }
    }

    @Override
    public String describe() {
        return String.valueOf(channel.getSourceAddress());
    }

    @Override
    public void close() {
        try {
            channel.close();
        } catch (IOException e) {
            log.debug("WS close for {} failed: {}", describe(), e.toString());
        }
    }
}
