package com.matey.anomaly.core.feed;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link FeedTransport} over a WebSocket, using Spring's {@link StandardWebSocketClient}
 * on top of the JSR-356 container shipped with spring-boot-starter-websocket.
 */
@Slf4j
public class WebSocketFeedTransport implements FeedTransport {

    private final WebSocketClient client;
    private final Duration connectTimeout;
    private final int maxTextMessageBytes;

    public WebSocketFeedTransport(Duration connectTimeout, int maxTextMessageBytes) {
        this(new StandardWebSocketClient(), connectTimeout, maxTextMessageBytes);
    }

    public WebSocketFeedTransport(WebSocketClient client, Duration connectTimeout, int maxTextMessageBytes) {
        this.client = client;
        this.connectTimeout = connectTimeout;
        this.maxTextMessageBytes = maxTextMessageBytes;
    }

    @Override
    public FeedSession connect(URI uri, BlockingQueue<FeedFrame> inbox) throws FeedTransportException {
        InboxHandler handler = new InboxHandler(inbox, maxTextMessageBytes);
        try {
            WebSocketSession session = client.execute(handler, new WebSocketHttpHeaders(), uri)
                    .get(connectTimeout.toMillis(), TimeUnit.MILLISECONDS);
            return new WebSocketFeedSession(session);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FeedTransportException("Interrupted while connecting to " + uri, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new FeedTransportException("Connect to " + uri + " failed: " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            throw new FeedTransportException("Connect to " + uri + " timed out after " + connectTimeout, e);
        }
    }

    @RequiredArgsConstructor
    private static final class InboxHandler extends TextWebSocketHandler {

        private final BlockingQueue<FeedFrame> inbox;
        private final int maxTextMessageBytes;

        @Override
        public void afterConnectionEstablished(WebSocketSession session) {
            session.setTextMessageSizeLimit(maxTextMessageBytes);
        }

        @Override
        protected void handleTextMessage(WebSocketSession session, TextMessage message) {
            inbox.offer(FeedFrame.text(message.getPayload()));
        }

        @Override
        public void handleTransportError(WebSocketSession session, Throwable exception) {
            inbox.offer(FeedFrame.error(exception));
        }

        @Override
        public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
            inbox.offer(FeedFrame.closed(status.toString()));
        }
    }

    @RequiredArgsConstructor
    private static final class WebSocketFeedSession implements FeedSession {

        private final WebSocketSession session;

        @Override
        public void send(String text) throws FeedTransportException {
            try {
                session.sendMessage(new TextMessage(text));
            } catch (IOException | IllegalStateException e) {
                throw new FeedTransportException("Send failed: " + e.getMessage(), e);
            }
        }

        @Override
        public boolean isOpen() {
            return session.isOpen();
        }

        @Override
        public void close() {
            if (!session.isOpen()) {
                return;
            }
            try {
                session.close(CloseStatus.NORMAL);
            } catch (IOException e) {
                log.debug("Error while closing feed session {}: {}", session.getId(), e.getMessage());
            }
        }
    }
}
