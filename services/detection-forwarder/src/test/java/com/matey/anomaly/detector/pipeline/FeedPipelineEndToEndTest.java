package com.matey.anomaly.detector.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.matey.anomaly.core.feed.FeedConnector;
import com.matey.anomaly.core.feed.FeedFrame;
import com.matey.anomaly.core.feed.FeedSession;
import com.matey.anomaly.core.feed.FeedTransport;
import com.matey.anomaly.core.feed.FeedTransportException;
import com.matey.anomaly.core.forward.ForwardResult;
import com.matey.anomaly.core.forward.Forwarder;
import com.matey.anomaly.core.forward.ForwarderStats;
import com.matey.anomaly.core.lifecycle.ApplicationTerminator;
import com.matey.anomaly.core.model.CanonicalRecord;
import com.matey.anomaly.core.normalize.BinanceTradeNormalizer;
import com.matey.anomaly.core.retry.BackoffPolicy;
import com.matey.anomaly.detector.metrics.PipelineStats;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.BlockingQueue;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Raw exchange frames in, one batch of canonical records out to the forwarder.
 */
@ExtendWith(MockitoExtension.class)
class FeedPipelineEndToEndTest {

    @Mock
    private Forwarder forwarder;

    @Mock
    private ApplicationTerminator terminator;

    @Captor
    private ArgumentCaptor<List<CanonicalRecord>> batch;

    @Test
    void twoTradesBecomeOneBatchWithSynthesizedMessages() {
        ObjectMapper objectMapper = new ObjectMapper();
        FeedTransport transport = new OneShotTransport(
                FeedFrame.text("{\"result\":null,\"id\":1}"),
                FeedFrame.text("{\"e\":\"trade\",\"s\":\"BTCUSD\",\"t\":1,\"p\":\"100\",\"q\":\"1\",\"T\":1700000000000,\"m\":false}"),
                FeedFrame.text("{\"e\":\"trade\",\"s\":\"BTCUSD\",\"t\":2,\"p\":\"101\",\"q\":\"1\",\"T\":1700000001000,\"m\":true}"));
        FeedConnector connector = new FeedConnector(URI.create("wss://feed.test/ws"), List.of("btcusd@trade"),
                transport, BackoffPolicy.exponential(Duration.ofSeconds(1), Duration.ofSeconds(60)),
                objectMapper, Duration.ofMillis(10), Duration.ZERO);
        PipelineStats stats = new PipelineStats();
        FeedRecordSource source = new FeedRecordSource(connector, new BinanceTradeNormalizer(objectMapper), stats);

        when(forwarder.forward(anyList())).thenReturn(ForwardResult.success(List.of(), 1));
        when(forwarder.getStats()).thenReturn(new ForwarderStats());

        DetectionPipeline pipeline = new DetectionPipeline(source, forwarder, stats, terminator, List.of(),
                new BatchSettings(2, Duration.ofSeconds(5), Duration.ofMillis(50), Duration.ofSeconds(2)));
        pipeline.start();
        try {
            verify(forwarder, timeout(3_000)).forward(batch.capture());
        } finally {
            pipeline.shutdown();
        }

        assertThat(batch.getValue()).extracting(CanonicalRecord::getMessage).containsExactly(
                "BUY 1.0000 BTCUSD @ 100.00000000",
                "SELL 1.0000 BTCUSD @ 101.00000000");
        assertThat(batch.getValue()).extracting(CanonicalRecord::getSymbol).containsOnly("BTCUSD");
        assertThat(stats.getMalformed()).isZero();
    }

    /** Delivers the given frames on the first connect; later connects fail. */
    private static final class OneShotTransport implements FeedTransport {

        private final List<FeedFrame> frames;
        private boolean used;

        OneShotTransport(FeedFrame... frames) {
            this.frames = List.of(frames);
        }

        @Override
        public synchronized FeedSession connect(URI uri, BlockingQueue<FeedFrame> inbox) throws FeedTransportException {
            if (used) {
                throw new FeedTransportException("already used");
            }
            used = true;
            inbox.addAll(frames);
            return new FeedSession() {
                @Override
                public void send(String text) {
                }

                @Override
                public boolean isOpen() {
                    return true;
                }

                @Override
                public void close() {
                }
            };
        }
    }
}
