package chatbridge.dispatch;

import chatbridge.ChatBridgeSettings;
import chatbridge.DeliveryException;
import chatbridge.MutableClock;
import chatbridge.Posts;
import chatbridge.RecordingDelivery;
import chatbridge.compose.MessageComposer;
import chatbridge.model.ConversationState;
import chatbridge.model.FilterLevel;
import chatbridge.model.ForumTopic;
import chatbridge.model.MatchedTarget;
import chatbridge.spi.MetricsExporter;
import chatbridge.store.InMemoryConversationStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NotificationDispatcherTest {

    private static final MatchedTarget GENERAL = new MatchedTarget("#general", FilterLevel.WATCH);
    private static final MatchedTarget RANDOM = new MatchedTarget("#random", FilterLevel.WATCH);

    private final ForumTopic topic = Posts.topic("10", "1");

    private MutableClock clock;
    private RecordingDelivery delivery;
    private InMemoryConversationStore conversations;
    private CountingMetrics metrics;
    private NotificationDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        delivery = new RecordingDelivery(clock);
        conversations = new InMemoryConversationStore();
        metrics = new CountingMetrics();
        dispatcher = dispatcher(delivery);
    }

    private NotificationDispatcher dispatcher(RecordingDelivery d) {
        MessageComposer composer = new MessageComposer(id -> null, (p, max) -> "body " + p.id(),
                new ChatBridgeSettings());
        CoalescingPolicy policy = new CoalescingPolicy(Duration.ofMinutes(5), 5, clock);
        return new NotificationDispatcher(d, conversations, composer, policy, metrics);
    }

    // ── Coalescing ──────────────────────────────────────────────────

    @Test
    void secondPostWithinWindowEditsExistingMessage() {
        dispatcher.dispatch(Posts.firstPost(topic), List.of(GENERAL));
        clock.advance(Duration.ofMinutes(1));
        List<DeliveryOutcome> outcomes = dispatcher.dispatch(Posts.reply(topic, 2), List.of(GENERAL));

        assertEquals(1, delivery.posts.size());
        assertEquals(1, delivery.updates.size());
        DeliveryOutcome.Updated updated = assertInstanceOf(DeliveryOutcome.Updated.class, outcomes.get(0));
        assertEquals(2, updated.attachments());

        RecordingDelivery.Update update = delivery.updates.get(0);
        assertEquals("C-general", update.message().channel());
        assertNotNull(update.message().attachments().get(0).title());
        assertNull(update.message().attachments().get(1).title());
        assertEquals(1, metrics.created.get());
        assertEquals(1, metrics.updated.get());
    }

    @Test
    void capReachedStartsNewThread() {
        dispatcher.dispatch(Posts.firstPost(topic), List.of(GENERAL));
        for (int n = 2; n <= 5; n++) {
            dispatcher.dispatch(Posts.reply(topic, n), List.of(GENERAL));
        }
        assertEquals(1, delivery.posts.size());
        assertEquals(4, delivery.updates.size());
        assertEquals(5, conversations.find("10", "#general").attachmentCount());

        DeliveryOutcome outcome = dispatcher.dispatch(Posts.reply(topic, 6), List.of(GENERAL)).get(0);

        assertInstanceOf(DeliveryOutcome.Created.class, outcome);
        assertEquals(2, delivery.posts.size());
        assertEquals(1, conversations.find("10", "#general").attachmentCount());
    }

    @Test
    void staleStateStartsNewThread() {
        dispatcher.dispatch(Posts.firstPost(topic), List.of(GENERAL));
        clock.advance(Duration.ofMinutes(5));
        dispatcher.dispatch(Posts.reply(topic, 2), List.of(GENERAL));

        assertEquals(2, delivery.posts.size());
        assertTrue(delivery.updates.isEmpty());
        assertNotNull(delivery.posts.get(1).attachments().get(0).title());
    }

    @Test
    void editRenewsFreshnessWindow() {
        dispatcher.dispatch(Posts.firstPost(topic), List.of(GENERAL));
        clock.advance(Duration.ofMinutes(4));
        dispatcher.dispatch(Posts.reply(topic, 2), List.of(GENERAL));
        clock.advance(Duration.ofMinutes(4));
        dispatcher.dispatch(Posts.reply(topic, 3), List.of(GENERAL));

        assertEquals(1, delivery.posts.size());
        assertEquals(2, delivery.updates.size());
    }

    @Test
    void stateIsKeptPerChannel() {
        dispatcher.dispatch(Posts.firstPost(topic), List.of(GENERAL));
        dispatcher.dispatch(Posts.reply(topic, 2), List.of(RANDOM));

        assertEquals(2, delivery.posts.size());
        ConversationState general = conversations.find("10", "#general");
        ConversationState random = conversations.find("10", "#random");
        assertEquals("C-general", general.vendorChannel());
        assertEquals("C-random", random.vendorChannel());
    }

    // ── Webhook mode ────────────────────────────────────────────────

    @Test
    void webhookModeAlwaysPostsAndKeepsNoState() {
        RecordingDelivery webhook = new RecordingDelivery(clock, false);
        NotificationDispatcher d = dispatcher(webhook);

        d.dispatch(Posts.firstPost(topic), List.of(GENERAL));
        d.dispatch(Posts.reply(topic, 2), List.of(GENERAL));

        assertEquals(2, webhook.posts.size());
        assertEquals(0, conversations.size());
    }

    // ── Failures ────────────────────────────────────────────────────

    @Test
    void failureOnOneChannelDoesNotStopOthers() {
        delivery.failFor("#general");

        List<DeliveryOutcome> outcomes = dispatcher.dispatch(Posts.firstPost(topic), List.of(GENERAL, RANDOM));

        assertEquals(2, outcomes.size());
        DeliveryOutcome.Failed failed = assertInstanceOf(DeliveryOutcome.Failed.class, outcomes.get(0));
        assertInstanceOf(DeliveryException.class, failed.error());
        assertInstanceOf(DeliveryOutcome.Created.class, outcomes.get(1));
        assertEquals(1, delivery.postsTo("#random").size());
        assertNull(conversations.find("10", "#general"));
        assertEquals(1, metrics.failed.get());
    }

    @Test
    void channelIsDeliveredOncePerEvent() {
        List<DeliveryOutcome> outcomes = dispatcher.dispatch(Posts.firstPost(topic),
                List.of(new MatchedTarget("#general", FilterLevel.FOLLOW), GENERAL));

        assertEquals(1, outcomes.size());
        assertEquals(FilterLevel.FOLLOW, outcomes.get(0).level());
        assertEquals(1, delivery.posts.size());
    }

    // ── Concurrency ─────────────────────────────────────────────────

    @Test
    void concurrentPostsToOneConversationOpenOneThread() throws Exception {
        int threads = 4;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                int postNumber = i + 2;
                futures.add(pool.submit(() -> {
                    start.await();
                    return dispatcher.dispatch(Posts.reply(topic, postNumber), List.of(GENERAL));
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(5, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, delivery.posts.size());
        assertEquals(threads - 1, delivery.updates.size());
        assertEquals(threads, conversations.find("10", "#general").attachmentCount());
    }

    private static final class CountingMetrics implements MetricsExporter {
        final AtomicInteger created = new AtomicInteger();
        final AtomicInteger updated = new AtomicInteger();
        final AtomicInteger failed = new AtomicInteger();

        @Override
        public void incrementDeliveryCreated() {
            created.incrementAndGet();
        }

        @Override
        public void incrementDeliveryUpdated() {
            updated.incrementAndGet();
        }

        @Override
        public void incrementDeliveryFailed() {
            failed.incrementAndGet();
        }
    }
}
