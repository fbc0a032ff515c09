package chatbridge.slack;

import chatbridge.DeliveryException;
import chatbridge.json.ChatBridgeJson;
import chatbridge.model.Attachment;
import chatbridge.model.ChatMessage;
import chatbridge.model.ConversationState;
import chatbridge.spi.DeliveryReceipt;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SlackApiDeliveryTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:07:00Z");

    private FakeSlackServer slack;
    private SlackApiDelivery delivery;

    @BeforeEach
    void setUp() {
        slack = new FakeSlackServer();
        HttpClient client = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build();
        delivery = new SlackApiDelivery(client, slack.uri("/api"), "xoxb-test",
                Duration.ofSeconds(5), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        slack.close();
    }

    // ── chat.postMessage ────────────────────────────────────────────

    @Test
    void postSendsFormWithBareChannel() {
        slack.respond("/api/chat.postMessage", 200,
                "{\"ok\":true,\"channel\":\"C024BE91L\",\"ts\":\"1714557600.000100\"}");

        DeliveryReceipt receipt = delivery.post(message("#general", attachment("first")));

        FakeSlackServer.Recorded request = slack.requests.get(0);
        assertEquals("POST", request.method());
        assertTrue(request.contentType().startsWith("application/x-www-form-urlencoded"));
        Map<String, String> form = request.form();
        assertEquals("xoxb-test", form.get("token"));
        assertEquals("Forum", form.get("username"));
        assertEquals("https://forum.test/icon.png", form.get("icon_url"));
        assertEquals("general", form.get("channel"));
        JsonNode attachments = ChatBridgeJson.readTree(form.get("attachments"));
        assertEquals("first", attachments.get(0).get("text").asText());
        assertFalse(form.containsKey("ts"));

        assertEquals("1714557600.000100", receipt.messageId());
        assertEquals("C024BE91L", receipt.vendorChannel());
        assertEquals(Instant.parse("2024-05-01T10:00:00.000100Z"), receipt.sentAt());
        assertEquals(1, receipt.message().attachments().size());
    }

    @Test
    void postUsesEchoedMessage() {
        slack.respond("/api/chat.postMessage", 200,
                "{\"ok\":true,\"channel\":\"C1\",\"ts\":\"1714557600.000100\","
                        + "\"message\":{\"username\":\"Forum\",\"text\":\"\",\"attachments\":"
                        + "[{\"id\":1,\"fallback\":\"f\",\"text\":\"echoed\",\"mrkdwn_in\":[\"text\"]}]}}");

        DeliveryReceipt receipt = delivery.post(message("#general", attachment("sent")));

        assertEquals("echoed", receipt.message().attachments().get(0).text());
        assertEquals("https://forum.test/icon.png", receipt.message().iconUrl());
        assertNull(receipt.message().text());
    }

    @Test
    void okFalseRaisesWithErrorCode() {
        slack.respond("/api/chat.postMessage", 200, "{\"ok\":false,\"error\":\"channel_not_found\"}");

        DeliveryException e = assertThrows(DeliveryException.class,
                () -> delivery.post(message("#nope", attachment("x"))));

        assertEquals("#nope", e.channel());
        assertEquals("channel_not_found", e.errorCode());
    }

    @Test
    void httpErrorRaises() {
        slack.respond("/api/chat.postMessage", 503, "busy");

        DeliveryException e = assertThrows(DeliveryException.class,
                () -> delivery.post(message("#general", attachment("x"))));
        assertEquals("http_503", e.errorCode());
    }

    @Test
    void unreadableResponseRaises() {
        slack.respond("/api/chat.postMessage", 200, "<html>");

        assertThrows(DeliveryException.class, () -> delivery.post(message("#general", attachment("x"))));
    }

    // ── chat.update ─────────────────────────────────────────────────

    @Test
    void updateTargetsVendorChannelAndTs() {
        slack.respond("/api/chat.update", 200,
                "{\"ok\":true,\"channel\":\"C024BE91L\",\"ts\":\"1714557600.000100\"}");
        ChatMessage previous = message("C024BE91L", attachment("one"));
        ConversationState state = new ConversationState("10", "#general", "C024BE91L", "1714557600.000100",
                previous, Instant.parse("2024-05-01T10:00:00Z"));

        DeliveryReceipt receipt = delivery.update(state,
                previous.appendAttachments(List.of(attachment("two"))));

        Map<String, String> form = slack.requests.get(0).form();
        assertEquals("/api/chat.update", slack.requests.get(0).path());
        assertEquals("C024BE91L", form.get("channel"));
        assertEquals("1714557600.000100", form.get("ts"));
        assertEquals("", form.get("text"));
        assertEquals("Forum", form.get("username"));
        assertEquals(2, ChatBridgeJson.readTree(form.get("attachments")).size());
        assertFalse(form.containsKey("icon_url"));

        assertEquals("1714557600.000100", receipt.messageId());
        assertEquals(NOW, receipt.sentAt());
        assertEquals(2, receipt.message().attachments().size());
    }

    @Test
    void updateFailureNamesSubscriptionChannel() {
        slack.respond("/api/chat.update", 200, "{\"ok\":false,\"error\":\"message_not_found\"}");
        ConversationState state = new ConversationState("10", "#general", "C1", "1.0",
                message("C1", attachment("one")), NOW);

        DeliveryException e = assertThrows(DeliveryException.class,
                () -> delivery.update(state, state.message()));
        assertEquals("#general", e.channel());
        assertEquals("message_not_found", e.errorCode());
    }

    @Test
    void rejectsBlankToken() {
        assertThrows(IllegalArgumentException.class, () -> new SlackApiDelivery(" "));
    }

    @Test
    void formEncodingEscapesReservedCharacters() {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("a", "x y");
        form.put("b", "#c&d");
        assertEquals("a=x+y&b=%23c%26d", SlackApiDelivery.formEncode(form));
    }

    static ChatMessage message(String channel, Attachment... attachments) {
        return new ChatMessage(channel, "Forum", "https://forum.test/icon.png", null, List.of(attachments));
    }

    static Attachment attachment(String text) {
        return new Attachment("Topic - @alice", "@alice", null, "#25AAE2", text, null, null, null,
                List.of("text"));
    }
}
