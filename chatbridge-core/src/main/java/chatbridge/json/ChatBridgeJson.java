package chatbridge.json;

import chatbridge.ChatBridgeException;
import chatbridge.model.Attachment;
import chatbridge.model.ChatMessage;
import chatbridge.model.ConversationState;
import chatbridge.model.FilterLevel;
import chatbridge.model.SubscriptionRule;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * JSON codecs for persisted rules, conversation state and chat payloads.
 *
 * <p>Rule lists are stored as {@code [{"channel","filter","tags"}]} with {@code tags}
 * written as {@code null} when the rule has no tag filter. Conversation state is stored as
 * {@code {"ts","channel","message","created_at"}}. Chat payloads use the vendor's
 * snake_case field names; {@code null} fields are omitted.
 */
public final class ChatBridgeJson {
  private static final Logger logger = Logger.getLogger(ChatBridgeJson.class.getName());

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private ChatBridgeJson() {
  }

  public static ObjectMapper mapper() {
    return MAPPER;
  }

  // ── Rules ──

  public static String writeRules(List<SubscriptionRule> rules) {
    ArrayNode array = MAPPER.createArrayNode();
    for (SubscriptionRule rule : rules) {
      ObjectNode node = array.addObject();
      node.put("channel", rule.channel());
      node.put("filter", rule.level().code());
      if (rule.hasTags()) {
        ArrayNode tags = node.putArray("tags");
        rule.tags().forEach(tags::add);
      } else {
        node.putNull("tags");
      }
    }
    return write(array);
  }

  /**
   * Decodes a rule list. Entries without a channel, with an unknown filter level or
   * with malformed tags are skipped with a warning.
   *
   * @throws ChatBridgeException if {@code json} is not a JSON array
   */
  public static List<SubscriptionRule> readRules(String json) {
    return readRules(json, false);
  }

  /**
   * Decodes a rule list, rejecting the whole record when any entry is malformed.
   *
   * @throws ChatBridgeException if {@code json} is not a JSON array of well-formed rules
   */
  public static List<SubscriptionRule> readRulesStrict(String json) {
    return readRules(json, true);
  }

  private static List<SubscriptionRule> readRules(String json, boolean strict) {
    JsonNode root = readTree(json);
    if (!root.isArray()) {
      throw new ChatBridgeException("Expected a JSON array of rules but got " + root.getNodeType());
    }
    List<SubscriptionRule> rules = new ArrayList<>(root.size());
    for (JsonNode node : root) {
      String channel = text(node, "channel");
      String filter = text(node, "filter");
      if (channel == null || filter == null) {
        malformed(strict, "malformed rule " + node);
        continue;
      }
      FilterLevel level;
      try {
        level = FilterLevel.parse(filter);
      } catch (IllegalArgumentException e) {
        malformed(strict, "rule for " + channel + ": " + e.getMessage());
        continue;
      }
      Set<String> tags = readTags(node.get("tags"));
      if (tags == null) {
        malformed(strict, "rule for " + channel + " with malformed tags " + node.get("tags"));
        continue;
      }
      rules.add(new SubscriptionRule(channel, level, tags));
    }
    return rules;
  }

  private static void malformed(boolean strict, String message) {
    if (strict) {
      throw new ChatBridgeException(message);
    }
    logger.warning("Skipping " + message);
  }

  /**
   * Missing, {@code null} and empty tags decode to an empty set. Returns {@code null}
   * for anything other than an array of non-blank strings.
   */
  private static Set<String> readTags(JsonNode tagsNode) {
    Set<String> tags = new LinkedHashSet<>();
    if (tagsNode == null || tagsNode.isNull()) {
      return tags;
    }
    if (!tagsNode.isArray()) {
      return null;
    }
    for (JsonNode tag : tagsNode) {
      if (!tag.isTextual() || tag.asText().isBlank()) {
        return null;
      }
      tags.add(tag.asText());
    }
    return tags;
  }

  // ── Conversation state ──

  public static String writeState(ConversationState state) {
    ObjectNode node = MAPPER.createObjectNode();
    node.put("ts", state.messageId());
    if (state.vendorChannel() != null) {
      node.put("channel", state.vendorChannel());
    }
    node.set("message", messageNode(state.message()));
    node.put("created_at", state.createdAt().toString());
    return write(node);
  }

  /**
   * Decodes a stored conversation state.
   *
   * @throws ChatBridgeException if the record is not valid JSON or lacks {@code ts},
   *     {@code message} or {@code created_at}
   */
  public static ConversationState readState(String topicId, String channel, String json) {
    JsonNode node = readTree(json);
    String ts = text(node, "ts");
    JsonNode message = node.get("message");
    Instant createdAt = instant(node.get("created_at"));
    if (ts == null || message == null || !message.isObject() || createdAt == null) {
      throw new ChatBridgeException("Incomplete conversation state for topic " + topicId
          + " in " + channel);
    }
    String vendorChannel = text(node, "channel");
    return new ConversationState(topicId, channel, vendorChannel, ts,
        readMessage(message, vendorChannel != null ? vendorChannel : channel), createdAt);
  }

  // ── Chat payloads ──

  public static ObjectNode messageNode(ChatMessage message) {
    ObjectNode node = MAPPER.createObjectNode();
    node.put("channel", message.channel());
    putIfPresent(node, "username", message.username());
    putIfPresent(node, "icon_url", message.iconUrl());
    putIfPresent(node, "text", message.text());
    node.set("attachments", attachmentsNode(message.attachments()));
    return node;
  }

  public static ArrayNode attachmentsNode(List<Attachment> attachments) {
    ArrayNode array = MAPPER.createArrayNode();
    for (Attachment a : attachments) {
      ObjectNode node = array.addObject();
      putIfPresent(node, "fallback", a.fallback());
      putIfPresent(node, "author_name", a.authorName());
      putIfPresent(node, "author_icon", a.authorIcon());
      putIfPresent(node, "color", a.color());
      putIfPresent(node, "text", a.text());
      putIfPresent(node, "title", a.title());
      putIfPresent(node, "title_link", a.titleLink());
      putIfPresent(node, "thumb_url", a.thumbUrl());
      if (!a.mrkdwnIn().isEmpty()) {
        ArrayNode fields = node.putArray("mrkdwn_in");
        a.mrkdwnIn().forEach(fields::add);
      }
    }
    return array;
  }

  /**
   * Decodes a chat payload.
   *
   * @param node           the payload object
   * @param defaultChannel channel used when the payload carries none
   */
  public static ChatMessage readMessage(JsonNode node, String defaultChannel) {
    String channel = text(node, "channel");
    List<Attachment> attachments = new ArrayList<>();
    JsonNode array = node.get("attachments");
    if (array != null && array.isArray()) {
      for (JsonNode a : array) {
        List<String> mrkdwnIn = new ArrayList<>();
        JsonNode fields = a.get("mrkdwn_in");
        if (fields != null && fields.isArray()) {
          fields.forEach(f -> mrkdwnIn.add(f.asText()));
        }
        attachments.add(new Attachment(
            text(a, "fallback"),
            text(a, "author_name"),
            text(a, "author_icon"),
            text(a, "color"),
            text(a, "text"),
            text(a, "title"),
            text(a, "title_link"),
            text(a, "thumb_url"),
            mrkdwnIn));
      }
    }
    return new ChatMessage(channel != null ? channel : defaultChannel,
        text(node, "username"), text(node, "icon_url"), text(node, "text"), attachments);
  }

  // ── Helpers ──

  public static JsonNode readTree(String json) {
    if (json == null) {
      throw new ChatBridgeException("Cannot decode null JSON");
    }
    try {
      return MAPPER.readTree(json);
    } catch (JsonProcessingException e) {
      throw new ChatBridgeException("Malformed JSON: " + e.getOriginalMessage(), e);
    }
  }

  public static String write(JsonNode node) {
    try {
      return MAPPER.writeValueAsString(node);
    } catch (JsonProcessingException e) {
      throw new ChatBridgeException("Failed to encode JSON", e);
    }
  }

  /**
   * Returns the textual field {@code name}, or {@code null} if absent, null or not text.
   */
  public static String text(JsonNode node, String name) {
    JsonNode value = node.get(name);
    return value != null && value.isTextual() ? value.asText() : null;
  }

  private static Instant instant(JsonNode value) {
    if (value == null || value.isNull()) {
      return null;
    }
    if (value.isNumber()) {
      return Instant.ofEpochMilli((long) (value.asDouble() * 1000));
    }
    try {
      return Instant.parse(value.asText());
    } catch (DateTimeParseException e) {
      return null;
    }
  }

  private static void putIfPresent(ObjectNode node, String name, String value) {
    if (value != null) {
      node.put(name, value);
    }
  }
}
