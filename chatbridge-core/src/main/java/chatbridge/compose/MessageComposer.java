package chatbridge.compose;

import chatbridge.ChatBridgeSettings;
import chatbridge.model.Attachment;
import chatbridge.model.Author;
import chatbridge.model.Category;
import chatbridge.model.ChatMessage;
import chatbridge.model.ForumPost;
import chatbridge.model.ForumTopic;
import chatbridge.spi.CategoryRegistry;
import chatbridge.spi.ExcerptFormatter;

import java.util.List;
import java.util.Objects;

/**
 * Builds the outbound chat message for a post.
 *
 * <p>The title, title link and thumbnail are only populated for a message that opens
 * a new conversation thread. Follow-up attachments coalesced into an existing message
 * omit them so the chat client does not re-render the link preview on every edit.
 */
public final class MessageComposer {
  static final String UNCATEGORIZED = "uncategorized";

  private final CategoryRegistry categories;
  private final ExcerptFormatter excerptFormatter;
  private final ChatBridgeSettings settings;

  public MessageComposer(CategoryRegistry categories, ExcerptFormatter excerptFormatter,
      ChatBridgeSettings settings) {
    this.categories = Objects.requireNonNull(categories, "categories");
    this.excerptFormatter = Objects.requireNonNull(excerptFormatter, "excerptFormatter");
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  /**
   * @param post      the post
   * @param channel   destination channel
   * @param newThread whether the message opens a new thread
   * @return a message with exactly one attachment
   */
  public ChatMessage compose(ForumPost post, String channel, boolean newThread) {
    Objects.requireNonNull(post, "post");
    Objects.requireNonNull(channel, "channel");
    return new ChatMessage(channel, settings.getUsername(), settings.getIconUrl(), null,
        List.of(attachment(post, newThread)));
  }

  /**
   * Builds the single attachment describing {@code post}.
   */
  public Attachment attachment(ForumPost post, boolean newThread) {
    ForumTopic topic = post.topic();
    Category category = topic.categoryId() == null ? null : categories.find(topic.categoryId());
    String displayName = displayName(post.author());

    String title = null;
    String titleLink = null;
    String thumbUrl = null;
    if (newThread) {
      title = title(topic, category);
      titleLink = post.url();
      thumbUrl = post.url();
    }

    return new Attachment(
        topic.title() + " - " + displayName,
        displayName,
        post.author().avatarUrl(),
        category == null || category.color() == null ? null : "#" + category.color(),
        excerptFormatter.excerpt(post, settings.getExcerptLength()),
        title,
        titleLink,
        thumbUrl,
        List.of("text"));
  }

  /**
   * Returns {@code "Full Name @username"}, or just {@code "@username"} when the full
   * name is blank or only restates the username (case-insensitive, with spaces either
   * replaced by {@code _} or removed).
   */
  public static String displayName(Author author) {
    String handle = "@" + author.username();
    String fullName = author.name() == null ? "" : author.name().trim();
    if (fullName.isEmpty()) {
      return handle;
    }
    String collapsed = fullName.replaceAll("\\s+", " ");
    if (collapsed.replace(' ', '_').equalsIgnoreCase(author.username())
        || collapsed.replace(" ", "").equalsIgnoreCase(author.username())) {
      return handle;
    }
    return fullName + " " + handle;
  }

  String title(ForumTopic topic, Category category) {
    StringBuilder title = new StringBuilder(topic.title());
    String label = categoryLabel(category);
    if (label != null) {
      title.append(' ').append(label);
    }
    if (!topic.tags().isEmpty()) {
      title.append(' ').append(String.join(", ", topic.tags()));
    }
    return title.toString();
  }

  private String categoryLabel(Category category) {
    if (category == null) {
      return null;
    }
    if (category.parentId() != null) {
      Category parent = categories.find(category.parentId());
      if (parent != null) {
        return "[" + parent.name() + "/" + category.name() + "]";
      }
    }
    if (category.name() == null
        || UNCATEGORIZED.equalsIgnoreCase(category.slug())
        || UNCATEGORIZED.equalsIgnoreCase(category.name())) {
      return null;
    }
    return "[" + category.name() + "]";
  }
}
