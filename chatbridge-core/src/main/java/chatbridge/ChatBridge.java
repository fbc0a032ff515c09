package chatbridge;

import chatbridge.compose.MessageComposer;
import chatbridge.dispatch.CoalescingPolicy;
import chatbridge.dispatch.DeliveryOutcome;
import chatbridge.dispatch.DispatchReport;
import chatbridge.dispatch.NotificationDispatcher;
import chatbridge.match.NotificationMatcher;
import chatbridge.model.ForumPost;
import chatbridge.model.MatchedTarget;
import chatbridge.rules.FilterRuleEngine;
import chatbridge.spi.CategoryRegistry;
import chatbridge.spi.ChatDelivery;
import chatbridge.spi.ConversationStore;
import chatbridge.spi.ExcerptFormatter;
import chatbridge.spi.FilterStore;
import chatbridge.spi.MetricsExporter;
import chatbridge.spi.PostVisibility;
import chatbridge.spi.TagRegistry;
import chatbridge.store.InMemoryConversationStore;
import chatbridge.store.InMemoryFilterStore;

import java.time.Clock;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composite entry point that wires the {@link FilterRuleEngine},
 * {@link NotificationMatcher}, {@link MessageComposer} and
 * {@link NotificationDispatcher} into a single {@link AutoCloseable} unit.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (ChatBridge bridge = ChatBridge.builder()
 *     .filterStore(filterStore)
 *     .conversationStore(conversationStore)
 *     .delivery(delivery)
 *     .tagRegistry(tags)
 *     .excerptFormatter(excerpts)
 *     .build()) {
 *   bridge.rules().setCategoryFilter("#general", FilterScope.ALL, FilterSetting.WATCH);
 *   bridge.notify(post, visibility);
 * }
 * }</pre>
 */
public final class ChatBridge implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ChatBridge.class.getName());

  private final ChatBridgeSettings settings;
  private final FilterRuleEngine rules;
  private final NotificationMatcher matcher;
  private final NotificationDispatcher dispatcher;
  private final PostVisibility defaultVisibility;
  private final MetricsExporter metrics;

  private ChatBridge(Builder builder) {
    this.settings = builder.settings;
    this.metrics = builder.metrics;
    this.defaultVisibility = builder.visibility;
    this.rules = new FilterRuleEngine(builder.filterStore, builder.tagRegistry);
    this.matcher = new NotificationMatcher(builder.filterStore, settings::isTaggingEnabled);
    MessageComposer composer = new MessageComposer(builder.categoryRegistry,
        builder.excerptFormatter, settings);
    CoalescingPolicy policy = CoalescingPolicy.from(settings, builder.clock);
    this.dispatcher = new NotificationDispatcher(builder.delivery, builder.conversationStore,
        composer, policy, metrics);
  }

  /**
   * Returns the rule engine for editing and listing subscriptions.
   */
  public FilterRuleEngine rules() {
    return rules;
  }

  public NotificationMatcher matcher() {
    return matcher;
  }

  public ChatBridgeSettings settings() {
    return settings;
  }

  /**
   * Processes a post-creation event using the visibility check configured on the builder.
   */
  public DispatchReport notify(ForumPost post) {
    return notify(post, defaultVisibility);
  }

  /**
   * Processes a post-creation event.
   *
   * <p>The event is skipped when the bridge is disabled, the post is not a regular post,
   * the topic is a private conversation, or {@code visibility} denies access. Otherwise
   * the post is matched against the subscription rules and delivered to every target.
   * Delivery failures are reported in the returned report, never thrown.
   *
   * @param post       the new post
   * @param visibility whether the bridge user may see the post; {@code null} allows all
   * @return what happened to the event
   */
  public DispatchReport notify(ForumPost post, PostVisibility visibility) {
    Objects.requireNonNull(post, "post");
    DispatchReport.SkipReason skip = precheck(post, visibility);
    if (skip != null) {
      metrics.incrementNotifySkipped();
      logger.log(Level.FINE, "Skipping post {0}: {1}", new Object[]{post.id(), skip});
      return DispatchReport.skipped(post.id(), skip);
    }

    List<MatchedTarget> targets = matcher.match(post);
    metrics.recordTargets((int) targets.stream().map(MatchedTarget::channel).distinct().count());
    if (targets.isEmpty()) {
      return DispatchReport.delivered(post.id(), List.of());
    }
    List<DeliveryOutcome> outcomes = dispatcher.dispatch(post, targets);
    logger.log(Level.FINE, "Post {0} delivered to {1} channel(s)",
        new Object[]{post.id(), outcomes.size()});
    return DispatchReport.delivered(post.id(), outcomes);
  }

  private DispatchReport.SkipReason precheck(ForumPost post, PostVisibility visibility) {
    if (!settings.isEnabled()) {
      return DispatchReport.SkipReason.DISABLED;
    }
    if (!post.regular()) {
      return DispatchReport.SkipReason.NOT_REGULAR;
    }
    if (post.topic().privateMessage()) {
      return DispatchReport.SkipReason.PRIVATE_MESSAGE;
    }
    if (visibility != null && !visibility.canSee(post)) {
      return DispatchReport.SkipReason.NOT_VISIBLE;
    }
    return null;
  }

  @Override
  public void close() {
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        throw (e instanceof RuntimeException r)
            ? r
            : new ChatBridgeException("Failed to close metrics exporter", e);
      }
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builder for {@link ChatBridge}.
   */
  public static final class Builder {
    private FilterStore filterStore;
    private ConversationStore conversationStore;
    private ChatDelivery delivery;
    private TagRegistry tagRegistry;
    private CategoryRegistry categoryRegistry;
    private ExcerptFormatter excerptFormatter;
    private PostVisibility visibility = PostVisibility.ALL;
    private ChatBridgeSettings settings;
    private MetricsExporter metrics;
    private Clock clock;
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {
    }

    /**
     * Sets the subscription rule store.
     *
     * <p>Optional. Defaults to an {@link InMemoryFilterStore}.
     */
    public Builder filterStore(FilterStore filterStore) {
      this.filterStore = filterStore;
      return this;
    }

    /**
     * Sets the conversation state store.
     *
     * <p>Optional. Defaults to an {@link InMemoryConversationStore}.
     */
    public Builder conversationStore(ConversationStore conversationStore) {
      this.conversationStore = conversationStore;
      return this;
    }

    /**
     * Sets the chat transport.
     *
     * <p><b>Required.</b>
     */
    public Builder delivery(ChatDelivery delivery) {
      this.delivery = delivery;
      return this;
    }

    /**
     * Sets the tag lookup used to validate tag filters.
     *
     * <p>Optional. Defaults to a registry that accepts every tag.
     */
    public Builder tagRegistry(TagRegistry tagRegistry) {
      this.tagRegistry = tagRegistry;
      return this;
    }

    /**
     * Sets the category lookup used for titles and colors.
     *
     * <p>Optional. Defaults to a registry that knows no categories.
     */
    public Builder categoryRegistry(CategoryRegistry categoryRegistry) {
      this.categoryRegistry = categoryRegistry;
      return this;
    }

    /**
     * Sets the post excerpt renderer.
     *
     * <p><b>Required.</b>
     */
    public Builder excerptFormatter(ExcerptFormatter excerptFormatter) {
      this.excerptFormatter = excerptFormatter;
      return this;
    }

    /**
     * Sets the visibility check used by {@link ChatBridge#notify(ForumPost)}.
     *
     * <p>Optional. Defaults to {@link PostVisibility#ALL}.
     */
    public Builder visibility(PostVisibility visibility) {
      this.visibility = Objects.requireNonNull(visibility, "visibility");
      return this;
    }

    public Builder settings(ChatBridgeSettings settings) {
      this.settings = settings;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the clock used for the freshness window. Intended for tests.
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Builds the bridge.
     *
     * @throws NullPointerException  if a required component is missing
     * @throws IllegalStateException if called twice
     */
    public ChatBridge build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      Objects.requireNonNull(delivery, "delivery");
      Objects.requireNonNull(excerptFormatter, "excerptFormatter");
      if (filterStore == null) filterStore = new InMemoryFilterStore();
      if (conversationStore == null) conversationStore = new InMemoryConversationStore();
      if (tagRegistry == null) tagRegistry = names -> new LinkedHashSet<>(names);
      if (categoryRegistry == null) categoryRegistry = id -> null;
      if (settings == null) settings = new ChatBridgeSettings();
      if (metrics == null) metrics = MetricsExporter.NOOP;
      if (clock == null) clock = Clock.systemUTC();
      return new ChatBridge(this);
    }
  }
}
