package chatbridge;

/**
 * Thrown when a rule references a tag the host's tag registry does not know.
 * No rule has been modified when this is thrown.
 */
public final class TagNotFoundException extends ChatBridgeException {
  private final String tag;

  public TagNotFoundException(String tag) {
    super("Tag not found: " + tag);
    this.tag = tag;
  }

  /**
   * Returns the first tag name that failed the lookup.
   */
  public String tag() {
    return tag;
  }
}
