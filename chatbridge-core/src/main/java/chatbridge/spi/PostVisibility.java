package chatbridge.spi;

import chatbridge.model.ForumPost;

/**
 * Permission check supplied with each notification: can the acting bridge user
 * see the post? Posts that fail the check are skipped silently.
 */
@FunctionalInterface
public interface PostVisibility {

  PostVisibility ALL = post -> true;

  boolean canSee(ForumPost post);
}
