package chatbridge;

import chatbridge.model.Author;
import chatbridge.model.ForumPost;
import chatbridge.model.ForumTopic;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Post fixtures shared by the core tests.
 */
public final class Posts {

    public static final Author ALICE = new Author("alice", "Alice Liddell", "https://forum.test/a.png");

    private Posts() {
    }

    public static ForumTopic topic(String id, String categoryId, String... tags) {
        return new ForumTopic(id, "Topic " + id, categoryId, new LinkedHashSet<>(List.of(tags)), false);
    }

    public static ForumPost firstPost(ForumTopic topic) {
        return post(topic, 1);
    }

    public static ForumPost reply(ForumTopic topic, int postNumber) {
        return post(topic, postNumber);
    }

    public static ForumPost post(ForumTopic topic, int postNumber) {
        String id = topic.id() + "-" + postNumber;
        return new ForumPost(id, postNumber, true,
                "https://forum.test/t/" + topic.id() + "/" + postNumber, ALICE, topic);
    }

    public static ForumTopic privateTopic(String id) {
        return new ForumTopic(id, "Secret " + id, null, Set.of(), true);
    }
}
