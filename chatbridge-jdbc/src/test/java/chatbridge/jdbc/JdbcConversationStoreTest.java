package chatbridge.jdbc;

import chatbridge.jdbc.store.H2KeyValueStore;
import chatbridge.model.Attachment;
import chatbridge.model.ChatMessage;
import chatbridge.model.ConversationState;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class JdbcConversationStoreTest {

    private JdbcDataSource dataSource;
    private H2KeyValueStore table;
    private JdbcConversationStore store;

    @BeforeEach
    void setUp() throws SQLException {
        dataSource = Schemas.h2();
        table = new H2KeyValueStore();
        store = new JdbcConversationStore(new DataSourceConnectionProvider(dataSource), table);
    }

    @Test
    void stateRoundTrips() {
        ConversationState state = state("1714557600.000100", 1);

        store.save(state);

        assertEquals(state, store.find("10", "#general"));
        assertNull(store.find("10", "#random"));
        assertNull(store.find("11", "#general"));
    }

    @Test
    void saveReplacesPreviousState() {
        store.save(state("1.0001", 1));
        store.save(state("1.0001", 3));

        assertEquals(3, store.find("10", "#general").attachmentCount());
    }

    @Test
    void undecodableStateIsTreatedAsAbsent() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            table.put(conn, "topic_10_#general", "{\"ts\":\"1.0\"}", Instant.now());
        }
        assertNull(store.find("10", "#general"));
    }

    private static ConversationState state(String ts, int attachments) {
        Attachment a = new Attachment("Topic - @alice", "@alice", "https://forum.test/a.png", "#25AAE2",
                "hello", null, null, null, List.of("text"));
        ChatMessage message = new ChatMessage("C024", "Forum", null, null, Collections.nCopies(attachments, a));
        return new ConversationState("10", "#general", "C024", ts, message,
                Instant.parse("2024-05-01T10:00:00Z"));
    }
}
