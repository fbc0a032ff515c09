package chatbridge.jdbc;

import chatbridge.jdbc.store.H2KeyValueStore;
import chatbridge.model.FilterLevel;
import chatbridge.model.FilterScope;
import chatbridge.model.FilterSetting;
import chatbridge.model.SubscriptionRule;
import chatbridge.rules.FilterRuleEngine;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdbcFilterStoreTest {

    private JdbcDataSource dataSource;
    private H2KeyValueStore table;
    private JdbcFilterStore store;

    @BeforeEach
    void setUp() throws SQLException {
        dataSource = Schemas.h2();
        table = new H2KeyValueStore();
        store = new JdbcFilterStore(new DataSourceConnectionProvider(dataSource), table);
    }

    @Test
    void rulesRoundTripInOrder() {
        List<SubscriptionRule> rules = List.of(
                SubscriptionRule.untagged("#general", FilterLevel.WATCH),
                SubscriptionRule.tagged("#dev", FilterLevel.FOLLOW, List.of("java", "build")),
                SubscriptionRule.untagged("@alice", FilterLevel.MUTE));

        store.save(FilterScope.category("7"), rules);

        List<SubscriptionRule> loaded = store.load(FilterScope.category("7"));
        assertEquals(rules, loaded);
        assertEquals(List.of("java", "build"), List.copyOf(loaded.get(1).tags()));
    }

    @Test
    void taglessRuleIsStoredWithNullTags() throws SQLException {
        store.save(FilterScope.ALL, List.of(SubscriptionRule.untagged("#general", FilterLevel.WATCH)));

        try (Connection conn = dataSource.getConnection()) {
            assertEquals("[{\"channel\":\"#general\",\"filter\":\"watch\",\"tags\":null}]",
                    table.get(conn, "category_*"));
        }
    }

    @Test
    void emptySaveDeletesRecord() throws SQLException {
        store.save(FilterScope.ALL, List.of(SubscriptionRule.untagged("#general", FilterLevel.WATCH)));
        store.save(FilterScope.ALL, List.of());

        try (Connection conn = dataSource.getConnection()) {
            assertNull(table.get(conn, "category_*"));
        }
        assertTrue(store.scopes().isEmpty());
    }

    @Test
    void scopesIgnoreConversationRecords() throws SQLException {
        store.save(FilterScope.category("3"), List.of(SubscriptionRule.untagged("#a", FilterLevel.WATCH)));
        store.save(FilterScope.ALL, List.of(SubscriptionRule.untagged("#b", FilterLevel.WATCH)));
        try (Connection conn = dataSource.getConnection()) {
            table.put(conn, "topic_1_#a", "{}", Instant.now());
        }

        assertEquals(new LinkedHashSet<>(List.of(FilterScope.ALL, FilterScope.category("3"))),
                new LinkedHashSet<>(store.scopes()));
    }

    @Test
    void unreadableRecordLoadsAsEmpty() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            table.put(conn, "category_9", "not json", Instant.now());
        }
        assertTrue(store.load(FilterScope.category("9")).isEmpty());
    }

    @Test
    void editOfUnreadableRecordFailsAndKeepsIt() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            table.put(conn, "category_9", "not json", Instant.now());
        }
        FilterRuleEngine engine = new FilterRuleEngine(store, names -> new LinkedHashSet<>(names));

        assertThrows(ChatBridgeStoreException.class,
                () -> engine.setCategoryFilter("#general", FilterScope.category("9"), FilterSetting.WATCH));

        try (Connection conn = dataSource.getConnection()) {
            assertEquals("not json", table.get(conn, "category_9"));
        }
    }

    @Test
    void editOfRecordWithMalformedRuleFailsAndKeepsIt() throws SQLException {
        String stored = "[{\"channel\":\"#dev\",\"filter\":\"watch\",\"tags\":\"java\"}]";
        try (Connection conn = dataSource.getConnection()) {
            table.put(conn, "category_*", stored, Instant.now());
        }
        FilterRuleEngine engine = new FilterRuleEngine(store, names -> new LinkedHashSet<>(names));

        assertTrue(store.load(FilterScope.ALL).isEmpty());
        assertThrows(ChatBridgeStoreException.class,
                () -> engine.setTagFilter("#dev", FilterSetting.WATCH, "build"));

        try (Connection conn = dataSource.getConnection()) {
            assertEquals(stored, table.get(conn, "category_*"));
        }
    }

    @Test
    void engineEditsPersistThroughJdbc() {
        FilterRuleEngine engine = new FilterRuleEngine(store, names -> new LinkedHashSet<>(names));

        engine.setTagFilter("#dev", FilterSetting.WATCH, "java");
        engine.setTagFilter("#dev", FilterSetting.WATCH, "build");
        engine.setTagFilter("#dev", FilterSetting.FOLLOW, "java");

        assertEquals(List.of(
                SubscriptionRule.tagged("#dev", FilterLevel.WATCH, List.of("build")),
                SubscriptionRule.tagged("#dev", FilterLevel.FOLLOW, List.of("java"))),
                store.load(FilterScope.ALL));

        engine.setTagFilter("#dev", FilterSetting.UNSET, "build");
        engine.setTagFilter("#dev", FilterSetting.UNSET, "java");
        assertFalse(store.scopes().contains(FilterScope.ALL));
    }

    @Test
    void missingTableSurfacesAsStoreException() {
        JdbcFilterStore broken = new JdbcFilterStore(new DataSourceConnectionProvider(dataSource),
                new H2KeyValueStore("no_such_table"));

        assertThrows(ChatBridgeStoreException.class, () -> broken.load(FilterScope.ALL));
    }
}
