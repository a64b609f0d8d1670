package com.geico.poc.faunasql.translation;

import com.fasterxml.jackson.databind.JsonNode;
import com.geico.poc.faunasql.errors.TranslationRejectedException;
import com.geico.poc.faunasql.fql.FqlSerializer;
import com.geico.poc.faunasql.sql.Column;
import com.geico.poc.faunasql.sql.TableJoin;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class JoinKeyCheckTest {

    @Test
    @DisplayName("The foreign key side is checked whichever table is joined")
    public void testCheckedSide() {
        JoinKeyCheck usersJoined = JoinKeyCheck.of("users",
            new TableJoin(Column.named("users", "id"), Column.named("posts", "author_id")));
        assertEquals("posts", usersJoined.getTable());
        assertEquals("author_id", usersJoined.getColumn());
        assertEquals("users", usersJoined.getReferencedTable());

        JoinKeyCheck postsJoined = JoinKeyCheck.of("posts",
            new TableJoin(Column.named("posts", "author_id"), Column.named("users", "id")));
        assertEquals("posts", postsJoined.getTable());
        assertEquals("author_id", postsJoined.getColumn());
        assertEquals("users", postsJoined.getReferencedTable());
    }

    @Test
    public void testVerify() {
        JoinKeyCheck check = new JoinKeyCheck("posts", "title", "users");

        check.verify("users");
        TranslationRejectedException notForeign = assertThrows(TranslationRejectedException.class, () -> check.verify(null));
        assertTrue(notForeign.getMessage().contains("posts.title"));
        TranslationRejectedException otherTable =
            assertThrows(TranslationRejectedException.class, () -> check.verify("comments"));
        assertTrue(otherTable.getMessage().contains("comments"));
    }

    @Test
    public void testLookupReadsEveryCheckedTable() {
        JsonNode json = FqlSerializer.serialize(JoinKeyCheck.lookup(Arrays.asList(
            new JoinKeyCheck("posts", "author_id", "users"),
            new JoinKeyCheck("comments", "post_id", "posts"))));

        assertTrue(json.isArray());
        assertEquals(2, json.size());
        assertTrue(json.get(0).toString().contains("\"posts\""));
        assertTrue(json.get(1).toString().contains("\"post_id\""));
    }
}
