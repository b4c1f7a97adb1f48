package com.chatdirecto.repositorios.feed;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RowFilterTest {

    @Test
    void filtroDeConversacionCoincideEnAmbasDirecciones() {
        RowFilter conversation = RowFilter.or(
            RowFilter.and(RowFilter.eq("sender_id", "a"), RowFilter.eq("receiver_id", "b")),
            RowFilter.and(RowFilter.eq("sender_id", "b"), RowFilter.eq("receiver_id", "a")));

        assertTrue(conversation.matches(row("a", "b")));
        assertTrue(conversation.matches(row("b", "a")));
        assertFalse(conversation.matches(row("a", "c")));
        assertFalse(conversation.matches(null));
    }

    @Test
    void laFormaTextualEsCanonicaYSirveDeClave() {
        RowFilter first = RowFilter.and(RowFilter.eq("user_id", "u1"), RowFilter.eq("read", "false"));
        RowFilter second = RowFilter.and(RowFilter.eq("user_id", "u1"), RowFilter.eq("read", "false"));

        assertEquals("and(user_id=eq.u1,read=eq.false)", first.toString());
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertNotEquals(first, RowFilter.eq("user_id", "u1"));
        assertEquals("*", RowFilter.all().toString());
    }

    @Test
    void columnasNulasNoCoinciden() {
        ObjectNode record = RowJson.mapper().createObjectNode();
        record.putNull("sender_id");

        assertFalse(RowFilter.eq("sender_id", "a").matches(record));
        assertThrows(IllegalArgumentException.class, RowFilter::and);
    }

    private static ObjectNode row(String sender, String receiver) {
        ObjectNode record = RowJson.mapper().createObjectNode();
        record.put("sender_id", sender);
        record.put("receiver_id", receiver);
        return record;
    }
}
