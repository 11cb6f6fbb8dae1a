package io.xmin.replication.model.schema;

import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class TableIdTest {

    @Test
    public void testParseQualified() {
        TableId tableId = TableId.parse("sales.orders", "public");

        assertEquals("sales", tableId.getSchema());
        assertEquals("orders", tableId.getName());
        assertEquals("sales.orders", tableId.getQualifiedName());
    }

    @Test
    public void testParseBareNameUsesDefaultSchema() {
        assertEquals(new TableId("public", "users"), TableId.parse("users", "public"));
        assertEquals(new TableId("app", "users"), TableId.parse("\"users\"", "app"));
    }

    @Test
    public void testQuotedSqlEscapesQuotes() {
        TableId tableId = new TableId("public", "we\"ird");

        assertEquals("\"public\".\"we\"\"ird\"", tableId.toQuotedSql());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmptyNameIsRejected() {
        new TableId("public", "");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testOverlongNameIsRejected() {
        StringBuilder name = new StringBuilder();
        for (int index = 0; index < 64; index++) {
            name.append('a');
        }

        new TableId("public", name.toString());
    }
}
