package io.xmin.replication.applier.statement;

import io.xmin.replication.model.schema.ColumnSchema;
import io.xmin.replication.model.schema.ElementType;
import io.xmin.replication.model.schema.TableId;
import io.xmin.replication.model.schema.TableSchema;

import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.assertEquals;

public class UpsertStatementBuilderTest {

    @Test
    public void testSingleKey() {
        TableSchema users = new TableSchema(
                new TableId("public", "users"),
                Arrays.asList(
                        new ColumnSchema("id", ElementType.INT8, false, "bigint", false, false),
                        new ColumnSchema("name", ElementType.TEXT, false, "text", true, false),
                        new ColumnSchema("scores", ElementType.INT4, true, "integer[]", true, false)
                ),
                Collections.singletonList("id")
        );

        UpsertStatementBuilder builder = new UpsertStatementBuilder(users);

        assertEquals(
                "INSERT INTO \"public\".\"users\" (\"id\", \"name\", \"scores\") VALUES " +
                "(CAST(? AS bigint), CAST(? AS text), CAST(? AS integer[])), " +
                "(CAST(? AS bigint), CAST(? AS text), CAST(? AS integer[])) " +
                "ON CONFLICT (\"id\") DO UPDATE SET \"name\" = EXCLUDED.\"name\", \"scores\" = EXCLUDED.\"scores\"",
                builder.build(2)
        );
        assertEquals(3, builder.getParametersPerRow());
    }

    @Test
    public void testCompositeKey() {
        TableSchema lines = new TableSchema(
                new TableId("sales", "order \"lines\""),
                Arrays.asList(
                        new ColumnSchema("order_id", ElementType.INT8, false, "bigint", false, false),
                        new ColumnSchema("item_id", ElementType.INT4, false, "integer", false, false),
                        new ColumnSchema("price", ElementType.NUMERIC, false, "numeric(10,2)", true, false)
                ),
                Arrays.asList("order_id", "item_id")
        );

        assertEquals(
                "INSERT INTO \"sales\".\"order \"\"lines\"\"\" (\"order_id\", \"item_id\", \"price\") VALUES " +
                "(CAST(? AS bigint), CAST(? AS integer), CAST(? AS numeric(10,2))) " +
                "ON CONFLICT (\"order_id\", \"item_id\") DO UPDATE SET \"price\" = EXCLUDED.\"price\"",
                new UpsertStatementBuilder(lines).build(1)
        );
    }

    @Test
    public void testAllKeyColumns() {
        TableSchema tags = new TableSchema(
                new TableId("public", "post_tags"),
                Arrays.asList(
                        new ColumnSchema("post_id", ElementType.INT8, false, "bigint", false, false),
                        new ColumnSchema("tag", ElementType.TEXT, false, "text", false, false)
                ),
                Arrays.asList("post_id", "tag")
        );

        assertEquals(
                "INSERT INTO \"public\".\"post_tags\" (\"post_id\", \"tag\") VALUES (CAST(? AS bigint), CAST(? AS text)) " +
                "ON CONFLICT (\"post_id\", \"tag\") DO NOTHING",
                new UpsertStatementBuilder(tags).build(1)
        );
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNoKey() {
        new UpsertStatementBuilder(new TableSchema(
                new TableId("public", "events"),
                Collections.singletonList(new ColumnSchema("payload", ElementType.JSONB, false, "jsonb", true, false)),
                Collections.emptyList()
        ));
    }
}
