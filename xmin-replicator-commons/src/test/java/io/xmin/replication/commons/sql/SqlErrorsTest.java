package io.xmin.replication.commons.sql;

import org.junit.Test;

import java.io.EOFException;
import java.sql.SQLException;
import java.sql.SQLRecoverableException;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class SqlErrorsTest {

    @Test
    public void testConnectionStates() {
        assertEquals(SqlErrors.Category.CONNECTIVITY, SqlErrors.classify(new SQLException("refused", "08001")));
        assertEquals(SqlErrors.Category.CONNECTIVITY, SqlErrors.classify(new SQLException("io", "08006")));
        assertEquals(SqlErrors.Category.CONNECTIVITY, SqlErrors.classify(new SQLException("admin shutdown", "57P01")));
        assertEquals(SqlErrors.Category.CONNECTIVITY, SqlErrors.classify(new SQLException("too many connections", "53300")));
        assertEquals(SqlErrors.Category.CONNECTIVITY, SqlErrors.classify(new SQLRecoverableException("gone")));
    }

    @Test
    public void testMissingStateWithIOCause() {
        SQLException exception = new SQLException("broken", null, new RuntimeException(new EOFException()));

        assertTrue(SqlErrors.isConnectivity(exception));
        assertFalse(SqlErrors.isConnectivity(new SQLException("no state")));
    }

    @Test
    public void testTransactionStates() {
        assertEquals(SqlErrors.Category.TRANSACTION, SqlErrors.classify(new SQLException("serialization", "40001")));
        assertEquals(SqlErrors.Category.TRANSACTION, SqlErrors.classify(new SQLException("deadlock", "40P01")));
        assertEquals(SqlErrors.Category.TRANSACTION, SqlErrors.classify(new SQLException("aborted", "25P02")));
        assertEquals(SqlErrors.Category.TRANSACTION, SqlErrors.classify(new SQLException("cancelled", "57014")));
    }

    @Test
    public void testDataStates() {
        assertEquals(SqlErrors.Category.DATA, SqlErrors.classify(new SQLException("not null", "23502")));
        assertEquals(SqlErrors.Category.DATA, SqlErrors.classify(new SQLException("undefined table", "42P01")));
        assertEquals(SqlErrors.Category.DATA, SqlErrors.classify(new SQLException("invalid text", "22P02")));
    }
}
