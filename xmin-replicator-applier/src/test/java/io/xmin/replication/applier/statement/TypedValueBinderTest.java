package io.xmin.replication.applier.statement;

import io.xmin.replication.model.schema.ColumnSchema;
import io.xmin.replication.model.schema.ElementType;
import io.xmin.replication.model.value.TypeConversionException;
import io.xmin.replication.model.value.TypedValue;

import org.junit.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigDecimal;
import java.sql.Array;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.Arrays;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class TypedValueBinderTest {

    @Test
    public void testScalars() throws SQLException {
        Connection connection = mock(Connection.class);
        PreparedStatement statement = mock(PreparedStatement.class);
        ColumnSchema amount = new ColumnSchema("amount", ElementType.NUMERIC, false, "numeric(30,10)", true, false);
        ColumnSchema ratio = new ColumnSchema("ratio", ElementType.FLOAT8, false, "double precision", true, false);

        TypedValueBinder.bind(connection, statement, 1, amount, TypedValue.decimal(new BigDecimal("12345678901234567890.0123456789")));
        TypedValueBinder.bind(connection, statement, 2, ratio, TypedValue.text("NaN"));
        TypedValueBinder.bind(connection, statement, 3, amount, TypedValue.nullValue());

        verify(statement).setBigDecimal(1, new BigDecimal("12345678901234567890.0123456789"));
        verify(statement).setString(2, "NaN");
        verify(statement).setNull(3, Types.NULL);
    }

    @Test
    public void testNestedArray() throws SQLException {
        Connection connection = mock(Connection.class);
        PreparedStatement statement = mock(PreparedStatement.class);
        Array array = mock(Array.class);
        ColumnSchema matrix = new ColumnSchema("matrix", ElementType.NUMERIC, true, "numeric[]", true, false);

        TypedValue value = TypedValue.array(TypedValue.Kind.DECIMAL, Arrays.asList(
                TypedValue.array(TypedValue.Kind.DECIMAL, Arrays.asList(TypedValue.decimal(new BigDecimal("1.5")), TypedValue.nullValue())),
                TypedValue.array(TypedValue.Kind.DECIMAL, Arrays.asList(TypedValue.text("Infinity"), TypedValue.decimal(new BigDecimal("1E+3"))))
        ));

        when(connection.createArrayOf(eq("text"), any(Object[].class))).thenReturn(array);

        TypedValueBinder.bind(connection, statement, 4, matrix, value);

        Object[] elements = TypedValueBinder.toElements(value);

        assertArrayEquals(new Object[] {"1.5", null}, (Object[]) elements[0]);
        assertArrayEquals(new Object[] {"Infinity", "1000"}, (Object[]) elements[1]);

        verify(statement).setArray(4, array);
    }

    @Test
    public void testBinaryArrayUsesByteArrays() throws SQLException {
        Connection connection = mock(Connection.class);
        PreparedStatement statement = mock(PreparedStatement.class);
        Array array = mock(Array.class);
        ColumnSchema payloads = new ColumnSchema("payloads", ElementType.BYTEA, true, "bytea[]", true, false);

        TypedValue value = TypedValue.array(TypedValue.Kind.BINARY, Arrays.asList(
                TypedValue.binary(new byte[] {1, 2}),
                TypedValue.nullValue(),
                TypedValue.binary(new byte[] {3})
        ));

        when(connection.createArrayOf(eq("bytea"), any(Object[].class))).thenReturn(array);

        TypedValueBinder.bind(connection, statement, 1, payloads, value);

        ArgumentCaptor<Object[]> elements = ArgumentCaptor.forClass(Object[].class);

        verify(connection).createArrayOf(eq("bytea"), elements.capture());
        verify(statement).setArray(1, array);

        assertEquals(byte[][].class, elements.getValue().getClass());
        assertArrayEquals(new byte[] {1, 2}, (byte[]) elements.getValue()[0]);
        assertNull(elements.getValue()[1]);
        assertArrayEquals(new byte[] {3}, (byte[]) elements.getValue()[2]);
    }

    @Test
    public void testNestedBinaryArray() {
        TypedValue value = TypedValue.array(TypedValue.Kind.BINARY, Arrays.asList(
                TypedValue.array(TypedValue.Kind.BINARY, Arrays.asList(TypedValue.binary(new byte[] {1}), TypedValue.binary(new byte[] {2}))),
                TypedValue.array(TypedValue.Kind.BINARY, Arrays.asList(TypedValue.binary(new byte[] {3}), TypedValue.nullValue()))
        ));

        Object[] elements = TypedValueBinder.toElements(value);

        assertEquals(byte[][][].class, elements.getClass());
        assertEquals(byte[][].class, elements[0].getClass());
        assertArrayEquals(new byte[] {3}, ((byte[][]) elements[1])[0]);
    }

    @Test(expected = TypeConversionException.class)
    public void testBinaryArrayWithMixedDimensions() {
        TypedValueBinder.toElements(TypedValue.array(TypedValue.Kind.BINARY, Arrays.asList(
                TypedValue.binary(new byte[] {1}),
                TypedValue.array(TypedValue.Kind.BINARY, Arrays.asList(TypedValue.binary(new byte[] {2})))
        )));
    }

    @Test
    public void testArrayTypes() {
        assertEquals("int8", TypedValueBinder.arrayType(TypedValue.Kind.INTEGER));
        assertEquals("bool", TypedValueBinder.arrayType(TypedValue.Kind.BOOLEAN));
        assertEquals("bytea", TypedValueBinder.arrayType(TypedValue.Kind.BINARY));
        assertEquals("text", TypedValueBinder.arrayType(TypedValue.Kind.UUID));
        assertEquals("text", TypedValueBinder.arrayType(TypedValue.Kind.JSON));
    }

    @Test(expected = TypeConversionException.class)
    public void testArrayForScalarColumn() throws SQLException {
        TypedValueBinder.bind(
                mock(Connection.class),
                mock(PreparedStatement.class),
                1,
                new ColumnSchema("id", ElementType.INT8, false, "bigint", false, true),
                TypedValue.array(TypedValue.Kind.INTEGER, Arrays.asList(TypedValue.integer(1L)))
        );
    }
}
