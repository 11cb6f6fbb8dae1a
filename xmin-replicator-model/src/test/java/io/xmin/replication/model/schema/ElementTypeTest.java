package io.xmin.replication.model.schema;

import io.xmin.replication.model.value.TypeConversionException;
import io.xmin.replication.model.value.TypedValue;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class ElementTypeTest {

    @Test
    public void testNumericMapsToDecimal() {
        assertEquals(TypedValue.Kind.DECIMAL, ElementType.byCode("numeric").getKind());
        assertEquals(TypedValue.Kind.DECIMAL, ElementType.byCode("float8").getKind());
    }

    @Test
    public void testIntegerFamily() {
        assertEquals(TypedValue.Kind.INTEGER, ElementType.byCode("int2").getKind());
        assertEquals(TypedValue.Kind.INTEGER, ElementType.byCode("INT4").getKind());
        assertEquals(TypedValue.Kind.INTEGER, ElementType.byCode("int8").getKind());
    }

    @Test
    public void testJsonAndUuid() {
        assertEquals(TypedValue.Kind.JSON, ElementType.byCode("jsonb").getKind());
        assertEquals(TypedValue.Kind.JSON, ElementType.byCode("json").getKind());
        assertEquals(TypedValue.Kind.UUID, ElementType.byCode("uuid").getKind());
    }

    @Test
    public void testArrayTypeNameIsNotAnElementType() {
        // array columns are resolved through their element type name, never the "_" array type
        assertFalse(ElementType.isKnown("_int4"));
        assertTrue(ElementType.isKnown("int4"));
    }

    @Test(expected = TypeConversionException.class)
    public void testUnknownTypeIsRejected() {
        ElementType.byCode("geometry");
    }

    @Test(expected = TypeConversionException.class)
    public void testNullTypeIsRejected() {
        ElementType.byCode(null);
    }
}
