package com.geico.poc.faunasql.sql;

import com.geico.poc.faunasql.errors.TranslationRejectedException;
import org.apache.calcite.sql.SqlLiteral;
import org.apache.calcite.sql.parser.SqlParserPos;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

public class SqlValuesTest {

    @Test
    public void testKeywordsAndNumbers() {
        assertNull(SqlValues.extract("NULL"));
        assertNull(SqlValues.extract((String) null));
        assertEquals(Boolean.TRUE, SqlValues.extract("true"));
        assertEquals(Boolean.FALSE, SqlValues.extract("FALSE"));
        assertEquals(42L, SqlValues.extract("42"));
        assertEquals(-7L, SqlValues.extract("-7"));
        assertEquals(1.5, SqlValues.extract("1.5"));
    }

    @Test
    public void testExactNumericLiterals() {
        assertEquals(Long.MAX_VALUE,
            SqlValues.extract(SqlLiteral.createExactNumeric(String.valueOf(Long.MAX_VALUE), SqlParserPos.ZERO)));
        assertEquals(2.5, SqlValues.extract(SqlLiteral.createExactNumeric("2.5", SqlParserPos.ZERO)));
        assertThrows(TranslationRejectedException.class,
            () -> SqlValues.extract(SqlLiteral.createExactNumeric("99999999999999999999999", SqlParserPos.ZERO)));
    }

    @Test
    @DisplayName("Quoted numbers stay strings and doubled quotes are unescaped")
    public void testQuotedStrings() {
        assertEquals("42", SqlValues.extract("'42'"));
        assertEquals("O'Brien", SqlValues.extract("'O''Brien'"));
        assertEquals("plain", SqlValues.extract("'plain'"));
    }

    @Test
    public void testDatetimeStrings() {
        assertEquals(OffsetDateTime.of(2020, 5, 1, 10, 30, 0, 0, ZoneOffset.ofHours(2)),
            SqlValues.extract("'2020-05-01T10:30:00+02:00'"));
        assertEquals(OffsetDateTime.of(2020, 5, 1, 10, 30, 0, 0, ZoneOffset.UTC),
            SqlValues.extract("'2020-05-01 10:30:00'"));
        assertEquals(OffsetDateTime.of(2020, 5, 1, 0, 0, 0, 0, ZoneOffset.UTC),
            SqlValues.extract("'2020-05-01'"));
        assertEquals("2020-13-45", SqlValues.extract("'2020-13-45'"));
    }
}
