package de.bsommerfeld.scratchdb.db.guard;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvFunctionsTest {

    @Test
    void parse_shouldReturnObjectsKeyedByHeader() throws IOException {
        String json = CsvFunctions.parse("name,age\nAnn,31\n\"Lee, Jr.\",40\n", true);
        assertEquals("[{\"name\":\"Ann\",\"age\":\"31\"},{\"name\":\"Lee, Jr.\",\"age\":\"40\"}]", json);
    }

    @Test
    void parse_shouldReturnArraysWithoutHeader() throws IOException {
        assertEquals("[[\"a\",\"b\"],[\"c\",\"d\"]]", CsvFunctions.parse("a;b\r\nc;d", false));
    }

    @Test
    void parse_shouldPadShortRowsAndExtendHeadersForLongRows() throws IOException {
        String json = CsvFunctions.parse("a,b\n1\n2,3,4\n", true);
        assertEquals("[{\"a\":\"1\",\"b\":\"\",\"col_2\":\"\"},{\"a\":\"2\",\"b\":\"3\",\"col_2\":\"4\"}]", json);
    }

    @Test
    void parse_shouldHonorExcelSeparatorPrefixAndBom() throws IOException {
        assertEquals("[{\"x\":\"1,5\"}]", CsvFunctions.parse("\uFEFFsep=;\nx\n1,5\n", true));
    }

    @Test
    void parse_shouldReturnEmptyArrayForBlankInput() throws IOException {
        assertEquals("[]", CsvFunctions.parse("  \n ", true));
        assertNull(CsvFunctions.parse(null, true));
    }

    @Test
    void column_shouldSkipHeaderAndMissingCells() throws IOException {
        assertEquals("[\"2\",\"4\"]", CsvFunctions.column("h1\th2\n1\t2\n3\t4\n5\n", 1, true));
        assertNull(CsvFunctions.column("a,b", -1, true));
    }

    @Test
    void headers_shouldDeduplicateNames() throws IOException {
        assertEquals("[\"id\",\"col_1\",\"id_2\"]", CsvFunctions.headers("id,,id\n1,2,3"));
    }

    @Test
    void chooseDelimiter_shouldPreferConsistentCandidate() {
        assertEquals('|', CsvFunctions.chooseDelimiter(List.of("a|b|c", "d|e|f", "g,h|i|j")));
        assertEquals(',', CsvFunctions.chooseDelimiter(List.of("single")));
    }

    @Test
    void headerFlag_shouldAcceptCommonSpellings() {
        assertTrue(CsvFunctions.headerFlag(null));
        assertFalse(CsvFunctions.headerFlag(0L));
        assertFalse(CsvFunctions.headerFlag("no"));
        assertTrue(CsvFunctions.headerFlag("TRUE"));
    }
}
