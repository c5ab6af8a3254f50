package de.bsommerfeld.scratchdb.db.guard;

import de.bsommerfeld.scratchdb.db.guard.SqlLexer.Kind;
import de.bsommerfeld.scratchdb.db.guard.SqlLexer.Token;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SqlLexerTest {

    @Test
    void mask_shouldPreserveLengthAndBlankLiteralsAndComments() {
        String sql = "SELECT 'a;b', \"c\" -- note\nFROM t /* x */";
        String masked = SqlLexer.mask(sql);

        assertEquals(sql.length(), masked.length());
        assertFalse(masked.contains("a;b"));
        assertFalse(masked.contains("note"));
        assertFalse(masked.contains("x */"));
        assertTrue(masked.startsWith("SELECT "));
        assertEquals(sql.indexOf("FROM"), masked.indexOf("FROM"));
    }

    @Test
    void mask_shouldHandleDoubledQuotesAndUnterminatedLiterals() {
        assertEquals("SELECT         ", SqlLexer.mask("SELECT 'it''s' "));
        assertEquals("SELECT      ", SqlLexer.mask("SELECT 'open"));
        assertEquals("", SqlLexer.mask(null));
    }

    @Test
    void tokenize_shouldClassifyTokens() {
        List<Token> tokens = SqlLexer.tokenize("SELECT \"Edit\", 'lit', 42 FROM [my table];");

        assertEquals(Kind.WORD, tokens.get(0).kind());
        assertTrue(tokens.get(0).isWord("select"));
        assertEquals(Kind.IDENTIFIER, tokens.get(1).kind());
        assertEquals("Edit", tokens.get(1).text());
        assertEquals("edit", tokens.get(1).lower());
        assertTrue(tokens.get(2).isSymbol(','));
        assertEquals(Kind.STRING, tokens.get(3).kind());
        assertEquals("lit", tokens.get(3).text());
        assertEquals(Kind.NUMBER, tokens.get(5).kind());
        assertEquals("my table", tokens.get(7).text());
        assertTrue(tokens.get(8).isSymbol(';'));
    }

    @Test
    void tokenize_shouldDropCommentsAndUnescapeQuotes() {
        List<Token> tokens = SqlLexer.tokenize("/* c */ `a``b` -- tail");

        assertEquals(1, tokens.size());
        assertEquals("a`b", tokens.get(0).text());
        assertTrue(tokens.get(0).isName());
    }
}
