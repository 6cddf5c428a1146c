package com.ddm.iris.format;

import com.ddm.iris.exception.PatternParseException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * {@link MessagePatternParser} 类的单元测试。
 *
 * @author liyifei
 */
class MessagePatternParserTest {

    private final MessagePatternParser parser = new MessagePatternParser();

    @Test
    void testParse_LiteralsAndArguments() {
        CompiledPattern pattern = parser.parse("Hello {0}, you have {1,number,integer} messages");

        assertEquals(List.of(
                new PatternPart.Literal("Hello "),
                PatternPart.Argument.plain(0),
                new PatternPart.Literal(", you have "),
                new PatternPart.Argument(1, FormatType.NUMBER, "integer", null, List.of()),
                new PatternPart.Literal(" messages")), pattern.parts());
        assertFalse(pattern.isLiteral());
        assertEquals(1, pattern.maxArgumentIndex());
    }

    @Test
    void testParse_IsCachedByText() {
        CompiledPattern first = parser.parse("Hi {0}");
        CompiledPattern second = parser.parse("Hi {0}");

        assertSame(first, second);
        assertEquals(1, parser.cachedCount());
    }

    @Test
    void testCompile_DoesNotTouchCache() {
        parser.compile("Hi {0}");

        assertEquals(0, parser.cachedCount());
    }

    @Test
    void testInvalidate() {
        CompiledPattern first = parser.parse("Hi {0}");
        parser.invalidate("Hi {0}");

        assertEquals(0, parser.cachedCount());
        assertNotSame(first, parser.parse("Hi {0}"));
    }

    @Test
    void testParse_Quoting() {
        assertEquals(List.of(new PatternPart.Literal("It's {0} here")), parser.parse("It''s '{0}' here").parts());
        assertEquals(List.of(new PatternPart.Literal("don't")), parser.parse("don't").parts());
        assertTrue(parser.parse("'{'literal'}'").isLiteral());
    }

    @Test
    void testParse_Choice() {
        CompiledPattern pattern = parser.parse("{0,choice,0#no files|1#one file|1<{0} files}");

        PatternPart.Argument arg = (PatternPart.Argument) pattern.parts().get(0);
        assertEquals(FormatType.CHOICE, arg.type());
        assertEquals(3, arg.choices().size());
        assertTrue(arg.choices().get(1).inclusive());
        assertFalse(arg.choices().get(2).inclusive());
        assertEquals(0, pattern.maxArgumentIndex());
    }

    @Test
    void testParse_ChoiceWithInfinity() {
        CompiledPattern pattern = parser.parse("{0,choice,-∞#negative|0#zero|0<positive}");

        PatternPart.Argument arg = (PatternPart.Argument) pattern.parts().get(0);
        assertEquals(Double.NEGATIVE_INFINITY, arg.choices().get(0).limit());
    }

    @Test
    void testParse_UnmatchedOpenBrace() {
        PatternParseException e = assertThrows(PatternParseException.class, () -> parser.parse("Hello {0"));

        assertEquals(6, e.getPosition());
        assertEquals("Hello {0", e.getPattern());
        assertEquals(0, parser.cachedCount());
    }

    @Test
    void testParse_UnmatchedCloseBrace() {
        PatternParseException e = assertThrows(PatternParseException.class, () -> parser.parse("Hello }"));

        assertEquals(6, e.getPosition());
    }

    @Test
    void testParse_InvalidArguments() {
        assertThrows(PatternParseException.class, () -> parser.parse("{x}"));
        assertThrows(PatternParseException.class, () -> parser.parse("{}"));
        assertThrows(PatternParseException.class, () -> parser.parse("{-1}"));
        assertThrows(PatternParseException.class, () -> parser.parse("{0,currency}"));
        assertThrows(PatternParseException.class, () -> parser.parse("{0,choice}"));
        assertThrows(PatternParseException.class, () -> parser.parse("{0,choice,one#x}"));
        assertThrows(PatternParseException.class, () -> parser.parse("{0,choice,1 files}"));
        assertThrows(PatternParseException.class, () -> parser.parse("{0,date,yyyy-MM-dd'T}"));
        assertThrows(PatternParseException.class, () -> parser.parse("'{unterminated"));
    }

    @Test
    void testParse_ChoiceLimitsMustAscend() {
        assertThrows(PatternParseException.class, () -> parser.parse("{0,choice,1#one|0#none}"));
        assertThrows(PatternParseException.class, () -> parser.parse("{0,choice,1#one|1#again}"));
    }
}
