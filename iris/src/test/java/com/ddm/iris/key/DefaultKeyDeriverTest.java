package com.ddm.iris.key;

import com.ddm.iris.defined.LabelRef;
import com.ddm.iris.defined.LabelValue;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * {@link DefaultKeyDeriver} 类的单元测试。
 *
 * @author liyifei
 */
class DefaultKeyDeriverTest {

    private final DefaultKeyDeriver deriver = new DefaultKeyDeriver();

    @Test
    void testDerive_IsDeterministic() {
        LabelRef first = deriver.derive("travel", "booking", "You have {0} bookings!", null);
        LabelRef second = deriver.derive("travel", "booking", "You have {0} bookings!", null);

        assertEquals(first, second);
        assertEquals(new LabelRef("travel", "travel_booking_you_have_bookings"), first);
    }

    @Test
    void testDerive_IgnoresInterpolatedValues() {
        LabelRef placeholder = deriver.derive("travel", "booking", "You have {0} bookings", null);
        LabelRef number = deriver.derive("travel", "booking", "You have 3 bookings", null);
        LabelRef decimal = deriver.derive("travel", "booking", "You have 1,234.5 bookings", null);

        assertEquals(placeholder, number);
        assertEquals(placeholder, decimal);
    }

    @Test
    void testDerive_KeepsChoiceWording() {
        LabelRef ref = deriver.derive("files", null, "There {0,choice,0#are no files|1#is one file|1<are {0} files}.", null);

        assertEquals("files_default_there_are_no_files_is_one_file_are_files", ref.key());
    }

    @Test
    void testDerive_DistinctChoiceOnlyPatterns() {
        LabelRef files = deriver.derive("bot", "inbox", "{0,choice,0#no files|1#one file|1<{0} files}", null);
        LabelRef messages = deriver.derive("bot", "inbox", "{0,choice,0#no messages|1#one message|1<{0} messages}", null);

        assertEquals("bot_inbox_no_files_one_file_files", files.key());
        assertNotEquals(files, messages);
    }

    @Test
    void testDerive_PlaceholderOnlyTextsUseHash() {
        LabelRef first = deriver.derive("bot", "inbox", "{0}", null);
        LabelRef second = deriver.derive("bot", "inbox", "{1}", null);

        assertTrue(first.key().matches("bot_inbox_[0-9a-f]{8}"), first.key());
        assertNotEquals(first, second);
        assertEquals(first, deriver.derive("bot", "inbox", "{0}", null));
        assertEquals("bot_inbox_", deriver.derive("bot", "inbox", "", null).key());
    }

    @Test
    void testDerive_ExplicitKeyIsUsedVerbatim() {
        LabelRef ref = deriver.derive("travel", "booking", "Anything at all", "Booking.Cancelled");

        assertEquals(new LabelRef("travel", "Booking.Cancelled"), ref);
    }

    @Test
    void testDerive_BlankExplicitKeyFallsBackToDerivation() {
        LabelRef ref = deriver.derive("travel", "booking", "Hello", "  ");

        assertEquals("travel_booking_hello", ref.key());
    }

    @Test
    void testDerive_NullCategoryUsesDefault() {
        assertEquals("travel_default_hello", deriver.derive("travel", null, "Hello", null).key());
    }

    @Test
    void testDerive_BlankNamespace() {
        assertThrows(IllegalArgumentException.class, () -> deriver.derive(" ", "booking", "Hello", null));
        assertThrows(IllegalArgumentException.class, () -> deriver.derive(null, "booking", "Hello", "key"));
    }

    @Test
    void testDerive_KeepsNonLatinScripts() {
        LabelRef ref = deriver.derive("bot", "greet", "你好，世界", null);

        assertEquals("bot_greet_你好_世界", ref.key());
    }

    @Test
    void testDerive_FromLabelValue() {
        LabelValue value = LabelValue.of("travel", "booking", "Hello {0}!", "Bob");

        assertEquals(deriver.derive("travel", "booking", "Hello {0}!", null), deriver.derive(value));
    }

    @Test
    void testSlug_TruncatesWithHashSuffix() {
        String longText = "word ".repeat(40);
        String slug = deriver.slug(longText);

        assertEquals(DefaultKeyDeriver.DEFAULT_MAX_LENGTH, slug.length());
        assertTrue(slug.matches("[a-z_]{55}_[0-9a-f]{8}"), slug);
    }

    @Test
    void testSlug_TruncatedKeysStayDistinct() {
        String prefix = "a".repeat(80);
        String first = deriver.slug(prefix + " first");
        String second = deriver.slug(prefix + " second");

        assertEquals(first.substring(0, 55), second.substring(0, 55));
        assertNotEquals(first, second);
    }

    @Test
    void testNormalize() {
        assertEquals("Hello , you have messages", deriver.normalize("Hello {0}, you have {1,number} messages"));
        assertEquals("", deriver.normalize("{0}"));
        assertEquals("", deriver.normalize(null));
    }

    @Test
    void testNormalize_ChoiceKeepsSubPatternText() {
        assertEquals("no files one file files", deriver.normalize("{0,choice,0#no files|1#one file|1<{0} files}"));
        assertEquals("a or b", deriver.normalize("{0,choice,0#a|1\u2264or {1,choice,0#b}}"));
    }

    @Test
    void testCanonicalize() {
        assertEquals("You have 0 files", deriver.canonicalize("You  have 3 files"));
        assertEquals(deriver.canonicalize("You have 3 files"), deriver.canonicalize("You have 4 files"));
        assertNotEquals(deriver.canonicalize("Hi {0}"), deriver.canonicalize("Hi {1}"));
        assertEquals("{0,number,#0.00} left", deriver.canonicalize("{0,number,#0.00} left"));
        assertEquals("", deriver.canonicalize(null));
    }

    @Test
    void testConstructor_RejectsTooSmallMaxLength() {
        assertThrows(IllegalArgumentException.class, () -> new DefaultKeyDeriver(9));
    }
}
