package com.ddm.iris.provider.memory;

import com.ddm.iris.defined.InterfaceType;
import com.ddm.iris.defined.Label;
import com.ddm.iris.defined.LabelRef;
import com.ddm.iris.defined.LocalizedLabel;
import com.ddm.iris.defined.VariantSlot;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

/**
 * {@link InMemoryLabelStore} 类的单元测试。
 *
 * @author liyifei
 */
class InMemoryLabelStoreTest {

    private static final LabelRef REF = new LabelRef("travel", "greeting");

    private final InMemoryLabelStore store = new InMemoryLabelStore();

    private static Label label(String text) {
        return new Label(REF, "greet", Locale.ENGLISH, text, List.of(LocalizedLabel.unvalidated(Locale.ENGLISH, text)));
    }

    @Test
    void testUpsertIfAbsent_KeepsFirstWrite() {
        Label first = label("Hello");
        Label second = label("Hi");

        assertSame(first, store.upsertIfAbsent(first));
        assertSame(first, store.upsertIfAbsent(second));
        assertEquals(1, store.size());
        assertEquals("Hello", store.getLabel(REF).defaultText());
    }

    @Test
    void testSaveVariant_ReplacesSameSlot() {
        store.upsertIfAbsent(label("Hello"));
        VariantSlot voice = new VariantSlot(Locale.ENGLISH, null, InterfaceType.VOICE);

        store.saveVariant(REF, LocalizedLabel.of(voice, true, "Hello there"));
        store.saveVariant(REF, LocalizedLabel.of(voice, true, "Good day"));

        assertEquals(2, store.getLabel(REF).variants().size());
        assertEquals(List.of("Good day"), store.findVariant(REF, voice).alternatives());
    }

    @Test
    void testSaveVariant_MissingLabel() {
        assertThrows(IllegalStateException.class,
                () -> store.saveVariant(REF, LocalizedLabel.unvalidated(Locale.FRENCH, "Bonjour")));
    }

    @Test
    void testFindVariant_Missing() {
        assertNull(store.findVariant(REF, VariantSlot.of(Locale.ENGLISH)));
        store.upsertIfAbsent(label("Hello"));
        assertNull(store.findVariant(REF, VariantSlot.of(Locale.FRENCH)));
    }

    @Test
    void testSaveLabel_ReplacesWholeLabel() {
        store.upsertIfAbsent(label("Hello"));
        store.saveLabel(new Label(REF, "greet", Locale.ENGLISH, "Hi", List.of()));

        assertTrue(store.getLabel(REF).variants().isEmpty());
        assertEquals("Hi", store.getLabel(REF).defaultText());
    }

    @Test
    void testReplaceDefaultText_KeepsOtherVariants() {
        store.upsertIfAbsent(label("Hello"));
        LocalizedLabel french = LocalizedLabel.of(VariantSlot.of(Locale.FRENCH), true, "Bonjour");
        store.saveVariant(REF, french);

        assertTrue(store.replaceDefaultText(REF, "Hi"));

        assertEquals("Hi", store.getLabel(REF).defaultText());
        assertEquals(LocalizedLabel.unvalidated(Locale.ENGLISH, "Hi"), store.findVariant(REF, VariantSlot.of(Locale.ENGLISH)));
        assertEquals(french, store.findVariant(REF, VariantSlot.of(Locale.FRENCH)));
    }

    @Test
    void testReplaceDefaultText_SkipsValidatedDefault() {
        store.upsertIfAbsent(label("Hello"));
        store.saveVariant(REF, LocalizedLabel.of(VariantSlot.of(Locale.ENGLISH), true, "Hello there"));

        assertFalse(store.replaceDefaultText(REF, "Hi"));
        assertEquals("Hello", store.getLabel(REF).defaultText());
    }

    @Test
    void testReplaceDefaultText_MissingLabel() {
        assertThrows(IllegalStateException.class, () -> store.replaceDefaultText(REF, "Hi"));
    }
}
