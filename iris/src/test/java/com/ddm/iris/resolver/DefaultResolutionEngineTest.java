package com.ddm.iris.resolver;

import com.ddm.iris.defined.I18nContext;
import com.ddm.iris.defined.InterfaceType;
import com.ddm.iris.defined.Label;
import com.ddm.iris.defined.LabelRef;
import com.ddm.iris.defined.LocalizedLabel;
import com.ddm.iris.defined.ResolvedPattern;
import com.ddm.iris.defined.VariantSlot;
import com.ddm.iris.exception.StoreUnavailableException;
import com.ddm.iris.format.MessagePatternParser;
import com.ddm.iris.key.DefaultKeyDeriver;
import com.ddm.iris.key.KeyDeriver;
import com.ddm.iris.provider.CachingLabelStore;
import com.ddm.iris.provider.LabelStore;
import com.ddm.iris.provider.memory.InMemoryLabelStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * {@link DefaultResolutionEngine} 类的单元测试。
 *
 * @author liyifei
 */
class DefaultResolutionEngineTest {

    private static final LabelRef REF = new LabelRef("travel", "welcome");

    private final KeyDeriver deriver = new DefaultKeyDeriver();
    private final List<KeyCollision> collisions = new CopyOnWriteArrayList<>();

    private InMemoryLabelStore store;
    private DefaultResolutionEngine engine;

    @BeforeEach
    void setUp() {
        store = new InMemoryLabelStore();
        engine = new DefaultResolutionEngine(store, deriver, AlternativeSelector.random(), List.of(collisions::add));
    }

    @Test
    void testResolve_FirstUseCreatesUnvalidatedLabel() {
        ResolvedPattern first = engine.resolve(REF, "Welcome!", I18nContext.of(Locale.ENGLISH));

        assertTrue(first.freshlyCreated());
        assertFalse(first.validated());
        assertEquals("Welcome!", first.pattern());

        Label stored = store.getLabel(REF);
        assertEquals(Locale.ENGLISH, stored.defaultLocale());
        assertEquals(List.of(LocalizedLabel.unvalidated(Locale.ENGLISH, "Welcome!")), stored.variants());

        ResolvedPattern second = engine.resolve(REF, "Welcome!", I18nContext.of(Locale.ENGLISH));
        assertFalse(second.freshlyCreated());
        assertEquals(1, store.size());
    }

    @Test
    void testResolve_SeedsDefaultI18nVariants() {
        LocalizedLabel voice = LocalizedLabel.of(new VariantSlot(Locale.ENGLISH, null, InterfaceType.VOICE),
                true, "Welcome aboard");

        ResolvedPattern resolved = engine.resolve(REF, null, "Welcome!",
                new I18nContext(Locale.ENGLISH, null, InterfaceType.VOICE), List.of(voice), false);

        assertEquals("Welcome aboard", resolved.pattern());
        assertFalse(resolved.validated(), "seeded variants are stored unvalidated");
        assertEquals(2, store.getLabel(REF).variants().size());
    }

    @Test
    void testResolve_SpecificityOrder() {
        store.saveLabel(new Label(REF, null, Locale.FRENCH, "Bonjour", List.of(
                LocalizedLabel.of(VariantSlot.of(Locale.FRENCH), true, "Bonjour"),
                LocalizedLabel.of(new VariantSlot(Locale.FRENCH, "connectorX", null), true, "Salut X"),
                LocalizedLabel.of(new VariantSlot(Locale.FRENCH, null, InterfaceType.VOICE), true, "Bonjour vocal"),
                LocalizedLabel.of(new VariantSlot(Locale.FRENCH, "connectorX", InterfaceType.TEXT), true, "Salut X texte"))));

        assertEquals("Salut X texte", pattern(new I18nContext(Locale.FRENCH, "connectorX", InterfaceType.TEXT)));
        assertEquals("Salut X", pattern(new I18nContext(Locale.FRENCH, "connectorX", InterfaceType.VOICE)));
        assertEquals("Bonjour vocal", pattern(new I18nContext(Locale.FRENCH, "connectorY", InterfaceType.VOICE)));
        assertEquals("Bonjour", pattern(new I18nContext(Locale.FRENCH, "connectorY", InterfaceType.TEXT)));
        assertEquals("Bonjour", pattern(I18nContext.of(Locale.FRENCH)));
    }

    @Test
    void testResolve_ConnectorSpecificVariantOnlyForThatConnector() {
        store.saveLabel(new Label(REF, null, Locale.ENGLISH, "Hello", List.of(
                LocalizedLabel.of(VariantSlot.of(Locale.ENGLISH), true, "Hello"),
                LocalizedLabel.of(new VariantSlot(Locale.ENGLISH, "connectorX", null), true, "Hey from X"))));

        assertEquals("Hey from X", pattern(new I18nContext(Locale.ENGLISH, "connectorX", null)));
        assertEquals("Hello", pattern(new I18nContext(Locale.ENGLISH, "connectorY", null)));
    }

    @Test
    void testResolve_FallsBackToDefaultLocale() {
        engine.resolve(REF, "Welcome!", I18nContext.of(Locale.ENGLISH));

        ResolvedPattern german = engine.resolve(REF, "Welcome!", I18nContext.of(Locale.GERMAN));

        assertEquals("Welcome!", german.pattern());
        assertEquals(VariantSlot.of(Locale.ENGLISH), german.variant().slot());
        assertEquals(1, store.getLabel(REF).variants().size(), "no German variant is created");
    }

    @Test
    void testResolve_FallsBackToDefaultText() {
        store.saveLabel(new Label(REF, null, Locale.ENGLISH, "Plain default", List.of()));

        ResolvedPattern resolved = engine.resolve(REF, "Ignored", I18nContext.of(Locale.ITALIAN));

        assertEquals("Plain default", resolved.pattern());
        assertNull(resolved.variant());
    }

    @Test
    void testResolve_ConcurrentFirstUse() throws Exception {
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<ResolvedPattern>> results = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            results.add(pool.submit(() -> {
                start.await();
                return engine.resolve(REF, "Welcome!", I18nContext.of(Locale.ENGLISH));
            }));
        }
        start.countDown();
        int fresh = 0;
        for (Future<ResolvedPattern> f : results) {
            ResolvedPattern resolved = f.get(10, TimeUnit.SECONDS);
            assertEquals("Welcome!", resolved.pattern());
            if (resolved.freshlyCreated()) {
                fresh++;
            }
        }
        pool.shutdown();

        assertEquals(1, fresh);
        assertEquals(1, store.size());
        assertEquals(1, store.getLabel(REF).variants().size());
    }

    @Test
    void testResolve_AlternativesAreRoughlyUniform() {
        store.saveLabel(new Label(REF, null, Locale.ENGLISH, "Hi", List.of(
                LocalizedLabel.of(VariantSlot.of(Locale.ENGLISH), true, "Hi", "Hello", "Hey"))));
        Map<String, Integer> counts = new HashMap<>();

        for (int i = 0; i < 10_000; i++) {
            counts.merge(pattern(I18nContext.of(Locale.ENGLISH)), 1, Integer::sum);
        }

        assertEquals(3, counts.size());
        counts.forEach((text, count) -> assertTrue(count > 2800 && count < 3900, text + "=" + count));
    }

    @Test
    void testResolve_SeededSelectorIsExact() {
        List<String> alternatives = List.of("Hi", "Hello", "Hey");
        store.saveLabel(new Label(REF, null, Locale.ENGLISH, "Hi", List.of(
                new LocalizedLabel(VariantSlot.of(Locale.ENGLISH), alternatives, true))));
        DefaultResolutionEngine seeded = new DefaultResolutionEngine(store, deriver, AlternativeSelector.seeded(42));
        Random expected = new Random(42);

        for (int i = 0; i < 20; i++) {
            assertEquals(alternatives.get(expected.nextInt(3)),
                    seeded.resolve(REF, "Hi", I18nContext.of(Locale.ENGLISH)).pattern());
        }
    }

    @Test
    void testResolve_CollisionOverwritesUnvalidatedDefault() {
        LabelRef derived = deriver.derive("travel", "greet", "Hello!", null);
        engine.resolve(derived, "greet", "Hello!", I18nContext.of(Locale.ENGLISH), List.of(), true);

        ResolvedPattern resolved = engine.resolve(derived, "greet", "Hello?", I18nContext.of(Locale.ENGLISH),
                List.of(), true);

        assertEquals(List.of(new KeyCollision(derived, "Hello!", "Hello?")), collisions);
        assertEquals("Hello?", resolved.pattern());
        assertEquals("Hello?", store.getLabel(derived).defaultText());
    }

    @Test
    void testResolve_CollisionKeepsValidatedDefault() {
        LabelRef derived = deriver.derive("travel", "greet", "Hello!", null);
        store.saveLabel(new Label(derived, "greet", Locale.ENGLISH, "Hello!", List.of(
                LocalizedLabel.of(VariantSlot.of(Locale.ENGLISH), true, "Hello, traveller!"))));

        ResolvedPattern resolved = engine.resolve(derived, "greet", "Hello?", I18nContext.of(Locale.ENGLISH),
                List.of(), true);

        assertEquals(1, collisions.size());
        assertEquals("Hello, traveller!", resolved.pattern());
        assertEquals("Hello!", store.getLabel(derived).defaultText());
    }

    @Test
    void testResolve_NoCollisionForInterpolatedValues() {
        LabelRef derived = deriver.derive("travel", "files", "You have 3 files", null);
        engine.resolve(derived, "files", "You have 3 files", I18nContext.of(Locale.ENGLISH), List.of(), true);
        engine.resolve(derived, "files", "You have 4 files", I18nContext.of(Locale.ENGLISH), List.of(), true);

        assertTrue(collisions.isEmpty());
    }

    @Test
    void testResolve_CollisionForDifferentPlaceholders() {
        LabelRef derived = deriver.derive("travel", "greet", "Hi {0}", null);
        assertEquals(derived, deriver.derive("travel", "greet", "Hi {1}", null));
        engine.resolve(derived, "greet", "Hi {0}", I18nContext.of(Locale.ENGLISH), List.of(), true);

        engine.resolve(derived, "greet", "Hi {1}", I18nContext.of(Locale.ENGLISH), List.of(), true);

        assertEquals(List.of(new KeyCollision(derived, "Hi {0}", "Hi {1}")), collisions);
    }

    @Test
    void testResolve_CollisionKeepsVariantsSavedByAnotherNode() {
        CachingLabelStore nodeA = new CachingLabelStore(store, new MessagePatternParser(), Duration.ofMinutes(5));
        CachingLabelStore nodeB = new CachingLabelStore(store, new MessagePatternParser(), Duration.ofMinutes(5));
        DefaultResolutionEngine engineA = new DefaultResolutionEngine(nodeA, deriver, AlternativeSelector.random(),
                List.of(collisions::add));
        LabelRef derived = deriver.derive("travel", "greet", "Hello!", null);
        VariantSlot fr = VariantSlot.of(Locale.FRENCH);
        try {
            engineA.resolve(derived, "greet", "Hello!", I18nContext.of(Locale.ENGLISH), List.of(), true);
            nodeB.saveVariant(derived, LocalizedLabel.of(fr, true, "Bonjour !"));

            engineA.resolve(derived, "greet", "hello", I18nContext.of(Locale.ENGLISH), List.of(), true);

            assertEquals(1, collisions.size());
            assertEquals("hello", store.getLabel(derived).defaultText());
            assertEquals(LocalizedLabel.of(fr, true, "Bonjour !"), store.findVariant(derived, fr));
            assertEquals("Bonjour !",
                    engineA.resolve(derived, "greet", "hello", I18nContext.of(Locale.FRENCH), List.of(), true).pattern());
        } finally {
            nodeA.close();
            nodeB.close();
        }
    }

    @Test
    void testResolve_CollisionRechecksValidationAgainstStore() {
        CachingLabelStore nodeA = new CachingLabelStore(store, new MessagePatternParser(), Duration.ofMinutes(5));
        CachingLabelStore nodeB = new CachingLabelStore(store, new MessagePatternParser(), Duration.ofMinutes(5));
        DefaultResolutionEngine engineA = new DefaultResolutionEngine(nodeA, deriver, AlternativeSelector.random());
        LabelRef derived = deriver.derive("travel", "greet", "Hello!", null);
        LocalizedLabel validated = LocalizedLabel.of(VariantSlot.of(Locale.ENGLISH), true, "Hello, traveller!");
        try {
            engineA.resolve(derived, "greet", "Hello!", I18nContext.of(Locale.ENGLISH), List.of(), true);
            nodeB.saveVariant(derived, validated);

            ResolvedPattern resolved = engineA.resolve(derived, "greet", "hello", I18nContext.of(Locale.ENGLISH),
                    List.of(), true);

            assertEquals("Hello, traveller!", resolved.pattern());
            assertEquals("Hello!", store.getLabel(derived).defaultText());
            assertEquals(validated, store.findVariant(derived, VariantSlot.of(Locale.ENGLISH)));
        } finally {
            nodeA.close();
            nodeB.close();
        }
    }

    @Test
    void testResolve_NoCollisionCheckForExplicitKeys() {
        engine.resolve(REF, "Welcome!", I18nContext.of(Locale.ENGLISH));
        engine.resolve(REF, "Welcome aboard!", I18nContext.of(Locale.ENGLISH));

        assertTrue(collisions.isEmpty());
        assertEquals("Welcome!", store.getLabel(REF).defaultText());
    }

    @Test
    void testResolve_FailingListenerDoesNotBreakResolution() {
        DefaultResolutionEngine withBrokenListener = new DefaultResolutionEngine(store, deriver,
                AlternativeSelector.random(), List.of(c -> {
                    throw new IllegalStateException("listener down");
                }));
        LabelRef derived = deriver.derive("travel", "greet", "Hello!", null);
        withBrokenListener.resolve(derived, "greet", "Hello!", I18nContext.of(Locale.ENGLISH), List.of(), true);

        assertDoesNotThrow(() -> withBrokenListener.resolve(derived, "greet", "Hello?",
                I18nContext.of(Locale.ENGLISH), List.of(), true));
    }

    @Test
    void testResolve_ReadFailureIsStoreUnavailable() {
        LabelStore broken = mock(LabelStore.class);
        when(broken.getLabel(REF)).thenThrow(new IllegalStateException("db down"));
        DefaultResolutionEngine failing = new DefaultResolutionEngine(broken, deriver, AlternativeSelector.random());

        StoreUnavailableException e = assertThrows(StoreUnavailableException.class,
                () -> failing.resolve(REF, "Welcome!", I18nContext.of(Locale.ENGLISH)));
        assertEquals(REF, e.getRef());
    }

    @Test
    void testResolve_CreateConflictRetriesAsRead() {
        Label existing = new Label(REF, null, Locale.ENGLISH, "Welcome!",
                List.of(LocalizedLabel.unvalidated(Locale.ENGLISH, "Welcome!")));
        LabelStore flaky = mock(LabelStore.class);
        when(flaky.getLabel(REF)).thenReturn(null, existing);
        when(flaky.upsertIfAbsent(any())).thenThrow(new IllegalStateException("conflict"));
        DefaultResolutionEngine retrying = new DefaultResolutionEngine(flaky, deriver, AlternativeSelector.random());

        ResolvedPattern resolved = retrying.resolve(REF, "Welcome!", I18nContext.of(Locale.ENGLISH));

        assertEquals("Welcome!", resolved.pattern());
        assertFalse(resolved.freshlyCreated());
        verify(flaky, times(2)).getLabel(REF);
    }

    @Test
    void testResolve_CreateConflictWithoutStoredLabel() {
        LabelStore flaky = mock(LabelStore.class);
        when(flaky.getLabel(REF)).thenReturn(null);
        when(flaky.upsertIfAbsent(any())).thenThrow(new IllegalStateException("conflict"));
        DefaultResolutionEngine retrying = new DefaultResolutionEngine(flaky, deriver, AlternativeSelector.random());

        assertThrows(StoreUnavailableException.class,
                () -> retrying.resolve(REF, "Welcome!", I18nContext.of(Locale.ENGLISH)));
    }

    @Test
    void testSaveVariant_GoesThroughStore() {
        engine.resolve(REF, "Welcome!", I18nContext.of(Locale.ENGLISH));
        engine.saveVariant(REF, LocalizedLabel.of(VariantSlot.of(Locale.FRENCH), true, "Bienvenue !"));

        assertEquals("Bienvenue !", pattern(I18nContext.of(Locale.FRENCH)));
    }

    private String pattern(I18nContext ctx) {
        return engine.resolve(REF, "unused", ctx).pattern();
    }
}
