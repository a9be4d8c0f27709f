package no.cantara.aictx.hooks;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.ServiceConfigurationError;

import static org.junit.jupiter.api.Assertions.*;

class LifecycleHooksTest {

    @Test
    void listenersSeeEventsInRegistrationOrder() {
        List<String> seen = new ArrayList<>();
        LifecycleHooks hooks = new LifecycleHooks(List.of(
                (event, ctx) -> seen.add("first:" + event.hookName()),
                (event, ctx) -> seen.add("second:" + ctx.get("adapter"))));

        hooks.emit(LifecycleEvent.BEFORE_EXPORT, Map.of("adapter", "cursor"));

        assertEquals(List.of("first:before_export", "second:cursor"), seen);
    }

    @Test
    void failingListenerIsSwallowedAndOthersStillRun() {
        List<LifecycleEvent> seen = new ArrayList<>();
        LifecycleHooks hooks = new LifecycleHooks(List.of(
                (event, ctx) -> { throw new IllegalStateException("boom"); },
                (event, ctx) -> seen.add(event)));

        assertDoesNotThrow(() -> hooks.emit(LifecycleEvent.AFTER_VALIDATE, Map.of()));
        assertEquals(List.of(LifecycleEvent.AFTER_VALIDATE), seen);
    }

    @Test
    void listenerLinkageErrorIsSwallowed() {
        List<LifecycleEvent> seen = new ArrayList<>();
        LifecycleHooks hooks = new LifecycleHooks(List.of(
                (event, ctx) -> { throw new NoClassDefFoundError("com/example/Gone"); },
                (event, ctx) -> seen.add(event)));

        assertDoesNotThrow(() -> hooks.emit(LifecycleEvent.BEFORE_BUILD_MANIFEST, Map.of()));
        assertEquals(List.of(LifecycleEvent.BEFORE_BUILD_MANIFEST), seen);
    }

    @Test
    void contextIsReadOnly() {
        LifecycleHooks hooks = new LifecycleHooks(List.of(
                (event, ctx) -> ctx.put("ok", false)));
        // the UnsupportedOperationException is swallowed like any other listener failure
        assertDoesNotThrow(() -> hooks.emit(LifecycleEvent.AFTER_VALIDATE, Map.of("ok", true)));
    }

    @Test
    void sixEventsWithSnakeCaseNames() {
        assertEquals(6, LifecycleEvent.values().length);
        assertEquals("before_build_manifest", LifecycleEvent.BEFORE_BUILD_MANIFEST.hookName());
    }

    @Test
    void onlyConfiguredPluginsAreActivated() {
        List<String> seen = new ArrayList<>();
        LifecyclePluginProvider audit = provider("audit-log", (event, ctx) -> seen.add("audit"));
        LifecyclePluginProvider metrics = provider("metrics", (event, ctx) -> seen.add("metrics"));

        LifecycleHooks hooks = LifecycleHooks.fromPlugins(List.of("audit-log", "missing"), List.of(audit, metrics));
        hooks.emit(LifecycleEvent.BEFORE_VALIDATE, Map.of());

        assertEquals(1, hooks.size());
        assertEquals(List.of("audit"), seen);
    }

    @Test
    void pluginThatFailsToStartIsSkipped() {
        LifecyclePluginProvider broken = new LifecyclePluginProvider() {
            @Override public String pluginId() { return "broken"; }
            @Override public LifecycleListener create() { throw new IllegalStateException("no"); }
        };
        assertEquals(0, LifecycleHooks.fromPlugins(List.of("broken"), List.of(broken)).size());
    }

    @Test
    void pluginWithMissingClassesAtStartIsSkipped() {
        LifecyclePluginProvider broken = new LifecyclePluginProvider() {
            @Override public String pluginId() { return "broken"; }
            @Override public LifecycleListener create() { throw new NoClassDefFoundError("com/example/Gone"); }
        };
        assertEquals(0, LifecycleHooks.fromPlugins(List.of("broken"), List.of(broken)).size());
    }

    @Test
    void providerThatFailsToLoadDoesNotHideTheOthers() {
        LifecyclePluginProvider audit = provider("audit-log", (event, ctx) -> { });
        Iterable<LifecyclePluginProvider> providers = () -> new Iterator<>() {
            private int next;

            @Override
            public boolean hasNext() {
                if (next == 0) {
                    next++;
                    throw new ServiceConfigurationError("Provider com.example.Missing not found");
                }
                return next == 1;
            }

            @Override
            public LifecyclePluginProvider next() {
                if (next != 1) {
                    throw new NoSuchElementException();
                }
                next++;
                return audit;
            }
        };

        LifecycleHooks hooks = assertDoesNotThrow(() -> LifecycleHooks.fromPlugins(List.of("audit-log"), providers));
        assertEquals(1, hooks.size());
    }

    @Test
    void unloadableServiceEntryOnClassPathIsSkipped() {
        // the test services file lists a provider class that does not exist
        assertDoesNotThrow(() -> LifecycleHooks.fromPlugins(List.of()));
        assertEquals(1, LifecycleHooks.fromPlugins(List.of("recording")).size());
    }

    @Test
    void serviceLoaderResolvesRegisteredProvider() {
        RecordingPluginProvider.EVENTS.clear();
        LifecycleHooks hooks = LifecycleHooks.fromPlugins(List.of("recording"));
        hooks.emit(LifecycleEvent.AFTER_EXPORT, Map.of());

        assertEquals(1, hooks.size());
        assertEquals(List.of(LifecycleEvent.AFTER_EXPORT), RecordingPluginProvider.EVENTS);
        assertEquals(0, LifecycleHooks.fromPlugins(List.of()).size());
    }

    private static LifecyclePluginProvider provider(String id, LifecycleListener listener) {
        return new LifecyclePluginProvider() {
            @Override public String pluginId() { return id; }
            @Override public LifecycleListener create() { return listener; }
        };
    }
}
