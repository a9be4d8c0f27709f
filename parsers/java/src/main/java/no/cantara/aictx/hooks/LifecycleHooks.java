package no.cantara.aictx.hooks;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;

/**
 * The listeners for one pipeline invocation. Emission is best-effort: a failing listener is
 * logged and skipped, and the remaining listeners still run.
 */
public final class LifecycleHooks {

    private static final Logger log = LoggerFactory.getLogger(LifecycleHooks.class);

    private final List<LifecycleListener> listeners;

    public LifecycleHooks(List<LifecycleListener> listeners) {
        this.listeners = List.copyOf(listeners);
    }

    /**
     * Resolves the configured plugin ids against the providers on the class path.
     * Unknown ids, providers that cannot be loaded and plugins that fail to start are
     * logged and skipped.
     */
    public static LifecycleHooks fromPlugins(List<String> pluginIds) {
        return fromPlugins(pluginIds, ServiceLoader.load(LifecyclePluginProvider.class));
    }

    static LifecycleHooks fromPlugins(List<String> pluginIds, Iterable<LifecyclePluginProvider> providers) {
        Map<String, LifecyclePluginProvider> byId = discover(providers);
        List<LifecycleListener> resolved = new ArrayList<>();
        for (String id : pluginIds) {
            LifecyclePluginProvider provider = byId.get(id);
            if (provider == null) {
                log.warn("Unknown plugin '{}' in config; available: {}", id, byId.keySet().stream().sorted().toList());
                continue;
            }
            try {
                resolved.add(provider.create());
                log.debug("Activated plugin '{}'", id);
            } catch (RuntimeException | LinkageError e) {
                log.warn("Plugin '{}' failed to start; skipping", id, e);
            }
        }
        return new LifecycleHooks(resolved);
    }

    // ServiceLoader's iterator moves past a provider that failed to load, so the walk can go on.
    private static Map<String, LifecyclePluginProvider> discover(Iterable<LifecyclePluginProvider> providers) {
        Map<String, LifecyclePluginProvider> byId = new HashMap<>();
        Iterator<LifecyclePluginProvider> it = providers.iterator();
        while (true) {
            try {
                if (!it.hasNext()) {
                    break;
                }
                LifecyclePluginProvider provider = it.next();
                byId.putIfAbsent(provider.pluginId(), provider);
            } catch (ServiceConfigurationError | RuntimeException | LinkageError e) {
                log.warn("Skipping plugin provider that could not be loaded", e);
            }
        }
        return byId;
    }

    public void emit(LifecycleEvent event, Map<String, Object> context) {
        Map<String, Object> view = Collections.unmodifiableMap(new HashMap<>(context));
        for (LifecycleListener listener : listeners) {
            try {
                listener.onEvent(event, view);
            } catch (RuntimeException | LinkageError e) {
                log.warn("Listener failed on {}; ignoring", event.hookName(), e);
            }
        }
    }

    public int size() {
        return listeners.size();
    }
}
