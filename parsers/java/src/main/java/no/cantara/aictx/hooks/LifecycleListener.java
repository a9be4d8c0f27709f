package no.cantara.aictx.hooks;

import java.util.Map;

/**
 * Observer of pipeline events. Listeners cannot influence the outcome: anything they throw is
 * logged and discarded by {@link LifecycleHooks}.
 */
@FunctionalInterface
public interface LifecycleListener {

    /**
     * @param event   the event being emitted
     * @param context read-only event data, e.g. {@code root}, {@code config}, {@code index},
     *                {@code ok}, {@code manifest}, {@code adapter}
     */
    void onEvent(LifecycleEvent event, Map<String, Object> context);
}
