package no.cantara.aictx.hooks;

/**
 * Service Provider Interface for lifecycle plugins.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader} but only activated when
 * their {@link #pluginId()} is listed under {@code plugins} in {@code .aictx/config.yaml}.
 * Register a provider in {@code META-INF/services/no.cantara.aictx.hooks.LifecyclePluginProvider}.
 */
public interface LifecyclePluginProvider {

    /** A stable, lowercase identifier, e.g. "audit-log". */
    String pluginId();

    LifecycleListener create();
}
