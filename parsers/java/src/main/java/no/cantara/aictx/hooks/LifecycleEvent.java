package no.cantara.aictx.hooks;

/** Points in the validate, build and export pipelines at which listeners are notified. */
public enum LifecycleEvent {
    BEFORE_VALIDATE,
    AFTER_VALIDATE,
    BEFORE_BUILD_MANIFEST,
    AFTER_BUILD_MANIFEST,
    BEFORE_EXPORT,
    AFTER_EXPORT;

    /** Name used in logs and plugin code, e.g. {@code before_validate}. */
    public String hookName() {
        return name().toLowerCase();
    }
}
