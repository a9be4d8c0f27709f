package no.cantara.aictx;

import java.nio.file.Path;

/** A required field is missing or an enum-constrained field holds an unknown value. */
public class SchemaException extends IllegalArgumentException {

    private final transient Path path;

    public SchemaException(Path path, String msg) {
        super(path + ": " + msg);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
