package no.cantara.aictx;

import no.cantara.aictx.model.Complexity;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/** Builds small convention trees for tests. */
final class Fixtures {

    private Fixtures() {}

    static Path write(Path root, String relative, String content) {
        try {
            Path file = root.resolve(relative);
            Files.createDirectories(file.getParent());
            Files.writeString(file, content);
            return file;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static String rule(String id, String body) {
        return "---\nid: " + id + "\nkind: rule\n---\n" + body + "\n";
    }

    static String spec(String id, String status, String complexity) {
        return "---\nid: " + id + "\nkind: spec\nstatus: " + status + "\ncomplexity: " + complexity + "\n---\n# " + id + "\n";
    }

    static String artifact(String id, String kind) {
        return "---\nid: " + id + "\nkind: " + kind + "\n---\n" + kind + " notes\n";
    }

    /** A complete task of the given complexity. */
    static void task(Path root, String name, String status, String complexity) {
        write(root, "tasks/" + name + "/spec.md", spec(name, status, complexity));
        for (String file : Complexity.fromValue(complexity).requiredFiles()) {
            if (!file.equals("spec.md")) {
                String kind = file.substring(0, file.length() - 3);
                write(root, "tasks/" + name + "/" + file, artifact(name + "-" + kind, kind));
            }
        }
    }
}
