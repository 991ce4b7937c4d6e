package com.celldeps.cli.manifest;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NotebookManifestReaderTest {

    private final NotebookManifestReader reader = new NotebookManifestReader();

    private static Path write(Path dir, String json) throws IOException {
        Path manifest = dir.resolve("manifest.json");
        Files.writeString(manifest, json);
        return manifest;
    }

    @Test
    void readsAllFields(@TempDir Path tmp) throws IOException {
        Path manifest = write(tmp, """
            {
              "notebook_name": "etl",
              "extra_builtins": ["display", "spark"],
              "cells": [
                { "id": "c1", "file": "cells/one.py" },
                { "id": "c2", "source": "y = x" }
              ]
            }
            """);

        NotebookManifest config = reader.read(manifest);
        assertEquals("etl", config.getNotebookName());
        assertEquals(List.of("display", "spark"), config.getExtraBuiltins());
        assertEquals(2, config.getCells().size());
        assertEquals("cells/one.py", config.getCells().get(0).getFile());
        assertNull(config.getCells().get(0).getSource());
        assertEquals("y = x", config.getCells().get(1).getSource());
    }

    @Test
    void missingOptionalFieldsDefault(@TempDir Path tmp) throws IOException {
        NotebookManifest config = reader.read(write(tmp, "{}"));
        assertEquals("notebook", config.getNotebookName());
        assertTrue(config.getExtraBuiltins().isEmpty());
        assertTrue(config.getCells().isEmpty());
    }

    @Test
    void fileNotFoundThrowsManifestReadException() {
        Path missing = Path.of("/tmp/does-not-exist-celldeps-manifest.json");
        assertThrows(NotebookManifestReader.ManifestReadException.class, () -> reader.read(missing));
    }

    @Test
    void emptyFileThrowsManifestReadException(@TempDir Path tmp) throws IOException {
        assertThrows(NotebookManifestReader.ManifestReadException.class, () -> reader.read(write(tmp, "")));
    }

    @Test
    void malformedJsonThrowsManifestReadException(@TempDir Path tmp) throws IOException {
        assertThrows(NotebookManifestReader.ManifestReadException.class,
                () -> reader.read(write(tmp, "{ \"cells\": [ { \"id\": ")));
    }

    @Test
    void cellNeedsAnId(@TempDir Path tmp) throws IOException {
        Path manifest = write(tmp, """
            { "cells": [ { "id": " ", "source": "x = 1" } ] }
            """);
        Exception ex = assertThrows(NotebookManifestReader.ManifestReadException.class, () -> reader.read(manifest));
        assertTrue(ex.getMessage().startsWith("Cell #0 has no id"), ex.getMessage());
    }

    @Test
    void duplicateIdsAreRejected(@TempDir Path tmp) throws IOException {
        Path manifest = write(tmp, """
            { "cells": [ { "id": "a", "source": "x = 1" }, { "id": "a", "source": "y = 2" } ] }
            """);
        Exception ex = assertThrows(NotebookManifestReader.ManifestReadException.class, () -> reader.read(manifest));
        assertTrue(ex.getMessage().contains("Duplicate cell id 'a'"), ex.getMessage());
    }

    @Test
    void cellNeedsExactlyOneOfFileOrSource(@TempDir Path tmp) throws IOException {
        Path both = write(tmp, """
            { "cells": [ { "id": "a", "file": "a.py", "source": "x = 1" } ] }
            """);
        assertThrows(NotebookManifestReader.ManifestReadException.class, () -> reader.read(both));

        Path neither = write(tmp, """
            { "cells": [ { "id": "a" } ] }
            """);
        assertThrows(NotebookManifestReader.ManifestReadException.class, () -> reader.read(neither));
    }

    @Test
    void emptySourceIsAllowed(@TempDir Path tmp) throws IOException {
        Path manifest = write(tmp, """
            { "cells": [ { "id": "a", "source": "" } ] }
            """);
        assertEquals("", reader.read(manifest).getCells().get(0).getSource());
    }

    @Test
    void loadCellsResolvesFilesAgainstBaseDirInOrder(@TempDir Path tmp) throws IOException {
        Files.createDirectories(tmp.resolve("cells"));
        Files.writeString(tmp.resolve("cells/first.py"), "a = 1\n");
        Path manifest = write(tmp, """
            {
              "cells": [
                { "id": "first", "file": "cells/first.py" },
                { "id": "second", "source": "b = a" }
              ]
            }
            """);

        List<CellSource> cells = reader.loadCells(reader.read(manifest), tmp);
        assertEquals(List.of(new CellSource("first", "a = 1\n"), new CellSource("second", "b = a")), cells);
    }

    @Test
    void missingCellFileThrowsManifestReadException(@TempDir Path tmp) throws IOException {
        Path manifest = write(tmp, """
            { "cells": [ { "id": "gone", "file": "gone.py" } ] }
            """);
        NotebookManifest config = reader.read(manifest);
        Exception ex = assertThrows(NotebookManifestReader.ManifestReadException.class,
                () -> reader.loadCells(config, tmp));
        assertTrue(ex.getMessage().contains("'gone'"), ex.getMessage());
    }
}
