package com.celldeps.cli.manifest;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public class NotebookManifestReader {

    private static final Gson GSON = new Gson();

    /**
     * Reads, deserializes and validates manifest.json from the given path.
     *
     * @throws ManifestReadException if the file is missing, malformed, or a cell entry is invalid
     */
    public NotebookManifest read(Path manifestPath) {
        if (!Files.exists(manifestPath)) {
            throw new ManifestReadException("Manifest file not found: " + manifestPath);
        }
        NotebookManifest manifest;
        try (Reader reader = Files.newBufferedReader(manifestPath, StandardCharsets.UTF_8)) {
            manifest = GSON.fromJson(reader, NotebookManifest.class);
        } catch (NoSuchFileException e) {
            throw new ManifestReadException("Manifest file not found: " + manifestPath, e);
        } catch (IOException e) {
            throw new ManifestReadException("Failed to read manifest: " + manifestPath + ": " + e.getMessage(), e);
        } catch (JsonParseException e) {
            throw new ManifestReadException("Manifest is not valid JSON: " + manifestPath + ": " + e.getMessage(), e);
        }
        if (manifest == null) {
            throw new ManifestReadException("Manifest file is empty or invalid JSON: " + manifestPath);
        }
        validate(manifest, manifestPath);
        return manifest;
    }

    /**
     * Returns every cell's source in manifest order, loading {@code file} cells
     * relative to {@code baseDir}.
     *
     * @throws ManifestReadException if a cell file cannot be read
     */
    public List<CellSource> loadCells(NotebookManifest manifest, Path baseDir) {
        List<CellSource> cells = new ArrayList<>();
        for (NotebookManifest.CellEntry entry : manifest.getCells()) {
            if (entry.getSource() != null) {
                cells.add(new CellSource(entry.getId(), entry.getSource()));
                continue;
            }
            Path cellPath = baseDir.resolve(entry.getFile());
            try {
                cells.add(new CellSource(entry.getId(), Files.readString(cellPath, StandardCharsets.UTF_8)));
            } catch (IOException e) {
                throw new ManifestReadException(
                        "Failed to read cell '" + entry.getId() + "' from " + cellPath + ": " + e.getMessage(), e);
            }
        }
        return cells;
    }

    private static void validate(NotebookManifest manifest, Path manifestPath) {
        Set<String> ids = new HashSet<>();
        int index = 0;
        for (NotebookManifest.CellEntry entry : manifest.getCells()) {
            if (entry == null) {
                throw new ManifestReadException("Cell #" + index + " is null in " + manifestPath);
            }
            String id = entry.getId();
            if (id == null || id.isBlank()) {
                throw new ManifestReadException("Cell #" + index + " has no id in " + manifestPath);
            }
            if (!ids.add(id)) {
                throw new ManifestReadException("Duplicate cell id '" + id + "' in " + manifestPath);
            }
            if ((entry.getFile() == null) == (entry.getSource() == null)) {
                throw new ManifestReadException(
                        "Cell '" + id + "' must have exactly one of 'file' or 'source' in " + manifestPath);
            }
            index++;
        }
        if (manifest.getExtraBuiltins().stream().anyMatch(name -> name == null || name.isBlank())) {
            throw new ManifestReadException("extra_builtins must not contain blank names in " + manifestPath);
        }
    }

    public static class ManifestReadException extends RuntimeException {
        public ManifestReadException(String message) { super(message); }
        public ManifestReadException(String message, Throwable cause) { super(message, cause); }
    }
}
