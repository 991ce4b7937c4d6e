package com.celldeps.cli.manifest;

import com.google.gson.annotations.SerializedName;
import java.util.Collections;
import java.util.List;

/**
 * Deserialized form of a notebook manifest.json.
 */
public class NotebookManifest {

    @SerializedName("notebook_name")
    private String notebookName;

    /** Names the notebook runtime injects into every cell (e.g. display, spark). */
    @SerializedName("extra_builtins")
    private List<String> extraBuiltins;

    @SerializedName("cells")
    private List<CellEntry> cells;

    public String getNotebookName()        { return notebookName != null ? notebookName : "notebook"; }
    public List<String> getExtraBuiltins() { return extraBuiltins != null ? extraBuiltins : Collections.emptyList(); }
    public List<CellEntry> getCells()      { return cells != null ? cells : Collections.emptyList(); }

    /**
     * One cell: inline {@code source}, or a {@code file} relative to the manifest's directory.
     */
    public static class CellEntry {

        @SerializedName("id")
        private String id;

        @SerializedName("file")
        private String file;

        @SerializedName("source")
        private String source;

        public String getId()     { return id; }
        public String getFile()   { return file; }
        public String getSource() { return source; }
    }
}
