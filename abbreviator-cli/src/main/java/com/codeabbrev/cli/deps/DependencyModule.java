package com.codeabbrev.cli.deps;

import com.google.gson.annotations.SerializedName;

import java.util.List;

/**
 * One module entry of a pydeps dependency map. Absent keys stay null and are
 * omitted again on write.
 */
public class DependencyModule {

    public String name;
    public String path;

    /** Import distance from the analysed script; 0 for the script itself. */
    public Integer bacon;

    public List<String> imports;

    @SerializedName("imported_by")
    public List<String> importedBy;

    /** Attached by {@link DependencyEnhancer}. */
    public String summary;

    /** Set when pydeps failed and only the script itself could be reported. */
    public String error;

    static DependencyModule forScript(String name, String path) {
        DependencyModule module = new DependencyModule();
        module.name = name;
        module.path = path;
        module.bacon = 0;
        return module;
    }
}
