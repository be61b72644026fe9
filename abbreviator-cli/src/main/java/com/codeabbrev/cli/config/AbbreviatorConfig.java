package com.codeabbrev.cli.config;

import com.google.gson.annotations.SerializedName;

/**
 * Deserialized form of the optional JSON configuration file. Every key may be
 * omitted; getters apply the defaults. Command-line flags win over these values.
 */
public class AbbreviatorConfig {

    @SerializedName("max_depth")
    private Integer maxDepth;

    /** No default: either the file or {@code --preserve-chars} must supply it for {@code abbreviate}. */
    @SerializedName("preserve_chars")
    private Integer preserveChars;

    @SerializedName("preserve_lines")
    private Integer preserveLines;

    @SerializedName("debug")
    private Boolean debug;

    @SerializedName("output_dir")
    private String outputDir;

    @SerializedName("db_path")
    private String dbPath;

    @SerializedName("llm_api_base")
    private String llmApiBase;

    @SerializedName("llm_model")
    private String llmModel;

    @SerializedName("llm_api_key_file")
    private String llmApiKeyFile;

    @SerializedName("llm_max_tokens")
    private Integer llmMaxTokens;

    @SerializedName("llm_temperature")
    private Double llmTemperature;

    @SerializedName("llm_top_p")
    private Double llmTopP;

    @SerializedName("llm_timeout_seconds")
    private Integer llmTimeoutSeconds;

    public int getMaxDepth()           { return maxDepth != null ? maxDepth : 2; }
    public Integer getPreserveChars()  { return preserveChars; }
    public int getPreserveLines()      { return preserveLines != null ? preserveLines : 2; }
    public boolean isDebug()           { return debug != null && debug; }
    public String getOutputDir()       { return outputDir != null ? outputDir : "data/output"; }
    public String getDbPath()          { return dbPath != null ? dbPath : "data/db/code_analysis.db"; }
    public String getLlmApiBase()      { return llmApiBase != null ? llmApiBase : "https://api.hyperbolic.xyz/v1/"; }
    public String getLlmModel()        { return llmModel != null ? llmModel : "deepseek-ai/DeepSeek-V3"; }
    public String getLlmApiKeyFile()   { return llmApiKeyFile != null ? llmApiKeyFile : "secrets/hyperbolic_api_key.txt"; }
    public int getLlmMaxTokens()       { return llmMaxTokens != null ? llmMaxTokens : 2048; }
    public double getLlmTemperature()  { return llmTemperature != null ? llmTemperature : 0.7; }
    public double getLlmTopP()         { return llmTopP != null ? llmTopP : 0.95; }
    public int getLlmTimeoutSeconds()  { return llmTimeoutSeconds != null ? llmTimeoutSeconds : 120; }
}
