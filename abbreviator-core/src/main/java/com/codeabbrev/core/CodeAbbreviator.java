package com.codeabbrev.core;

import com.codeabbrev.core.debug.DebugInfo;
import com.codeabbrev.core.syntax.Module;
import com.codeabbrev.core.syntax.ParseException;
import com.codeabbrev.core.syntax.PythonParser;
import com.codeabbrev.core.transform.BlockTransformer;
import com.codeabbrev.core.transform.DecisionPolicy;

/**
 * Entry point of the library: parse, abbreviate blocks nested deeper than the
 * configured depth, render.
 *
 * Never throws on bad input. When the source cannot be parsed or the rewrite
 * fails, the error is logged to stderr and the original text comes back
 * unchanged.
 */
public class CodeAbbreviator {

    private final PythonParser parser = new PythonParser();
    private final DecisionPolicy policy;

    public CodeAbbreviator() {
        this(new DecisionPolicy());
    }

    CodeAbbreviator(DecisionPolicy policy) {
        this.policy = policy;
    }

    public AbbreviationResult abbreviate(String source, AbbreviationOptions options) {
        DebugInfo debugInfo = new DebugInfo(options.debug);
        int originalChars = source.codePointCount(0, source.length());
        String text;
        boolean failed = false;
        try {
            Module module = parser.parse(source);
            Module transformed = new BlockTransformer(options, policy).transform(module, debugInfo);
            text = transformed.code();
        } catch (ParseException e) {
            System.err.println("[abbreviator] ERROR: could not parse source: " + e.getMessage());
            text = source;
            failed = true;
        } catch (RuntimeException e) {
            System.err.println("[abbreviator] ERROR: abbreviation failed, returning original text: "
                    + e.getMessage());
            text = source;
            failed = true;
        }
        if (options.debug) {
            System.err.print(debugInfo.summary());
        }
        return new AbbreviationResult(text, debugInfo, originalChars,
                text.codePointCount(0, text.length()), failed);
    }

    /** Abbreviated text only. */
    public String abbreviateCode(String source, AbbreviationOptions options) {
        return abbreviate(source, options).text();
    }
}
