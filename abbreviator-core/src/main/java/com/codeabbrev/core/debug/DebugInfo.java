package com.codeabbrev.core.debug;

import com.codeabbrev.core.syntax.BlockKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Per-call record of what the traversal considered, abbreviated and skipped.
 * Purely observational: nothing here feeds back into the transformed tree.
 * When disabled, every recording method is a no-op.
 */
public class DebugInfo {

    /** An abbreviation that was committed. */
    public record AbbreviatedNode(String kind, int depth, int charsSaved) {}

    /** An eligible node that was left unchanged. */
    public record SkippedNode(String kind, int depth, String reason) {}

    private final boolean enabled;
    private int nodesConsidered;
    private int nodesAbbreviated;
    private int nodesSkipped;
    private int maxDepthReached;
    private long charsSaved;
    private final Map<Integer, Integer> depthCounts = new TreeMap<>();
    private final List<AbbreviatedNode> abbreviatedNodes = new ArrayList<>();
    private final List<SkippedNode> skippedNodes = new ArrayList<>();

    public DebugInfo(boolean enabled) {
        this.enabled = enabled;
    }

    public static DebugInfo disabled() {
        return new DebugInfo(false);
    }

    public void consider(BlockKind kind, int depth) {
        if (!enabled) return;
        nodesConsidered++;
        maxDepthReached = Math.max(maxDepthReached, depth);
        depthCounts.merge(depth, 1, Integer::sum);
    }

    public void recordAbbreviated(BlockKind kind, int depth, int saved) {
        if (!enabled) return;
        nodesAbbreviated++;
        abbreviatedNodes.add(new AbbreviatedNode(kind.displayName(), depth, saved));
        charsSaved += saved;
    }

    public void recordSkipped(BlockKind kind, int depth, String reason) {
        if (!enabled) return;
        nodesSkipped++;
        skippedNodes.add(new SkippedNode(kind.displayName(), depth, reason));
    }

    public boolean isEnabled()              { return enabled; }
    public int getNodesConsidered()         { return nodesConsidered; }
    public int getNodesAbbreviated()        { return nodesAbbreviated; }
    public int getNodesSkipped()            { return nodesSkipped; }
    public int getMaxDepthReached()         { return maxDepthReached; }
    public long getCharsSaved()             { return charsSaved; }
    public Map<Integer, Integer> getDepthCounts()     { return Collections.unmodifiableMap(depthCounts); }
    public List<AbbreviatedNode> getAbbreviatedNodes() { return Collections.unmodifiableList(abbreviatedNodes); }
    public List<SkippedNode> getSkippedNodes()         { return Collections.unmodifiableList(skippedNodes); }

    /**
     * Human-readable report: totals, depth histogram and the abbreviated and
     * skipped lists. Empty when disabled.
     */
    public String summary() {
        if (!enabled) return "";
        StringBuilder out = new StringBuilder();
        out.append("\n----- Debug Summary -----\n");
        out.append("Nodes considered: ").append(nodesConsidered).append('\n');
        out.append("Nodes abbreviated: ").append(nodesAbbreviated).append('\n');
        out.append("Nodes skipped: ").append(nodesSkipped).append('\n');
        out.append("Total characters saved: ").append(charsSaved).append('\n');
        out.append("Maximum depth reached: ").append(maxDepthReached).append('\n');

        out.append("\nDepth distribution:\n");
        for (Map.Entry<Integer, Integer> entry : depthCounts.entrySet()) {
            out.append("  Depth ").append(entry.getKey()).append(": ").append(entry.getValue()).append(" nodes\n");
        }

        if (!abbreviatedNodes.isEmpty()) {
            out.append("\nAbbreviated nodes:\n");
            for (AbbreviatedNode node : abbreviatedNodes) {
                out.append("  ").append(node.kind()).append(" at depth ").append(node.depth())
                   .append(" (saved ").append(node.charsSaved()).append(" chars)\n");
            }
        }
        if (!skippedNodes.isEmpty()) {
            out.append("\nSkipped nodes:\n");
            for (SkippedNode node : skippedNodes) {
                out.append("  ").append(node.kind()).append(" at depth ").append(node.depth())
                   .append(" - ").append(node.reason()).append('\n');
            }
        }
        if (abbreviatedNodes.isEmpty() && skippedNodes.isEmpty()) {
            out.append("\nNo nodes were abbreviated. Try:\n");
            out.append("  1. Decreasing the --depth parameter\n");
            out.append("  2. Using a file with deeper nesting\n");
        }
        out.append("------------------------\n");
        return out.toString();
    }
}
