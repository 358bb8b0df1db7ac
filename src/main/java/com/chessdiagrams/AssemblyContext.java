package com.chessdiagrams;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * State of one assembly pass: the block stream, the blocks already consumed and
 * the chessboard verdicts computed so far.
 */
public class AssemblyContext {

    private static final Logger log = LoggerFactory.getLogger(AssemblyContext.class);

    private final List<Block> blocks;
    private final int maxDistance;
    private final HeaderParser headerParser;
    private final SolutionParser solutionParser;
    private final BoardClassifier classifier;

    private final Set<Integer> used = new HashSet<>();
    private final Set<String> emittedHeaders = new HashSet<>();
    private final Map<Integer, BoardVerdict> verdicts = new HashMap<>();

    public AssemblyContext(List<Block> blocks, int maxDistance, HeaderParser headerParser,
                           SolutionParser solutionParser, BoardClassifier classifier) {
        if (maxDistance < 0) {
            throw new ConfigurationException("Search distance must not be negative: " + maxDistance);
        }
        List<Block> ordered = new ArrayList<>(blocks);
        ordered.sort((a, b) -> Integer.compare(a.getGlobalIndex(), b.getGlobalIndex()));
        this.blocks = Collections.unmodifiableList(ordered);
        this.maxDistance = maxDistance;
        this.headerParser = headerParser;
        this.solutionParser = solutionParser;
        this.classifier = classifier;
    }

    public List<Block> getBlocks() {
        return blocks;
    }

    public int getMaxDistance() {
        return maxDistance;
    }

    /** Consumed by an earlier diagram, or a repeat of a header already emitted. */
    public boolean isUsed(Block block) {
        return used.contains(block.getGlobalIndex()) || isRepeatedHeader(block);
    }

    public void markUsed(Block block) {
        if (block != null) {
            used.add(block.getGlobalIndex());
            String key = headerKey(block);
            if (key != null) {
                emittedHeaders.add(key);
            }
        }
    }

    /** An unconsumed header whose puzzle already has a diagram. */
    public boolean isRepeatedHeader(Block block) {
        if (used.contains(block.getGlobalIndex()) || emittedHeaders.isEmpty()) {
            return false;
        }
        String key = headerKey(block);
        return key != null && emittedHeaders.contains(key);
    }

    private String headerKey(Block block) {
        if (!isHeader(block)) {
            return null;
        }
        HeaderInfo info = headerParser.parse(block.getText());
        return info == null ? null : info.key();
    }

    public boolean isHeader(Block block) {
        return block.isText() && headerParser.isHeader(block.getText());
    }

    /** Header matches win over solution matches. */
    public boolean isSolution(Block block) {
        return block.isText() && !isHeader(block) && solutionParser.isSolution(block.getText());
    }

    public boolean isChessboard(Block block) {
        return block.isImage() && verdict(block).isChessboard();
    }

    public BoardVerdict verdict(Block block) {
        if (!block.isImage()) {
            return BoardVerdict.rejected();
        }
        return verdicts.computeIfAbsent(block.getGlobalIndex(), k -> {
            BoardVerdict verdict = classifier.classify(block.getImage());
            log.debug("{}: {}", block, verdict);
            return verdict;
        });
    }

    public boolean hasRole(Block block, Role role) {
        switch (role) {
            case HEADER:
                return isHeader(block);
            case SOLUTION:
                return isSolution(block);
            case IMAGE:
                return isChessboard(block);
            default:
                return false;
        }
    }

    /** The role of a block, or null when it plays none. */
    public Role roleOf(Block block) {
        if (block.isImage()) {
            return isChessboard(block) ? Role.IMAGE : null;
        }
        if (isHeader(block)) {
            return Role.HEADER;
        }
        return isSolution(block) ? Role.SOLUTION : null;
    }

    /** Number of distinct images the classifier turned down so far. */
    public int rejectedImageCount() {
        int rejected = 0;
        for (BoardVerdict verdict : verdicts.values()) {
            if (!verdict.isChessboard()) {
                rejected++;
            }
        }
        return rejected;
    }

    /**
     * Finds the unused block of the given role whose global index lies in
     * {@code [from, to]}, closest to the anchor; on equal distance the earlier one.
     * The anchor itself never qualifies.
     */
    public Block nearest(Role role, Block anchor, int from, int to) {
        Block best = null;
        int bestDistance = Integer.MAX_VALUE;
        for (int i = firstPositionAtLeast(from); i < blocks.size(); i++) {
            Block candidate = blocks.get(i);
            if (candidate.getGlobalIndex() > to) {
                break;
            }
            if (candidate == anchor || isUsed(candidate) || !hasRole(candidate, role)) {
                continue;
            }
            int distance = candidate.distanceTo(anchor);
            if (distance < bestDistance) {
                best = candidate;
                bestDistance = distance;
            }
        }
        return best;
    }

    private int firstPositionAtLeast(int globalIndex) {
        int low = 0;
        int high = blocks.size();
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (blocks.get(mid).getGlobalIndex() < globalIndex) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }
}
