package com.chessdiagrams;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks the block stream and groups header, board image and solution blocks
 * into diagrams according to a {@link DiagramStructure}.
 */
public class DiagramAssembler {

    private static final Logger log = LoggerFactory.getLogger(DiagramAssembler.class);

    private final DiagramStructure structure;
    private final int maxDistance;
    private final HeaderParser headerParser;
    private final SolutionParser solutionParser;
    private final BoardClassifier classifier;
    private final Integer maxDiagrams;
    private final Integer pageEnd;

    public DiagramAssembler(DiagramStructure structure, int maxDistance, HeaderParser headerParser,
                            SolutionParser solutionParser, BoardClassifier classifier) {
        this(structure, maxDistance, headerParser, solutionParser, classifier, null, null);
    }

    public DiagramAssembler(DiagramStructure structure, int maxDistance, HeaderParser headerParser,
                            SolutionParser solutionParser, BoardClassifier classifier,
                            Integer maxDiagrams, Integer pageEnd) {
        this.structure = structure;
        this.maxDistance = maxDistance;
        this.headerParser = headerParser;
        this.solutionParser = solutionParser;
        this.classifier = classifier;
        this.maxDiagrams = maxDiagrams;
        this.pageEnd = pageEnd;
    }

    public AssemblyResult assemble(List<Block> blocks) {
        return assemble(newContext(blocks));
    }

    /** Fresh state for one pass over the given blocks. */
    public AssemblyContext newContext(List<Block> blocks) {
        return new AssemblyContext(blocks, maxDistance, headerParser, solutionParser, classifier);
    }

    public AssemblyResult assemble(AssemblyContext context) {
        List<DiagramCandidate> found = new ArrayList<>();
        int dropped = 0;

        for (Block block : context.getBlocks()) {
            if (maxDiagrams != null && found.size() >= maxDiagrams) {
                log.info("Reached the limit of {} diagrams", maxDiagrams);
                break;
            }
            if (pageEnd != null && block.getPage() > pageEnd) {
                log.debug("{} is past page {}, stopping", block, pageEnd);
                break;
            }
            if (context.isRepeatedHeader(block)) {
                log.debug("Skipping {}: header already processed", block);
                continue;
            }
            if (context.isUsed(block) || !structure.isAnchor(block, context)) {
                continue;
            }

            DiagramCandidate candidate = structure.locateRoles(block, context);
            if (!candidate.hasImage()) {
                log.debug("No chessboard within {} blocks of {}", maxDistance, block);
                continue;
            }
            if (candidate.isNoise()) {
                log.debug("Dropping {}: neither header nor solution", candidate.getImage());
                dropped++;
                continue;
            }

            for (Block used : candidate.blocks()) {
                context.markUsed(used);
            }
            found.add(candidate);
            log.debug("Diagram {}: {}", found.size(), candidate);
        }

        int unmatchedHeaders = 0;
        int repeatedHeaders = 0;
        for (Block block : context.getBlocks()) {
            if (context.isRepeatedHeader(block)) {
                repeatedHeaders++;
            } else if (!context.isUsed(block) && context.isHeader(block)) {
                unmatchedHeaders++;
            }
        }
        return new AssemblyResult(found, dropped, context.rejectedImageCount(), unmatchedHeaders, repeatedHeaders);
    }
}
