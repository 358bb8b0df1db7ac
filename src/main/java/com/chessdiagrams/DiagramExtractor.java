package com.chessdiagrams;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the whole pipeline for books that print header, board and solution as
 * separate regions: block stream, assembly, parsing, image saving and position
 * recognition.
 */
public class DiagramExtractor {

    private static final Logger log = LoggerFactory.getLogger(DiagramExtractor.class);

    private final ExtractorConfig config;
    private final BoardClassifier classifier;
    private final RecognitionClient recognition;
    private final ImageStore imageStore;

    public DiagramExtractor(ExtractorConfig config) {
        this(config, new ChessboardValidator(config.chessboard), recognitionClient(config), ImageStore.from(config));
    }

    /**
     * @param recognition null to skip position recognition
     */
    public DiagramExtractor(ExtractorConfig config, BoardClassifier classifier, RecognitionClient recognition,
                            ImageStore imageStore) {
        config.validate();
        this.config = config;
        this.classifier = classifier;
        this.recognition = recognition;
        this.imageStore = imageStore;
    }

    static RecognitionClient recognitionClient(ExtractorConfig config) {
        if (!config.useRecognitionApi) {
            return null;
        }
        Duration timeout = Duration.ofMillis(Math.round(config.apiTimeoutSeconds * 1000));
        return new RecognitionClient(new ChessvisionRecognitionService(config.recognitionUrl, timeout),
                config.minDelaySeconds, config.maxDelaySeconds);
    }

    public ExtractionResult<Diagram> extract(DocumentSource source) throws IOException {
        // 1. Block stream
        BlockStreamBuilder streamBuilder = new BlockStreamBuilder(config.pageStart, config.pageEnd);
        List<Block> blocks = streamBuilder.build(source);

        // 2. Assembly
        HeaderParser headerParser = new HeaderParser(config.headerBlockPattern());
        SolutionParser solutionParser = new SolutionParser(config.solutionBlockPattern(), config.fullMoveMaxLength);
        DiagramAssembler assembler = new DiagramAssembler(config.structure(), config.maxSearchDistance,
                headerParser, solutionParser, classifier, config.maxDiagrams, config.pageEnd);
        AssemblyContext context = assembler.newContext(blocks);
        if (config.inspectBlocks) {
            inspect(context);
        }
        log.info("Assembling diagrams with layout {}, search distance {}", config.structure(), config.maxSearchDistance);
        AssemblyResult assembly = assembler.assemble(context);

        // 3. Records
        ExtractionSummary summary = new ExtractionSummary();
        int callsBefore = recognition == null ? 0 : recognition.getCalls();
        int failuresBefore = recognition == null ? 0 : recognition.getFailures();

        List<Diagram> diagrams = new ArrayList<>();
        for (DiagramCandidate candidate : assembly.getCandidates()) {
            Diagram diagram = toDiagram(candidate, context, headerParser, solutionParser);
            diagrams.add(diagram);
            diagram.setImagePath(imageStore.saveChessboard(candidate.getImage().getImage(),
                    diagrams.size(), candidate.getImage().getPage()));
            if (recognition != null) {
                diagram.applyRecognition(recognition.recognize(candidate.getImage().getImage()));
            }
            if (candidate.spansPages()) {
                summary.crossPageDiagrams++;
            }
            summary.countTurn(diagram.getTurnFromText());
            log.info("Extracted {}", diagram);
        }

        if (config.saveNonChessboardImages) {
            saveRejectedImages(context);
        }

        summary.records = diagrams.size();
        summary.unmatchedHeaders = assembly.getUnmatchedHeaders();
        summary.repeatedHeaders = assembly.getRepeatedHeaders();
        summary.skippedPages = streamBuilder.getSkippedPages();
        summary.rejectedImages = assembly.getRejectedImages();
        summary.droppedCandidates = assembly.getDroppedCandidates();
        if (recognition != null) {
            summary.recognitionCalls = recognition.getCalls() - callsBefore;
            summary.recognitionFailures = recognition.getFailures() - failuresBefore;
        }
        return new ExtractionResult<>(diagrams, summary);
    }

    private Diagram toDiagram(DiagramCandidate candidate, AssemblyContext context,
                              HeaderParser headerParser, SolutionParser solutionParser) {
        Block header = candidate.getHeader();
        Block image = candidate.getImage();
        Block solution = candidate.getSolution();

        HeaderInfo headerInfo = header == null ? null : headerParser.parse(header.getText());
        SolutionDetails details = solution == null ? null : solutionParser.parse(solution.getText());
        return new Diagram(candidate.firstPage(), headerInfo, details,
                image.getPage(),
                header == null ? null : header.getPage(),
                solution == null ? null : solution.getPage(),
                context.verdict(image).getConfidence());
    }

    private void saveRejectedImages(AssemblyContext context) {
        for (Block block : context.getBlocks()) {
            if (block.isImage() && !context.isChessboard(block)) {
                imageStore.saveNonChessboard(block.getImage(), block.getPage(), block.getGlobalIndex());
            }
        }
    }

    private void inspect(AssemblyContext context) {
        log.info("=== Block inspection ({} blocks) ===", context.getBlocks().size());
        for (Block block : context.getBlocks()) {
            Role role = context.roleOf(block);
            String label = role == null ? "-" : role.name();
            if (block.isText()) {
                log.info("{} {}: {}", block, label, abbreviate(TextNormalizer.singleLine(block.getText())));
            } else {
                log.info("{} {}: {}", block, label, context.verdict(block));
            }
        }
    }

    private static String abbreviate(String text) {
        return text.length() <= 100 ? text : text.substring(0, 100) + "...";
    }
}
