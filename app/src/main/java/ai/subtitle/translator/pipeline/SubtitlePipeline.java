package ai.subtitle.translator.pipeline;

import ai.subtitle.translator.merge.LineMergeEngine;
import ai.subtitle.translator.rebuild.BilingualMerger;
import ai.subtitle.translator.rebuild.CaptionRebuilder;
import ai.subtitle.translator.render.AssRenderer;
import ai.subtitle.translator.subtitle.CaptionEntry;
import ai.subtitle.translator.subtitle.SrtCodec;
import ai.subtitle.translator.timing.OverlapRepairer;
import ai.subtitle.translator.translate.BatchTranslationOrchestrator;
import ai.subtitle.translator.translate.TranslationMode;
import ai.subtitle.translator.translate.TranslationOutcome;
import ai.subtitle.translator.writer.SubtitleWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * File-level driver for the caption stages. Each stage reads one SRT file and writes one output file;
 * {@link #run(Path, boolean)} chains fix, line merge, translation and rendering.
 */
public class SubtitlePipeline {

    private static final Logger LOGGER = LoggerFactory.getLogger(SubtitlePipeline.class);
    static final String MDC_FILE = "file";
    static final String MDC_STAGE = "stage";

    private final SubtitleReader reader;
    private final SubtitleWriter writer;
    private final SrtCodec codec;
    private final OverlapRepairer overlapRepairer;
    private final LineMergeEngine lineMergeEngine;
    private final BatchTranslationOrchestrator orchestrator;
    private final CaptionRebuilder rebuilder;
    private final BilingualMerger bilingualMerger;
    private final AssRenderer renderer;
    private final TranslationMode translationMode;

    public SubtitlePipeline(OverlapRepairer overlapRepairer,
                            LineMergeEngine lineMergeEngine,
                            BatchTranslationOrchestrator orchestrator,
                            AssRenderer renderer,
                            TranslationMode translationMode) {
        this(new SubtitleReader(), new SubtitleWriter(), new SrtCodec(), overlapRepairer, lineMergeEngine,
                orchestrator, new CaptionRebuilder(), new BilingualMerger(), renderer, translationMode);
    }

    SubtitlePipeline(SubtitleReader reader,
                     SubtitleWriter writer,
                     SrtCodec codec,
                     OverlapRepairer overlapRepairer,
                     LineMergeEngine lineMergeEngine,
                     BatchTranslationOrchestrator orchestrator,
                     CaptionRebuilder rebuilder,
                     BilingualMerger bilingualMerger,
                     AssRenderer renderer,
                     TranslationMode translationMode) {
        this.reader = Objects.requireNonNull(reader, "reader");
        this.writer = Objects.requireNonNull(writer, "writer");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.overlapRepairer = Objects.requireNonNull(overlapRepairer, "overlapRepairer");
        this.lineMergeEngine = Objects.requireNonNull(lineMergeEngine, "lineMergeEngine");
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        this.rebuilder = Objects.requireNonNull(rebuilder, "rebuilder");
        this.bilingualMerger = Objects.requireNonNull(bilingualMerger, "bilingualMerger");
        this.renderer = Objects.requireNonNull(renderer, "renderer");
        this.translationMode = Objects.requireNonNull(translationMode, "translationMode");
    }

    public Path fix(Path input, Path output) {
        return stage(input, "fix", () -> {
            List<CaptionEntry> repaired = overlapRepairer.repair(load(input));
            return writer.write(output, codec.serialize(repaired));
        });
    }

    public Path mergeLines(Path input, Path output) {
        return stage(input, "merge-lines", () -> {
            List<CaptionEntry> merged = lineMergeEngine.merge(load(input));
            return writer.write(output, codec.serialize(merged));
        });
    }

    public TranslationOutcome translate(Path input, Path output) {
        return stage(input, "translate", () -> {
            List<CaptionEntry> entries = load(input);
            TranslationOutcome outcome = orchestrator.translate(entries, translationMode);
            List<CaptionEntry> rebuilt = rebuilder.rebuild(entries, outcome.texts());
            writer.write(output, codec.serialize(rebuilt));
            return outcome;
        });
    }

    public Path mergeBilingual(Path first, Path second, Path output) {
        Objects.requireNonNull(second, "second");
        return stage(first, "bilingual", () -> {
            List<CaptionEntry> merged = bilingualMerger.merge(load(first), load(second));
            return writer.write(output, codec.serialize(merged));
        });
    }

    public Path render(Path input, Path output) {
        return stage(input, "render", () -> writer.write(output, renderer.render(load(input)), true));
    }

    /**
     * Runs every stage. An existing translated file is reused unless {@code overwrite} is set.
     */
    public PipelineResult run(Path input, boolean overwrite) {
        Objects.requireNonNull(input, "input");
        Path fixed = fix(input, OutputPaths.fixed(input));
        Path merged = mergeLines(fixed, OutputPaths.merged(input));
        Path translated = OutputPaths.translated(input);
        boolean reuse = !overwrite && Files.isRegularFile(translated);
        TranslationOutcome outcome;
        if (reuse) {
            LOGGER.info("Reusing existing translation {}", translated);
            outcome = TranslationOutcome.empty();
        } else {
            outcome = translate(merged, translated);
        }
        Path script = render(translated, OutputPaths.script(input));
        LOGGER.info("Pipeline finished for {}: {}", input, script);
        return new PipelineResult(fixed, merged, translated, script, outcome, reuse);
    }

    private List<CaptionEntry> load(Path input) {
        return codec.parseEntries(reader.read(input));
    }

    private <T> T stage(Path input, String stage, Supplier<T> body) {
        Objects.requireNonNull(input, "input");
        MDC.put(MDC_FILE, String.valueOf(input.getFileName()));
        MDC.put(MDC_STAGE, stage);
        try {
            LOGGER.info("Starting {} for {}", stage, input);
            T result = body.get();
            LOGGER.debug("Finished {} for {}", stage, input);
            return result;
        } finally {
            MDC.remove(MDC_FILE);
            MDC.remove(MDC_STAGE);
        }
    }
}
