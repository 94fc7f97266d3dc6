package ai.subtitle.translator.pipeline;

import ai.subtitle.translator.translate.TranslationOutcome;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Files written by a full pipeline run, in stage order, plus the translation outcome. When an existing translation
 * was reused the outcome is empty.
 */
public record PipelineResult(Path fixed,
                             Path merged,
                             Path translated,
                             Path script,
                             TranslationOutcome outcome,
                             boolean translationReused) {

    public PipelineResult {
        Objects.requireNonNull(fixed, "fixed");
        Objects.requireNonNull(merged, "merged");
        Objects.requireNonNull(translated, "translated");
        Objects.requireNonNull(script, "script");
        Objects.requireNonNull(outcome, "outcome");
    }
}
