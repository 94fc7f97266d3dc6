package ai.subtitle.translator.translate;

import ai.subtitle.translator.subtitle.CaptionEntry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates a caption stream batch by batch and guarantees one resolved text per caption.
 *
 * <p>Batches run strictly one after another. Within a batch the translator is called back to back until a
 * complete, well-formed response arrives or the attempt budget is spent. The best partial map only ever grows;
 * captions still missing afterwards keep their original text.</p>
 */
public class BatchTranslationOrchestrator {

    private static final Logger LOGGER = LoggerFactory.getLogger(BatchTranslationOrchestrator.class);

    private final TranslatorFactory translatorFactory;
    private final PromptTemplate promptTemplate;
    private final BilingualResultParser parser;
    private final TranslationSettings settings;

    public BatchTranslationOrchestrator(TranslatorFactory translatorFactory, PromptTemplate promptTemplate) {
        this(translatorFactory, promptTemplate, new BilingualResultParser(), TranslationSettings.defaults());
    }

    public BatchTranslationOrchestrator(TranslatorFactory translatorFactory,
                                        PromptTemplate promptTemplate,
                                        BilingualResultParser parser,
                                        TranslationSettings settings) {
        this.translatorFactory = Objects.requireNonNull(translatorFactory, "translatorFactory");
        this.promptTemplate = Objects.requireNonNull(promptTemplate, "promptTemplate");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public TranslationOutcome translate(List<CaptionEntry> entries, TranslationMode mode) {
        Objects.requireNonNull(entries, "entries");
        Objects.requireNonNull(mode, "mode");
        if (entries.isEmpty()) {
            return TranslationOutcome.empty();
        }
        Translator translator = translatorFactory.select(mode);
        List<TranslationBatch> batches = TranslationBatch.split(entries, settings.batchSize());
        LOGGER.info("Translating {} captions in {} batch(es) of up to {} ({} mode)",
                entries.size(), batches.size(), settings.batchSize(), mode);

        List<BatchResult> batchResults = new ArrayList<>(batches.size());
        List<String> texts = new ArrayList<>(entries.size());
        List<Resolution> resolutions = new ArrayList<>(entries.size());
        for (TranslationBatch batch : batches) {
            if (Thread.currentThread().isInterrupted()) {
                LOGGER.warn("Translation interrupted before batch {}-{}", batch.firstSequence(), batch.lastSequence());
                throw new TranslationCancelledException(batchResults.size());
            }
            BatchResult result = translateBatch(translator, batch);
            batchResults.add(result);
            texts.addAll(result.texts());
            resolutions.addAll(result.resolutions());
        }

        if (texts.size() != entries.size()) {
            LOGGER.warn("Resolved {} texts for {} captions; filling the difference with original text",
                    texts.size(), entries.size());
            reconcile(entries, texts, resolutions);
        }
        TranslationOutcome outcome = new TranslationOutcome(texts, resolutions, batchResults);
        LOGGER.info("Translation finished: {} translated, {} kept original, {} attempt(s)",
                outcome.translatedCount(), outcome.filledCount(), outcome.totalAttempts());
        return outcome;
    }

    public BatchResult translateBatch(Translator translator, TranslationBatch batch) {
        Objects.requireNonNull(translator, "translator");
        Objects.requireNonNull(batch, "batch");
        String payload = batch.payload();
        Map<Integer, String> best = Map.of();
        boolean accepted = false;
        int attempts = 0;
        while (attempts < settings.maxAttempts()) {
            attempts++;
            String response;
            try {
                response = translator.translate(promptTemplate.text(), payload);
            } catch (RuntimeException ex) {
                LOGGER.warn("Batch {}-{} attempt {}/{} failed: {}", batch.firstSequence(), batch.lastSequence(),
                        attempts, settings.maxAttempts(), ex.getMessage());
                continue;
            }
            ParsedTranslation parsed = parser.parse(response);
            Map<Integer, String> units = withinBatch(parsed, batch);
            if (units.size() > best.size()) {
                best = units;
            }
            if (units.size() == batch.size() && parsed.formatValid()) {
                best = units;
                accepted = true;
                break;
            }
            LOGGER.warn("Batch {}-{} attempt {}/{} returned {}/{} units (format valid: {})",
                    batch.firstSequence(), batch.lastSequence(), attempts, settings.maxAttempts(),
                    units.size(), batch.size(), parsed.formatValid());
        }
        if (accepted) {
            LOGGER.debug("Batch {}-{} translated after {} attempt(s)", batch.firstSequence(), batch.lastSequence(), attempts);
        }
        return ensureCompleteness(best, batch, attempts, accepted);
    }

    public BatchResult ensureCompleteness(Map<Integer, String> units, TranslationBatch batch) {
        return ensureCompleteness(units, batch, 0, false);
    }

    /**
     * Lays the translated units out in batch order, keeping original text wherever a unit is missing.
     */
    public BatchResult ensureCompleteness(Map<Integer, String> units, TranslationBatch batch, int attempts, boolean formatValid) {
        Objects.requireNonNull(units, "units");
        List<String> texts = new ArrayList<>(batch.size());
        List<Resolution> resolutions = new ArrayList<>(batch.size());
        List<Integer> missing = new ArrayList<>();
        for (int i = 0; i < batch.size(); i++) {
            int sequence = batch.globalSequence(i);
            String translated = units.get(sequence);
            if (translated == null) {
                texts.add(batch.originalText(sequence));
                resolutions.add(Resolution.FILLED);
                missing.add(sequence);
            } else {
                texts.add(translated);
                resolutions.add(Resolution.TRANSLATED);
            }
        }
        if (!missing.isEmpty()) {
            LOGGER.warn("Batch {}-{}: no translation for {} after {} attempt(s); keeping original text",
                    batch.firstSequence(), batch.lastSequence(), missing, attempts);
        }
        return new BatchResult(batch, texts, resolutions, attempts, formatValid);
    }

    public TranslationSettings settings() {
        return settings;
    }

    private Map<Integer, String> withinBatch(ParsedTranslation parsed, TranslationBatch batch) {
        Map<Integer, String> units = new LinkedHashMap<>();
        for (Map.Entry<Integer, String> entry : parsed.units().entrySet()) {
            if (batch.covers(entry.getKey())) {
                units.put(entry.getKey(), entry.getValue());
            } else {
                LOGGER.debug("Discarding unit {} outside batch {}-{}", entry.getKey(), batch.firstSequence(), batch.lastSequence());
            }
        }
        return units;
    }

    private void reconcile(List<CaptionEntry> entries, List<String> texts, List<Resolution> resolutions) {
        while (texts.size() > entries.size()) {
            texts.remove(texts.size() - 1);
            resolutions.remove(resolutions.size() - 1);
        }
        for (int i = texts.size(); i < entries.size(); i++) {
            texts.add(entries.get(i).singleLineText());
            resolutions.add(Resolution.FILLED);
        }
    }
}
