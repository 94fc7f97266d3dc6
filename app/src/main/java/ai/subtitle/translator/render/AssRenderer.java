package ai.subtitle.translator.render;

import ai.subtitle.translator.subtitle.CaptionEntry;
import ai.subtitle.translator.subtitle.ScriptDetector;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders a bilingual caption stream as an ASS script.
 *
 * <p>Every caption yields up to two dialogue events over the same interval: the Chinese lines in the
 * {@value #TARGET_STYLE} style, raised above the source lines rendered in {@value #SOURCE_STYLE}.</p>
 */
public class AssRenderer {

    private static final Logger LOGGER = LoggerFactory.getLogger(AssRenderer.class);

    public static final String SOURCE_STYLE = "Default";
    public static final String TARGET_STYLE = "Chinese";
    static final String SOURCE_FONT = "Arial";
    static final String TARGET_FONT = "VYuan_Round";
    static final String WHITE = "&H00FFFFFF";
    static final String BLACK = "&H00000000";
    static final String BLUE = "&H00FF0000";
    private static final int BASE_MARGIN_V = 10;
    private static final int STACK_GAP = 8;
    private static final String EVENT_FORMAT = "Format: Layer, Start, End, Style, Name, MarginL, MarginR, MarginV, Effect, Text";

    private final RenderSettings settings;
    private final AssStyle sourceStyle;
    private final AssStyle targetStyle;

    public AssRenderer() {
        this(RenderSettings.defaults());
    }

    public AssRenderer(RenderSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.sourceStyle = new AssStyle(SOURCE_STYLE, SOURCE_FONT, settings.sourceFontSize(), WHITE, BLACK, 2, BASE_MARGIN_V);
        this.targetStyle = new AssStyle(TARGET_STYLE, TARGET_FONT, settings.targetFontSize(), WHITE, BLUE, 3,
                BASE_MARGIN_V + settings.sourceFontSize() + STACK_GAP);
    }

    public String render(List<CaptionEntry> entries) {
        Objects.requireNonNull(entries, "entries");
        List<String> lines = new ArrayList<>(header());
        int events = 0;
        for (CaptionEntry entry : entries) {
            List<String> target = new ArrayList<>();
            List<String> source = new ArrayList<>();
            for (String line : entry.lines()) {
                if (line.isBlank()) {
                    continue;
                }
                if (ScriptDetector.containsCjk(line)) {
                    target.add(escape(line));
                } else {
                    source.add(escape(line));
                }
            }
            String start = entry.start().toAss();
            String end = entry.end().toAss();
            if (!target.isEmpty()) {
                lines.add(dialogue(start, end, targetStyle, target));
                events++;
            }
            if (!source.isEmpty()) {
                lines.add(dialogue(start, end, sourceStyle, source));
                events++;
            }
        }
        LOGGER.info("Rendered {} dialogue event(s) from {} captions", events, entries.size());
        return String.join("\n", lines) + "\n";
    }

    public RenderSettings settings() {
        return settings;
    }

    private List<String> header() {
        return List.of(
                "[Script Info]",
                "Title: Bilingual Subtitles",
                "ScriptType: v4.00+",
                "WrapStyle: 0",
                "PlayResX: 1280",
                "PlayResY: 720",
                "ScaledBorderAndShadow: yes",
                "",
                "[V4+ Styles]",
                AssStyle.FORMAT,
                sourceStyle.toStyleLine(),
                targetStyle.toStyleLine(),
                "",
                "[Events]",
                EVENT_FORMAT);
    }

    private String dialogue(String start, String end, AssStyle style, List<String> textLines) {
        return "Dialogue: 0," + start + "," + end + "," + style.name() + ",,0,0,0,," + String.join("\\N", textLines);
    }

    static String escape(String line) {
        return line.replace("{", "\\{").replace("}", "\\}");
    }
}
