package github.sarthakdev143.clip_factory.captions;

import github.sarthakdev143.clip_factory.model.CaptionSettings;
import github.sarthakdev143.clip_factory.model.Transcript;
import github.sarthakdev143.clip_factory.model.TranscriptSegment;
import github.sarthakdev143.clip_factory.model.TranscriptWord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds an Advanced SubStation Alpha document for one clip. FFmpeg burns it in with the {@code ass} filter,
 * so all preset styling (outline, box, karaoke fill, glow, gradient) is expressed as ASS styles and tags.
 */
@Component
public class AssCaptionRenderer {

    private static final Logger logger = LoggerFactory.getLogger(AssCaptionRenderer.class);
    private static final int MAX_WORDS_PER_LINE = 4;
    private static final double MAX_LINE_GAP_SECONDS = 0.8;
    private static final double BASE_FONT_SIZE = 52.0;
    private static final double REFERENCE_WIDTH = 1080.0;
    private static final double BOTTOM_MARGIN_RATIO = 0.15;

    public CaptionTrack render(
            CaptionSettings settings,
            Transcript transcript,
            double clipStartSec,
            double clipEndSec,
            int width,
            int height) {
        CaptionStyle style = settings.style();
        if (!settings.rendersCaptions()) {
            throw new IllegalArgumentException("Captions are disabled for this job.");
        }

        List<CaptionLine> lines;
        boolean degraded = false;
        List<TranscriptWord> words = transcript == null
                ? List.of()
                : transcript.wordsBetween(clipStartSec, clipEndSec);
        boolean wordTimings = transcript != null && transcript.hasWordTimings() && !words.isEmpty();

        if (wordTimings) {
            lines = groupWords(words, clipStartSec, clipEndSec);
        } else {
            degraded = style.requiresWordTimings();
            if (degraded) {
                logger.warn("No word-level timestamps for clip {}-{}s; {} captions fall back to segment timing",
                        clipStartSec, clipEndSec, style.toApiValue());
            }
            lines = segmentLines(transcript, clipStartSec, clipEndSec);
        }

        StringBuilder document = new StringBuilder();
        appendHeader(document, settings, width, height);
        for (CaptionLine line : lines) {
            document.append("Dialogue: 0,")
                    .append(formatTimestamp(line.start()))
                    .append(',')
                    .append(formatTimestamp(line.end()))
                    .append(",Default,,0,0,0,,")
                    .append(buildEventText(style, settings, line))
                    .append('\n');
        }
        return new CaptionTrack(document.toString(), lines.size(), degraded);
    }

    private void appendHeader(StringBuilder document, CaptionSettings settings, int width, int height) {
        CaptionStyle style = settings.style();
        HexColor textColor = settings.color() != null ? HexColor.parse(settings.color(), "caption_color") : style.primaryColor();
        HexColor outlineColor = settings.outlineColor() != null
                ? HexColor.parse(settings.outlineColor(), "caption_outline_color")
                : style.outlineColor();

        // Karaoke fills from SecondaryColour to PrimaryColour as each word is spoken.
        HexColor primary = style == CaptionStyle.KARAOKE ? style.highlightColor() : textColor;
        HexColor secondary = textColor;

        boolean boxed = style.backgroundColor() != null;
        String back = boxed
                ? style.backgroundColor().toAss(style.backgroundAlpha())
                : new HexColor(0, 0, 0).toAss(255);
        String outline = boxed
                ? style.backgroundColor().toAss(style.backgroundAlpha())
                : (outlineColor == null ? new HexColor(0, 0, 0).toAss(255) : outlineColor.toAss());
        int fontSize = (int) Math.round(BASE_FONT_SIZE * style.fontScale() * (width / REFERENCE_WIDTH));
        int marginV = (int) Math.round(height * BOTTOM_MARGIN_RATIO);
        int marginLr = (int) Math.round(width * 0.05);
        int borderStyle = boxed ? 3 : 1;
        int outlineWidth = boxed ? 12 : style.outlineThickness();
        int bold = style == CaptionStyle.BOLD ? -1 : 0;

        document.append("[Script Info]\n")
                .append("ScriptType: v4.00+\n")
                .append("PlayResX: ").append(width).append('\n')
                .append("PlayResY: ").append(height).append('\n')
                .append("WrapStyle: 0\n")
                .append("ScaledBorderAndShadow: yes\n\n")
                .append("[V4+ Styles]\n")
                .append("Format: Name, Fontname, Fontsize, PrimaryColour, SecondaryColour, OutlineColour, BackColour, ")
                .append("Bold, Italic, Underline, StrikeOut, ScaleX, ScaleY, Spacing, Angle, BorderStyle, Outline, ")
                .append("Shadow, Alignment, MarginL, MarginR, MarginV, Encoding\n")
                .append("Style: Default,Arial,")
                .append(fontSize).append(',')
                .append(primary.toAss()).append(',')
                .append(secondary.toAss()).append(',')
                .append(outline).append(',')
                .append(back).append(',')
                .append(bold).append(",0,0,0,100,100,0,0,")
                .append(borderStyle).append(',')
                .append(outlineWidth).append(",0,2,")
                .append(marginLr).append(',')
                .append(marginLr).append(',')
                .append(marginV).append(",1\n\n")
                .append("[Events]\n")
                .append("Format: Layer, Start, End, Style, Name, MarginL, MarginR, MarginV, Effect, Text\n");
    }

    String buildEventText(CaptionStyle style, CaptionSettings settings, CaptionLine line) {
        StringBuilder text = new StringBuilder();
        if (style.glow()) {
            text.append("{\\blur4}");
        }
        if (style.gradientEndColor() != null) {
            long durationMs = Math.round((line.end() - line.start()) * 1000);
            HexColor start = settings.color() != null ? HexColor.parse(settings.color(), "caption_color") : style.primaryColor();
            text.append("{\\1c&H").append(start.toAss().substring(4)).append("&")
                    .append("\\t(0,").append(durationMs).append(",\\1c&H")
                    .append(style.gradientEndColor().toAss().substring(4)).append("&)}");
        }

        if (style == CaptionStyle.KARAOKE && !line.words().isEmpty()) {
            double cursor = line.start();
            for (int index = 0; index < line.words().size(); index++) {
                TimedWord word = line.words().get(index);
                // Silence before the word stays in the unsung colour.
                long leadCs = Math.round(Math.max(word.start() - cursor, 0) * 100);
                long wordCs = Math.max(Math.round((word.end() - Math.max(word.start(), cursor)) * 100), 1);
                if (index > 0) {
                    text.append(' ');
                }
                if (leadCs > 0) {
                    text.append("{\\k").append(leadCs).append('}');
                }
                text.append("{\\k").append(wordCs).append('}').append(applyCase(style, escape(word.text())));
                cursor = Math.max(word.end(), cursor);
            }
            return text.toString();
        }

        text.append(applyCase(style, escape(line.text())));
        return text.toString();
    }

    private List<CaptionLine> groupWords(List<TranscriptWord> words, double clipStartSec, double clipEndSec) {
        double clipDuration = clipEndSec - clipStartSec;
        List<CaptionLine> lines = new ArrayList<>();
        List<TimedWord> current = new ArrayList<>();

        for (TranscriptWord word : words) {
            String token = word.word() == null ? "" : word.word().trim();
            if (token.isEmpty()) {
                continue;
            }
            double start = clamp(word.start() - clipStartSec, 0, clipDuration);
            double end = clamp(word.end() - clipStartSec, start, clipDuration);
            TimedWord timed = new TimedWord(token, start, end);

            if (!current.isEmpty()) {
                TimedWord previous = current.get(current.size() - 1);
                boolean full = current.size() >= MAX_WORDS_PER_LINE;
                boolean pause = timed.start() - previous.end() > MAX_LINE_GAP_SECONDS;
                if (full || pause) {
                    lines.add(CaptionLine.ofWords(current));
                    current = new ArrayList<>();
                }
            }
            current.add(timed);
        }
        if (!current.isEmpty()) {
            lines.add(CaptionLine.ofWords(current));
        }
        return lines;
    }

    private List<CaptionLine> segmentLines(Transcript transcript, double clipStartSec, double clipEndSec) {
        if (transcript == null) {
            return List.of();
        }
        double clipDuration = clipEndSec - clipStartSec;
        List<CaptionLine> lines = new ArrayList<>();
        for (TranscriptSegment segment : transcript.segmentsBetween(clipStartSec, clipEndSec)) {
            double start = clamp(segment.start() - clipStartSec, 0, clipDuration);
            double end = clamp(segment.end() - clipStartSec, start, clipDuration);
            if (end > start) {
                lines.add(new CaptionLine(segment.text(), start, end, List.of()));
            }
        }
        return lines;
    }

    private String applyCase(CaptionStyle style, String text) {
        return switch (style.textCase()) {
            case UPPER -> text.toUpperCase(Locale.ROOT);
            case LOWER -> text.toLowerCase(Locale.ROOT);
            case AS_IS -> text;
        };
    }

    private String escape(String text) {
        return text
                .replace("\\", "/")
                .replace("{", "(")
                .replace("}", ")")
                .replace("\r", "")
                .replace("\n", " ");
    }

    static String formatTimestamp(double seconds) {
        long centiseconds = Math.round(Math.max(seconds, 0) * 100);
        long hours = centiseconds / 360000;
        long minutes = (centiseconds / 6000) % 60;
        long secs = (centiseconds / 100) % 60;
        long cs = centiseconds % 100;
        return String.format(Locale.ROOT, "%d:%02d:%02d.%02d", hours, minutes, secs, cs);
    }

    private double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(value, max));
    }

    record TimedWord(String text, double start, double end) {
    }

    record CaptionLine(String text, double start, double end, List<TimedWord> words) {

        static CaptionLine ofWords(List<TimedWord> words) {
            StringBuilder text = new StringBuilder();
            for (TimedWord word : words) {
                if (text.length() > 0) {
                    text.append(' ');
                }
                text.append(word.text());
            }
            return new CaptionLine(
                    text.toString(),
                    words.get(0).start(),
                    words.get(words.size() - 1).end(),
                    List.copyOf(words));
        }
    }
}
