package droidtap.tree;

import droidtap.model.UIElement;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Plain-text summary of a captured screen for diagnostics.
 */
public final class ScreenSummary {

    private static final int MAX_TEXTS = 10;

    private ScreenSummary() {}

    public static String describe(List<UIElement> elements) {
        if (elements.isEmpty()) {
            return "Unable to analyze screen (UI tree empty)";
        }

        Map<String, Integer> packages = new LinkedHashMap<>();
        int buttons = 0;
        int textViews = 0;
        int images = 0;
        for (UIElement e : elements) {
            if (!e.getPackageName().isEmpty()) {
                packages.merge(e.getPackageName(), 1, Integer::sum);
            }
            if (e.getClassName().contains("Button"))   buttons++;
            if (e.getClassName().contains("TextView")) textViews++;
            if (e.getClassName().contains("Image"))    images++;
        }
        String app = packages.entrySet().stream()
                .max(Map.Entry.comparingByValue())
                .map(Map.Entry::getKey)
                .orElse("unknown");

        List<String> texts = elements.stream()
                .filter(e -> e.getText().length() > 1 && e.getBounds().width() > 50)
                .map(UIElement::getText)
                .toList();

        StringBuilder sb = new StringBuilder("Screen Analysis:\n");
        sb.append("- App: ").append(app).append('\n');
        sb.append(String.format("- Elements: %d buttons, %d text views, %d images%n", buttons, textViews, images));
        if (!texts.isEmpty()) {
            sb.append("- Visible text (").append(texts.size()).append(" items):\n");
            for (int i = 0; i < Math.min(MAX_TEXTS, texts.size()); i++) {
                sb.append("  ").append(i + 1).append(". ").append(texts.get(i)).append('\n');
            }
            if (texts.size() > MAX_TEXTS) {
                sb.append("  ... and ").append(texts.size() - MAX_TEXTS).append(" more\n");
            }
        }
        return sb.toString();
    }
}
