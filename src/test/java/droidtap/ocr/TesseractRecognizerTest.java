package droidtap.ocr;

import droidtap.model.Bounds;
import droidtap.model.OcrMatch;
import droidtap.model.ScoredOcrMatch;
import org.testng.annotations.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Exercises the search logic of {@link TesseractRecognizer} over canned OCR
 * output; the native engine is never loaded.
 */
public class TesseractRecognizerTest {

    private static final byte[] IMAGE = {1, 2, 3};

    /** Returns fixed words instead of running Tesseract, counting passes. */
    private static class CannedRecognizer extends TesseractRecognizer {
        private final List<OcrMatch> words;
        final AtomicInteger passes = new AtomicInteger();

        CannedRecognizer(List<OcrMatch> words) {
            super(true, "unused", "eng", 0.6);
            this.words = words;
        }

        @Override
        protected List<OcrMatch> recognize(byte[] image) {
            passes.incrementAndGet();
            return words;
        }
    }

    private static OcrMatch word(String text, double confidence) {
        return new OcrMatch(text, confidence, Bounds.ofSize(10, 10, 100, 40));
    }

    @Test
    public void findText_caseInsensitiveSubstring_bestConfidenceFirst() {
        CannedRecognizer ocr = new CannedRecognizer(List.of(
                word("Settings", 0.70), word("SETTINGS", 0.95), word("Profile", 0.99)));

        List<OcrMatch> hits = ocr.findText(IMAGE, "settings");

        assertThat(hits).extracting(OcrMatch::confidence).containsExactly(0.95, 0.70);
    }

    @Test
    public void findText_ignoresLowConfidenceWords() {
        CannedRecognizer ocr = new CannedRecognizer(List.of(word("Settings", 0.59)));

        assertThat(ocr.findText(IMAGE, "settings")).isEmpty();
    }

    @Test
    public void findTextFuzzy_returnsOnlyAboveThreshold_mostSimilarFirst() {
        CannedRecognizer ocr = new CannedRecognizer(List.of(
                word("Subscrlbe", 0.9), word("Subscribe", 0.8), word("Shorts", 0.9)));

        List<ScoredOcrMatch> hits = ocr.findTextFuzzy(IMAGE, "subscribe", 0.7);

        assertThat(hits).extracting(h -> h.match().text()).containsExactly("Subscribe", "Subscrlbe");
        assertThat(hits.get(0).score()).isEqualTo(1.0);
    }

    @Test
    public void searchesOnTheSameCapture_reuseOnePass() {
        CannedRecognizer ocr = new CannedRecognizer(List.of(word("Library", 0.9)));

        ocr.findText(IMAGE, "nothing");
        ocr.findTextFuzzy(IMAGE, "librari", 0.7);
        assertThat(ocr.passes.get()).isEqualTo(1);

        ocr.findText(new byte[]{1, 2, 3}, "library");
        assertThat(ocr.passes.get()).isEqualTo(2);
    }

    @Test
    public void isAvailable_disabledByConfig_false() throws Exception {
        Path dir = Files.createTempDirectory("tessdata");
        assertThat(new TesseractRecognizer(false, dir.toString(), "eng", 0.6).isAvailable()).isFalse();
    }

    @Test
    public void isAvailable_missingTessdata_false() {
        assertThat(new TesseractRecognizer(true, "/no/such/tessdata", "eng", 0.6).isAvailable()).isFalse();
    }

    @Test
    public void isAvailable_enabledWithTessdataDir_true() throws Exception {
        Path dir = Files.createTempDirectory("tessdata");
        assertThat(new TesseractRecognizer(true, dir.toString(), "eng", 0.6).isAvailable()).isTrue();
    }
}
