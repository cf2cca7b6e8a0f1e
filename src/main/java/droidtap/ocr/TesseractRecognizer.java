package droidtap.ocr;

import droidtap.model.Bounds;
import droidtap.model.OcrMatch;
import droidtap.model.ScoredOcrMatch;
import net.sourceforge.tess4j.ITessAPI;
import net.sourceforge.tess4j.ITesseract;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.Word;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.Rectangle;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * {@link TextRecognizer} backed by Tesseract through tess4j.
 *
 * <p>Recognition runs in sparse-text mode at word level. The word list of the
 * most recent image is kept, so exact and fuzzy searches over the same cached
 * screenshot cost a single OCR pass.
 */
public class TesseractRecognizer implements TextRecognizer {

    private static final Logger log = LoggerFactory.getLogger(TesseractRecognizer.class);

    /** Tesseract page segmentation mode 11: sparse text, no particular order. */
    private static final int PSM_SPARSE_TEXT = 11;

    /** Words below this engine confidence (0-100 scale) are noise. */
    private static final float MIN_WORD_CONFIDENCE = 30f;

    private final boolean enabled;
    private final String datapath;
    private final String language;
    private final double minConfidence;

    private volatile boolean nativeBroken;
    private volatile LastPass lastPass;

    private record LastPass(byte[] image, List<OcrMatch> matches) {}

    /**
     * @param enabled       master switch from configuration
     * @param datapath      directory holding the {@code *.traineddata} files
     * @param language      Tesseract language code, e.g. {@code eng}
     * @param minConfidence matches below this confidence (0-1) are ignored by searches
     */
    public TesseractRecognizer(boolean enabled, String datapath, String language, double minConfidence) {
        this.enabled       = enabled;
        this.datapath      = datapath;
        this.language      = language;
        this.minConfidence = minConfidence;
    }

    @Override
    public boolean isAvailable() {
        if (!enabled || nativeBroken) return false;
        if (datapath == null || datapath.isBlank() || !Files.isDirectory(Path.of(datapath))) {
            log.debug("tessdata directory '{}' not found, OCR unavailable", datapath);
            return false;
        }
        return true;
    }

    @Override
    public List<OcrMatch> findText(byte[] image, String query) {
        String q = query.toLowerCase(Locale.ROOT);
        List<OcrMatch> results = new ArrayList<>();
        for (OcrMatch m : extractText(image)) {
            if (m.confidence() < minConfidence) continue;
            if (m.text().toLowerCase(Locale.ROOT).contains(q)) {
                results.add(m);
            }
        }
        results.sort(Comparator.comparingDouble(OcrMatch::confidence).reversed());
        return results;
    }

    @Override
    public List<ScoredOcrMatch> findTextFuzzy(byte[] image, String query, double threshold) {
        String q = query.toLowerCase(Locale.ROOT);
        List<ScoredOcrMatch> results = new ArrayList<>();
        for (OcrMatch m : extractText(image)) {
            if (m.confidence() < minConfidence) continue;
            double similarity = TextSimilarity.ratio(q, m.text().toLowerCase(Locale.ROOT));
            if (similarity >= threshold) {
                results.add(new ScoredOcrMatch(similarity, m));
            }
        }
        results.sort(Comparator.comparingDouble(ScoredOcrMatch::score).reversed());
        return results;
    }

    /**
     * Runs (or reuses) the OCR pass for an image.
     */
    List<OcrMatch> extractText(byte[] image) {
        LastPass last = lastPass;
        if (last != null && last.image() == image) {
            return last.matches();
        }
        List<OcrMatch> matches = recognize(image);
        lastPass = new LastPass(image, matches);
        return matches;
    }

    /**
     * One Tesseract pass. Engine faults are logged and produce an empty list.
     */
    protected List<OcrMatch> recognize(byte[] image) {
        try {
            BufferedImage img = ImageIO.read(new ByteArrayInputStream(image));
            if (img == null) {
                log.warn("OCR skipped: screenshot is not a readable image ({} bytes)", image.length);
                return List.of();
            }

            ITesseract tesseract = new Tesseract();
            tesseract.setDatapath(datapath);
            tesseract.setLanguage(language);
            tesseract.setPageSegMode(PSM_SPARSE_TEXT);

            List<OcrMatch> matches = new ArrayList<>();
            for (Word word : tesseract.getWords(img, ITessAPI.TessPageIteratorLevel.RIL_WORD)) {
                String text = word.getText() != null ? word.getText().trim() : "";
                if (text.isEmpty() || word.getConfidence() < MIN_WORD_CONFIDENCE) continue;
                Rectangle r = word.getBoundingBox();
                matches.add(new OcrMatch(text, word.getConfidence() / 100.0,
                        Bounds.ofSize(r.x, r.y, r.width, r.height)));
            }
            log.debug("OCR pass found {} words", matches.size());
            return matches;
        } catch (IOException e) {
            log.warn("OCR extraction failed: {}", e.getMessage());
            return List.of();
        } catch (LinkageError e) {
            // native libtesseract missing or incompatible: stop offering OCR
            nativeBroken = true;
            log.warn("Tesseract native library unavailable, disabling OCR: {}", e.getMessage());
            return List.of();
        }
    }
}
