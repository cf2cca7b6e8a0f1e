package droidtap.tree;

import droidtap.device.DeviceCommands;
import droidtap.model.Bounds;
import droidtap.model.UIElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link AccessibilityTree} backed by {@code uiautomator dump}.
 *
 * <p>Each call dumps the hierarchy to a file on the device, reads it back with
 * {@code cat} and flattens every {@code <node>} into a {@link UIElement} in
 * pre-order, so parents precede their children.
 */
public class UiAutomatorTree implements AccessibilityTree {

    private static final Logger log = LoggerFactory.getLogger(UiAutomatorTree.class);

    static final String DUMP_PATH = "/sdcard/ui_dump.xml";

    private final DeviceCommands device;
    private final ListItemDetector listDetector;

    public UiAutomatorTree(DeviceCommands device) {
        this(device, new ListItemDetector());
    }

    public UiAutomatorTree(DeviceCommands device, ListItemDetector listDetector) {
        this.device       = device;
        this.listDetector = listDetector;
    }

    @Override
    public List<UIElement> captureTree() {
        device.shell("uiautomator", "dump", DUMP_PATH);
        String xml = device.shell("cat", DUMP_PATH);
        List<UIElement> elements = parse(xml);
        log.debug("Captured {} accessibility nodes", elements.size());
        return elements;
    }

    @Override
    public List<UIElement> detectListItems(String itemType) {
        List<UIElement> items = listDetector.detect(captureTree());
        if (items.isEmpty()) {
            log.debug("No repeating items detected for '{}'", itemType);
        } else {
            log.debug("Detected {} '{}' candidates, first: {}", items.size(), itemType, items.get(0).label());
        }
        return items;
    }

    /**
     * Parses a uiautomator XML dump.
     *
     * @throws TreeCaptureException if the dump is blank, not XML, or contains no nodes
     */
    static List<UIElement> parse(String xml) {
        if (xml == null || xml.isBlank()) {
            throw new TreeCaptureException("Accessibility dump is empty");
        }
        // uiautomator sometimes prefixes status text before the document
        int start = xml.indexOf('<');
        if (start < 0) {
            throw new TreeCaptureException("Accessibility dump is not XML: " + abbreviate(xml));
        }

        Document doc;
        try {
            doc = newBuilder().parse(new InputSource(new StringReader(xml.substring(start))));
        } catch (SAXException | IOException e) {
            throw new TreeCaptureException("Unparseable accessibility dump: " + e.getMessage(), e);
        }

        List<UIElement> elements = new ArrayList<>();
        collect(doc.getDocumentElement(), elements);
        if (elements.isEmpty()) {
            throw new TreeCaptureException("Accessibility dump contains no nodes");
        }
        return elements;
    }

    private static void collect(Element node, List<UIElement> out) {
        if ("node".equals(node.getTagName())) {
            out.add(toElement(node));
        }
        NodeList children = node.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node child = children.item(i);
            if (child.getNodeType() == Node.ELEMENT_NODE) {
                collect((Element) child, out);
            }
        }
    }

    private static UIElement toElement(Element node) {
        return new UIElement(
                node.getAttribute("text"),
                node.getAttribute("content-desc"),
                node.getAttribute("resource-id"),
                node.getAttribute("class"),
                node.getAttribute("package"),
                Bounds.parse(node.getAttribute("bounds")),
                "true".equals(node.getAttribute("clickable")),
                "true".equals(node.getAttribute("scrollable")));
    }

    private static DocumentBuilder newBuilder() {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setExpandEntityReferences(false);
            return factory.newDocumentBuilder();
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser unavailable", e);
        }
    }

    private static String abbreviate(String s) {
        String t = s.trim();
        return t.length() > 80 ? t.substring(0, 80) + "..." : t;
    }
}
