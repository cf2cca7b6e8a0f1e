package droidtap.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One accessibility node captured from the device.
 *
 * <p>Instances are snapshots of a single capture: a later capture produces new
 * objects rather than mutating these. String attributes are never {@code null};
 * absent attributes are empty strings.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class UIElement {

    /** Visible label. */
    @JsonProperty("text")
    private final String text;

    /** Screen-reader label, often the only label on icon buttons. */
    @JsonProperty("contentDesc")
    private final String contentDesc;

    @JsonProperty("resourceId")
    private final String resourceId;

    /** Widget class, e.g. {@code android.widget.Button}. */
    @JsonProperty("className")
    private final String className;

    @JsonProperty("package")
    private final String packageName;

    @JsonProperty("bounds")
    private final Bounds bounds;

    @JsonProperty("clickable")
    private final boolean clickable;

    @JsonProperty("scrollable")
    private final boolean scrollable;

    public UIElement(String text, String contentDesc, String resourceId, String className,
                     String packageName, Bounds bounds, boolean clickable, boolean scrollable) {
        this.text        = nullToEmpty(text);
        this.contentDesc = nullToEmpty(contentDesc);
        this.resourceId  = nullToEmpty(resourceId);
        this.className   = nullToEmpty(className);
        this.packageName = nullToEmpty(packageName);
        this.bounds      = bounds != null ? bounds : Bounds.EMPTY;
        this.clickable   = clickable;
        this.scrollable  = scrollable;
    }

    public String  getText()        { return text; }
    public String  getContentDesc() { return contentDesc; }
    public String  getResourceId()  { return resourceId; }
    public String  getClassName()   { return className; }
    public String  getPackageName() { return packageName; }
    public Bounds  getBounds()      { return bounds; }
    public boolean isClickable()    { return clickable; }
    public boolean isScrollable()   { return scrollable; }

    @JsonIgnore
    public Coordinates center() {
        return bounds.center();
    }

    /** Whether the widget class looks like a button of any kind. */
    @JsonIgnore
    public boolean isButtonClass() {
        return className.contains("Button");
    }

    /**
     * Human-readable label: text, then content-description, then class name.
     */
    @JsonIgnore
    public String label() {
        if (!text.isEmpty()) return text;
        if (!contentDesc.isEmpty()) return contentDesc;
        return className;
    }

    private static String nullToEmpty(String s) {
        return s != null ? s : "";
    }

    @Override
    public String toString() {
        return String.format("UIElement{text='%s', desc='%s', class='%s', bounds=%s, clickable=%s}",
                text, contentDesc, className, bounds, clickable);
    }
}
