package droidtap.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.testng.annotations.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class UIElementTest {

    @Test
    public void nullAttributes_becomeEmptyStrings() {
        UIElement e = new UIElement(null, null, null, null, null, null, false, false);

        assertThat(e.getText()).isEmpty();
        assertThat(e.getContentDesc()).isEmpty();
        assertThat(e.getClassName()).isEmpty();
        assertThat(e.getBounds()).isEqualTo(Bounds.EMPTY);
    }

    @Test
    public void label_prefersTextThenDescriptionThenClass() {
        Bounds b = new Bounds(0, 0, 10, 10);
        assertThat(new UIElement("Play", "Play video", "", "android.widget.Button", "", b, true, false).label())
                .isEqualTo("Play");
        assertThat(new UIElement("", "Play video", "", "android.widget.Button", "", b, true, false).label())
                .isEqualTo("Play video");
        assertThat(new UIElement("", "", "", "android.widget.ImageView", "", b, true, false).label())
                .isEqualTo("android.widget.ImageView");
    }

    @Test
    public void isButtonClass_matchesAnyButtonWidget() {
        Bounds b = new Bounds(0, 0, 10, 10);
        assertThat(new UIElement("", "", "", "android.widget.ImageButton", "", b, false, false).isButtonClass()).isTrue();
        assertThat(new UIElement("", "", "", "android.widget.TextView", "", b, false, false).isButtonClass()).isFalse();
    }

    @Test
    public void json_usesPackageKeyAndOmitsDerivedValues() throws Exception {
        UIElement e = new UIElement("Home", "", "id/home", "android.widget.TextView",
                "com.example", new Bounds(0, 0, 100, 50), true, false);

        JsonNode node = new ObjectMapper().valueToTree(e);

        assertThat(node.path("text").asText()).isEqualTo("Home");
        assertThat(node.path("package").asText()).isEqualTo("com.example");
        assertThat(node.path("bounds").path("right").asInt()).isEqualTo(100);
        assertThat(node.has("contentDesc")).isFalse();
        assertThat(node.has("label")).isFalse();
        assertThat(node.has("buttonClass")).isFalse();
    }
}
