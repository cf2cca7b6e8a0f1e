package droidtap.tree;

import droidtap.model.UIElement;

import java.util.List;

/**
 * Source of accessibility snapshots of the current screen.
 */
public interface AccessibilityTree {

    /**
     * Captures the screen's accessibility nodes in document order.
     *
     * @throws TreeCaptureException if the dump is empty or unparseable
     * @throws droidtap.device.DeviceException if the device round trip fails
     */
    List<UIElement> captureTree();

    /**
     * Captures the tree and returns the repeating items of a list or grid,
     * top-to-bottom then left-to-right. Empty when no list is recognisable.
     *
     * @param itemType what the caller is looking for ("video", "post", ...)
     */
    List<UIElement> detectListItems(String itemType);
}
