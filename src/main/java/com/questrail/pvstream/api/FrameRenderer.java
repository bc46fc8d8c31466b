package com.questrail.pvstream.api;

import com.questrail.pvstream.model.DecodedFrame;

import java.util.Optional;

/**
 * FrameRenderer
 * =============================================================================
 * Downstream port owned by the GUI layer.
 *
 * <p>The display pump calls {@link #render(DecodedFrame, ContrastWindow)} on the
 * display thread once per consumed frame. Implementations MUST NOT block (no
 * modal dialogs, no waiting on user input); hand the pixels to the toolkit and
 * return.</p>
 *
 * <p>The frame passed in is owned by the display pump. Renderers may keep a
 * reference to it but must not modify its pixel buffer.</p>
 */
public interface FrameRenderer
{
    /**
     * Draw a frame with the given intensity window.
     *
     * @param frame  fully processed display frame (decimated, transformed, corrected)
     * @param window intensity bounds; may be degenerate, see {@link ContrastWindow#normalize(double)}
     */
    void render(DecodedFrame frame, ContrastWindow window);

    /**
     * Current drawing area, if known. Without one, automatic decimation keeps
     * every pixel.
     */
    default Optional<Viewport> viewport()
    {
        return Optional.empty();
    }
}
