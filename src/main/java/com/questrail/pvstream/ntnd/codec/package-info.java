/**
 * NTNDArray Frame Codec
 * =============================================================================
 *
 * <p>This package defines the boundary between the self-describing array
 * structure delivered by the feed ({@code RawFrame}) and the typed image the
 * display side works with ({@code DecodedFrame}).</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   FrameFeed callback
 *        → RawFrame
 *            → FrameDecoder      (layout rules applied here)
 *                → DecodedFrame  (row-major H x W x C)
 *                    → FrameQueue
 * </pre>
 *
 * <h2>Layout Rules</h2>
 * <p>The flat buffer is read in C order with the declared dimensions, then
 * permuted into {@code (height, width, channels)} according to the
 * {@code ColorMode} attribute. All index mechanics live in the {@code impl}
 * package; nothing outside it knows about axis strides.</p>
 */
package com.questrail.pvstream.ntnd.codec;
