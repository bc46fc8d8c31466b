/**
 * NTNDArray Frame Codec Implementation
 * =============================================================================
 *
 * <pre>
 *   RawFrame
 *        → ColorMode attribute (lenient, defaults to MONO)
 *        → payload / dimension checks
 *        → AxisPermutation.gatherIndices (C-order reshape + transpose)
 *        → DecodedFrame
 * </pre>
 *
 * <p>This layer is strictly:</p>
 * <ul>
 *   <li>pure (no logging, no clocks, no shared state)</li>
 *   <li>transport-agnostic</li>
 *   <li>display-agnostic</li>
 * </ul>
 *
 * <p>Any failure at this layer results in the frame being dropped by the caller.</p>
 */
package com.questrail.pvstream.ntnd.codec.impl;
