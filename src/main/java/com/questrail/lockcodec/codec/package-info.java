/**
 * Lock Codec — Text Transform Layer
 * =============================================================================
 *
 * <p>This package defines the codec contracts: single-lock, batch and
 * multi-lock encoding of text into fixed-width decimal groups.</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   String text
 *        → SingleLockCodec / BatchLockCodec / MultiLockCodec
 *            → lock arithmetic (codec.impl)
 *                → CharsetTable snapshot
 * </pre>
 *
 * <h2>Important Boundaries</h2>
 * <ul>
 *   <li>Codecs never load charsets; they read whatever table the
 *       {@link com.questrail.lockcodec.charset.CharsetTableHolder} holds.</li>
 *   <li>Codecs never log directly; outcomes go to a
 *       {@link com.questrail.lockcodec.observability.CodecObservabilitySink}.</li>
 *   <li>The transform is an additive offset over a small integer alphabet. It
 *       is reversible by anyone holding the charset and is not encryption.</li>
 * </ul>
 */
package com.questrail.lockcodec.codec;
