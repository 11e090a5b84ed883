/**
 * Client-side audio: sources, capture, PCM16 encoding and loudness.
 *
 * <p>Wire format is fixed: 16-bit signed little-endian mono PCM at the configured sample rate
 * (16kHz by default). See {@link com.phillippitts.funnel.service.audio.AudioFormat}.
 *
 * @since 1.0
 */
package com.phillippitts.funnel.service.audio;
