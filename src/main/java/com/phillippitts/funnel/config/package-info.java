/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.funnel.config.ThreadPoolConfig} - pool behind the per-session mailboxes</li>
 *   <li>{@link com.phillippitts.funnel.config.WebSocketConfig} - streaming endpoint registration</li>
 *   <li>{@link com.phillippitts.funnel.config.RelayConfig} - transcription backend client</li>
 *   <li>{@link com.phillippitts.funnel.config.ClientConfig} - recording client, only when
 *       {@code funnel.client.enabled=true}</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - typed {@code funnel.*} and {@code threadpool.*} properties</li>
 *   <li>{@code config.logging} - Logging infrastructure configuration (MDC filters)</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.funnel.config;
