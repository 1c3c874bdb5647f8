/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.voiceorders.config.VoicePipelineConfig} - order store, transcript hub
 *       and backend clients</li>
 *   <li>{@link com.phillippitts.voiceorders.config.ThreadPoolConfig} - executors for backend calls
 *       and transcript fan-out</li>
 *   <li>{@link com.phillippitts.voiceorders.config.WebSocketConfig} - voice and observer endpoints</li>
 *   <li>{@link com.phillippitts.voiceorders.config.VoiceOrdersMetricsConfig} - session, observer and
 *       backend pool gauges</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - typed {@code @ConfigurationProperties}</li>
 *   <li>{@code config.logging} - Logging infrastructure configuration (MDC filters)</li>
 * </ul>
 */
package com.phillippitts.voiceorders.config;
